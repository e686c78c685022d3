package com.herzen.oracle.sandbox;

import java.util.List;

public interface RandomSource {
    /** Uniform integer in {@code [min, max]}, both inclusive. */
    long nextInt(long min, long max);

    /** Uniform double in {@code [min, max]}. */
    double nextDouble(double min, double max);

    <T> T choose(List<T> options);
}

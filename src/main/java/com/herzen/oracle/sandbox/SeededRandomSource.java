package com.herzen.oracle.sandbox;

import java.util.List;
import java.util.Random;

public class SeededRandomSource implements RandomSource {
    private final Random random;

    public SeededRandomSource() {
        this.random = new Random();
    }

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public long nextInt(long min, long max) {
        if (min > max) {
            throw new EvaluationException("empty range for randint(" + min + ", " + max + ")");
        }
        if (min == max) return min;
        long span = max - min + 1;
        if (span <= 0) {
            // range wider than Long.MAX_VALUE
            long value;
            do {
                value = random.nextLong();
            } while (value < min || value > max);
            return value;
        }
        return min + random.nextLong(span);
    }

    @Override
    public double nextDouble(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    @Override
    public <T> T choose(List<T> options) {
        if (options == null || options.isEmpty()) {
            throw new EvaluationException("cannot choose from an empty sequence");
        }
        return options.get(random.nextInt(options.size()));
    }
}

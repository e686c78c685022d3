package com.herzen.oracle.repository;

import com.herzen.oracle.pattern.PatternModels.PatternTemplate;

import java.util.List;

public interface PatternRepository {
    /** Every readable pattern; unreadable entries are skipped. */
    List<PatternTemplate> loadAll();

    void save(PatternTemplate pattern);

    /** Moves the pattern out of the active set. Returns false when it is not stored. */
    boolean archive(String patternId);
}

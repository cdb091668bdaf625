package com.instorm.scorecard.storage;

import java.util.Optional;

/**
 * String key-value storage that outlives the process.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * Stores the value in a single write: readers see either the old value or the new one.
     */
    void put(String key, String value);

    void remove(String key);
}

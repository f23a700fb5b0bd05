package com.ryuqq.atomicstore.adapter.inmemory.store;

/**
 * A queued batch mutation (immutable record).
 *
 * @param type mutation kind
 * @param key target key
 * @param value value to write, null for {@link Type#REMOVE}
 * @param <V> value type
 */
record BatchJob<V>(BatchJob.Type type, String key, V value) {

    enum Type {
        INSERT,
        INSERT_UNIQUE,
        REMOVE
    }

    static <V> BatchJob<V> insert(String key, V value) {
        return new BatchJob<>(Type.INSERT, key, value);
    }

    static <V> BatchJob<V> insertUnique(String key, V value) {
        return new BatchJob<>(Type.INSERT_UNIQUE, key, value);
    }

    static <V> BatchJob<V> remove(String key) {
        return new BatchJob<>(Type.REMOVE, key, null);
    }
}

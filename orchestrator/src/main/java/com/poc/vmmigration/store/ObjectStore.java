package com.poc.vmmigration.store;

import java.util.List;

/**
 * Key-based store for one type of object.
 * Implementations hand out fresh instances, so callers never share
 * mutable state with the store or with each other.
 *
 * @param <T> stored object type
 */
public interface ObjectStore<T> {

    /**
     * @throws com.poc.vmmigration.exception.AlreadyExistsException if the key is taken
     */
    T create(String key, T object);

    /**
     * @throws com.poc.vmmigration.exception.NotFoundException if nothing is stored under the key
     */
    T read(String key);

    /**
     * @throws com.poc.vmmigration.exception.NotFoundException if nothing is stored under the key
     */
    T update(String key, T object);

    /**
     * @throws com.poc.vmmigration.exception.NotFoundException if nothing is stored under the key
     */
    void delete(String key);

    /**
     * All stored objects, ordered by key.
     */
    List<T> listAll();
}

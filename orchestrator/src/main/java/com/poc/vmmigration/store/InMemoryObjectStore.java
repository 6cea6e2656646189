package com.poc.vmmigration.store;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Store backed by a concurrent map of JSON documents.
 * Used in tests and when no durable storage is needed.
 */
public class InMemoryObjectStore<T> extends AbstractJsonObjectStore<T> {

    private final ConcurrentNavigableMap<String, String> documents = new ConcurrentSkipListMap<>();

    public InMemoryObjectStore(ObjectMapper objectMapper, Class<T> type, String typeName) {
        super(objectMapper, type, typeName);
    }

    @Override
    public T create(String key, T object) {
        validateKey(key);
        if (documents.putIfAbsent(key, serialize(key, object)) != null) {
            throw alreadyExists(key);
        }
        return object;
    }

    @Override
    public T read(String key) {
        validateKey(key);
        String json = documents.get(key);
        if (json == null) {
            throw notFound(key);
        }
        return deserialize(key, json);
    }

    @Override
    public T update(String key, T object) {
        validateKey(key);
        if (documents.replace(key, serialize(key, object)) == null) {
            throw notFound(key);
        }
        return object;
    }

    @Override
    public void delete(String key) {
        validateKey(key);
        if (documents.remove(key) == null) {
            throw notFound(key);
        }
    }

    @Override
    public List<T> listAll() {
        return documents.entrySet().stream()
                .map(entry -> deserialize(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }
}

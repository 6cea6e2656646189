package com.poc.vmmigration.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.vmmigration.exception.AlreadyExistsException;
import com.poc.vmmigration.exception.NotFoundException;
import com.poc.vmmigration.exception.StorageException;
import com.poc.vmmigration.util.StoreKeyValidator;

/**
 * Base for stores that keep objects as JSON documents.
 */
public abstract class AbstractJsonObjectStore<T> implements ObjectStore<T> {

    protected final ObjectMapper objectMapper;
    protected final Class<T> type;
    protected final String typeName;

    protected AbstractJsonObjectStore(ObjectMapper objectMapper, Class<T> type, String typeName) {
        this.objectMapper = objectMapper;
        this.type = type;
        this.typeName = typeName;
    }

    protected String serialize(String key, T object) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + typeName + " " + key, e);
        }
    }

    protected T deserialize(String key, String json) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize " + typeName + " " + key, e);
        }
    }

    protected void validateKey(String key) {
        StoreKeyValidator.validateKey(key);
    }

    protected AlreadyExistsException alreadyExists(String key) {
        return new AlreadyExistsException(capitalizedTypeName() + " " + key + " already exists");
    }

    protected NotFoundException notFound(String key) {
        return new NotFoundException(capitalizedTypeName() + " " + key + " not found");
    }

    private String capitalizedTypeName() {
        return Character.toUpperCase(typeName.charAt(0)) + typeName.substring(1);
    }
}

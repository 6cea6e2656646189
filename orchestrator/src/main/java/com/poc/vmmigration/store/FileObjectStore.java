package com.poc.vmmigration.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.vmmigration.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Store that keeps one JSON file per object, named {@code <type>_<key>.json}.
 * Writes go through a temporary file and an atomic move.
 */
@Slf4j
public class FileObjectStore<T> extends AbstractJsonObjectStore<T> {

    private final Path directory;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FileObjectStore(Path directory, ObjectMapper objectMapper, Class<T> type, String typeName) {
        super(objectMapper, type, typeName);
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + directory, e);
        }
        log.info("File store for {} initialized at {}", typeName, directory.toAbsolutePath());
    }

    @Override
    public T create(String key, T object) {
        Path file = fileFor(key);
        String json = serialize(key, object);
        lock.writeLock().lock();
        try {
            if (Files.exists(file)) {
                throw alreadyExists(key);
            }
            write(file, json);
            log.debug("Created {} {}", typeName, key);
            return object;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public T read(String key) {
        Path file = fileFor(key);
        lock.readLock().lock();
        try {
            if (!Files.exists(file)) {
                throw notFound(key);
            }
            return deserialize(key, readFile(file));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public T update(String key, T object) {
        Path file = fileFor(key);
        String json = serialize(key, object);
        lock.writeLock().lock();
        try {
            if (!Files.exists(file)) {
                throw notFound(key);
            }
            write(file, json);
            log.debug("Updated {} {}", typeName, key);
            return object;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String key) {
        Path file = fileFor(key);
        lock.writeLock().lock();
        try {
            if (!Files.deleteIfExists(file)) {
                throw notFound(key);
            }
            log.debug("Deleted {} {}", typeName, key);
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + typeName + " " + key, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<T> listAll() {
        lock.readLock().lock();
        try {
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, typeName + "_*.json")) {
                stream.forEach(files::add);
            }
            files.sort(Comparator.comparing(path -> path.getFileName().toString()));

            List<T> objects = new ArrayList<>(files.size());
            for (Path file : files) {
                objects.add(deserialize(file.getFileName().toString(), readFile(file)));
            }
            return objects;
        } catch (IOException e) {
            throw new StorageException("Failed to list " + typeName + " objects in " + directory, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Path fileFor(String key) {
        validateKey(key);
        return directory.resolve(typeName + "_" + key + ".json");
    }

    private String readFile(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file, e);
        }
    }

    private void write(Path file, String json) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + file, e);
        }
    }
}

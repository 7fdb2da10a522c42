package com.variance.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.variance.model.Identifiable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Repository keeping one JSON file per entity.
 *
 * Directory structure: {root}/{StoreTypeName}/{ElementTypeName}/{id}.json
 *
 * The directory is created on construction. Inserting an existing ID overwrites
 * its file; nothing is ever deleted. Writes are not atomic and there is no locking.
 *
 * @param <T> Entity type that implements Identifiable
 */
public class JsonFileRepository<T extends Identifiable> implements Repository<T> {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final Class<T> entityClass;
    protected final Path directory;
    protected final ObjectMapper mapper;
    private final String suffix;

    public JsonFileRepository(Class<T> entityClass) {
        this(entityClass, StoreConfig.fromSystemProperties());
    }

    public JsonFileRepository(Class<T> entityClass, StoreConfig config) {
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
        this.suffix = "." + config.extension();
        this.directory = config.rootDirectory()
            .resolve(getClass().getSimpleName())
            .resolve(entityClass.getSimpleName())
            .toAbsolutePath()
            .normalize();
        this.mapper = createMapper();

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to create store directory " + directory, e);
        }
        log.debug("Opened {} store at {}", entityClass.getSimpleName(), directory);
    }

    /**
     * Create and configure the ObjectMapper.
     * Subclasses can override to customize serialization.
     */
    protected ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public void insert(T item) {
        Objects.requireNonNull(item, "item");
        Path file = resolve(item.getId());
        try {
            Files.write(file, mapper.writeValueAsBytes(item));
            log.debug("Saved {} {} to {}", entityClass.getSimpleName(), item.getId(), file);
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to write " + file, e);
        }
    }

    @Override
    public T get(String id) {
        Path file = resolve(id);
        if (Files.isDirectory(file)) {
            throw new EntityNotFoundException(id, file);
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new EntityNotFoundException(id, file);
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to read " + file, e);
        }
        return parse(file, content);
    }

    @Override
    public Stream<T> getAll() {
        Stream<Path> files;
        try {
            files = Files.list(directory);
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to list " + directory, e);
        }
        return files
            .filter(this::isRecordFile)
            .map(this::load);
    }

    @Override
    public boolean exists(String id) {
        return Files.isRegularFile(resolve(id));
    }

    /**
     * Get the directory holding this store's records.
     */
    public Path getDirectory() {
        return directory;
    }

    /**
     * Get the record file path for an ID. The file need not exist.
     *
     * @throws IllegalArgumentException if the ID is empty or would leave the store directory
     */
    public Path getFile(String id) {
        return resolve(id);
    }

    private Path resolve(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Entity id must be non-empty");
        }
        if (id.equals(".") || id.equals("..")) {
            throw new IllegalArgumentException("Entity id '" + id + "' is not a plain file name");
        }
        String fileName = id + suffix;
        Path name;
        try {
            name = directory.getFileSystem().getPath(fileName);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Entity id '" + id + "' is not a valid file name", e);
        }
        // ids map 1:1 to file names, no separators or relative segments
        if (name.getNameCount() != 1 || !fileName.equals(name.getFileName().toString())) {
            throw new IllegalArgumentException("Entity id '" + id + "' is not a plain file name");
        }
        Path file = directory.resolve(name);
        if (!directory.equals(file.getParent())) {
            throw new IllegalArgumentException("Entity id '" + id + "' is not a plain file name");
        }
        return file;
    }

    private boolean isRecordFile(Path file) {
        return Files.isRegularFile(file) && file.getFileName().toString().endsWith(suffix);
    }

    private T load(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            log.error("Failed to read {} from {}: {}", entityClass.getSimpleName(), file, e.getMessage());
            throw new RepositoryIoException("Failed to read " + file, e);
        }
        try {
            return parse(file, content);
        } catch (EntityDeserializationException e) {
            log.error("Failed to load {} from {}: {}", entityClass.getSimpleName(), file, e.getMessage());
            throw e;
        }
    }

    private T parse(Path file, byte[] content) {
        T entity;
        try {
            entity = mapper.readValue(content, entityClass);
        } catch (JsonProcessingException e) {
            throw new EntityDeserializationException(file, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RepositoryIoException("Failed to decode " + file, e);
        }
        if (entity == null) {
            throw new EntityDeserializationException(file, "content is null", null);
        }
        return entity;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "<" + entityClass.getSimpleName() + ">(" + directory + ")";
    }
}

package com.variance.io;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where stores keep their files.
 *
 * @param rootDirectory base directory, each store lives in {@code <root>/<StoreType>/<ElementType>}
 * @param extension     record file extension without the dot
 */
public record StoreConfig(Path rootDirectory, String extension) {

    public static final String ROOT_PROPERTY = "variance.data.dir";
    public static final Path DEFAULT_ROOT = Path.of("data");
    public static final String DEFAULT_EXTENSION = "json";

    public StoreConfig {
        Objects.requireNonNull(rootDirectory, "rootDirectory");
        if (extension == null || extension.isBlank() || extension.contains(".")) {
            throw new IllegalArgumentException("Invalid record extension: " + extension);
        }
    }

    public static StoreConfig defaults() {
        return new StoreConfig(DEFAULT_ROOT, DEFAULT_EXTENSION);
    }

    /**
     * Defaults, with the root directory taken from the {@value #ROOT_PROPERTY}
     * system property when it is set.
     */
    public static StoreConfig fromSystemProperties() {
        String root = System.getProperty(ROOT_PROPERTY);
        if (root == null || root.isBlank()) {
            return defaults();
        }
        return new StoreConfig(Path.of(root.trim()), DEFAULT_EXTENSION);
    }

    public StoreConfig withRootDirectory(Path rootDirectory) {
        return new StoreConfig(rootDirectory, extension);
    }
}

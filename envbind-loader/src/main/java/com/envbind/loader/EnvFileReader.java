package com.envbind.loader;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@code KEY=value} files into an overlay map.
 *
 * <p>
 * Parsing is delegated to dotenv-java. Only entries declared in the file are
 * returned; the process environment is neither read nor modified. Relative
 * paths are resolved against the base directory given at construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnvFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(EnvFileReader.class);

    private final Path baseDirectory;

    /**
     * @param baseDirectory directory relative paths are resolved against;
     *                      must not be {@code null}
     */
    public EnvFileReader(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "Base directory must not be null")
                .toAbsolutePath();
    }

    /**
     * Read one file.
     *
     * @param path file path; must not be {@code null}
     * @return unmodifiable map of the file's entries; iteration order is
     *         unspecified
     * @throws EnvFileException if the file does not exist, cannot be parsed
     *                          or declares the same key twice
     */
    public Map<String, String> read(Path path) throws EnvFileException {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new EnvFileException("env file not found: " + file);
        }

        Map<String, String> entries = new LinkedHashMap<>();
        try {
            Dotenv dotenv = Dotenv.configure()
                    .directory(file.getParent().toString())
                    .filename(file.getFileName().toString())
                    .load();
            for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
                entries.put(entry.getKey(), entry.getValue());
            }
        } catch (RuntimeException e) {
            // dotenv-java reports repeated keys as IllegalStateException, not DotenvException
            throw new EnvFileException("cannot load env file " + file + ": " + e.getMessage(), e);
        }
        LOG.info("Loaded {} variable(s) from {}", entries.size(), file);
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Read several files in order; a key in a later file replaces the same
     * key from an earlier one.
     *
     * @param paths file paths; must not be {@code null}
     * @return unmodifiable merged map
     * @throws EnvFileException if any file fails, wrapping the first failure
     */
    public Map<String, String> readAll(List<Path> paths) throws EnvFileException {
        Objects.requireNonNull(paths, "Paths must not be null");
        Map<String, String> merged = new LinkedHashMap<>();
        for (Path path : paths) {
            try {
                merged.putAll(read(path));
            } catch (EnvFileException e) {
                throw new EnvFileException("error loading .env files: " + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Read a file if it exists and parses; any failure is logged at debug and
     * reported as empty.
     *
     * @param path file path; must not be {@code null}
     * @return the entries, or empty if the file could not be used
     */
    public Optional<Map<String, String>> tryRead(Path path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            LOG.trace("No env file at {}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(read(file));
        } catch (EnvFileException e) {
            LOG.debug("Ignoring unusable env file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param path file path, absolute or relative to the base directory
     * @return absolute, normalized path
     */
    public Path resolve(Path path) {
        Objects.requireNonNull(path, "Env file path must not be null");
        return baseDirectory.resolve(path).normalize();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }
}

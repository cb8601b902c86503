package com.envbind.loader;

import com.envbind.core.bind.EnvLookup;
import com.envbind.core.bind.FieldBinder;
import com.envbind.core.exception.EnvBindException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads {@code .env} files and binds configuration objects.
 *
 * <h3>Precedence</h3>
 * <ol>
 * <li>Process environment</li>
 * <li>Values read from {@code .env} files</li>
 * <li>Defaults declared in {@code @Env} tags</li>
 * </ol>
 * <p>
 * File values never modify the process environment; they are layered
 * underneath it for the duration of one call. With
 * {@link LoadOptions#isUseSystem()} set to {@code false} neither of the first
 * two layers is consulted and only tag defaults apply.
 * </p>
 *
 * <h3>Calling conventions</h3>
 * <ul>
 * <li>{@link #load(Object)} - best-effort {@code .env} in the base
 * directory</li>
 * <li>{@link #loadFromEnv(Object)} - process environment only</li>
 * <li>{@link #loadFromFile(Object, Path)} and
 * {@link #loadFromFiles(Object, Path...)} - explicit files, failures
 * propagate</li>
 * <li>{@link #findAndLoad(Object)} - first file found among
 * {@link #SEARCH_PATHS} and {@value #ENV_FILE_VARIABLE}</li>
 * <li>{@link #mustLoad(Object)} - fail fast with an unchecked exception</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class EnvLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EnvLoader.class);

    /** Environment variable naming an extra file for {@link #findAndLoad(Object)}. */
    public static final String ENV_FILE_VARIABLE = "ENV_FILE";

    /** File tried by {@link #load(Object)} when no files are requested. */
    public static final Path DEFAULT_ENV_FILE = Path.of(".env");

    /** Locations searched by {@link #findAndLoad(Object)}, in order. */
    public static final List<String> SEARCH_PATHS = List.of(
            ".env",
            "./.env",
            "../.env",
            "../../.env",
            "./config/.env",
            "./env/.env");

    private final EnvLookup systemEnvironment;
    private final EnvFileReader fileReader;

    /**
     * @param systemEnvironment the process environment, or a stand-in for it;
     *                          must not be {@code null}
     * @param baseDirectory     directory relative file paths resolve against;
     *                          must not be {@code null}
     */
    public EnvLoader(EnvLookup systemEnvironment, Path baseDirectory) {
        this.systemEnvironment = Objects.requireNonNull(systemEnvironment, "System environment must not be null");
        this.fileReader = new EnvFileReader(baseDirectory);
    }

    /**
     * @return loader over {@link System#getenv(String)} and the working
     *         directory
     */
    public static EnvLoader create() {
        return new EnvLoader(EnvLookup.system(), Path.of(""));
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Bind {@code config} from the process environment and, if present, a
     * {@code .env} file in the base directory. A missing or unreadable
     * default file is ignored.
     *
     * @param config the configuration object
     * @param <T>    configuration type
     * @return {@code config}
     * @throws EnvBindException if binding fails
     */
    public <T> T load(T config) throws EnvBindException {
        return load(config, LoadOptions.defaults());
    }

    /**
     * Instantiate {@code type} and bind it as {@link #load(Object)} does.
     *
     * @param type configuration class with a no-arg constructor
     * @param <T>  configuration type
     * @return the bound instance
     * @throws EnvBindException if instantiation or binding fails
     */
    public <T> T loadNew(Class<T> type) throws EnvBindException {
        Map<String, String> overlay = readDefaultFile();
        return binder(overlay, true).bindNew(type);
    }

    /**
     * Bind {@code config} with explicit options. Requested files are always
     * read, so a missing file fails even when {@code useSystem} is
     * {@code false}; their values are only bound when it is {@code true}.
     *
     * @param config  the configuration object
     * @param options files and environment switch; must not be {@code null}
     * @param <T>     configuration type
     * @return {@code config}
     * @throws EnvFileException if a requested file cannot be loaded
     * @throws EnvBindException if binding fails
     */
    public <T> T load(T config, LoadOptions options) throws EnvBindException {
        Objects.requireNonNull(options, "LoadOptions must not be null");
        Map<String, String> overlay = options.getEnvFiles().isEmpty()
                ? readDefaultFile()
                : fileReader.readAll(options.getEnvFiles());
        return binder(overlay, options.isUseSystem()).bind(config);
    }

    /**
     * Bind {@code config} from the process environment only; no file is
     * read.
     *
     * @param config the configuration object
     * @param <T>    configuration type
     * @return {@code config}
     * @throws EnvBindException if binding fails
     */
    public <T> T loadFromEnv(T config) throws EnvBindException {
        return new FieldBinder(systemEnvironment).bind(config);
    }

    /**
     * Bind {@code config} after reading one file.
     *
     * @param config  the configuration object
     * @param envFile file to read; must exist
     * @param <T>     configuration type
     * @return {@code config}
     * @throws EnvFileException if the file cannot be loaded
     * @throws EnvBindException if binding fails
     */
    public <T> T loadFromFile(T config, Path envFile) throws EnvBindException {
        Objects.requireNonNull(envFile, "Env file path must not be null");
        Map<String, String> overlay;
        try {
            overlay = fileReader.read(envFile);
        } catch (EnvFileException e) {
            throw new EnvFileException("error loading .env file: " + e.getMessage(), e);
        }
        return binder(overlay, true).bind(config);
    }

    /**
     * Bind {@code config} after reading several files; later files override
     * earlier ones. With no paths the {@code .env} file in the base directory
     * is read, and it must exist.
     *
     * @param config   the configuration object
     * @param envFiles files to read, in order; each must exist
     * @param <T>      configuration type
     * @return {@code config}
     * @throws EnvFileException if any file cannot be loaded
     * @throws EnvBindException if binding fails
     */
    public <T> T loadFromFiles(T config, Path... envFiles) throws EnvBindException {
        Objects.requireNonNull(envFiles, "Env file paths must not be null");
        List<Path> paths = envFiles.length == 0 ? List.of(DEFAULT_ENV_FILE) : Arrays.asList(envFiles);
        Map<String, String> overlay = fileReader.readAll(paths);
        return binder(overlay, true).bind(config);
    }

    /**
     * Bind {@code config} after probing {@link #SEARCH_PATHS} and then the
     * path in {@value #ENV_FILE_VARIABLE}. The first file that exists and
     * loads is used; if none does, binding proceeds from the process
     * environment alone.
     *
     * @param config the configuration object
     * @param <T>    configuration type
     * @return {@code config}
     * @throws EnvBindException if binding fails
     */
    public <T> T findAndLoad(T config) throws EnvBindException {
        Map<String, String> overlay = Collections.emptyMap();
        for (Path candidate : searchPaths()) {
            Optional<Map<String, String>> entries = fileReader.tryRead(candidate);
            if (entries.isPresent()) {
                LOG.info("Using env file {}", fileReader.resolve(candidate));
                overlay = entries.get();
                break;
            }
        }
        return binder(overlay, true).bind(config);
    }

    /**
     * {@link #load(Object)}, failing fast: any binding failure becomes an
     * {@link IllegalStateException}. Meant for application start-up, where a
     * broken configuration should stop the process.
     *
     * @param config the configuration object
     * @param <T>    configuration type
     * @return {@code config}
     * @throws IllegalStateException if loading or binding fails
     */
    public <T> T mustLoad(T config) {
        try {
            return load(config);
        } catch (EnvBindException e) {
            throw new IllegalStateException("Configuration could not be loaded: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    List<Path> searchPaths() {
        List<Path> paths = new ArrayList<>();
        for (String candidate : SEARCH_PATHS) {
            paths.add(Path.of(candidate));
        }
        String override = systemEnvironment.lookup(ENV_FILE_VARIABLE);
        if (override != null && !override.isBlank()) {
            paths.add(Path.of(override));
        }
        return paths;
    }

    private Map<String, String> readDefaultFile() {
        return fileReader.tryRead(DEFAULT_ENV_FILE).orElse(Collections.emptyMap());
    }

    private FieldBinder binder(Map<String, String> overlay, boolean useSystem) {
        if (!useSystem) {
            LOG.debug("Environment lookup disabled; binding tag defaults only");
            return FieldBinder.defaultsOnly();
        }
        return new FieldBinder(systemEnvironment.orElse(EnvLookup.of(overlay)));
    }
}

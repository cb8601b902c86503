package com.envbind.loader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Options for {@link EnvLoader#load(Object, LoadOptions)}.
 *
 * <ul>
 * <li>{@code envFiles} - files to read, in order; later files win. When
 * empty, a {@code .env} in the base directory is tried on a best-effort
 * basis.</li>
 * <li>{@code useSystem} - whether environment values are bound at all
 * (default {@code true}). When {@code false} only tag defaults apply;
 * requested files are still read and must exist.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class LoadOptions {

    private static final LoadOptions DEFAULTS = builder().build();

    private final List<Path> envFiles;
    private final boolean useSystem;

    private LoadOptions(Builder b) {
        this.envFiles = List.copyOf(b.envFiles);
        this.useSystem = b.useSystem;
    }

    /**
     * @return no files, process environment consulted
     */
    public static LoadOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return unmodifiable list of files to read
     */
    public List<Path> getEnvFiles() {
        return envFiles;
    }

    public boolean isUseSystem() {
        return useSystem;
    }

    @Override
    public String toString() {
        return "LoadOptions{" +
                "envFiles=" + envFiles +
                ", useSystem=" + useSystem +
                '}';
    }

    /**
     * Fluent builder for {@link LoadOptions}.
     */
    public static class Builder {
        private final List<Path> envFiles = new ArrayList<>();
        private boolean useSystem = true;

        public Builder envFile(Path v) {
            this.envFiles.add(v);
            return this;
        }

        public Builder envFile(String v) {
            Objects.requireNonNull(v, "envFile must not be null");
            return envFile(Path.of(v));
        }

        public Builder envFiles(List<Path> v) {
            Objects.requireNonNull(v, "envFiles must not be null");
            v.forEach(this::envFile);
            return this;
        }

        public Builder useSystem(boolean v) {
            this.useSystem = v;
            return this;
        }

        /**
         * Build and validate the options.
         *
         * @return validated {@link LoadOptions}
         * @throws IllegalArgumentException if a file path is null or blank
         */
        public LoadOptions build() {
            for (int i = 0; i < envFiles.size(); i++) {
                Path path = envFiles.get(i);
                if (path == null || path.toString().isBlank()) {
                    throw new IllegalArgumentException("envFiles[" + i + "] must not be null or blank");
                }
            }
            return new LoadOptions(this);
        }
    }
}

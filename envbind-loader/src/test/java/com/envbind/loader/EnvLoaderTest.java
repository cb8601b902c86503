package com.envbind.loader;

import com.envbind.core.annotation.Env;
import com.envbind.core.bind.EnvLookup;
import com.envbind.core.exception.MissingRequiredException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EnvLoader}.
 */
class EnvLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should bind from the system environment when there is no .env file")
    void shouldLoadWithoutFile() throws Exception {
        AppConfig config = loader(Map.of("DB_PASSWORD", "sys")).load(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("sys");
        assertThat(config.appName).isEqualTo("envbind");
        assertThat(config.workers).isEqualTo(2);
        assertThat(config.allowedHosts).containsExactly("localhost");
        assertThat(config.requestTimeout).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Should pick up a .env file in the base directory")
    void shouldLoadDefaultFile() throws Exception {
        write(".env", "DB_PASSWORD=from_file\n", "WORKERS=8\n");

        AppConfig config = loader(Map.of()).load(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("from_file");
        assertThat(config.workers).isEqualTo(8);
    }

    @Test
    @DisplayName("Should let the system environment win over file values")
    void shouldPreferSystemOverFile() throws Exception {
        write(".env", "DB_PASSWORD=from_file\n", "WORKERS=8\n");

        AppConfig config = loader(Map.of("WORKERS", "16")).load(new AppConfig());

        assertThat(config.workers).isEqualTo(16);
        assertThat(config.dbPassword).isEqualTo("from_file");
    }

    @Test
    @DisplayName("Should fall back to the file when the system value is empty")
    void shouldFallBackToFileForEmptySystemValue() throws Exception {
        write(".env", "DB_PASSWORD=from_file\n");

        AppConfig config = loader(Map.of("DB_PASSWORD", "")).load(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("from_file");
    }

    @Test
    @DisplayName("Should ignore a default .env file that repeats a key")
    void shouldIgnoreRepeatedKeyInDefaultFile() throws Exception {
        write(".env", "DB_PASSWORD=a\n", "DB_PASSWORD=b\n");

        AppConfig config = loader(Map.of("DB_PASSWORD", "sys")).load(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("sys");
    }

    @Test
    @DisplayName("Should fail with a checked exception when a named file repeats a key")
    void shouldFailForRepeatedKeyInNamedFile() throws Exception {
        write("twice.env", "DB_PASSWORD=a\n", "DB_PASSWORD=b\n");

        assertThatThrownBy(() -> loader(Map.of("DB_PASSWORD", "sys"))
                .loadFromFile(new AppConfig(), Path.of("twice.env")))
                .isInstanceOf(EnvFileException.class)
                .hasMessageStartingWith("error loading .env file:");
    }

    @Test
    @DisplayName("Should skip a candidate that repeats a key when searching")
    void shouldSkipRepeatedKeyCandidate() throws Exception {
        Path base = Files.createDirectories(dir.resolve("work/app/config")).getParent();
        write("work/app/.env", "DB_PASSWORD=a\n", "DB_PASSWORD=b\n");
        write("work/app/config/.env", "DB_PASSWORD=config\n");

        AppConfig config = new EnvLoader(EnvLookup.of(Map.of()), base).findAndLoad(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("config");
    }

    @Test
    @DisplayName("Should ignore a malformed default .env file")
    void shouldIgnoreMalformedDefaultFile() throws Exception {
        write(".env", "not an entry\n");

        AppConfig config = loader(Map.of("DB_PASSWORD", "sys")).load(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("sys");
    }

    @Test
    @DisplayName("Should not read any file in environment-only mode")
    void shouldIgnoreFilesInEnvOnlyMode() throws Exception {
        write(".env", "DB_PASSWORD=from_file\n", "APP_NAME=from_file\n");

        AppConfig config = loader(Map.of("DB_PASSWORD", "sys")).loadFromEnv(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("sys");
        assertThat(config.appName).isEqualTo("envbind");
    }

    @Test
    @DisplayName("Should load one named file")
    void shouldLoadFromFile() throws Exception {
        write("service.env", "DB_PASSWORD=named\n", "ALLOWED_HOSTS=a, b ,c\n");

        AppConfig config = loader(Map.of()).loadFromFile(new AppConfig(), Path.of("service.env"));

        assertThat(config.dbPassword).isEqualTo("named");
        assertThat(config.allowedHosts).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Should fail when a named file is missing")
    void shouldFailForMissingNamedFile() {
        assertThatThrownBy(() -> loader(Map.of("DB_PASSWORD", "sys"))
                .loadFromFile(new AppConfig(), Path.of("missing.env")))
                .isInstanceOf(EnvFileException.class)
                .hasMessageStartingWith("error loading .env file:");
    }

    @Test
    @DisplayName("Should let later files override earlier ones")
    void shouldLoadFromFilesInOrder() throws Exception {
        write("base.env", "DB_PASSWORD=base\n", "APP_NAME=base-app\n");
        write("local.env", "DB_PASSWORD=local\n");

        AppConfig config = loader(Map.of())
                .loadFromFiles(new AppConfig(), Path.of("base.env"), Path.of("local.env"));

        assertThat(config.dbPassword).isEqualTo("local");
        assertThat(config.appName).isEqualTo("base-app");
    }

    @Test
    @DisplayName("Should read the base .env file when no files are named")
    void shouldLoadFromFilesDefault() throws Exception {
        write(".env", "DB_PASSWORD=default_file\n");

        AppConfig config = loader(Map.of()).loadFromFiles(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("default_file");
    }

    @Test
    @DisplayName("Should fail when no files are named and the base .env is missing")
    void shouldFailForMissingDefaultInLoadFromFiles() {
        assertThatThrownBy(() -> loader(Map.of("DB_PASSWORD", "sys")).loadFromFiles(new AppConfig()))
                .isInstanceOf(EnvFileException.class)
                .hasMessageContaining("env file not found");
    }

    @Test
    @DisplayName("Should fail when any of several files is missing")
    void shouldFailForMissingFileInList() throws Exception {
        write("base.env", "DB_PASSWORD=base\n");

        assertThatThrownBy(() -> loader(Map.of())
                .loadFromFiles(new AppConfig(), Path.of("base.env"), Path.of("missing.env")))
                .isInstanceOf(EnvFileException.class)
                .hasMessageContaining("error loading .env files");
    }

    @Test
    @DisplayName("Should honour explicit option files")
    void shouldLoadWithOptions() throws Exception {
        write("app.env", "DB_PASSWORD=file\n", "WORKERS=9\n");

        AppConfig config = loader(Map.of("WORKERS", "32")).load(new AppConfig(),
                LoadOptions.builder().envFile("app.env").build());

        assertThat(config.dbPassword).isEqualTo("file");
        assertThat(config.workers).isEqualTo(32);
    }

    @Test
    @DisplayName("Should apply only tag defaults when environment lookup is disabled")
    void shouldUseDefaultsOnlyWithoutSystem() throws Exception {
        write("app.env", "WORKERS=9\n", "APP_NAME=from_file\n");
        LoadOptions options = LoadOptions.builder().envFile("app.env").useSystem(false).build();

        DefaultsConfig config = loader(Map.of("WORKERS", "32")).load(new DefaultsConfig(), options);

        assertThat(config.workers).isEqualTo(2);
        assertThat(config.appName).isEqualTo("envbind");
    }

    @Test
    @DisplayName("Should report required fields when environment lookup is disabled")
    void shouldReportRequiredWithoutSystem() throws Exception {
        write("app.env", "DB_PASSWORD=file\n");
        LoadOptions options = LoadOptions.builder().envFile("app.env").useSystem(false).build();

        assertThatThrownBy(() -> loader(Map.of("DB_PASSWORD", "sys")).load(new AppConfig(), options))
                .isInstanceOf(MissingRequiredException.class)
                .hasMessageContaining("DB_PASSWORD is required");
    }

    @Test
    @DisplayName("Should still read option files when environment lookup is disabled")
    void shouldFailForMissingOptionFileWithoutSystem() {
        LoadOptions options = LoadOptions.builder().envFile("missing.env").useSystem(false).build();

        assertThatThrownBy(() -> loader(Map.of()).load(new DefaultsConfig(), options))
                .isInstanceOf(EnvFileException.class);
    }

    @Test
    @DisplayName("Should fail when an option file is missing")
    void shouldFailForMissingOptionFile() {
        LoadOptions options = LoadOptions.builder().envFile("missing.env").build();

        assertThatThrownBy(() -> loader(Map.of("DB_PASSWORD", "sys")).load(new AppConfig(), options))
                .isInstanceOf(EnvFileException.class);
    }

    @Test
    @DisplayName("Should find a file in the config directory")
    void shouldFindConfigDirectoryFile() throws Exception {
        Path base = Files.createDirectories(dir.resolve("work/app/config")).getParent();
        write("work/app/config/.env", "DB_PASSWORD=found\n");

        AppConfig config = new EnvLoader(EnvLookup.of(Map.of()), base).findAndLoad(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("found");
    }

    @Test
    @DisplayName("Should prefer a closer file when several exist")
    void shouldPreferFirstSearchPath() throws Exception {
        Path nested = Files.createDirectories(dir.resolve("app/service"));
        write(".env", "DB_PASSWORD=grandparent\n");
        write("app/.env", "DB_PASSWORD=parent\n");

        AppConfig config = new EnvLoader(EnvLookup.of(Map.of()), nested).findAndLoad(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("parent");
    }

    @Test
    @DisplayName("Should use the file named by ENV_FILE")
    void shouldUseEnvFileVariable() throws Exception {
        Path external = Files.createDirectories(dir.resolve("secrets")).resolve("prod.env");
        Files.writeString(external, "DB_PASSWORD=from_env_file\n");
        Path base = Files.createDirectories(dir.resolve("a/b/c"));

        AppConfig config = new EnvLoader(EnvLookup.of(Map.of("ENV_FILE", external.toString())), base)
                .findAndLoad(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("from_env_file");
    }

    @Test
    @DisplayName("Should skip a malformed candidate and keep searching")
    void shouldSkipMalformedCandidate() throws Exception {
        Path base = Files.createDirectories(dir.resolve("work/app/env")).getParent();
        write("work/app/.env", "not an entry\n");
        write("work/app/env/.env", "DB_PASSWORD=second\n");

        AppConfig config = new EnvLoader(EnvLookup.of(Map.of()), base).findAndLoad(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("second");
    }

    @Test
    @DisplayName("Should still bind when no file is found")
    void shouldBindWithoutAnyFile() throws Exception {
        Path empty = Files.createDirectories(dir.resolve("x/y/z"));

        AppConfig config = new EnvLoader(EnvLookup.of(Map.of("DB_PASSWORD", "sys")), empty)
                .findAndLoad(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("sys");
    }

    @Test
    @DisplayName("Should report missing required fields as checked failures")
    void shouldReportMissingRequired() {
        assertThatThrownBy(() -> loader(Map.of()).load(new AppConfig()))
                .isInstanceOf(MissingRequiredException.class)
                .hasMessageContaining("DB_PASSWORD is required");
    }

    @Test
    @DisplayName("Should fail fast in mustLoad")
    void shouldFailFastInMustLoad() {
        assertThatThrownBy(() -> loader(Map.of()).mustLoad(new AppConfig()))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(MissingRequiredException.class)
                .hasMessageContaining("DB_PASSWORD is required");
    }

    @Test
    @DisplayName("Should return the bound object from mustLoad")
    void shouldReturnFromMustLoad() {
        AppConfig config = loader(Map.of("DB_PASSWORD", "ok")).mustLoad(new AppConfig());

        assertThat(config.dbPassword).isEqualTo("ok");
    }

    @Test
    @DisplayName("Should instantiate and load a configuration class")
    void shouldLoadNewInstance() throws Exception {
        write(".env", "DB_PASSWORD=file\n");

        AppConfig config = loader(Map.of()).loadNew(AppConfig.class);

        assertThat(config.dbPassword).isEqualTo("file");
    }

    @Test
    @DisplayName("Should search the fixed locations before ENV_FILE")
    void shouldListSearchPaths() {
        EnvLoader loader = new EnvLoader(EnvLookup.of(Map.of("ENV_FILE", "/etc/app.env")), dir);

        assertThat(loader.searchPaths())
                .hasSize(EnvLoader.SEARCH_PATHS.size() + 1)
                .last()
                .isEqualTo(Path.of("/etc/app.env"));
    }

    static class DefaultsConfig {
        @Env("APP_NAME,envbind")
        String appName;

        @Env("WORKERS,2")
        int workers;
    }

    private EnvLoader loader(Map<String, String> system) {
        return new EnvLoader(EnvLookup.of(system), dir);
    }

    private void write(String name, String... lines) throws IOException {
        Files.writeString(dir.resolve(name), String.join("", lines));
    }
}

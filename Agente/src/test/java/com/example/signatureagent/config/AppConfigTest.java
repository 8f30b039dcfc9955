package com.example.signatureagent.config;

import com.example.signatureagent.config.AppConfig.Mode;
import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.digest.DigestModule.UnsupportedAlgorithmException;
import com.example.signatureagent.export.RowExport.OutputFormat;
import com.example.signatureagent.repository.RepositoryModule;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaults_shouldApplyWhenNothingIsConfigured() {
        AppConfig config = AppConfig.fromMap(Map.of());

        assertEquals(Mode.COMPUTE, config.mode());
        assertEquals(EnumSet.allOf(HashAlgorithm.class), config.algorithms());
        assertEquals(EnumSet.of(HashAlgorithm.MD5), config.repositoryAlgorithms());
        assertEquals(RepositoryModule.DEFAULT_ROOT_URI, config.repositoryUri());
        assertEquals(4, config.repositoryConcurrency());
        assertEquals(Duration.ofSeconds(30), config.repositoryTimeout());
        assertEquals("N/A", config.missingPlaceholder());
        assertEquals(OutputFormat.CSV, config.outputFormat());
        assertTrue(config.runTimeout().isEmpty());
        assertTrue(config.paths().isEmpty());
        assertFalse(config.recurse());
        assertFalse(config.includeRootPath());
    }

    @Test
    void paths_shouldSplitOnPlatformPathSeparatorOnly() {
        String sep = File.pathSeparator;
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.SIGNATURE_PATHS,
                " /data/a " + sep + "/data/b, c" + sep + sep + " "));

        assertEquals(List.of("/data/a", "/data/b, c"), config.paths());
    }

    @Test
    void list_shouldStillSplitAlgorithmsOnCommaAndSemicolon() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.SIGNATURE_ALGORITHMS, "md5; sha1 ,,sha512"));

        assertEquals(List.of("md5", "sha1", "sha512"), config.list(AppConfig.SIGNATURE_ALGORITHMS));
    }

    @Test
    void algorithms_shouldParseAliases() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.SIGNATURE_ALGORITHMS, "sha-256,MD5"));

        assertEquals(EnumSet.of(HashAlgorithm.MD5, HashAlgorithm.SHA256), config.algorithms());
    }

    @Test
    void algorithms_shouldFailFastOnUnknownName() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.REPOSITORY_ALGORITHMS, "MD5,WHIRLPOOL"));

        assertThrows(UnsupportedAlgorithmException.class, config::repositoryAlgorithms);
    }

    @Test
    void repositoryUri_shouldEnforceSchemeAndTrailingSlash() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.REPOSITORY_URI, "http://localhost:8080/lookup"));
        assertEquals("http://localhost:8080/lookup/", config.repositoryUri());

        AppConfig ftp = AppConfig.fromMap(Map.of(AppConfig.REPOSITORY_URI, "ftp://host/x/"));
        assertThrows(IllegalStateException.class, ftp::repositoryUri);
    }

    @Test
    void numericValues_shouldBeClampedOrFallBackToDefault() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.REPOSITORY_CONCURRENCY, "500",
                AppConfig.REPOSITORY_TIMEOUT_SECONDS, "abc",
                AppConfig.SIGNATURE_WORKERS, "0",
                AppConfig.SIGNATURE_RUN_TIMEOUT_SECONDS, "90"));

        assertEquals(64, config.repositoryConcurrency());
        assertEquals(Duration.ofSeconds(30), config.repositoryTimeout());
        assertEquals(1, config.workers());
        assertEquals(Optional.of(Duration.ofSeconds(90)), config.runTimeout());
    }

    @Test
    void flags_shouldAcceptCommonTruthyValues() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.SIGNATURE_RECURSE, "yes",
                AppConfig.SIGNATURE_INCLUDE_HIDDEN, "1",
                AppConfig.SIGNATURE_INCLUDE_ROOT_PATH, "TRUE"));

        assertTrue(config.recurse());
        assertTrue(config.includeHiddenAndSystem());
        assertTrue(config.includeRootPath());
    }

    @Test
    void mode_shouldRejectUnknownValue() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.SIGNATURE_MODE, "upload"));

        assertThrows(IllegalStateException.class, config::mode);
        assertTrue(config.toString().contains("mode=error:IllegalStateException"));
    }

    @Test
    void outputFormat_shouldPreferExplicitSettingOverFileSuffix() {
        AppConfig inferred = AppConfig.fromMap(Map.of(AppConfig.SIGNATURE_OUTPUT_FILE, "out/rows.json"));
        AppConfig explicit = AppConfig.fromMap(Map.of(
                AppConfig.SIGNATURE_OUTPUT_FILE, "out/rows.json",
                AppConfig.SIGNATURE_OUTPUT_FORMAT, "csv"));

        assertEquals(OutputFormat.JSON, inferred.outputFormat());
        assertEquals(Optional.of(Path.of("out/rows.json")), inferred.outputFile());
        assertEquals(OutputFormat.CSV, explicit.outputFormat());
    }

    @Test
    void override_shouldTakePrecedenceAndBeRemovable() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.SIGNATURE_MODE, "verify"));

        config.override(AppConfig.SIGNATURE_MODE, "lookup");
        assertEquals(Mode.LOOKUP, config.mode());

        config.override(AppConfig.SIGNATURE_MODE, null);
        assertEquals(Mode.VERIFY, config.mode());
    }

    @Test
    void require_shouldFailForMissingKey() {
        assertThrows(IllegalStateException.class, () -> AppConfig.fromMap(Map.of()).require(AppConfig.SIGNATURE_REFERENCE_FILE));
    }

    @Test
    void missingPlaceholder_shouldAllowEmptyValue() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.SIGNATURE_MISSING_PLACEHOLDER, ""));

        assertEquals("", config.missingPlaceholder());
    }
}

package com.example.signatureagent.scan;

import com.example.signatureagent.scan.PathNormalizer.NormalizedPath;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PathNormalizerTest {

    @TempDir
    Path tempDir;

    @Test
    void normalize_shouldStripRootWithoutTrailingSeparator() throws IOException {
        Path file = Files.createDirectories(tempDir.resolve("sub")).resolve("file.txt");
        Files.writeString(file, "x");

        NormalizedPath normalized = PathNormalizer.normalize(file, tempDir);

        assertEquals("sub/file.txt", normalized.pathRelativeToRoot());
        assertTrue(normalized.root().endsWith("/"));
    }

    @Test
    void normalize_shouldGiveSameResultWithTrailingSeparator() throws IOException {
        Path file = Files.createDirectories(tempDir.resolve("sub")).resolve("file.txt");
        Files.writeString(file, "x");

        String withoutSlash = PathNormalizer.normalize(file.toString(), tempDir.toString()).pathRelativeToRoot();
        String withSlash = PathNormalizer.normalize(file.toString(), tempDir + "/").pathRelativeToRoot();

        assertEquals("sub/file.txt", withoutSlash);
        assertEquals(withoutSlash, withSlash);
    }

    @Test
    void normalize_shouldMatchRootCaseInsensitively() {
        NormalizedPath normalized = PathNormalizer.normalize("/DATA/Sub/File.TXT", "/data/");

        assertEquals("Sub/File.TXT", normalized.pathRelativeToRoot());
    }

    @Test
    void normalize_shouldUnifyBackslashes() {
        NormalizedPath normalized = PathNormalizer.normalize("C:\\dados\\a\\b.txt", "C:\\dados\\");

        assertEquals("C:/dados/", normalized.root());
        assertEquals("a/b.txt", normalized.pathRelativeToRoot());
    }

    @Test
    void normalize_shouldStripProviderPrefixFromRoot() {
        NormalizedPath normalized = PathNormalizer.normalize(
                "C:\\dados\\a\\b.txt",
                "Microsoft.PowerShell.Core\\FileSystem::C:\\dados\\");

        assertEquals("a/b.txt", normalized.pathRelativeToRoot());
    }

    @Test
    void normalize_shouldReturnFullPathWhenPrefixDoesNotMatch() {
        NormalizedPath normalized = PathNormalizer.normalize("/other/place/f.txt", "/data/");

        assertEquals("/other/place/f.txt", normalized.pathRelativeToRoot());
    }

    @Test
    void relativize_shouldReturnFileNameForFileDirectlyUnderRoot() throws IOException {
        Path file = tempDir.resolve("top.bin");
        Files.write(file, new byte[] {1});

        assertEquals("top.bin", PathNormalizer.relativize(file, tempDir));
    }

    @Test
    void stripProvider_shouldHandleFileUris() {
        assertEquals("/tmp/x", PathNormalizer.stripProvider("file:///tmp/x"));
        assertEquals("C:/x", PathNormalizer.stripProvider("file:/C:/x"));
        assertEquals("/plain", PathNormalizer.stripProvider("/plain"));
    }

    @Test
    void normalizeRoot_shouldNotAppendSeparatorToNonexistentPath() {
        assertEquals("/definitely/not/here", PathNormalizer.normalizeRoot("/definitely/not/here"));
    }

    @Test
    void normalize_shouldKeepDoubleColonInsideDirectoryName() throws IOException {
        assumeTrue(File.separatorChar == '/', "':' não é válido em nomes no Windows");
        Path root = Files.createDirectories(tempDir.resolve("pkg::v1"));
        Path file = Files.createDirectories(root.resolve("sub")).resolve("file.txt");
        Files.writeString(file, "x");

        NormalizedPath normalized = PathNormalizer.normalize(file, root);

        assertEquals(root + "/", normalized.root());
        assertEquals("sub/file.txt", normalized.pathRelativeToRoot());
    }

    @Test
    void stripProvider_shouldOnlyStripLeadingProviderShapedPrefix() {
        assertEquals("C:\\dados", PathNormalizer.stripProvider("Microsoft.PowerShell.Core\\FileSystem::C:\\dados"));
        assertEquals("/data/pkg::v1", PathNormalizer.stripProvider("/data/pkg::v1"));
        assertEquals("./a::b/c", PathNormalizer.stripProvider("./a::b/c"));
    }

    @Test
    void normalize_shouldKeepBackslashInPosixFileName() {
        assumeTrue(File.separatorChar == '/', "apenas POSIX");

        String withBackslash = PathNormalizer.normalize("/data/a\\b.txt", "/data/").pathRelativeToRoot();
        String nested = PathNormalizer.normalize("/data/a/b.txt", "/data/").pathRelativeToRoot();

        assertEquals("a\\b.txt", withBackslash);
        assertEquals("a/b.txt", nested);
        assertNotEquals(withBackslash, nested);
    }
}

package com.example.signatureagent.scan;

import com.example.signatureagent.scan.Scanner.FileEntry;
import com.example.signatureagent.scan.Scanner.ScanConsumer;
import com.example.signatureagent.scan.Scanner.ScanService;
import com.example.signatureagent.scan.Scanner.ScanStatistics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void list_shouldOnlyReturnTopLevelFilesWhenNotRecursing() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "a");
        Path sub = Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(sub.resolve("b.txt"), "b");

        List<FileEntry> files = new ScanService(false, false).list(tempDir, null);

        assertEquals(Set.of("a.txt"), names(files));
    }

    @Test
    void list_shouldDescendWhenRecursing() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "a");
        Path deep = Files.createDirectories(tempDir.resolve("sub").resolve("deeper"));
        Files.writeString(deep.resolve("c.txt"), "c");

        List<FileEntry> files = new ScanService(true, false).list(tempDir, null);

        assertEquals(Set.of("a.txt", "c.txt"), names(files));
    }

    @Test
    void list_shouldSkipHiddenFilesAndDirectoriesUnlessIncluded() throws IOException {
        Files.writeString(tempDir.resolve("visible.txt"), "v");
        Files.writeString(tempDir.resolve(".hidden.txt"), "h");
        Path hiddenDir = Files.createDirectories(tempDir.resolve(".cache"));
        Files.writeString(hiddenDir.resolve("inner.txt"), "i");

        List<FileEntry> withoutHidden = new ScanService(true, false).list(tempDir, null);
        List<FileEntry> withHidden = new ScanService(true, true).list(tempDir, null);

        // Files.isHidden usa o ponto inicial em sistemas POSIX
        assertEquals(Set.of("visible.txt"), names(withoutHidden));
        assertEquals(Set.of("visible.txt", ".hidden.txt", "inner.txt"), names(withHidden));
    }

    @Test
    void scan_shouldReportStatistics() throws IOException {
        Files.writeString(tempDir.resolve("one.txt"), "1");
        Files.writeString(tempDir.resolve("two.txt"), "2");
        Files.writeString(tempDir.resolve(".three.txt"), "3");
        List<FileEntry> found = new ArrayList<>();

        ScanStatistics stats = new ScanService(false, false).scan(tempDir, new ScanConsumer() {
            @Override
            public void onFileFound(FileEntry entry) {
                found.add(entry);
            }

            @Override
            public void onError(Path path, String message, IOException exc) {
                fail("erro inesperado: " + message);
            }
        });

        assertEquals(2, stats.filesFound());
        assertEquals(1, stats.filesSkippedHidden());
        assertEquals(0, stats.errors());
        assertEquals(2, found.size());
    }

    @Test
    void scan_shouldRejectRegularFileAsRoot() throws IOException {
        Path file = tempDir.resolve("file.txt");
        Files.writeString(file, "x");

        assertThrows(IOException.class, () -> new ScanService(false, false).list(file, null));
    }

    @Test
    void fileEntry_shouldCaptureSizeAndHashability() throws IOException {
        Path file = tempDir.resolve("data.bin");
        Files.write(file, new byte[] {1, 2, 3});
        Path empty = tempDir.resolve("empty.bin");
        Files.write(empty, new byte[0]);

        FileEntry entry = FileEntry.of(file);
        FileEntry emptyEntry = FileEntry.of(empty);

        assertEquals(3, entry.sizeBytes());
        assertEquals("data.bin", entry.name());
        assertTrue(entry.isHashable());
        assertFalse(emptyEntry.isHashable());
        assertFalse(FileEntry.of(tempDir).isHashable());
    }

    private static Set<String> names(List<FileEntry> files) {
        return files.stream().map(FileEntry::name).collect(Collectors.toSet());
    }
}

package com.example.signatureagent.digest;

import com.example.signatureagent.digest.DigestModule.DigestEngine;
import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.digest.DigestModule.UnsupportedAlgorithmException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DigestModuleTest {

    private static final String ABC_MD5 = "900150983CD24FB0D6963F7D28E17F72";
    private static final String ABC_SHA1 = "A9993E364706816ABA3E25717850C26C9CD0D89D";
    private static final String ABC_SHA256 = "BA7816BF8F01CFEA414140DE5DAE2223B00361A396177A9CB410FF61F20015AD";
    private static final String ABC_SHA512 = "DDAF35A193617ABACC417349AE20413112E6FA4E89A97EA20A9EEEE64B55D39A"
            + "2192992A274FC1A836BA3C23A3FEEBBD454D4423643CE80E2A9AC94FA54CA49F";

    @TempDir
    Path tempDir;

    @Test
    void digest_shouldMatchKnownVectorsForAllAlgorithms() {
        Map<HashAlgorithm, String> digests = DigestEngine.allAlgorithms()
                .digest("abc".getBytes(StandardCharsets.US_ASCII));

        assertEquals(ABC_MD5, digests.get(HashAlgorithm.MD5));
        assertEquals(ABC_SHA1, digests.get(HashAlgorithm.SHA1));
        assertEquals(ABC_SHA256, digests.get(HashAlgorithm.SHA256));
        assertEquals(ABC_SHA512, digests.get(HashAlgorithm.SHA512));
    }

    @Test
    void digest_shouldReturnUpperCaseHexOfExpectedLength() {
        Map<HashAlgorithm, String> digests = DigestEngine.allAlgorithms().digest("test content".getBytes());

        for (HashAlgorithm algorithm : HashAlgorithm.values()) {
            String hex = digests.get(algorithm);
            assertEquals(algorithm.hexLength(), hex.length(), algorithm.name());
            assertTrue(hex.matches("[0-9A-F]+"), hex);
        }
    }

    @Test
    void digest_shouldOnlyComputeRequestedAlgorithms() {
        DigestEngine engine = new DigestEngine(EnumSet.of(HashAlgorithm.SHA256, HashAlgorithm.MD5));

        Map<HashAlgorithm, String> digests = engine.digest("abc".getBytes(StandardCharsets.US_ASCII));

        assertEquals(List.of(HashAlgorithm.MD5, HashAlgorithm.SHA256), List.copyOf(digests.keySet()));
        assertEquals(ABC_SHA256, digests.get(HashAlgorithm.SHA256));
    }

    @Test
    void digestFile_shouldMatchInMemoryDigest() throws IOException {
        Path file = tempDir.resolve("data.bin");
        byte[] content = new byte[200_000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i * 31);
        }
        Files.write(file, content);

        DigestEngine engine = DigestEngine.allAlgorithms();
        assertEquals(engine.digest(content), engine.digest(file));
    }

    @Test
    void digestFile_shouldReportAllBytesRead() throws IOException {
        Path file = tempDir.resolve("data.bin");
        Files.write(file, new byte[150_000]);
        AtomicLong total = new AtomicLong();

        DigestEngine.allAlgorithms().digest(file, total::addAndGet);

        assertEquals(150_000, total.get());
    }

    @Test
    void digest_shouldReadStreamExactlyOnce() throws IOException {
        CountingStream in = new CountingStream("abc".getBytes(StandardCharsets.US_ASCII));

        Map<HashAlgorithm, String> digests = DigestEngine.allAlgorithms().digest(in, null);

        assertEquals(3, in.bytesServed);
        assertEquals(ABC_MD5, digests.get(HashAlgorithm.MD5));
    }

    @Test
    void digest_shouldPropagateReadFailure() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                throw new IOException("disk gone");
            }
        };

        assertThrows(IOException.class, () -> DigestEngine.allAlgorithms().digest(broken, null));
    }

    @Test
    void digestFile_shouldThrowForNonexistentFile() {
        Path ghost = tempDir.resolve("ghost.txt");
        assertThrows(IOException.class, () -> DigestEngine.allAlgorithms().digest(ghost));
    }

    @Test
    void engine_shouldRejectEmptyAlgorithmSet() {
        assertThrows(IllegalArgumentException.class, () -> new DigestEngine(EnumSet.noneOf(HashAlgorithm.class)));
    }

    @Test
    void parse_shouldAcceptAliasesCaseInsensitively() {
        assertEquals(HashAlgorithm.SHA1, HashAlgorithm.parse("sha-1"));
        assertEquals(HashAlgorithm.SHA256, HashAlgorithm.parse("SHA256"));
        assertEquals(HashAlgorithm.SHA512, HashAlgorithm.parse(" Sha-512 "));
        assertEquals(HashAlgorithm.MD5, HashAlgorithm.parse("md5"));
    }

    @Test
    void parse_shouldRejectUnknownAlgorithm() {
        UnsupportedAlgorithmException e = assertThrows(UnsupportedAlgorithmException.class,
                () -> HashAlgorithm.parse("CRC32"));
        assertEquals("CRC32", e.requested());
    }

    @Test
    void parseAll_shouldKeepDeclarationOrder() {
        Set<HashAlgorithm> parsed = HashAlgorithm.parseAll(List.of("sha512", "md5", "MD5"));
        assertEquals(List.of(HashAlgorithm.MD5, HashAlgorithm.SHA512), List.copyOf(parsed));
    }

    @Test
    void parseAll_shouldRejectEmptyList() {
        assertThrows(IllegalArgumentException.class, () -> HashAlgorithm.parseAll(List.of()));
    }

    @Test
    void columnName_shouldAppendHashSuffix() {
        assertEquals("SHA256Hash", HashAlgorithm.SHA256.columnName());
    }

    private static final class CountingStream extends ByteArrayInputStream {
        long bytesServed;

        CountingStream(byte[] data) {
            super(data);
        }

        @Override
        public synchronized int read(byte[] b, int off, int len) {
            int n = super.read(b, off, len);
            if (n > 0) {
                bytesServed += n;
            }
            return n;
        }

        @Override
        public synchronized void reset() {
            throw new UnsupportedOperationException("rewind");
        }
    }
}

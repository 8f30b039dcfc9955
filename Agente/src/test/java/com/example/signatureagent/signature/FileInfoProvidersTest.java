package com.example.signatureagent.signature;

import com.example.signatureagent.signature.FileInfoProviders.JarCertificateInfoProvider;
import com.example.signatureagent.signature.FileInfoProviders.JarManifestVersionInfoProvider;
import com.example.signatureagent.signature.Signatures.CertificateInfo;
import com.example.signatureagent.signature.Signatures.SignatureStatus;
import com.example.signatureagent.signature.Signatures.VersionInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.junit.jupiter.api.Assertions.*;

class FileInfoProvidersTest {

    @TempDir
    Path tempDir;

    private Path writeJar(String name, Manifest manifest) throws IOException {
        Path jar = tempDir.resolve(name);
        try (OutputStream file = Files.newOutputStream(jar);
             JarOutputStream out = manifest != null ? new JarOutputStream(file, manifest) : new JarOutputStream(file)) {
            out.putNextEntry(new JarEntry("com/example/Hello.class"));
            out.write("not really bytecode".getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }
        return jar;
    }

    @Test
    void versionInfo_shouldMapManifestAttributes() throws IOException {
        Manifest manifest = new Manifest();
        Attributes main = manifest.getMainAttributes();
        main.put(Attributes.Name.MANIFEST_VERSION, "1.0");
        main.putValue("Bundle-SymbolicName", "com.example.hello;singleton:=true");
        main.putValue("Implementation-Version", "1.4.2");
        main.putValue("Implementation-Title", "Hello Library");
        main.putValue("Specification-Version", "1.4");
        Path jar = writeJar("Hello-1.4.2.jar", manifest);

        Optional<VersionInfo> info = new JarManifestVersionInfoProvider().versionInfo(jar);

        assertTrue(info.isPresent());
        assertEquals("com.example.hello", info.get().internalName());
        assertEquals("Hello-1.4.2.jar", info.get().originalFilename());
        assertEquals("1.4.2", info.get().fileVersion());
        assertEquals("Hello Library", info.get().fileDescription());
        assertEquals("Hello Library", info.get().product());
        assertEquals("1.4", info.get().productVersion());
    }

    @Test
    void versionInfo_shouldBeEmptyForNonArchive() throws IOException {
        Path text = tempDir.resolve("notes.txt");
        Files.writeString(text, "hello");

        assertTrue(new JarManifestVersionInfoProvider().versionInfo(text).isEmpty());
    }

    @Test
    void versionInfo_shouldBeEmptyWhenJarHasNoManifest() throws IOException {
        Path jar = writeJar("plain.jar", null);

        assertTrue(new JarManifestVersionInfoProvider().versionInfo(jar).isEmpty());
    }

    @Test
    void certificateInfo_shouldReportUnsignedJar() throws IOException {
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        Path jar = writeJar("unsigned.jar", manifest);

        Optional<CertificateInfo> info = new JarCertificateInfoProvider().certificateInfo(jar);

        assertTrue(info.isPresent());
        assertEquals(SignatureStatus.NOT_SIGNED, info.get().status());
        assertNull(info.get().signer());
    }

    @Test
    void certificateInfo_shouldBeEmptyForNonArchive() throws IOException {
        Path text = tempDir.resolve("notes.bin");
        Files.writeString(text, "hello");

        assertTrue(new JarCertificateInfoProvider().certificateInfo(text).isEmpty());
    }

    @Test
    void certificateInfo_shouldFailForCorruptArchive() throws IOException {
        Path broken = tempDir.resolve("broken.jar");
        Files.writeString(broken, "this is not a zip file");

        assertThrows(IOException.class, () -> new JarCertificateInfoProvider().certificateInfo(broken));
    }
}

package com.example.signatureagent.signature;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.security.CodeSigner;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Timestamp;
import java.security.cert.Certificate;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.signatureagent.signature.Signatures.CertificateDetails;
import com.example.signatureagent.signature.Signatures.CertificateInfo;
import com.example.signatureagent.signature.Signatures.SignatureStatus;
import com.example.signatureagent.signature.Signatures.VersionInfo;

/**
 * Colaboradores externos que extraem blocos opcionais de versão e de
 * certificado de um arquivo, mais as implementações para pacotes Java
 * (JAR/WAR/EAR), que carregam essas informações no manifest e nas assinaturas.
 */
public final class FileInfoProviders {

    private FileInfoProviders() {}

    private static final Set<String> ARCHIVE_EXTENSIONS = Set.of("jar", "war", "ear");
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    /**
     * Extrai informações de versão. Vazio quando o arquivo não tem o bloco.
     */
    @FunctionalInterface
    public interface VersionInfoProvider {
        Optional<VersionInfo> versionInfo(Path file) throws IOException;

        static VersionInfoProvider none() {
            return file -> Optional.empty();
        }
    }

    /**
     * Extrai informações de certificado. Vazio quando o formato não suporta assinatura.
     */
    @FunctionalInterface
    public interface CertificateInfoProvider {
        Optional<CertificateInfo> certificateInfo(Path file) throws IOException;

        static CertificateInfoProvider none() {
            return file -> Optional.empty();
        }
    }

    static boolean isJavaArchive(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String lower = name.toString().toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot > 0 && ARCHIVE_EXTENSIONS.contains(lower.substring(dot + 1));
    }

    /**
     * Versão a partir dos atributos principais do MANIFEST.MF.
     *
     * Mapeamento: InternalName = Automatic-Module-Name / Bundle-SymbolicName,
     * OriginalFilename = nome do arquivo, FileVersion = Implementation-Version,
     * FileDescription = Bundle-Description / Implementation-Title,
     * Product = Specification-Title / Bundle-Name, ProductVersion = Specification-Version.
     */
    public static final class JarManifestVersionInfoProvider implements VersionInfoProvider {

        @Override
        public Optional<VersionInfo> versionInfo(Path file) throws IOException {
            if (!isJavaArchive(file)) {
                return Optional.empty();
            }
            try (JarFile jar = new JarFile(file.toFile(), false)) {
                Manifest manifest = jar.getManifest();
                if (manifest == null) {
                    return Optional.empty();
                }
                Attributes main = manifest.getMainAttributes();
                String fileName = file.getFileName() != null ? file.getFileName().toString() : "";
                return Optional.of(new VersionInfo(
                        first(main, "Automatic-Module-Name", "Bundle-SymbolicName"),
                        fileName,
                        first(main, "Implementation-Version", "Bundle-Version"),
                        first(main, "Bundle-Description", "Implementation-Title"),
                        first(main, "Specification-Title", "Bundle-Name", "Implementation-Title"),
                        first(main, "Specification-Version", "Implementation-Version")));
            }
        }

        private static String first(Attributes attributes, String... names) {
            for (String name : names) {
                String value = attributes.getValue(name);
                if (value != null && !value.isBlank()) {
                    // Bundle-SymbolicName pode vir com diretivas: "a.b.c;singleton:=true"
                    int directive = value.indexOf(';');
                    return (directive > 0 ? value.substring(0, directive) : value).trim();
                }
            }
            return "";
        }
    }

    /**
     * Verifica a assinatura de um JAR e descreve o certificado do assinante.
     *
     * Cada entrada é lida até o fim (é isso que dispara a verificação do
     * {@link JarFile}); um digest divergente vira {@link SignatureStatus#HASH_MISMATCH}.
     * Entradas sem assinatura (fora de META-INF) fazem o arquivo contar como
     * não assinado.
     */
    public static final class JarCertificateInfoProvider implements CertificateInfoProvider {

        private static final Logger log = LoggerFactory.getLogger(JarCertificateInfoProvider.class);

        @Override
        public Optional<CertificateInfo> certificateInfo(Path file) throws IOException {
            if (!isJavaArchive(file)) {
                return Optional.empty();
            }
            try (JarFile jar = new JarFile(file.toFile(), true)) {
                CodeSigner signer = null;
                boolean unsignedEntry = false;
                byte[] buffer = new byte[8192];

                Enumeration<JarEntry> entries = jar.entries();
                while (entries.hasMoreElements()) {
                    JarEntry entry = entries.nextElement();
                    if (entry.isDirectory()) {
                        continue;
                    }
                    try (InputStream in = jar.getInputStream(entry)) {
                        while (in.read(buffer) != -1) {
                            // leitura completa é obrigatória para a verificação
                        }
                    }
                    if (entry.getName().toUpperCase(Locale.ROOT).startsWith("META-INF/")) {
                        continue;
                    }
                    CodeSigner[] signers = entry.getCodeSigners();
                    if (signers == null || signers.length == 0) {
                        unsignedEntry = true;
                    } else if (signer == null) {
                        signer = signers[0];
                    }
                }

                if (signer == null) {
                    return Optional.of(CertificateInfo.notSigned());
                }
                CertificateDetails signerDetails = details(signer.getSignerCertPath().getCertificates());
                Timestamp timestamp = signer.getTimestamp();
                CertificateDetails timestamper = timestamp != null
                        ? details(timestamp.getSignerCertPath().getCertificates())
                        : null;
                if (unsignedEntry) {
                    return Optional.of(new CertificateInfo(signerDetails, timestamper, SignatureStatus.UNKNOWN_ERROR,
                            "JAR parcialmente assinado"));
                }
                return Optional.of(new CertificateInfo(signerDetails, timestamper, SignatureStatus.VALID,
                        "Assinatura verificada"));
            } catch (SecurityException e) {
                log.warn("Assinatura inválida em {}: {}", file, e.getMessage());
                return Optional.of(new CertificateInfo(null, null, SignatureStatus.HASH_MISMATCH, e.getMessage()));
            }
        }

        private static CertificateDetails details(List<? extends Certificate> chain) {
            if (chain.isEmpty() || !(chain.get(0) instanceof X509Certificate)) {
                return null;
            }
            X509Certificate cert = (X509Certificate) chain.get(0);
            return new CertificateDetails(
                    cert.getSubjectX500Principal().getName(),
                    cert.getIssuerX500Principal().getName(),
                    cert.getSerialNumber().toString(16).toUpperCase(Locale.ROOT),
                    thumbprint(cert),
                    cert.getNotBefore().toInstant(),
                    cert.getNotAfter().toInstant());
        }

        /** SHA-1 do certificado codificado (convenção de "thumbprint"). */
        private static String thumbprint(X509Certificate cert) {
            try {
                return HEX.formatHex(MessageDigest.getInstance("SHA-1").digest(cert.getEncoded()));
            } catch (NoSuchAlgorithmException | CertificateEncodingException e) {
                log.debug("Falha ao calcular thumbprint: {}", e.toString());
                return "";
            }
        }
    }
}

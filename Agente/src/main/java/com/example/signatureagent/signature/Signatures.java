package com.example.signatureagent.signature;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.export.RowExport.OutputRow;
import com.example.signatureagent.scan.PathNormalizer.NormalizedPath;
import com.example.signatureagent.scan.Scanner.FileEntry;

/**
 * Agrega os modelos de assinatura de arquivo e o builder que os monta.
 */
public final class Signatures {

    private Signatures() {}

    static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    /**
     * Bloco de informações de versão (nome interno, versão do produto etc.).
     * Campos ausentes vêm como string vazia.
     */
    public record VersionInfo(String internalName,
                              String originalFilename,
                              String fileVersion,
                              String fileDescription,
                              String product,
                              String productVersion) {

        public VersionInfo {
            internalName = blankIfNull(internalName);
            originalFilename = blankIfNull(originalFilename);
            fileVersion = blankIfNull(fileVersion);
            fileDescription = blankIfNull(fileDescription);
            product = blankIfNull(product);
            productVersion = blankIfNull(productVersion);
        }

        void appendTo(OutputRow.Builder row) {
            row.put("InternalName", internalName)
                    .put("OriginalFilename", originalFilename)
                    .put("FileVersion", fileVersion)
                    .put("FileDescription", fileDescription)
                    .put("Product", product)
                    .put("ProductVersion", productVersion);
        }
    }

    /** Status da assinatura digital. */
    public enum SignatureStatus {
        VALID("Valid"),
        NOT_SIGNED("NotSigned"),
        HASH_MISMATCH("HashMismatch"),
        UNKNOWN_ERROR("UnknownError");

        private final String label;

        SignatureStatus(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /**
     * Dados de um certificado (assinante ou carimbo de tempo).
     */
    public record CertificateDetails(String subject,
                                     String issuer,
                                     String serialNumber,
                                     String thumbprint,
                                     Instant notBefore,
                                     Instant notAfter) {

        public CertificateDetails {
            subject = blankIfNull(subject);
            issuer = blankIfNull(issuer);
            serialNumber = blankIfNull(serialNumber);
            thumbprint = blankIfNull(thumbprint);
        }

        void appendTo(OutputRow.Builder row, String prefix) {
            row.put(prefix + "Subject", subject)
                    .put(prefix + "Issuer", issuer)
                    .put(prefix + "SerialNumber", serialNumber)
                    .put(prefix + "Thumbprint", thumbprint)
                    .put(prefix + "NotBefore", notBefore != null ? ISO.format(notBefore) : "")
                    .put(prefix + "NotAfter", notAfter != null ? ISO.format(notAfter) : "");
        }
    }

    /**
     * Bloco de certificado: assinante, carimbo de tempo (opcional) e status.
     */
    public record CertificateInfo(CertificateDetails signer,
                                  CertificateDetails timestamper,
                                  SignatureStatus status,
                                  String statusMessage) {

        public CertificateInfo {
            Objects.requireNonNull(status, "status");
            statusMessage = blankIfNull(statusMessage);
        }

        public static CertificateInfo notSigned() {
            return new CertificateInfo(null, null, SignatureStatus.NOT_SIGNED, "Arquivo sem assinatura");
        }

        void appendTo(OutputRow.Builder row) {
            CertificateDetails emptyDetails = new CertificateDetails(null, null, null, null, null, null);
            (signer != null ? signer : emptyDetails).appendTo(row, "SignerCertificate");
            (timestamper != null ? timestamper : emptyDetails).appendTo(row, "TimeStamperCertificate");
            row.put("SignatureStatus", status.label())
                    .put("SignatureStatusMessage", statusMessage);
        }
    }

    /**
     * Assinatura de um arquivo: metadados + um digest por algoritmo pedido.
     *
     * Imutável; criada uma vez por arquivo por execução. {@code fullPath} e
     * {@code root} só existem quando a exposição do root foi habilitada.
     */
    public static final class SignatureRecord {
        private final String filename;
        private final String fullPath;
        private final String root;
        private final String pathRelativeToRoot;
        private final long sizeBytes;
        private final Instant createdUtc;
        private final Instant modifiedUtc;
        private final Map<HashAlgorithm, String> digests;
        private final VersionInfo versionInfo;
        private final CertificateInfo certificateInfo;
        private final Instant entryTimestamp;

        private SignatureRecord(Builder b) {
            this.filename = Objects.requireNonNull(b.filename, "filename");
            this.fullPath = b.fullPath;
            this.root = b.root;
            this.pathRelativeToRoot = Objects.requireNonNull(b.pathRelativeToRoot, "pathRelativeToRoot");
            if (b.sizeBytes < 0) {
                throw new IllegalArgumentException("sizeBytes deve ser >= 0");
            }
            this.sizeBytes = b.sizeBytes;
            this.createdUtc = Objects.requireNonNull(b.createdUtc, "createdUtc");
            this.modifiedUtc = Objects.requireNonNull(b.modifiedUtc, "modifiedUtc");
            if (b.digests.isEmpty()) {
                throw new IllegalArgumentException("Assinatura sem digest: " + b.filename);
            }
            this.digests = Collections.unmodifiableMap(new EnumMap<>(b.digests));
            this.versionInfo = b.versionInfo;
            this.certificateInfo = b.certificateInfo;
            this.entryTimestamp = b.entryTimestamp != null ? b.entryTimestamp : Instant.now();
        }

        public static Builder builder() {
            return new Builder();
        }

        /** Nome base em minúsculas: chave de identidade para o matching. */
        public String filename() { return filename; }
        public Optional<String> fullPath() { return Optional.ofNullable(fullPath); }
        public Optional<String> root() { return Optional.ofNullable(root); }
        public String pathRelativeToRoot() { return pathRelativeToRoot; }
        public long sizeBytes() { return sizeBytes; }
        public Instant createdUtc() { return createdUtc; }
        public Instant modifiedUtc() { return modifiedUtc; }
        public Map<HashAlgorithm, String> digests() { return digests; }
        public Optional<VersionInfo> versionInfo() { return Optional.ofNullable(versionInfo); }
        public Optional<CertificateInfo> certificateInfo() { return Optional.ofNullable(certificateInfo); }
        public Instant entryTimestamp() { return entryTimestamp; }

        /** Digest do algoritmo, ou vazio se ele não foi pedido nesta execução. */
        public Optional<String> digest(HashAlgorithm algorithm) {
            return Optional.ofNullable(digests.get(algorithm));
        }

        /**
         * Linha de saída com os campos fixos. Campos opcionais ausentes não
         * viram colunas (não apenas ficam em branco).
         */
        public OutputRow toRow() {
            OutputRow.Builder row = OutputRow.builder()
                    .put("Filename", filename);
            if (fullPath != null) {
                row.put("FullPath", fullPath);
            }
            if (root != null) {
                row.put("Root", root);
            }
            row.put("PathRelativeToRoot", pathRelativeToRoot)
                    .put("Size", Long.toString(sizeBytes))
                    .put("CreationTimeUtc", ISO.format(createdUtc))
                    .put("LastWriteTimeUtc", ISO.format(modifiedUtc));
            digests.forEach((algorithm, hex) -> row.put(algorithm.columnName(), hex));
            if (versionInfo != null) {
                versionInfo.appendTo(row);
            }
            if (certificateInfo != null) {
                certificateInfo.appendTo(row);
            }
            row.put("EntryTimestamp", ISO.format(entryTimestamp));
            return row.build();
        }

        @Override
        public String toString() {
            return "SignatureRecord{" + pathRelativeToRoot + ", " + sizeBytes + " bytes, " + digests.keySet() + "}";
        }

        public static final class Builder {
            private String filename;
            private String fullPath;
            private String root;
            private String pathRelativeToRoot;
            private long sizeBytes;
            private Instant createdUtc;
            private Instant modifiedUtc;
            private final Map<HashAlgorithm, String> digests = new EnumMap<>(HashAlgorithm.class);
            private VersionInfo versionInfo;
            private CertificateInfo certificateInfo;
            private Instant entryTimestamp;

            public Builder filename(String v) { this.filename = v != null ? v.toLowerCase(Locale.ROOT) : null; return this; }
            public Builder fullPath(String v) { this.fullPath = v; return this; }
            public Builder root(String v) { this.root = v; return this; }
            public Builder pathRelativeToRoot(String v) { this.pathRelativeToRoot = v; return this; }
            public Builder sizeBytes(long v) { this.sizeBytes = v; return this; }
            public Builder createdUtc(Instant v) { this.createdUtc = v; return this; }
            public Builder modifiedUtc(Instant v) { this.modifiedUtc = v; return this; }
            public Builder digest(HashAlgorithm algorithm, String hex) { this.digests.put(algorithm, hex); return this; }
            public Builder digests(Map<HashAlgorithm, String> v) { this.digests.putAll(v); return this; }
            public Builder versionInfo(VersionInfo v) { this.versionInfo = v; return this; }
            public Builder certificateInfo(CertificateInfo v) { this.certificateInfo = v; return this; }
            public Builder entryTimestamp(Instant v) { this.entryTimestamp = v; return this; }
            public SignatureRecord build() { return new SignatureRecord(this); }
        }
    }

    /**
     * Contexto de uma execução: contadores, instante de início e cancelamento.
     * Substitui contadores globais; é passado explicitamente a quem precisa.
     */
    public static final class RunContext {
        private final Instant startedAt;
        private final AtomicLong filesProcessed = new AtomicLong();
        private final AtomicLong filesSkipped = new AtomicLong();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final Instant deadline;

        public RunContext() {
            this(null);
        }

        /**
         * @param timeout tempo máximo da execução; null ou zero = sem limite
         */
        public RunContext(Duration timeout) {
            this.startedAt = Instant.now();
            this.deadline = (timeout != null && !timeout.isZero() && !timeout.isNegative())
                    ? startedAt.plus(timeout)
                    : null;
        }

        public Instant startedAt() { return startedAt; }

        public long incrementProcessed() { return filesProcessed.incrementAndGet(); }
        public long incrementSkipped() { return filesSkipped.incrementAndGet(); }
        public long filesProcessed() { return filesProcessed.get(); }
        public long filesSkipped() { return filesSkipped.get(); }

        /** Cancelamento pedido pelo usuário. */
        public void cancel() { cancelled.set(true); }

        /** Cancelado explicitamente ou prazo estourado. */
        public boolean isCancelled() {
            if (cancelled.get()) {
                return true;
            }
            return deadline != null && Instant.now().isAfter(deadline);
        }

        public RunStatistics statistics() {
            return RunStatistics.of(Duration.between(startedAt, Instant.now()), filesProcessed(), filesSkipped());
        }
    }

    /**
     * Estatísticas de fim de execução. Média por arquivo é zero quando nenhum
     * arquivo foi processado.
     */
    public static final class RunStatistics {
        private final Duration elapsed;
        private final long filesProcessed;
        private final long filesSkipped;
        private final Duration averagePerFile;

        private RunStatistics(Duration elapsed, long filesProcessed, long filesSkipped, Duration averagePerFile) {
            this.elapsed = elapsed;
            this.filesProcessed = filesProcessed;
            this.filesSkipped = filesSkipped;
            this.averagePerFile = averagePerFile;
        }

        public static RunStatistics of(Duration elapsed, long filesProcessed, long filesSkipped) {
            Objects.requireNonNull(elapsed, "elapsed");
            Duration average = filesProcessed > 0 ? elapsed.dividedBy(filesProcessed) : Duration.ZERO;
            return new RunStatistics(elapsed, filesProcessed, filesSkipped, average);
        }

        public Duration elapsed() { return elapsed; }
        public long filesProcessed() { return filesProcessed; }
        public long filesSkipped() { return filesSkipped; }
        public Duration averagePerFile() { return averagePerFile; }

        @Override
        public String toString() {
            return "RunStatistics{arquivos=" + filesProcessed
                    + ", pulados=" + filesSkipped
                    + ", tempo=" + elapsed.toMillis() + "ms"
                    + ", mediaPorArquivo=" + averagePerFile.toMillis() + "ms}";
        }
    }

    /**
     * Monta {@link SignatureRecord}s a partir do arquivo enumerado, dos digests
     * e dos blocos opcionais de versão/certificado.
     */
    public static final class SignatureBuilder {

        private final boolean includeRootPath;
        private final RunContext context;

        public SignatureBuilder(boolean includeRootPath, RunContext context) {
            this.includeRootPath = includeRootPath;
            this.context = Objects.requireNonNull(context, "context");
        }

        public SignatureRecord build(FileEntry entry,
                                     NormalizedPath path,
                                     Map<HashAlgorithm, String> digests,
                                     Optional<VersionInfo> versionInfo,
                                     Optional<CertificateInfo> certificateInfo) {
            Objects.requireNonNull(entry, "entry");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(digests, "digests");

            SignatureRecord.Builder builder = SignatureRecord.builder()
                    .filename(entry.name())
                    .pathRelativeToRoot(path.pathRelativeToRoot())
                    .sizeBytes(entry.sizeBytes())
                    .createdUtc(entry.createdUtc())
                    .modifiedUtc(entry.modifiedUtc())
                    .digests(digests)
                    .versionInfo(versionInfo != null ? versionInfo.orElse(null) : null)
                    .certificateInfo(certificateInfo != null ? certificateInfo.orElse(null) : null)
                    .entryTimestamp(Instant.now());

            // Sem exposição do root o campo nem existe no registro exportado
            if (includeRootPath) {
                builder.fullPath(entry.fullPath().toString())
                        .root(path.root());
            }

            SignatureRecord record = builder.build();
            context.incrementProcessed();
            return record;
        }
    }

    static String blankIfNull(String value) {
        return value != null ? value : "";
    }
}

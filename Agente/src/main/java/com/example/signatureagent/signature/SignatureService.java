package com.example.signatureagent.signature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.signatureagent.digest.DigestModule.DigestEngine;
import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.progress.ProgressEstimator;
import com.example.signatureagent.progress.ProgressEstimator.ProgressListener;
import com.example.signatureagent.scan.PathNormalizer;
import com.example.signatureagent.scan.PathNormalizer.NormalizedPath;
import com.example.signatureagent.scan.Scanner.FileEntry;
import com.example.signatureagent.scan.Scanner.ScanConsumer;
import com.example.signatureagent.scan.Scanner.ScanService;
import com.example.signatureagent.signature.FileInfoProviders.CertificateInfoProvider;
import com.example.signatureagent.signature.FileInfoProviders.VersionInfoProvider;
import com.example.signatureagent.signature.Signatures.CertificateInfo;
import com.example.signatureagent.signature.Signatures.RunContext;
import com.example.signatureagent.signature.Signatures.RunStatistics;
import com.example.signatureagent.signature.Signatures.SignatureBuilder;
import com.example.signatureagent.signature.Signatures.SignatureRecord;
import com.example.signatureagent.signature.Signatures.VersionInfo;

/**
 * Ponto de entrada de cálculo de assinaturas. Liga Scan -> Digest -> Builder.
 *
 * A travessia é sequencial (ordem do enumerador); o hash roda em um pool
 * limitado de workers, um arquivo por tarefa. Um único agregador (a thread que
 * chamou) recolhe os resultados na ordem da enumeração.
 */
public final class SignatureService {

    private static final Logger log = LoggerFactory.getLogger(SignatureService.class);

    private final VersionInfoProvider versionInfoProvider;
    private final CertificateInfoProvider certificateInfoProvider;

    public SignatureService() {
        this(new FileInfoProviders.JarManifestVersionInfoProvider(),
                new FileInfoProviders.JarCertificateInfoProvider());
    }

    public SignatureService(VersionInfoProvider versionInfoProvider, CertificateInfoProvider certificateInfoProvider) {
        this.versionInfoProvider = Objects.requireNonNull(versionInfoProvider, "versionInfoProvider");
        this.certificateInfoProvider = Objects.requireNonNull(certificateInfoProvider, "certificateInfoProvider");
    }

    /**
     * Opções de uma execução. Padrões: não recursivo, sem ocultos, sem blocos
     * de versão/certificado, sem exposição do root, os quatro algoritmos.
     */
    public static final class Options {
        private final boolean recurse;
        private final boolean includeHiddenAndSystem;
        private final boolean includeVersionData;
        private final boolean includeCertificateData;
        private final boolean includeRootPath;
        private final Set<HashAlgorithm> algorithms;
        private final int workers;
        private final Duration runTimeout;
        private final ProgressListener progressListener;

        private Options(Builder b) {
            this.recurse = b.recurse;
            this.includeHiddenAndSystem = b.includeHiddenAndSystem;
            this.includeVersionData = b.includeVersionData;
            this.includeCertificateData = b.includeCertificateData;
            this.includeRootPath = b.includeRootPath;
            if (b.algorithms.isEmpty()) {
                throw new IllegalArgumentException("Pelo menos um algoritmo é obrigatório");
            }
            this.algorithms = EnumSet.copyOf(b.algorithms);
            if (b.workers < 1) {
                throw new IllegalArgumentException("workers deve ser >= 1");
            }
            this.workers = b.workers;
            this.runTimeout = b.runTimeout;
            this.progressListener = b.progressListener != null ? b.progressListener : ProgressListener.none();
        }

        public static Builder builder() {
            return new Builder();
        }

        public boolean recurse() { return recurse; }
        public boolean includeHiddenAndSystem() { return includeHiddenAndSystem; }
        public boolean includeVersionData() { return includeVersionData; }
        public boolean includeCertificateData() { return includeCertificateData; }
        public boolean includeRootPath() { return includeRootPath; }
        public Set<HashAlgorithm> algorithms() { return EnumSet.copyOf(algorithms); }
        public int workers() { return workers; }
        public Optional<Duration> runTimeout() { return Optional.ofNullable(runTimeout); }
        public ProgressListener progressListener() { return progressListener; }

        public static final class Builder {
            private boolean recurse;
            private boolean includeHiddenAndSystem;
            private boolean includeVersionData;
            private boolean includeCertificateData;
            private boolean includeRootPath;
            private Set<HashAlgorithm> algorithms = EnumSet.allOf(HashAlgorithm.class);
            private int workers = Math.max(1, Runtime.getRuntime().availableProcessors());
            private Duration runTimeout;
            private ProgressListener progressListener;

            public Builder recurse(boolean v) { this.recurse = v; return this; }
            public Builder includeHiddenAndSystem(boolean v) { this.includeHiddenAndSystem = v; return this; }
            public Builder includeVersionData(boolean v) { this.includeVersionData = v; return this; }
            public Builder includeCertificateData(boolean v) { this.includeCertificateData = v; return this; }
            public Builder includeRootPath(boolean v) { this.includeRootPath = v; return this; }
            public Builder algorithms(Set<HashAlgorithm> v) { this.algorithms = EnumSet.copyOf(Objects.requireNonNull(v, "algorithms")); return this; }
            public Builder workers(int v) { this.workers = v; return this; }
            public Builder runTimeout(Duration v) { this.runTimeout = v; return this; }
            public Builder progressListener(ProgressListener v) { this.progressListener = v; return this; }
            public Options build() { return new Options(this); }
        }
    }

    /**
     * Resultado de uma execução: registros (ordem da enumeração), indicador
     * de execução parcial (cancelada/timeout) e estatísticas.
     */
    public static final class SignatureRun {
        private final List<SignatureRecord> records;
        private final boolean partial;
        private final RunStatistics statistics;

        public SignatureRun(List<SignatureRecord> records, boolean partial, RunStatistics statistics) {
            this.records = List.copyOf(Objects.requireNonNull(records, "records"));
            this.partial = partial;
            this.statistics = Objects.requireNonNull(statistics, "statistics");
        }

        public List<SignatureRecord> records() { return records; }
        public boolean partial() { return partial; }
        public RunStatistics statistics() { return statistics; }
    }

    /** Arquivo enumerado + root sob o qual foi encontrado. */
    private static final class WorkItem {
        final FileEntry entry;
        final Path root;

        WorkItem(FileEntry entry, Path root) {
            this.entry = entry;
            this.root = root;
        }
    }

    /**
     * Assinatura "clássica": caminhos como string e flags.
     */
    public SignatureRun computeSignatures(List<String> paths,
                                          boolean recurse,
                                          boolean includeHiddenAndSystem,
                                          boolean includeVersionData,
                                          boolean includeCertificateData,
                                          boolean includeRootPath) {
        Objects.requireNonNull(paths, "paths");
        Options options = Options.builder()
                .recurse(recurse)
                .includeHiddenAndSystem(includeHiddenAndSystem)
                .includeVersionData(includeVersionData)
                .includeCertificateData(includeCertificateData)
                .includeRootPath(includeRootPath)
                .build();
        return computeSignatures(toPaths(paths), options, new RunContext());
    }

    public SignatureRun computeSignatures(List<Path> paths, Options options) {
        Objects.requireNonNull(options, "options");
        return computeSignatures(paths, options, new RunContext(options.runTimeout().orElse(null)));
    }

    /**
     * Executa com um {@link RunContext} do caller (permite cancelar de outra thread).
     *
     * @throws IllegalArgumentException se nenhum caminho informado existir
     */
    public SignatureRun computeSignatures(List<Path> paths, Options options, RunContext context) {
        Objects.requireNonNull(paths, "paths");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(context, "context");

        DigestEngine engine = new DigestEngine(options.algorithms());
        SignatureBuilder builder = new SignatureBuilder(options.includeRootPath(), context);
        ScanService scanner = new ScanService(options.recurse(), options.includeHiddenAndSystem());

        List<Path> validPaths = new ArrayList<>();
        for (Path path : paths) {
            if (path != null && Files.exists(path)) {
                validPaths.add(path.toAbsolutePath().normalize());
            } else {
                log.warn("Caminho não encontrado ou inacessível, ignorando: {}", path);
            }
        }
        if (validPaths.isEmpty()) {
            throw new IllegalArgumentException("Nenhum caminho válido para calcular assinaturas");
        }

        log.info("Calculando assinaturas: caminhos={}, algoritmos={}, workers={}, recursivo={}",
                validPaths.size(), options.algorithms(), options.workers(), options.recurse());

        List<SignatureRecord> records = new ArrayList<>();
        boolean partial = false;
        ExecutorService pool = Executors.newFixedThreadPool(options.workers());
        try {
            for (Path path : validPaths) {
                if (context.isCancelled()) {
                    partial = true;
                    break;
                }
                List<WorkItem> items = enumerate(path, scanner, context);
                partial |= processRoot(path, items, engine, builder, options, context, pool, records);
            }
        } finally {
            pool.shutdownNow();
        }

        partial |= context.isCancelled();
        RunStatistics statistics = context.statistics();
        log.info("Assinaturas concluídas: {}{}", statistics, partial ? " (PARCIAL)" : "");
        return new SignatureRun(records, partial, statistics);
    }

    /**
     * Diretório -> enumerador; arquivo avulso -> uma entrada com o diretório pai como root.
     */
    private List<WorkItem> enumerate(Path path, ScanService scanner, RunContext context) {
        List<WorkItem> items = new ArrayList<>();
        try {
            if (Files.isDirectory(path)) {
                ScanConsumer warnings = new ScanConsumer() {
                    @Override
                    public void onFileFound(FileEntry entry) {
                        // não usado: list() acumula os arquivos
                    }

                    @Override
                    public void onError(Path failed, String message, IOException exc) {
                        log.warn("{}: {} ({})", message, failed, exc != null ? exc.getMessage() : "");
                    }
                };
                for (FileEntry entry : scanner.list(path, warnings)) {
                    items.add(new WorkItem(entry, path));
                }
            } else {
                Path parent = path.getParent() != null ? path.getParent() : path;
                items.add(new WorkItem(FileEntry.of(path), parent));
            }
        } catch (IOException e) {
            log.warn("Falha ao enumerar {}: {}", path, e.getMessage());
            context.incrementSkipped();
        }
        return items;
    }

    /**
     * Filtra, calcula o volume total do root, distribui o hash no pool e
     * recolhe na ordem. Retorna true se a execução ficou parcial.
     */
    private boolean processRoot(Path root,
                                List<WorkItem> items,
                                DigestEngine engine,
                                SignatureBuilder builder,
                                Options options,
                                RunContext context,
                                ExecutorService pool,
                                List<SignatureRecord> sink) {
        List<WorkItem> hashable = new ArrayList<>(items.size());
        long totalBytes = 0;
        for (WorkItem item : items) {
            FileEntry entry = item.entry;
            if (entry.isHashable()) {
                hashable.add(item);
                totalBytes += entry.sizeBytes();
            } else if (entry.sizeBytes() == 0 && entry.isReadable() && Files.exists(entry.fullPath())) {
                log.warn("Arquivo vazio (0 bytes), ignorando: {}", entry.fullPath());
                context.incrementSkipped();
            } else {
                log.warn("Arquivo inexistente ou inacessível, ignorando: {}", entry.fullPath());
                context.incrementSkipped();
            }
        }

        ProgressEstimator progress = new ProgressEstimator(root.toString(), totalBytes,
                engine.algorithms().size(), options.progressListener());

        boolean partial = false;
        List<Future<SignatureRecord>> futures = new ArrayList<>(hashable.size());
        for (WorkItem item : hashable) {
            if (context.isCancelled()) {
                partial = true;
                break;
            }
            futures.add(pool.submit(() -> signFile(item, engine, builder, options, context, progress)));
        }

        for (Future<SignatureRecord> future : futures) {
            try {
                SignatureRecord record = future.get();
                if (record != null) {
                    sink.add(record);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                partial = true;
                break;
            } catch (ExecutionException e) {
                log.warn("Falha inesperada ao processar arquivo: {}", String.valueOf(e.getCause()));
                context.incrementSkipped();
            }
        }

        if (!partial) {
            progress.complete();
        }
        return partial;
    }

    /**
     * Tarefa de um worker. Falhas deste arquivo viram aviso e null; nunca
     * derrubam o lote.
     */
    private SignatureRecord signFile(WorkItem item,
                                     DigestEngine engine,
                                     SignatureBuilder builder,
                                     Options options,
                                     RunContext context,
                                     ProgressEstimator progress) {
        FileEntry entry = item.entry;
        if (context.isCancelled()) {
            return null;
        }

        Map<HashAlgorithm, String> digests;
        try {
            digests = engine.digest(entry.fullPath());
        } catch (IOException | SecurityException e) {
            log.warn("Falha ao calcular hash de {}: {}", entry.fullPath(), e.getMessage());
            context.incrementSkipped();
            return null;
        }
        for (HashAlgorithm algorithm : digests.keySet()) {
            progress.recordDigestPhase(entry.sizeBytes(), algorithm.name());
        }

        Optional<VersionInfo> versionInfo = Optional.empty();
        Optional<CertificateInfo> certificateInfo = Optional.empty();
        if (options.includeVersionData()) {
            versionInfo = readOptional(() -> versionInfoProvider.versionInfo(entry.fullPath()), "versão", entry);
        }
        if (options.includeCertificateData()) {
            certificateInfo = readOptional(() -> certificateInfoProvider.certificateInfo(entry.fullPath()), "certificado", entry);
        }
        progress.recordMetadataPhase(entry.sizeBytes());

        NormalizedPath normalized = PathNormalizer.normalize(entry.fullPath(), item.root);
        return builder.build(entry, normalized, digests, versionInfo, certificateInfo);
    }

    @FunctionalInterface
    private interface IoSupplier<T> {
        T get() throws IOException;
    }

    /** Bloco opcional que falha não invalida a assinatura: vira ausente + aviso. */
    private static <T> Optional<T> readOptional(IoSupplier<Optional<T>> supplier, String what, FileEntry entry) {
        try {
            return supplier.get();
        } catch (IOException | RuntimeException e) {
            log.warn("Falha ao ler informações de {} de {}: {}", what, entry.fullPath(), e.getMessage());
            return Optional.empty();
        }
    }

    private static List<Path> toPaths(List<String> raw) {
        List<Path> paths = new ArrayList<>(raw.size());
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                paths.add(Path.of(value.trim()));
            } catch (InvalidPathException e) {
                log.warn("Caminho inválido, ignorando: {}", value);
            }
        }
        return paths;
    }
}

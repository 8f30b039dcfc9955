package com.example.signatureagent;

import com.example.signatureagent.config.AppConfig;
import com.example.signatureagent.config.AppConfig.Mode;
import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.export.RowExport;
import com.example.signatureagent.export.RowExport.OutputRow;
import com.example.signatureagent.export.RowExport.RowWriter;
import com.example.signatureagent.progress.ProgressEstimator.ProgressListener;
import com.example.signatureagent.repository.RepositoryModule.LookupResult;
import com.example.signatureagent.repository.RepositoryModule.LookupService;
import com.example.signatureagent.repository.RepositoryModule.RepositoryClient;
import com.example.signatureagent.signature.Signatures.RunContext;
import com.example.signatureagent.signature.Signatures.SignatureRecord;
import com.example.signatureagent.signature.SignatureService;
import com.example.signatureagent.signature.SignatureService.Options;
import com.example.signatureagent.signature.SignatureService.SignatureRun;
import com.example.signatureagent.verify.Verification.MatchedRecord;
import com.example.signatureagent.verify.Verification.ReferenceMatcher;
import com.example.signatureagent.verify.Verification.ReferenceReader;
import com.example.signatureagent.verify.Verification.ReferenceRecord;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Entrada headless do agente. Lê a configuração, executa o modo pedido
 * (compute, verify, lookup ou template) e grava as linhas em arquivo ou stdout.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private final AppConfig config;
    private final SignatureService signatureService;
    private final OutputStream stdout;

    public Main() {
        this(AppConfig.load(), new SignatureService(), System.out);
    }

    Main(AppConfig config, SignatureService signatureService, OutputStream stdout) {
        this.config = Objects.requireNonNull(config, "config");
        this.signatureService = Objects.requireNonNull(signatureService, "signatureService");
        this.stdout = Objects.requireNonNull(stdout, "stdout");
    }

    public static void main(String[] args) throws Exception {
        new Main().run();
    }

    public void run() throws IOException {
        LOGGER.info(() -> "Configuração: " + config);
        List<OutputRow> rows = produceRows();

        RowWriter writer = RowWriter.forFormat(config.outputFormat());
        Path output = config.outputFile().orElse(null);
        if (output != null) {
            writer.write(rows, output);
            LOGGER.info(() -> "Saída gravada em " + output + " (" + rows.size() + " linhas)");
        } else {
            RowExport.writeToStream(writer, rows, stdout);
        }
    }

    List<OutputRow> produceRows() throws IOException {
        Mode mode = config.mode();
        LOGGER.info(() -> "Modo: " + mode);
        switch (mode) {
            case TEMPLATE:
                return List.of(ReferenceMatcher.emptyReferenceTemplate().toRow());
            case VERIFY:
                return verify();
            case LOOKUP:
                return lookup();
            case COMPUTE:
            default:
                return toRows(compute(config.algorithms(), new RunContext(config.runTimeout().orElse(null))).records());
        }
    }

    private List<OutputRow> verify() throws IOException {
        Path referenceFile = config.referenceFile()
                .orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + AppConfig.SIGNATURE_REFERENCE_FILE));
        // referência é lida antes do hash: arquivo ruim falha cedo
        List<ReferenceRecord> references = new ReferenceReader().read(referenceFile);
        SignatureRun run = compute(config.algorithms(), new RunContext(config.runTimeout().orElse(null)));

        List<MatchedRecord> matched = new ReferenceMatcher(config.missingPlaceholder()).verify(run.records(), references);
        List<OutputRow> rows = new ArrayList<>(matched.size());
        for (MatchedRecord record : matched) {
            rows.add(record.toRow());
        }
        return rows;
    }

    private List<OutputRow> lookup() {
        Set<HashAlgorithm> repositoryAlgorithms = config.repositoryAlgorithms();
        // garante que os digests consultados sejam calculados
        Set<HashAlgorithm> algorithms = EnumSet.copyOf(config.algorithms());
        algorithms.addAll(repositoryAlgorithms);

        RunContext context = new RunContext(config.runTimeout().orElse(null));
        SignatureRun run = compute(algorithms, context);

        RepositoryClient client = new RepositoryClient(config.repositoryUri(), config.repositoryTimeout());
        LookupResult result = new LookupService(client, config.repositoryConcurrency())
                .lookup(run.records(), repositoryAlgorithms, context);
        if (result.partial()) {
            LOGGER.warning("Consulta ao repositório interrompida; resultado parcial.");
        }
        return result.rows();
    }

    private SignatureRun compute(Set<HashAlgorithm> algorithms, RunContext context) {
        List<String> paths = config.paths();
        if (paths.isEmpty()) {
            throw new IllegalStateException("Configuração obrigatória ausente: " + AppConfig.SIGNATURE_PATHS);
        }
        List<Path> resolved = new ArrayList<>(paths.size());
        for (String path : paths) {
            resolved.add(Path.of(path));
        }

        Options options = Options.builder()
                .recurse(config.recurse())
                .includeHiddenAndSystem(config.includeHiddenAndSystem())
                .includeVersionData(config.includeVersionData())
                .includeCertificateData(config.includeCertificateData())
                .includeRootPath(config.includeRootPath())
                .algorithms(algorithms)
                .workers(config.workers())
                .progressListener(ProgressListener.logging(10))
                .build();

        SignatureRun run = signatureService.computeSignatures(resolved, options, context);
        if (run.partial()) {
            LOGGER.warning(() -> "Execução interrompida (cancelada ou timeout); " + run.records().size() + " assinaturas parciais.");
        }
        return run;
    }

    private static List<OutputRow> toRows(List<SignatureRecord> records) {
        List<OutputRow> rows = new ArrayList<>(records.size());
        for (SignatureRecord record : records) {
            rows.add(record.toRow());
        }
        return rows;
    }
}

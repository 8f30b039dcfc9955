package com.example.signatureagent.verify;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.export.RowExport.OutputFormat;
import com.example.signatureagent.export.RowExport.OutputRow;
import com.example.signatureagent.signature.Signatures.SignatureRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Agrega os tipos da verificação local contra assinaturas de referência.
 */
public final class Verification {

    private Verification() {}

    public static final String DEFAULT_MISSING_PLACEHOLDER = "N/A";

    /**
     * Assinatura de referência: nome do arquivo + zero ou mais digests.
     *
     * Algoritmo ausente do mapa = "não informado"; presente com string vazia =
     * "informado, mas vazio". Os dois casos resultam em MISSING no matching.
     */
    public static final class ReferenceRecord {
        private final String filename;
        private final Map<HashAlgorithm, String> digests;

        public ReferenceRecord(String filename, Map<HashAlgorithm, String> digests) {
            this.filename = Objects.requireNonNull(filename, "filename");
            Map<HashAlgorithm, String> copy = new EnumMap<>(HashAlgorithm.class);
            if (digests != null) {
                digests.forEach((algorithm, value) -> copy.put(algorithm, value != null ? value.trim() : ""));
            }
            this.digests = Collections.unmodifiableMap(copy);
        }

        public String filename() { return filename; }
        public Map<HashAlgorithm, String> digests() { return digests; }

        /** Digest informado para o algoritmo (pode ser string vazia). */
        public Optional<String> digest(HashAlgorithm algorithm) {
            return Optional.ofNullable(digests.get(algorithm));
        }

        /** Informado e não vazio. */
        public boolean supplies(HashAlgorithm algorithm) {
            String value = digests.get(algorithm);
            return value != null && !value.isEmpty();
        }

        /** Linha com o schema de referência (Filename + uma coluna por algoritmo). */
        public OutputRow toRow() {
            OutputRow.Builder row = OutputRow.builder().put("Filename", filename);
            for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                row.put(algorithm.columnName(), digests.getOrDefault(algorithm, ""));
            }
            return row.build();
        }

        @Override
        public String toString() {
            return "ReferenceRecord{" + filename + ", " + digests.keySet() + "}";
        }
    }

    /** Estado tri-valorado por algoritmo. */
    public enum MatchState {
        MATCHED,
        MISMATCHED,
        MISSING
    }

    /**
     * Resultado de um algoritmo. MATCHED/MISMATCHED viram "true"/"false";
     * MISSING vira o placeholder configurado.
     */
    public static final class MatchResult {
        private final MatchState state;
        private final String placeholder;

        private MatchResult(MatchState state, String placeholder) {
            this.state = Objects.requireNonNull(state, "state");
            this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
        }

        public static MatchResult compare(String computed, String reference, String placeholder) {
            if (computed == null || computed.isEmpty() || reference == null || reference.isEmpty()) {
                return missing(placeholder);
            }
            boolean equal = computed.equalsIgnoreCase(reference);
            return new MatchResult(equal ? MatchState.MATCHED : MatchState.MISMATCHED, placeholder);
        }

        public static MatchResult missing(String placeholder) {
            return new MatchResult(MatchState.MISSING, placeholder);
        }

        public MatchState state() { return state; }

        /** true/false quando houve comparação; vazio quando MISSING. */
        public Optional<Boolean> matched() {
            return state == MatchState.MISSING
                    ? Optional.empty()
                    : Optional.of(state == MatchState.MATCHED);
        }

        public String render() {
            return matched().map(String::valueOf).orElse(placeholder);
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * Assinatura + resultado por algoritmo. Sempre traz os quatro algoritmos.
     */
    public static final class MatchedRecord {
        private final SignatureRecord signature;
        private final Map<HashAlgorithm, MatchResult> results;

        public MatchedRecord(SignatureRecord signature, Map<HashAlgorithm, MatchResult> results) {
            this.signature = Objects.requireNonNull(signature, "signature");
            this.results = Collections.unmodifiableMap(new EnumMap<>(Objects.requireNonNull(results, "results")));
        }

        public SignatureRecord signature() { return signature; }
        public Map<HashAlgorithm, MatchResult> results() { return results; }

        public MatchResult result(HashAlgorithm algorithm) {
            return results.get(algorithm);
        }

        /** Colunas da assinatura seguidas de "&lt;Algo&gt;HashMatch". */
        public OutputRow toRow() {
            OutputRow.Builder row = signature.toRow().toBuilder();
            for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                MatchResult result = results.get(algorithm);
                row.put(algorithm.columnName() + "Match", result != null ? result.render() : "");
            }
            return row.build();
        }
    }

    /**
     * Compara assinaturas calculadas com assinaturas de referência pelo nome do arquivo.
     *
     * Política:
     * - nome comparado sem diferenciar maiúsculas (Locale.ROOT);
     * - nomes duplicados na referência: vale o primeiro na ordem de entrada
     *   (aviso uma vez por nome);
     * - digests comparados sem diferenciar maiúsculas;
     * - uma linha de saída por assinatura, na ordem de entrada.
     */
    public static final class ReferenceMatcher {

        private static final Logger log = LoggerFactory.getLogger(ReferenceMatcher.class);

        private final String placeholder;

        public ReferenceMatcher() {
            this(DEFAULT_MISSING_PLACEHOLDER);
        }

        public ReferenceMatcher(String placeholder) {
            this.placeholder = placeholder != null ? placeholder : DEFAULT_MISSING_PLACEHOLDER;
        }

        public String placeholder() {
            return placeholder;
        }

        public List<MatchedRecord> verify(List<SignatureRecord> signatures, List<ReferenceRecord> references) {
            Objects.requireNonNull(signatures, "signatures");
            Objects.requireNonNull(references, "references");

            Map<String, ReferenceRecord> byName = indexByFilename(references);
            List<MatchedRecord> out = new ArrayList<>(signatures.size());
            for (SignatureRecord signature : signatures) {
                ReferenceRecord reference = byName.get(key(signature.filename()));
                out.add(match(signature, reference));
            }

            long matchedFiles = out.stream()
                    .filter(m -> m.results().values().stream().anyMatch(r -> r.state() == MatchState.MATCHED))
                    .count();
            log.info("Verificação concluída: assinaturas={}, referências={}, com algum digest conferido={}",
                    signatures.size(), references.size(), matchedFiles);
            return out;
        }

        /**
         * Compara uma assinatura com sua referência (null = sem referência).
         */
        public MatchedRecord match(SignatureRecord signature, ReferenceRecord reference) {
            Map<HashAlgorithm, MatchResult> results = new EnumMap<>(HashAlgorithm.class);
            for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                if (reference == null || !reference.supplies(algorithm)) {
                    results.put(algorithm, MatchResult.missing(placeholder));
                } else {
                    results.put(algorithm, MatchResult.compare(
                            signature.digest(algorithm).orElse(null),
                            reference.digest(algorithm).orElse(null),
                            placeholder));
                }
            }
            return new MatchedRecord(signature, results);
        }

        /**
         * Registro de referência com todos os campos em branco, para descobrir/
         * exportar o conjunto de colunas esperado sem dados reais.
         */
        public static ReferenceRecord emptyReferenceTemplate() {
            Map<HashAlgorithm, String> blanks = new EnumMap<>(HashAlgorithm.class);
            for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                blanks.put(algorithm, "");
            }
            return new ReferenceRecord("", blanks);
        }

        private Map<String, ReferenceRecord> indexByFilename(List<ReferenceRecord> references) {
            Map<String, ReferenceRecord> byName = new HashMap<>();
            Set<String> warned = new LinkedHashSet<>();
            for (ReferenceRecord reference : references) {
                String key = key(reference.filename());
                if (byName.putIfAbsent(key, reference) != null && warned.add(key)) {
                    log.warn("Referência duplicada para '{}': usando a primeira ocorrência", reference.filename());
                }
            }
            return byName;
        }

        private static String key(String filename) {
            return filename.trim().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Carrega referências de um arquivo JSON (array de objetos) ou CSV com
     * cabeçalho. Colunas aceitas (sem diferenciar maiúsculas): Filename e, por
     * algoritmo, "MD5" ou "MD5Hash" (idem SHA1/SHA256/SHA512). Colunas
     * desconhecidas são ignoradas; coluna ausente = digest não informado.
     */
    public static final class ReferenceReader {

        private static final Logger log = LoggerFactory.getLogger(ReferenceReader.class);
        private static final String BOM = "\uFEFF";

        private final ObjectMapper jsonMapper = new ObjectMapper();
        private final CsvMapper csvMapper = new CsvMapper();

        public List<ReferenceRecord> read(Path file) throws IOException {
            Objects.requireNonNull(file, "file");
            if (!Files.isRegularFile(file)) {
                throw new IOException("Arquivo de referência não encontrado: " + file);
            }
            List<ReferenceRecord> records = OutputFormat.fromFileName(file) == OutputFormat.JSON
                    ? readJson(file)
                    : readCsv(file);
            log.info("Referências carregadas de {}: {}", file, records.size());
            return records;
        }

        List<ReferenceRecord> readJson(Path file) throws IOException {
            JsonNode root;
            try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                root = jsonMapper.readTree(in);
            }
            List<ReferenceRecord> records = new ArrayList<>();
            if (root == null || root.isMissingNode() || root.isNull()) {
                return records;
            }
            Iterable<JsonNode> nodes = root.isArray() ? root : List.of(root);
            for (JsonNode node : nodes) {
                if (!node.isObject()) {
                    log.warn("Entrada de referência ignorada (não é objeto): {}", node);
                    continue;
                }
                Map<String, String> fields = new HashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> field = it.next();
                    JsonNode value = field.getValue();
                    fields.put(field.getKey(), value == null || value.isNull() ? null : value.asText());
                }
                toRecord(fields).ifPresent(records::add);
            }
            return records;
        }

        List<ReferenceRecord> readCsv(Path file) throws IOException {
            CsvSchema schema = CsvSchema.emptySchema().withHeader();
            List<ReferenceRecord> records = new ArrayList<>();
            try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                 MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class).with(schema).readValues(in)) {
                while (it.hasNext()) {
                    toRecord(it.next()).ifPresent(records::add);
                }
            }
            return records;
        }

        /** Nome de coluna comparável; remove BOM UTF-8 (CSV salvo pelo Excel). */
        static String columnKey(String name) {
            if (name == null) {
                return "";
            }
            String key = name.startsWith(BOM) ? name.substring(1) : name;
            return key.trim().toUpperCase(Locale.ROOT);
        }

        private Optional<ReferenceRecord> toRecord(Map<String, String> fields) {
            String filename = null;
            Map<HashAlgorithm, String> digests = new EnumMap<>(HashAlgorithm.class);
            for (Map.Entry<String, String> field : fields.entrySet()) {
                String column = columnKey(field.getKey());
                if (column.equals("FILENAME")) {
                    filename = field.getValue();
                    continue;
                }
                for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                    if (column.equals(algorithm.name()) || column.equals(algorithm.columnName().toUpperCase(Locale.ROOT))) {
                        // null (JSON) = não informado; "" = informado vazio
                        if (field.getValue() != null) {
                            digests.put(algorithm, field.getValue());
                        }
                    }
                }
            }
            if (filename == null || filename.isBlank()) {
                log.warn("Entrada de referência sem Filename ignorada: {}", fields.keySet());
                return Optional.empty();
            }
            return Optional.of(new ReferenceRecord(filename.trim(), digests));
        }
    }
}

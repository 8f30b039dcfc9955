package com.example.signatureagent.repository;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.export.RowExport.OutputRow;
import com.example.signatureagent.signature.Signatures.RunContext;
import com.example.signatureagent.signature.Signatures.SignatureRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Consulta a um repositório remoto de assinaturas e fusão das respostas nas
 * linhas de saída.
 *
 * Protocolo: GET {rootUri}{digestHex}; HTTP 200 devolve um array JSON de
 * objetos planos (zero ou mais correspondências).
 */
public final class RepositoryModule {

    private RepositoryModule() {}

    public static final String DEFAULT_ROOT_URI = "https://validate.whitescope.io/api/v1/json/";
    public static final Set<HashAlgorithm> DEFAULT_ALGORITHMS = Collections.unmodifiableSet(EnumSet.of(HashAlgorithm.MD5));
    public static final int DEFAULT_CONCURRENCY = 4;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String ATTRIBUTE_PREFIX = "Repository";
    static final String HASH_ALGORITHM_COLUMN = ATTRIBUTE_PREFIX + "HashAlgorithm";

    /**
     * Consulta com os valores padrão (concorrência 4, timeout 30s).
     */
    public static LookupResult lookupRepository(List<SignatureRecord> signatures,
                                                String rootUri,
                                                Set<HashAlgorithm> algorithms) {
        RepositoryClient client = new RepositoryClient(rootUri != null ? rootUri : DEFAULT_ROOT_URI, DEFAULT_TIMEOUT);
        return new LookupService(client, DEFAULT_CONCURRENCY)
                .lookup(signatures, algorithms != null ? algorithms : DEFAULT_ALGORITHMS);
    }

    /**
     * Uma correspondência devolvida pelo repositório para (arquivo, algoritmo).
     * Atributos na ordem em que vieram no JSON.
     */
    public record RepositoryMatch(String filename, HashAlgorithm algorithm, Map<String, String> attributes) {
        public RepositoryMatch {
            Objects.requireNonNull(filename, "filename");
            Objects.requireNonNull(algorithm, "algorithm");
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(
                    attributes != null ? attributes : Map.of()));
        }
    }

    /**
     * Cliente HTTP do repositório.
     */
    public static final class RepositoryClient {

        private static final Logger log = LoggerFactory.getLogger(RepositoryClient.class);

        private final String rootUri;
        private final OkHttpClient httpClient;
        private final ObjectMapper mapper = new ObjectMapper();

        public RepositoryClient(String rootUri, Duration timeout) {
            this(rootUri, defaultClient(timeout));
        }

        /**
         * Construtor permitindo injetar um OkHttpClient (útil para testes).
         */
        public RepositoryClient(String rootUri, OkHttpClient httpClient) {
            this.rootUri = Objects.requireNonNull(rootUri, "rootUri");
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            if (HttpUrl.parse(rootUri) == null) {
                throw new IllegalArgumentException("URI do repositório inválida: " + rootUri);
            }
        }

        private static OkHttpClient defaultClient(Duration timeout) {
            Duration t = timeout != null ? timeout : DEFAULT_TIMEOUT;
            return new OkHttpClient.Builder()
                    .callTimeout(t)
                    .connectTimeout(t)
                    .readTimeout(t)
                    .writeTimeout(t)
                    .build();
        }

        public String rootUri() {
            return rootUri;
        }

        /**
         * Consulta um digest. Lista vazia = nenhuma correspondência.
         *
         * @throws IOException em falha de transporte, HTTP diferente de 200 ou JSON inválido
         */
        public List<RepositoryMatch> lookup(String filename, HashAlgorithm algorithm, String digest) throws IOException {
            Objects.requireNonNull(algorithm, "algorithm");
            if (digest == null || digest.isBlank()) {
                throw new IllegalArgumentException("digest vazio");
            }
            HttpUrl url = HttpUrl.parse(rootUri + digest.trim());
            if (url == null) {
                throw new IOException("URL de consulta inválida: " + rootUri + digest);
            }

            Request request = new Request.Builder()
                    .url(url)
                    .header("Accept", "application/json")
                    .get()
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                int code = response.code();
                if (code != 200) {
                    throw new IOException("Repositório respondeu HTTP " + code + " para " + algorithm + " " + digest);
                }
                ResponseBody body = response.body();
                String bodyString = body != null ? body.string() : "";
                List<RepositoryMatch> matches = parseMatches(filename, algorithm, bodyString);
                log.debug("Repositório: {} {} -> {} correspondência(s)", algorithm, digest, matches.size());
                return matches;
            }
        }

        List<RepositoryMatch> parseMatches(String filename, HashAlgorithm algorithm, String body) throws IOException {
            List<RepositoryMatch> matches = new ArrayList<>();
            if (body == null || body.isBlank()) {
                return matches;
            }
            JsonNode root;
            try {
                root = mapper.readTree(body);
            } catch (Exception e) {
                throw new IOException("Falha ao decodificar resposta do repositório", e);
            }
            if (root == null || root.isNull() || root.isMissingNode()) {
                return matches;
            }
            // objeto único conta como array de um elemento
            Iterable<JsonNode> elements = root.isArray() ? root : List.of(root);
            for (JsonNode element : elements) {
                if (!element.isObject()) {
                    log.warn("Elemento ignorado na resposta do repositório (não é objeto): {}", element);
                    continue;
                }
                Map<String, String> attributes = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    attributes.put(field.getKey(), render(field.getValue()));
                }
                matches.add(new RepositoryMatch(filename != null ? filename : "", algorithm, attributes));
            }
            return matches;
        }

        private static String render(JsonNode value) {
            if (value == null || value.isNull()) {
                return "";
            }
            // valores aninhados viram o próprio texto JSON
            return value.isValueNode() ? value.asText() : value.toString();
        }
    }

    /**
     * Projeta correspondências do repositório nas linhas de assinatura.
     */
    public static final class ResultMerger {

        private ResultMerger() {}

        /** "sha256" -> "RepositorySha256"; "FileName" -> "RepositoryFileName". */
        public static String attributeColumn(String key) {
            if (key == null || key.isEmpty()) {
                return ATTRIBUTE_PREFIX;
            }
            return ATTRIBUTE_PREFIX + key.substring(0, 1).toUpperCase(Locale.ROOT) + key.substring(1);
        }

        /** Uma linha por correspondência; lista vazia quando não houve nenhuma. */
        public static List<OutputRow> merge(SignatureRecord signature, List<RepositoryMatch> matches) {
            Objects.requireNonNull(signature, "signature");
            List<OutputRow> rows = new ArrayList<>(matches.size());
            OutputRow base = signature.toRow();
            for (RepositoryMatch match : matches) {
                OutputRow.Builder row = base.toBuilder();
                match.attributes().forEach((key, value) -> row.put(attributeColumn(key), value));
                // o algoritmo consultado prevalece sobre um atributo homônimo
                row.put(HASH_ALGORITHM_COLUMN, match.algorithm().name());
                rows.add(row.build());
            }
            return rows;
        }
    }

    /**
     * Resultado consolidado: linhas com correspondência seguidas das linhas
     * sem correspondência.
     */
    public static final class LookupResult {
        private final List<OutputRow> matched;
        private final List<OutputRow> noMatch;
        private final int requests;
        private final int failures;
        private final boolean partial;

        public LookupResult(List<OutputRow> matched, List<OutputRow> noMatch, int requests, int failures, boolean partial) {
            this.matched = List.copyOf(matched);
            this.noMatch = List.copyOf(noMatch);
            this.requests = requests;
            this.failures = failures;
            this.partial = partial;
        }

        public List<OutputRow> matched() { return matched; }
        public List<OutputRow> noMatch() { return noMatch; }
        public int requests() { return requests; }
        public int failures() { return failures; }
        public boolean partial() { return partial; }

        public List<OutputRow> rows() {
            List<OutputRow> all = new ArrayList<>(matched.size() + noMatch.size());
            all.addAll(matched);
            all.addAll(noMatch);
            return all;
        }
    }

    /**
     * Dispara as consultas (registro, algoritmo) num pool limitado e agrega os
     * resultados na ordem de entrada: índice do registro, depois ordem do
     * algoritmo, depois ordem da correspondência. Falhas viram "sem
     * correspondência" e nunca interrompem a execução.
     */
    public static final class LookupService {

        private static final Logger log = LoggerFactory.getLogger(LookupService.class);

        private final RepositoryClient client;
        private final int concurrency;

        public LookupService(RepositoryClient client, int concurrency) {
            this.client = Objects.requireNonNull(client, "client");
            if (concurrency < 1) {
                throw new IllegalArgumentException("concorrência deve ser >= 1: " + concurrency);
            }
            this.concurrency = concurrency;
        }

        public LookupResult lookup(List<SignatureRecord> signatures, Set<HashAlgorithm> algorithms) {
            return lookup(signatures, algorithms, new RunContext());
        }

        public LookupResult lookup(List<SignatureRecord> signatures, Set<HashAlgorithm> algorithms, RunContext context) {
            Objects.requireNonNull(signatures, "signatures");
            Objects.requireNonNull(context, "context");
            if (algorithms == null || algorithms.isEmpty()) {
                throw new IllegalArgumentException("Nenhum algoritmo para consulta ao repositório");
            }
            Set<HashAlgorithm> ordered = EnumSet.copyOf(algorithms);

            List<Query> queries = new ArrayList<>();
            for (SignatureRecord signature : signatures) {
                for (HashAlgorithm algorithm : ordered) {
                    String digest = signature.digest(algorithm).orElse("");
                    if (digest.isEmpty()) {
                        log.debug("Sem digest {} para {}, consulta não enviada", algorithm, signature.filename());
                        continue;
                    }
                    queries.add(new Query(signature, algorithm, digest));
                }
            }

            List<OutputRow> matched = new ArrayList<>();
            List<OutputRow> noMatch = new ArrayList<>();
            int failures = 0;
            boolean partial = false;

            if (queries.isEmpty()) {
                log.info("Nenhuma consulta ao repositório a fazer.");
                return new LookupResult(matched, noMatch, 0, 0, false);
            }

            ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, queries.size()));
            List<Callable<Outcome>> tasks = new ArrayList<>(queries.size());
            for (Query query : queries) {
                tasks.add(() -> execute(query, context));
            }
            try {
                List<Future<Outcome>> futures = pool.invokeAll(tasks);
                for (int i = 0; i < futures.size(); i++) {
                    Query query = queries.get(i);
                    Outcome outcome;
                    try {
                        outcome = futures.get(i).get();
                    } catch (ExecutionException e) {
                        log.warn("Consulta {} {} falhou: {}", query.algorithm, query.signature.filename(),
                                String.valueOf(e.getCause()));
                        outcome = Outcome.failed();
                    }
                    if (outcome.skipped) {
                        partial = true;
                        continue;
                    }
                    if (outcome.failed) {
                        failures++;
                    }
                    List<OutputRow> rows = ResultMerger.merge(query.signature, outcome.matches);
                    if (rows.isEmpty()) {
                        noMatch.add(query.signature.toRow());
                    } else {
                        matched.addAll(rows);
                    }
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Consulta ao repositório interrompida; resultado parcial");
                partial = true;
            } finally {
                pool.shutdownNow();
            }

            log.info("Consulta ao repositório concluída: consultas={}, com correspondência={}, sem correspondência={}, falhas={}{}",
                    queries.size(), matched.size(), noMatch.size(), failures, partial ? " (parcial)" : "");
            return new LookupResult(matched, noMatch, queries.size(), failures, partial);
        }

        private Outcome execute(Query query, RunContext context) {
            if (context.isCancelled()) {
                return Outcome.skipped();
            }
            try {
                return Outcome.of(client.lookup(query.signature.filename(), query.algorithm, query.digest));
            } catch (IOException e) {
                log.warn("Falha ao consultar {} {} ({}): {}", query.algorithm, query.digest,
                        query.signature.filename(), e.getMessage());
                return Outcome.failed();
            }
        }

        private static final class Query {
            final SignatureRecord signature;
            final HashAlgorithm algorithm;
            final String digest;

            Query(SignatureRecord signature, HashAlgorithm algorithm, String digest) {
                this.signature = signature;
                this.algorithm = algorithm;
                this.digest = digest;
            }
        }

        private static final class Outcome {
            final List<RepositoryMatch> matches;
            final boolean failed;
            final boolean skipped;

            private Outcome(List<RepositoryMatch> matches, boolean failed, boolean skipped) {
                this.matches = matches;
                this.failed = failed;
                this.skipped = skipped;
            }

            static Outcome of(List<RepositoryMatch> matches) { return new Outcome(matches, false, false); }
            static Outcome failed() { return new Outcome(List.of(), true, false); }
            static Outcome skipped() { return new Outcome(List.of(), false, true); }
        }
    }
}

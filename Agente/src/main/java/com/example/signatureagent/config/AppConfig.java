package com.example.signatureagent.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import com.example.signatureagent.digest.DigestModule.HashAlgorithm;
import com.example.signatureagent.export.RowExport.OutputFormat;
import com.example.signatureagent.repository.RepositoryModule;
import com.example.signatureagent.verify.Verification;

/**
 * AppConfig
 * ----------
 * Carrega, valida e expõe as configurações do agente de assinaturas.
 *
 * PRINCÍPIOS:
 * - Falhar cedo: algoritmo desconhecido ou modo inválido lançam antes de qualquer leitura de arquivo.
 * - Precedência previsível: System properties > variáveis de ambiente > .env.
 * - Métodos tipados com limites (int/long) em vez de parse espalhado pelo código.
 * - toString() seguro, sem explodir quando algo obrigatório falta.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /**
     * Caminhos a processar, separados apenas pelo separador de path da plataforma
     * (':' em POSIX, ';' no Windows), como em CLASSPATH. Vírgulas fazem parte do caminho.
     */
    public static final String SIGNATURE_PATHS = "SIGNATURE_PATHS";
    public static final String SIGNATURE_RECURSE = "SIGNATURE_RECURSE";
    /** Inclui arquivos/diretórios ocultos e de sistema. */
    public static final String SIGNATURE_INCLUDE_HIDDEN = "SIGNATURE_INCLUDE_HIDDEN";
    public static final String SIGNATURE_INCLUDE_VERSION = "SIGNATURE_INCLUDE_VERSION";
    public static final String SIGNATURE_INCLUDE_CERTIFICATE = "SIGNATURE_INCLUDE_CERTIFICATE";
    /** Quando true, FullPath e Root aparecem na saída. Padrão false (sem exposição do root). */
    public static final String SIGNATURE_INCLUDE_ROOT_PATH = "SIGNATURE_INCLUDE_ROOT_PATH";
    /** Lista de algoritmos (MD5, SHA1, SHA256, SHA512). Padrão: todos. */
    public static final String SIGNATURE_ALGORITHMS = "SIGNATURE_ALGORITHMS";
    public static final String SIGNATURE_WORKERS = "SIGNATURE_WORKERS";
    /** Tempo máximo da execução em segundos; 0 = sem limite. */
    public static final String SIGNATURE_RUN_TIMEOUT_SECONDS = "SIGNATURE_RUN_TIMEOUT_SECONDS";
    /** compute | verify | lookup | template. */
    public static final String SIGNATURE_MODE = "SIGNATURE_MODE";
    /** Arquivo de referência (CSV ou JSON) para o modo verify. */
    public static final String SIGNATURE_REFERENCE_FILE = "SIGNATURE_REFERENCE_FILE";
    public static final String SIGNATURE_MISSING_PLACEHOLDER = "SIGNATURE_MISSING_PLACEHOLDER";
    /** Saída; ausente = stdout. */
    public static final String SIGNATURE_OUTPUT_FILE = "SIGNATURE_OUTPUT_FILE";
    /** csv | json. Ausente = deduzido pelo arquivo de saída (csv quando stdout). */
    public static final String SIGNATURE_OUTPUT_FORMAT = "SIGNATURE_OUTPUT_FORMAT";

    /** URL raiz do repositório; o digest é concatenado ao final. */
    public static final String REPOSITORY_URI = "REPOSITORY_URI";
    public static final String REPOSITORY_ALGORITHMS = "REPOSITORY_ALGORITHMS";
    public static final String REPOSITORY_CONCURRENCY = "REPOSITORY_CONCURRENCY";
    public static final String REPOSITORY_TIMEOUT_SECONDS = "REPOSITORY_TIMEOUT_SECONDS";

    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,;\\" + File.pathSeparatorChar + "]");
    private static final Pattern PATH_SEPARATOR = Pattern.compile(Pattern.quote(File.pathSeparator));

    /** Modos de execução do agente. */
    public enum Mode {
        COMPUTE, VERIFY, LOOKUP, TEMPLATE
    }

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados. */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega de três fontes:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente
     * 3) Arquivo .env (se existir; só preenche ausentes)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>(System.getenv());

        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /**
     * Busca valor (overrides > values) e devolve Optional sem brancos.
     */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    /**
     * Busca valor obrigatório; lança IllegalStateException se ausente.
     */
    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. value==null remove.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= GETTERS ESPECÍFICOS =======

    /** Caminhos de entrada; vazio quando não configurado. */
    public List<String> paths() {
        return split(SIGNATURE_PATHS, PATH_SEPARATOR);
    }

    public boolean recurse() {
        return bool(SIGNATURE_RECURSE, false);
    }

    public boolean includeHiddenAndSystem() {
        return bool(SIGNATURE_INCLUDE_HIDDEN, false);
    }

    public boolean includeVersionData() {
        return bool(SIGNATURE_INCLUDE_VERSION, false);
    }

    public boolean includeCertificateData() {
        return bool(SIGNATURE_INCLUDE_CERTIFICATE, false);
    }

    public boolean includeRootPath() {
        return bool(SIGNATURE_INCLUDE_ROOT_PATH, false);
    }

    /**
     * Algoritmos de hash. Nome desconhecido lança UnsupportedAlgorithmException.
     */
    public Set<HashAlgorithm> algorithms() {
        List<String> names = list(SIGNATURE_ALGORITHMS);
        return names.isEmpty() ? EnumSet.allOf(HashAlgorithm.class) : HashAlgorithm.parseAll(names);
    }

    /** Workers de hash: [1, 256]; padrão = núcleos disponíveis. */
    public int workers() {
        return intConfig(SIGNATURE_WORKERS, Runtime.getRuntime().availableProcessors(), 1, 256);
    }

    /** Vazio quando 0 (sem limite). */
    public Optional<Duration> runTimeout() {
        long seconds = longConfig(SIGNATURE_RUN_TIMEOUT_SECONDS, 0, 0, 7 * 24 * 3600L);
        return seconds == 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
    }

    public Mode mode() {
        String raw = getOrDefault(SIGNATURE_MODE, "compute").trim().toUpperCase(Locale.ROOT);
        try {
            return Mode.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("SIGNATURE_MODE inválido: use compute, verify, lookup ou template", e);
        }
    }

    public Optional<Path> referenceFile() {
        return find(SIGNATURE_REFERENCE_FILE).map(Path::of);
    }

    public String missingPlaceholder() {
        // placeholder pode ser intencionalmente vazio: lê o valor cru
        String override = overrides.get(SIGNATURE_MISSING_PLACEHOLDER);
        if (override != null) {
            return override;
        }
        String raw = values.get(SIGNATURE_MISSING_PLACEHOLDER);
        return raw != null ? raw : Verification.DEFAULT_MISSING_PLACEHOLDER;
    }

    public Optional<Path> outputFile() {
        return find(SIGNATURE_OUTPUT_FILE).map(Path::of);
    }

    /**
     * Formato explícito tem prioridade; senão deduz pelo arquivo de saída.
     */
    public OutputFormat outputFormat() {
        Optional<String> explicit = find(SIGNATURE_OUTPUT_FORMAT);
        if (explicit.isPresent()) {
            try {
                return OutputFormat.parse(explicit.get());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("SIGNATURE_OUTPUT_FORMAT inválido: " + explicit.get(), e);
            }
        }
        return outputFile().map(OutputFormat::fromFileName).orElse(OutputFormat.CSV);
    }

    /**
     * URL do repositório: exige http(s) e garante "/" final, pois o digest é
     * concatenado diretamente.
     */
    public String repositoryUri() {
        String raw = getOrDefault(REPOSITORY_URI, RepositoryModule.DEFAULT_ROOT_URI).trim();
        String lower = raw.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new IllegalStateException("REPOSITORY_URI deve começar com http/https");
        }
        return raw.endsWith("/") ? raw : raw + "/";
    }

    public Set<HashAlgorithm> repositoryAlgorithms() {
        List<String> names = list(REPOSITORY_ALGORITHMS);
        return names.isEmpty() ? RepositoryModule.DEFAULT_ALGORITHMS : HashAlgorithm.parseAll(names);
    }

    /** Consultas simultâneas ao repositório: [1, 64]. Padrão 4. */
    public int repositoryConcurrency() {
        return intConfig(REPOSITORY_CONCURRENCY, RepositoryModule.DEFAULT_CONCURRENCY, 1, 64);
    }

    /** Timeout por chamada: [1, 600] s. Padrão 30. */
    public Duration repositoryTimeout() {
        return Duration.ofSeconds(longConfig(REPOSITORY_TIMEOUT_SECONDS,
                RepositoryModule.DEFAULT_TIMEOUT.getSeconds(), 1, 600));
    }

    // ======= HELPERS TIPADOS =======

    /**
     * Flag booleana tolerante: "true/1/yes" (case-insensitive) → true; senão false.
     */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    /** Lista separada por vírgula, ponto e vírgula ou separador de path; itens em branco descartados. */
    public List<String> list(String key) {
        return split(key, LIST_SEPARATOR);
    }

    private List<String> split(String key, Pattern separator) {
        List<String> out = new ArrayList<>();
        find(key).ifPresent(raw -> Arrays.stream(separator.split(raw))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add));
        return out;
    }

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= LOGGING SEGURO =======

    @Override
    public String toString() {
        return "AppConfig{" +
                "mode=" + safe(() -> mode().name().toLowerCase(Locale.ROOT)) +
                ", paths=" + safe(() -> String.valueOf(paths())) +
                ", recurse=" + recurse() +
                ", hidden=" + includeHiddenAndSystem() +
                ", algorithms=" + safe(() -> String.valueOf(algorithms())) +
                ", workers=" + workers() +
                ", repository=" + safe(this::repositoryUri) +
                ", repositoryAlgorithms=" + safe(() -> String.valueOf(repositoryAlgorithms())) +
                ", output=" + safe(() -> outputFile().map(Path::toString).orElse("stdout")) +
                "}";
    }

    /** Não deixa toString() explodir caso um getter lance. */
    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException e) { return "error:" + e.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}

package com.example.signatureagent.scan;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transforma (caminho do arquivo, root da busca) em uma identidade estável
 * relativa ao root. Sem efeitos colaterais além da checagem "root é diretório".
 *
 * Regras:
 * - remove prefixo de provider do root ("Provider::C:\dados", "file:/dados");
 * - acrescenta separador final ao root quando ele denota um diretório;
 * - remove o root como prefixo literal (case-insensitive) do caminho completo;
 * - se o prefixo não casar, devolve o caminho completo sem alteração (identidade
 *   degradada, mas não é erro).
 *
 * O resultado usa '/' como separador. '\' só vira '/' no Windows ou em caminhos
 * com forma Windows ("C:\...", "\\servidor\..."); em POSIX '\' é caractere
 * válido de nome de arquivo e é preservado.
 */
public final class PathNormalizer {

    /** "Modulo\Provider::" no início; sem '/' para não confundir com diretório "pkg::v1". */
    private static final Pattern PROVIDER_PREFIX = Pattern.compile("^[A-Za-z][\\w.-]*(?:\\\\[\\w.-]+)*::");
    private static final Pattern WINDOWS_SHAPED = Pattern.compile("^(?:[A-Za-z]:\\\\|\\\\\\\\).*", Pattern.DOTALL);
    private static final String FILE_SCHEME = "file:";

    private PathNormalizer() {}

    /**
     * Root normalizado + caminho relativo.
     */
    public static final class NormalizedPath {
        private final String root;
        private final String pathRelativeToRoot;

        public NormalizedPath(String root, String pathRelativeToRoot) {
            this.root = Objects.requireNonNull(root, "root");
            this.pathRelativeToRoot = Objects.requireNonNull(pathRelativeToRoot, "pathRelativeToRoot");
        }

        public String root() { return root; }
        public String pathRelativeToRoot() { return pathRelativeToRoot; }

        @Override
        public String toString() {
            return "NormalizedPath{root=" + root + ", relative=" + pathRelativeToRoot + "}";
        }
    }

    public static NormalizedPath normalize(Path filePath, Path searchRoot) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(searchRoot, "searchRoot");
        return normalize(filePath.toString(), searchRoot.toString());
    }

    public static NormalizedPath normalize(String filePath, String searchRoot) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(searchRoot, "searchRoot");

        String root = normalizeRoot(searchRoot);
        String full = unify(filePath);

        String relative = full;
        if (!root.isEmpty() && full.length() >= root.length()
                && full.regionMatches(true, 0, root, 0, root.length())) {
            relative = full.substring(root.length());
        }
        return new NormalizedPath(root, relative);
    }

    /**
     * Atalho para quem só quer o caminho relativo.
     */
    public static String relativize(Path filePath, Path searchRoot) {
        return normalize(filePath, searchRoot).pathRelativeToRoot();
    }

    /**
     * Remove prefixo de provider, unifica separadores e garante '/' final quando
     * o root é um diretório.
     */
    static String normalizeRoot(String searchRoot) {
        String root = stripProvider(searchRoot.trim());
        root = unify(root);
        if (!root.isEmpty() && !root.endsWith("/") && isDirectory(root)) {
            root = root + "/";
        }
        return root;
    }

    static String stripProvider(String raw) {
        String value = raw;
        Matcher provider = PROVIDER_PREFIX.matcher(value);
        if (provider.find()) {
            value = value.substring(provider.end());
        }
        if (value.toLowerCase(Locale.ROOT).startsWith(FILE_SCHEME)) {
            value = value.substring(FILE_SCHEME.length());
            // "file:///x" -> "/x"; "file:/C:/x" -> "C:/x"
            while (value.startsWith("//")) {
                value = value.substring(1);
            }
            if (value.length() > 2 && value.charAt(0) == '/' && value.charAt(2) == ':') {
                value = value.substring(1);
            }
        }
        return value;
    }

    static String unify(String path) {
        if (File.separatorChar == '\\' || WINDOWS_SHAPED.matcher(path).matches()) {
            return path.replace('\\', '/');
        }
        return path;
    }

    private static boolean isDirectory(String root) {
        try {
            return Files.isDirectory(Path.of(root));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}

package com.example.signatureagent.digest;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongConsumer;

/**
 * Agrega os tipos relacionados ao cálculo de digests de conteúdo.
 */
public final class DigestModule {

    private DigestModule() {}

    /**
     * Algoritmos suportados. A ordem de declaração é a ordem das colunas exportadas.
     */
    public enum HashAlgorithm {
        MD5("MD5", 16),
        SHA1("SHA-1", 20),
        SHA256("SHA-256", 32),
        SHA512("SHA-512", 64);

        private final String jcaName;
        private final int digestLength;

        HashAlgorithm(String jcaName, int digestLength) {
            this.jcaName = jcaName;
            this.digestLength = digestLength;
        }

        /** Nome usado por {@link MessageDigest#getInstance(String)}. */
        public String jcaName() {
            return jcaName;
        }

        /** Quantidade de caracteres hex do digest (2 por byte). */
        public int hexLength() {
            return digestLength * 2;
        }

        /** Prefixo das colunas de saída, ex.: "SHA256" -> "SHA256Hash". */
        public String columnName() {
            return name() + "Hash";
        }

        MessageDigest newDigest() {
            try {
                return MessageDigest.getInstance(jcaName);
            } catch (NoSuchAlgorithmException e) {
                // Todos os quatro são obrigatórios em qualquer JVM
                throw new IllegalStateException("Algoritmo indisponível na JVM: " + jcaName, e);
            }
        }

        /**
         * Converte um nome vindo de configuração. Aceita "MD5", "SHA1", "SHA-1",
         * "sha256" etc. (case-insensitive).
         *
         * @throws UnsupportedAlgorithmException se o nome não for um dos quatro suportados
         */
        public static HashAlgorithm parse(String name) {
            if (name == null || name.isBlank()) {
                throw new UnsupportedAlgorithmException(String.valueOf(name));
            }
            String key = name.trim().toUpperCase(Locale.ROOT).replace("-", "");
            for (HashAlgorithm algorithm : values()) {
                if (algorithm.name().equals(key)) {
                    return algorithm;
                }
            }
            throw new UnsupportedAlgorithmException(name);
        }

        /**
         * Converte uma lista de nomes, preservando a ordem de declaração do enum.
         * Lista vazia resulta em erro: não há trabalho a fazer sem algoritmo.
         */
        public static Set<HashAlgorithm> parseAll(Collection<String> names) {
            Objects.requireNonNull(names, "names");
            EnumSet<HashAlgorithm> result = EnumSet.noneOf(HashAlgorithm.class);
            for (String name : names) {
                result.add(parse(name));
            }
            if (result.isEmpty()) {
                throw new IllegalArgumentException("Nenhum algoritmo de hash informado");
            }
            return result;
        }
    }

    /**
     * Erro de configuração: algoritmo fora de {MD5, SHA1, SHA256, SHA512}.
     * Deve ser rejeitado antes de iniciar o trabalho.
     */
    public static final class UnsupportedAlgorithmException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        private final String requested;

        public UnsupportedAlgorithmException(String requested) {
            super("Algoritmo de hash não suportado: " + requested
                    + " (use MD5, SHA1, SHA256 ou SHA512)");
            this.requested = requested;
        }

        public String requested() {
            return requested;
        }
    }

    /**
     * Calcula N digests em uma única passada sobre o conteúdo.
     *
     * Cada bloco lido alimenta todos os {@link MessageDigest} configurados; o
     * arquivo nunca é relido nem "rebobinado" por algoritmo. Instâncias são
     * imutáveis e podem ser compartilhadas entre threads (os MessageDigest são
     * criados por chamada).
     */
    public static final class DigestEngine {

        private static final HexFormat HEX = HexFormat.of().withUpperCase();
        private static final int BUFFER_SIZE = 64 * 1024;

        private final Set<HashAlgorithm> algorithms;

        public DigestEngine(Set<HashAlgorithm> algorithms) {
            Objects.requireNonNull(algorithms, "algorithms");
            if (algorithms.isEmpty()) {
                throw new IllegalArgumentException("Pelo menos um algoritmo é obrigatório");
            }
            this.algorithms = Collections.unmodifiableSet(EnumSet.copyOf(algorithms));
        }

        /** Engine com os quatro algoritmos. */
        public static DigestEngine allAlgorithms() {
            return new DigestEngine(EnumSet.allOf(HashAlgorithm.class));
        }

        public Set<HashAlgorithm> algorithms() {
            return algorithms;
        }

        /**
         * Calcula os digests do arquivo.
         *
         * @throws IOException se o arquivo não puder ser lido até o fim
         */
        public Map<HashAlgorithm, String> digest(Path file) throws IOException {
            return digest(file, null);
        }

        /**
         * Calcula os digests do arquivo, reportando bytes lidos a cada bloco.
         */
        public Map<HashAlgorithm, String> digest(Path file, LongConsumer bytesRead) throws IOException {
            Objects.requireNonNull(file, "file");
            try (InputStream in = new BufferedInputStream(Files.newInputStream(file), BUFFER_SIZE)) {
                return digest(in, bytesRead);
            }
        }

        /**
         * Calcula os digests do stream. O stream não é fechado.
         *
         * @param bytesRead callback opcional (pode ser null) chamado com o tamanho de cada bloco
         * @throws IOException se o stream não puder ser lido até o fim
         */
        public Map<HashAlgorithm, String> digest(InputStream in, LongConsumer bytesRead) throws IOException {
            Objects.requireNonNull(in, "in");

            List<HashAlgorithm> order = new ArrayList<>(algorithms);
            MessageDigest[] digests = new MessageDigest[order.size()];
            for (int i = 0; i < digests.length; i++) {
                digests[i] = order.get(i).newDigest();
            }

            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                for (MessageDigest md : digests) {
                    md.update(buffer, 0, read);
                }
                if (bytesRead != null && read > 0) {
                    bytesRead.accept(read);
                }
            }

            Map<HashAlgorithm, String> result = new EnumMap<>(HashAlgorithm.class);
            for (int i = 0; i < digests.length; i++) {
                result.put(order.get(i), HEX.formatHex(digests[i].digest()));
            }
            return result;
        }

        /** Conveniência para buffers em memória. */
        public Map<HashAlgorithm, String> digest(byte[] data) {
            Objects.requireNonNull(data, "data");
            try {
                return digest(new ByteArrayInputStream(data), null);
            } catch (IOException e) {
                // ByteArrayInputStream não lança IOException
                throw new IllegalStateException(e);
            }
        }
    }
}

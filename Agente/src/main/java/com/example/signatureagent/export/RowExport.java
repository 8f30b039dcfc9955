package com.example.signatureagent.export;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Formato de linha de saída e escritores CSV/JSON.
 *
 * O schema exportado é sempre a UNIÃO das colunas de todas as linhas (na ordem
 * em que aparecem pela primeira vez), nunca o schema da primeira linha: uma
 * linha sem atributos de repositório no topo não pode esconder as colunas
 * Repository* das linhas seguintes.
 */
public final class RowExport {

    private RowExport() {}

    /**
     * Linha achatada: colunas ordenadas nome -> valor. Imutável.
     */
    public static final class OutputRow {
        private final Map<String, String> columns;

        private OutputRow(Map<String, String> columns) {
            this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        }

        public static Builder builder() {
            return new Builder();
        }

        /** Copia esta linha para acrescentar colunas. */
        public Builder toBuilder() {
            Builder builder = new Builder();
            builder.values.putAll(columns);
            return builder;
        }

        public Map<String, String> columns() {
            return columns;
        }

        public Optional<String> get(String column) {
            return Optional.ofNullable(columns.get(column));
        }

        public boolean has(String column) {
            return columns.containsKey(column);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OutputRow)) return false;
            return columns.equals(((OutputRow) o).columns);
        }

        @Override
        public int hashCode() {
            return columns.hashCode();
        }

        @Override
        public String toString() {
            return "OutputRow" + columns;
        }

        public static final class Builder {
            private final Map<String, String> values = new LinkedHashMap<>();

            /** Valor null vira string vazia; a coluna existe mesmo assim. */
            public Builder put(String column, String value) {
                Objects.requireNonNull(column, "column");
                values.put(column, value != null ? value : "");
                return this;
            }

            public OutputRow build() {
                return new OutputRow(values);
            }
        }
    }

    /** Formatos suportados pelo sink. */
    public enum OutputFormat {
        CSV, JSON;

        public static OutputFormat parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return CSV;
            }
            try {
                return valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Formato de saída inválido: " + raw + " (use csv ou json)", e);
            }
        }

        /** Deduz pelo sufixo do arquivo; padrão CSV. */
        public static OutputFormat fromFileName(Path file) {
            String name = file.getFileName() != null ? file.getFileName().toString().toLowerCase(Locale.ROOT) : "";
            return name.endsWith(".json") ? JSON : CSV;
        }
    }

    /**
     * União das colunas de todas as linhas, na ordem da primeira ocorrência.
     */
    public static List<String> unionColumns(List<OutputRow> rows) {
        Set<String> union = new LinkedHashSet<>();
        for (OutputRow row : rows) {
            union.addAll(row.columns().keySet());
        }
        return new ArrayList<>(union);
    }

    /**
     * Escritor de linhas.
     */
    public interface RowWriter {
        void write(List<OutputRow> rows, Writer out) throws IOException;

        default void write(List<OutputRow> rows, Path file) throws IOException {
            Objects.requireNonNull(file, "file");
            if (file.toAbsolutePath().getParent() != null) {
                Files.createDirectories(file.toAbsolutePath().getParent());
            }
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(rows, out);
            }
        }

        static RowWriter forFormat(OutputFormat format) {
            return format == OutputFormat.JSON ? new JsonRowWriter() : new CsvRowWriter();
        }
    }

    /**
     * CSV com cabeçalho = união das colunas. Células ausentes saem vazias.
     */
    public static final class CsvRowWriter implements RowWriter {

        private static final Logger log = LoggerFactory.getLogger(CsvRowWriter.class);

        private final CsvMapper mapper = new CsvMapper();

        @Override
        public void write(List<OutputRow> rows, Writer out) throws IOException {
            Objects.requireNonNull(rows, "rows");
            List<String> columns = unionColumns(rows);
            if (columns.isEmpty()) {
                log.info("Nenhuma linha para exportar (CSV vazio).");
                return;
            }

            CsvSchema.Builder schema = CsvSchema.builder();
            for (String column : columns) {
                schema.addColumn(column);
            }

            try (SequenceWriter writer = mapper.writer(schema.build().withHeader()).writeValues(new NonClosingWriter(out))) {
                for (OutputRow row : rows) {
                    Map<String, String> full = new LinkedHashMap<>();
                    for (String column : columns) {
                        full.put(column, row.columns().getOrDefault(column, ""));
                    }
                    writer.write(full);
                }
            }
            log.info("CSV exportado: {} linhas, {} colunas", rows.size(), columns.size());
        }
    }

    /**
     * JSON: array de objetos. Cada objeto só traz as colunas que a linha tem;
     * o consumidor recebe a união naturalmente.
     */
    public static final class JsonRowWriter implements RowWriter {

        private static final Logger log = LoggerFactory.getLogger(JsonRowWriter.class);

        private final ObjectMapper mapper;

        public JsonRowWriter() {
            this.mapper = new ObjectMapper();
            this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }

        @Override
        public void write(List<OutputRow> rows, Writer out) throws IOException {
            Objects.requireNonNull(rows, "rows");
            List<Map<String, String>> payload = new ArrayList<>(rows.size());
            for (OutputRow row : rows) {
                payload.add(row.columns());
            }
            mapper.writeValue(new NonClosingWriter(out), payload);
            log.info("JSON exportado: {} linhas", rows.size());
        }
    }

    /**
     * O ObjectMapper fecha o Writer ao final; quem abriu o Writer é quem fecha.
     */
    private static final class NonClosingWriter extends Writer {
        private final Writer delegate;

        NonClosingWriter(Writer delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            delegate.write(cbuf, off, len);
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.flush();
        }
    }

    /**
     * Escreve em stdout quando não há arquivo de saída configurado.
     */
    public static void writeToStream(RowWriter writer, List<OutputRow> rows, OutputStream stream) throws IOException {
        Writer out = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
        writer.write(rows, out);
        out.flush();
    }
}

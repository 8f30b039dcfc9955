package com.example.signatureagent.export;

import com.example.signatureagent.export.RowExport.CsvRowWriter;
import com.example.signatureagent.export.RowExport.JsonRowWriter;
import com.example.signatureagent.export.RowExport.OutputFormat;
import com.example.signatureagent.export.RowExport.OutputRow;
import com.example.signatureagent.export.RowExport.RowWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RowExportTest {

    @TempDir
    Path tempDir;

    private static List<OutputRow> mixedRows() {
        // primeira linha sem colunas Repository*: o schema não pode vir só dela
        OutputRow plain = OutputRow.builder().put("Filename", "a.txt").put("MD5Hash", "AA").build();
        OutputRow enriched = OutputRow.builder()
                .put("Filename", "b.txt")
                .put("MD5Hash", "BB")
                .put("RepositoryVendor", "ACME")
                .build();
        return List.of(plain, enriched);
    }

    @Test
    void unionColumns_shouldKeepFirstSeenOrder() {
        assertEquals(List.of("Filename", "MD5Hash", "RepositoryVendor"), RowExport.unionColumns(mixedRows()));
    }

    @Test
    void csv_shouldUseUnionSchemaAndBlankMissingCells() throws IOException {
        StringWriter out = new StringWriter();

        new CsvRowWriter().write(mixedRows(), out);

        String[] lines = out.toString().split("\\R");
        assertEquals("Filename,MD5Hash,RepositoryVendor", lines[0]);
        assertEquals("a.txt,AA,", lines[1]);
        assertEquals("b.txt,BB,ACME", lines[2]);
    }

    @Test
    void csv_shouldQuoteValuesWithSeparators() throws IOException {
        StringWriter out = new StringWriter();
        OutputRow row = OutputRow.builder().put("Subject", "CN=Dev, O=Example").build();

        new CsvRowWriter().write(List.of(row), out);

        assertTrue(out.toString().contains("\"CN=Dev, O=Example\""), out.toString());
    }

    @Test
    void csv_shouldWriteNothingForNoRows() throws IOException {
        StringWriter out = new StringWriter();

        new CsvRowWriter().write(List.of(), out);

        assertEquals("", out.toString());
    }

    @Test
    void json_shouldWriteArrayWithEachRowColumns() throws IOException {
        StringWriter out = new StringWriter();

        new JsonRowWriter().write(mixedRows(), out);

        JsonNode array = new ObjectMapper().readTree(out.toString());
        assertTrue(array.isArray());
        assertEquals(2, array.size());
        assertFalse(array.get(0).has("RepositoryVendor"));
        assertEquals("ACME", array.get(1).get("RepositoryVendor").asText());
    }

    @Test
    void writeToFile_shouldCreateParentDirectories() throws IOException {
        Path file = tempDir.resolve("out").resolve("nested").resolve("rows.csv");

        RowWriter.forFormat(OutputFormat.CSV).write(mixedRows(), file);

        assertTrue(Files.exists(file));
        assertTrue(Files.readString(file).startsWith("Filename,MD5Hash,RepositoryVendor"));
    }

    @Test
    void writeToStream_shouldNotCloseCallerStream() throws IOException {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();

        RowExport.writeToStream(new JsonRowWriter(), mixedRows(), stream);
        RowExport.writeToStream(new CsvRowWriter(), mixedRows(), stream);

        String text = stream.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith("["));
        assertTrue(text.contains("Filename,MD5Hash,RepositoryVendor"));
    }

    @Test
    void outputFormat_shouldParseAndInferFromFileName() {
        assertEquals(OutputFormat.JSON, OutputFormat.parse("Json"));
        assertEquals(OutputFormat.CSV, OutputFormat.parse(null));
        assertEquals(OutputFormat.JSON, OutputFormat.fromFileName(Path.of("x/rows.JSON")));
        assertEquals(OutputFormat.CSV, OutputFormat.fromFileName(Path.of("rows.txt")));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.parse("xml"));
    }

    @Test
    void outputRow_shouldTurnNullIntoEmptyString() {
        OutputRow row = OutputRow.builder().put("A", null).build();

        assertTrue(row.has("A"));
        assertEquals("", row.get("A").orElseThrow());
        assertEquals(row, row.toBuilder().build());
    }
}

package com.olympicsdata.infrastructure.csv;

import com.olympicsdata.domain.error.MissingTableException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reading and writing of header-first CSV tables.
 */
public final class CsvTables {

    private static final char BOM = '\uFEFF';

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .build();

    private CsvTables() {
    }

    /**
     * Raw table: header in file order and one column→value map per row.
     * Short rows yield empty strings for the missing cells.
     */
    public record RawTable(String name, List<String> header, List<Map<String, String>> rows) {
    }

    /**
     * Reads a table and checks that the required columns are present.
     *
     * @throws MissingTableException if the file is missing or lacks a required column
     */
    public static RawTable read(Path file, List<String> requiredColumns) throws IOException {
        String name = file.getFileName().toString();
        if (!Files.isRegularFile(file)) {
            throw new MissingTableException("Required table not found: " + file);
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            reader.mark(1);
            if (reader.read() != BOM) {
                reader.reset();
            }
            try (CSVParser parser = READ_FORMAT.parse(reader)) {
                List<String> header = new ArrayList<>(parser.getHeaderNames());
                for (String column : requiredColumns) {
                    if (!header.contains(column)) {
                        throw new MissingTableException("Table " + name + " lacks required column '" + column + "'");
                    }
                }
                List<Map<String, String>> rows = new ArrayList<>();
                for (CSVRecord record : parser) {
                    Map<String, String> row = new LinkedHashMap<>();
                    for (String column : header) {
                        row.put(column, record.isSet(column) ? record.get(column) : "");
                    }
                    rows.add(row);
                }
                return new RawTable(name, header, rows);
            }
        }
    }

    /**
     * Writes a table with the given header; every row must have one value per column.
     */
    public static void write(Writer writer, List<String> header, Iterable<List<String>> rows) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(header.toArray(String[]::new))
            .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    /** Cell value with null mapped to the empty string. */
    static String cell(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }
}

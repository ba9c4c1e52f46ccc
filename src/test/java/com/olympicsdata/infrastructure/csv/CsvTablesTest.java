package com.olympicsdata.infrastructure.csv;

import com.olympicsdata.domain.error.MissingTableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CsvTables.
 */
class CsvTablesTest {

    @TempDir
    Path dir;

    @Test
    void testReadSkipsByteOrderMark() throws IOException {
        Path file = dir.resolve("nocs.csv");
        Files.writeString(file, "\uFEFFcode,country_long\nFRA,France\n", StandardCharsets.UTF_8);

        CsvTables.RawTable table = CsvTables.read(file, List.of("code"));

        assertEquals(List.of("code", "country_long"), table.header());
        assertEquals("FRA", table.rows().get(0).get("code"));
    }

    @Test
    void testQuotedCellsAndShortRows() throws IOException {
        Path file = dir.resolve("athletes.csv");
        Files.writeString(file, "code,name,disciplines\n"
            + "1,\"DOE, Jane\",\"['Cycling Road', 'Cycling Track']\"\n"
            + "2,SMITH Ann\n", StandardCharsets.UTF_8);

        CsvTables.RawTable table = CsvTables.read(file, List.of("code", "name"));

        assertEquals(2, table.rows().size());
        assertEquals("DOE, Jane", table.rows().get(0).get("name"));
        assertEquals("['Cycling Road', 'Cycling Track']", table.rows().get(0).get("disciplines"));
        assertEquals("", table.rows().get(1).get("disciplines"));
    }

    @Test
    void testMissingFileIsFatal() {
        MissingTableException e = assertThrows(MissingTableException.class,
            () -> CsvTables.read(dir.resolve("olympics_games.csv"), List.of("edition_id")));

        assertTrue(e.getMessage().contains("olympics_games.csv"));
    }

    @Test
    void testMissingRequiredColumnIsFatal() throws IOException {
        Path file = dir.resolve("olympics_country.csv");
        Files.writeString(file, "noc,name\nFRA,France\n", StandardCharsets.UTF_8);

        MissingTableException e = assertThrows(MissingTableException.class,
            () -> CsvTables.read(file, List.of("noc", "country")));

        assertTrue(e.getMessage().contains("country"));
    }

    @Test
    void testWriteQuotesWhereNeeded() throws IOException {
        StringWriter out = new StringWriter();

        CsvTables.write(out, List.of("noc", "country"),
            List.of(List.of("CIV", "Côte d'Ivoire"), List.of("KOR", "Korea, South")));

        assertEquals("noc,country\r\nCIV,Côte d'Ivoire\r\nKOR,\"Korea, South\"\r\n", out.toString());
    }
}

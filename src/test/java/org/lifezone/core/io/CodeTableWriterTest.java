package org.lifezone.core.io;

import static org.junit.Assert.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedMap;
import java.util.TreeMap;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CodeTableWriterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static SortedMap<Integer, String> sample() {
        SortedMap<Integer, String> table = new TreeMap<>();
        table.put(0, "No data");
        table.put(1, "No vegetation, outside of HLZ parameters");
        table.put(39761, "subtropical moist forest - core life zone");
        return table;
    }

    @Test
    public void testCsvQuotesNamesWithCommas() {
        String csv = CodeTableWriter.toCsv(sample());
        assertEquals("Code,Name\n"
                + "0,No data\n"
                + "1,\"No vegetation, outside of HLZ parameters\"\n"
                + "39761,subtropical moist forest - core life zone\n", csv);
    }

    @Test
    public void testJsonArrayInCodeOrder() throws IOException {
        JsonNode root = new ObjectMapper().readTree(CodeTableWriter.toJson(sample()));
        assertTrue(root.isArray());
        assertEquals(3, root.size());
        assertEquals(39761, root.get(2).get("code").asInt());
        assertEquals("subtropical moist forest - core life zone", root.get(2).get("name").asText());
    }

    @Test
    public void testWritePicksFormatByExtension() throws IOException {
        Path json = tmp.getRoot().toPath().resolve("out/codes.json");
        Path csv = tmp.getRoot().toPath().resolve("codes.csv");
        CodeTableWriter.write(sample(), json);
        CodeTableWriter.write(sample(), csv);

        assertTrue(Files.readString(json, StandardCharsets.UTF_8).trim().startsWith("["));
        assertTrue(Files.readString(csv, StandardCharsets.UTF_8).startsWith("Code,Name"));
    }
}

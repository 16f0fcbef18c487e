package org.lifezone.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Таблица код -> имя для отчётов.
 * JSON: [{"code": 24771, "name": "..."}, ...]; CSV: Code,Name.
 */
public class CodeTableWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String toJson(Map<Integer, String> table) {
        ArrayNode root = MAPPER.createArrayNode();
        for (Map.Entry<Integer, String> e : table.entrySet()) {
            ObjectNode row = root.addObject();
            row.put("code", e.getKey());
            row.put("name", e.getValue());
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode code table JSON", e);
        }
    }

    public static String toCsv(Map<Integer, String> table) {
        StringBuilder sb = new StringBuilder("Code,Name\n");
        for (Map.Entry<Integer, String> e : table.entrySet()) {
            sb.append(e.getKey()).append(',').append(csvField(e.getValue())).append('\n');
        }
        return sb.toString();
    }

    /** Формат по расширению: .json, иначе CSV. */
    public static void write(Map<Integer, String> table, Path out) {
        String name = out.getFileName().toString().toLowerCase();
        String body = name.endsWith(".json") ? toJson(table) : toCsv(table);
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(out, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write code table: " + out.toAbsolutePath(), e);
        }
    }

    private static String csvField(String v) {
        if (v.indexOf(',') < 0 && v.indexOf('"') < 0) return v;
        return '"' + v.replace("\"", "\"\"") + '"';
    }
}

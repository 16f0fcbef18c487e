package org.lifezone.app;

import org.lifezone.core.classification.CodeDecoder;
import org.lifezone.core.io.CodeTableWriter;
import org.lifezone.core.io.ZoneTableLoader;
import org.lifezone.core.model.ZoneTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Расшифровка кодов HLZ в таблицу код -> имя.
 * <pre>
 *   DecodeMain [--table hlz_defs.csv] [--codes-file codes.txt] [--out table.json|table.csv] code...
 * </pre>
 * Коды - аргументами и/или файлом (по коду в строке либо через запятую/пробел).
 * Без --out таблица печатается в stdout как CSV.
 */
public class DecodeMain {

    private static final Logger log = LoggerFactory.getLogger(DecodeMain.class);

    public static void main(String[] args) {
        try {
            run(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            System.exit(2);
        } catch (RuntimeException e) {
            log.error("Decode failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static String run(String[] args) {
        Path tablePath = null;
        Path codesFile = null;
        Path out = null;
        List<Integer> codes = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--table" -> tablePath = Paths.get(requireValue(args, ++i, a));
                case "--codes-file" -> codesFile = Paths.get(requireValue(args, ++i, a));
                case "--out" -> out = Paths.get(requireValue(args, ++i, a));
                default -> parseCodes(a, codes);
            }
        }
        if (codesFile != null) {
            codes.addAll(readCodes(codesFile));
        }
        if (codes.isEmpty()) {
            throw new IllegalArgumentException("No codes given. Usage: DecodeMain [--table csv] [--codes-file txt] [--out json|csv] code...");
        }

        ZoneTable table = (tablePath == null) ? ZoneTableLoader.loadDefault() : ZoneTableLoader.load(tablePath);
        SortedMap<Integer, String> decoded = CodeDecoder.forTable(table).decodeAll(codes);
        log.info("Decoded {} distinct codes", decoded.size());

        String csv = CodeTableWriter.toCsv(decoded);
        if (out == null) {
            System.out.print(csv);
        } else {
            CodeTableWriter.write(decoded, out);
            log.info("Code table written to {}", out.toAbsolutePath());
        }
        return csv;
    }

    static List<Integer> readCodes(Path file) {
        List<Integer> codes = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                parseCodes(line, codes);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read codes file: " + file.toAbsolutePath(), e);
        }
        return codes;
    }

    private static void parseCodes(String raw, List<Integer> out) {
        for (String token : raw.split("[,\\s]+")) {
            if (token.isEmpty()) continue;
            try {
                out.add(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a code: " + token, e);
            }
        }
    }

    private static String requireValue(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new IllegalArgumentException(flag + " needs a value");
        }
        return args[i];
    }
}

package org.lifezone.core.io;

import org.lifezone.core.exception.InvalidZoneTableException;
import org.lifezone.core.model.ZoneDefinition;
import org.lifezone.core.model.ZoneTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV таблицы зон: заголовок, затем строки abt,tap,per,veg_class.
 * Номер строки (с единицы) = индекс veg class.
 */
public class ZoneTableLoader {

    public static final String DEFAULT_RESOURCE = "/hlz_defs.csv";

    public static ZoneTable loadDefault() {
        InputStream in = ZoneTableLoader.class.getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new InvalidZoneTableException("Bundled zone table not found: " + DEFAULT_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new InvalidZoneTableException("Failed to read bundled zone table", e);
        }
    }

    public static ZoneTable load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new InvalidZoneTableException("Failed to read zone table: " + path.toAbsolutePath(), e);
        }
    }

    public static ZoneTable load(Reader reader, String source) throws IOException {
        List<ZoneDefinition> rows = new ArrayList<>();

        BufferedReader br = (reader instanceof BufferedReader b) ? b : new BufferedReader(reader);
        String line;
        boolean first = true;
        int lineNo = 0;

        while ((line = br.readLine()) != null) {
            lineNo++;
            if (first) {
                first = false;
                continue;
            }
            if (line.isBlank()) continue;

            String[] parts = line.split(",", 4);
            if (parts.length < 4) {
                throw new InvalidZoneTableException(source + ":" + lineNo + " expected 4 columns: " + line);
            }

            try {
                double abt = Double.parseDouble(unquote(parts[0]));
                double tap = Double.parseDouble(unquote(parts[1]));
                double per = Double.parseDouble(unquote(parts[2]));
                String name = unquote(parts[3]);
                rows.add(new ZoneDefinition(rows.size() + 1, abt, tap, per, name));
            } catch (NumberFormatException e) {
                throw new InvalidZoneTableException(source + ":" + lineNo + " bad number: " + line, e);
            }
        }

        return new ZoneTable(rows);
    }

    private static String unquote(String s) {
        return s.trim().replace("\"", "");
    }
}

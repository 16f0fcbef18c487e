package org.lifezone.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Настройки: значения по умолчанию -> файл lifezone.properties -> системные свойства.
 */
public final class ClassifierConfigLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("lifezone.properties");

    private ClassifierConfigLoader() {
    }

    public static ClassifierSettings load() {
        ClassifierSettings settings = ClassifierSettings.defaults();
        apply(settings, resolvePath());
        settings.applyOverridesFromSystem();
        return settings;
    }

    public static void apply(ClassifierSettings settings, Path path) {
        if (!Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classifier config: " + path.toAbsolutePath(), e);
        }
        settings.apply(props);
    }

    static Path resolvePath() {
        String override = pick(
                System.getProperty("lifezone.config.path"),
                System.getenv("LIFEZONE_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}

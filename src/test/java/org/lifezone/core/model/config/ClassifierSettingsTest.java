package org.lifezone.core.model.config;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ClassifierSettingsTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaults() {
        ClassifierSettings s = ClassifierSettings.defaults();
        assertEquals(ClassificationVariant.CLASSICAL, s.variant);
        assertTrue(s.computeEcotones);
        assertEquals(2048, s.tileRows);
        assertEquals(2048, s.tileCols);
        assertTrue(s.parallel);
        assertFalse(s.strictNumerics);
        assertTrue(s.enableValidation);
    }

    @Test
    public void testVariantDrivesEcotonesUnlessOverridden() {
        Properties props = new Properties();
        props.setProperty("lifezone.variant", "penman-monteith");
        ClassifierSettings s = ClassifierSettings.defaults();
        s.apply(props);
        assertEquals(ClassificationVariant.PENMAN_MONTEITH, s.variant);
        assertFalse(s.computeEcotones);

        props.setProperty("lifezone.ecotones", "true");
        s.apply(props);
        assertTrue(s.computeEcotones);
    }

    @Test
    public void testBlankValuesIgnored() {
        Properties props = new Properties();
        props.setProperty("lifezone.tile.rows", "  ");
        props.setProperty("lifezone.tile.cols", "512");
        props.setProperty("lifezone.strict", "true");
        ClassifierSettings s = ClassifierSettings.defaults();
        s.apply(props);
        assertEquals(2048, s.tileRows);
        assertEquals(512, s.tileCols);
        assertTrue(s.strictNumerics);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownVariant() {
        Properties props = new Properties();
        props.setProperty("lifezone.variant", "thornthwaite");
        ClassifierSettings.defaults().apply(props);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveTileSize() {
        Properties props = new Properties();
        props.setProperty("lifezone.tile.rows", "0");
        ClassifierSettings.defaults().apply(props);
    }

    @Test
    public void testLoaderReadsFile() throws IOException {
        Path file = tmp.newFile("lifezone.properties").toPath();
        Files.writeString(file, "lifezone.parallel=false\nlifezone.tile.rows=64\n");
        ClassifierSettings s = ClassifierSettings.defaults();
        ClassifierConfigLoader.apply(s, file);
        assertFalse(s.parallel);
        assertEquals(64, s.tileRows);
    }

    @Test
    public void testLoaderSkipsMissingFile() {
        ClassifierSettings s = ClassifierSettings.defaults();
        ClassifierConfigLoader.apply(s, tmp.getRoot().toPath().resolve("absent.properties"));
        assertEquals(2048, s.tileRows);
    }

    @Test
    public void testConfigPathOverride() {
        String old = System.getProperty("lifezone.config.path");
        try {
            System.setProperty("lifezone.config.path", " /etc/hlz.properties ");
            assertEquals("/etc/hlz.properties", ClassifierConfigLoader.resolvePath().toString());
        } finally {
            if (old == null) {
                System.clearProperty("lifezone.config.path");
            } else {
                System.setProperty("lifezone.config.path", old);
            }
        }
    }
}

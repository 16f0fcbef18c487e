package org.lifezone.core.model;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import org.lifezone.core.exception.InvalidZoneTableException;
import org.lifezone.core.io.ZoneTableLoader;
import org.junit.Test;

public class ZoneTableTest {

    @Test
    public void testBundledTableLayout() {
        ZoneTable table = ZoneTableLoader.loadDefault();

        assertEquals(41, table.size());
        assertEquals(34, table.searchLimit());
        assertEquals(20, table.warmTemperateDesertIndex());
        assertEquals(26, table.warmTemperateRainForestIndex());
        assertEquals(15, table.subtropicalOffset());

        assertEquals("rain forest", table.name(34));
        assertEquals("thorn woodland", table.name(37));
        assertEquals("desert", table.name(HlzConstants.POLAR_DESERT_VEG_CLASS));
    }

    @Test
    public void testPolarRows() {
        ZoneTable table = ZoneTableLoader.loadDefault();
        // строка 1 - под огибающей осадков, не полярная
        assertFalse(table.isPolarRow(1));
        assertTrue(table.isPolarRow(2));
        assertTrue(table.isPolarRow(3));
        assertTrue(table.isPolarRow(4));
        assertFalse(table.isPolarRow(5));
        assertFalse(table.isPolarRow(0));
        assertFalse(table.isPolarRow(40));
    }

    @Test
    public void testSubtropicalRowsShareWarmTemperateEdges() {
        ZoneTable table = ZoneTableLoader.loadDefault();
        for (int i = table.warmTemperateDesertIndex(); i <= table.warmTemperateRainForestIndex(); i++) {
            ZoneDefinition warm = table.row(i);
            ZoneDefinition sub = table.row(i + table.subtropicalOffset());
            assertEquals(warm.biotempEdge(), sub.biotempEdge(), 0.0);
            assertEquals(warm.precipEdge(), sub.precipEdge(), 0.0);
            assertEquals(warm.petRatioEdge(), sub.petRatioEdge(), 0.0);
        }
    }

    @Test
    public void testFromEdgesRequiresEnoughNames() {
        List<double[]> edges = bundledEdges();
        List<String> names = new ArrayList<>(ZoneTableLoader.loadDefault().names());
        names.remove(names.size() - 1);
        try {
            ZoneTable.fromEdges(edges, names);
            fail("Expected InvalidZoneTableException");
        } catch (InvalidZoneTableException e) {
            assertTrue(e.getMessage().contains("40 entries"));
        }
    }

    @Test
    public void testFromEdgesMatchesLoadedTable() {
        ZoneTable loaded = ZoneTableLoader.loadDefault();
        ZoneTable built = ZoneTable.fromEdges(bundledEdges(), loaded.names());
        assertEquals(loaded.rows(), built.rows());
    }

    @Test(expected = InvalidZoneTableException.class)
    public void testTooFewSearchRowsRejected() {
        List<double[]> edges = bundledEdges().subList(0, 20);
        ZoneTable.fromEdges(edges, ZoneTableLoader.loadDefault().names());
    }

    @Test(expected = InvalidZoneTableException.class)
    public void testNonPositiveEdgeRejected() {
        List<double[]> edges = bundledEdges();
        edges.set(5, new double[]{1.5, 0.0, 1.0});
        ZoneTable.fromEdges(edges, ZoneTableLoader.loadDefault().names());
    }

    @Test(expected = InvalidZoneTableException.class)
    public void testMissingSubtropicalBlockRejected() {
        List<double[]> edges = bundledEdges().subList(0, 38);
        ZoneTable.fromEdges(edges, ZoneTableLoader.loadDefault().names());
    }

    @Test(expected = InvalidZoneTableException.class)
    public void testEmptyTableRejected() {
        new ZoneTable(new ArrayList<>());
    }

    private static List<double[]> bundledEdges() {
        List<double[]> edges = new ArrayList<>();
        for (ZoneDefinition z : ZoneTableLoader.loadDefault().rows()) {
            edges.add(new double[]{z.biotempEdge(), z.precipEdge(), z.petRatioEdge()});
        }
        return edges;
    }
}

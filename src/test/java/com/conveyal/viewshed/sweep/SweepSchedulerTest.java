package com.conveyal.viewshed.sweep;

import com.conveyal.viewshed.ViewshedParameters;
import com.conveyal.viewshed.analyst.OutputMode;
import com.conveyal.viewshed.analyst.VisibilityAggregator;
import com.conveyal.viewshed.analyst.VisibilityGrid;
import com.conveyal.viewshed.grid.ElevationGrid;
import com.conveyal.viewshed.grid.GridExtents;
import com.conveyal.viewshed.los.LineOfSight;
import com.conveyal.viewshed.los.LineOfSightResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;

import static com.conveyal.viewshed.TerrainFixtures.flat;
import static com.conveyal.viewshed.TerrainFixtures.gaussianBump;
import static com.conveyal.viewshed.TerrainFixtures.unitGrid;
import static com.conveyal.viewshed.TerrainFixtures.wall;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for target ordering and partitioning under both strategies. Everything here runs on the calling thread;
 * parallel execution is covered in ViewshedComputerTest.
 */
class SweepSchedulerTest {

    private static VisibilityGrid sweep (ElevationGrid grid, ViewshedParameters parameters) {
        LineOfSight lineOfSight = new LineOfSight(grid, parameters);
        SweepScheduler scheduler = new SweepScheduler(lineOfSight, parameters.sectorResolution);
        VisibilityAggregator aggregator = new VisibilityAggregator(lineOfSight, parameters.outputMode);
        scheduler.sweepAll(aggregator);
        return aggregator.toGrid(scheduler);
    }

    private static ViewshedParameters parameters (double x, double y, double height, SectorResolution resolution) {
        ViewshedParameters parameters = new ViewshedParameters(x, y, height);
        parameters.sectorResolution = resolution;
        return parameters;
    }

    /** Exact sweeping must reproduce the naive evaluation of every target one by one. */
    @Test
    void exactSweepMatchesPerTargetEvaluation () {
        ElevationGrid grid = unitGrid(gaussianBump());
        ViewshedParameters parameters = parameters(0, 0, 2, SectorResolution.EXACT);
        VisibilityGrid swept = sweep(grid, parameters);
        assertEquals(SweepScheduler.Strategy.EXACT, swept.strategy);

        LineOfSight naive = new LineOfSight(grid, parameters);
        int hidden = 0;
        for (int row = 0; row < 21; row++) {
            for (int col = 0; col < 21; col++) {
                LineOfSightResult result = naive.evaluate(row, col);
                if (result.isVisible()) {
                    assertEquals(result.margin, swept.get(row, col), 0, "cell " + row + ", " + col);
                } else {
                    assertTrue(Double.isNaN(swept.get(row, col)), "cell " + row + ", " + col);
                    hidden += 1;
                }
            }
        }
        // The hill must actually hide something for this comparison to mean anything.
        assertTrue(hidden > 20);
        assertEquals(2, swept.get(0, 0), 1e-12);
    }

    /**
     * Whatever the terrain, a request that does not opt in to the horizon sweep must give the same decision and margin
     * as evaluating each target on its own.
     */
    @Test
    void defaultStrategyMatchesPerTargetEvaluationOnEveryCell () {
        double[][] spike = flat(21, 21, 0);
        spike[10][11] = 30;
        double[][] random = new double[41][41];
        Random rng = new Random(42);
        for (double[] row : random) {
            for (int col = 0; col < row.length; col++) {
                row[col] = rng.nextDouble() * 20;
            }
        }
        assertMatchesPerTargetEvaluation(unitGrid(gaussianBump()), new ViewshedParameters(0, 0, 2));
        assertMatchesPerTargetEvaluation(unitGrid(spike), new ViewshedParameters(10, 5, 1.7));
        assertMatchesPerTargetEvaluation(unitGrid(random), new ViewshedParameters(13, 27, 5));
    }

    private static void assertMatchesPerTargetEvaluation (ElevationGrid grid, ViewshedParameters parameters) {
        VisibilityGrid swept = sweep(grid, parameters);
        assertEquals(SweepScheduler.Strategy.EXACT, swept.strategy);
        LineOfSight naive = new LineOfSight(grid, parameters);
        for (int row = 0; row < grid.extents.rows; row++) {
            for (int col = 0; col < grid.extents.cols; col++) {
                LineOfSightResult result = naive.evaluate(row, col);
                String cell = "cell " + row + ", " + col;
                assertEquals(result.isVisible(), swept.isVisible(row, col), cell);
                if (result.isVisible()) {
                    assertEquals(result.margin, swept.get(row, col), 0, cell);
                }
            }
        }
    }

    /** The approximate horizon sweep is only used on request, and gets the clear-cut cells of the hill right. */
    @Test
    void horizonSweepIsOptIn () {
        ElevationGrid grid = unitGrid(gaussianBump());
        assertEquals(SweepScheduler.Strategy.EXACT, sweep(grid, new ViewshedParameters(0, 0, 2)).strategy);
        VisibilityGrid horizon = sweep(grid, parameters(0, 0, 2, SectorResolution.AUTO));
        assertEquals(SweepScheduler.Strategy.HORIZON, horizon.strategy);
        assertEquals(160, horizon.nSectors);
        assertFalse(horizon.isVisible(20, 20));
        assertTrue(horizon.isVisible(0, 20));
        assertTrue(horizon.isVisible(20, 0));
    }

    /** A higher eye never hides a cell and never lowers a margin. */
    @ParameterizedTest
    @ValueSource(strings = {"exact", "auto"})
    void raisingObserverNeverLowersMargins (String resolution) {
        ElevationGrid grid = unitGrid(gaussianBump());
        VisibilityGrid previous = null;
        for (double height : new double[] {0, 0.5, 2, 5, 10}) {
            VisibilityGrid current = sweep(grid, parameters(0, 0, height, SectorResolution.parse(resolution)));
            if (previous != null) {
                for (int row = 0; row < 21; row++) {
                    for (int col = 0; col < 21; col++) {
                        if (!previous.isVisible(row, col)) continue;
                        String cell = "cell " + row + ", " + col + " at height " + height;
                        assertTrue(current.isVisible(row, col), cell);
                        assertTrue(current.get(row, col) >= previous.get(row, col) - 1e-9, cell);
                    }
                }
            }
            previous = current;
        }
    }

    /** The central ray takes the same number of samples per cell crossed whatever the cell aspect ratio. */
    @Test
    void rayStepFollowsCellSize () {
        GridExtents tall = new GridExtents(10, 10, 0, 0, 1, 1000);
        assertEquals(0.5, SweepScheduler.rayStep(tall, 2, 0), 1e-12);
        assertEquals(500, SweepScheduler.rayStep(tall, 2, Math.PI / 2), 1e-9);
        assertEquals(0.5, SweepScheduler.rayStep(tall, 2, Math.PI), 1e-12);
        // Diagonally the column axis is still crossed much faster than the row axis.
        assertEquals(0.5 * Math.sqrt(2), SweepScheduler.rayStep(tall, 2, Math.PI / 4), 1e-9);
        GridExtents square = new GridExtents(10, 10, 0, 0, 2, 2);
        assertEquals(Math.sqrt(2) / 4 * 2, SweepScheduler.rayStep(square, 4, Math.PI / 4), 1e-9);
    }

    @ParameterizedTest
    @ValueSource(strings = {"exact", "auto", "500"})
    void flatTerrainIsFullyVisible (String resolution) {
        VisibilityGrid result = sweep(unitGrid(flat(15, 11, 5)), parameters(5, 7, 1.7, SectorResolution.parse(resolution)));
        assertEquals(15 * 11, result.visibleCount);
        for (int row = 0; row < 15; row++) {
            for (int col = 0; col < 11; col++) {
                double margin = result.get(row, col);
                assertTrue(margin > 0 && margin <= 1.7 + 1e-9, "cell " + row + ", " + col);
            }
        }
        assertEquals(1.7, result.get(7, 5), 1e-12);
    }

    @ParameterizedTest
    @ValueSource(strings = {"exact", "auto"})
    void wallHidesTerrainBehindIt (String resolution) {
        VisibilityGrid result = sweep(unitGrid(wall(21, 21, 10, 50)),
                parameters(10, 2, 1.7, SectorResolution.parse(resolution)));
        for (int row = 0; row < 21; row++) {
            for (int col = 0; col < 21; col++) {
                assertEquals(row <= 10, result.isVisible(row, col), "cell " + row + ", " + col);
            }
        }
    }

    @Test
    void coarseSectorsFallBackToExact () {
        ElevationGrid grid = unitGrid(flat(21, 21, 0));
        LineOfSight lineOfSight = new LineOfSight(grid, parameters(10, 10, 1, SectorResolution.EXACT));
        assertEquals(80, SweepScheduler.minimumSectors(grid.extents, lineOfSight.observer));

        SweepScheduler coarse = new SweepScheduler(lineOfSight, SectorResolution.sectors(8));
        assertEquals(SweepScheduler.Strategy.EXACT, coarse.strategy);
        assertEquals(0, coarse.nSectors);

        SweepScheduler fine = new SweepScheduler(lineOfSight, SectorResolution.sectors(200));
        assertEquals(SweepScheduler.Strategy.HORIZON, fine.strategy);
        assertEquals(200, fine.nSectors);

        SweepScheduler auto = new SweepScheduler(lineOfSight, SectorResolution.AUTO);
        assertEquals(80, auto.nSectors);
    }

    @Test
    void partitionsAreContiguousAndCoverAllUnits () {
        ElevationGrid grid = unitGrid(flat(21, 21, 0));
        LineOfSight lineOfSight = new LineOfSight(grid, parameters(10, 10, 1, SectorResolution.EXACT));

        List<SweepScheduler.Partition> rows = new SweepScheduler(lineOfSight, SectorResolution.EXACT).partition(4);
        assertContiguous(rows, 21);
        // More partitions than rows yields one row each.
        assertEquals(21, new SweepScheduler(lineOfSight, SectorResolution.EXACT).partition(100).size());

        List<SweepScheduler.Partition> sectors = new SweepScheduler(lineOfSight, SectorResolution.AUTO).partition(7);
        assertEquals(7, sectors.size());
        assertContiguous(sectors, 80);
    }

    private static void assertContiguous (List<SweepScheduler.Partition> partitions, int nUnits) {
        int next = 0;
        for (SweepScheduler.Partition partition : partitions) {
            assertEquals(next, partition.start);
            assertTrue(partition.end > partition.start);
            next = partition.end;
        }
        assertEquals(nUnits, next);
    }

    @Test
    void viewingAngleOutputInBothStrategies () {
        for (SectorResolution resolution : new SectorResolution[] {SectorResolution.EXACT, SectorResolution.AUTO}) {
            ViewshedParameters parameters = parameters(0, 0, 1, resolution);
            parameters.outputMode = OutputMode.VIEWING_ANGLE;
            VisibilityGrid result = sweep(unitGrid(flat(5, 5, 0)), parameters);
            assertEquals(180, result.get(0, 0));
            assertEquals(45, result.get(0, 1), 1e-9);
            assertEquals(45, result.get(1, 0), 1e-9);
        }
    }

}

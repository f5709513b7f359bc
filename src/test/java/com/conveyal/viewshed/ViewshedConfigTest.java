package com.conveyal.viewshed;

import com.conveyal.viewshed.analyst.OutputMode;
import com.conveyal.viewshed.los.NoDataPolicy;
import com.conveyal.viewshed.sweep.SectorResolution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ViewshedConfigTest {

    @AfterEach
    void clearSystemProperties () {
        System.clearProperty("viewshed.samples.per.cell");
    }

    @Test
    void shippedDefaults () {
        ViewshedConfig config = ViewshedConfig.load();
        assertEquals(0, config.workerThreads());
        assertEquals(2, config.samplesPerCell());
        assertTrue(Double.isNaN(config.occlusionTolerance()));
        assertEquals(SectorResolution.EXACT, config.sectorResolution());
        assertEquals(NoDataPolicy.TREAT_AS_TRANSPARENT, config.noDataPolicy());
        assertEquals(OutputMode.MARGIN, config.outputMode());
    }

    @Test
    void propertiesOverrideDefaults () {
        Properties props = new Properties();
        props.setProperty("worker-threads", "3");
        props.setProperty("occlusion-tolerance", "0.01");
        props.setProperty("sector-resolution", "auto");
        props.setProperty("no-data-policy", "treat-as-opaque");
        props.setProperty("output-mode", "viewing-angle");
        ViewshedConfig config = ViewshedConfig.fromProperties(props);
        assertEquals(3, config.workerThreads());
        assertEquals(2, config.samplesPerCell());

        ViewshedParameters parameters = config.defaultParameters(10, 20, 1.5);
        assertEquals(10, parameters.observerX);
        assertEquals(20, parameters.observerY);
        assertEquals(1.5, parameters.observerHeight);
        assertEquals(0.01, parameters.occlusionTolerance);
        assertEquals(SectorResolution.AUTO, parameters.sectorResolution);
        assertEquals(NoDataPolicy.TREAT_AS_OPAQUE, parameters.noDataPolicy);
        assertEquals(OutputMode.VIEWING_ANGLE, parameters.outputMode);
        parameters.validate();
    }

    @Test
    void fileIsLayeredOverDefaults (@TempDir Path directory) throws IOException {
        Path file = directory.resolve("viewshed.properties");
        Files.write(file, "samples-per-cell=5\nsector-resolution=400\n".getBytes(StandardCharsets.UTF_8));
        ViewshedConfig config = ViewshedConfig.fromFile(file.toString());
        assertEquals(5, config.samplesPerCell());
        assertEquals(SectorResolution.sectors(400), config.sectorResolution());
        assertEquals(OutputMode.MARGIN, config.outputMode());
    }

    @Test
    void missingFileIsReported (@TempDir Path directory) {
        String missing = directory.resolve("absent.properties").toString();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ViewshedConfig.fromFile(missing));
        assertTrue(e.getMessage().contains(missing));
    }

    @Test
    void systemPropertiesTakePrecedence () {
        System.setProperty("viewshed.samples.per.cell", "4");
        Properties props = new Properties();
        props.setProperty("samples-per-cell", "3");
        assertEquals(4, ViewshedConfig.fromProperties(props).samplesPerCell());
    }

    @Test
    void reportsEveryInvalidKeyAtOnce () {
        Properties props = new Properties();
        props.setProperty("worker-threads", "many");
        props.setProperty("output-mode", "hologram");
        props.setProperty("samples-per-cell", "0");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ViewshedConfig.fromProperties(props));
        assertTrue(e.getMessage().contains("worker-threads"));
        assertTrue(e.getMessage().contains("output-mode"));
        assertTrue(e.getMessage().contains("samples-per-cell"));
    }

}

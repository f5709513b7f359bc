package com.conveyal.viewshed;

import com.conveyal.viewshed.analyst.OutputMode;
import com.conveyal.viewshed.analyst.ViewshedComputer;
import com.conveyal.viewshed.los.NoDataPolicy;
import com.conveyal.viewshed.sweep.SectorResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Loads configuration for viewshed computations and exposes it to the ViewshedComputer and to new requests.
 * Defaults come from viewshed.properties on the classpath. A user file or Properties object is layered over them, and
 * environment variables and system properties override both (see ConfigBase).
 */
public class ViewshedConfig extends ConfigBase implements ViewshedComputer.Config {

    private static final Logger LOG = LoggerFactory.getLogger(ViewshedConfig.class);

    public static final String DEFAULTS_RESOURCE = "viewshed.properties";

    // INSTANCE FIELDS

    private final int workerThreads;
    private final int samplesPerCell;
    private final double occlusionTolerance;
    private final SectorResolution sectorResolution;
    private final NoDataPolicy noDataPolicy;
    private final OutputMode outputMode;

    // CONSTRUCTORS

    protected ViewshedConfig (Properties props) {
        super(props);
        workerThreads = intProp("worker-threads");
        if (workerThreads < 0) {
            invalidProp("worker-threads", "must be zero (all available processors) or a positive thread count");
        }
        samplesPerCell = intProp("samples-per-cell");
        if (samplesPerCell < 1 && !keysWithErrors.contains("samples-per-cell")) {
            invalidProp("samples-per-cell", "at least one sample per cell is required");
        }
        occlusionTolerance = parsedProp("occlusion-tolerance", ViewshedParameters::parseTolerance, Double.NaN);
        if (occlusionTolerance < 0) {
            invalidProp("occlusion-tolerance", "must be 'auto' or a non-negative number");
        }
        sectorResolution = parsedProp("sector-resolution", SectorResolution::parse, SectorResolution.EXACT);
        noDataPolicy = parsedProp("no-data-policy", NoDataPolicy::parse, NoDataPolicy.TREAT_AS_TRANSPARENT);
        outputMode = parsedProp("output-mode", OutputMode::parse, OutputMode.MARGIN);
        throwIfErrors();
        LOG.info("Viewshed configuration: {} worker threads, {} samples per cell, {} sectors, no-data {}, output {}.",
                workerThreads == 0 ? "all" : workerThreads, samplesPerCell, sectorResolution, noDataPolicy, outputMode);
    }

    /** Configuration from the shipped defaults and any environment or system property overrides. */
    public static ViewshedConfig load () {
        return new ViewshedConfig(propsFromResource(DEFAULTS_RESOURCE));
    }

    /** Configuration from a properties file layered over the shipped defaults. */
    public static ViewshedConfig fromFile (String filename) {
        return fromProperties(propsFromFile(filename));
    }

    /** Configuration from the given properties layered over the shipped defaults. The argument is not modified. */
    public static ViewshedConfig fromProperties (Properties overrides) {
        Properties props = propsFromResource(DEFAULTS_RESOURCE);
        for (String key : overrides.stringPropertyNames()) {
            props.setProperty(key, overrides.getProperty(key));
        }
        return new ViewshedConfig(props);
    }

    /** A new request for the given observer, with every option taken from this configuration. */
    public ViewshedParameters defaultParameters (double observerX, double observerY, double observerHeight) {
        ViewshedParameters parameters = new ViewshedParameters(observerX, observerY, observerHeight);
        parameters.samplesPerCell = samplesPerCell;
        parameters.occlusionTolerance = occlusionTolerance;
        parameters.sectorResolution = sectorResolution;
        parameters.noDataPolicy = noDataPolicy;
        parameters.outputMode = outputMode;
        return parameters;
    }

    // INTERFACE IMPLEMENTATIONS

    @Override public int workerThreads () { return workerThreads; }

    public int samplesPerCell () { return samplesPerCell; }
    public double occlusionTolerance () { return occlusionTolerance; }
    public SectorResolution sectorResolution () { return sectorResolution; }
    public NoDataPolicy noDataPolicy () { return noDataPolicy; }
    public OutputMode outputMode () { return outputMode; }

}

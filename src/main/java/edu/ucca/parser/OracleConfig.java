package edu.ucca.parser;

import edu.stanford.nlp.io.IOUtils;
import edu.stanford.nlp.util.PropertiesUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of a gold oracle, fixed when the oracle is created.
 */
public class OracleConfig {
    public static final String DEFAULT_RESOURCE = "ucca-oracle.properties";

    public static final String COMPOUND_SWAP = "oracle.compoundSwap";
    public static final String MAX_STEPS_PER_ELEMENT = "oracle.maxStepsPerElement";

    public static final OracleConfig DEFAULT = new OracleConfig(false, 100);

    private final boolean compoundSwap;
    private final int maxStepsPerElement;

    /**
     * @param compoundSwap whether a single SWAP may move several stack elements at once
     * @param maxStepsPerElement how many actions a derivation may take per terminal, unit and edge
     *                           of the gold passage before it is considered stuck
     */
    public OracleConfig(boolean compoundSwap, int maxStepsPerElement) {
        if (maxStepsPerElement < 1) {
            throw new IllegalArgumentException("maxStepsPerElement must be positive, got " + maxStepsPerElement);
        }
        this.compoundSwap = compoundSwap;
        this.maxStepsPerElement = maxStepsPerElement;
    }

    public static OracleConfig fromProperties(Properties props) {
        return new OracleConfig(
                PropertiesUtils.getBool(props, COMPOUND_SWAP, DEFAULT.compoundSwap),
                PropertiesUtils.getInt(props, MAX_STEPS_PER_ELEMENT, DEFAULT.maxStepsPerElement));
    }

    /**
     * Reads the configuration from a properties file, looked up as a URL, on the classpath, or on
     * the file system.
     */
    public static OracleConfig load(String path) throws IOException {
        return fromProperties(loadProperties(path));
    }

    public static Properties loadProperties(String path) throws IOException {
        Properties props = new Properties();
        try (InputStream is = IOUtils.getInputStreamFromURLOrClasspathOrFileSystem(path)) {
            props.load(is);
        }
        return props;
    }

    public boolean isCompoundSwap() {
        return compoundSwap;
    }

    public int getMaxStepsPerElement() {
        return maxStepsPerElement;
    }

    public OracleConfig withCompoundSwap(boolean compoundSwap) {
        return new OracleConfig(compoundSwap, maxStepsPerElement);
    }

    @Override
    public String toString() {
        return COMPOUND_SWAP + "=" + compoundSwap + ", " + MAX_STEPS_PER_ELEMENT + "=" + maxStepsPerElement;
    }
}

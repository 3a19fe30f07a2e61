package edu.ucca.parser;

import org.junit.Test;

import java.io.IOException;
import java.util.Properties;

import static org.junit.Assert.*;

public class OracleConfigTest {

    @Test
    public void testDefaults() {
        OracleConfig config = OracleConfig.fromProperties(new Properties());
        assertFalse(config.isCompoundSwap());
        assertEquals(100, config.getMaxStepsPerElement());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty(OracleConfig.COMPOUND_SWAP, "true");
        props.setProperty(OracleConfig.MAX_STEPS_PER_ELEMENT, "7");
        OracleConfig config = OracleConfig.fromProperties(props);
        assertTrue(config.isCompoundSwap());
        assertEquals(7, config.getMaxStepsPerElement());
        assertFalse(config.withCompoundSwap(false).isCompoundSwap());
        assertEquals(7, config.withCompoundSwap(false).getMaxStepsPerElement());
    }

    @Test
    public void testLoadFromClasspath() throws IOException {
        OracleConfig config = OracleConfig.load(OracleConfig.DEFAULT_RESOURCE);
        assertFalse(config.isCompoundSwap());
        assertEquals(OracleConfig.DEFAULT.getMaxStepsPerElement(), config.getMaxStepsPerElement());
        assertEquals("0", OracleConfig.loadProperties(OracleConfig.DEFAULT_RESOURCE).getProperty("corpus.threads"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStepsMustBePositive() {
        new OracleConfig(true, 0);
    }
}

package com.ttennebkram.rmstripes.wavelet;

import com.ttennebkram.rmstripes.ConfigurationException;
import org.junit.Test;

import static org.junit.Assert.*;

public class WaveletsTest {

    @Test
    public void lookupIgnoresCase() {
        assertSame(Wavelets.get("db10"), Wavelets.get("DB10"));
        assertSame(Wavelets.get("bior2.8"), Wavelets.get(" Bior2.8 "));
        assertEquals(20, Wavelets.get("db10").getFilterLength());
    }

    @Test
    public void db1IsHaar() {
        assertSame(Wavelets.get("haar"), Wavelets.get("db1"));
    }

    @Test
    public void unknownNameListsAvailableWavelets() {
        try {
            Wavelets.get("db99");
            fail("expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("db99"));
            assertTrue(e.getMessage(), e.getMessage().contains("sym8"));
        }
        assertFalse(Wavelets.isKnown("db99"));
        assertFalse(Wavelets.isKnown(null));
    }

    @Test(expected = ConfigurationException.class)
    public void nullNameIsRejected() {
        Wavelets.get(null);
    }

    @Test
    public void registeredFiltersHaveUnitDcGain() {
        double sqrt2 = Math.sqrt(2);
        for (String name : Wavelets.names()) {
            Wavelet w = Wavelets.get(name);
            assertEquals(name, sqrt2, sum(w.getScalingDecomposition()), 1e-8);
            assertEquals(name, 0.0, sum(w.getWaveletDecomposition()), 1e-8);
            assertEquals(name, sqrt2, sum(w.getScalingReconstruction()), 1e-8);
            assertEquals(name, 0.0, sum(w.getWaveletReconstruction()), 1e-8);
        }
    }

    @Test
    public void boundaryFreeLevelFollowsFilterLength() {
        // haar spans 1 sample: 64 supports 6 halvings
        assertEquals(6, Wavelets.get("haar").boundaryFreeLevel(64));
        // db10 spans 19 samples
        assertEquals(1, Wavelets.get("db10").boundaryFreeLevel(64));
        assertEquals(0, Wavelets.get("db10").boundaryFreeLevel(20));
    }

    @Test(expected = IllegalArgumentException.class)
    public void oddFilterLengthIsRejected() {
        new Wavelet("broken", new double[]{1, 2, 3}, new double[]{1, 2, 3}, new double[]{1, 2, 3}, new double[]{1, 2, 3});
    }

    private static double sum(double[] values) {
        double s = 0;
        for (double v : values) {
            s += v;
        }
        return s;
    }
}

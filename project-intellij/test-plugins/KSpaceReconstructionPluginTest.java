import ij.ImagePlus;
import ij.plugin.filter.PlugInFilter;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KSpaceReconstructionPluginTest {

    private ImagePlus kspace;
    private KSpaceReconstruction_ plugin;

    @BeforeEach
    void setUp() {
        Complex[][] values = KSpaceReconstructor.acquire(TestArrays.randomImage(16, 16, 61)).getValues();
        kspace = KSpaceImages.toStack("phantom", values);
        plugin = new KSpaceReconstruction_();
        plugin.setLogging(false);
        plugin.setDisplay(false);
    }

    @Test
    void setup_acceptsModeLabels() {
        assertEquals(PlugInFilter.DOES_ALL + PlugInFilter.NO_CHANGES, plugin.setup("mask", kspace));
        assertEquals(KSpaceReconstruction_.MASK, plugin.getMode());
        plugin.setup("interference", kspace);
        assertEquals(KSpaceReconstruction_.INTERFERENCE, plugin.getMode());
        plugin.setup("defaults", kspace);
        assertEquals(KSpaceReconstruction_.INTERFERENCE, plugin.getMode());
    }

    @Test
    void setup_withoutImage_isDone() {
        assertEquals(PlugInFilter.DONE, plugin.setup("none", null));
    }

    @Test
    @DisplayName("No modification reconstructs the stored k-space")
    void noneMode_reconstructsWithoutDifference() {
        plugin.setup("none", kspace);
        plugin.run(kspace.getProcessor());

        assertSame(plugin.getFullReconstruction(), plugin.getReconstruction());
        assertNull(plugin.getMagnitudeDifference());
        assertNull(plugin.getMask());
        TestArrays.assertClose(KSpaceReconstructor.reconstruct(KSpaceImages.toSpectrum(kspace)),
                plugin.getReconstruction(), 1e-12);
    }

    @Test
    void maskMode_usesTheConfiguredBand() {
        plugin.setMask(1, -2, 3, 2, false);
        plugin.setup("mask", kspace);
        plugin.run(kspace.getProcessor());

        boolean[][] expected = FrequencyMask.buildRectangularMask(16, 16, 1, -2, 3, 2);
        assertEquals(FrequencyMask.countRetained(expected), FrequencyMask.countRetained(plugin.getMask()));
        assertTrue(plugin.getMask()[9][6]);
        assertFalse(plugin.getMask()[8][9]);
        TestArrays.assertClose(KSpaceReconstructor.reconstruct(KSpaceImages.toSpectrum(kspace), expected),
                plugin.getReconstruction(), 1e-12);

        double[][] difference = plugin.getMagnitudeDifference();
        assertEquals(16, difference.length);
        assertEquals(plugin.getFullReconstruction()[3][5].abs() - plugin.getReconstruction()[3][5].abs(),
                difference[3][5], 1e-12);
    }

    @Test
    void bandStop_invertsTheMask() {
        plugin.setMask(0, 0, 2, 2, true);
        plugin.setup("mask", kspace);
        plugin.run(kspace.getProcessor());

        assertEquals(256 - 25, FrequencyMask.countRetained(plugin.getMask()));
        assertFalse(plugin.getMask()[8][8]);
    }

    @Test
    void interferenceMode_overwritesOneCoefficient() {
        Complex value = new Complex(500.0, -200.0);
        plugin.setInterference(-3, 2, value);
        plugin.setup("interference", kspace);
        plugin.run(kspace.getProcessor());

        CentredSpectrum corrupted = new CentredSpectrum(
                InterferenceInjector.injectPoint(KSpaceImages.toComplex(kspace), -3, 2, value));
        TestArrays.assertClose(KSpaceReconstructor.reconstruct(corrupted), plugin.getReconstruction(), 1e-12);
        assertNotNull(plugin.getMagnitudeDifference());
    }

    @Test
    void loggedRun_completes() {
        plugin.setLogging(true);
        plugin.setFieldOfView(32.0, 16.0);
        plugin.setMask(0, 0, 4, 4, false);
        plugin.setup("mask", kspace);
        plugin.run(kspace.getProcessor());
        assertNotNull(plugin.getReconstruction());
    }
}

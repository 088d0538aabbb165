import ij.ImagePlus;
import ij.measure.Calibration;
import ij.plugin.filter.PlugInFilter;
import ij.process.FloatProcessor;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CreateKSpacePluginTest {

    private static ImagePlus testImage(double[][] values) {
        return new ImagePlus("phantom", new FloatProcessor(ArrayConversions.convertDoubleToFloat(values)));
    }

    @Test
    void setup_withoutImage_isDone() {
        assertEquals(PlugInFilter.DONE, new CreateKSpace_().setup("", null));
    }

    @Test
    void createdStack_holdsCentredKSpace() {
        double[][] values = TestArrays.randomImage(16, 12, 71);
        ImagePlus imp = testImage(values);

        CreateKSpace_ plugin = new CreateKSpace_();
        plugin.setDisplay(false);
        plugin.setLogging(false);
        assertEquals(PlugInFilter.DOES_ALL + PlugInFilter.NO_CHANGES, plugin.setup("", imp));
        plugin.run(imp.getProcessor());

        ImagePlus kspace = plugin.getKSpaceImage();
        assertEquals(2, kspace.getStackSize());
        assertEquals("K-space of phantom", kspace.getTitle());

        // the image went through 32-bit floats on the way in and the way out
        Complex[][] expected = KSpaceReconstructor.acquire(
                ArrayConversions.convertFloatToDouble(imp.getProcessor().getFloatArray())).getValues();
        TestArrays.assertClose(expected, KSpaceImages.toComplex(kspace), 1e-6);
    }

    @Test
    void stackIsCalibratedInSpatialFrequency() {
        ImagePlus imp = testImage(TestArrays.randomImage(8, 4, 72));
        Calibration cal = imp.getCalibration();
        cal.pixelWidth = 0.5;
        cal.pixelHeight = 2.0;
        cal.setUnit("mm");
        imp.setCalibration(cal);

        CreateKSpace_ plugin = new CreateKSpace_();
        plugin.setDisplay(false);
        plugin.setLogging(false);
        plugin.setup("", imp);
        plugin.run(imp.getProcessor());

        Calibration kspace_cal = plugin.getKSpaceImage().getCalibration();
        // Kmax = 1 / pixel size
        assertEquals(2.0 / 8, kspace_cal.pixelWidth, 1e-12);
        assertEquals(0.5 / 4, kspace_cal.pixelHeight, 1e-12);
        assertEquals(4.0, kspace_cal.xOrigin, 0.0);
        assertEquals(2.0, kspace_cal.yOrigin, 0.0);
        assertEquals("mm^-1", kspace_cal.getUnit());
    }

    @Test
    void createdKSpace_reconstructsTheImage() {
        double[][] values = {{1, 2, 3, 4, 5}, {6, 7, 8, 9, 10}, {11, 12, 13, 14, 15}};
        ImagePlus imp = testImage(values);

        CreateKSpace_ plugin = new CreateKSpace_();
        plugin.setDisplay(false);
        plugin.setLogging(false);
        plugin.setup("", imp);
        plugin.run(imp.getProcessor());

        Complex[][] image = KSpaceReconstructor.reconstruct(KSpaceImages.toSpectrum(plugin.getKSpaceImage()));
        TestArrays.assertClose(ArrayConversions.toComplex(values), image, 1e-5);
    }
}

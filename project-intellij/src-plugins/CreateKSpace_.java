// ImageJ plugin to simulate the acquisition of the current image: the image is
// Fourier transformed and the result stored, with zero frequency at the centre,
// as a two-slice stack (real, imaginary) that KSpaceReconstruction_ can read.

import ij.IJ;
import ij.ImagePlus;
import ij.measure.Calibration;
import ij.plugin.filter.PlugInFilter;
import ij.process.ImageProcessor;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

/**
 * ImageJ plugin to create centre-origin k-space from the current image.
 */
public class CreateKSpace_ implements PlugInFilter {
    private ImagePlus imp;
    private ImagePlus kspace_image;

    private boolean log_results = true;
    private boolean show_images = true;


    /** Method to enable or disable the display of the result
     *
     * @param show_images Boolean value to set image display on or off
     */
    void setDisplay(boolean show_images) { this.show_images = show_images; }


    /** Method to enable or disable writing to the ImageJ log
     *
     * @param log_condition Boolean value to set logging on or off
     */
    void setLogging(boolean log_condition) { this.log_results = log_condition; }


    /** Method to return the k-space stack created by the last run
     *
     * @return Two-slice (real, imaginary) stack, or null if the plugin has not run
     */
    ImagePlus getKSpaceImage() { return this.kspace_image; }


    /**
     * This method is automatically run by ImageJ when the plugin is called.
     *
     * @param arg Not used by this plugin
     * @param imp Passed to the routine automatically by ImageJ.
     * @return DONE if there is no image; DOES_ALL + NO_CHANGES otherwise
     */
    public int setup(String arg, ImagePlus imp) {
        this.imp = imp;
        if (this.imp == null) {
            return DONE;
        }
        return DOES_ALL + NO_CHANGES;
    }


    /**
     * This method is called automatically by ImageJ once the <i>setup</i> method has completed.
     * The pixel values of the current slice are transformed. The k-space stack is
     * calibrated in spatial frequency using the pixel size of the image.
     *
     * @param ip The ImageProcessor that is passed to this method automatically by ImageJ
     */
    public void run(ImageProcessor ip) {
        double[][] pixels = ArrayConversions.convertFloatToDouble(ip.getFloatArray());

        Calibration cal = this.imp.getCalibration();
        double fov_x = ip.getWidth() * cal.pixelWidth;
        double fov_y = ip.getHeight() * cal.pixelHeight;

        CentredSpectrum spectrum;
        double k_max_x, k_max_y;
        try {
            IJ.showStatus("Transforming " + this.imp.getTitle());
            spectrum = KSpaceReconstructor.acquire(pixels);
            k_max_x = SpatialFrequency.maxFrequency(fov_x, ip.getWidth());
            k_max_y = SpatialFrequency.maxFrequency(fov_y, ip.getHeight());
        } catch (MathIllegalArgumentException e) {
            IJ.error("There was a problem transforming the image:\n" + e.getMessage());
            return;
        }

        this.kspace_image = KSpaceImages.toStack("K-space of " + this.imp.getTitle(), spectrum.getValues());
        KSpaceImages.calibrateFrequency(this.kspace_image, k_max_x, k_max_y, cal.getUnit());

        if (this.log_results) {
            IJ.log("K-space of " + this.imp.getTitle() + "," + spectrum.getWidth() + " x " + spectrum.getHeight());
            IJ.log("Kmax x (" + cal.getUnit() + "^-1)," + k_max_x);
            IJ.log("Kmax y (" + cal.getUnit() + "^-1)," + k_max_y);
            IJ.log("Energy," + FourierTransformPair.energy(spectrum.getValues()));
        }

        if (this.show_images) {
            this.kspace_image.show();
        }
    }
}



/*
 * MIT License
 *
 * Copyright (c) 2019 David Platten
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

import ij.IJ;
import ij.ImagePlus;
import ij.gui.GenericDialog;
import ij.plugin.filter.PlugInFilter;
import ij.process.ImageProcessor;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.text.DecimalFormat;
import java.util.Arrays;


/**
 * An ImageJ plugin to reconstruct an image from k-space, optionally after selecting a band of
 * spatial frequencies or corrupting a single coefficient.
 * <br><br>
 * The current image must be a stack of two slices holding the real and imaginary parts of
 * centre-origin k-space (see {@link KSpaceImages}; {@link CreateKSpace_} makes one from an
 * ordinary image). The plugin shows:
 * <ul>
 *     <li>the magnitude and phase of the reconstruction</li>
 *     <li>for the mask and interference modes, the signed difference |full| - |modified| between
 *     the reconstruction of the unmodified k-space and the modified one</li>
 *     <li>for the mask mode, the mask itself</li>
 * </ul>
 * Mask offsets and the interference position are given relative to the zero-frequency element,
 * which sits at (width/2, height/2) truncated toward zero.
 */
public class KSpaceReconstruction_ implements PlugInFilter {
    private ImagePlus imp;

    // It is important that the constants below are in alphabetical order
    // so that the binarySearch that is used later works correctly.
    static final int INTERFERENCE=0, MASK=1, NONE=2;
    private static final String[] MODE_LABELS = {"interference", "mask", "none"};
    private int mode = NONE;

    private int offset_x = 0;
    private int offset_y = 0;
    private int half_x = 8;
    private int half_y = 8;
    private boolean band_stop = false;

    private int position_x = 4;
    private int position_y = 4;
    private double interference_real = 1.0e4;
    private double interference_imag = 0.0;

    private double field_of_view_x = 0.0; // in image units; 0 means one unit per pixel
    private double field_of_view_y = 0.0;

    private boolean log_results = true;
    private boolean show_images = true;

    private Complex[][] reconstruction;
    private Complex[][] full_reconstruction;
    private double[][] magnitude_difference;
    private boolean[][] mask;

    private DecimalFormat three_dp = new DecimalFormat("0.000");


    /** Method to enable or disable the display of result images
     *
     * @param show_images Boolean value to set image display on or off
     */
    void setDisplay(boolean show_images) { this.show_images = show_images; }


    /** Method to enable or disable writing to the ImageJ log
     *
     * @param log_condition Boolean value to set logging on or off
     */
    void setLogging(boolean log_condition) { this.log_results = log_condition; }


    /** Method to set the rectangular band that the mask mode retains
     *
     * @param offset_x Offset of the band centre from zero frequency along x (pixels)
     * @param offset_y Offset of the band centre from zero frequency along y (pixels)
     * @param half_x Half width of the band (pixels)
     * @param half_y Half height of the band (pixels)
     * @param band_stop If true the band is removed instead of kept
     */
    void setMask(int offset_x, int offset_y, int half_x, int half_y, boolean band_stop) {
        this.offset_x = offset_x;
        this.offset_y = offset_y;
        this.half_x = half_x;
        this.half_y = half_y;
        this.band_stop = band_stop;
    }


    /** Method to set the coefficient that the interference mode overwrites
     *
     * @param position_x Position relative to zero frequency along x (pixels)
     * @param position_y Position relative to zero frequency along y (pixels)
     * @param value The value written at that position
     */
    void setInterference(int position_x, int position_y, Complex value) {
        this.position_x = position_x;
        this.position_y = position_y;
        this.interference_real = value.getReal();
        this.interference_imag = value.getImaginary();
    }


    /** Method to set the field of view used to express frequencies in the log
     *
     * @param field_of_view_x Length of the image along x, in image units
     * @param field_of_view_y Length of the image along y, in image units
     */
    void setFieldOfView(double field_of_view_x, double field_of_view_y) {
        this.field_of_view_x = field_of_view_x;
        this.field_of_view_y = field_of_view_y;
    }


    int getMode() { return this.mode; }

    /** @return The complex image from the last run, after any mask or interference */
    Complex[][] getReconstruction() { return this.reconstruction; }

    /** @return The complex image of the unmodified k-space from the last run */
    Complex[][] getFullReconstruction() { return this.full_reconstruction; }

    /** @return |full| - |modified| from the last run, or null in the NONE mode */
    double[][] getMagnitudeDifference() { return this.magnitude_difference; }

    /** @return The centre-origin mask from the last run, or null if no mask was used */
    boolean[][] getMask() { return this.mask; }


    /**
     * This method is automatically run by ImageJ when the plugin is called.
     *
     * @param arg <i>none</i>, <i>mask</i> or <i>interference</i> selects the mode and runs with the
     *            current settings; <i>defaults</i> runs the current mode with the current settings.
     *            If empty then the user is prompted for the options.
     * @param imp Passed to the routine automatically by ImageJ.
     * @return DONE if unsuccessful; DOES_ALL + NO_CHANGES otherwise
     */
    public int setup(String arg, ImagePlus imp) {
        this.imp = imp;

        if (this.imp == null) {
            return DONE;
        }

        if (this.imp.getStackSize() != 2) {
            IJ.error("K-space reconstruction needs a stack of two slices (real, imaginary)");
            return DONE;
        }

        if ((arg != null) && (arg.length() > 0)) {
            int requested_mode = Arrays.binarySearch(MODE_LABELS, arg);
            if (requested_mode >= 0) {
                this.mode = requested_mode;
            }
            else if (!arg.equals("defaults")) {
                IJ.error("Unrecognised value passed to setup: " + arg);
                return DONE;
            }
        }
        else {
            GenericDialog gd = new GenericDialog("K-space reconstruction options");
            gd.addChoice("Modification:", MODE_LABELS, MODE_LABELS[this.mode]);
            gd.addMessage("Mask (pixels, relative to zero frequency)");
            gd.addNumericField("Band centre offset x", this.offset_x, 0);
            gd.addNumericField("Band centre offset y", this.offset_y, 0);
            gd.addNumericField("Band half width", this.half_x, 0);
            gd.addNumericField("Band half height", this.half_y, 0);
            gd.addCheckbox("Remove the band instead of keeping it", this.band_stop);
            gd.addMessage("Interference (pixels, relative to zero frequency)");
            gd.addNumericField("Position x", this.position_x, 0);
            gd.addNumericField("Position y", this.position_y, 0);
            gd.addNumericField("Value (real part)", this.interference_real, 1);
            gd.addNumericField("Value (imaginary part)", this.interference_imag, 1);
            gd.addMessage("Field of view for the frequency scale (0 = 1 unit per pixel)");
            gd.addNumericField("Field of view x", this.field_of_view_x, 2);
            gd.addNumericField("Field of view y", this.field_of_view_y, 2);
            gd.showDialog();
            if (gd.wasCanceled()) {
                return DONE;
            }

            this.mode = Arrays.binarySearch(MODE_LABELS, gd.getNextChoice());
            this.offset_x = (int) gd.getNextNumber();
            this.offset_y = (int) gd.getNextNumber();
            this.half_x = (int) gd.getNextNumber();
            this.half_y = (int) gd.getNextNumber();
            this.band_stop = gd.getNextBoolean();
            this.position_x = (int) gd.getNextNumber();
            this.position_y = (int) gd.getNextNumber();
            this.interference_real = gd.getNextNumber();
            this.interference_imag = gd.getNextNumber();
            this.field_of_view_x = gd.getNextNumber();
            this.field_of_view_y = gd.getNextNumber();
        }
        return DOES_ALL + NO_CHANGES;
    }


    /**
     * This method is called automatically by ImageJ once the <i>setup</i> method has completed.
     * Both slices of the stack are read, whichever slice is current.
     *
     * @param ip The ImageProcessor that is passed to this method automatically by ImageJ
     */
    public void run(ImageProcessor ip) {
        this.magnitude_difference = null;
        this.mask = null;

        try {
            IJ.showStatus("Reconstructing " + this.imp.getTitle());
            CentredSpectrum spectrum = KSpaceImages.toSpectrum(this.imp);
            this.full_reconstruction = KSpaceReconstructor.reconstruct(spectrum);
            IJ.showProgress(0.5);

            if (this.mode == MASK) {
                boolean[][] band = FrequencyMask.buildRectangularMask(spectrum.getWidth(), spectrum.getHeight(),
                        this.offset_x, this.offset_y, this.half_x, this.half_y);
                this.mask = this.band_stop ? FrequencyMask.invert(band) : band;
                this.reconstruction = KSpaceReconstructor.reconstruct(spectrum, this.mask);
            }
            else if (this.mode == INTERFERENCE) {
                Complex value = new Complex(this.interference_real, this.interference_imag);
                this.reconstruction = KSpaceReconstructor.reconstructWithInterference(spectrum,
                        this.position_x, this.position_y, value);
            }
            else {
                this.reconstruction = this.full_reconstruction;
            }

            if (this.mode != NONE) {
                this.magnitude_difference = SpectrumComparator.magnitudeDifference(this.full_reconstruction, this.reconstruction);
            }

            IJ.showProgress(1.0);

            if (this.log_results) logReconstruction(spectrum);
        }
        catch (MathIllegalArgumentException e) {
            IJ.error("There was a problem reconstructing the image:\n" + e.getMessage());
            return;
        }

        if (this.show_images) showResults();
    }


    /**
     * Method to write the reconstruction settings and a summary of the result to the ImageJ log.
     *
     * @param spectrum The k-space that was reconstructed
     */
    private void logReconstruction(CentredSpectrum spectrum) {
        int width = spectrum.getWidth();
        int height = spectrum.getHeight();
        double k_max_x = SpatialFrequency.maxFrequency(fieldOfView(this.field_of_view_x, width), width);
        double k_max_y = SpatialFrequency.maxFrequency(fieldOfView(this.field_of_view_y, height), height);

        IJ.log("K-space reconstruction of " + this.imp.getTitle());
        IJ.log("Size," + width + " x " + height);
        IJ.log("Zero frequency index," + spectrum.getCentreIndexX() + ", " + spectrum.getCentreIndexY());
        IJ.log("Modification," + MODE_LABELS[this.mode]);

        if (this.mode == MASK) {
            int first_x = spectrum.toAbsoluteX(this.offset_x - this.half_x);
            int last_x = spectrum.toAbsoluteX(this.offset_x + this.half_x);
            int first_y = spectrum.toAbsoluteY(this.offset_y - this.half_y);
            int last_y = spectrum.toAbsoluteY(this.offset_y + this.half_y);
            IJ.log("Band," + (this.band_stop ? "stop" : "pass"));
            IJ.log("Band Kx range," + this.three_dp.format(SpatialFrequency.frequencyAt(first_x, width, k_max_x))
                    + ", " + this.three_dp.format(SpatialFrequency.frequencyAt(last_x, width, k_max_x)));
            IJ.log("Band Ky range," + this.three_dp.format(SpatialFrequency.frequencyAt(first_y, height, k_max_y))
                    + ", " + this.three_dp.format(SpatialFrequency.frequencyAt(last_y, height, k_max_y)));
            IJ.log("Coefficients retained," + FrequencyMask.countRetained(this.mask) + " of " + (width * height));
        }
        else if (this.mode == INTERFERENCE) {
            int index_x = spectrum.toAbsoluteX(this.position_x);
            int index_y = spectrum.toAbsoluteY(this.position_y);
            IJ.log("Interference index," + index_x + ", " + index_y);
            IJ.log("Interference Kx, Ky," + this.three_dp.format(SpatialFrequency.frequencyAt(index_x, width, k_max_x))
                    + ", " + this.three_dp.format(SpatialFrequency.frequencyAt(index_y, height, k_max_y)));
            IJ.log("Interference value," + this.interference_real + ", " + this.interference_imag);
        }

        IJ.log("K-space energy," + this.three_dp.format(FourierTransformPair.energy(spectrum.getValues())));
        IJ.log("Image energy," + this.three_dp.format(FourierTransformPair.energy(this.reconstruction)));
        if (this.mode != NONE) {
            IJ.log("Largest change," + this.three_dp.format(
                    SpectrumComparator.maxAbsoluteDifference(this.full_reconstruction, this.reconstruction)));
        }
        IJ.log("\n");
    }


    /**
     * Method to display the magnitude, phase, difference and mask images.
     */
    private void showResults() {
        String title = this.imp.getTitle();

        ImagePlus magnitude_image = KSpaceImages.toImage("Magnitude of " + title, ArrayConversions.magnitude(this.reconstruction));
        magnitude_image.show();
        IJ.run(magnitude_image, "Enhance Contrast", "saturated=0.35");

        ImagePlus phase_image = KSpaceImages.toImage("Phase of " + title, ArrayConversions.phase(this.reconstruction));
        phase_image.show();

        if (this.magnitude_difference != null) {
            ImagePlus difference_image = KSpaceImages.toImage("Magnitude difference of " + title, this.magnitude_difference);
            difference_image.show();
            IJ.run(difference_image, "Enhance Contrast", "saturated=0.35");
        }

        if (this.mask != null) {
            KSpaceImages.toMaskImage("Mask of " + title, this.mask).show();
        }
    }


    /**
     * @return The field of view, or the number of pixels if none was given
     */
    private static double fieldOfView(double field_of_view, int size) {
        return (field_of_view > 0.0) ? field_of_view : size;
    }
}

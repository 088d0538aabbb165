// ImageJ plugin to show the sinusoid that a k-space coefficient encodes. The
// pattern is either given directly (periods, cycles and phases) or by the
// absolute index of a coefficient in centre-origin k-space.

import ij.IJ;
import ij.ImagePlus;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

/**
 *
 */
public class BasisSinusoid_ implements PlugIn {

    private int width = 64;
    private int height = 64;
    private boolean by_index = true;

    private int index_x = 36;
    private int index_y = 32;

    private double period_x = 64.0;
    private double period_y = 64.0;
    private double freq_x = 4.0;
    private double freq_y = 0.0;
    private double phase_x = 0.0;
    private double phase_y = 0.0;

    private ImagePlus sinusoid_image;

    void setSize(int width, int height) { this.width = width; this.height = height; }

    void setIndex(int index_x, int index_y) {
        this.by_index = true;
        this.index_x = index_x;
        this.index_y = index_y;
    }

    void setPattern(double period_x, double period_y, double freq_x, double freq_y, double phase_x, double phase_y) {
        this.by_index = false;
        this.period_x = period_x;
        this.period_y = period_y;
        this.freq_x = freq_x;
        this.freq_y = freq_y;
        this.phase_x = phase_x;
        this.phase_y = phase_y;
    }

    ImagePlus getSinusoidImage() { return this.sinusoid_image; }


    /** Method to run the plugin
     *
     * @param arg If <i>defaults</i> the image is created from the current settings without a dialog
     */
    public void run(String arg) {
        if (!"defaults".equals(arg)) {
            GenericDialog gd = new GenericDialog("Basis sinusoid");
            gd.addNumericField("Image width (pixels)", this.width, 0);
            gd.addNumericField("Image height (pixels)", this.height, 0);
            gd.addCheckbox("Use the k-space index below", this.by_index);
            gd.addNumericField("K-space index x", this.index_x, 0);
            gd.addNumericField("K-space index y", this.index_y, 0);
            gd.addMessage("Otherwise use:");
            gd.addNumericField("Period x (pixels)", this.period_x, 1);
            gd.addNumericField("Period y (pixels)", this.period_y, 1);
            gd.addNumericField("Cycles per period x", this.freq_x, 2);
            gd.addNumericField("Cycles per period y", this.freq_y, 2);
            gd.addNumericField("Phase x (radians)", this.phase_x, 3);
            gd.addNumericField("Phase y (radians)", this.phase_y, 3);
            gd.showDialog();
            if (gd.wasCanceled()) {
                return; // Return to the calling method
            }

            this.width = (int) gd.getNextNumber();
            this.height = (int) gd.getNextNumber();
            this.by_index = gd.getNextBoolean();
            this.index_x = (int) gd.getNextNumber();
            this.index_y = (int) gd.getNextNumber();
            this.period_x = gd.getNextNumber();
            this.period_y = gd.getNextNumber();
            this.freq_x = gd.getNextNumber();
            this.freq_y = gd.getNextNumber();
            this.phase_x = gd.getNextNumber();
            this.phase_y = gd.getNextNumber();
        }

        try {
            createSinusoidImage();
        } catch (MathIllegalArgumentException e) {
            IJ.error("Unable to create the sinusoid:\n" + e.getMessage());
            return;
        }
        this.sinusoid_image.show();
    }


    /**
     * Method to create the sinusoid image from the current settings. The image is stored and
     * can be obtained with {@link #getSinusoidImage()}.
     */
    void createSinusoidImage() {
        double[][] pattern;
        String title;
        if (this.by_index) {
            pattern = SinusoidSynthesizer.basisForIndex(this.width, this.height, this.index_x, this.index_y);
            title = "Basis sinusoid at k-space index " + this.index_x + ", " + this.index_y;
        }
        else {
            pattern = SinusoidSynthesizer.synthesize(this.width, this.height, this.period_x, this.period_y,
                    this.freq_x, this.freq_y, this.phase_x, this.phase_y);
            title = "Sinusoid " + this.freq_x + " x " + this.freq_y + " cycles";
        }
        this.sinusoid_image = KSpaceImages.toImage(title, pattern);
    }
}

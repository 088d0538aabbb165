import ij.ImagePlus;
import ij.ImageStack;
import ij.gui.NewImage;
import ij.measure.Calibration;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;

/**
 * Conversions between ImageJ images and the arrays used by the reconstruction classes.
 * <br><br>
 * Complex data is held in ImageJ as a stack of two 32-bit slices: slice 1 holds the real part
 * and slice 2 the imaginary part. Pixel (x, y) corresponds to element [x][y], which is also how
 * {@link ij.process.ImageProcessor#getFloatArray()} lays out its values.
 */
public class KSpaceImages {

    static final String REAL_LABEL = "Real";
    static final String IMAGINARY_LABEL = "Imaginary";


    /**
     * Method to read a two-slice (real, imaginary) stack as centre-origin k-space.
     *
     * @param imp A stack with exactly two slices
     * @return The k-space held in the stack
     * @throws DimensionMismatchException if the stack does not have two slices
     */
    public static CentredSpectrum toSpectrum(ImagePlus imp) {
        return new CentredSpectrum(toComplex(imp));
    }


    /**
     * Method to read a two-slice (real, imaginary) stack as a complex array.
     *
     * @param imp A stack with exactly two slices
     * @return Two-dimensional array of complex values, indexed [x][y]
     * @throws DimensionMismatchException if the stack does not have two slices
     */
    public static Complex[][] toComplex(ImagePlus imp) {
        if (imp == null) {
            throw new NullArgumentException();
        }
        ImageStack stack = imp.getStack();
        if (stack.getSize() != 2) {
            throw new DimensionMismatchException(stack.getSize(), 2);
        }
        double[][] real = ArrayConversions.convertFloatToDouble(stack.getProcessor(1).getFloatArray());
        double[][] imaginary = ArrayConversions.convertFloatToDouble(stack.getProcessor(2).getFloatArray());
        return ArrayConversions.toComplex(real, imaginary);
    }


    /**
     * Method to store a complex array as a two-slice (real, imaginary) 32-bit stack.
     *
     * @param title The title of the new image
     * @param values Two-dimensional array of complex values, indexed [x][y]
     * @return A new, unshown ImagePlus
     */
    public static ImagePlus toStack(String title, Complex[][] values) {
        CentredSpectrum.checkRectangular(values);
        ImageStack stack = new ImageStack(values.length, values[0].length);
        stack.addSlice(REAL_LABEL, new FloatProcessor(ArrayConversions.convertDoubleToFloat(ArrayConversions.realPart(values))));
        stack.addSlice(IMAGINARY_LABEL, new FloatProcessor(ArrayConversions.convertDoubleToFloat(ArrayConversions.imaginaryPart(values))));
        return new ImagePlus(title, stack);
    }


    /**
     * Method to create a 32-bit image from an array of real values.
     *
     * @param title The title of the new image
     * @param values Two-dimensional array of values, indexed [x][y]
     * @return A new, unshown ImagePlus
     */
    public static ImagePlus toImage(String title, double[][] values) {
        CentredSpectrum.checkRectangular(values);
        ImagePlus imp = NewImage.createFloatImage(title, values.length, values[0].length, 1, NewImage.FILL_BLACK);
        imp.getProcessor().setFloatArray(ArrayConversions.convertDoubleToFloat(values));
        imp.getProcessor().resetMinAndMax();
        return imp;
    }


    /**
     * Method to create an 8-bit image of a mask: 255 where a coefficient is retained, 0 elsewhere.
     *
     * @param title The title of the new image
     * @param mask Two-dimensional mask, indexed [x][y]
     * @return A new, unshown ImagePlus
     */
    public static ImagePlus toMaskImage(String title, boolean[][] mask) {
        CentredSpectrum.checkRectangular(mask);
        ByteProcessor bp = new ByteProcessor(mask.length, mask[0].length);
        for (int x=0; x<mask.length; x++) {
            for (int y=0; y<mask[0].length; y++) {
                bp.set(x, y, mask[x][y] ? 255 : 0);
            }
        }
        return new ImagePlus(title, bp);
    }


    /**
     * Method to calibrate a k-space image in spatial frequency, so that ImageJ reports the
     * frequency of the pixel under the cursor. The origin is the real centre (width/2, height/2),
     * the same reference as {@link SpatialFrequency#frequencyAt(int, int, double)}; for odd sizes
     * it falls half a pixel after the truncated centre index.
     *
     * @param imp The k-space image
     * @param k_max_x Sampling frequency along x, see {@link SpatialFrequency#maxFrequency(double, int)}
     * @param k_max_y Sampling frequency along y
     * @param unit The length unit of the original image, e.g. "mm"
     */
    public static void calibrateFrequency(ImagePlus imp, double k_max_x, double k_max_y, String unit) {
        Calibration cal = new Calibration(imp);
        cal.pixelWidth = k_max_x / imp.getWidth();
        cal.pixelHeight = k_max_y / imp.getHeight();
        cal.xOrigin = imp.getWidth() / 2.0;
        cal.yOrigin = imp.getHeight() / 2.0;
        cal.setUnit(unit + "^-1");
        imp.setCalibration(cal);
    }
}

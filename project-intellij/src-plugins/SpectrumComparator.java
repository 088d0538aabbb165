import org.apache.commons.math3.complex.Complex;

/**
 * Compares two reconstructions of the same shape, e.g. a full reconstruction against one
 * made from masked or corrupted k-space.
 */
public class SpectrumComparator {

    /**
     * Method to calculate the signed difference of magnitudes, |a| - |b|, at each pixel.
     * Negative values mark pixels where <i>image_b</i> is the brighter of the two.
     *
     * @param image_a Two-dimensional array of complex values
     * @param image_b Two-dimensional array of complex values, same shape as <i>image_a</i>
     * @return A new array indexed [x][y]
     * @throws org.apache.commons.math3.exception.DimensionMismatchException if the shapes differ
     */
    public static double[][] magnitudeDifference(Complex[][] image_a, Complex[][] image_b) {
        checkShapes(image_a, image_b);

        double[][] result = new double[image_a.length][image_a[0].length];
        for (int x=0; x<image_a.length; x++) {
            for (int y=0; y<image_a[0].length; y++) {
                result[x][y] = ArrayConversions.magnitude(image_a[x][y]) - ArrayConversions.magnitude(image_b[x][y]);
            }
        }
        return result;
    }


    /**
     * Method to find the largest complex distance |a - b| between corresponding elements.
     *
     * @param image_a Two-dimensional array of complex values
     * @param image_b Two-dimensional array of complex values, same shape as <i>image_a</i>
     * @return The maximum distance, 0 for identical arrays
     * @throws org.apache.commons.math3.exception.DimensionMismatchException if the shapes differ
     */
    public static double maxAbsoluteDifference(Complex[][] image_a, Complex[][] image_b) {
        checkShapes(image_a, image_b);

        double max = 0.0;
        for (int x=0; x<image_a.length; x++) {
            for (int y=0; y<image_a[0].length; y++) {
                max = Math.max(max, ArrayConversions.magnitude(image_a[x][y].subtract(image_b[x][y])));
            }
        }
        return max;
    }


    private static void checkShapes(Complex[][] image_a, Complex[][] image_b) {
        CentredSpectrum.checkRectangular(image_a);
        CentredSpectrum.checkRectangular(image_b);
        CentredSpectrum.checkSameShape(image_a.length, image_a[0].length, image_b.length, image_b[0].length);
    }
}

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.ZeroException;
import org.apache.commons.math3.util.FastMath;

/**
 * Generates the real-valued sinusoidal basis pattern that a spatial frequency represents.
 * <br><br>
 * Each k-space coefficient is the weight of one 2d sinusoid in the image. Rendering that sinusoid
 * shows which periodic structure the coefficient (or a mask region around it) encodes.
 * <br><br>
 * The value at pixel (x, y) is
 * <br><br>
 * &pi; sin(2&pi; f<sub>x</sub> x / P<sub>x</sub> + &phi;<sub>x</sub> + 2&pi; f<sub>y</sub> y / P<sub>y</sub> + &phi;<sub>y</sub>)
 * <br><br>
 * where f is the number of cycles over a period P pixels long.
 */
public class SinusoidSynthesizer {

    /**
     * Method to generate a sinusoid with zero phase along both axes.
     *
     * @see #synthesize(int, int, double, double, double, double, double, double)
     */
    public static double[][] synthesize(int width, int height, double period_x, double period_y,
                                        double freq_x, double freq_y) {
        return synthesize(width, height, period_x, period_y, freq_x, freq_y, 0.0, 0.0);
    }


    /**
     * Method to generate a 2d sinusoid.
     *
     * @param width Number of pixels along x
     * @param height Number of pixels along y
     * @param period_x Length along x (pixels) over which <i>freq_x</i> cycles are counted
     * @param period_y Length along y (pixels) over which <i>freq_y</i> cycles are counted
     * @param freq_x Number of cycles per <i>period_x</i>
     * @param freq_y Number of cycles per <i>period_y</i>
     * @param phase_x Phase offset along x (radians)
     * @param phase_y Phase offset along y (radians)
     * @return A new array indexed [x][y]
     * @throws ZeroException if either period is zero
     */
    public static double[][] synthesize(int width, int height, double period_x, double period_y,
                                        double freq_x, double freq_y, double phase_x, double phase_y) {
        if (period_x == 0.0) {
            throw new ZeroException();
        }
        if (period_y == 0.0) {
            throw new ZeroException();
        }
        if (width < 1) {
            throw new NotStrictlyPositiveException(width);
        }
        if (height < 1) {
            throw new NotStrictlyPositiveException(height);
        }

        double k_x = 2.0 * FastMath.PI * freq_x / period_x;
        double k_y = 2.0 * FastMath.PI * freq_y / period_y;

        double[][] result = new double[width][height];
        for (int x=0; x<width; x++) {
            for (int y=0; y<height; y++) {
                result[x][y] = FastMath.PI * FastMath.sin(k_x * x + phase_x + k_y * y + phase_y);
            }
        }
        return result;
    }


    /**
     * Method to generate the basis sinusoid encoded by the coefficient at an absolute index of a
     * centre-origin k-space array. The coefficient (ix, iy) holds ix - c<sub>x</sub> cycles across
     * the width and iy - c<sub>y</sub> cycles across the height.
     *
     * @param width N<sub>x</sub> of the k-space array
     * @param height N<sub>y</sub> of the k-space array
     * @param index_x Absolute x index of the coefficient
     * @param index_y Absolute y index of the coefficient
     * @return A new array indexed [x][y]
     * @throws org.apache.commons.math3.exception.OutOfRangeException if the index is outside the array
     */
    public static double[][] basisForIndex(int width, int height, int index_x, int index_y) {
        int centre_x = CentredSpectrum.centreIndex(width);
        int centre_y = CentredSpectrum.centreIndex(height);
        // Range check only, the absolute index itself is already known
        CentredSpectrum.toAbsolute(index_x - centre_x, width);
        CentredSpectrum.toAbsolute(index_y - centre_y, height);

        return synthesize(width, height, width, height, index_x - centre_x, index_y - centre_y);
    }
}

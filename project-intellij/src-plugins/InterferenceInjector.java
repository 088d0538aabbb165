import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.NullArgumentException;

/**
 * Simulates a sensor artifact by overwriting a single k-space coefficient, typically with a
 * value far larger than the rest of the spectrum. A point in k-space becomes a sinusoidal stripe
 * pattern across the whole reconstructed image.
 */
public class InterferenceInjector {

    /**
     * Method to replace one coefficient of a centre-origin k-space array.
     *
     * @param spectrum Centre-origin k-space values, indexed [x][y]
     * @param position_x Position of the coefficient along x, relative to the zero-frequency element
     * @param position_y Position of the coefficient along y, relative to the zero-frequency element
     * @param value The new value of the coefficient
     * @return A copy of <i>spectrum</i> with the single coefficient replaced
     * @throws org.apache.commons.math3.exception.OutOfRangeException if the position maps outside the array
     */
    public static Complex[][] injectPoint(Complex[][] spectrum, int position_x, int position_y, Complex value) {
        if (value == null) {
            throw new NullArgumentException();
        }
        CentredSpectrum.checkRectangular(spectrum);
        int index_x = CentredSpectrum.toAbsolute(position_x, spectrum.length);
        int index_y = CentredSpectrum.toAbsolute(position_y, spectrum[0].length);

        Complex[][] result = CentredSpectrum.copy(spectrum);
        result[index_x][index_y] = value;
        return result;
    }
}

import org.apache.commons.math3.complex.Complex;

/**
 * Reconstruction pipeline from centre-origin k-space to the image:
 * <pre>
 *    k-space --[mask | interference]--> shift --> inverse transform --> image
 * </pre>
 * and the simulated acquisition that goes the other way. All methods return new arrays.
 */
public class KSpaceReconstructor {

    /** Method to reconstruct an image from centre-origin k-space.
     *
     * @param spectrum The k-space data
     * @return The complex image, indexed [x][y]
     */
    public static Complex[][] reconstruct(CentredSpectrum spectrum) {
        return FourierTransformPair.inverse(SpectrumShifter.shift(spectrum.getValues()));
    }


    /** Method to reconstruct an image from the coefficients that a mask retains.
     *
     * @param spectrum The k-space data
     * @param mask Centre-origin mask of the same shape as the k-space data
     * @return The complex image, indexed [x][y]
     */
    public static Complex[][] reconstruct(CentredSpectrum spectrum, boolean[][] mask) {
        Complex[][] masked = FrequencyMask.applyMask(spectrum.getValues(), mask);
        return FourierTransformPair.inverse(SpectrumShifter.shift(masked));
    }


    /** Method to reconstruct an image after overwriting one k-space coefficient.
     *
     * @param spectrum The k-space data
     * @param position_x Centre-origin x position of the coefficient
     * @param position_y Centre-origin y position of the coefficient
     * @param value The value to write at that position
     * @return The complex image, indexed [x][y]
     */
    public static Complex[][] reconstructWithInterference(CentredSpectrum spectrum, int position_x, int position_y,
                                                          Complex value) {
        Complex[][] corrupted = InterferenceInjector.injectPoint(spectrum.getValues(), position_x, position_y, value);
        return FourierTransformPair.inverse(SpectrumShifter.shift(corrupted));
    }


    /** Method to simulate the acquisition of an image: forward transform, then move zero frequency
     * to the centre.
     *
     * @param image Two-dimensional array of complex image values, indexed [x][y]
     * @return Centre-origin k-space
     */
    public static CentredSpectrum acquire(Complex[][] image) {
        return new CentredSpectrum(SpectrumShifter.inverseShift(FourierTransformPair.forward(image)));
    }


    /** Method to simulate the acquisition of a real-valued image.
     *
     * @param image Two-dimensional array of pixel values, indexed [x][y]
     * @return Centre-origin k-space
     */
    public static CentredSpectrum acquire(double[][] image) {
        return new CentredSpectrum(SpectrumShifter.inverseShift(FourierTransformPair.forward(image)));
    }
}

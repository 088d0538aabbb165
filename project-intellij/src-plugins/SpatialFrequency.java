import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.ZeroException;

/**
 * Conversion between k-space pixel indices and spatial frequencies.
 * <br><br>
 * The frequency scale is set by the sample spacing: for a field of view FOV sampled with N pixels
 * K<sub>max</sub> = 1 / (FOV / N). The pixel at index i of a centre-origin array then represents
 * <br><br>
 * K = K<sub>max</sub>/2 &times; (i - C) / C
 * <br><br>
 * cycles per unit length, where C = N/2 (not truncated). Frequencies run from -K<sub>max</sub>/2 at
 * index 0 to just below +K<sub>max</sub>/2. {@link KSpaceImages#calibrateFrequency} puts the image
 * origin at the same C, so the calibrated display and the logged values agree for odd sizes too.
 */
public class SpatialFrequency {

    /**
     * Method to calculate the sampling frequency.
     *
     * @param field_of_view Physical length covered by the samples (e.g. mm)
     * @param size Number of samples along the axis
     * @return K<sub>max</sub> in cycles per unit length
     * @throws ZeroException if the field of view is zero
     * @throws NotStrictlyPositiveException if size is less than 1
     */
    public static double maxFrequency(double field_of_view, int size) {
        if (size < 1) {
            throw new NotStrictlyPositiveException(size);
        }
        if (field_of_view == 0.0) {
            throw new ZeroException();
        }
        return 1.0 / (field_of_view / size);
    }


    /**
     * Method to calculate the spatial frequency represented by an index of a centre-origin axis.
     *
     * @param index Absolute index along the axis
     * @param size Number of samples along the axis
     * @param k_max Sampling frequency, see {@link #maxFrequency(double, int)}
     * @return The spatial frequency in cycles per unit length
     * @throws NotStrictlyPositiveException if size is less than 1
     */
    public static double frequencyAt(int index, int size, double k_max) {
        if (size < 1) {
            throw new NotStrictlyPositiveException(size);
        }
        double centre = size / 2.0;
        return k_max / 2.0 * (index - centre) / centre;
    }


    /**
     * Method to calculate the spatial frequency of every index of a centre-origin axis, e.g. for
     * labelling a plot axis.
     *
     * @param size Number of samples along the axis
     * @param k_max Sampling frequency
     * @return Array of <i>size</i> frequencies
     */
    public static double[] frequencyAxis(int size, double k_max) {
        if (size < 1) {
            throw new NotStrictlyPositiveException(size);
        }
        double[] axis = new double[size];
        for (int i=0; i<size; i++) {
            axis[i] = frequencyAt(i, size, k_max);
        }
        return axis;
    }
}

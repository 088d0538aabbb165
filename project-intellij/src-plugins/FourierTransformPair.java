

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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.apache.commons.math3.util.FastMath;

/**
 * Orthonormal two-dimensional discrete Fourier transform pair.
 * <br><br>
 * Both directions scale by 1/&radic;n along each axis, so each 2d transform divides by
 * &radic;(N<sub>x</sub> * N<sub>y</sub>) in total. This is the unitary convention:
 * <ul>
 *     <li>forward(inverse(X)) == X and inverse(forward(X)) == X, up to rounding</li>
 *     <li>the sum of squared magnitudes is the same in both domains (Parseval)</li>
 * </ul>
 * The transform is separable: every column is transformed, the result is transposed, every
 * column is transformed again and the result transposed back. Axes whose length is a power of
 * two use {@link FastFourierTransformer} with {@link DftNormalization#UNITARY}, O(n log n).
 * Other lengths are evaluated directly, O(n<sup>2</sup>), with the same scaling.
 * <br><br>
 * Input arrays must be in the corner-origin convention (zero frequency at [0][0]). Call
 * {@link SpectrumShifter#shift} first when starting from centre-origin k-space.
 */
public class FourierTransformPair {

    /** Method to carry out a two-dimensional forward Fourier transform.
     *
     * @param input_array Corner-origin array of complex values, indexed [x][y]
     * @return The forward transform, with the same dimensions as the input
     */
    public static Complex[][] forward(Complex[][] input_array) {
        return transform(input_array, TransformType.FORWARD);
    }


    /** Method to carry out a two-dimensional forward Fourier transform of real values.
     *
     * @param input_array Array of real values, indexed [x][y]
     * @return The forward transform, with the same dimensions as the input
     */
    public static Complex[][] forward(double[][] input_array) {
        return transform(ArrayConversions.toComplex(input_array), TransformType.FORWARD);
    }


    /** Method to carry out a two-dimensional inverse Fourier transform.
     *
     * @param input_array Corner-origin array of complex values, indexed [x][y]
     * @return The inverse transform, with the same dimensions as the input
     */
    public static Complex[][] inverse(Complex[][] input_array) {
        return transform(input_array, TransformType.INVERSE);
    }


    /**
     * Method to calculate the total energy of an array: the sum of the squared magnitudes of its
     * elements. With the unitary scaling this is unchanged by either transform.
     *
     * @param values Two-dimensional array of complex values
     * @return Sum of |v|<sup>2</sup>
     */
    public static double energy(Complex[][] values) {
        CentredSpectrum.checkRectangular(values);
        double sum = 0.0;
        for (Complex[] column : values) {
            for (Complex value : column) {
                sum += value.getReal() * value.getReal() + value.getImaginary() * value.getImaginary();
            }
        }
        return sum;
    }


    /** A method to carry out a two-dimensional forward or reverse Fourier transform.
     *
     * @param input_array A two-dimensional Complex array of values, indexed [x][y]
     * @param trans_type TransformType.INVERSE or TransformType.FORWARD
     * @return A two-dimensional array of complex numbers containing the result of the Fourier transform.
     *         The return array has the same dimensions as the input array.
     */
    private static Complex[][] transform(Complex[][] input_array, TransformType trans_type) {
        CentredSpectrum.checkRectangular(input_array);

        Complex[][] two_d_fft = new Complex[input_array.length][];

        // Fourier transform each column in the input array
        for (int col=0; col<input_array.length; col++) {
            two_d_fft[col] = transform1d(input_array[col], trans_type);
        }

        // Mirror the initial results along the diagonal so rows become columns
        two_d_fft = transpose(two_d_fft);

        for (int col=0; col<two_d_fft.length; col++) {
            two_d_fft[col] = transform1d(two_d_fft[col], trans_type);
        }

        // Mirror the results back to their original orientation
        return transpose(two_d_fft);
    }


    /**
     * Method to carry out a unitary one-dimensional transform, using the FFT where the length
     * allows it.
     */
    private static Complex[] transform1d(Complex[] values, TransformType trans_type) {
        if (values.length == 1) {
            return values.clone();
        }
        if (ArithmeticUtils.isPowerOfTwo(values.length)) {
            FastFourierTransformer fourier_transformer = new FastFourierTransformer(DftNormalization.UNITARY);
            return fourier_transformer.transform(values, trans_type);
        }
        return directTransform(values, trans_type);
    }


    /**
     * Method to evaluate the discrete Fourier transform directly for lengths that are not a
     * power of two:
     * <br><br>
     * y<sub>k</sub> = (1/&radic;n) &Sigma;<sub>j</sub> x<sub>j</sub> exp(&#8723;2&pi;i jk/n)
     * <br><br>
     * with the minus sign for the forward transform.
     *
     * @param values The values to transform
     * @param trans_type TransformType.INVERSE or TransformType.FORWARD
     * @return The transformed values
     */
    private static Complex[] directTransform(Complex[] values, TransformType trans_type) {
        int n = values.length;
        double sign = (trans_type == TransformType.FORWARD) ? -1.0 : 1.0;
        double scale = 1.0 / FastMath.sqrt(n);

        // Twiddle factors, indexed by (j*k) mod n so the angle never grows large
        double[] cos_table = new double[n];
        double[] sin_table = new double[n];
        for (int m=0; m<n; m++) {
            double angle = 2.0 * FastMath.PI * m / n;
            cos_table[m] = FastMath.cos(angle);
            sin_table[m] = sign * FastMath.sin(angle);
        }

        Complex[] result = new Complex[n];
        for (int k=0; k<n; k++) {
            double sum_re = 0.0;
            double sum_im = 0.0;
            for (int j=0; j<n; j++) {
                int m = (int) (((long) j * k) % n);
                double re = values[j].getReal();
                double im = values[j].getImaginary();
                sum_re += re * cos_table[m] - im * sin_table[m];
                sum_im += re * sin_table[m] + im * cos_table[m];
            }
            result[k] = new Complex(sum_re * scale, sum_im * scale);
        }
        return result;
    }


    /** Method to transpose a 2d array of complex numbers: the row and column indices are swapped.
     *   <pre>
     *    1   2   3   4    Transpose       1   5   9  13
     *    5   6   7   8    moves between   2   6  10  14
     *    9  10  11  12    these two       3   7  11  15
     *   13  14  15  16    arrays          4   8  12  16
     *  </pre>
     *
     * @param input A two-dimensional array of complex numbers
     * @return The transpose of the input, also a two-dimensional array of complex numbers
     */
    private static Complex[][] transpose(Complex[][] input) {
        Complex[][] output = new Complex[input[0].length][input.length];

        for (int i=0; i<input.length; i++) {
            for (int j=0; j<input[0].length; j++) {
                output[j][i] = input[i][j];
            }
        }

        return output;
    }
}

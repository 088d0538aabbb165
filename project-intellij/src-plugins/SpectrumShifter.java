

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

/**
 * Converts k-space arrays between the centre-origin and corner-origin conventions (see
 * {@link CentredSpectrum}).
 * <br><br>
 * Both directions are a cyclic rotation of each axis by half its length (integer division):
 * <ul>
 *     <li>{@link #shift}: centre-origin to corner-origin, out[i] = in[(i + N/2) mod N]. The element
 *     at the centre of the input ends up at [0][0].</li>
 *     <li>{@link #inverseShift}: corner-origin to centre-origin, out[(i + N/2) mod N] = in[i]. The
 *     element at [0][0] ends up at the centre.</li>
 * </ul>
 * For an even length both rotations move elements by N/2, so shift(shift(a)) == a. For an odd
 * length they differ by one element and only shift(inverseShift(a)) == a holds.
 * <br><br>
 * The methods only move elements, no arithmetic is done on the values, and a new array is
 * always returned.
 */
public class SpectrumShifter {

    /** Method to move the zero-frequency element from the centre of the array to [0][0].
     *
     * @param input_array Centre-origin array of frequency data, indexed [x][y]
     * @return Corner-origin array of the same dimensions
     */
    public static Complex[][] shift(Complex[][] input_array) {
        CentredSpectrum.checkRectangular(input_array);
        int width = input_array.length;
        int height = input_array[0].length;

        Complex[][] shifted = new Complex[width][];
        for (int x=0; x<width; x++) {
            shifted[x] = new Complex[height];
            Complex[] source = input_array[(x + width / 2) % width];
            rotateInto(source, shifted[x], height / 2);
        }
        return shifted;
    }


    /** Method to move the zero-frequency element from [0][0] to the centre of the array.
     *
     * @param input_array Corner-origin array of frequency data, indexed [x][y]
     * @return Centre-origin array of the same dimensions
     */
    public static Complex[][] inverseShift(Complex[][] input_array) {
        CentredSpectrum.checkRectangular(input_array);
        int width = input_array.length;
        int height = input_array[0].length;

        Complex[][] shifted = new Complex[width][];
        for (int x=0; x<width; x++) {
            shifted[x] = new Complex[height];
            Complex[] source = input_array[(x + width - width / 2) % width];
            rotateInto(source, shifted[x], height - height / 2);
        }
        return shifted;
    }


    /**
     * Method to copy <i>source</i> into <i>target</i> rotated left by <i>amount</i> elements, so that
     * target[i] = source[(i + amount) mod n].
     */
    private static void rotateInto(Complex[] source, Complex[] target, int amount) {
        int n = source.length;
        System.arraycopy(source, amount, target, 0, n - amount);
        System.arraycopy(source, 0, target, n - amount, amount);
    }
}

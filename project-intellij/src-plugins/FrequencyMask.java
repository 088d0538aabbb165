

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
import org.apache.commons.math3.exception.OutOfRangeException;

/**
 * Rectangular band selection over a centre-origin k-space array.
 * <br><br>
 * A mask is a boolean array of the same [x][y] shape as the spectrum it is applied to. A
 * <i>true</i> element marks a coefficient that is kept; every other coefficient is set to zero.
 */
public class FrequencyMask {

    /**
     * Method to build a rectangular band-pass mask. The retained region is
     * <br><br>
     * [c<sub>x</sub> + offset_x - half_x, c<sub>x</sub> + offset_x + half_x] &times;
     * [c<sub>y</sub> + offset_y - half_y, c<sub>y</sub> + offset_y + half_y]
     * <br><br>
     * inclusive at both ends, where c<sub>x</sub>, c<sub>y</sub> are the truncated centre indices
     * ({@link CentredSpectrum#centreIndex(int)}). The offsets are in the centre-origin convention.
     * The region is never clipped to fit the array.
     *
     * @param width N<sub>x</sub> of the spectrum the mask will be applied to
     * @param height N<sub>y</sub> of the spectrum the mask will be applied to
     * @param offset_x Offset of the region centre from the zero-frequency element along x
     * @param offset_y Offset of the region centre from the zero-frequency element along y
     * @param half_x Half side-length of the region along x; 0 selects a single column
     * @param half_y Half side-length of the region along y; 0 selects a single row
     * @return A new mask, indexed [x][y]
     * @throws OutOfRangeException if a half extent is negative or any edge of the region lies
     *         outside the array
     */
    public static boolean[][] buildRectangularMask(int width, int height, int offset_x, int offset_y,
                                                   int half_x, int half_y) {
        int centre_x = CentredSpectrum.centreIndex(width);
        int centre_y = CentredSpectrum.centreIndex(height);

        int[] x_range = regionEdges((long) centre_x + offset_x, half_x, width);
        int[] y_range = regionEdges((long) centre_y + offset_y, half_y, height);

        boolean[][] mask = new boolean[width][height];
        for (int x=x_range[0]; x<=x_range[1]; x++) {
            for (int y=y_range[0]; y<=y_range[1]; y++) {
                mask[x][y] = true;
            }
        }
        return mask;
    }


    /**
     * Method to zero every coefficient that the mask does not retain.
     *
     * @param spectrum Two-dimensional array of k-space values, indexed [x][y]
     * @param mask Mask of exactly the same shape as <i>spectrum</i>
     * @return A new array; retained coefficients are copied, the rest are {@link Complex#ZERO}
     * @throws org.apache.commons.math3.exception.DimensionMismatchException if the shapes differ
     */
    public static Complex[][] applyMask(Complex[][] spectrum, boolean[][] mask) {
        CentredSpectrum.checkRectangular(spectrum);
        CentredSpectrum.checkRectangular(mask);
        CentredSpectrum.checkSameShape(spectrum.length, spectrum[0].length, mask.length, mask[0].length);

        Complex[][] result = new Complex[spectrum.length][spectrum[0].length];
        for (int x=0; x<spectrum.length; x++) {
            for (int y=0; y<spectrum[0].length; y++) {
                result[x][y] = mask[x][y] ? spectrum[x][y] : Complex.ZERO;
            }
        }
        return result;
    }


    /**
     * Method to swap retained and discarded elements, turning a band-pass mask into a band-stop one.
     *
     * @param mask The mask to invert
     * @return A new mask of the same shape
     */
    public static boolean[][] invert(boolean[][] mask) {
        CentredSpectrum.checkRectangular(mask);
        boolean[][] result = new boolean[mask.length][mask[0].length];
        for (int x=0; x<mask.length; x++) {
            for (int y=0; y<mask[0].length; y++) {
                result[x][y] = !mask[x][y];
            }
        }
        return result;
    }


    /**
     * @param mask A mask
     * @return The number of retained (true) elements
     */
    public static int countRetained(boolean[][] mask) {
        CentredSpectrum.checkRectangular(mask);
        int count = 0;
        for (boolean[] column : mask) {
            for (boolean retained : column) {
                if (retained) count++;
            }
        }
        return count;
    }


    /**
     * Method to work out the first and last index of the region along one axis.
     *
     * @param region_centre Absolute index of the region centre
     * @param half_extent Half side-length of the region
     * @param size Length of the axis
     * @return {first, last}, both inclusive
     * @throws OutOfRangeException if the half extent is negative or either edge is outside [0, size)
     */
    private static int[] regionEdges(long region_centre, int half_extent, int size) {
        if (half_extent < 0) {
            throw new OutOfRangeException(half_extent, 0, size - 1);
        }
        // long, so that extreme offsets cannot wrap back into range
        long first = region_centre - half_extent;
        long last = region_centre + half_extent;
        if (first < 0) {
            throw new OutOfRangeException(first, 0, size - 1);
        }
        if (last >= size) {
            throw new OutOfRangeException(last, 0, size - 1);
        }
        return new int[] {(int) first, (int) last};
    }
}

import org.apache.commons.math3.complex.Complex;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

final class TestArrays {

    private TestArrays() {
    }

    static Complex[][] randomSpectrum(int width, int height, long seed) {
        Random r = new Random(seed);
        Complex[][] values = new Complex[width][height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                values[x][y] = new Complex(r.nextGaussian(), r.nextGaussian());
            }
        }
        return values;
    }

    static double[][] randomImage(int width, int height, long seed) {
        Random r = new Random(seed);
        double[][] values = new double[width][height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                values[x][y] = 100.0 * r.nextDouble();
            }
        }
        return values;
    }

    /** Element (x, y) holds x + i*y, so every element is distinct. */
    static Complex[][] indexSpectrum(int width, int height) {
        Complex[][] values = new Complex[width][height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                values[x][y] = new Complex(x, y);
            }
        }
        return values;
    }

    static Complex[][] zeros(int width, int height) {
        Complex[][] values = new Complex[width][height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                values[x][y] = Complex.ZERO;
            }
        }
        return values;
    }

    static boolean[][] filledMask(int width, int height, boolean value) {
        boolean[][] mask = new boolean[width][height];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                mask[x][y] = value;
            }
        }
        return mask;
    }

    /** Element-by-element identity: the same Complex instance at every position. */
    static void assertSameElements(Complex[][] expected, Complex[][] actual) {
        assertEquals(expected.length, actual.length, "width");
        for (int x = 0; x < expected.length; x++) {
            assertEquals(expected[x].length, actual[x].length, "height");
            for (int y = 0; y < expected[x].length; y++) {
                assertSame(expected[x][y], actual[x][y], "element [" + x + "][" + y + "]");
            }
        }
    }

    static boolean sameElements(Complex[][] a, Complex[][] b) {
        for (int x = 0; x < a.length; x++) {
            for (int y = 0; y < a[x].length; y++) {
                if (!a[x][y].equals(b[x][y])) return false;
            }
        }
        return true;
    }

    static double maxMagnitude(Complex[][] values) {
        double max = 0.0;
        for (Complex[] column : values) {
            for (Complex v : column) {
                max = Math.max(max, v.abs());
            }
        }
        return max;
    }

    static void assertClose(Complex[][] expected, Complex[][] actual, double relative_tolerance) {
        double max_error = SpectrumComparator.maxAbsoluteDifference(expected, actual);
        double scale = Math.max(1.0, maxMagnitude(expected));
        assertEquals(0.0, max_error / scale, relative_tolerance,
                "relative error " + max_error / scale + " exceeds " + relative_tolerance);
    }
}

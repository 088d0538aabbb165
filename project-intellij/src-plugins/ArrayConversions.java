import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.complex.ComplexUtils;
import org.apache.commons.math3.util.FastMath;

public class ArrayConversions {

    /**
     *
     * @param values Two-dimensional array of float values
     * @return Two-dimensional array of double values
     */
    public static double[][] convertFloatToDouble(final float[][] values) {
        int width = values.length;
        int height = values[0].length;

        final double[][] result = new double[width][height];

        for (int i=0; i<width; i++) {
            for (int j=0; j<height; j++) {
                result[i][j] = values[i][j];
            }
        }
        return result;
    }


    /**
     *
     * @param values Two-dimensional array of Double values
     * @return Two-dimensional array of Float values
     */
    public static float[][] convertDoubleToFloat(final double[][] values) {
        int width = values.length;
        int height = values[0].length;

        final float[][] result = new float[width][height];

        for (int i=0; i<width; i++) {
            for (int j=0; j<height; j++) {
                result[i][j] = (float) values[i][j];
            }
        }
        return result;
    }


    /**
     * Method to convert a 2d double array to a 2d complex array with zero imaginary parts
     *
     * @param values Two-dimensional array of Double values
     * @return Two-dimensional array of Complex values
     */
    public static Complex[][] toComplex(final double[][] values) {
        CentredSpectrum.checkRectangular(values);
        int width = values.length;

        final Complex[][] result = new Complex[width][];

        for (int i=0; i<width; i++) {
            result[i] = ComplexUtils.convertToComplex(values[i]);
        }
        return result;
    }


    /**
     * Method to combine real and imaginary parts into a 2d complex array
     *
     * @param real Two-dimensional array of real parts
     * @param imaginary Two-dimensional array of imaginary parts, same dimensions as <i>real</i>
     * @return Two-dimensional array of Complex values
     */
    public static Complex[][] toComplex(final double[][] real, final double[][] imaginary) {
        CentredSpectrum.checkRectangular(real);
        CentredSpectrum.checkRectangular(imaginary);
        CentredSpectrum.checkSameShape(real.length, real[0].length, imaginary.length, imaginary[0].length);
        int width = real.length;
        int height = real[0].length;

        final Complex[][] result = new Complex[width][height];

        for (int i=0; i<width; i++) {
            for (int j=0; j<height; j++) {
                result[i][j] = new Complex(real[i][j], imaginary[i][j]);
            }
        }
        return result;
    }


    public static double[][] realPart(final Complex[][] values) {
        CentredSpectrum.checkRectangular(values);
        final double[][] result = new double[values.length][values[0].length];

        for (int i=0; i<values.length; i++) {
            for (int j=0; j<values[0].length; j++) {
                result[i][j] = values[i][j].getReal();
            }
        }
        return result;
    }


    public static double[][] imaginaryPart(final Complex[][] values) {
        CentredSpectrum.checkRectangular(values);
        final double[][] result = new double[values.length][values[0].length];

        for (int i=0; i<values.length; i++) {
            for (int j=0; j<values[0].length; j++) {
                result[i][j] = values[i][j].getImaginary();
            }
        }
        return result;
    }


    /**
     * Method to calculate the magnitude (Euclidean norm of the real and imaginary parts) of each
     * element. The zero value has a magnitude of exactly 0.
     *
     * @param values Two-dimensional array of Complex values
     * @return Two-dimensional array of magnitudes
     */
    public static double[][] magnitude(final Complex[][] values) {
        CentredSpectrum.checkRectangular(values);
        final double[][] result = new double[values.length][values[0].length];

        for (int i=0; i<values.length; i++) {
            for (int j=0; j<values[0].length; j++) {
                result[i][j] = magnitude(values[i][j]);
            }
        }
        return result;
    }


    /**
     * Method to calculate the phase (four-quadrant arctangent of imaginary over real) of each
     * element, in radians in the range [-&pi;, &pi;].
     *
     * @param values Two-dimensional array of Complex values
     * @return Two-dimensional array of phases
     */
    public static double[][] phase(final Complex[][] values) {
        CentredSpectrum.checkRectangular(values);
        final double[][] result = new double[values.length][values[0].length];

        for (int i=0; i<values.length; i++) {
            for (int j=0; j<values[0].length; j++) {
                result[i][j] = phase(values[i][j]);
            }
        }
        return result;
    }


    static double magnitude(final Complex value) {
        return FastMath.hypot(value.getReal(), value.getImaginary());
    }


    /**
     * Method to calculate the phase of a single value. When both parts are zero the phase is
     * 0, whatever the signs of the zeros.
     *
     * @param value A complex value
     * @return atan2(imaginary, real), or 0 for the zero value
     */
    static double phase(final Complex value) {
        double re = value.getReal();
        double im = value.getImaginary();
        if (re == 0.0 && im == 0.0) {
            return 0.0;
        }
        return FastMath.atan2(im, re);
    }
}

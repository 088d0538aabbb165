import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.OutOfRangeException;

import java.lang.reflect.Array;

/**
 * A two-dimensional k-space array held in the <i>centre-origin</i> convention, together with
 * the location of its zero-frequency element.
 * <br><br>
 * Two index conventions are used in this package:
 * <ul>
 *     <li><b>Corner-origin</b>: the coefficient at index [0][0] is zero spatial frequency. This is the
 *     layout that {@link FourierTransformPair} works on.</li>
 *     <li><b>Centre-origin</b>: zero spatial frequency sits at (C<sub>x</sub>, C<sub>y</sub>) =
 *     (N<sub>x</sub>/2, N<sub>y</sub>/2). Offsets, mask regions and interference positions given by
 *     the user are relative to this point.</li>
 * </ul>
 * {@link SpectrumShifter} converts between the two. Arrays are indexed <i>[x][y]</i>, so
 * N<sub>x</sub> is the length of the outer array.
 * <br><br>
 * The real-valued centre is non-integer for odd sizes. Whenever it has to become an array
 * index it is truncated toward zero by {@link #centreIndex(int)}, and nowhere else.
 */
public class CentredSpectrum {

    private final Complex[][] values;
    private final int width;
    private final int height;


    /**
     * @param values Centre-origin k-space values, indexed [x][y]. The array is copied.
     */
    public CentredSpectrum(Complex[][] values) {
        checkRectangular(values);
        this.values = copy(values);
        this.width = values.length;
        this.height = values[0].length;
    }


    /** Method to return a copy of the k-space values
     *
     * @return The centre-origin values, indexed [x][y]
     */
    public Complex[][] getValues() { return copy(this.values); }

    public Complex getValue(int x, int y) { return this.values[x][y]; }

    /** @return N<sub>x</sub> */
    public int getWidth() { return this.width; }

    /** @return N<sub>y</sub> */
    public int getHeight() { return this.height; }

    /** @return C<sub>x</sub> = N<sub>x</sub>/2 as a real number */
    public double getCentreX() { return this.width / 2.0; }

    /** @return C<sub>y</sub> = N<sub>y</sub>/2 as a real number */
    public double getCentreY() { return this.height / 2.0; }

    public int getCentreIndexX() { return centreIndex(this.width); }

    public int getCentreIndexY() { return centreIndex(this.height); }


    /**
     * Method to convert a centre-origin x offset into an absolute array index.
     *
     * @param offset_x Offset from the zero-frequency element along x
     * @return The absolute index along x
     * @throws OutOfRangeException if the index falls outside the array
     */
    public int toAbsoluteX(int offset_x) {
        return toAbsolute(offset_x, this.width);
    }


    /**
     * Method to convert a centre-origin y offset into an absolute array index.
     *
     * @param offset_y Offset from the zero-frequency element along y
     * @return The absolute index along y
     * @throws OutOfRangeException if the index falls outside the array
     */
    public int toAbsoluteY(int offset_y) {
        return toAbsolute(offset_y, this.height);
    }


    /**
     * Method to obtain the integer index of the zero-frequency element along one axis.
     * The real centre size/2 is truncated toward zero, e.g. 2 for a size of 4 and 2 for a
     * size of 5.
     *
     * @param size Length of the axis
     * @return The truncated centre index
     */
    public static int centreIndex(int size) {
        if (size < 1) {
            throw new NotStrictlyPositiveException(size);
        }
        return (int) (size / 2.0);
    }


    /**
     * Method to map a centre-origin offset onto an absolute index along an axis of the given size.
     *
     * @param offset Offset from the zero-frequency element
     * @param size Length of the axis
     * @return centreIndex(size) + offset
     * @throws OutOfRangeException if the result is outside [0, size)
     */
    static int toAbsolute(int offset, int size) {
        long index = (long) centreIndex(size) + offset;
        if (index < 0 || index >= size) {
            throw new OutOfRangeException(index, 0, size - 1);
        }
        return (int) index;
    }


    /**
     * Method to check that a two-dimensional array is non-empty and not ragged.
     *
     * @param values The array to check
     * @throws NullArgumentException if the array or one of its columns is null
     * @throws NoDataException if either dimension is zero
     * @throws DimensionMismatchException if the columns have different lengths
     */
    static void checkRectangular(Object[] values) {
        if (values == null) {
            throw new NullArgumentException();
        }
        if (values.length == 0) {
            throw new NoDataException();
        }
        int height = -1;
        for (Object column : values) {
            if (column == null) {
                throw new NullArgumentException();
            }
            int length = Array.getLength(column);
            if (length == 0) {
                throw new NoDataException();
            }
            if (height < 0) {
                height = length;
            }
            else if (length != height) {
                throw new DimensionMismatchException(length, height);
            }
        }
    }


    /**
     * Method to check that two arrays have the same [x][y] shape.
     *
     * @throws DimensionMismatchException if either dimension differs
     */
    static void checkSameShape(int width_a, int height_a, int width_b, int height_b) {
        if (width_a != width_b) {
            throw new DimensionMismatchException(width_b, width_a);
        }
        if (height_a != height_b) {
            throw new DimensionMismatchException(height_b, height_a);
        }
    }


    /**
     * Method to make a shallow copy of a 2d complex array. {@link Complex} is immutable so the
     * elements can be shared.
     */
    static Complex[][] copy(Complex[][] values) {
        Complex[][] result = new Complex[values.length][];
        for (int i=0; i<values.length; i++) {
            result[i] = values[i].clone();
        }
        return result;
    }
}

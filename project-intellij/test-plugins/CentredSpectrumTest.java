import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CentredSpectrumTest {

    @Test
    void centreIndex_truncatesTowardZero() {
        assertEquals(0, CentredSpectrum.centreIndex(1));
        assertEquals(1, CentredSpectrum.centreIndex(2));
        assertEquals(1, CentredSpectrum.centreIndex(3));
        assertEquals(2, CentredSpectrum.centreIndex(4));
        assertEquals(2, CentredSpectrum.centreIndex(5));
        assertEquals(128, CentredSpectrum.centreIndex(257));
        assertThrows(NotStrictlyPositiveException.class, () -> CentredSpectrum.centreIndex(0));
    }

    @Test
    void shapeAndCentre() {
        CentredSpectrum spectrum = new CentredSpectrum(TestArrays.zeros(5, 8));
        assertEquals(5, spectrum.getWidth());
        assertEquals(8, spectrum.getHeight());
        assertEquals(2.5, spectrum.getCentreX(), 0.0);
        assertEquals(4.0, spectrum.getCentreY(), 0.0);
        assertEquals(2, spectrum.getCentreIndexX());
        assertEquals(4, spectrum.getCentreIndexY());
    }

    @Test
    void offsets_mapToAbsoluteIndices() {
        CentredSpectrum spectrum = new CentredSpectrum(TestArrays.zeros(5, 8));
        assertEquals(2, spectrum.toAbsoluteX(0));
        assertEquals(0, spectrum.toAbsoluteX(-2));
        assertEquals(4, spectrum.toAbsoluteX(2));
        assertEquals(7, spectrum.toAbsoluteY(3));
        assertThrows(OutOfRangeException.class, () -> spectrum.toAbsoluteX(3));
        assertThrows(OutOfRangeException.class, () -> spectrum.toAbsoluteY(-5));
        assertThrows(OutOfRangeException.class, () -> spectrum.toAbsoluteX(Integer.MAX_VALUE));
        assertThrows(OutOfRangeException.class, () -> spectrum.toAbsoluteY(Integer.MIN_VALUE));
    }

    @Test
    void valuesAreCopied() {
        Complex[][] values = TestArrays.indexSpectrum(3, 3);
        Complex original = values[1][1];
        CentredSpectrum spectrum = new CentredSpectrum(values);

        values[1][1] = Complex.NaN;
        assertSame(original, spectrum.getValue(1, 1));

        spectrum.getValues()[1][1] = Complex.NaN;
        assertSame(original, spectrum.getValue(1, 1));
    }

    @Test
    void invalidArrays_areRejected() {
        assertThrows(NullArgumentException.class, () -> new CentredSpectrum(null));
        assertThrows(NoDataException.class, () -> new CentredSpectrum(new Complex[0][]));
        assertThrows(NoDataException.class, () -> new CentredSpectrum(new Complex[3][0]));
        assertThrows(DimensionMismatchException.class,
                () -> new CentredSpectrum(new Complex[][] {new Complex[2], new Complex[3]}));
    }
}

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyMaskTest {

    @Test
    void centredBand_isInclusiveOfBothEdges() {
        boolean[][] mask = FrequencyMask.buildRectangularMask(8, 8, 0, 0, 1, 2);
        assertEquals(3 * 5, FrequencyMask.countRetained(mask));
        for (int x = 0; x < 8; x++) {
            for (int y = 0; y < 8; y++) {
                boolean expected = x >= 3 && x <= 5 && y >= 2 && y <= 6;
                assertEquals(expected, mask[x][y], "mask[" + x + "][" + y + "]");
            }
        }
    }

    @Test
    void offsetBand_oddSize_usesTruncatedCentre() {
        // centre index of 5 is 2, of 4 is 2
        boolean[][] mask = FrequencyMask.buildRectangularMask(5, 4, 1, -1, 1, 1);
        assertEquals(9, FrequencyMask.countRetained(mask));
        assertTrue(mask[2][0]);
        assertTrue(mask[4][2]);
        assertFalse(mask[1][1]);
        assertFalse(mask[3][3]);
    }

    @Test
    void zeroHalfExtents_selectSingleCoefficient() {
        boolean[][] mask = FrequencyMask.buildRectangularMask(4, 4, 0, 0, 0, 0);
        assertEquals(1, FrequencyMask.countRetained(mask));
        assertTrue(mask[2][2]);
    }

    @Test
    void bandExceedingMargin_throwsOutOfRange_neverClamps() {
        assertThrows(OutOfRangeException.class, () -> FrequencyMask.buildRectangularMask(8, 8, 0, 0, 5, 1));
        assertThrows(OutOfRangeException.class, () -> FrequencyMask.buildRectangularMask(8, 8, 0, 0, 4, 1));
        assertThrows(OutOfRangeException.class, () -> FrequencyMask.buildRectangularMask(8, 8, 3, 0, 1, 1));
        assertThrows(OutOfRangeException.class, () -> FrequencyMask.buildRectangularMask(8, 8, 0, -3, 1, 2));
        assertThrows(OutOfRangeException.class, () -> FrequencyMask.buildRectangularMask(8, 8, 0, 0, -1, 1));
    }

    @Test
    void extremeOffsets_throwOutOfRange_insteadOfWrapping() {
        assertThrows(OutOfRangeException.class,
                () -> FrequencyMask.buildRectangularMask(8, 8, Integer.MAX_VALUE, 0, 4, 1));
        assertThrows(OutOfRangeException.class,
                () -> FrequencyMask.buildRectangularMask(8, 8, 0, Integer.MIN_VALUE, 1, 4));
        assertThrows(OutOfRangeException.class,
                () -> FrequencyMask.buildRectangularMask(8, 8, 0, 0, Integer.MAX_VALUE, 0));
    }

    @Test
    void widestBandThatFits_isAccepted() {
        // centre 4 of 8: 4 - 4 = 0 and 4 + 3 = 7 are the extreme indices
        boolean[][] mask = FrequencyMask.buildRectangularMask(8, 8, -1, 0, 3, 3);
        assertTrue(mask[0][1]);
        assertTrue(mask[6][7]);
        assertFalse(mask[7][4]);
    }

    @Test
    void applyMask_isIdempotent() {
        Complex[][] s = TestArrays.randomSpectrum(8, 6, 11);
        boolean[][] mask = FrequencyMask.buildRectangularMask(8, 6, 1, 0, 2, 1);
        Complex[][] once = FrequencyMask.applyMask(s, mask);
        Complex[][] twice = FrequencyMask.applyMask(once, mask);
        TestArrays.assertSameElements(once, twice);
    }

    @Test
    void fullMask_keepsEverything() {
        Complex[][] s = TestArrays.randomSpectrum(5, 7, 12);
        TestArrays.assertSameElements(s, FrequencyMask.applyMask(s, TestArrays.filledMask(5, 7, true)));
    }

    @Test
    void emptyMask_zeroesEverything() {
        Complex[][] s = TestArrays.randomSpectrum(5, 7, 13);
        Complex[][] masked = FrequencyMask.applyMask(s, TestArrays.filledMask(5, 7, false));
        for (Complex[] column : masked) {
            for (Complex v : column) {
                assertEquals(0.0, v.getReal(), 0.0);
                assertEquals(0.0, v.getImaginary(), 0.0);
            }
        }
    }

    @Test
    void applyMask_doesNotModifyInput() {
        Complex[][] s = TestArrays.randomSpectrum(4, 4, 14);
        Complex[][] before = CentredSpectrum.copy(s);
        FrequencyMask.applyMask(s, TestArrays.filledMask(4, 4, false));
        TestArrays.assertSameElements(before, s);
    }

    @Test
    void shapeMismatch_isRejected() {
        Complex[][] s = TestArrays.randomSpectrum(4, 4, 15);
        assertThrows(DimensionMismatchException.class, () -> FrequencyMask.applyMask(s, TestArrays.filledMask(4, 5, true)));
        assertThrows(DimensionMismatchException.class, () -> FrequencyMask.applyMask(s, TestArrays.filledMask(3, 4, true)));
    }

    @Test
    void invertedMask_isComplement() {
        boolean[][] band = FrequencyMask.buildRectangularMask(6, 6, 0, 0, 1, 1);
        boolean[][] stop = FrequencyMask.invert(band);
        assertEquals(36 - 9, FrequencyMask.countRetained(stop));

        Complex[][] s = TestArrays.randomSpectrum(6, 6, 16);
        Complex[][] pass = FrequencyMask.applyMask(s, band);
        Complex[][] rest = FrequencyMask.applyMask(s, stop);
        for (int x = 0; x < 6; x++) {
            for (int y = 0; y < 6; y++) {
                assertEquals(s[x][y], pass[x][y].add(rest[x][y]));
            }
        }
    }
}

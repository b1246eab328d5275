package ols.ml;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.exception.NoDataException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EstimationTest {

    @Test
    void successCarriesEstimator() {
        Estimation e = Estimation.run(new double[][]{{1, 2}, {2, 1}, {3, 4}, {4, 3}}, new double[]{6, 6, 14, 14}, true);
        assertTrue(e.isSuccess());
        assertNull(e.getFailureKind());
        assertNull(e.getMessage());
        assertArrayEquals(new double[]{0, 2, 2}, e.getEstimator().getCoefficients(), 1e-8);
    }

    @Test
    void singularBecomesFailure() {
        Estimation e = Estimation.run(new double[][]{{1, 1}, {2, 2}, {3, 3}}, new double[]{1, 2, 4}, true);
        assertFalse(e.isSuccess());
        assertEquals(FailureKind.SINGULAR_MATRIX, e.getFailureKind());
        assertNotNull(e.getMessage());
        assertThrows(IllegalStateException.class, e::getEstimator);
    }

    @Test
    void mismatchedRowsBecomeFailure() {
        Estimation e = Estimation.run(new double[][]{{1}, {2}, {3}}, new double[]{1, 2}, true);
        assertEquals(FailureKind.INCOMPATIBLE_SHAPES, e.getFailureKind());
    }

    @Test
    void emptyInputBecomesFailure() {
        Estimation e = Estimation.run(new double[0][], new double[0], true);
        assertEquals(FailureKind.DEGENERATE_INPUT, e.getFailureKind());
    }

    @Test
    void emptyResponseIsDegenerateEvenWithRows() {
        Estimation e = Estimation.run(new double[][]{{1}, {2}, {3}}, new double[0], true);
        assertEquals(FailureKind.DEGENERATE_INPUT, e.getFailureKind());
    }

    @Test
    void usesTheGivenInverter() {
        double[][] x = {{1, 2}, {2, 1}, {3, 4}, {4, 3}};
        double[] y = {6, 6, 14, 14};
        Estimation strict = Estimation.run(x, y, true, m -> {
            throw new SingularMatrixException();
        });
        assertEquals(FailureKind.SINGULAR_MATRIX, strict.getFailureKind());
    }

    @Test
    void classifyRecognisesCommonsMathExceptions() {
        assertEquals(FailureKind.SINGULAR_MATRIX, FailureKind.classify(new SingularMatrixException()));
        assertEquals(FailureKind.DEGENERATE_INPUT, FailureKind.classify(new NoDataException()));
    }

    @Test
    void classifyRethrowsUnknownExceptions() {
        IllegalArgumentException boom = new IllegalArgumentException("boom");
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> FailureKind.classify(boom));
        assertSame(boom, thrown);
    }
}

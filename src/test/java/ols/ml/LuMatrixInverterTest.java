package ols.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonSquareMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LuMatrixInverterTest {

    @Test
    void invertsRegularMatrix() {
        RealMatrix m = MatrixUtils.createRealMatrix(new double[][]{{4, 7}, {2, 6}});
        double[][] inv = new LuMatrixInverter().invert(m).getData();
        assertArrayEquals(new double[]{0.6, -0.7}, inv[0], 1e-12);
        assertArrayEquals(new double[]{-0.2, 0.4}, inv[1], 1e-12);
    }

    @Test
    void singularMatrixThrows() {
        RealMatrix m = MatrixUtils.createRealMatrix(new double[][]{{1, 2}, {2, 4}});
        assertThrows(SingularMatrixException.class, () -> new LuMatrixInverter().invert(m));
    }

    @Test
    void thresholdDecidesSingularity() {
        RealMatrix m = MatrixUtils.createRealMatrix(new double[][]{{1, 1}, {1, 1 + 1e-13}});
        assertThrows(SingularMatrixException.class, () -> new LuMatrixInverter().invert(m));

        LuMatrixInverter loose = new LuMatrixInverter(1e-15);
        assertEquals(1e-15, loose.getSingularityThreshold());
        assertTrue(Double.isFinite(loose.invert(m).getEntry(0, 0)));
    }

    @Test
    void badlyScaledButRegularMatrixInverts() {
        RealMatrix m = MatrixUtils.createRealMatrix(new double[][]{{1e-12, 0}, {0, 1}});
        assertEquals(1e12, new LuMatrixInverter().invert(m).getEntry(0, 0), 1e-3);
    }

    @Test
    void zeroDiagonalFallsBackToRowScale() {
        RealMatrix swap = MatrixUtils.createRealMatrix(new double[][]{{0, 2}, {2, 0}});
        double[][] inv = new LuMatrixInverter().invert(swap).getData();
        assertArrayEquals(new double[]{0, 0.5}, inv[0], 1e-12);
        assertArrayEquals(new double[]{0.5, 0}, inv[1], 1e-12);
    }

    @Test
    void thresholdScalesWithTheMatrix() {
        RealMatrix big = MatrixUtils.createRealMatrix(new double[][]{{4e8, 7e8}, {2e8, 6e8}});
        double[][] inv = new LuMatrixInverter().invert(big).getData();
        assertArrayEquals(new double[]{0.6e-8, -0.7e-8}, inv[0], 1e-20);

        // second row is 3.3 times the first, up to rounding
        double[] first = {1234.567, 98765.4321};
        RealMatrix collinear = MatrixUtils.createRealMatrix(new double[][]{
            first, {3.3 * first[0], 3.3 * first[1]}});
        assertThrows(SingularMatrixException.class, () -> new LuMatrixInverter().invert(collinear));
    }

    @Test
    void zeroMatrixIsSingular() {
        RealMatrix zero = MatrixUtils.createRealMatrix(2, 2);
        assertThrows(SingularMatrixException.class, () -> new LuMatrixInverter().invert(zero));
    }

    @Test
    void nonSquareThrows() {
        RealMatrix m = MatrixUtils.createRealMatrix(new double[][]{{1, 2, 3}, {4, 5, 6}});
        assertThrows(NonSquareMatrixException.class, () -> new LuMatrixInverter().invert(m));
    }
}

package ols.ml;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Inverts a square matrix. The estimator only depends on this, so the numerical backend can be swapped.
 */
public interface MatrixInverter {

    /**
     * @param m a square matrix
     * @return the full dense inverse of {@code m}
     * @throws org.apache.commons.math3.linear.SingularMatrixException if {@code m} is singular
     * @throws org.apache.commons.math3.linear.NonSquareMatrixException if {@code m} is not square
     */
    RealMatrix invert(RealMatrix m);
}

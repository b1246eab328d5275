package ols.ml;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.MultiDimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Ways an estimation can fail. {@link OlsEstimator} never checks its inputs, so each kind is recognised
 * from the exception commons-math raised.
 */
public enum FailureKind {
    /** X'X is singular or numerically near-singular. */
    SINGULAR_MATRIX,
    /** X and y do not have the same number of rows, or X is ragged. */
    INCOMPATIBLE_SHAPES,
    /**
     * No rows, or no columns once the intercept column is added. An empty y always lands here, even when X has rows,
     * because the response is read before X.
     */
    DEGENERATE_INPUT;

    /**
     * @param e exception thrown while estimating
     * @return the matching kind
     * @throws RuntimeException {@code e} itself, when it does not belong to any kind
     */
    public static FailureKind classify(RuntimeException e) {
        if (e instanceof SingularMatrixException) return SINGULAR_MATRIX;
        if (e instanceof DimensionMismatchException || e instanceof MultiDimensionMismatchException) {
            return INCOMPATIBLE_SHAPES;
        }
        if (e instanceof NoDataException) return DEGENERATE_INPUT;
        throw e;
    }
}

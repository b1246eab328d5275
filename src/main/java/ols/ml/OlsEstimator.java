package ols.ml;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordinary Least Squares (OLS) estimation by the normal equations.
 * <p>
 * Model: y = Xβ + u
 * <p>
 * Closed-form solution: β = (X'X)⁻¹X'y, where X has a leading column of 1s when an intercept is estimated.
 * All results are computed once in the constructor; an instance is an immutable bundle of them.
 * <p>
 * NOTE: no consistency checks. Mismatched row counts, a constant column in X together with the intercept,
 * or fewer observations than regressors are the caller's problem. Failures come straight from commons-math:
 * <ul>
 *     <li>{@link org.apache.commons.math3.linear.SingularMatrixException} when X'X cannot be inverted,</li>
 *     <li>{@link org.apache.commons.math3.exception.DimensionMismatchException} when y does not line up with X,</li>
 *     <li>{@link org.apache.commons.math3.exception.NoDataException} when y is empty or X' has no rows or no columns.</li>
 * </ul>
 * Maximal complexity: O(n·k² + k³).
 */
public class OlsEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(OlsEstimator.class);

    private final boolean constant;
    private final RealMatrix design;  // X', n×k'
    private final RealMatrix betas;   // k'×1
    private final RealMatrix xt;      // k'×n
    private final RealMatrix xtx;     // k'×k'
    private final RealMatrix xtxi;    // k'×k'
    private final RealMatrix predy;   // n×1
    private final RealMatrix u;       // n×1

    /**
     * Estimate with an intercept.
     *
     * @param x n×k regressors (no column of 1s)
     * @param y response, one value per row of x
     */
    public OlsEstimator(double[][] x, double[] y) {
        this(x, y, true);
    }

    /**
     * @param x        n×k regressors
     * @param y        response, one value per row of x
     * @param constant if true a column of 1s is prepended to x to estimate an intercept
     */
    public OlsEstimator(double[][] x, double[] y, boolean constant) {
        this(x, column(y), constant);
    }

    /**
     * @param x        n×k regressors
     * @param y        response, one value per row of x
     * @param constant if true a column of 1s is prepended to x to estimate an intercept
     * @param inverter used to compute (X'X)⁻¹
     */
    public OlsEstimator(double[][] x, double[] y, boolean constant, MatrixInverter inverter) {
        this(x, column(y), constant, inverter);
    }

    /**
     * @param x        n×k regressors
     * @param y        n×1 response
     * @param constant if true a column of 1s is prepended to x to estimate an intercept
     */
    public OlsEstimator(double[][] x, double[][] y, boolean constant) {
        this(x, y, constant, new LuMatrixInverter());
    }

    /**
     * @param x        n×k regressors
     * @param y        n×1 response
     * @param constant if true a column of 1s is prepended to x to estimate an intercept
     * @param inverter used to compute (X'X)⁻¹
     */
    public OlsEstimator(double[][] x, double[][] y, boolean constant, MatrixInverter inverter) {
        this.constant = constant;
        // y first: an empty response is degenerate whatever X holds
        RealMatrix ym = new Array2DRowRealMatrix(y);
        this.design = new Array2DRowRealMatrix(designMatrix(x, constant), false);
        LOG.debug("Estimating OLS: n={}, k={}, constant={}",
            design.getRowDimension(), design.getColumnDimension(), constant);

        this.xt = design.transpose();
        this.xtx = xt.multiply(design);
        this.xtxi = inverter.invert(xtx);
        RealMatrix xty = xt.multiply(ym);
        this.betas = xtxi.multiply(xty);
        this.predy = design.multiply(betas);
        this.u = ym.subtract(predy);
    }

    /** Prepend a column of 1s when {@code constant} is set; otherwise copy x row by row. */
    private static double[][] designMatrix(double[][] x, boolean constant) {
        int offset = constant ? 1 : 0;
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = new double[x[i].length + offset];
            if (constant) out[i][0] = 1.0;
            System.arraycopy(x[i], 0, out[i], offset, x[i].length);
        }
        return out;
    }

    private static double[][] column(double[] y) {
        double[][] out = new double[y.length][1];
        for (int i = 0; i < y.length; i++) out[i][0] = y[i];
        return out;
    }

    /** k'×1 estimated coefficients; the first one is the intercept when {@link #hasConstant()}. */
    public double[][] getBetas() {
        return betas.getData();
    }

    /** Coefficients as a flat array [β₀, β₁, ...]. */
    public double[] getCoefficients() {
        return betas.getColumn(0);
    }

    /** Intercept β₀. */
    public double getIntercept() {
        if (!constant) throw new IllegalStateException("Estimated without an intercept");
        return betas.getEntry(0, 0);
    }

    /** k'×n transposed design matrix. */
    public double[][] getXt() {
        return xt.getData();
    }

    /** k'×k' cross-product X'X. */
    public double[][] getXtx() {
        return xtx.getData();
    }

    /** k'×k' inverse of X'X. */
    public double[][] getXtxi() {
        return xtxi.getData();
    }

    /** n×1 fitted values Xβ. */
    public double[][] getPredy() {
        return predy.getData();
    }

    /** n×1 residuals y - Xβ. */
    public double[][] getU() {
        return u.getData();
    }

    /** n×k' design matrix actually used, including the column of 1s if any. */
    public double[][] getDesign() {
        return design.getData();
    }

    public boolean hasConstant() { return constant; }
    public int getObservationCount() { return design.getRowDimension(); }
    public int getRegressorCount() { return design.getColumnDimension(); }
}

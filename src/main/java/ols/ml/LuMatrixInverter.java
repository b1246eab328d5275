package ols.ml;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.NonSquareMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Dense inverse through an LU decomposition with partial pivoting.
 * <p>
 * The matrix is first equilibrated, S = DmD with D = diag(1/√|m_ii|), so that the singularity test does not depend on
 * the units of the regressors; for a cross-product X'X, S holds the cosines between the columns of X.
 * A pivot of S smaller (in absolute value) than {@code singularityThreshold * ||S||₁} makes m singular and
 * {@link #invert(RealMatrix)} throws {@link SingularMatrixException}. The inverse is then m⁻¹ = DS⁻¹D.
 * <p>
 * Rows with a zero diagonal are scaled by their largest entry instead. An all-zero row is singular.
 */
public class LuMatrixInverter implements MatrixInverter {

    public static final double DEFAULT_SINGULARITY_THRESHOLD = 1e-11;

    private final double singularityThreshold;

    public LuMatrixInverter() {
        this(DEFAULT_SINGULARITY_THRESHOLD);
    }

    public LuMatrixInverter(double singularityThreshold) {
        this.singularityThreshold = singularityThreshold;
    }

    @Override
    public RealMatrix invert(RealMatrix m) {
        if (!m.isSquare()) throw new NonSquareMatrixException(m.getRowDimension(), m.getColumnDimension());
        int k = m.getRowDimension();
        double[] d = scaling(m);

        double[][] s = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) s[i][j] = m.getEntry(i, j) * d[i] * d[j];
        }
        RealMatrix sm = new Array2DRowRealMatrix(s, false);
        RealMatrix si = new LUDecomposition(sm, singularityThreshold * sm.getNorm()).getSolver().getInverse();

        double[][] inv = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) inv[i][j] = si.getEntry(i, j) * d[i] * d[j];
        }
        return new Array2DRowRealMatrix(inv, false);
    }

    private static double[] scaling(RealMatrix m) {
        int k = m.getRowDimension();
        double[] d = new double[k];
        for (int i = 0; i < k; i++) {
            double size = Math.abs(m.getEntry(i, i));
            if (size == 0) {
                for (int j = 0; j < k; j++) size = Math.max(size, Math.abs(m.getEntry(i, j)));
            }
            if (size == 0) throw new SingularMatrixException();
            d[i] = 1.0 / Math.sqrt(size);
        }
        return d;
    }

    public double getSingularityThreshold() {
        return singularityThreshold;
    }
}

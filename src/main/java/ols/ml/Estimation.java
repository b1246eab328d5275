package ols.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outcome of one OLS estimation: either the fitted {@link OlsEstimator} or the {@link FailureKind} that stopped it.
 * Use this where a failed fit is an expected answer (user-supplied data) rather than a bug.
 */
public final class Estimation {

    private static final Logger LOG = LoggerFactory.getLogger(Estimation.class);

    private final OlsEstimator estimator;
    private final FailureKind failureKind;
    private final String message;

    private Estimation(OlsEstimator estimator, FailureKind failureKind, String message) {
        this.estimator = estimator;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static Estimation run(double[][] x, double[] y, boolean constant) {
        return run(x, y, constant, new LuMatrixInverter());
    }

    public static Estimation run(double[][] x, double[] y, boolean constant, MatrixInverter inverter) {
        try {
            return success(new OlsEstimator(x, y, constant, inverter));
        } catch (RuntimeException e) {
            FailureKind kind = FailureKind.classify(e);
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.debug("Estimation failed ({}): {}", kind, msg);
            return failure(kind, msg);
        }
    }

    public static Estimation success(OlsEstimator estimator) {
        return new Estimation(estimator, null, null);
    }

    public static Estimation failure(FailureKind kind, String message) {
        return new Estimation(null, kind, message);
    }

    public boolean isSuccess() {
        return estimator != null;
    }

    /** @throws IllegalStateException if the estimation failed */
    public OlsEstimator getEstimator() {
        if (estimator == null) throw new IllegalStateException("Estimation failed: " + failureKind + " - " + message);
        return estimator;
    }

    /** Null on success. */
    public FailureKind getFailureKind() { return failureKind; }

    /** Null on success. */
    public String getMessage() { return message; }
}

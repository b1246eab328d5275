package ols;

import ols.ml.Dataset;
import ols.ml.Estimation;
import ols.ml.LuMatrixInverter;
import ols.ml.OlsEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Demo: OLS fit of the built-in sample, or of a CSV (first column y, then X) given as the first argument.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Dataset data;
        if (args.length > 0 && args[0] != null && !args[0].trim().isEmpty()) {
            try {
                data = Dataset.fromCsv(Paths.get(args[0].trim()));
            } catch (Exception e) {
                String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                LOG.error("CSV error: {}", msg);
                System.exit(1);
                return;
            }
        } else {
            data = Dataset.sample();
        }

        LuMatrixInverter inverter = new LuMatrixInverter(
            OlsConfig.singularityThreshold(LuMatrixInverter.DEFAULT_SINGULARITY_THRESHOLD));
        Estimation estimation = Estimation.run(data.getX(), data.getY(), true, inverter);
        if (!estimation.isSuccess()) {
            LOG.error("Estimation failed ({}): {}", estimation.getFailureKind(), estimation.getMessage());
            System.exit(2);
            return;
        }
        OlsEstimator ols = estimation.getEstimator();
        LOG.info("Fitted {} observations, {} coefficients", ols.getObservationCount(), ols.getRegressorCount());

        System.out.println("=== OLS ===");
        double[] betas = ols.getCoefficients();
        System.out.printf("Intercept β₀ = %.6f%n", betas[0]);
        for (int i = 1; i < betas.length; i++) {
            System.out.printf("β%d = %.6f%n", i, betas[i]);
        }
        System.out.println("Fitted (first 5): " + format(ols.getPredy(), 5));
        System.out.println("Residuals (first 5): " + format(ols.getU(), 5));
    }

    private static String format(double[][] a, int max) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(a.length, max); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.4f", a[i][0]));
        }
        if (a.length > max) sb.append("...");
        sb.append("]");
        return sb.toString();
    }
}

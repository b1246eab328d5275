package ols.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Regression data: a response y and regressors X, row-aligned.
 */
public class Dataset {

    private static final Logger LOG = LoggerFactory.getLogger(Dataset.class);

    private final double[][] x;
    private final double[] y;

    public Dataset(double[][] x, double[] y) {
        this.x = copy(x);
        this.y = y.clone();
    }

    private static double[][] copy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) out[i] = a[i].clone();
        return out;
    }

    /** n×k regressors (a copy). */
    public double[][] getX() { return copy(x); }

    /** Response, one value per row (a copy). */
    public double[] getY() { return y.clone(); }

    public int size() { return y.length; }

    /**
     * Load a dataset from a CSV. Expected: one row per observation, first column = y, remaining columns = X.
     * Separators may be ',', ';' or tabs. Blank lines, '#' comments and unparseable lines (e.g. a header) are skipped.
     */
    public static Dataset fromCsv(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path);
        List<Double> ys = new ArrayList<>();
        List<double[]> xs = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]+");
            try {
                double value = Double.parseDouble(parts[0].trim());
                double[] row = new double[parts.length - 1];
                for (int j = 1; j < parts.length; j++) row[j - 1] = Double.parseDouble(parts[j].trim());
                ys.add(value);
                xs.add(row);
            } catch (NumberFormatException e) {
                LOG.debug("Skipping line {} of {}: {}", i + 1, path, line);
            }
        }
        if (ys.isEmpty()) throw new IllegalArgumentException("No data rows in " + path);
        LOG.info("Loaded {} observations from {}", ys.size(), path);
        return new Dataset(xs.toArray(new double[0][]), ys.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /** Synthetic sample: y = 3 + 2·x₁ - 0.5·x₂ plus a small deterministic disturbance. */
    public static Dataset sample() {
        double[][] x = {
            {1, 8}, {2, 3}, {3, 9}, {4, 1}, {5, 7}, {6, 2},
            {7, 6}, {8, 4}, {9, 10}, {10, 5}, {11, 3}, {12, 8}
        };
        double[] noise = {0.3, -0.2, 0.1, -0.4, 0.2, 0.0, -0.1, 0.4, -0.3, 0.1, 0.2, -0.3};
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 3 + 2 * x[i][0] - 0.5 * x[i][1] + noise[i];
        }
        return new Dataset(x, y);
    }
}

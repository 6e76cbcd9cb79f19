package com.webapp.backend_telemetry.ml;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Zero-mean / unit-variance scaling fitted per column. Uses the population
 * standard deviation; a constant column gets a scale of 1 so it maps to 0.
 */
public final class FeatureScaler {
    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static FeatureScaler fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit scaler on an empty matrix");
        }
        int width = rows[0].length;
        double[] means = new double[width];
        double[] scales = new double[width];
        Mean mean = new Mean();
        StandardDeviation std = new StandardDeviation(false);

        for (int col = 0; col < width; col++) {
            double[] column = new double[rows.length];
            for (int r = 0; r < rows.length; r++) {
                column[r] = rows[r][col];
            }
            means[col] = mean.evaluate(column);
            double sd = std.evaluate(column);
            scales[col] = sd == 0.0 ? 1.0 : sd;
        }
        return new FeatureScaler(means, scales);
    }

    public double[] transform(double[] row) {
        if (row.length != means.length) {
            throw new IllegalArgumentException(
                    "Expected " + means.length + " features but got " + row.length);
        }
        double[] scaled = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            scaled[i] = (row[i] - means[i]) / scales[i];
        }
        return scaled;
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double[] getScales() {
        return scales.clone();
    }
}

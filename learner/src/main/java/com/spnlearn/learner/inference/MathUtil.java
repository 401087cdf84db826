package com.spnlearn.learner.inference;

public class MathUtil {

    private MathUtil() {
    }

    /**
     * Computes log(sum(exp(x_i))) with the "max trick" for numerical stability:
     * logSumExp(x) = max(x) + log(sum(exp(x_i - max(x))))
     */
    public static double logSumExp(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v > max)
                max = v;
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }
        if (max == Double.POSITIVE_INFINITY) {
            return Double.POSITIVE_INFINITY;
        }

        double sum = 0.0;
        for (double v : values) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /**
     * Normalizes non-negative weights to sum to one.
     */
    public static double[] normalize(double[] weights) {
        double sum = 0.0;
        for (double w : weights) {
            if (w < 0) {
                throw new IllegalArgumentException("weights must not be negative");
            }
            sum += w;
        }
        if (sum <= 0) {
            throw new IllegalArgumentException("weights must not all be zero");
        }
        double[] result = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            result[i] = weights[i] / sum;
        }
        return result;
    }
}

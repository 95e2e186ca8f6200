package in.addwise.service.risk;

/**
 * Distribution helpers for the risk model.
 */
public final class RiskMath {

    private static final double SQRT2 = Math.sqrt(2.0);

    /**
     * P(X >= threshold) for X ~ Poisson(lambda).
     *
     * Computed as 1 - CDF(threshold - 1) by summing terms iteratively, so no
     * factorial overflows for the small thresholds used here.
     */
    public static double poissonTail(double lambda, int threshold) {
        if (threshold <= 0) {
            return 1.0;
        }
        if (!(lambda > 0)) {
            return 0.0;
        }
        double term = Math.exp(-lambda);
        double cdf = term;
        for (int k = 1; k < threshold; k++) {
            term *= lambda / k;
            cdf += term;
        }
        return clampProbability(1.0 - cdf);
    }

    /**
     * Standard normal CDF Φ(z).
     */
    public static double normalCdf(double z) {
        if (Double.isNaN(z)) {
            return Double.NaN;
        }
        return clampProbability(0.5 * (1.0 + erf(z / SQRT2)));
    }

    /**
     * P(X < x) for X ~ N(mean, std²). A zero std degenerates to a step.
     */
    public static double normalCdf(double x, double mean, double std) {
        if (!(std > 0)) {
            return x > mean ? 1.0 : 0.0;
        }
        return normalCdf((x - mean) / std);
    }

    /**
     * Error function, Abramowitz &amp; Stegun 7.1.26 (|error| &lt; 1.5e-7).
     */
    public static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + 0.3275911 * ax);
        double poly = t * (0.254829592
            + t * (-0.284496736
            + t * (1.421413741
            + t * (-1.453152027
            + t * 1.061405429))));
        return sign * (1.0 - poly * Math.exp(-ax * ax));
    }

    /**
     * Inverse standard normal CDF (Acklam's rational approximation,
     * relative error about 1.15e-9).
     */
    public static double normalQuantile(double p) {
        if (!(p > 0 && p < 1)) {
            throw new IllegalArgumentException("Quantile probability must be in (0, 1): " + p);
        }
        final double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
            1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        final double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
            6.680131188771972e+01, -1.328068155288572e+01};
        final double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
            -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        final double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
            3.754408661907416e+00};
        final double pLow = 0.02425;

        if (p < pLow) {
            double q = Math.sqrt(-2 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        if (p > 1 - pLow) {
            double q = Math.sqrt(-2 * Math.log(1 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
            / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1);
    }

    public static double clampProbability(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }

    private RiskMath() {}
}

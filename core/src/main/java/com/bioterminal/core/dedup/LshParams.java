package com.bioterminal.core.dedup;

/**
 * LSH 밴딩 파라미터 (bands x rows <= numPerm).
 */
public record LshParams(int bands, int rows) {

    private static final int STEPS = 200;

    public LshParams {
        if (bands < 1 || rows < 1) throw new IllegalArgumentException("bands/rows must be >= 1");
    }

    /**
     * 후보 확률 P(s) = 1 - (1 - s^r)^b 에 대해
     * [0, t] 구간 위양성 면적 x fpWeight + [t, 1] 구간 위음성 면적 x fnWeight 가 최소인 (b, r).
     */
    public static LshParams optimal(double threshold, int numPerm, double fpWeight, double fnWeight) {
        double minError = Double.MAX_VALUE;
        LshParams best = null;
        for (int b = 1; b <= numPerm; b++) {
            int maxR = numPerm / b;
            for (int r = 1; r <= maxR; r++) {
                double fp = integrate(b, r, 0.0, threshold, false);
                double fn = integrate(b, r, threshold, 1.0, true);
                double err = fp * fpWeight + fn * fnWeight;
                if (err < minError) {
                    minError = err;
                    best = new LshParams(b, r);
                }
            }
        }
        return best;
    }

    /** 특정 Jaccard 유사도의 후보 확률 */
    public double candidateProbability(double s) {
        return 1.0 - Math.pow(1.0 - Math.pow(s, rows), bands);
    }

    // 심프슨 적분
    private static double integrate(int b, int r, double lo, double hi, boolean miss) {
        double h = (hi - lo) / STEPS;
        double sum = 0.0;
        for (int i = 0; i <= STEPS; i++) {
            double s = lo + i * h;
            double p = 1.0 - Math.pow(1.0 - Math.pow(s, r), b);
            double f = miss ? 1.0 - p : p;
            double w = (i == 0 || i == STEPS) ? 1 : (i % 2 == 1 ? 4 : 2);
            sum += w * f;
        }
        return sum * h / 3.0;
    }
}

package com.surveyaudit.ml;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 有序作答序列（题组/矩阵题）上的敷衍作答特征，只依赖单条记录。
 */
public final class PatternFeatures {

    public static final int LONGEST_RUN = 0;
    public static final int ZIGZAG = 1;
    public static final int DIAGONAL = 2;
    public static final int CYCLE = 3;
    public static final int LOW_DISTINCT = 4;
    public static final int POSITION_BIAS = 5;
    public static final int DIMENSION = 6;

    public static final List<String> FEATURE_NAMES = List.of(
            "longestRun", "zigzag", "diagonal", "cycle", "lowDistinct", "positionBias");

    private PatternFeatures() {
    }

    public static double[] extract(double[] seq) {
        double[] x = new double[DIMENSION];
        int n = seq.length;
        if (n < 2) {
            return x;
        }
        x[LONGEST_RUN] = (double) longestRun(seq) / n;
        x[ZIGZAG] = zigzagRatio(seq);
        x[DIAGONAL] = diagonalRatio(seq);
        x[CYCLE] = cycleRatio(seq);

        Map<Double, Integer> counts = new HashMap<>();
        for (double v : seq) {
            counts.merge(v, 1, Integer::sum);
        }
        x[LOW_DISTINCT] = 1.0 - (counts.size() - 1.0) / (n - 1.0);
        x[POSITION_BIAS] = (double) counts.values().stream().mapToInt(Integer::intValue).max().orElse(0) / n;
        return x;
    }

    static int longestRun(double[] seq) {
        int best = 1, run = 1;
        for (int i = 1; i < seq.length; i++) {
            run = seq[i] == seq[i - 1] ? run + 1 : 1;
            best = Math.max(best, run);
        }
        return best;
    }

    /**
     * a,b,a,b… 交替占比
     */
    public static double zigzagRatio(double[] seq) {
        if (seq.length < 3) {
            return 0.0;
        }
        int hits = 0;
        for (int i = 2; i < seq.length; i++) {
            if (seq[i] == seq[i - 2] && seq[i] != seq[i - 1]) {
                hits++;
            }
        }
        return (double) hits / (seq.length - 2);
    }

    /**
     * 等步长（非零）递增或递减占比
     */
    public static double diagonalRatio(double[] seq) {
        if (seq.length < 3) {
            return 0.0;
        }
        int hits = 0;
        for (int i = 2; i < seq.length; i++) {
            double d1 = seq[i - 1] - seq[i - 2];
            double d2 = seq[i] - seq[i - 1];
            if (d1 != 0 && d1 == d2) {
                hits++;
            }
        }
        return (double) hits / (seq.length - 2);
    }

    static double cycleRatio(double[] seq) {
        int n = seq.length;
        double best = 0.0;
        for (int p = 2; p <= n / 2; p++) {
            int hits = 0;
            for (int i = p; i < n; i++) {
                if (seq[i] == seq[i - p]) {
                    hits++;
                }
            }
            best = Math.max(best, (double) hits / (n - p));
        }
        return best;
    }
}

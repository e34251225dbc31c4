package app.sage.core.review.algorithm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;

public record SchedulerSettings(
        double requestRetention,
        double maximumIntervalDays,
        double graduatingIntervalDays,
        double easyIntervalDays,
        int minimumIntervalMinutes,
        List<Integer> learningStepsMinutes,
        List<Integer> relearningStepsMinutes,
        double masteryStabilityDays,
        double[] weights
) {
    public static final double MIN_STABILITY = 0.1;
    public static final double MAX_STABILITY = 36500.0;
    public static final double MIN_DIFFICULTY = 1.0;
    public static final double MAX_DIFFICULTY = 10.0;

    static final int WEIGHT_COUNT = 21;

    private static final double[] FALLBACK_W = new double[]{
            0.212, 1.2931, 2.3065, 8.2956, 6.4133, 0.8334, 3.0194, 0.001, 1.8722, 0.1666,
            0.796, 1.4835, 0.0614, 0.2629, 1.6483, 0.6014, 1.8729, 0.5425, 0.0912, 0.0658, 0.1542
    };

    public static SchedulerSettings defaults() {
        return from(null);
    }

    public static SchedulerSettings from(JsonNode cfg) {
        if (cfg == null || cfg.isNull()) {
            cfg = JsonNodeFactory.instance.objectNode();
        }

        double rr = clamp(number(cfg, "requestRetention", 0.9), 0.7, 0.99);
        double max = clamp(number(cfg, "maximumIntervalDays", 365), 1, MAX_STABILITY);
        double grad = clamp(number(cfg, "graduatingIntervalDays", 1), 1, max);
        double easy = clamp(number(cfg, "easyIntervalDays", 4), grad, max);
        int minMin = (int) Math.max(1, number(cfg, "minimumIntervalMinutes", 1));
        double mastery = Math.max(1, number(cfg, "masteryStabilityDays", 21));

        double[] w = FALLBACK_W.clone();
        JsonNode wj = cfg.path("weights");
        if (wj.isArray()) {
            for (int i = 0; i < WEIGHT_COUNT && i < wj.size(); i++) {
                if (wj.get(i).isNumber()) {
                    w[i] = wj.get(i).asDouble();
                }
            }
        }

        return new SchedulerSettings(
                rr, max, grad, easy, minMin,
                steps(cfg.path("learningStepsMinutes"), List.of(1, 10)),
                steps(cfg.path("relearningStepsMinutes"), List.of(10)),
                mastery,
                w
        );
    }

    public double w(int i) {
        return weights[i];
    }

    public double minimumIntervalDays() {
        return minimumIntervalMinutes / 1440.0;
    }

    private static double number(JsonNode cfg, String field, double fallback) {
        JsonNode n = cfg.path(field);
        if (!n.isNumber()) {
            return fallback;
        }
        double v = n.asDouble();
        return Double.isFinite(v) ? v : fallback;
    }

    private static List<Integer> steps(JsonNode n, List<Integer> fallback) {
        if (n.isMissingNode() || n.isNull() || !n.isArray()) return fallback;
        List<Integer> out = new ArrayList<>();
        for (JsonNode x : n) {
            if (x.isNumber() && x.asInt() > 0) out.add(x.asInt());
        }
        return List.copyOf(out);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}

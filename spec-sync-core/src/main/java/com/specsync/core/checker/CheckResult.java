package com.specsync.core.checker;

import java.util.Map;

/**
 * Outcome of a single checker invocation.
 *
 * <p>The checker's {@code satisfied} verdict assumes the default threshold; the
 * {@link CheckerDispatcher} applies the definition's actual threshold to {@code score}.
 *
 * @param satisfied whether the checker considers the requirement met
 * @param score score in [0.0, 1.0]
 * @param details details such as {@code reason}, {@code path} or {@code count}
 */
public record CheckResult(boolean satisfied, double score, Map<String, Object> details) {

    public CheckResult {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0.0, 1.0]: " + score);
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static CheckResult ok(Map<String, Object> details) {
        return new CheckResult(true, 1.0, details);
    }

    public static CheckResult failed(Map<String, Object> details) {
        return new CheckResult(false, 0.0, details);
    }

    /**
     * Failed result with only a reason.
     *
     * @param reason why the requirement is unsatisfied
     * @return failed result
     */
    public static CheckResult failed(String reason) {
        return failed(Map.of("reason", reason));
    }

    /**
     * Result scored as the share of satisfied parts.
     *
     * @param satisfiedCount number of satisfied parts
     * @param total number of parts, zero counts as fully satisfied
     * @param details details
     * @return result with {@code score = satisfiedCount / total}
     */
    public static CheckResult fraction(int satisfiedCount, int total, Map<String, Object> details) {
        double score = total == 0 ? 1.0 : (double) satisfiedCount / total;
        return new CheckResult(satisfiedCount == total, score, details);
    }
}

package com.powersentinel.core.forecast;

import com.powersentinel.core.model.ModelOrder;

import java.util.Objects;

/**
 * Outcome of fitting one candidate order during a grid search.
 *
 * <p>
 * A skipped trial (non-convergent, numerically failed or timed out) scores
 * {@code +Infinity} and carries the reason.
 * </p>
 *
 * @since 1.0.0
 */
public final class CandidateTrial {

    private final ModelOrder order;
    private final double aic;
    private final String failureReason;

    private CandidateTrial(ModelOrder order, double aic, String failureReason) {
        this.order = Objects.requireNonNull(order, "Order must not be null");
        this.aic = aic;
        this.failureReason = failureReason;
    }

    static CandidateTrial scored(ModelOrder order, double aic) {
        return new CandidateTrial(order, aic, null);
    }

    static CandidateTrial skipped(ModelOrder order, String reason) {
        return new CandidateTrial(order, Double.POSITIVE_INFINITY, reason);
    }

    public ModelOrder getOrder() {
        return order;
    }

    public double getAic() {
        return aic;
    }

    public boolean isSkipped() {
        return failureReason != null;
    }

    /** @return why the trial was skipped, or {@code null} if it was scored */
    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return isSkipped()
                ? "CandidateTrial{" + order + ", skipped: " + failureReason + '}'
                : "CandidateTrial{" + order + ", aic=" + aic + '}';
    }
}

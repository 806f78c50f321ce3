package com.powersentinel.core.forecast;

import com.powersentinel.core.model.ModelOrder;

import java.util.Collections;
import java.util.List;

/**
 * Winning order of a grid search plus every trial in canonical
 * (p, d, q) order.
 *
 * @since 1.0.0
 */
public final class GridSearchResult {

    private final ModelOrder bestOrder;
    private final double bestAic;
    private final List<CandidateTrial> trials;

    GridSearchResult(ModelOrder bestOrder, double bestAic, List<CandidateTrial> trials) {
        this.bestOrder = bestOrder;
        this.bestAic = bestAic;
        this.trials = Collections.unmodifiableList(trials);
    }

    public ModelOrder getBestOrder() {
        return bestOrder;
    }

    public double getBestAic() {
        return bestAic;
    }

    public List<CandidateTrial> getTrials() {
        return trials;
    }

    public int getCandidateCount() {
        return trials.size();
    }

    public int getSkippedCount() {
        return (int) trials.stream().filter(CandidateTrial::isSkipped).count();
    }

    @Override
    public String toString() {
        return "GridSearchResult{best=" + bestOrder + ", aic=" + bestAic
                + ", candidates=" + trials.size() + ", skipped=" + getSkippedCount() + '}';
    }
}

package com.powersentinel.core.error;

import com.powersentinel.core.model.ModelOrder;

/**
 * Raised when a single model fit fails: the optimizer ran out of budget,
 * produced non-finite parameters, or the training series does not satisfy
 * the structural requirements of the requested order.
 *
 * <p>
 * The grid search recovers from this exception by skipping the candidate;
 * the final fit of the chosen order lets it propagate.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelFitException extends PowerSentinelException {

    private static final long serialVersionUID = 1L;

    private final ModelOrder order;

    public ModelFitException(ModelOrder order, String message) {
        super("ARIMA" + order + ": " + message);
        this.order = order;
    }

    public ModelFitException(ModelOrder order, String message, Throwable cause) {
        super("ARIMA" + order + ": " + message, cause);
        this.order = order;
    }

    public ModelOrder getOrder() {
        return order;
    }
}

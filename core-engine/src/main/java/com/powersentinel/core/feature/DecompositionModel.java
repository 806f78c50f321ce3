package com.powersentinel.core.feature;

/**
 * How the seasonal component combines with trend and residual.
 *
 * @since 1.0.0
 */
public enum DecompositionModel {

    /** observed = trend + seasonal + residual */
    ADDITIVE,

    /** observed = trend * seasonal * residual */
    MULTIPLICATIVE;

    /**
     * Case-insensitive lookup, as used by request parameters.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static DecompositionModel fromName(String name) {
        for (DecompositionModel model : values()) {
            if (model.name().equalsIgnoreCase(name == null ? "" : name.trim())) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown decomposition model: '" + name + "'");
    }
}

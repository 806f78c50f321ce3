package com.powersentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyStrategy} instances by name.
 *
 * <p>
 * This is the single point of extension when adding new strategies: register
 * the new name here and create the corresponding implementation.
 * </p>
 *
 * @since 1.0.0
 */
public final class StrategyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyFactory.class);

    private StrategyFactory() {
        // utility class — not instantiable
    }

    /**
     * @param name strategy name, case-insensitive
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AnomalyStrategy create(String name) {
        Objects.requireNonNull(name, "Strategy name must not be null");

        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case ResidualThresholdStrategy.NAME -> new ResidualThresholdStrategy();
            case IsolationForestResidualStrategy.NAME -> new IsolationForestResidualStrategy();
            default -> throw new IllegalArgumentException(
                    "Unknown anomaly strategy: '" + name + "'. Supported strategies: "
                            + ResidualThresholdStrategy.NAME + ", " + IsolationForestResidualStrategy.NAME);
        };
    }

    /**
     * @return unmodifiable list of strategies, one per name, in order
     */
    public static List<AnomalyStrategy> createAll(List<String> names) {
        Objects.requireNonNull(names, "Strategy names must not be null");
        LOG.info("Creating {} anomaly strategy(ies) from configuration", names.size());
        return Collections.unmodifiableList(names.stream()
                .map(StrategyFactory::create)
                .toList());
    }
}

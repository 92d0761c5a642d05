package com.grorchestrator.orchestration.model.clusterset;

import java.util.Arrays;
import java.util.Optional;

public enum PromotionScope {
    /**
     * Promote this node to be primary of its cluster.
     */
    UNIT,
    /**
     * Promote this cluster to be primary of the cluster set.
     */
    CLUSTER;

    public static Optional<PromotionScope> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(scope -> scope.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}

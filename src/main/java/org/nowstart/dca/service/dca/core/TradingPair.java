package org.nowstart.dca.service.dca.core;

import java.math.BigDecimal;
import java.util.Set;

public record TradingPair(
        String name,
        String altName,
        String base,
        String quote,
        int lotDecimals,
        int quoteDecimals,
        BigDecimal orderMin
) {

    public TradingPair {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("pair name is required");
        }
        if (lotDecimals < 0 || quoteDecimals < 0) {
            throw new IllegalArgumentException("pair decimals must be >= 0");
        }
        if (orderMin == null || orderMin.signum() <= 0) {
            throw new IllegalArgumentException("pair orderMin must be > 0");
        }
    }

    /**
     * Identifiers under which the exchange may report orders of this pair.
     */
    public Set<String> identifiers() {
        if (altName == null || altName.isBlank() || altName.equals(name)) {
            return Set.of(name);
        }
        return Set.of(name, altName);
    }

    public boolean matches(String pairIdentifier) {
        return pairIdentifier != null && identifiers().contains(pairIdentifier);
    }
}

package org.nowstart.dca.service.exchange;

/**
 * Which order timestamp Kraken compares against the {@code start} bound of a closed orders query.
 */
public enum CloseTimeFilter {
    OPEN("open");

    private final String value;

    CloseTimeFilter(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}

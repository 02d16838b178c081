package com.volumesentinel.core.model;

/**
 * Alert severity tiers, ordered from most to least severe.
 *
 * <p>
 * Each tier owns an inclusive lower bound on the drop percentage, so an exact
 * boundary value resolves to the higher tier.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {
    CRITICAL(70.0),
    HIGH(50.0),
    MEDIUM(30.0),
    LOW(Double.NEGATIVE_INFINITY);

    private final double minDropPct;

    Severity(double minDropPct) {
        this.minDropPct = minDropPct;
    }

    public double getMinDropPct() {
        return minDropPct;
    }

    /**
     * @param dropPct relative shortfall below the historical mean, in percent
     * @return the first tier whose lower bound {@code dropPct} reaches
     */
    public static Severity fromDropPercent(double dropPct) {
        for (Severity severity : values()) {
            if (dropPct >= severity.minDropPct) {
                return severity;
            }
        }
        return LOW;
    }
}

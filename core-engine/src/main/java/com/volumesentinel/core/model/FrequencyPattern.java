package com.volumesentinel.core.model;

import java.util.Locale;

/**
 * Natural cadence of a combination, inferred from the spacing of its
 * non-zero weeks.
 *
 * @since 1.0.0
 */
public enum FrequencyPattern {
    /** Present every week; the only signature sub-weekly traffic leaves in weekly aggregates. */
    DAILY,
    WEEKLY,
    BIWEEKLY,
    MONTHLY,
    QUARTERLY,
    SEMI_ANNUAL,
    /** No stable cadence, or too little evidence to tell. */
    IRREGULAR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.volumesentinel.core.trend;

/**
 * Fixed menu of trailing trend windows, measured in days back from the most
 * recent observed week.
 *
 * @since 1.0.0
 */
public enum TrendWindow {
    TWO_WEEKS("2_weeks", 14),
    ONE_MONTH("1_month", 28),
    THREE_MONTHS("3_months", 91),
    SIX_MONTHS("6_months", 182),
    NINE_MONTHS("9_months", 273),
    TWELVE_MONTHS("12_months", 364),
    EIGHTEEN_MONTHS("18_months", 546);

    private final String label;
    private final int days;

    TrendWindow(String label, int days) {
        this.label = label;
        this.days = days;
    }

    public String getLabel() {
        return label;
    }

    public int getDays() {
        return days;
    }
}

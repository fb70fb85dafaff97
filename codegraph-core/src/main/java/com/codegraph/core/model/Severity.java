package com.codegraph.core.model;

/**
 * Severity of a quality issue.
 *
 * <p>Each level carries the weight it contributes to a debt score and the
 * estimated effort in hours to fix one issue of that severity.
 */
public enum Severity {
    LOW(0.5, 1),
    MEDIUM(1.0, 2),
    HIGH(2.0, 4),
    CRITICAL(4.0, 8);

    private final double debtWeight;
    private final int fixHours;

    Severity(double debtWeight, int fixHours) {
        this.debtWeight = debtWeight;
        this.fixHours = fixHours;
    }

    public double getDebtWeight() {
        return debtWeight;
    }

    public int getFixHours() {
        return fixHours;
    }

    /**
     * Returns the more severe of two severities.
     *
     * @param a first severity, may be null
     * @param b second severity, may be null
     * @return the higher severity, or null if both are null
     */
    public static Severity max(Severity a, Severity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}

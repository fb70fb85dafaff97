package com.codegraph.core.quality;

import com.codegraph.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Limits used by the quality detectors. Each limit is exclusive: a value must exceed it.
 *
 * <p>Loaded from the {@code quality:} section of {@code codegraph.yaml}; missing or
 * non-positive values fall back to the defaults.
 *
 * @param longFunctionMedium function lines above which LONG_FUNCTION is MEDIUM
 * @param longFunctionHigh function lines above which LONG_FUNCTION is HIGH
 * @param longFunctionCritical function lines above which LONG_FUNCTION is CRITICAL
 * @param godClassMethodsMedium method count above which GOD_CLASS is MEDIUM
 * @param godClassMethodsHigh method count above which GOD_CLASS is HIGH
 * @param godClassMethodsCritical method count above which GOD_CLASS is CRITICAL
 * @param godClassLinesMedium class lines above which GOD_CLASS is MEDIUM
 * @param godClassLinesHigh class lines above which GOD_CLASS is HIGH
 * @param godClassLinesCritical class lines above which GOD_CLASS is CRITICAL
 * @param couplingMedium fan-in or fan-out above which TIGHT_COUPLING is MEDIUM
 * @param couplingHigh fan-in or fan-out above which TIGHT_COUPLING is HIGH
 * @param imbalanceMinDegree larger of fan-in/fan-out needed before imbalance is checked (inclusive)
 * @param imbalanceRatio ratio of larger to smaller degree for a LOW imbalance (inclusive)
 * @param imbalanceMediumRatio ratio for a MEDIUM imbalance (inclusive)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QualityThresholds(
    int longFunctionMedium,
    int longFunctionHigh,
    int longFunctionCritical,
    int godClassMethodsMedium,
    int godClassMethodsHigh,
    int godClassMethodsCritical,
    int godClassLinesMedium,
    int godClassLinesHigh,
    int godClassLinesCritical,
    int couplingMedium,
    int couplingHigh,
    int imbalanceMinDegree,
    double imbalanceRatio,
    double imbalanceMediumRatio
) {
    public QualityThresholds {
        longFunctionMedium = orDefault(longFunctionMedium, 50);
        longFunctionHigh = orDefault(longFunctionHigh, 100);
        longFunctionCritical = orDefault(longFunctionCritical, 200);
        godClassMethodsMedium = orDefault(godClassMethodsMedium, 15);
        godClassMethodsHigh = orDefault(godClassMethodsHigh, 20);
        godClassMethodsCritical = orDefault(godClassMethodsCritical, 30);
        godClassLinesMedium = orDefault(godClassLinesMedium, 300);
        godClassLinesHigh = orDefault(godClassLinesHigh, 500);
        godClassLinesCritical = orDefault(godClassLinesCritical, 800);
        couplingMedium = orDefault(couplingMedium, 10);
        couplingHigh = orDefault(couplingHigh, 20);
        imbalanceMinDegree = orDefault(imbalanceMinDegree, 8);
        imbalanceRatio = imbalanceRatio > 0 ? imbalanceRatio : 8.0;
        imbalanceMediumRatio = imbalanceMediumRatio > 0 ? imbalanceMediumRatio : 16.0;
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    private static int orDefault(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    public Severity longFunctionSeverity(int lines) {
        return grade(lines, longFunctionMedium, longFunctionHigh, longFunctionCritical);
    }

    public Severity godClassMethodSeverity(int methods) {
        return grade(methods, godClassMethodsMedium, godClassMethodsHigh, godClassMethodsCritical);
    }

    public Severity godClassLineSeverity(int lines) {
        return grade(lines, godClassLinesMedium, godClassLinesHigh, godClassLinesCritical);
    }

    /**
     * Grades a fan-in or fan-out count.
     *
     * @return HIGH, MEDIUM or null when within limits
     */
    public Severity couplingSeverity(int degree) {
        if (degree > couplingHigh) {
            return Severity.HIGH;
        }
        return degree > couplingMedium ? Severity.MEDIUM : null;
    }

    private static Severity grade(int value, int medium, int high, int critical) {
        if (value > critical) {
            return Severity.CRITICAL;
        }
        if (value > high) {
            return Severity.HIGH;
        }
        return value > medium ? Severity.MEDIUM : null;
    }
}

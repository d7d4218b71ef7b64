package com.tony.npbStats.model;

import org.apache.commons.math3.util.Precision;

/**
 * Calculs des taux dérivés. Un taux n'existe que si son dénominateur est non nul.
 */
public final class Rates {

    private Rates() {
    }

    static int requireCount(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Statistique négative refusée pour " + field + " : " + value);
        }
        return value;
    }

    static Double ratio(double numerator, int denominator, int scale) {
        if (denominator <= 0) return null;
        return Precision.round(numerator / denominator, scale);
    }

    static Double sum(Double a, Double b, int scale) {
        if (a == null || b == null) return null;
        return Precision.round(a + b, scale);
    }

    public static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}

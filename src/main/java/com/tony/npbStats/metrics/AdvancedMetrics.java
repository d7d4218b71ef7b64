package com.tony.npbStats.metrics;

import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.PitchingStats;
import com.tony.npbStats.model.SeasonStats;
import org.apache.commons.math3.util.Precision;

import static com.tony.npbStats.metrics.NpbConstants.*;

/**
 * Métriques avancées calculées à partir des statistiques de comptage.
 * Chaque fonction renvoie null quand son entrée ne permet pas de conclure.
 */
public final class AdvancedMetrics {

    private AdvancedMetrics() {
    }

    /**
     * Complète les champs avancés absents d'une ligne (ne remplace jamais une valeur fournie par la source).
     * Le WAR n'est jamais estimé : seul un WAR publié par une source est retenu.
     */
    public static SeasonStats enrich(SeasonStats stats) {
        if (stats instanceof BattingStats) return enrichBatting((BattingStats) stats);
        if (stats instanceof PitchingStats) return enrichPitching((PitchingStats) stats);
        return stats;
    }

    public static BattingStats enrichBatting(BattingStats s) {
        return s.toBuilder()
                .woba(s.getWoba() != null ? s.getWoba() : woba(s))
                .opsPlus(s.getOpsPlus() != null ? s.getOpsPlus() : opsPlus(s.getOps()))
                .build();
    }

    public static PitchingStats enrichPitching(PitchingStats s) {
        return s.toBuilder()
                .fip(s.getFip() != null ? s.getFip() : fip(s))
                .eraPlus(s.getEraPlus() != null ? s.getEraPlus() : eraPlus(s.getEra()))
                .build();
    }

    // --- Batteurs ---

    public static Double woba(BattingStats s) {
        int denominator = s.getAtBats() + s.getWalks() + s.getSacrificeFlies() + s.getHitByPitch();
        if (denominator <= 0) return null;
        double numerator = WOBA_BB * s.getWalks()
                + WOBA_HBP * s.getHitByPitch()
                + WOBA_1B * s.getSingles()
                + WOBA_2B * s.getDoubles()
                + WOBA_3B * s.getTriples()
                + WOBA_HR * s.getHomeRuns();
        return Precision.round(numerator / denominator, 3);
    }

    public static Integer opsPlus(Double ops) {
        if (ops == null) return null;
        return (int) Math.round(100 * ops / LEAGUE_OPS);
    }

    // --- Lanceurs ---

    /**
     * FIP = (13 x HR + 3 x (BB + HBP) - 2 x K) / IP + constante.
     */
    public static Double fip(PitchingStats s) {
        if (s.getOutsRecorded() <= 0) return null;
        double numerator = 13.0 * s.getHomeRunsAllowed()
                + 3.0 * (s.getWalks() + s.getHitBatters())
                - 2.0 * s.getStrikeouts();
        return Precision.round(numerator / s.getInningsPitched() + FIP_CONSTANT, 2);
    }

    public static Integer eraPlus(Double era) {
        if (era == null || era <= 0) return null;
        return (int) Math.round(100 * LEAGUE_ERA / era);
    }
}

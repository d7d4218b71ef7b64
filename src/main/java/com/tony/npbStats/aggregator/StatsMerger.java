package com.tony.npbStats.aggregator;

import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.provider.PlayerStatsReport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fusion des champs avancés entre deux rapports pour le même joueur.
 * Seuls les champs absents du rapport de base sont complétés, ligne par ligne (par saison) et sur l'agrégat carrière.
 */
final class StatsMerger {

    private StatsMerger() {
    }

    static PlayerStatsReport fill(PlayerStatsReport base, PlayerStatsReport other) {
        Map<Integer, SeasonStats> otherBySeason = new LinkedHashMap<>();
        other.getSeasons().forEach(row -> otherBySeason.putIfAbsent(row.getSeason(), row));

        List<SeasonStats> seasons = base.getSeasons().stream()
                .map(row -> {
                    SeasonStats match = otherBySeason.get(row.getSeason());
                    return match == null ? row : row.fillAdvancedFrom(match);
                })
                .toList();

        SeasonStats career = base.getCareerTotals();
        if (career != null && other.getCareerTotals() != null) {
            career = career.fillAdvancedFrom(other.getCareerTotals());
        }

        return base.toBuilder()
                .clearSeasons()
                .seasons(seasons)
                .careerTotals(career)
                .build();
    }

    static boolean isComplete(PlayerStatsReport report) {
        boolean seasonsComplete = report.getSeasons().stream().allMatch(SeasonStats::hasAllAdvancedFields);
        return seasonsComplete && (report.getCareerTotals() == null || report.getCareerTotals().hasAllAdvancedFields());
    }
}

package com.tony.npbStats.provider;

import com.tony.npbStats.metrics.AdvancedMetrics;
import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.CareerTotals;
import com.tony.npbStats.model.PitchingStats;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StatsType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Réponse d'une source pour les statistiques d'un joueur.
 * <ul>
 *     <li>saison demandée : une seule ligne dans {@code seasons}, pas d'agrégat ;</li>
 *     <li>carrière : toutes les saisons triées, {@code careerTotals} recalculé depuis ces saisons,
 *     et éventuellement la ligne carrière stockée par l'archive ({@code storedCareerTotals}).</li>
 * </ul>
 * Les consommateurs doivent privilégier {@code careerTotals}.
 */
@Value
@Builder(toBuilder = true)
public class PlayerStatsReport {
    String playerId;
    StatsType statsType;
    @Singular
    List<SeasonStats> seasons;
    SeasonStats careerTotals;
    SeasonStats storedCareerTotals;
    String source;

    public static PlayerStatsReport singleSeason(SeasonStats row) {
        return PlayerStatsReport.builder()
                .playerId(row.getPlayerId())
                .statsType(row.getStatsType())
                .season(row)
                .source(row.getSource())
                .build();
    }

    /**
     * Rapport carrière : tri par saison et recalcul de l'agrégat.
     */
    public static PlayerStatsReport career(String playerId, StatsType type, List<? extends SeasonStats> rows,
                                           SeasonStats storedCareer, String source) {
        List<SeasonStats> sorted = onePerSeason(rows).stream()
                .sorted(Comparator.comparing(SeasonStats::getSeason, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        return PlayerStatsReport.builder()
                .playerId(playerId)
                .statsType(type)
                .seasons(sorted)
                .careerTotals(AdvancedMetrics.enrich(CareerTotals.of(playerId, type, sorted, source)))
                .storedCareerTotals(storedCareer)
                .source(source)
                .build();
    }

    /**
     * Regroupe les lignes par saison. Un joueur transféré en cours d'année a une ligne par club :
     * elles sont additionnées en une seule ligne, sans club.
     */
    public static List<SeasonStats> onePerSeason(List<? extends SeasonStats> rows) {
        Map<Integer, List<SeasonStats>> bySeason = new LinkedHashMap<>();
        for (SeasonStats row : rows) {
            bySeason.computeIfAbsent(row.getSeason(), s -> new ArrayList<>()).add(row);
        }
        List<SeasonStats> combined = new ArrayList<>();
        bySeason.forEach((season, seasonRows) -> combined.add(combineSeason(seasonRows, season)));
        return combined;
    }

    /**
     * Somme des lignes d'une même saison, taux recalculés. La source reste celle de la première ligne.
     */
    public static SeasonStats combineSeason(List<? extends SeasonStats> rows, Integer season) {
        if (rows.size() == 1) return rows.get(0);
        SeasonStats first = rows.get(0);
        SeasonStats sum = CareerTotals.of(first.getPlayerId(), first.getStatsType(), rows, first.getSource());
        if (sum instanceof BattingStats) {
            return AdvancedMetrics.enrich(((BattingStats) sum).toBuilder().season(season).build());
        }
        return AdvancedMetrics.enrich(((PitchingStats) sum).toBuilder().season(season).build());
    }

    public boolean isCareer() {
        return careerTotals != null;
    }

    /**
     * Matchs joués : agrégat recalculé si présent, sinon somme des lignes.
     */
    public int getTotalGames() {
        if (careerTotals != null) return careerTotals.getGames();
        return seasons.stream().mapToInt(SeasonStats::getGames).sum();
    }

    public Optional<Integer> getLatestSeason() {
        return seasons.stream().map(SeasonStats::getSeason).filter(Objects::nonNull).max(Integer::compare);
    }
}

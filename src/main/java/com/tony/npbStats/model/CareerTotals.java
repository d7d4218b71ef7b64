package com.tony.npbStats.model;

import org.apache.commons.math3.util.Precision;

import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Agrégat carrière : somme des statistiques de comptage puis recalcul de tous les taux.
 * Les taux saisonniers ne sont jamais moyennés.
 */
public final class CareerTotals {

    private CareerTotals() {
    }

    public static SeasonStats of(String playerId, StatsType type, List<? extends SeasonStats> seasons, String source) {
        if (seasons == null || seasons.isEmpty()) {
            throw new IllegalArgumentException("Aucune saison pour calculer la carrière de " + playerId);
        }
        return type == StatsType.BATTING
                ? batting(playerId, castAll(seasons, BattingStats.class), source)
                : pitching(playerId, castAll(seasons, PitchingStats.class), source);
    }

    public static BattingStats batting(String playerId, List<BattingStats> seasons, String source) {
        return BattingStats.builder()
                .playerId(playerId)
                .season(null)
                .team(commonTeam(seasons))
                .source(source)
                .games(sum(seasons, BattingStats::getGames))
                .plateAppearances(sum(seasons, BattingStats::getPlateAppearances))
                .atBats(sum(seasons, BattingStats::getAtBats))
                .runs(sum(seasons, BattingStats::getRuns))
                .hits(sum(seasons, BattingStats::getHits))
                .doubles(sum(seasons, BattingStats::getDoubles))
                .triples(sum(seasons, BattingStats::getTriples))
                .homeRuns(sum(seasons, BattingStats::getHomeRuns))
                .runsBattedIn(sum(seasons, BattingStats::getRunsBattedIn))
                .stolenBases(sum(seasons, BattingStats::getStolenBases))
                .caughtStealing(sum(seasons, BattingStats::getCaughtStealing))
                .walks(sum(seasons, BattingStats::getWalks))
                .hitByPitch(sum(seasons, BattingStats::getHitByPitch))
                .sacrificeHits(sum(seasons, BattingStats::getSacrificeHits))
                .sacrificeFlies(sum(seasons, BattingStats::getSacrificeFlies))
                .strikeouts(sum(seasons, BattingStats::getStrikeouts))
                // Le WAR est additif, les autres métriques avancées non
                .war(sumWar(seasons.stream().map(BattingStats::getWar).toList()))
                .build();
    }

    public static PitchingStats pitching(String playerId, List<PitchingStats> seasons, String source) {
        return PitchingStats.builder()
                .playerId(playerId)
                .season(null)
                .team(commonTeam(seasons))
                .source(source)
                .games(sum(seasons, PitchingStats::getGames))
                .wins(sum(seasons, PitchingStats::getWins))
                .losses(sum(seasons, PitchingStats::getLosses))
                .saves(sum(seasons, PitchingStats::getSaves))
                .holds(sum(seasons, PitchingStats::getHolds))
                .gamesStarted(sum(seasons, PitchingStats::getGamesStarted))
                .completeGames(sum(seasons, PitchingStats::getCompleteGames))
                .shutouts(sum(seasons, PitchingStats::getShutouts))
                .outsRecorded(sum(seasons, PitchingStats::getOutsRecorded))
                .hitsAllowed(sum(seasons, PitchingStats::getHitsAllowed))
                .runsAllowed(sum(seasons, PitchingStats::getRunsAllowed))
                .earnedRuns(sum(seasons, PitchingStats::getEarnedRuns))
                .homeRunsAllowed(sum(seasons, PitchingStats::getHomeRunsAllowed))
                .walks(sum(seasons, PitchingStats::getWalks))
                .hitBatters(sum(seasons, PitchingStats::getHitBatters))
                .strikeouts(sum(seasons, PitchingStats::getStrikeouts))
                .war(sumWar(seasons.stream().map(PitchingStats::getWar).toList()))
                .build();
    }

    private static <T> int sum(List<T> seasons, ToIntFunction<T> field) {
        return seasons.stream().mapToInt(field).sum();
    }

    private static Double sumWar(List<Double> values) {
        if (values.stream().anyMatch(Objects::isNull)) return null;
        return Precision.round(values.stream().mapToDouble(Double::doubleValue).sum(), 1);
    }

    // Équipe unique sur toute la carrière, sinon rien
    private static String commonTeam(List<? extends SeasonStats> seasons) {
        List<String> teams = seasons.stream().map(SeasonStats::getTeam).distinct().toList();
        return teams.size() == 1 ? teams.get(0) : null;
    }

    private static <T extends SeasonStats> List<T> castAll(List<? extends SeasonStats> seasons, Class<T> type) {
        return seasons.stream()
                .map(s -> {
                    if (!type.isInstance(s)) {
                        throw new IllegalArgumentException("Ligne " + s.getStatsType() + " mélangée à un agrégat " + type.getSimpleName());
                    }
                    return type.cast(s);
                })
                .toList();
    }
}

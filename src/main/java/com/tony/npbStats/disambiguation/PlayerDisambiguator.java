package com.tony.npbStats.disambiguation;

import com.tony.npbStats.aggregator.PlayerDataAggregator;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.provider.FanOut;
import com.tony.npbStats.provider.PlayerStatsReport;
import com.tony.npbStats.provider.ProviderResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Départage des homonymes : on garde les candidats qui ont réellement joué (au moins un match
 * en carrière, au bâton ou au lancer). Les sondages par candidat tournent en parallèle.
 */
@Slf4j
@RequiredArgsConstructor
public class PlayerDisambiguator {

    private final PlayerDataAggregator aggregator;
    private final FanOut fanOut;

    public DisambiguationResult resolve(String name) {
        return disambiguate(name, aggregator.searchPlayer(name));
    }

    public DisambiguationResult disambiguate(String query, List<Player> candidates) {
        if (candidates.isEmpty()) {
            return DisambiguationResult.builder()
                    .query(query)
                    .status(DisambiguationResult.Status.NO_MATCH)
                    .message("Aucun joueur trouvé pour '" + query + "'")
                    .build();
        }
        if (candidates.size() == 1) {
            return DisambiguationResult.builder()
                    .query(query)
                    .status(DisambiguationResult.Status.SINGLE_MATCH)
                    .candidates(candidates)
                    .build();
        }

        log.info("🔍 '{}' : {} homonymes, vérification des statistiques", query, candidates.size());
        Map<Integer, Supplier<Boolean>> checks = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            String playerId = candidates.get(i).getId();
            checks.put(i, () -> hasRecordedStats(playerId));
        }
        Map<Integer, Optional<Boolean>> outcomes = fanOut.invokeAll(checks);

        List<Player> confirmed = new ArrayList<>();
        List<Player> others = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            boolean played = outcomes.getOrDefault(i, Optional.empty()).orElse(false);
            (played ? confirmed : others).add(candidates.get(i));
        }

        if (confirmed.size() == 1) {
            Player selected = confirmed.get(0);
            log.info("✅ '{}' : sélection automatique de {}", query, selected.getId());
            return DisambiguationResult.builder()
                    .query(query)
                    .status(DisambiguationResult.Status.AUTO_SELECTED)
                    .candidate(selected)
                    .otherCandidates(others)
                    .message("Seul " + selected.getNameEnglish() + " a des statistiques enregistrées")
                    .build();
        }
        if (confirmed.size() > 1) {
            log.info("⚠️ '{}' : {} candidats ont des statistiques, choix laissé à l'appelant", query, confirmed.size());
            return DisambiguationResult.builder()
                    .query(query)
                    .status(DisambiguationResult.Status.AMBIGUOUS)
                    .candidates(confirmed)
                    .otherCandidates(others)
                    .message(confirmed.size() + " joueurs correspondent à '" + query
                            + "' : relancer la requête avec l'id du joueur")
                    .build();
        }
        return DisambiguationResult.builder()
                .query(query)
                .status(DisambiguationResult.Status.UNCONFIRMED)
                .candidates(candidates)
                .message("Aucun des " + candidates.size() + " candidats n'a de statistiques confirmées en NPB")
                .build();
    }

    private boolean hasRecordedStats(String playerId) {
        if (playedAny(playerId, StatsType.BATTING)) return true;
        // Sondage annulé (délai dépassé) : pas de seconde série de requêtes
        if (Thread.currentThread().isInterrupted()) return false;
        return playedAny(playerId, StatsType.PITCHING);
    }

    private boolean playedAny(String playerId, StatsType type) {
        ProviderResult<PlayerStatsReport> result = aggregator.getPlayerStats(playerId, null, type);
        return result != null && result.isFound() && result.getValue().getTotalGames() > 0;
    }
}

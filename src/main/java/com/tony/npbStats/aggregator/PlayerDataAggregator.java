package com.tony.npbStats.aggregator;

import com.tony.npbStats.model.League;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.StandingsEntry;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;
import com.tony.npbStats.provider.FanOut;
import com.tony.npbStats.provider.PlayerDataProvider;
import com.tony.npbStats.provider.PlayerStatsReport;
import com.tony.npbStats.provider.ProviderResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Point d'entrée : un ensemble de sources nommées et, pour chaque opération, leur ordre de priorité.
 * Instance construite explicitement et passée aux appelants (pas de singleton global).
 */
@Slf4j
public class PlayerDataAggregator {

    public enum Operation { SEARCH, STATS, TEAMS, ROSTER, STANDINGS }

    private final Map<String, PlayerDataProvider> providers = new LinkedHashMap<>();
    private final Map<Operation, List<String>> priorities = new EnumMap<>(Operation.class);
    private final FanOut fanOut;

    public PlayerDataAggregator(Collection<? extends PlayerDataProvider> providers,
                                Map<Operation, List<String>> priorities, FanOut fanOut) {
        providers.forEach(p -> this.providers.put(p.name(), p));
        for (Operation op : Operation.values()) {
            List<String> order = priorities.getOrDefault(op, List.of());
            for (String name : order) {
                if (!this.providers.containsKey(name)) {
                    throw new IllegalArgumentException("Source inconnue dans la priorité " + op + " : " + name);
                }
            }
            this.priorities.put(op, List.copyOf(order));
        }
        this.fanOut = fanOut;
        log.info("🧩 Agrégateur prêt : sources {} / priorités {}", this.providers.keySet(), this.priorities);
    }

    public Set<String> providerNames() {
        return Collections.unmodifiableSet(providers.keySet());
    }

    public List<String> priority(Operation operation) {
        return priorities.get(operation);
    }

    // --- Recherche ---

    public List<Player> searchPlayer(String name) {
        return searchPlayer(name, null);
    }

    /**
     * Sans source : parcours par priorité avec dédoublonnage par id. Si la première source
     * trouve au moins un joueur, les suivantes ne sont pas interrogées.
     */
    public List<Player> searchPlayer(String name, String source) {
        if (source != null) {
            return explicit(source)
                    .flatMap(p -> FanOut.attempt(source, () -> p.searchPlayer(name)))
                    .orElse(List.of());
        }

        Map<String, Player> merged = new LinkedHashMap<>();
        List<String> order = priorities.get(Operation.SEARCH);
        for (int i = 0; i < order.size(); i++) {
            String providerName = order.get(i);
            PlayerDataProvider provider = providers.get(providerName);
            Optional<List<Player>> found = FanOut.attempt(providerName, () -> provider.searchPlayer(name));
            found.orElse(List.of()).forEach(p -> merged.merge(p.getId(), p, Player::withSourceIdsOf));

            if (i == 0 && found.map(list -> !list.isEmpty()).orElse(false)) {
                log.debug("🔍 '{}' : {} résultat(s) dès la source prioritaire {}", name, merged.size(), providerName);
                break;
            }
        }
        return new ArrayList<>(merged.values());
    }

    // --- Statistiques ---

    public ProviderResult<PlayerStatsReport> getPlayerStats(String playerId, Integer season, StatsType statsType) {
        return getPlayerStats(playerId, season, statsType, null);
    }

    /**
     * Sans source : la première source qui répond fournit le rapport, les suivantes ne font que
     * compléter les champs avancés absents. Arrêt dès que tous les champs avancés sont renseignés.
     * Avec source : délégation directe, une panne de transport remonte à l'appelant.
     */
    public ProviderResult<PlayerStatsReport> getPlayerStats(String playerId, Integer season, StatsType statsType, String source) {
        if (source != null) {
            Optional<PlayerDataProvider> provider = explicit(source);
            if (provider.isEmpty()) return ProviderResult.notFound("Source inconnue : " + source);
            return provider.get().getPlayerStats(playerId, season, statsType);
        }

        PlayerStatsReport best = null;
        List<String> contributors = new ArrayList<>();
        for (String providerName : priorities.get(Operation.STATS)) {
            PlayerDataProvider provider = providers.get(providerName);
            Optional<ProviderResult<PlayerStatsReport>> result =
                    FanOut.attempt(providerName, () -> provider.getPlayerStats(playerId, season, statsType));
            if (result.isEmpty() || !result.get().isFound()) continue;

            PlayerStatsReport report = result.get().getValue();
            if (best == null) {
                best = report;
                contributors.add(report.getSource() != null ? report.getSource() : providerName);
            } else {
                PlayerStatsReport filled = StatsMerger.fill(best, report);
                if (!filled.equals(best)) {
                    contributors.add(report.getSource() != null ? report.getSource() : providerName);
                    best = filled;
                }
            }
            if (StatsMerger.isComplete(best)) break;
        }

        if (best == null) {
            return ProviderResult.notFound("Aucune source n'a de statistiques pour " + playerId);
        }
        if (contributors.size() > 1) {
            best = best.toBuilder().source(String.join("+", contributors)).build();
        }
        return ProviderResult.found(best);
    }

    // --- Équipes et effectifs : première source non vide ---

    public List<Team> getTeams(Integer season) {
        return getTeams(season, null);
    }

    public List<Team> getTeams(Integer season, String source) {
        return firstNonEmpty(Operation.TEAMS, source, p -> () -> p.getTeams(season));
    }

    public List<Player> getTeamRoster(String teamId, Integer season) {
        return getTeamRoster(teamId, season, null);
    }

    public List<Player> getTeamRoster(String teamId, Integer season, String source) {
        return firstNonEmpty(Operation.ROSTER, source, p -> () -> p.getTeamRoster(teamId, season));
    }

    public ProviderResult<List<StandingsEntry>> getStandings(League league, Integer season) {
        boolean allUnsupported = true;
        for (String providerName : priorities.get(Operation.STANDINGS)) {
            PlayerDataProvider provider = providers.get(providerName);
            Optional<ProviderResult<List<StandingsEntry>>> result =
                    FanOut.attempt(providerName, () -> provider.getStandings(league, season));
            if (result.isPresent() && result.get().isFound()) return result.get();
            allUnsupported &= result.map(ProviderResult::isUnsupported).orElse(false);
        }
        return allUnsupported
                ? ProviderResult.unsupported("Aucune source ne conserve les classements " + season)
                : ProviderResult.notFound("Classement introuvable : " + league + " " + season);
    }

    // --- Santé ---

    /**
     * Toutes les sources en parallèle. Une source en erreur ou hors délai vaut false.
     */
    public Map<String, Boolean> healthCheck() {
        Map<String, Supplier<Boolean>> checks = new LinkedHashMap<>();
        providers.forEach((name, provider) -> checks.put(name, provider::healthCheck));

        Map<String, Boolean> health = new LinkedHashMap<>();
        fanOut.invokeAll(checks).forEach((name, up) -> health.put(name, up.orElse(false)));
        log.info("🩺 Santé des sources : {}", health);
        return health;
    }

    // --- Outils ---

    private Optional<PlayerDataProvider> explicit(String source) {
        PlayerDataProvider provider = providers.get(source);
        if (provider == null) {
            log.warn("⚠️ Source inconnue demandée : {}", source);
        }
        return Optional.ofNullable(provider);
    }

    private <T> List<T> firstNonEmpty(Operation operation, String source,
                                      Function<PlayerDataProvider, Supplier<List<T>>> call) {
        if (source != null) {
            return explicit(source)
                    .flatMap(p -> FanOut.attempt(source, call.apply(p)))
                    .orElse(List.of());
        }
        for (String providerName : priorities.get(operation)) {
            List<T> result = FanOut.attempt(providerName, call.apply(providers.get(providerName))).orElse(List.of());
            if (!result.isEmpty()) return result;
        }
        return List.of();
    }
}

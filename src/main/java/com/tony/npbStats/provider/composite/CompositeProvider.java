package com.tony.npbStats.provider.composite;

import com.tony.npbStats.model.League;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StandingsEntry;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;
import com.tony.npbStats.provider.FanOut;
import com.tony.npbStats.provider.PlayerDataProvider;
import com.tony.npbStats.provider.PlayerStatsReport;
import com.tony.npbStats.provider.ProviderResult;
import com.tony.npbStats.provider.TransportFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combine l'archive (saisons avant la date charnière) et le site officiel (saisons depuis).
 * <ul>
 *     <li>saison donnée : une seule source, choisie par rapport à la date charnière ;</li>
 *     <li>carrière : l'archive d'abord, complétée par le site officiel si la carrière touche la date charnière.</li>
 * </ul>
 * Si une seule des deux sources tombe en panne, la réponse est dégradée ; si les deux tombent, l'erreur remonte.
 */
@Slf4j
public class CompositeProvider implements PlayerDataProvider {

    public static final String NAME = "composite";

    private final PlayerDataProvider historical;
    private final PlayerDataProvider scraper;
    private final int cutoffYear;

    public CompositeProvider(PlayerDataProvider historical, PlayerDataProvider scraper, int cutoffYear) {
        this.historical = historical;
        this.scraper = scraper;
        this.cutoffYear = cutoffYear;
    }

    @Override
    public String name() {
        return NAME;
    }

    public String mergedSource() {
        return historical.name() + "+" + scraper.name();
    }

    private boolean isHistorical(Integer season) {
        return season != null && season < cutoffYear;
    }

    // --- Recherche ---

    @Override
    public List<Player> searchPlayer(String name) {
        Optional<List<Player>> fromArchive = FanOut.attempt(historical.name(), () -> historical.searchPlayer(name));
        Optional<List<Player>> fromSite = FanOut.attempt(scraper.name(), () -> scraper.searchPlayer(name));
        requireOneSide(fromArchive, fromSite, "recherche '" + name + "'");

        // L'archive est prioritaire en cas de collision d'id
        Map<String, Player> byId = new LinkedHashMap<>();
        fromArchive.orElse(List.of()).forEach(p -> byId.putIfAbsent(p.getId(), p.taggedWith(historical.name())));
        fromSite.orElse(List.of()).forEach(p -> byId.putIfAbsent(p.getId(), p.taggedWith(scraper.name())));
        return new ArrayList<>(byId.values());
    }

    // --- Statistiques ---

    @Override
    public ProviderResult<PlayerStatsReport> getPlayerStats(String playerId, Integer season, StatsType statsType) {
        if (season != null) {
            PlayerDataProvider target = isHistorical(season) ? historical : scraper;
            return target.getPlayerStats(playerId, season, statsType);
        }
        return careerStats(playerId, statsType);
    }

    private ProviderResult<PlayerStatsReport> careerStats(String playerId, StatsType statsType) {
        Optional<ProviderResult<PlayerStatsReport>> archive =
                FanOut.attempt(historical.name(), () -> historical.getPlayerStats(playerId, null, statsType));

        if (archive.isEmpty() || !archive.get().isFound()) {
            // Rien dans l'archive : le site officiel seul (sa panne remonte, l'archive n'a rien donné)
            return scraper.getPlayerStats(playerId, null, statsType);
        }

        PlayerStatsReport archived = archive.get().getValue();
        int latest = archived.getLatestSeason().orElse(Integer.MIN_VALUE);
        if (latest < cutoffYear - 1) {
            return archive.get();
        }

        log.debug("🔗 Carrière de {} jusqu'en {} : complément depuis le site officiel", playerId, latest);
        Optional<ProviderResult<PlayerStatsReport>> live =
                FanOut.attempt(scraper.name(), () -> scraper.getPlayerStats(playerId, null, statsType));
        if (live.isEmpty() || !live.get().isFound()) {
            return archive.get();
        }

        // Chaque source ramenée à une ligne par saison avant l'union (transferts en cours d'année)
        List<SeasonStats> union = new ArrayList<>(PlayerStatsReport.onePerSeason(archived.getSeasons()));
        union.addAll(PlayerStatsReport.onePerSeason(live.get().getValue().getSeasons()));
        List<SeasonStats> deduplicated = dedupeBySeason(union);
        log.info("🔗 Carrière fusionnée pour {} : {} saison(s)", playerId, deduplicated.size());
        return ProviderResult.found(PlayerStatsReport.career(playerId, statsType, deduplicated, null, mergedSource()));
    }

    /**
     * Une ligne par saison : la première rencontrée l'emporte (l'archive, placée en tête).
     */
    static List<SeasonStats> dedupeBySeason(List<SeasonStats> rows) {
        Map<Integer, SeasonStats> bySeason = new LinkedHashMap<>();
        for (SeasonStats row : rows) {
            bySeason.putIfAbsent(row.getSeason(), row);
        }
        return new ArrayList<>(bySeason.values());
    }

    // --- Équipes, effectifs, classements ---

    @Override
    public List<Team> getTeams(Integer season) {
        if (isHistorical(season)) {
            return historical.getTeams(season);
        }
        Optional<List<Team>> archived = FanOut.attempt(historical.name(), () -> historical.getTeams(season));
        Optional<List<Team>> current = FanOut.attempt(scraper.name(), () -> scraper.getTeams(season));
        requireOneSide(archived, current, "équipes");

        // Les clubs actuels remplacent leur version archivée
        Map<String, Team> byId = new LinkedHashMap<>();
        archived.orElse(List.of()).forEach(t -> byId.put(t.getId(), t));
        current.orElse(List.of()).forEach(t -> byId.put(t.getId(), t));
        return new ArrayList<>(byId.values());
    }

    @Override
    public List<Player> getTeamRoster(String teamId, Integer season) {
        // Sans saison : effectif historique complet
        if (season == null || isHistorical(season)) {
            return historical.getTeamRoster(teamId, season);
        }
        return scraper.getTeamRoster(teamId, season);
    }

    @Override
    public ProviderResult<List<StandingsEntry>> getStandings(League league, Integer season) {
        if (isHistorical(season)) {
            return ProviderResult.unsupported("Classements indisponibles avant " + cutoffYear);
        }
        return scraper.getStandings(league, season);
    }

    @Override
    public boolean healthCheck() {
        boolean archiveUp = historical.healthCheck();
        boolean siteUp = scraper.healthCheck();
        if (archiveUp != siteUp) {
            log.warn("⚠️ Service dégradé : archive={}, site officiel={}", archiveUp, siteUp);
        }
        return archiveUp || siteUp;
    }

    private void requireOneSide(Optional<?> archive, Optional<?> site, String operation) {
        if (archive.isEmpty() && site.isEmpty()) {
            throw new TransportFailureException(NAME, "Archive et site officiel indisponibles (" + operation + ")");
        }
    }
}

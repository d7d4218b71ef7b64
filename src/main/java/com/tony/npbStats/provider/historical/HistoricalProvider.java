package com.tony.npbStats.provider.historical;

import com.tony.npbStats.metrics.AdvancedMetrics;
import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.League;
import com.tony.npbStats.model.PitchingStats;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StandingsEntry;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;
import com.tony.npbStats.name.NameResolver;
import com.tony.npbStats.provider.PlayerDataProvider;
import com.tony.npbStats.provider.PlayerStatsReport;
import com.tony.npbStats.provider.ProviderResult;
import com.tony.npbStats.provider.TransportFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Source "archive" : saisons antérieures à la date charnière, stockées localement.
 * Ne connaît pas les classements (l'archive ne conserve pas le jour par jour).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoricalProvider implements PlayerDataProvider {

    public static final String NAME = "historical";

    private final HistoricalPlayerRepository playerRepository;
    private final HistoricalTeamRepository teamRepository;
    private final BattingSeasonRepository battingRepository;
    private final PitchingSeasonRepository pitchingRepository;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Player> searchPlayer(String name) {
        if (name == null || name.isBlank()) return List.of();
        return withArchive("recherche '" + name + "'", () -> {
            List<HistoricalPlayer> hits = playerRepository.searchByName(name.trim());
            if (hits.isEmpty()) {
                // Pas de sous-chaîne : on tente les variantes de romanisation (archive de petite taille)
                hits = playerRepository.findAll().stream()
                        .filter(p -> matchesAnyName(name, p))
                        .toList();
            }
            log.debug("📚 Archive : {} résultat(s) pour '{}'", hits.size(), name);
            return hits.stream()
                    .sorted(Comparator.comparing(HistoricalPlayer::getNameEnglish))
                    .map(p -> toPlayer(p, null))
                    .toList();
        });
    }

    @Override
    @Transactional(readOnly = true)
    public ProviderResult<PlayerStatsReport> getPlayerStats(String playerId, Integer season, StatsType statsType) {
        return withArchive("stats " + playerId, () -> statsType == StatsType.BATTING
                ? battingReport(playerId, season)
                : pitchingReport(playerId, season));
    }

    private ProviderResult<PlayerStatsReport> battingReport(String playerId, Integer season) {
        if (season != null) {
            List<BattingStats> rows = battingRepository.findByPlayerIdAndSeason(playerId, season).stream()
                    .map(this::toBatting).toList();
            if (rows.isEmpty()) return ProviderResult.notFound("Aucune saison " + season + " en attaque pour " + playerId);
            return ProviderResult.found(PlayerStatsReport.singleSeason(PlayerStatsReport.combineSeason(rows, season)));
        }

        List<BattingStats> rows = battingRepository.findByPlayerIdAndSeasonIsNotNullOrderBySeasonAsc(playerId).stream()
                .map(this::toBatting).toList();
        if (rows.isEmpty()) return ProviderResult.notFound("Aucune statistique en attaque pour " + playerId);

        SeasonStats stored = battingRepository.findByPlayerIdAndSeasonIsNull(playerId).stream()
                .findFirst().map(this::toBatting).orElse(null);
        return ProviderResult.found(PlayerStatsReport.career(playerId, StatsType.BATTING, rows, stored, NAME));
    }

    private ProviderResult<PlayerStatsReport> pitchingReport(String playerId, Integer season) {
        if (season != null) {
            List<PitchingStats> rows = pitchingRepository.findByPlayerIdAndSeason(playerId, season).stream()
                    .map(this::toPitching).toList();
            if (rows.isEmpty()) return ProviderResult.notFound("Aucune saison " + season + " au lancer pour " + playerId);
            return ProviderResult.found(PlayerStatsReport.singleSeason(PlayerStatsReport.combineSeason(rows, season)));
        }

        List<PitchingStats> rows = pitchingRepository.findByPlayerIdAndSeasonIsNotNullOrderBySeasonAsc(playerId).stream()
                .map(this::toPitching).toList();
        if (rows.isEmpty()) return ProviderResult.notFound("Aucune statistique au lancer pour " + playerId);

        SeasonStats stored = pitchingRepository.findByPlayerIdAndSeasonIsNull(playerId).stream()
                .findFirst().map(this::toPitching).orElse(null);
        return ProviderResult.found(PlayerStatsReport.career(playerId, StatsType.PITCHING, rows, stored, NAME));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Team> getTeams(Integer season) {
        return withArchive("équipes", () -> teamRepository.findAllByOrderByLeagueAscTeamIdAsc().stream()
                .filter(t -> t.isActiveIn(season))
                .map(this::toTeam)
                .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Player> getTeamRoster(String teamId, Integer season) {
        return withArchive("effectif " + teamId, () -> {
            Set<String> ids = new LinkedHashSet<>();
            if (season == null) {
                ids.addAll(battingRepository.findPlayerIdsByTeam(teamId));
                ids.addAll(pitchingRepository.findPlayerIdsByTeam(teamId));
            } else {
                ids.addAll(battingRepository.findPlayerIdsByTeamAndSeason(teamId, season));
                ids.addAll(pitchingRepository.findPlayerIdsByTeamAndSeason(teamId, season));
            }
            String teamName = teamRepository.findById(teamId).map(HistoricalTeam::getNameEnglish).orElse(teamId);
            return playerRepository.findAllById(ids).stream()
                    .sorted(Comparator.comparing(HistoricalPlayer::getNameEnglish))
                    .map(p -> toPlayer(p, teamName))
                    .toList();
        });
    }

    @Override
    public ProviderResult<List<StandingsEntry>> getStandings(League league, Integer season) {
        return ProviderResult.unsupported("L'archive ne conserve pas les classements");
    }

    @Override
    public boolean healthCheck() {
        try {
            long count = playerRepository.count();
            log.debug("📚 Archive : {} joueurs", count);
            return true;
        } catch (DataAccessException e) {
            log.warn("⚠️ Archive historique indisponible : {}", e.getMessage());
            return false;
        }
    }

    // --- Conversions vers le modèle canonique ---

    private boolean matchesAnyName(String query, HistoricalPlayer p) {
        if (NameResolver.match(query, p.getNameEnglish())) return true;
        return p.getNameVariants().stream().anyMatch(v -> NameResolver.match(query, v));
    }

    private Player toPlayer(HistoricalPlayer p, String teamName) {
        boolean bats = battingRepository.existsByPlayerIdAndSeasonIsNotNull(p.getPlayerId());
        boolean pitches = pitchingRepository.existsByPlayerIdAndSeasonIsNotNull(p.getPlayerId());
        String years = p.getDebutYear() == null ? null
                : p.getDebutYear() + "-" + (p.getFinalYear() == null ? "" : p.getFinalYear());
        return Player.builder()
                .id(p.getPlayerId())
                .nameEnglish(p.getNameEnglish())
                .nameJapanese(p.getNameJapanese())
                .sourceIds(Map.of(NAME, p.getPlayerId()))
                .teamName(teamName)
                .position(p.getPosition() != null ? p.getPosition() : positionClass(bats, pitches))
                .yearsActive(years)
                .disambiguationInfo(years == null ? "NPB (archive)" : "NPB " + years)
                .source(NAME)
                .build();
    }

    private String positionClass(boolean bats, boolean pitches) {
        if (bats && pitches) return "Two-way Player";
        return pitches ? "Pitcher" : "Position Player";
    }

    private Team toTeam(HistoricalTeam t) {
        return Team.builder()
                .id(t.getTeamId())
                .nameEnglish(t.getNameEnglish())
                .nameJapanese(t.getNameJapanese())
                .league(t.getLeague())
                .abbreviation(t.getAbbreviation())
                .city(t.getCity())
                .build();
    }

    private BattingStats toBatting(BattingSeasonRecord r) {
        return AdvancedMetrics.enrichBatting(BattingStats.builder()
                .playerId(r.getPlayerId())
                .season(r.getSeason())
                .team(r.getTeamId())
                .source(NAME)
                .games(r.getGames())
                .plateAppearances(r.getPlateAppearances())
                .atBats(r.getAtBats())
                .runs(r.getRuns())
                .hits(r.getHits())
                .doubles(r.getDoubles())
                .triples(r.getTriples())
                .homeRuns(r.getHomeRuns())
                .runsBattedIn(r.getRunsBattedIn())
                .stolenBases(r.getStolenBases())
                .caughtStealing(r.getCaughtStealing())
                .walks(r.getWalks())
                .hitByPitch(r.getHitByPitch())
                .sacrificeHits(r.getSacrificeHits())
                .sacrificeFlies(r.getSacrificeFlies())
                .strikeouts(r.getStrikeouts())
                .war(r.getWar())
                .opsPlus(r.getOpsPlus())
                .wrcPlus(r.getWrcPlus())
                .woba(r.getWoba())
                .build());
    }

    private PitchingStats toPitching(PitchingSeasonRecord r) {
        return AdvancedMetrics.enrichPitching(PitchingStats.builder()
                .playerId(r.getPlayerId())
                .season(r.getSeason())
                .team(r.getTeamId())
                .source(NAME)
                .games(r.getGames())
                .gamesStarted(r.getGamesStarted())
                .wins(r.getWins())
                .losses(r.getLosses())
                .saves(r.getSaves())
                .holds(r.getHolds())
                .completeGames(r.getCompleteGames())
                .shutouts(r.getShutouts())
                .outsRecorded(r.getOutsRecorded())
                .hitsAllowed(r.getHitsAllowed())
                .runsAllowed(r.getRunsAllowed())
                .earnedRuns(r.getEarnedRuns())
                .homeRunsAllowed(r.getHomeRunsAllowed())
                .walks(r.getWalks())
                .hitBatters(r.getHitBatters())
                .strikeouts(r.getStrikeouts())
                .fip(r.getFip())
                .xfip(r.getXfip())
                .eraPlus(r.getEraPlus())
                .war(r.getWar())
                .build());
    }

    // Une base injoignable est une panne de transport, pas un "introuvable"
    private <T> T withArchive(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new TransportFailureException(NAME, "Archive indisponible (" + operation + ")", e);
        }
    }
}

package com.tony.npbStats.provider.scraper;

import com.tony.npbStats.model.League;
import com.tony.npbStats.model.NpbClubs;
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
import com.tony.npbStats.provider.scraper.LeagueSiteParser.ScrapedLine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Source "site officiel" (npb.jp) : saisons récentes, classements et effectifs.
 * <p>
 * Le site n'a pas de moteur de recherche : une recherche parcourt les classements individuels
 * (puis les pages d'équipe) de la saison courante et de la précédente. C'est une opération coûteuse,
 * chaque page passant par le limiteur de débit.
 */
@Slf4j
public class ScraperProvider implements PlayerDataProvider {

    public static final String NAME = "scraper";

    private final HtmlSiteClient client;
    private final LeagueSitePages pages;
    private final int cutoffYear;
    private final int careerSeasons;
    private final Clock clock;

    public ScraperProvider(HtmlSiteClient client, LeagueSitePages pages, int cutoffYear, int careerSeasons, Clock clock) {
        this.client = client;
        this.pages = pages;
        this.cutoffYear = cutoffYear;
        this.careerSeasons = careerSeasons;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * La saison NPB démarre fin mars : en janvier-février, la saison courante est encore la précédente.
     */
    public int currentSeason() {
        LocalDate today = LocalDate.now(clock);
        return today.getMonthValue() <= 2 ? today.getYear() - 1 : today.getYear();
    }

    // --- Recherche ---

    @Override
    public List<Player> searchPlayer(String name) {
        if (name == null || name.isBlank()) return List.of();
        int current = currentSeason();
        for (int season : List.of(current, current - 1)) {
            List<Player> found = searchSeason(name, season);
            if (!found.isEmpty()) {
                log.info("🌐 {} joueur(s) trouvé(s) pour '{}' en {}", found.size(), name, season);
                return found;
            }
        }
        log.info("🔍 Aucun joueur '{}' sur le site officiel ({} / {})", name, current, current - 1);
        return List.of();
    }

    private List<Player> searchSeason(String query, int season) {
        Map<String, Player> byId = new LinkedHashMap<>();
        Function<String, String> ids = n -> ScraperPlayerIds.of(n, season);

        for (League league : League.values()) {
            for (StatsType type : StatsType.values()) {
                collectMatches(byId, query, season, type, leaderLines(type, season, league, ids));
            }
        }
        if (!byId.isEmpty()) return new ArrayList<>(byId.values());

        // Joueurs non qualifiés : absents des classements, présents sur les pages d'équipe
        for (Team team : NpbClubs.ALL) {
            for (StatsType type : StatsType.values()) {
                collectMatches(byId, query, season, type, teamLines(type, season, team, ids));
            }
        }
        return new ArrayList<>(byId.values());
    }

    private void collectMatches(Map<String, Player> byId, String query, int season, StatsType type, List<ScrapedLine> lines) {
        for (ScrapedLine line : lines) {
            if (!NameResolver.match(query, line.name())) continue;
            String id = line.stats().getPlayerId();
            String position = type == StatsType.PITCHING ? "Pitcher" : "Position Player";
            Player existing = byId.get(id);
            if (existing != null && !position.equals(existing.getPosition())) {
                byId.put(id, existing.toBuilder().position("Two-way Player").build());
                continue;
            }
            if (existing != null) continue;
            String teamName = NpbClubs.find(line.team()).map(Team::getNameEnglish).orElse(line.team());
            byId.put(id, Player.builder()
                    .id(id)
                    .nameEnglish(line.name())
                    .sourceId(NAME, id)
                    .team(NpbClubs.find(line.team()).orElse(null))
                    .teamName(teamName)
                    .position(position)
                    .yearsActive(String.valueOf(season))
                    .disambiguationInfo("NPB " + season + (teamName == null ? "" : " - " + teamName))
                    .source(NAME)
                    .build());
        }
    }

    // --- Statistiques ---

    @Override
    public ProviderResult<PlayerStatsReport> getPlayerStats(String playerId, Integer season, StatsType statsType) {
        ScraperPlayerIds.ParsedId parsed = ScraperPlayerIds.parse(playerId);
        Function<String, String> ids = n -> playerId;

        if (season != null) {
            return findSeason(parsed.name(), season, statsType, ids)
                    .map(line -> ProviderResult.found(PlayerStatsReport.singleSeason(line.stats())))
                    .orElseGet(() -> ProviderResult.notFound("Pas de saison " + season + " pour " + playerId + " sur le site officiel"));
        }

        int current = currentSeason();
        int first = Math.max(cutoffYear, current - careerSeasons + 1);
        if (parsed.season() != null) {
            first = Math.max(cutoffYear, Math.min(first, parsed.season()));
        }
        List<SeasonStats> rows = new ArrayList<>();
        for (int s = first; s <= current; s++) {
            findSeason(parsed.name(), s, statsType, ids).ifPresent(line -> rows.add(line.stats()));
        }
        if (rows.isEmpty()) {
            return ProviderResult.notFound("Aucune saison " + first + "-" + current + " pour " + playerId);
        }
        log.debug("🌐 {} : {} saison(s) trouvée(s) sur le site officiel", playerId, rows.size());
        return ProviderResult.found(PlayerStatsReport.career(playerId, statsType, rows, null, NAME));
    }

    private Optional<ScrapedLine> findSeason(String name, int season, StatsType type, Function<String, String> ids) {
        for (League league : League.values()) {
            Optional<ScrapedLine> hit = firstMatch(name, leaderLines(type, season, league, ids));
            if (hit.isPresent()) return hit;
        }
        for (Team team : NpbClubs.ALL) {
            Optional<ScrapedLine> hit = firstMatch(name, teamLines(type, season, team, ids));
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    private Optional<ScrapedLine> firstMatch(String name, List<ScrapedLine> lines) {
        return lines.stream().filter(l -> NameResolver.match(name, l.name())).findFirst();
    }

    // --- Équipes, effectifs, classements ---

    @Override
    public List<Team> getTeams(Integer season) {
        return NpbClubs.ALL;
    }

    @Override
    public List<Player> getTeamRoster(String teamId, Integer season) {
        Optional<Team> team = NpbClubs.find(teamId);
        if (team.isEmpty()) {
            log.warn("⚠️ Équipe inconnue du site officiel : {}", teamId);
            return List.of();
        }
        int s = season != null ? season : currentSeason();
        Map<String, Player> byId = new LinkedHashMap<>();
        Function<String, String> ids = n -> ScraperPlayerIds.of(n, s);
        for (StatsType type : StatsType.values()) {
            for (ScrapedLine line : teamLines(type, s, team.get(), ids)) {
                String position = type == StatsType.PITCHING ? "Pitcher" : "Position Player";
                byId.merge(line.stats().getPlayerId(),
                        Player.builder()
                                .id(line.stats().getPlayerId())
                                .nameEnglish(line.name())
                                .sourceId(NAME, line.stats().getPlayerId())
                                .team(team.get())
                                .teamName(team.get().getNameEnglish())
                                .position(position)
                                .yearsActive(String.valueOf(s))
                                .source(NAME)
                                .build(),
                        (a, b) -> a.toBuilder().position("Two-way Player").build());
            }
        }
        return new ArrayList<>(byId.values());
    }

    @Override
    public ProviderResult<List<StandingsEntry>> getStandings(League league, Integer season) {
        int s = season != null ? season : currentSeason();
        List<StandingsEntry> entries = LeagueSiteParser.parseStandings(client.fetchTable(pages.standings(s, league)), s, league, NAME);
        if (entries.isEmpty()) return ProviderResult.notFound("Pas de classement " + league.getDisplayName() + " " + s);
        return ProviderResult.found(entries);
    }

    @Override
    public boolean healthCheck() {
        try {
            client.fetchUncached(pages.standings(currentSeason(), League.CENTRAL));
            return true;
        } catch (TransportFailureException e) {
            log.warn("⚠️ Site officiel injoignable : {}", e.getMessage());
            return false;
        }
    }

    // --- Pages ---

    private List<ScrapedLine> leaderLines(StatsType type, int season, League league, Function<String, String> ids) {
        HtmlTable table = client.fetchTable(pages.leaders(type, season, league));
        return type == StatsType.BATTING
                ? LeagueSiteParser.parseBatting(table, LeagueSitePages.BATTING_LEADERS, season, null, ids, NAME)
                : LeagueSiteParser.parsePitching(table, LeagueSitePages.PITCHING_LEADERS, season, null, ids, NAME);
    }

    private List<ScrapedLine> teamLines(StatsType type, int season, Team team, Function<String, String> ids) {
        HtmlTable table = client.fetchTable(pages.teamPage(type, season, team));
        return type == StatsType.BATTING
                ? LeagueSiteParser.parseBatting(table, LeagueSitePages.BATTING_TEAM, season, team, ids, NAME)
                : LeagueSiteParser.parsePitching(table, LeagueSitePages.PITCHING_TEAM, season, team, ids, NAME);
    }
}

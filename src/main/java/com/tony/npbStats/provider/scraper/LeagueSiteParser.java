package com.tony.npbStats.provider.scraper;

import com.tony.npbStats.metrics.AdvancedMetrics;
import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.Innings;
import com.tony.npbStats.model.League;
import com.tony.npbStats.model.NpbClubs;
import com.tony.npbStats.model.PitchingStats;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StandingsEntry;
import com.tony.npbStats.model.Team;
import com.tony.npbStats.provider.TransportFailureException;
import com.tony.npbStats.provider.scraper.LeagueSitePages.BattingColumns;
import com.tony.npbStats.provider.scraper.LeagueSitePages.PitchingColumns;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Transforme les lignes brutes des pages du site officiel en modèle canonique.
 * Une ligne illisible est ignorée, elle ne fait pas échouer la page. Une page dont aucune ligne
 * n'est lisible (mise en page modifiée, contenu corrompu) est une panne de transport.
 */
@Slf4j
public final class LeagueSiteParser {

    private LeagueSiteParser() {
    }

    /**
     * Ligne de tableau reconnue : nom affiché, équipe, statistiques.
     */
    public record ScrapedLine(String name, String team, SeasonStats stats) {
    }

    /**
     * @param fixedTeam équipe de la page (pages d'équipe), null pour les classements individuels
     * @param idForName dérivation de l'id joueur à partir du nom affiché
     */
    public static List<ScrapedLine> parseBatting(HtmlTable table, BattingColumns c, int season, Team fixedTeam,
                                                 Function<String, String> idForName, String source) {
        List<ScrapedLine> lines = new ArrayList<>();
        int rejected = 0;
        for (List<String> row : table.rows()) {
            if (row.size() < c.minCells()) continue;
            String name = row.get(c.name());
            if (name.isBlank() || name.toLowerCase(Locale.ROOT).contains("player")) continue;
            try {
                String team = teamOf(row, c.team(), fixedTeam);
                BattingStats stats = BattingStats.builder()
                        .playerId(idForName.apply(name))
                        .season(season)
                        .team(team)
                        .source(source)
                        .games(cell(row, c.games()))
                        .plateAppearances(cell(row, c.plateAppearances()))
                        .atBats(cell(row, c.atBats()))
                        .runs(cell(row, c.runs()))
                        .hits(cell(row, c.hits()))
                        .doubles(cell(row, c.doubles()))
                        .triples(cell(row, c.triples()))
                        .homeRuns(cell(row, c.homeRuns()))
                        .runsBattedIn(cell(row, c.rbi()))
                        .stolenBases(cell(row, c.stolenBases()))
                        .caughtStealing(cell(row, c.caughtStealing()))
                        .sacrificeHits(cell(row, c.sacrificeHits()))
                        .sacrificeFlies(cell(row, c.sacrificeFlies()))
                        .walks(cell(row, c.walks()))
                        .hitByPitch(cell(row, c.hitByPitch()))
                        .strikeouts(cell(row, c.strikeouts()))
                        .build();
                lines.add(new ScrapedLine(name, team, AdvancedMetrics.enrichBatting(stats)));
            } catch (IllegalArgumentException e) {
                rejected++;
                log.debug("Ligne batteur ignorée ({}) : {}", name, e.getMessage());
            }
        }
        return checked(lines, rejected, "batteurs " + season, source);
    }

    public static List<ScrapedLine> parsePitching(HtmlTable table, PitchingColumns c, int season, Team fixedTeam,
                                                  Function<String, String> idForName, String source) {
        List<ScrapedLine> lines = new ArrayList<>();
        int rejected = 0;
        for (List<String> row : table.rows()) {
            if (row.size() < c.minCells()) continue;
            String name = row.get(c.name());
            if (name.isBlank() || name.toLowerCase(Locale.ROOT).contains("pitcher")) continue;
            try {
                String team = teamOf(row, c.team(), fixedTeam);
                PitchingStats stats = PitchingStats.builder()
                        .playerId(idForName.apply(name))
                        .season(season)
                        .team(team)
                        .source(source)
                        .games(cell(row, c.games()))
                        .wins(cell(row, c.wins()))
                        .losses(cell(row, c.losses()))
                        .saves(cell(row, c.saves()))
                        .holds(cell(row, c.holds()))
                        .completeGames(cell(row, c.completeGames()))
                        .shutouts(cell(row, c.shutouts()))
                        .outsRecorded(Innings.toOuts(row.get(c.innings()) + row.get(c.inningsFraction())))
                        .hitsAllowed(cell(row, c.hits()))
                        .homeRunsAllowed(cell(row, c.homeRuns()))
                        .walks(cell(row, c.walks()))
                        .hitBatters(cell(row, c.hitBatters()))
                        .strikeouts(cell(row, c.strikeouts()))
                        .runsAllowed(cell(row, c.runs()))
                        .earnedRuns(cell(row, c.earnedRuns()))
                        .build();
                lines.add(new ScrapedLine(name, team, AdvancedMetrics.enrichPitching(stats)));
            } catch (IllegalArgumentException e) {
                rejected++;
                log.debug("Ligne lanceur ignorée ({}) : {}", name, e.getMessage());
            }
        }
        return checked(lines, rejected, "lanceurs " + season, source);
    }

    public static List<StandingsEntry> parseStandings(HtmlTable table, int season, League league, String source) {
        List<StandingsEntry> entries = new ArrayList<>();
        int rejected = 0;
        for (List<String> row : table.rows()) {
            if (row.size() < LeagueSitePages.STANDINGS_MIN_CELLS) continue;
            try {
                entries.add(StandingsEntry.builder()
                        .season(season)
                        .league(league)
                        .rank(cell(row, 0))
                        .teamName(row.get(1))
                        .games(cell(row, 2))
                        .wins(cell(row, 3))
                        .losses(cell(row, 4))
                        .ties(cell(row, 5))
                        .winningPercentage(decimal(row.get(6)))
                        .gamesBehind(row.size() > 7 ? decimal(row.get(7)) : null)
                        .build());
            } catch (IllegalArgumentException e) {
                rejected++;
                log.debug("Ligne de classement ignorée : {}", row);
            }
        }
        return checked(entries, rejected, "classement " + league.getDisplayName() + " " + season, source);
    }

    private static <T> List<T> checked(List<T> parsed, int rejected, String page, String source) {
        if (rejected == 0) return parsed;
        if (parsed.isEmpty()) {
            throw new TransportFailureException(source,
                    "Page " + page + " illisible : aucune des " + rejected + " lignes n'est reconnue");
        }
        log.warn("⚠️ Page {} : {} ligne(s) illisible(s) ignorée(s)", page, rejected);
        return parsed;
    }

    private static String teamOf(List<String> row, int column, Team fixedTeam) {
        if (fixedTeam != null) return fixedTeam.getId();
        if (column < 0) return null;
        // Les classements affichent "(S)" ou "Yakult"
        String raw = row.get(column).replace("(", "").replace(")", "").trim();
        return NpbClubs.find(raw).map(Team::getId).orElse(raw);
    }

    /**
     * Entier de comptage : vide ou "-" vaut 0, le reste doit être numérique.
     */
    static int cell(List<String> row, int index) {
        String value = row.get(index).replace(",", "").trim();
        if (value.isEmpty() || value.equals("-")) return 0;
        return Integer.parseInt(value);
    }

    static Double decimal(String raw) {
        String value = raw.trim();
        if (value.isEmpty() || value.equals("-") || value.equals("--")) return null;
        return Double.valueOf(value.startsWith(".") ? "0" + value : value);
    }
}

package com.tony.npbStats.provider.scraper;

import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.League;
import com.tony.npbStats.model.NpbClubs;
import com.tony.npbStats.model.PitchingStats;
import com.tony.npbStats.model.StandingsEntry;
import com.tony.npbStats.provider.TransportFailureException;
import com.tony.npbStats.provider.scraper.LeagueSiteParser.ScrapedLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeagueSiteParserTest {

    @Test
    @DisplayName("Le tableau principal est celui qui a le plus de lignes de données")
    void mainTable_ShouldIgnoreNavigationTables() {
        HtmlTable table = HtmlPages.table("bat_c.html");

        assertThat(table.rows()).hasSize(4);
        assertThat(table.rows().get(1)).startsWith("1", "Murakami, Munetaka", "(S)");
    }

    @Test
    @DisplayName("Classement des batteurs : lignes illisibles et en-têtes ignorés")
    void parseBatting_ShouldReadLeaderboard() {
        // ACT
        List<ScrapedLine> lines = LeagueSiteParser.parseBatting(HtmlPages.table("bat_c.html"),
                LeagueSitePages.BATTING_LEADERS, 2022, null, name -> ScraperPlayerIds.of(name, 2022), "scraper");

        // ASSERT
        assertThat(lines).extracting(ScrapedLine::name).containsExactly("Murakami, Munetaka", "Okamoto, Kazuma");
        ScrapedLine murakami = lines.get(0);
        assertThat(murakami.team()).isEqualTo("S");
        BattingStats stats = (BattingStats) murakami.stats();
        assertThat(stats.getPlayerId()).isEqualTo("npb_murakami_munetaka_2022");
        assertThat(stats.getHomeRuns()).isEqualTo(56);
        assertThat(stats.getRunsBattedIn()).isEqualTo(134);
        assertThat(stats.getWalks()).isEqualTo(118);
        assertThat(stats.getStrikeouts()).isEqualTo(128);
        assertThat(stats.getSluggingPercentage()).isEqualTo(0.710);
        assertThat(stats.getWoba()).isNotNull();
        assertThat(((BattingStats) lines.get(1).stats()).getCaughtStealing()).isZero(); // "-"
    }

    @Test
    @DisplayName("Classement des lanceurs : manches réparties sur deux cellules")
    void parsePitching_ShouldJoinInningsCells() {
        List<ScrapedLine> lines = LeagueSiteParser.parsePitching(HtmlPages.table("pit_c.html"),
                LeagueSitePages.PITCHING_LEADERS, 2022, null, name -> "aoyagi", "scraper");

        assertThat(lines).hasSize(1);
        PitchingStats stats = (PitchingStats) lines.get(0).stats();
        assertThat(lines.get(0).team()).isEqualTo("T");
        assertThat(stats.getOutsRecorded()).isEqualTo(431);
        assertThat(stats.getEra()).isEqualTo(1.69); // recalculée, pas le 1.66 affiché
        assertThat(stats.getWins()).isEqualTo(13);
        assertThat(stats.getHitBatters()).isEqualTo(8);
        assertThat(stats.getFip()).isNotNull();
    }

    @Test
    @DisplayName("Page d'équipe : l'équipe vient de l'URL")
    void parseTeamPage_ShouldUseFixedTeam() {
        List<ScrapedLine> lines = LeagueSiteParser.parseBatting(HtmlPages.table("idb1_s.html"),
                LeagueSitePages.BATTING_TEAM, 2022, NpbClubs.find("S").orElseThrow(), name -> name, "scraper");

        assertThat(lines).hasSize(3);
        assertThat(lines).extracting(ScrapedLine::team).containsOnly("S");
        assertThat(((BattingStats) lines.get(1).stats()).getSacrificeHits()).isEqualTo(16);
    }

    @Test
    @DisplayName("Classement des équipes")
    void parseStandings_ShouldReadPercentagesAndGamesBehind() {
        List<StandingsEntry> entries = LeagueSiteParser.parseStandings(HtmlPages.table("std_c.html"), 2022, League.CENTRAL, "scraper");

        assertThat(entries).hasSize(3);
        assertThat(entries.get(0).getTeamName()).isEqualTo("Tokyo Yakult Swallows");
        assertThat(entries.get(0).getWinningPercentage()).isEqualTo(0.576);
        assertThat(entries.get(0).getGamesBehind()).isNull();
        assertThat(entries.get(1).getGamesBehind()).isEqualTo(8.0);
        assertThat(entries.get(2).getTies()).isEqualTo(4);
    }

    @Test
    @DisplayName("Ids dérivés du nom : déterministes et relisibles")
    void playerIds_ShouldBeDeterministic() {
        String id = ScraperPlayerIds.of("Murakami, Munetaka", 2024);

        assertThat(id).isEqualTo(ScraperPlayerIds.of("murakami  munetaka", 2024));
        assertThat(ScraperPlayerIds.parse(id)).isEqualTo(new ScraperPlayerIds.ParsedId("murakami munetaka", 2024));
        assertThat(ScraperPlayerIds.parse("suzuki-ichiro").season()).isNull();
    }

    /**
     * Tableau dont toutes les lignes ont un nom mais des cellules non numériques.
     */
    static HtmlTable garbledTable(int rows) {
        List<List<String>> table = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            List<String> row = new ArrayList<>(Collections.nCopies(30, "n/a"));
            row.set(0, String.valueOf(i + 1));
            row.set(1, "Murakami, Munetaka");
            row.set(2, "(S)");
            table.add(row);
        }
        return new HtmlTable(table);
    }

    @Test
    @DisplayName("Aucune ligne lisible sur une page non vide : panne de transport, pas un résultat vide")
    void parseBatting_ShouldFailOnUnreadablePage() {
        assertThatThrownBy(() -> LeagueSiteParser.parseBatting(garbledTable(30), LeagueSitePages.BATTING_LEADERS,
                2024, null, name -> name, "scraper"))
                .isInstanceOf(TransportFailureException.class)
                .hasMessageContaining("[scraper]")
                .hasMessageContaining("30 lignes");
        assertThatThrownBy(() -> LeagueSiteParser.parsePitching(garbledTable(5), LeagueSitePages.PITCHING_LEADERS,
                2024, null, name -> name, "scraper"))
                .isInstanceOf(TransportFailureException.class);
    }

    @Test
    @DisplayName("Page vide ou sans ligne de données : simplement aucun résultat")
    void parseBatting_EmptyPageShouldGiveNoLines() {
        assertThat(LeagueSiteParser.parseBatting(HtmlTable.empty(), LeagueSitePages.BATTING_LEADERS,
                2024, null, name -> name, "scraper")).isEmpty();
    }
}

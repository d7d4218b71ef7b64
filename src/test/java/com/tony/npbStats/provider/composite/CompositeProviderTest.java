package com.tony.npbStats.provider.composite;

import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.League;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;
import com.tony.npbStats.provider.PlayerDataProvider;
import com.tony.npbStats.provider.PlayerStatsReport;
import com.tony.npbStats.provider.ProviderResult;
import com.tony.npbStats.provider.TransportFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.tony.npbStats.provider.StatsFixtures.career;
import static com.tony.npbStats.provider.StatsFixtures.player;
import static com.tony.npbStats.provider.StatsFixtures.season;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompositeProviderTest {

    private static final String ID = "matsunaka-nobuhiko";

    @Mock private PlayerDataProvider historical;
    @Mock private PlayerDataProvider scraper;

    private CompositeProvider composite;

    @BeforeEach
    void setUp() {
        lenient().when(historical.name()).thenReturn("historical");
        lenient().when(scraper.name()).thenReturn("scraper");
        composite = new CompositeProvider(historical, scraper, 2005);
    }

    @Test
    @DisplayName("Saison avant la date charnière : l'archive seule")
    void seasonBeforeCutoff_ShouldNeverCallScraper() {
        // ARRANGE
        PlayerStatsReport report = PlayerStatsReport.singleSeason(season(ID, 1999, 135, 23, "historical"));
        when(historical.getPlayerStats(ID, 1999, StatsType.BATTING)).thenReturn(ProviderResult.found(report));

        // ACT
        ProviderResult<PlayerStatsReport> result = composite.getPlayerStats(ID, 1999, StatsType.BATTING);

        // ASSERT
        assertThat(result.getValue()).isSameAs(report);
        verifyNoInteractions(scraper);
    }

    @Test
    @DisplayName("Saison depuis la date charnière : le site officiel seul")
    void seasonFromCutoff_ShouldNeverCallHistorical() {
        when(scraper.getPlayerStats(ID, 2010, StatsType.BATTING)).thenReturn(ProviderResult.notFound("absent"));

        ProviderResult<PlayerStatsReport> result = composite.getPlayerStats(ID, 2010, StatsType.BATTING);

        assertThat(result.getStatus()).isEqualTo(ProviderResult.Status.NOT_FOUND);
        verifyNoInteractions(historical);
    }

    @Test
    @DisplayName("Carrière à cheval : union dédoublonnée, la saison commune vient de l'archive")
    void career_ShouldMergeAndDeduplicateSeasons() {
        // ARRANGE
        when(historical.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(ProviderResult.found(career(ID, "historical",
                season(ID, 2001, 140, 36, "historical"),
                season(ID, 2002, 138, 30, "historical"),
                season(ID, 2003, 135, 33, "historical"))));
        when(scraper.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(ProviderResult.found(career(ID, "scraper",
                season(ID, 2003, 130, 99, "scraper"),
                season(ID, 2004, 130, 44, "scraper"))));

        // ACT
        PlayerStatsReport merged = composite.getPlayerStats(ID, null, StatsType.BATTING).getValue();

        // ASSERT
        assertThat(merged.getSeasons()).extracting(SeasonStats::getSeason).containsExactly(2001, 2002, 2003, 2004);
        SeasonStats season2003 = merged.getSeasons().get(2);
        assertThat(season2003.getSource()).isEqualTo("historical");
        assertThat(((BattingStats) season2003).getHomeRuns()).isEqualTo(33);

        BattingStats totals = (BattingStats) merged.getCareerTotals();
        assertThat(totals.getGames()).isEqualTo(140 + 138 + 135 + 130);
        assertThat(totals.getHomeRuns()).isEqualTo(36 + 30 + 33 + 44);
        assertThat(merged.getSource()).isEqualTo("historical+scraper");
        assertThat(merged.getStoredCareerTotals()).isNull();
    }

    @Test
    @DisplayName("Carrière à cheval avec transfert en cours de saison : les lignes des deux clubs comptent")
    void career_ShouldKeepEveryTeamOfTradedSeason() {
        // ARRANGE : l'archive renvoie une ligne par club pour 2004
        BattingStats withHawks = season(ID, 2004, 60, 10, "historical");
        BattingStats withLions = season(ID, 2004, 70, 12, "historical").toBuilder().team("L").build();
        PlayerStatsReport archived = PlayerStatsReport.builder()
                .playerId(ID)
                .statsType(StatsType.BATTING)
                .season(withHawks)
                .season(withLions)
                .source("historical")
                .build();
        when(historical.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(ProviderResult.found(archived));
        when(scraper.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(ProviderResult.found(career(ID, "scraper",
                season(ID, 2005, 100, 20, "scraper"))));

        // ACT
        PlayerStatsReport merged = composite.getPlayerStats(ID, null, StatsType.BATTING).getValue();

        // ASSERT
        assertThat(merged.getSeasons()).extracting(SeasonStats::getSeason).containsExactly(2004, 2005);
        BattingStats season2004 = (BattingStats) merged.getSeasons().get(0);
        assertThat(season2004.getGames()).isEqualTo(130);
        assertThat(season2004.getHomeRuns()).isEqualTo(22);
        assertThat(season2004.getTeam()).isNull();
        assertThat(season2004.getSource()).isEqualTo("historical");

        BattingStats totals = (BattingStats) merged.getCareerTotals();
        assertThat(totals.getGames()).isEqualTo(230);
        assertThat(totals.getHomeRuns()).isEqualTo(42);
    }

    @Test
    @DisplayName("Carrière terminée bien avant la date charnière : pas d'appel au site officiel")
    void oldCareer_ShouldNotQueryScraper() {
        ProviderResult<PlayerStatsReport> archived = ProviderResult.found(career(ID, "historical",
                season(ID, 1989, 120, 20, "historical"), season(ID, 1990, 110, 18, "historical")));
        when(historical.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(archived);

        assertThat(composite.getPlayerStats(ID, null, StatsType.BATTING)).isSameAs(archived);
        verify(scraper, never()).getPlayerStats(anyString(), any(), any());
    }

    @Test
    @DisplayName("Rien dans l'archive : le site officiel seul")
    void careerMissingFromArchive_ShouldFallThroughToScraper() {
        ProviderResult<PlayerStatsReport> live = ProviderResult.found(career(ID, "scraper", season(ID, 2020, 100, 10, "scraper")));
        when(historical.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(ProviderResult.notFound("absent"));
        when(scraper.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(live);

        assertThat(composite.getPlayerStats(ID, null, StatsType.BATTING)).isSameAs(live);
    }

    @Test
    @DisplayName("Site officiel en panne pendant une carrière à cheval : réponse dégradée à l'archive")
    void careerWithScraperDown_ShouldDegradeToArchive() {
        ProviderResult<PlayerStatsReport> archived = ProviderResult.found(career(ID, "historical", season(ID, 2004, 130, 44, "historical")));
        when(historical.getPlayerStats(ID, null, StatsType.BATTING)).thenReturn(archived);
        when(scraper.getPlayerStats(ID, null, StatsType.BATTING)).thenThrow(new TransportFailureException("scraper", "timeout"));

        assertThat(composite.getPlayerStats(ID, null, StatsType.BATTING)).isSameAs(archived);
    }

    @Test
    @DisplayName("Recherche : l'archive l'emporte en cas de collision d'id, chaque joueur porte son origine")
    void search_ShouldPreferArchiveOnCollision() {
        when(historical.searchPlayer("Matsunaka")).thenReturn(List.of(player(ID, "Nobuhiko Matsunaka", "historical")));
        when(scraper.searchPlayer("Matsunaka")).thenReturn(List.of(
                player(ID, "Matsunaka, Nobuhiko", "scraper"),
                player("npb_matsunaka_x_2024", "Matsunaka, X", "scraper")));

        List<Player> found = composite.searchPlayer("Matsunaka");

        assertThat(found).extracting(Player::getNameEnglish).containsExactly("Nobuhiko Matsunaka", "Matsunaka, X");
        assertThat(found).extracting(Player::getSource).containsExactly("historical", "scraper");
    }

    @Test
    @DisplayName("Recherche : une source en panne n'empêche pas l'autre, deux pannes remontent")
    void search_ShouldDegradeThenFail() {
        when(historical.searchPlayer("Oh")).thenReturn(List.of(player("oh-sadaharu", "Sadaharu Oh", "historical")));
        when(scraper.searchPlayer(anyString())).thenThrow(new TransportFailureException("scraper", "timeout"));
        assertThat(composite.searchPlayer("Oh")).hasSize(1);

        when(historical.searchPlayer("Oh")).thenThrow(new TransportFailureException("historical", "H2 down"));
        assertThatThrownBy(() -> composite.searchPlayer("Oh")).isInstanceOf(TransportFailureException.class);
    }

    @Test
    @DisplayName("Classements avant la date charnière : non supportés, sans appel")
    void standingsBeforeCutoff_ShouldBeUnsupported() {
        assertThat(composite.getStandings(League.CENTRAL, 1990).isUnsupported()).isTrue();
        verifyNoInteractions(historical, scraper);
    }

    @Test
    @DisplayName("Effectifs : archive avant la date charnière ou sans saison, site officiel ensuite")
    void roster_ShouldRouteBySeason() {
        composite.getTeamRoster("G", 1990);
        composite.getTeamRoster("G", null);
        composite.getTeamRoster("G", 2024);

        verify(historical).getTeamRoster("G", 1990);
        verify(historical).getTeamRoster("G", null);
        verify(scraper).getTeamRoster("G", 2024);
        verify(scraper, never()).getTeamRoster("G", 1990);
    }

    @Test
    @DisplayName("Équipes récentes : les clubs actuels remplacent leur version archivée")
    void teams_ShouldPreferCurrentClubs() {
        Team oldGiants = Team.builder().id("G").nameEnglish("Tokyo Kyojin").league(League.CENTRAL).build();
        Team blueWave = Team.builder().id("BW").nameEnglish("Orix BlueWave").league(League.PACIFIC).build();
        Team giants = Team.builder().id("G").nameEnglish("Yomiuri Giants").league(League.CENTRAL).build();
        when(historical.getTeams(null)).thenReturn(List.of(oldGiants, blueWave));
        when(scraper.getTeams(null)).thenReturn(List.of(giants));

        assertThat(composite.getTeams(null)).extracting(Team::getNameEnglish)
                .containsExactly("Yomiuri Giants", "Orix BlueWave");
    }

    @Test
    void teamsBeforeCutoff_ShouldComeFromArchiveOnly() {
        composite.getTeams(1995);

        verify(historical).getTeams(1995);
        verifyNoInteractions(scraper);
    }

    @Test
    void healthCheck_ShouldBeUpWhileOneSideAnswers() {
        when(historical.healthCheck()).thenReturn(true);
        when(scraper.healthCheck()).thenReturn(false);

        assertThat(composite.healthCheck()).isTrue();
    }
}

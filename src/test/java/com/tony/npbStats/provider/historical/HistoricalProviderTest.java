package com.tony.npbStats.provider.historical;

import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.League;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.provider.PlayerStatsReport;
import com.tony.npbStats.provider.ProviderResult;
import com.tony.npbStats.provider.TransportFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HistoricalProviderTest {

    @Mock private HistoricalPlayerRepository playerRepository;
    @Mock private HistoricalTeamRepository teamRepository;
    @Mock private BattingSeasonRepository battingRepository;
    @Mock private PitchingSeasonRepository pitchingRepository;

    @InjectMocks
    private HistoricalProvider provider;

    private static BattingSeasonRecord row(Integer season, String team, int games, int atBats, int hits, int homeRuns) {
        BattingSeasonRecord r = new BattingSeasonRecord();
        r.setPlayerId("ochiai-hiromitsu");
        r.setSeason(season);
        r.setTeamId(team);
        r.setGames(games);
        r.setAtBats(atBats);
        r.setHits(hits);
        r.setHomeRuns(homeRuns);
        r.setWar(season == null ? 99.0 : null);
        return r;
    }

    @Test
    @DisplayName("Carrière : agrégat recalculé, ligne carrière stockée conservée à part")
    void getPlayerStats_CareerShouldRecomputeTotals() {
        // ARRANGE : la ligne stockée ne correspond pas à la somme
        when(battingRepository.findByPlayerIdAndSeasonIsNotNullOrderBySeasonAsc("ochiai-hiromitsu"))
                .thenReturn(List.of(row(1985, "M", 130, 460, 169, 52), row(1986, "M", 123, 417, 150, 50)));
        when(battingRepository.findByPlayerIdAndSeasonIsNull("ochiai-hiromitsu"))
                .thenReturn(List.of(row(null, "M", 250, 870, 320, 100)));

        // ACT
        ProviderResult<PlayerStatsReport> result = provider.getPlayerStats("ochiai-hiromitsu", null, StatsType.BATTING);

        // ASSERT
        PlayerStatsReport report = result.getValue();
        BattingStats career = (BattingStats) report.getCareerTotals();
        assertThat(report.getSeasons()).hasSize(2);
        assertThat(career.getGames()).isEqualTo(253);
        assertThat(career.getHomeRuns()).isEqualTo(102);
        assertThat(career.getBattingAverage()).isEqualTo(0.364); // 319 / 877
        assertThat(report.getStoredCareerTotals().getGames()).isEqualTo(250);
        assertThat(report.getSource()).isEqualTo("historical");
        assertThat(report.getTotalGames()).isEqualTo(253);
    }

    @Test
    @DisplayName("Saison avec transfert : les lignes des deux clubs sont additionnées")
    void getPlayerStats_SeasonShouldCombineTeams() {
        when(battingRepository.findByPlayerIdAndSeason("ochiai-hiromitsu", 1987))
                .thenReturn(List.of(row(1987, "M", 60, 200, 60, 10), row(1987, "D", 70, 250, 80, 18)));

        PlayerStatsReport report = provider.getPlayerStats("ochiai-hiromitsu", 1987, StatsType.BATTING).getValue();

        BattingStats season = (BattingStats) report.getSeasons().get(0);
        assertThat(report.getSeasons()).hasSize(1);
        assertThat(season.getSeason()).isEqualTo(1987);
        assertThat(season.getGames()).isEqualTo(130);
        assertThat(season.getHomeRuns()).isEqualTo(28);
        assertThat(season.getTeam()).isNull();
    }

    @Test
    @DisplayName("Pas de ligne : introuvable, pas d'exception")
    void getPlayerStats_ShouldReturnNotFound() {
        when(pitchingRepository.findByPlayerIdAndSeasonIsNotNullOrderBySeasonAsc("nobody")).thenReturn(List.of());

        ProviderResult<PlayerStatsReport> result = provider.getPlayerStats("nobody", null, StatsType.PITCHING);

        assertThat(result.getStatus()).isEqualTo(ProviderResult.Status.NOT_FOUND);
    }

    @Test
    @DisplayName("Recherche : si la sous-chaîne échoue, on essaie les variantes de romanisation")
    void searchPlayer_ShouldFallBackToRomanizationVariants() {
        // ARRANGE
        HistoricalPlayer oh = new HistoricalPlayer("oh-sadaharu", "Sadaharu Oh");
        oh.getNameVariants().add("Oh Sadaharu");
        oh.setDebutYear(1959);
        oh.setFinalYear(1980);
        when(playerRepository.searchByName("Oo Sadaharu")).thenReturn(List.of());
        when(playerRepository.findAll()).thenReturn(List.of(oh, new HistoricalPlayer("nagashima-shigeo", "Shigeo Nagashima")));

        // ACT
        List<Player> found = provider.searchPlayer("Oo Sadaharu");

        // ASSERT
        assertThat(found).extracting(Player::getId).containsExactly("oh-sadaharu");
        assertThat(found.get(0).getYearsActive()).isEqualTo("1959-1980");
        assertThat(found.get(0).getSourceIds()).containsEntry("historical", "oh-sadaharu");
        assertThat(found.get(0).getPosition()).isEqualTo("Position Player");
    }

    @Test
    @DisplayName("Les classements ne sont pas conservés : non supporté")
    void getStandings_ShouldBeUnsupported() {
        assertThat(provider.getStandings(League.PACIFIC, 1990).isUnsupported()).isTrue();
        verifyNoInteractions(playerRepository, teamRepository, battingRepository, pitchingRepository);
    }

    @Test
    @DisplayName("Base injoignable : panne de transport pour les requêtes, false pour le health check")
    void databaseFailure_ShouldBecomeTransportFailure() {
        when(playerRepository.searchByName(anyString())).thenThrow(new DataAccessResourceFailureException("H2 down"));
        when(playerRepository.count()).thenThrow(new DataAccessResourceFailureException("H2 down"));

        assertThatThrownBy(() -> provider.searchPlayer("Oh"))
                .isInstanceOf(TransportFailureException.class)
                .hasMessageStartingWith("[historical]");
        assertThat(provider.healthCheck()).isFalse();
    }
}

package com.tony.npbStats.provider;

import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StatsType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tony.npbStats.provider.StatsFixtures.season;
import static org.assertj.core.api.Assertions.assertThat;

class PlayerStatsReportTest {

    @Test
    @DisplayName("Carrière : une ligne par saison, les clubs d'une saison avec transfert sont additionnés")
    void career_ShouldCollapseTradedSeason() {
        // ARRANGE
        BattingStats first = season("ochiai", 1986, 60, 10, "historical");
        BattingStats second = season("ochiai", 1986, 70, 12, "historical").toBuilder().team("D").build();
        BattingStats next = season("ochiai", 1987, 120, 30, "historical");

        // ACT
        PlayerStatsReport report = PlayerStatsReport.career("ochiai", StatsType.BATTING,
                List.of(next, first, second), null, "historical");

        // ASSERT
        assertThat(report.getSeasons()).extracting(SeasonStats::getSeason).containsExactly(1986, 1987);
        BattingStats season1986 = (BattingStats) report.getSeasons().get(0);
        assertThat(season1986.getGames()).isEqualTo(130);
        assertThat(season1986.getAtBats()).isEqualTo(520);
        assertThat(season1986.getTeam()).isNull();
        assertThat(report.getCareerTotals().getGames()).isEqualTo(250);
        assertThat(report.getTotalGames()).isEqualTo(250);
    }

    @Test
    void onePerSeason_ShouldKeepSingleRowsUntouched() {
        BattingStats only = season("ochiai", 1986, 60, 10, "scraper");

        assertThat(PlayerStatsReport.onePerSeason(List.of(only))).containsExactly(only);
    }
}

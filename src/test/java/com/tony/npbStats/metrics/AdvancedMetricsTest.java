package com.tony.npbStats.metrics;

import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.PitchingStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AdvancedMetricsTest {

    private final BattingStats batter = BattingStats.builder()
            .playerId("b").season(2022)
            .atBats(500).hits(150).doubles(30).triples(5).homeRuns(20)
            .walks(60).hitByPitch(5).sacrificeFlies(5)
            .build();

    private final PitchingStats pitcher = PitchingStats.builder()
            .playerId("p").season(2022)
            .outsRecorded(517).earnedRuns(50).hitsAllowed(150)
            .homeRunsAllowed(15).walks(40).hitBatters(5).strikeouts(180)
            .build();

    @Test
    @DisplayName("wOBA et OPS+ avec les pondérations NPB")
    void battingMetrics_ShouldUseNpbWeights() {
        assertThat(AdvancedMetrics.woba(batter)).isEqualTo(0.373); // 212.6 / 570
        assertThat(AdvancedMetrics.opsPlus(batter.getOps())).isEqualTo(117);
        assertThat(AdvancedMetrics.opsPlus(null)).isNull();
    }

    @Test
    @DisplayName("FIP et ERA+ pour un lanceur")
    void pitchingMetrics_ShouldComputeFipAndEraPlus() {
        assertThat(AdvancedMetrics.fip(pitcher)).isEqualTo(2.93);
        assertThat(AdvancedMetrics.eraPlus(pitcher.getEra())).isEqualTo(134);
        assertThat(AdvancedMetrics.fip(PitchingStats.builder().playerId("x").build())).isNull();
    }

    @Test
    @DisplayName("L'enrichissement ne remplace pas une valeur publiée et n'invente pas de WAR")
    void enrich_ShouldKeepPublishedValues() {
        // ARRANGE
        BattingStats published = batter.toBuilder().woba(0.400).build();

        // ACT
        BattingStats enriched = AdvancedMetrics.enrichBatting(published);

        // ASSERT
        assertThat(enriched.getWoba()).isEqualTo(0.400);
        assertThat(enriched.getOpsPlus()).isEqualTo(117);
        assertThat(enriched.getWar()).isNull();
        assertThat(enriched.getWrcPlus()).isNull();
    }
}

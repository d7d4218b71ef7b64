package com.tony.npbStats.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NpbClubsTest {

    @Test
    void find_ShouldAcceptCodeFullNameOrNickname() {
        assertThat(NpbClubs.find("g")).map(Team::getNameEnglish).contains("Yomiuri Giants");
        assertThat(NpbClubs.find("Tokyo Yakult Swallows")).map(Team::getId).contains("S");
        assertThat(NpbClubs.find("Hawks")).map(Team::getId).contains("H");
        assertThat(NpbClubs.find("Kintetsu Buffaloes")).isEmpty();
    }

    @Test
    void ofLeague_ShouldSplitTwelveClubsInTwoLeagues() {
        assertThat(NpbClubs.ALL).hasSize(12);
        assertThat(NpbClubs.ofLeague(League.CENTRAL)).hasSize(6);
        assertThat(NpbClubs.ofLeague(League.PACIFIC)).extracting(Team::getId).contains("B", "F");
        assertThat(NpbClubs.pageCode(NpbClubs.find("DB").orElseThrow())).isEqualTo("db");
    }
}

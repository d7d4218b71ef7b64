package com.tony.npbStats.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StandingsEntry {
    int season;
    League league;
    int rank;
    String teamName;
    int games;
    int wins;
    int losses;
    int ties;
    Double winningPercentage;
    // null pour le leader ("-" sur le site)
    Double gamesBehind;
}

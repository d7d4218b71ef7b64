package com.tony.npbStats.model;

import lombok.Builder;
import lombok.Value;

@Value
public class PitchingStats implements SeasonStats {
    String playerId;
    Integer season;
    String team;
    String source;
    int games;

    // --- Comptage ---
    int wins;
    int losses;
    int saves;
    int holds;
    int gamesStarted;
    int completeGames;
    int shutouts;
    // Manches stockées en retraits : 172.1 IP = 517 outs
    int outsRecorded;
    int hitsAllowed;
    int runsAllowed;
    int earnedRuns;
    int homeRunsAllowed;
    int walks;
    int hitBatters;
    int strikeouts;

    // --- Taux (recalculés) ---
    Double era;
    Double whip;
    Double strikeoutsPerNine;
    Double walksPerNine;

    // --- Avancées (optionnelles) ---
    Double fip;
    Double xfip;
    Integer eraPlus;
    Double war;

    @Builder(toBuilder = true)
    private PitchingStats(String playerId, Integer season, String team, String source, int games,
                          int wins, int losses, int saves, int holds, int gamesStarted, int completeGames,
                          int shutouts, int outsRecorded, int hitsAllowed, int runsAllowed, int earnedRuns,
                          int homeRunsAllowed, int walks, int hitBatters, int strikeouts,
                          Double fip, Double xfip, Integer eraPlus, Double war) {
        this.playerId = playerId;
        this.season = season;
        this.team = team;
        this.source = source;
        this.games = Rates.requireCount("games", games);
        this.wins = Rates.requireCount("wins", wins);
        this.losses = Rates.requireCount("losses", losses);
        this.saves = Rates.requireCount("saves", saves);
        this.holds = Rates.requireCount("holds", holds);
        this.gamesStarted = Rates.requireCount("gamesStarted", gamesStarted);
        this.completeGames = Rates.requireCount("completeGames", completeGames);
        this.shutouts = Rates.requireCount("shutouts", shutouts);
        this.outsRecorded = Rates.requireCount("outsRecorded", outsRecorded);
        this.hitsAllowed = Rates.requireCount("hitsAllowed", hitsAllowed);
        this.runsAllowed = Rates.requireCount("runsAllowed", runsAllowed);
        this.earnedRuns = Rates.requireCount("earnedRuns", earnedRuns);
        this.homeRunsAllowed = Rates.requireCount("homeRunsAllowed", homeRunsAllowed);
        this.walks = Rates.requireCount("walks", walks);
        this.hitBatters = Rates.requireCount("hitBatters", hitBatters);
        this.strikeouts = Rates.requireCount("strikeouts", strikeouts);

        // 9 manches = 27 retraits
        this.era = Rates.ratio(27.0 * earnedRuns, outsRecorded, 2);
        this.whip = Rates.ratio(3.0 * (walks + hitsAllowed), outsRecorded, 2);
        this.strikeoutsPerNine = Rates.ratio(27.0 * strikeouts, outsRecorded, 2);
        this.walksPerNine = Rates.ratio(27.0 * walks, outsRecorded, 2);

        this.fip = fip;
        this.xfip = xfip;
        this.eraPlus = eraPlus;
        this.war = war;
    }

    public double getInningsPitched() {
        return outsRecorded / 3.0;
    }

    public String getInningsDisplay() {
        return Innings.format(outsRecorded);
    }

    @Override
    public StatsType getStatsType() {
        return StatsType.PITCHING;
    }

    @Override
    public boolean hasAllAdvancedFields() {
        return fip != null && xfip != null && eraPlus != null && war != null;
    }

    @Override
    public PitchingStats fillAdvancedFrom(SeasonStats other) {
        if (!(other instanceof PitchingStats)) return this;
        PitchingStats o = (PitchingStats) other;
        return toBuilder()
                .fip(Rates.firstNonNull(fip, o.fip))
                .xfip(Rates.firstNonNull(xfip, o.xfip))
                .eraPlus(Rates.firstNonNull(eraPlus, o.eraPlus))
                .war(Rates.firstNonNull(war, o.war))
                .build();
    }

    @Override
    public PitchingStats withSource(String source) {
        return toBuilder().source(source).build();
    }
}

package com.tony.npbStats.model;

import lombok.Builder;
import lombok.Value;

@Value
public class BattingStats implements SeasonStats {
    String playerId;
    Integer season;
    String team;
    String source;
    int games;

    // --- Comptage ---
    int plateAppearances;
    int atBats;
    int runs;
    int hits;
    int doubles;
    int triples;
    int homeRuns;
    int runsBattedIn;
    int stolenBases;
    int caughtStealing;
    int walks;
    int hitByPitch;
    int sacrificeHits;
    int sacrificeFlies;
    int strikeouts;

    // --- Taux (recalculés, jamais repris de la source) ---
    Double battingAverage;
    Double onBasePercentage;
    Double sluggingPercentage;
    Double ops;

    // --- Avancées (optionnelles) ---
    Double woba;
    Integer opsPlus;
    Integer wrcPlus;
    Double war;

    @Builder(toBuilder = true)
    private BattingStats(String playerId, Integer season, String team, String source, int games,
                         int plateAppearances, int atBats, int runs, int hits, int doubles, int triples,
                         int homeRuns, int runsBattedIn, int stolenBases, int caughtStealing, int walks,
                         int hitByPitch, int sacrificeHits, int sacrificeFlies, int strikeouts,
                         Double woba, Integer opsPlus, Integer wrcPlus, Double war) {
        this.playerId = playerId;
        this.season = season;
        this.team = team;
        this.source = source;
        this.games = Rates.requireCount("games", games);
        this.plateAppearances = Rates.requireCount("plateAppearances", plateAppearances);
        this.atBats = Rates.requireCount("atBats", atBats);
        this.runs = Rates.requireCount("runs", runs);
        this.hits = Rates.requireCount("hits", hits);
        this.doubles = Rates.requireCount("doubles", doubles);
        this.triples = Rates.requireCount("triples", triples);
        this.homeRuns = Rates.requireCount("homeRuns", homeRuns);
        this.runsBattedIn = Rates.requireCount("runsBattedIn", runsBattedIn);
        this.stolenBases = Rates.requireCount("stolenBases", stolenBases);
        this.caughtStealing = Rates.requireCount("caughtStealing", caughtStealing);
        this.walks = Rates.requireCount("walks", walks);
        this.hitByPitch = Rates.requireCount("hitByPitch", hitByPitch);
        this.sacrificeHits = Rates.requireCount("sacrificeHits", sacrificeHits);
        this.sacrificeFlies = Rates.requireCount("sacrificeFlies", sacrificeFlies);
        this.strikeouts = Rates.requireCount("strikeouts", strikeouts);
        if (doubles + triples + homeRuns > hits) {
            throw new IllegalArgumentException("Coups sûrs incohérents pour " + playerId + " (" + season + ")");
        }

        this.battingAverage = Rates.ratio(hits, atBats, 3);
        this.onBasePercentage = Rates.ratio(hits + walks + hitByPitch, atBats + walks + hitByPitch + sacrificeFlies, 3);
        this.sluggingPercentage = Rates.ratio(totalBases(hits, doubles, triples, homeRuns), atBats, 3);
        this.ops = Rates.sum(onBasePercentage, sluggingPercentage, 3);

        this.woba = woba;
        this.opsPlus = opsPlus;
        this.wrcPlus = wrcPlus;
        this.war = war;
    }

    private static int totalBases(int hits, int doubles, int triples, int homeRuns) {
        return hits + doubles + 2 * triples + 3 * homeRuns;
    }

    public int getSingles() {
        return hits - doubles - triples - homeRuns;
    }

    public int getTotalBases() {
        return totalBases(hits, doubles, triples, homeRuns);
    }

    @Override
    public StatsType getStatsType() {
        return StatsType.BATTING;
    }

    @Override
    public boolean hasAllAdvancedFields() {
        return woba != null && opsPlus != null && wrcPlus != null && war != null;
    }

    @Override
    public BattingStats fillAdvancedFrom(SeasonStats other) {
        if (!(other instanceof BattingStats)) return this;
        BattingStats o = (BattingStats) other;
        return toBuilder()
                .woba(Rates.firstNonNull(woba, o.woba))
                .opsPlus(Rates.firstNonNull(opsPlus, o.opsPlus))
                .wrcPlus(Rates.firstNonNull(wrcPlus, o.wrcPlus))
                .war(Rates.firstNonNull(war, o.war))
                .build();
    }

    @Override
    public BattingStats withSource(String source) {
        return toBuilder().source(source).build();
    }
}

package com.tony.npbStats.provider.historical;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Ligne de l'archive. Une saison null correspond à la ligne carrière stockée.
 * Les taux stockés ne sont conservés que pour référence : ils sont recalculés à la lecture.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "batting_season", indexes = @Index(columnList = "player_id, season"))
public class BattingSeasonRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String playerId;

    private Integer season;
    private String teamId;

    private int games;
    private int plateAppearances;
    private int atBats;
    private int runs;
    private int hits;
    private int doubles;
    private int triples;
    private int homeRuns;
    private int runsBattedIn;
    private int stolenBases;
    private int caughtStealing;
    private int walks;
    private int hitByPitch;
    private int sacrificeHits;
    private int sacrificeFlies;
    private int strikeouts;

    private Double storedAverage;

    private Double war;
    private Integer opsPlus;
    private Integer wrcPlus;
    private Double woba;

    private String dataSource;
}

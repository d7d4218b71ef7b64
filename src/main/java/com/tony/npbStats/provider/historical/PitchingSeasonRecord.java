package com.tony.npbStats.provider.historical;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "pitching_season", indexes = @Index(columnList = "player_id, season"))
public class PitchingSeasonRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String playerId;

    private Integer season;
    private String teamId;

    private int games;
    private int gamesStarted;
    private int wins;
    private int losses;
    private int saves;
    private int holds;
    private int completeGames;
    private int shutouts;
    private int outsRecorded;
    private int hitsAllowed;
    private int runsAllowed;
    private int earnedRuns;
    private int homeRunsAllowed;
    private int walks;
    private int hitBatters;
    private int strikeouts;

    private Double storedEra;

    private Double fip;
    private Double xfip;
    private Integer eraPlus;
    private Double war;

    private String dataSource;
}

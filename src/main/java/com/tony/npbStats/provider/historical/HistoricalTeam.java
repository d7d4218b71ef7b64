package com.tony.npbStats.provider.historical;

import com.tony.npbStats.model.League;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "historical_team")
public class HistoricalTeam {
    @Id
    private String teamId;

    @Column(nullable = false)
    private String nameEnglish;

    private String nameJapanese;

    @Enumerated(EnumType.STRING)
    private League league;

    private String city;
    private String abbreviation;

    // Période d'existence sous ce nom (null = toujours actif)
    private Integer firstSeason;
    private Integer lastSeason;

    public boolean isActiveIn(Integer season) {
        if (season == null) return true;
        return (firstSeason == null || firstSeason <= season) && (lastSeason == null || season <= lastSeason);
    }
}

package com.tony.npbStats.provider.historical;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "historical_player")
public class HistoricalPlayer {
    @Id
    private String playerId;

    @Column(nullable = false)
    private String nameEnglish;

    private String nameJapanese;

    // Graphies alternatives ("Suzuki Ichiro", "Suzuki, Ichiro"...)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "historical_player_name_variant", joinColumns = @JoinColumn(name = "player_id"))
    @Column(name = "name_variant")
    private List<String> nameVariants = new ArrayList<>();

    private String position;
    private String bats;
    private String throwsHand;
    private String birthPlace;
    private Integer debutYear;
    private Integer finalYear;

    public HistoricalPlayer(String playerId, String nameEnglish) {
        this.playerId = playerId;
        this.nameEnglish = nameEnglish;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HistoricalPlayer)) return false;
        return playerId != null && playerId.equals(((HistoricalPlayer) o).getPlayerId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}

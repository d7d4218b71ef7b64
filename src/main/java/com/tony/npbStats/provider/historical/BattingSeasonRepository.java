package com.tony.npbStats.provider.historical;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface BattingSeasonRepository extends JpaRepository<BattingSeasonRecord, Long> {

    List<BattingSeasonRecord> findByPlayerIdAndSeasonIsNotNullOrderBySeasonAsc(String playerId);

    List<BattingSeasonRecord> findByPlayerIdAndSeason(String playerId, Integer season);

    // Ligne carrière stockée
    List<BattingSeasonRecord> findByPlayerIdAndSeasonIsNull(String playerId);

    @Query("SELECT DISTINCT b.playerId FROM BattingSeasonRecord b WHERE b.teamId = :teamId AND b.season = :season")
    List<String> findPlayerIdsByTeamAndSeason(@Param("teamId") String teamId, @Param("season") Integer season);

    @Query("SELECT DISTINCT b.playerId FROM BattingSeasonRecord b WHERE b.teamId = :teamId AND b.season IS NOT NULL")
    List<String> findPlayerIdsByTeam(@Param("teamId") String teamId);

    boolean existsByPlayerIdAndSeasonIsNotNull(String playerId);
}

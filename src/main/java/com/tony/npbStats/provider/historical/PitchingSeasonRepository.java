package com.tony.npbStats.provider.historical;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PitchingSeasonRepository extends JpaRepository<PitchingSeasonRecord, Long> {

    List<PitchingSeasonRecord> findByPlayerIdAndSeasonIsNotNullOrderBySeasonAsc(String playerId);

    List<PitchingSeasonRecord> findByPlayerIdAndSeason(String playerId, Integer season);

    List<PitchingSeasonRecord> findByPlayerIdAndSeasonIsNull(String playerId);

    @Query("SELECT DISTINCT p.playerId FROM PitchingSeasonRecord p WHERE p.teamId = :teamId AND p.season = :season")
    List<String> findPlayerIdsByTeamAndSeason(@Param("teamId") String teamId, @Param("season") Integer season);

    @Query("SELECT DISTINCT p.playerId FROM PitchingSeasonRecord p WHERE p.teamId = :teamId AND p.season IS NOT NULL")
    List<String> findPlayerIdsByTeam(@Param("teamId") String teamId);

    boolean existsByPlayerIdAndSeasonIsNotNull(String playerId);
}

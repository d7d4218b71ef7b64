package com.tony.npbStats.provider.historical;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface HistoricalTeamRepository extends JpaRepository<HistoricalTeam, String> {

    List<HistoricalTeam> findAllByOrderByLeagueAscTeamIdAsc();
}

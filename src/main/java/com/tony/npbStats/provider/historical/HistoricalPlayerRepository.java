package com.tony.npbStats.provider.historical;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface HistoricalPlayerRepository extends JpaRepository<HistoricalPlayer, String> {

    // Sous-chaîne sur le nom principal, le nom japonais et les graphies alternatives
    @Query("SELECT DISTINCT p FROM HistoricalPlayer p LEFT JOIN p.nameVariants v " +
            "WHERE LOWER(p.nameEnglish) LIKE LOWER(CONCAT('%', :term, '%')) " +
            "OR LOWER(v) LIKE LOWER(CONCAT('%', :term, '%')) " +
            "OR p.nameJapanese LIKE CONCAT('%', :term, '%')")
    List<HistoricalPlayer> searchByName(@Param("term") String term);
}

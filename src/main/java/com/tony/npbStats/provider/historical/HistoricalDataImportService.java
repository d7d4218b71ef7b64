package com.tony.npbStats.provider.historical;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.npbStats.model.Innings;
import com.tony.npbStats.model.League;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Chargement de l'archive historique depuis les CSV embarqués (teams, players, batting, pitching).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoricalDataImportService {

    private final HistoricalPlayerRepository playerRepository;
    private final HistoricalTeamRepository teamRepository;
    private final BattingSeasonRepository battingRepository;
    private final PitchingSeasonRepository pitchingRepository;

    @Transactional
    public String importArchive(String location) {
        log.info("📥 Import de l'archive historique depuis classpath:{}", location);

        List<HistoricalTeam> teams = readCsv(location + "/teams.csv", TeamRow.class).stream()
                .map(this::toTeam).toList();
        teamRepository.saveAll(teams);

        List<HistoricalPlayer> players = readCsv(location + "/players.csv", PlayerRow.class).stream()
                .map(this::toPlayer).toList();
        playerRepository.saveAll(players);

        List<BattingSeasonRecord> batting = readCsv(location + "/batting.csv", BattingRow.class).stream()
                .map(this::toBatting).toList();
        battingRepository.saveAll(batting);

        List<PitchingSeasonRecord> pitching = readCsv(location + "/pitching.csv", PitchingRow.class).stream()
                .map(this::toPitching).toList();
        pitchingRepository.saveAll(pitching);

        String summary = String.format("Archive importée : %d équipes, %d joueurs, %d lignes batteur, %d lignes lanceur",
                teams.size(), players.size(), batting.size(), pitching.size());
        log.info("✅ {}", summary);
        return summary;
    }

    private <T> List<T> readCsv(String path, Class<T> type) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("⚠️ Fichier d'archive absent : {}", path);
            return List.of();
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return new CsvToBeanBuilder<T>(reader)
                    .withType(type).withSeparator(',').withIgnoreLeadingWhiteSpace(true).build().parse();
        } catch (IOException e) {
            throw new IllegalStateException("Lecture impossible de " + path, e);
        }
    }

    // --- Conversion CSV -> entités ---

    private HistoricalTeam toTeam(TeamRow row) {
        HistoricalTeam team = new HistoricalTeam();
        team.setTeamId(row.getTeamId());
        team.setNameEnglish(row.getNameEnglish());
        team.setNameJapanese(row.getNameJapanese());
        team.setLeague(League.valueOf(row.getLeague().trim().toUpperCase(Locale.ROOT)));
        team.setCity(row.getCity());
        team.setAbbreviation(row.getAbbreviation());
        team.setFirstSeason(row.getFirstSeason());
        team.setLastSeason(row.getLastSeason());
        return team;
    }

    private HistoricalPlayer toPlayer(PlayerRow row) {
        HistoricalPlayer player = new HistoricalPlayer(row.getPlayerId(), row.getNameEnglish());
        player.setNameJapanese(row.getNameJapanese());
        if (row.getNameVariants() != null && !row.getNameVariants().isBlank()) {
            player.getNameVariants().addAll(Arrays.stream(row.getNameVariants().split("\\|"))
                    .map(String::trim).filter(v -> !v.isEmpty()).toList());
        }
        player.setPosition(row.getPosition());
        player.setBats(row.getBats());
        player.setThrowsHand(row.getThrowsHand());
        player.setBirthPlace(row.getBirthPlace());
        player.setDebutYear(row.getDebutYear());
        player.setFinalYear(row.getFinalYear());
        return player;
    }

    private BattingSeasonRecord toBatting(BattingRow row) {
        BattingSeasonRecord r = new BattingSeasonRecord();
        r.setPlayerId(row.getPlayerId());
        r.setSeason(row.getSeason());
        r.setTeamId(row.getTeamId());
        r.setGames(orZero(row.getGames()));
        r.setAtBats(orZero(row.getAtBats()));
        r.setRuns(orZero(row.getRuns()));
        r.setHits(orZero(row.getHits()));
        r.setDoubles(orZero(row.getDoubles()));
        r.setTriples(orZero(row.getTriples()));
        r.setHomeRuns(orZero(row.getHomeRuns()));
        r.setRunsBattedIn(orZero(row.getRbi()));
        r.setStolenBases(orZero(row.getStolenBases()));
        r.setCaughtStealing(orZero(row.getCaughtStealing()));
        r.setWalks(orZero(row.getWalks()));
        r.setHitByPitch(orZero(row.getHitByPitch()));
        r.setSacrificeHits(orZero(row.getSacrificeHits()));
        r.setSacrificeFlies(orZero(row.getSacrificeFlies()));
        r.setStrikeouts(orZero(row.getStrikeouts()));
        // Les vieux relevés n'ont pas les passages au bâton : on les reconstitue
        r.setPlateAppearances(row.getPlateAppearances() != null ? row.getPlateAppearances()
                : r.getAtBats() + r.getWalks() + r.getHitByPitch() + r.getSacrificeHits() + r.getSacrificeFlies());
        r.setStoredAverage(row.getAverage());
        r.setWar(row.getWar());
        r.setOpsPlus(row.getOpsPlus());
        r.setWrcPlus(row.getWrcPlus());
        r.setWoba(row.getWoba());
        r.setDataSource("historical_import");
        return r;
    }

    private PitchingSeasonRecord toPitching(PitchingRow row) {
        PitchingSeasonRecord r = new PitchingSeasonRecord();
        r.setPlayerId(row.getPlayerId());
        r.setSeason(row.getSeason());
        r.setTeamId(row.getTeamId());
        r.setGames(orZero(row.getGames()));
        r.setGamesStarted(orZero(row.getGamesStarted()));
        r.setWins(orZero(row.getWins()));
        r.setLosses(orZero(row.getLosses()));
        r.setSaves(orZero(row.getSaves()));
        r.setHolds(orZero(row.getHolds()));
        r.setCompleteGames(orZero(row.getCompleteGames()));
        r.setShutouts(orZero(row.getShutouts()));
        r.setOutsRecorded(Innings.toOuts(row.getInningsPitched()));
        r.setHitsAllowed(orZero(row.getHitsAllowed()));
        r.setRunsAllowed(orZero(row.getRunsAllowed()));
        r.setEarnedRuns(orZero(row.getEarnedRuns()));
        r.setHomeRunsAllowed(orZero(row.getHomeRunsAllowed()));
        r.setWalks(orZero(row.getWalks()));
        r.setHitBatters(orZero(row.getHitBatters()));
        r.setStrikeouts(orZero(row.getStrikeouts()));
        r.setStoredEra(row.getEra());
        r.setFip(row.getFip());
        r.setXfip(row.getXfip());
        r.setEraPlus(row.getEraPlus());
        r.setWar(row.getWar());
        r.setDataSource("historical_import");
        return r;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    // --- Lignes CSV ---

    @Data
    public static class TeamRow {
        @CsvBindByName(column = "team_id", required = true) private String teamId;
        @CsvBindByName(column = "name_english") private String nameEnglish;
        @CsvBindByName(column = "name_japanese") private String nameJapanese;
        @CsvBindByName(column = "league") private String league;
        @CsvBindByName(column = "city") private String city;
        @CsvBindByName(column = "abbreviation") private String abbreviation;
        @CsvBindByName(column = "first_season") private Integer firstSeason;
        @CsvBindByName(column = "last_season") private Integer lastSeason;
    }

    @Data
    public static class PlayerRow {
        @CsvBindByName(column = "player_id", required = true) private String playerId;
        @CsvBindByName(column = "name_english") private String nameEnglish;
        @CsvBindByName(column = "name_japanese") private String nameJapanese;
        @CsvBindByName(column = "name_variants") private String nameVariants;
        @CsvBindByName(column = "position") private String position;
        @CsvBindByName(column = "bats") private String bats;
        @CsvBindByName(column = "throws") private String throwsHand;
        @CsvBindByName(column = "birth_place") private String birthPlace;
        @CsvBindByName(column = "debut_year") private Integer debutYear;
        @CsvBindByName(column = "final_year") private Integer finalYear;
    }

    @Data
    public static class BattingRow {
        @CsvBindByName(column = "player_id", required = true) private String playerId;
        @CsvBindByName(column = "season") private Integer season;
        @CsvBindByName(column = "team_id") private String teamId;
        @CsvBindByName(column = "g") private Integer games;
        @CsvBindByName(column = "pa") private Integer plateAppearances;
        @CsvBindByName(column = "ab") private Integer atBats;
        @CsvBindByName(column = "r") private Integer runs;
        @CsvBindByName(column = "h") private Integer hits;
        @CsvBindByName(column = "2b") private Integer doubles;
        @CsvBindByName(column = "3b") private Integer triples;
        @CsvBindByName(column = "hr") private Integer homeRuns;
        @CsvBindByName(column = "rbi") private Integer rbi;
        @CsvBindByName(column = "sb") private Integer stolenBases;
        @CsvBindByName(column = "cs") private Integer caughtStealing;
        @CsvBindByName(column = "bb") private Integer walks;
        @CsvBindByName(column = "hbp") private Integer hitByPitch;
        @CsvBindByName(column = "sh") private Integer sacrificeHits;
        @CsvBindByName(column = "sf") private Integer sacrificeFlies;
        @CsvBindByName(column = "so") private Integer strikeouts;
        @CsvBindByName(column = "avg") private Double average;
        @CsvBindByName(column = "war") private Double war;
        @CsvBindByName(column = "ops_plus") private Integer opsPlus;
        @CsvBindByName(column = "wrc_plus") private Integer wrcPlus;
        @CsvBindByName(column = "woba") private Double woba;
    }

    @Data
    public static class PitchingRow {
        @CsvBindByName(column = "player_id", required = true) private String playerId;
        @CsvBindByName(column = "season") private Integer season;
        @CsvBindByName(column = "team_id") private String teamId;
        @CsvBindByName(column = "g") private Integer games;
        @CsvBindByName(column = "gs") private Integer gamesStarted;
        @CsvBindByName(column = "w") private Integer wins;
        @CsvBindByName(column = "l") private Integer losses;
        @CsvBindByName(column = "sv") private Integer saves;
        @CsvBindByName(column = "hld") private Integer holds;
        @CsvBindByName(column = "cg") private Integer completeGames;
        @CsvBindByName(column = "sho") private Integer shutouts;
        // Notation NPB : "172.1"
        @CsvBindByName(column = "ip") private String inningsPitched;
        @CsvBindByName(column = "h") private Integer hitsAllowed;
        @CsvBindByName(column = "r") private Integer runsAllowed;
        @CsvBindByName(column = "er") private Integer earnedRuns;
        @CsvBindByName(column = "hr") private Integer homeRunsAllowed;
        @CsvBindByName(column = "bb") private Integer walks;
        @CsvBindByName(column = "hbp") private Integer hitBatters;
        @CsvBindByName(column = "so") private Integer strikeouts;
        @CsvBindByName(column = "era") private Double era;
        @CsvBindByName(column = "fip") private Double fip;
        @CsvBindByName(column = "xfip") private Double xfip;
        @CsvBindByName(column = "era_plus") private Integer eraPlus;
        @CsvBindByName(column = "war") private Double war;
    }
}

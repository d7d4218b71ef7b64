package com.tony.npbStats.provider.scraper;

import com.tony.npbStats.model.League;
import com.tony.npbStats.model.NpbClubs;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;

/**
 * Adresses des pages du site officiel et position des colonnes dans chacune d'elles.
 * <p>
 * Les indices comptent toutes les cellules td de la ligne, y compris les colonnes ignorées
 * (TB, IBB, WP, BK...). Pages d'équipe : une première colonne vide ou "*" (gaucher) précède le nom.
 */
public class LeagueSitePages {

    /**
     * Colonnes d'un tableau de batteurs. {@code team} vaut -1 quand l'équipe vient de l'URL.
     */
    public record BattingColumns(int name, int team, int games, int plateAppearances, int atBats, int runs,
                                 int hits, int doubles, int triples, int homeRuns, int rbi, int stolenBases,
                                 int caughtStealing, int sacrificeHits, int sacrificeFlies, int walks,
                                 int hitByPitch, int strikeouts) {
        public int minCells() {
            return strikeouts + 1;
        }
    }

    /**
     * Colonnes d'un tableau de lanceurs. Les manches sont réparties sur deux cellules : "172" et ".1".
     */
    public record PitchingColumns(int name, int team, int games, int wins, int losses, int saves, int holds,
                                  int completeGames, int shutouts, int innings, int inningsFraction,
                                  int hits, int homeRuns, int walks, int hitBatters, int strikeouts,
                                  int runs, int earnedRuns) {
        public int minCells() {
            return earnedRuns + 1;
        }
    }

    // Rang | Joueur | Équipe | AVG | G | PA | AB | R | H | 2B | 3B | HR | TB | RBI | SB | CS | SH | SF | BB | IBB | HBP | SO | GIDP | SLG | OBP
    public static final BattingColumns BATTING_LEADERS =
            new BattingColumns(1, 2, 4, 5, 6, 7, 8, 9, 10, 11, 13, 14, 15, 16, 17, 18, 20, 21);

    // * | Joueur | G | PA | AB | R | H | 2B | 3B | HR | TB | RBI | SB | CS | SH | SF | BB | IBB | HBP | SO | GIDP | AVG | SLG | OBP
    public static final BattingColumns BATTING_TEAM =
            new BattingColumns(1, -1, 2, 3, 4, 5, 6, 7, 8, 9, 11, 12, 13, 14, 15, 16, 18, 19);

    // Rang | Lanceur | Équipe | ERA | G | W | L | SV | HLD | HP | CG | SHO | NBB | PCT | BF | IP | (IP) | H | HR | BB | IBB | HBP | SO | WP | BK | R | ER
    public static final PitchingColumns PITCHING_LEADERS =
            new PitchingColumns(1, 2, 4, 5, 6, 7, 8, 10, 11, 15, 16, 17, 18, 19, 21, 22, 25, 26);

    // * | Lanceur | G | W | L | SV | HLD | HP | CG | SHO | NBB | PCT | BF | IP | (IP) | H | HR | BB | IBB | HBP | SO | WP | BK | R | ER | ERA
    public static final PitchingColumns PITCHING_TEAM =
            new PitchingColumns(1, -1, 2, 3, 4, 5, 6, 8, 9, 13, 14, 15, 16, 17, 19, 20, 23, 24);

    // Classement : Rang | Équipe | G | W | L | T | PCT | GB
    public static final int STANDINGS_MIN_CELLS = 7;

    private final String baseUrl;

    public LeagueSitePages(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String leaders(StatsType type, int season, League league) {
        String page = type == StatsType.BATTING ? "bat_" : "pit_";
        return baseUrl + "/" + season + "/stats/" + page + league.getPageSuffix() + ".html";
    }

    public String teamPage(StatsType type, int season, Team team) {
        String page = type == StatsType.BATTING ? "idb1_" : "idp1_";
        return baseUrl + "/" + season + "/stats/" + page + NpbClubs.pageCode(team) + ".html";
    }

    public String standings(int season, League league) {
        return baseUrl + "/" + season + "/standings/std_" + league.getPageSuffix() + ".html";
    }
}

package com.tony.npbStats.provider.reference;

import com.tony.npbStats.metrics.AdvancedMetrics;
import com.tony.npbStats.model.BattingStats;
import com.tony.npbStats.model.Innings;
import com.tony.npbStats.model.NpbClubs;
import com.tony.npbStats.model.PitchingStats;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;
import com.tony.npbStats.provider.TransportFailureException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lecture des pages de baseball-reference.com : résultats de recherche et tableaux des pages registre.
 * Les colonnes sont repérées par leur en-tête ("HR", "WAR", "wRC+"), pas par leur position.
 */
@Slf4j
public final class ReferenceSiteParser {

    private ReferenceSiteParser() {
    }

    private static final Pattern YEARS = Pattern.compile("\\((\\d{4})-(\\d{4})\\)");
    private static final Pattern YEAR = Pattern.compile("^(\\d{4})");
    // "Munetaka Murakami Minor, Fall, Winter & Japanese Leagues Statistics" -> "Munetaka Murakami"
    private static final Pattern PAGE_SUFFIX = Pattern.compile(
            "\\s+(Minor|Major|Japanese|Foreign|Register|Stats|Statistics|Leagues?)\\b.*$");
    // Central (JPCL), Pacific (JPPL), ou "NPB" sur les saisons anciennes
    private static final List<String> NPB_LEAGUES = List.of("JPC", "JPP", "NPB");

    public record SearchHit(String registerId, String name, String yearsActive) {
    }

    /**
     * @param canonicalUrl page réellement servie : la recherche redirige quand il n'y a qu'un résultat
     */
    public record SearchPage(String canonicalUrl, String playerName, List<SearchHit> hits) {
    }

    public record StatsTable(String id, List<String> headers, List<List<String>> rows) {

        /**
         * Index de la première colonne portant cet en-tête (casse ignorée), -1 si absente.
         */
        int column(String header) {
            for (int i = 0; i < headers.size(); i++) {
                if (headers.get(i).equalsIgnoreCase(header)) return i;
            }
            return -1;
        }

        boolean holds(StatsType type) {
            String kind = type == StatsType.BATTING ? "batting" : "pitching";
            String tableId = id.toLowerCase(Locale.ROOT);
            return tableId.equals("standard_" + kind) || tableId.contains(kind + "_foreign");
        }
    }

    public record RegisterPage(String playerName, List<StatsTable> tables) {
    }

    // --- Recherche ---

    public static SearchPage searchPage(Document doc) {
        Element canonical = doc.selectFirst("link[rel=canonical]");
        String url = canonical != null ? canonical.attr("href") : doc.location();

        Map<String, SearchHit> hits = new LinkedHashMap<>();
        for (Element link : doc.select("a[href]")) {
            Optional<String> id = ReferenceSitePages.registerId(link.attr("href"));
            String name = link.text().trim();
            if (id.isEmpty() || name.isEmpty()) continue;
            Element parent = link.parent();
            Matcher years = YEARS.matcher(parent != null ? parent.text() : name);
            hits.putIfAbsent(id.get(), new SearchHit(id.get(), name,
                    years.find() ? years.group(1) + "-" + years.group(2) : null));
        }
        return new SearchPage(url, playerName(doc), List.copyOf(hits.values()));
    }

    // --- Page registre ---

    public static RegisterPage registerPage(Document doc) {
        List<StatsTable> tables = new ArrayList<>();
        for (Element table : allTables(doc)) {
            StatsTable parsed = statsTable(table);
            if (parsed.holds(StatsType.BATTING) || parsed.holds(StatsType.PITCHING)) {
                tables.add(parsed);
            }
        }
        return new RegisterPage(playerName(doc), List.copyOf(tables));
    }

    /**
     * Saisons NPB du premier tableau du bon type qui en contient. Un transfert en cours d'année
     * donne plusieurs lignes pour la même saison : elles sont toutes rendues.
     *
     * @throws TransportFailureException si le tableau a des saisons NPB mais qu'aucune n'est lisible
     */
    public static List<SeasonStats> npbSeasons(RegisterPage page, StatsType type, String playerId, String source) {
        for (StatsTable table : page.tables()) {
            if (!table.holds(type)) continue;
            List<SeasonStats> rows = npbRows(table, type, playerId, source);
            if (!rows.isEmpty()) return rows;
        }
        return List.of();
    }

    private static List<SeasonStats> npbRows(StatsTable table, StatsType type, String playerId, String source) {
        List<SeasonStats> seasons = new ArrayList<>();
        int rejected = 0;
        for (List<String> row : table.rows()) {
            Matcher year = YEAR.matcher(row.isEmpty() ? "" : row.get(0).trim());
            if (!year.find()) continue;
            String league = value(table, row, "Lg");
            if (NPB_LEAGUES.stream().noneMatch(league::contains)) continue;
            int season = Integer.parseInt(year.group(1));
            try {
                seasons.add(type == StatsType.BATTING
                        ? batting(table, row, playerId, season, source)
                        : pitching(table, row, playerId, season, source));
            } catch (IllegalArgumentException e) {
                rejected++;
                log.debug("Ligne {} {} ignorée : {}", table.id(), season, e.getMessage());
            }
        }
        if (rejected > 0 && seasons.isEmpty()) {
            throw new TransportFailureException(source,
                    "Tableau " + table.id() + " illisible : aucune des " + rejected + " saisons NPB n'est reconnue");
        }
        if (rejected > 0) {
            log.warn("⚠️ Tableau {} : {} saison(s) illisible(s) ignorée(s)", table.id(), rejected);
        }
        return seasons;
    }

    private static BattingStats batting(StatsTable t, List<String> row, String playerId, int season, String source) {
        BattingStats stats = BattingStats.builder()
                .playerId(playerId)
                .season(season)
                .team(team(t, row))
                .source(source)
                .games(count(t, row, "G"))
                .plateAppearances(count(t, row, "PA"))
                .atBats(count(t, row, "AB"))
                .runs(count(t, row, "R"))
                .hits(count(t, row, "H"))
                .doubles(count(t, row, "2B"))
                .triples(count(t, row, "3B"))
                .homeRuns(count(t, row, "HR"))
                .runsBattedIn(count(t, row, "RBI"))
                .stolenBases(count(t, row, "SB"))
                .caughtStealing(count(t, row, "CS"))
                .walks(count(t, row, "BB"))
                .hitByPitch(count(t, row, "HBP"))
                .sacrificeHits(count(t, row, "SH"))
                .sacrificeFlies(count(t, row, "SF"))
                .strikeouts(count(t, row, "SO"))
                .opsPlus(integer(t, row, "OPS+"))
                .wrcPlus(integer(t, row, "wRC+"))
                .war(decimal(t, row, "WAR"))
                .build();
        return AdvancedMetrics.enrichBatting(stats);
    }

    private static PitchingStats pitching(StatsTable t, List<String> row, String playerId, int season, String source) {
        PitchingStats stats = PitchingStats.builder()
                .playerId(playerId)
                .season(season)
                .team(team(t, row))
                .source(source)
                .games(count(t, row, "G"))
                .wins(count(t, row, "W"))
                .losses(count(t, row, "L"))
                .saves(count(t, row, "SV"))
                .holds(count(t, row, "HLD"))
                .gamesStarted(count(t, row, "GS"))
                .completeGames(count(t, row, "CG"))
                .shutouts(count(t, row, "SHO"))
                .outsRecorded(Innings.toOuts(value(t, row, "IP")))
                .hitsAllowed(count(t, row, "H"))
                .runsAllowed(count(t, row, "R"))
                .earnedRuns(count(t, row, "ER"))
                .homeRunsAllowed(count(t, row, "HR"))
                .walks(count(t, row, "BB"))
                .hitBatters(count(t, row, "HBP"))
                .strikeouts(count(t, row, "SO"))
                .eraPlus(integer(t, row, "ERA+"))
                .fip(decimal(t, row, "FIP"))
                .war(decimal(t, row, "WAR"))
                .build();
        return AdvancedMetrics.enrichPitching(stats);
    }

    // --- Cellules ---

    private static String value(StatsTable table, List<String> row, String header) {
        int index = table.column(header);
        if (index < 0 || index >= row.size()) return "";
        return row.get(index).trim();
    }

    private static String team(StatsTable table, List<String> row) {
        String raw = value(table, row, "Tm");
        if (raw.isEmpty() || raw.equals("-")) return null;
        return NpbClubs.find(raw).map(Team::getId).orElse(raw);
    }

    /**
     * Colonne absente, vide ou "-" : 0.
     */
    private static int count(StatsTable table, List<String> row, String header) {
        String v = value(table, row, header).replace(",", "");
        if (v.isEmpty() || v.equals("-")) return 0;
        return Integer.parseInt(v);
    }

    private static Integer integer(StatsTable table, List<String> row, String header) {
        String v = value(table, row, header);
        if (v.isEmpty() || v.equals("-")) return null;
        return Integer.valueOf(v);
    }

    private static Double decimal(StatsTable table, List<String> row, String header) {
        String v = value(table, row, header);
        if (v.isEmpty() || v.equals("-")) return null;
        return Double.valueOf(v.startsWith(".") ? "0" + v : v);
    }

    // --- Structure HTML ---

    /**
     * Le site livre une partie de ses tableaux dans des commentaires HTML, affichés ensuite en JavaScript.
     */
    private static List<Element> allTables(Document doc) {
        List<Element> tables = new ArrayList<>(doc.select("table"));
        for (Element element : doc.getAllElements()) {
            for (Node node : element.childNodes()) {
                if (node instanceof Comment && ((Comment) node).getData().contains("<table")) {
                    tables.addAll(Jsoup.parseBodyFragment(((Comment) node).getData()).select("table"));
                }
            }
        }
        return tables;
    }

    private static StatsTable statsTable(Element table) {
        List<String> headers = new ArrayList<>();
        Element headerRow = table.select("thead tr").last();
        if (headerRow != null) {
            headerRow.children().forEach(cell -> headers.add(cell.text().trim()));
        }
        List<List<String>> rows = new ArrayList<>();
        for (Element tr : table.select("tbody tr")) {
            List<String> cells = tr.children().stream()
                    .filter(cell -> cell.normalName().equals("td") || cell.normalName().equals("th"))
                    .map(cell -> cell.text().trim())
                    .toList();
            if (!cells.isEmpty()) rows.add(cells);
        }
        return new StatsTable(table.id(), List.copyOf(headers), List.copyOf(rows));
    }

    private static String playerName(Document doc) {
        Element h1 = doc.selectFirst("h1");
        String raw = h1 != null ? h1.text() : doc.title();
        raw = raw.replaceAll("\\s*\\|.*$", "");
        String name = PAGE_SUFFIX.matcher(raw.trim()).replaceAll("").trim();
        return name.isEmpty() ? null : name;
    }
}

package com.tony.npbStats.provider.reference;

import com.tony.npbStats.model.League;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.SeasonStats;
import com.tony.npbStats.model.StandingsEntry;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;
import com.tony.npbStats.name.NameResolver;
import com.tony.npbStats.provider.PlayerDataProvider;
import com.tony.npbStats.provider.PlayerStatsReport;
import com.tony.npbStats.provider.ProviderResult;
import com.tony.npbStats.provider.TransportFailureException;
import com.tony.npbStats.provider.reference.ReferenceSiteParser.RegisterPage;
import com.tony.npbStats.provider.reference.ReferenceSiteParser.SearchPage;
import com.tony.npbStats.provider.scraper.HtmlSiteClient;
import com.tony.npbStats.provider.scraper.ScraperPlayerIds;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Source secondaire baseball-reference.com : carrières japonaises complètes (pages registre),
 * seule source à publier le WAR et le wRC+. Le site tolère mal les rafales : son client a
 * son propre limiteur, plus lent que celui du site officiel.
 * <p>
 * Pas d'équipes, d'effectifs ni de classements.
 */
@Slf4j
public class ReferenceSiteProvider implements PlayerDataProvider {

    public static final String NAME = "reference";
    static final String ID_PREFIX = "br_";

    private final HtmlSiteClient client;
    private final ReferenceSitePages pages;

    public ReferenceSiteProvider(HtmlSiteClient client, ReferenceSitePages pages) {
        this.client = client;
        this.pages = pages;
    }

    @Override
    public String name() {
        return NAME;
    }

    // --- Recherche ---

    @Override
    public List<Player> searchPlayer(String name) {
        if (name == null || name.isBlank()) return List.of();
        SearchPage page = client.fetch(pages.search(name), SearchPage.class, ReferenceSiteParser::searchPage);

        // Un seul résultat : le site redirige directement vers la page registre
        Optional<String> landed = ReferenceSitePages.registerId(page.canonicalUrl());
        if (landed.isPresent()) {
            return List.of(player(landed.get(), page.playerName() != null ? page.playerName() : name, null,
                    "Baseball-Reference register"));
        }

        // Joueur passé par la MLB : la fiche MLB renvoie vers sa page registre
        if (ReferenceSitePages.isMajorLeaguePage(page.canonicalUrl()) && page.playerName() != null) {
            String[] parts = page.playerName().split(" ");
            String lastName = parts[parts.length - 1].toLowerCase(Locale.ROOT);
            return page.hits().stream()
                    .filter(hit -> hit.registerId().toLowerCase(Locale.ROOT).contains(lastName)
                            || hit.name().toLowerCase(Locale.ROOT).contains(lastName))
                    .findFirst()
                    .map(hit -> List.of(player(hit.registerId(), page.playerName(), hit.yearsActive(),
                            "MLB & NPB player")))
                    .orElseGet(List::of);
        }

        List<Player> players = page.hits().stream()
                .map(hit -> player(hit.registerId(), hit.name(), hit.yearsActive(), "Baseball-Reference register"))
                .toList();
        log.info("📚 {} joueur(s) trouvé(s) pour '{}' sur baseball-reference", players.size(), name);
        return players;
    }

    private Player player(String registerId, String name, String yearsActive, String info) {
        String id = ID_PREFIX + registerId;
        return Player.builder()
                .id(id)
                .nameEnglish(name)
                .sourceId(NAME, id)
                .yearsActive(yearsActive)
                .disambiguationInfo(yearsActive != null ? info + " " + yearsActive : info)
                .source(NAME)
                .build();
    }

    // --- Statistiques ---

    @Override
    public ProviderResult<PlayerStatsReport> getPlayerStats(String playerId, Integer season, StatsType statsType) {
        Optional<String> registerId = registerIdFor(playerId);
        if (registerId.isEmpty()) {
            return ProviderResult.notFound("Pas de page registre baseball-reference pour " + playerId);
        }
        RegisterPage page = client.fetch(pages.register(registerId.get()), RegisterPage.class,
                ReferenceSiteParser::registerPage);
        List<SeasonStats> rows = ReferenceSiteParser.npbSeasons(page, statsType, playerId, NAME);

        if (season != null) {
            List<SeasonStats> inSeason = rows.stream().filter(r -> season.equals(r.getSeason())).toList();
            if (inSeason.isEmpty()) {
                return ProviderResult.notFound("Pas de saison NPB " + season + " pour " + playerId + " sur baseball-reference");
            }
            return ProviderResult.found(PlayerStatsReport.singleSeason(PlayerStatsReport.combineSeason(inSeason, season)));
        }
        if (rows.isEmpty()) {
            return ProviderResult.notFound("Aucune saison NPB pour " + playerId + " sur baseball-reference");
        }
        log.debug("📚 {} : {} ligne(s) NPB sur baseball-reference", playerId, rows.size());
        return ProviderResult.found(PlayerStatsReport.career(playerId, statsType, rows, null, NAME));
    }

    /**
     * Id "br_" : lecture directe. Id d'une autre source : recherche par nom, retenue seulement
     * si un seul joueur du site correspond.
     */
    private Optional<String> registerIdFor(String playerId) {
        if (playerId.startsWith(ID_PREFIX)) {
            return Optional.of(playerId.substring(ID_PREFIX.length()));
        }
        String name = ScraperPlayerIds.parse(playerId).name();
        if (name.isBlank()) return Optional.empty();
        List<Player> candidates = searchPlayer(name).stream()
                .filter(p -> NameResolver.match(name, p.getNameEnglish()))
                .toList();
        if (candidates.size() != 1) {
            log.debug("Pas de correspondance unique pour {} sur baseball-reference ({} candidat(s))",
                    playerId, candidates.size());
            return Optional.empty();
        }
        return Optional.of(candidates.get(0).getId().substring(ID_PREFIX.length()));
    }

    // --- Équipes, effectifs, classements ---

    @Override
    public List<Team> getTeams(Integer season) {
        return List.of();
    }

    @Override
    public List<Player> getTeamRoster(String teamId, Integer season) {
        return List.of();
    }

    @Override
    public ProviderResult<List<StandingsEntry>> getStandings(League league, Integer season) {
        return ProviderResult.unsupported("baseball-reference ne publie pas de classements NPB");
    }

    @Override
    public boolean healthCheck() {
        try {
            client.fetchUncached(pages.search("test"));
            return true;
        } catch (TransportFailureException e) {
            log.warn("⚠️ baseball-reference injoignable : {}", e.getMessage());
            return false;
        }
    }
}

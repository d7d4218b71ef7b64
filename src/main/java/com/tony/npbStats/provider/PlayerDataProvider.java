package com.tony.npbStats.provider;

import com.tony.npbStats.model.League;
import com.tony.npbStats.model.Player;
import com.tony.npbStats.model.StandingsEntry;
import com.tony.npbStats.model.StatsType;
import com.tony.npbStats.model.Team;

import java.util.List;

/**
 * Une source de données joueurs (archive locale, site officiel, composite...).
 * <p>
 * "Introuvable" et "non supporté" ne sont jamais des exceptions : ils passent par {@link ProviderResult}
 * ou par une liste vide. Seules les pannes de transport (timeout, réponse illisible) lèvent
 * une {@link TransportFailureException}.
 */
public interface PlayerDataProvider {

    /**
     * Nom de la source, utilisé comme étiquette d'origine et comme clé dans l'agrégateur.
     */
    String name();

    List<Player> searchPlayer(String name);

    /**
     * @param season null pour la carrière complète (toutes les saisons + agrégat recalculé)
     */
    ProviderResult<PlayerStatsReport> getPlayerStats(String playerId, Integer season, StatsType statsType);

    List<Team> getTeams(Integer season);

    List<Player> getTeamRoster(String teamId, Integer season);

    ProviderResult<List<StandingsEntry>> getStandings(League league, Integer season);

    /**
     * Ne lève jamais d'exception : une source en panne répond simplement false.
     */
    boolean healthCheck();
}

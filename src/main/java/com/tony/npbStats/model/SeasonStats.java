package com.tony.npbStats.model;

/**
 * Ligne de statistiques (une saison, ou la carrière si {@code season} est null).
 * Deux variantes : {@link BattingStats} et {@link PitchingStats}, discriminées par {@link #getStatsType()}.
 * <p>
 * Les taux sont toujours recalculés à partir des statistiques de comptage.
 * Les champs avancés (WAR, wOBA, FIP...) sont optionnels.
 */
public interface SeasonStats {

    String getPlayerId();

    Integer getSeason();

    String getTeam();

    String getSource();

    int getGames();

    StatsType getStatsType();

    default boolean isCareer() {
        return getSeason() == null;
    }

    boolean hasAllAdvancedFields();

    /**
     * Renvoie une nouvelle ligne où seuls les champs avancés absents sont complétés depuis {@code other}.
     * Aucun champ déjà renseigné n'est écrasé et aucun objet n'est modifié.
     */
    SeasonStats fillAdvancedFrom(SeasonStats other);

    SeasonStats withSource(String source);
}

package com.tony.npbStats.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fiche d'identité d'un joueur, reconstruite à chaque requête.
 * L'id n'est unique que dans l'espace de noms d'une source : les correspondances
 * entre sources sont conservées dans {@code sourceIds}.
 */
@Value
@Builder(toBuilder = true)
public class Player {
    String id;
    String nameEnglish;
    String nameJapanese;
    @Singular
    Map<String, String> sourceIds;
    Team team;
    String teamName;
    String jerseyNumber;
    String position;
    String yearsActive;
    String disambiguationInfo;
    String source;

    /**
     * Copie marquée avec la source d'origine (utilisé par le composite).
     */
    public Player taggedWith(String origin) {
        Map<String, String> ids = new LinkedHashMap<>(sourceIds);
        ids.putIfAbsent(origin, id);
        return toBuilder()
                .clearSourceIds()
                .sourceIds(ids)
                .source(origin)
                .build();
    }

    /**
     * Même joueur vu par une autre source : on garde cette fiche et on ajoute les ids manquants.
     */
    public Player withSourceIdsOf(Player other) {
        Map<String, String> ids = new LinkedHashMap<>(other.getSourceIds());
        ids.putAll(sourceIds);
        return toBuilder()
                .clearSourceIds()
                .sourceIds(ids)
                .build();
    }
}

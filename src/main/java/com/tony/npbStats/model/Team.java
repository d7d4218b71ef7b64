package com.tony.npbStats.model;

import lombok.Builder;
import lombok.Value;

/**
 * Club de référence (chargé une fois, lecture seule ensuite).
 */
@Value
@Builder
public class Team {
    String id;
    String nameEnglish;
    String nameJapanese;
    League league;
    String abbreviation;
    String city;
}

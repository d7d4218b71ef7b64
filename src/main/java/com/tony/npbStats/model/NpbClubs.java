package com.tony.npbStats.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Les 12 clubs actuels de la NPB. Le code correspond au suffixe des pages d'équipe
 * du site officiel (idb1_g.html, idp1_db.html...).
 */
public final class NpbClubs {

    private NpbClubs() {
    }

    public static final List<Team> ALL = List.of(
            // Central League
            club("G", "Yomiuri Giants", "読売ジャイアンツ", League.CENTRAL, "Tokyo"),
            club("T", "Hanshin Tigers", "阪神タイガース", League.CENTRAL, "Nishinomiya"),
            club("C", "Hiroshima Toyo Carp", "広島東洋カープ", League.CENTRAL, "Hiroshima"),
            club("D", "Chunichi Dragons", "中日ドラゴンズ", League.CENTRAL, "Nagoya"),
            club("DB", "Yokohama DeNA BayStars", "横浜DeNAベイスターズ", League.CENTRAL, "Yokohama"),
            club("S", "Tokyo Yakult Swallows", "東京ヤクルトスワローズ", League.CENTRAL, "Tokyo"),
            // Pacific League
            club("H", "Fukuoka SoftBank Hawks", "福岡ソフトバンクホークス", League.PACIFIC, "Fukuoka"),
            club("M", "Chiba Lotte Marines", "千葉ロッテマリーンズ", League.PACIFIC, "Chiba"),
            club("L", "Saitama Seibu Lions", "埼玉西武ライオンズ", League.PACIFIC, "Tokorozawa"),
            club("E", "Tohoku Rakuten Golden Eagles", "東北楽天ゴールデンイーグルス", League.PACIFIC, "Sendai"),
            club("F", "Hokkaido Nippon-Ham Fighters", "北海道日本ハムファイターズ", League.PACIFIC, "Kitahiroshima"),
            club("B", "Orix Buffaloes", "オリックス・バファローズ", League.PACIFIC, "Osaka")
    );

    private static Team club(String code, String english, String japanese, League league, String city) {
        return Team.builder()
                .id(code)
                .abbreviation(code)
                .nameEnglish(english)
                .nameJapanese(japanese)
                .league(league)
                .city(city)
                .build();
    }

    public static List<Team> ofLeague(League league) {
        return ALL.stream().filter(t -> t.getLeague() == league).toList();
    }

    /**
     * Recherche par code, nom complet ou surnom ("Giants", "yomiuri giants", "g").
     */
    public static Optional<Team> find(String reference) {
        if (reference == null || reference.isBlank()) return Optional.empty();
        String ref = reference.trim().toLowerCase(Locale.ROOT);
        return ALL.stream()
                .filter(t -> t.getId().equalsIgnoreCase(ref)
                        || t.getNameEnglish().toLowerCase(Locale.ROOT).equals(ref)
                        || t.getNameEnglish().toLowerCase(Locale.ROOT).endsWith(" " + ref))
                .findFirst();
    }

    public static String pageCode(Team team) {
        return team.getId().toLowerCase(Locale.ROOT);
    }
}

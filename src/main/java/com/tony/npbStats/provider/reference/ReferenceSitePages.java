package com.tony.npbStats.provider.reference;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plan d'URL de baseball-reference.com. Les carrières japonaises sont sur les pages "registre"
 * (ligues mineures et étrangères), jamais sur les pages MLB.
 */
public class ReferenceSitePages {

    private static final Pattern REGISTER_ID = Pattern.compile("/register/player\\.fcgi\\?id=([^&#\"]+)");
    private static final Pattern MAJOR_LEAGUE_PAGE = Pattern.compile("/players/[a-z]/[^/]+\\.shtml");

    private final String baseUrl;

    public ReferenceSitePages(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String search(String name) {
        return baseUrl + "/search/search.fcgi?search=" + URLEncoder.encode(name.trim(), StandardCharsets.UTF_8);
    }

    public String register(String registerId) {
        return baseUrl + "/register/player.fcgi?id=" + URLEncoder.encode(registerId, StandardCharsets.UTF_8);
    }

    /**
     * Id registre contenu dans un lien ou une URL ("murakam000mun").
     */
    public static Optional<String> registerId(String href) {
        if (href == null) return Optional.empty();
        Matcher m = REGISTER_ID.matcher(href);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * La recherche redirige vers la fiche MLB quand le joueur y a joué.
     */
    public static boolean isMajorLeaguePage(String url) {
        return url != null && MAJOR_LEAGUE_PAGE.matcher(url).find();
    }
}

package com.tony.npbStats.provider.scraper;

import com.tony.npbStats.name.NameResolver;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Le site n'expose pas d'identifiant stable : l'id est dérivé du nom normalisé et de la saison
 * ("npb_murakami_munetaka_2024"), de sorte que deux requêtes convergent vers le même id.
 */
public final class ScraperPlayerIds {

    private ScraperPlayerIds() {
    }

    private static final Pattern GENERATED = Pattern.compile("^npb_(.+)_(\\d{4})$");

    public record ParsedId(String name, Integer season) {
    }

    public static String of(String displayName, int season) {
        return "npb_" + NameResolver.slug(displayName) + "_" + season;
    }

    /**
     * Id généré ou, à défaut, slug de nom ("suzuki-ichiro" -> "suzuki ichiro").
     */
    public static ParsedId parse(String playerId) {
        Matcher m = GENERATED.matcher(playerId);
        if (m.matches()) {
            return new ParsedId(m.group(1).replace('_', ' '), Integer.parseInt(m.group(2)));
        }
        String asName = playerId.replace('-', ' ').replace('_', ' ');
        return new ParsedId(NameResolver.normalize(asName), null);
    }
}

package com.tony.npbStats.name;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rapprochement de noms romanisés : "Ohtani", "Otani" et "Ootani" désignent le même joueur,
 * tout comme "Suzuki Ichiro", "Ichiro Suzuki" et "Suzuki, Ichiro".
 * <p>
 * Fonctions pures et déterministes, sans état.
 */
public final class NameResolver {

    private NameResolver() {
    }

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Groupes de romanisation connus. La première valeur est la forme canonique.
     * L'ordre compte : les voyelles longues passent avant les syllabes.
     */
    static final Map<String, List<String>> ROMANIZATION_VARIANTS = new LinkedHashMap<>();
    static {
        // Voyelles longues
        ROMANIZATION_VARIANTS.put("ou", List.of("o", "oh", "oo"));
        ROMANIZATION_VARIANTS.put("oo", List.of("o", "oh", "ou"));
        ROMANIZATION_VARIANTS.put("oh", List.of("o", "oo", "ou"));
        ROMANIZATION_VARIANTS.put("uu", List.of("u", "uh"));
        ROMANIZATION_VARIANTS.put("ei", List.of("e"));
        ROMANIZATION_VARIANTS.put("ii", List.of("i"));
        // Hepburn -> Kunrei
        ROMANIZATION_VARIANTS.put("shi", List.of("si"));
        ROMANIZATION_VARIANTS.put("chi", List.of("ti"));
        ROMANIZATION_VARIANTS.put("tsu", List.of("tu"));
        ROMANIZATION_VARIANTS.put("fu", List.of("hu"));
        ROMANIZATION_VARIANTS.put("ji", List.of("zi", "di"));
        ROMANIZATION_VARIANTS.put("zu", List.of("du"));
        ROMANIZATION_VARIANTS.put("sha", List.of("sya"));
        ROMANIZATION_VARIANTS.put("shu", List.of("syu"));
        ROMANIZATION_VARIANTS.put("sho", List.of("syo"));
        ROMANIZATION_VARIANTS.put("cha", List.of("tya"));
        ROMANIZATION_VARIANTS.put("chu", List.of("tyu"));
        ROMANIZATION_VARIANTS.put("cho", List.of("tyo"));
        ROMANIZATION_VARIANTS.put("ja", List.of("zya", "dya"));
        ROMANIZATION_VARIANTS.put("ju", List.of("zyu", "dyu"));
        ROMANIZATION_VARIANTS.put("jo", List.of("zyo", "dyo"));
    }

    /**
     * Minuscules, sans ponctuation, espaces compactés, romanisation canonique.
     * Idempotente : la réécriture est répétée jusqu'à stabilité.
     */
    public static String normalize(String name) {
        if (name == null) return "";
        // Chaque règle fait baisser le nombre de f, j et c, sinon celui des z, sinon longueur + nombre de h : la boucle s'arrête
        String result = clean(name);
        String rewritten = romanize(result);
        while (!rewritten.equals(result)) {
            result = rewritten;
            rewritten = romanize(result);
        }
        return result;
    }

    /**
     * Forme normalisée, forme nettoyée, chaque substitution simple de la table
     * et l'ordre prénom/nom inversé.
     */
    public static Set<String> generateVariants(String name) {
        Set<String> variants = new LinkedHashSet<>();
        if (name == null || name.isBlank()) return variants;

        String cleaned = clean(name);
        variants.add(normalize(name));
        variants.add(cleaned);

        for (Map.Entry<String, List<String>> entry : ROMANIZATION_VARIANTS.entrySet()) {
            if (!cleaned.contains(entry.getKey())) continue;
            for (String replacement : entry.getValue()) {
                variants.add(cleaned.replace(entry.getKey(), replacement));
            }
        }

        String[] tokens = cleaned.split(" ");
        if (tokens.length == 2) {
            String swapped = tokens[1] + " " + tokens[0];
            variants.add(swapped);
            variants.add(normalize(swapped));
        }
        variants.remove("");
        return variants;
    }

    public static boolean match(String query, String candidate) {
        return match(query, candidate, false);
    }

    public static boolean match(String query, String candidate, boolean strict) {
        if (query == null || candidate == null) return false;
        String normalizedQuery = normalize(query);
        String normalizedCandidate = normalize(candidate);

        if (normalizedQuery.equals(normalizedCandidate)) return true;
        if (strict || normalizedQuery.isEmpty()) return false;

        // "Nom, Prénom" tel qu'affiché sur le site officiel
        if (candidate.contains(",")) {
            String[] parts = candidate.split(",", 2);
            String last = normalize(parts[0]);
            String first = normalize(parts[1]);
            if (normalizedQuery.equals(last) || normalizedQuery.equals(first)
                    || normalizedQuery.equals(normalize(first + " " + last))) {
                return true;
            }
        }

        if (generateVariants(query).stream().anyMatch(normalizedCandidate::equals)) return true;

        if (!normalizedQuery.contains(" ")) {
            return Arrays.asList(normalizedCandidate.split(" ")).contains(normalizedQuery);
        }
        return false;
    }

    /**
     * Identifiant lisible dérivé du nom : "Munetaka Murakami" -> "munetaka_murakami".
     */
    public static String slug(String name) {
        return normalize(name).replace(' ', '_');
    }

    private static String clean(String name) {
        String lower = name.toLowerCase(Locale.ROOT).strip();
        String noPunctuation = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(noPunctuation).replaceAll(" ").trim();
    }

    private static String romanize(String value) {
        String result = value;
        for (Map.Entry<String, List<String>> entry : ROMANIZATION_VARIANTS.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue().get(0));
        }
        return result;
    }
}

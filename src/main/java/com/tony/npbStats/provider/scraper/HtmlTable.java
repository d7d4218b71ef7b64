package com.tony.npbStats.provider.scraper;

import java.util.List;

/**
 * Lignes d'un tableau HTML, chaque ligne étant la liste ordonnée du texte de ses cellules.
 */
public record HtmlTable(List<List<String>> rows) {

    public static HtmlTable empty() {
        return new HtmlTable(List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}

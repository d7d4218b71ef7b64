package com.tony.npbStats.provider.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Pages du site officiel enregistrées dans src/test/resources/pages.
 */
final class HtmlPages {

    private HtmlPages() {
    }

    static Document document(String name) {
        try (InputStream in = HtmlPages.class.getResourceAsStream("/pages/" + name)) {
            if (in == null) throw new IllegalArgumentException("Page de test absente : " + name);
            return Jsoup.parse(in, "UTF-8", "https://npb.jp/bis/eng/");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static HtmlTable table(String name) {
        return HtmlSiteClient.mainTable(document(name));
    }
}

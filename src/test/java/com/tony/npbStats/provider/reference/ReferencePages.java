package com.tony.npbStats.provider.reference;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Pages baseball-reference enregistrées dans src/test/resources/pages/reference.
 */
final class ReferencePages {

    static final String BASE_URL = "https://www.baseball-reference.com";

    private ReferencePages() {
    }

    static Document document(String name) {
        try (InputStream in = ReferencePages.class.getResourceAsStream("/pages/reference/" + name)) {
            if (in == null) throw new IllegalArgumentException("Page de test absente : " + name);
            return Jsoup.parse(in, "UTF-8", BASE_URL + "/");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Page registre minimale : un tableau standard_batting avec les lignes données (Year, Tm, Lg, G, AB, H, HR).
     */
    static Document battingRegister(String... rows) {
        StringBuilder html = new StringBuilder("<html><head><title>Test | Baseball-Reference.com</title></head><body>")
                .append("<table id=\"standard_batting\"><thead><tr>")
                .append("<th>Year</th><th>Tm</th><th>Lg</th><th>G</th><th>AB</th><th>H</th><th>HR</th><th>WAR</th>")
                .append("</tr></thead><tbody>");
        for (String row : rows) {
            String[] cells = row.split(",");
            html.append("<tr><th>").append(cells[0]).append("</th>");
            for (int i = 1; i < cells.length; i++) {
                html.append("<td>").append(cells[i]).append("</td>");
            }
            html.append("</tr>");
        }
        html.append("</tbody></table></body></html>");
        return Jsoup.parse(html.toString(), BASE_URL + "/");
    }
}

package com.tony.npbStats.provider.scraper;

import com.tony.npbStats.cache.ResponseCache;
import com.tony.npbStats.provider.TransportFailureException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Accès HTTP à un site de statistiques : limitation de débit, rotation du User-Agent, timeout, cache.
 * Chaque site a son propre client, donc son propre limiteur.
 */
@Slf4j
public class HtmlSiteClient {

    private final String providerName;
    private final Duration timeout;
    private final List<String> userAgents;
    private final AtomicInteger nextAgent = new AtomicInteger();
    private final RequestThrottle throttle;
    private final ResponseCache cache;

    public HtmlSiteClient(String providerName, Duration timeout, List<String> userAgents,
                          RequestThrottle throttle, ResponseCache cache) {
        this.providerName = providerName;
        this.timeout = timeout;
        this.userAgents = List.copyOf(userAgents);
        this.throttle = throttle;
        this.cache = cache;
    }

    /**
     * Tableau principal de la page, mis en cache. Une page inexistante (404) donne un tableau vide.
     *
     * @throws TransportFailureException timeout, erreur réseau ou HTTP
     */
    public HtmlTable fetchTable(String url) {
        return fetch(url, HtmlTable.class, HtmlSiteClient::mainTable);
    }

    /**
     * Page extraite puis mise en cache : seul le résultat de l'extraction est conservé.
     * Une page inexistante (404) est extraite comme un document vide.
     *
     * @throws TransportFailureException timeout, erreur réseau ou HTTP
     */
    public <T> T fetch(String url, Class<T> type, Function<Document, T> extractor) {
        return cache.getOrCompute(ResponseCache.key("fetch", type.getName(), url), type,
                () -> extractor.apply(download(url)));
    }

    /**
     * Même chose sans passer par le cache (utilisé par le health check).
     */
    public HtmlTable fetchUncached(String url) {
        return mainTable(download(url));
    }

    protected Document fetchDocument(String url, String userAgent) throws IOException {
        return Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout((int) timeout.toMillis())
                .get();
    }

    private Document download(String url) {
        try {
            throttle.respectRateLimit();
            log.debug("🌐 GET {}", url);
            Document doc = fetchDocument(url, nextUserAgent());
            log.debug("📄 {} chargée", url);
            return doc;
        } catch (HttpStatusException e) {
            if (e.getStatusCode() == 404) {
                log.debug("Page absente : {}", url);
                return Document.createShell(url);
            }
            throw new TransportFailureException(providerName, "HTTP " + e.getStatusCode() + " sur " + url, e);
        } catch (IOException e) {
            throw new TransportFailureException(providerName, "Échec du chargement de " + url + " : " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailureException(providerName, "Requête annulée : " + url, e);
        }
    }

    String nextUserAgent() {
        return userAgents.get(Math.floorMod(nextAgent.getAndIncrement(), userAgents.size()));
    }

    /**
     * Le tableau de statistiques est celui qui a le plus de lignes de données (cellules td).
     */
    static HtmlTable mainTable(Document doc) {
        return doc.select("table").stream()
                .map(HtmlSiteClient::dataRows)
                .max(Comparator.comparingInt(List::size))
                .map(HtmlTable::new)
                .orElse(HtmlTable.empty());
    }

    private static List<List<String>> dataRows(Element table) {
        List<List<String>> rows = new ArrayList<>();
        for (Element tr : table.select("tr")) {
            List<Element> cells = tr.children().stream()
                    .filter(cell -> cell.normalName().equals("td"))
                    .toList();
            if (cells.isEmpty()) continue;
            rows.add(cells.stream().map(td -> td.text().trim()).toList());
        }
        return List.copyOf(rows);
    }
}

package com.tony.npbStats.config;

import com.tony.npbStats.aggregator.PlayerDataAggregator;
import com.tony.npbStats.aggregator.PlayerDataAggregator.Operation;
import com.tony.npbStats.cache.ResponseCache;
import com.tony.npbStats.disambiguation.PlayerDisambiguator;
import com.tony.npbStats.provider.FanOut;
import com.tony.npbStats.provider.PlayerDataProvider;
import com.tony.npbStats.provider.composite.CompositeProvider;
import com.tony.npbStats.provider.historical.HistoricalProvider;
import com.tony.npbStats.provider.reference.ReferenceSitePages;
import com.tony.npbStats.provider.reference.ReferenceSiteProvider;
import com.tony.npbStats.provider.scraper.HtmlSiteClient;
import com.tony.npbStats.provider.scraper.LeagueSitePages;
import com.tony.npbStats.provider.scraper.RequestThrottle;
import com.tony.npbStats.provider.scraper.ScraperProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Câblage des sources : une seule instance d'agrégateur, construite ici et injectée aux appelants.
 */
@Configuration
@RequiredArgsConstructor
public class ProviderConfig {

    // Les saisons NPB se découpent à l'heure de Tokyo
    private static final ZoneId NPB_ZONE = ZoneId.of("Asia/Tokyo");

    private final NpbProperties properties;

    @Bean
    public ResponseCache responseCache() {
        NpbProperties.Cache cache = properties.getCache();
        return new ResponseCache(cache.isEnabled(), cache.getTtl(), cache.getMaximumSize());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutor() {
        return Executors.newFixedThreadPool(properties.getFanOut().getThreads(),
                new CustomizableThreadFactory("npb-fanout-"));
    }

    @Bean
    public FanOut fanOut(ExecutorService fanOutExecutor) {
        return new FanOut(fanOutExecutor, properties.getFanOut().getTimeout());
    }

    @Bean
    public Clock npbClock() {
        return Clock.system(NPB_ZONE);
    }

    @Bean
    public LeagueSitePages leagueSitePages() {
        return new LeagueSitePages(properties.getScraper().getBaseUrl());
    }

    // Un client par site : chacun a son propre limiteur de débit
    @Bean
    public ScraperProvider scraperProvider(ResponseCache responseCache, LeagueSitePages leagueSitePages, Clock npbClock) {
        NpbProperties.Scraper scraper = properties.getScraper();
        HtmlSiteClient client = new HtmlSiteClient(ScraperProvider.NAME, scraper.getTimeout(), scraper.getUserAgents(),
                new RequestThrottle(scraper.getRequestDelay()), responseCache);
        return new ScraperProvider(client, leagueSitePages, properties.getCutoffYear(),
                scraper.getCareerSeasons(), npbClock);
    }

    @Bean
    public ReferenceSiteProvider referenceSiteProvider(ResponseCache responseCache) {
        NpbProperties.Reference reference = properties.getReference();
        HtmlSiteClient client = new HtmlSiteClient(ReferenceSiteProvider.NAME, reference.getTimeout(),
                properties.getScraper().getUserAgents(), new RequestThrottle(reference.getRequestDelay()), responseCache);
        return new ReferenceSiteProvider(client, new ReferenceSitePages(reference.getBaseUrl()));
    }

    @Bean
    public CompositeProvider compositeProvider(HistoricalProvider historicalProvider, ScraperProvider scraperProvider) {
        return new CompositeProvider(historicalProvider, scraperProvider, properties.getCutoffYear());
    }

    @Bean
    public PlayerDataAggregator playerDataAggregator(List<PlayerDataProvider> providers, FanOut fanOut) {
        return new PlayerDataAggregator(providers, priorities(properties.getPriorities()), fanOut);
    }

    @Bean
    public PlayerDisambiguator playerDisambiguator(PlayerDataAggregator playerDataAggregator, FanOut fanOut) {
        return new PlayerDisambiguator(playerDataAggregator, fanOut);
    }

    static Map<Operation, List<String>> priorities(NpbProperties.Priorities configured) {
        Map<Operation, List<String>> priorities = new EnumMap<>(Operation.class);
        priorities.put(Operation.SEARCH, configured.getSearch());
        priorities.put(Operation.STATS, configured.getStats());
        priorities.put(Operation.TEAMS, configured.getTeams());
        priorities.put(Operation.ROSTER, configured.getRoster());
        priorities.put(Operation.STANDINGS, configured.getStandings());
        return priorities;
    }
}

package com.tony.npbStats.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "npb")
@Validated
@Data
public class NpbProperties {

    // --- Routage archive / site officiel ---
    // Première saison servie par le site officiel
    @Min(1936)
    private int cutoffYear = 2005;

    // --- Ordre de priorité des sources, par opération ---
    @Valid
    private Priorities priorities = new Priorities();

    @Valid
    private Scraper scraper = new Scraper();

    @Valid
    private Reference reference = new Reference();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private FanOut fanOut = new FanOut();

    @Valid
    private Archive archive = new Archive();

    @Data
    public static class Priorities {
        @NotEmpty private List<String> search = new ArrayList<>(List.of("composite", "reference"));
        @NotEmpty private List<String> stats = new ArrayList<>(List.of("composite", "reference"));
        @NotEmpty private List<String> teams = new ArrayList<>(List.of("composite"));
        @NotEmpty private List<String> roster = new ArrayList<>(List.of("composite"));
        @NotEmpty private List<String> standings = new ArrayList<>(List.of("composite"));
    }

    @Data
    public static class Scraper {
        @NotNull private String baseUrl = "https://npb.jp/bis/eng";
        // Délai minimum entre deux requêtes vers le site (évite le blocage)
        @NotNull private Duration requestDelay = Duration.ofMillis(500);
        @NotNull private Duration timeout = Duration.ofSeconds(30);
        @NotEmpty private List<String> userAgents = new ArrayList<>(List.of(
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Safari/605.1.15",
                "Mozilla/5.0 (X11; Linux x86_64; rv:121.0) Gecko/20100101 Firefox/121.0"
        ));
        // Nombre de saisons remontées pour une carrière (jamais avant la date charnière)
        @Min(1) private int careerSeasons = 5;
    }

    // baseball-reference.com : mêmes User-Agents que le site officiel
    @Data
    public static class Reference {
        @NotNull private String baseUrl = "https://www.baseball-reference.com";
        // Le site bloque les clients trop rapides
        @NotNull private Duration requestDelay = Duration.ofSeconds(3);
        @NotNull private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        @NotNull private Duration ttl = Duration.ofHours(6);
        @Min(1) private long maximumSize = 500;
    }

    @Data
    public static class FanOut {
        @Min(1) private int threads = 8;
        // Délai global d'un appel multi-sources : les branches encore en cours sont annulées
        @NotNull private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Archive {
        private boolean seedOnStartup = true;
        @NotNull private String location = "archive";
    }
}

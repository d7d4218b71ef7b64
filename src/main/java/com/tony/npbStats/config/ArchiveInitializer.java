package com.tony.npbStats.config;

import com.tony.npbStats.provider.historical.HistoricalDataImportService;
import com.tony.npbStats.provider.historical.HistoricalPlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ArchiveInitializer implements CommandLineRunner {

    private final NpbProperties properties;
    private final HistoricalPlayerRepository playerRepository;
    private final HistoricalDataImportService importService;

    @Override
    public void run(String... args) {
        if (!properties.getArchive().isSeedOnStartup()) {
            log.info("⏭️ Chargement de l'archive désactivé");
            return;
        }
        // On ne remplit que si la base est vide
        if (playerRepository.count() == 0) {
            log.info("🌱 Archive vide, chargement initial...");
            importService.importArchive(properties.getArchive().getLocation());
        } else {
            log.info("✅ Archive déjà chargée ({} joueurs)", playerRepository.count());
        }
    }
}

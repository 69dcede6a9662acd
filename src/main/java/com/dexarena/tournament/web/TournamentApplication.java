package com.dexarena.tournament.web;

import com.dexarena.tournament.format.TournamentFormat;
import com.dexarena.tournament.format.TournamentFormatLoader;
import com.dexarena.tournament.json.ObjectMapperFactory;
import com.dexarena.tournament.manager.FileTournamentRepository;
import com.dexarena.tournament.manager.InMemoryTournamentRepository;
import com.dexarena.tournament.manager.TournamentManager;
import com.dexarena.tournament.manager.TournamentRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Main application class for the tournament service.
 * Exposes the tournament manager over REST and pushes progress over STOMP.
 */
@SpringBootApplication(scanBasePackages = "com.dexarena.tournament")
public class TournamentApplication {

    private static final Logger log = LoggerFactory.getLogger(TournamentApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TournamentApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public TournamentRepository tournamentRepository(
            @Value("${tournament.storage:file}") String storage,
            @Value("${tournament.data-dir:./data}") String dataDir) {
        return switch (storage) {
            case "memory" -> new InMemoryTournamentRepository();
            case "file" -> {
                log.info("Storing tournaments under {}", Path.of(dataDir).toAbsolutePath());
                yield new FileTournamentRepository(Path.of(dataDir));
            }
            default -> throw new IllegalArgumentException("Unknown tournament.storage: " + storage);
        };
    }

    @Bean
    public TournamentManager tournamentManager(TournamentRepository repository) {
        return new TournamentManager(repository);
    }

    /**
     * Playoff format reported by the API. An explicit format file wins over the bundled formats.yaml.
     */
    @Bean
    public TournamentFormat tournamentFormat(
            @Value("${tournament.format-file:}") String formatFile,
            @Value("${tournament.format-key:favorite-monster}") String formatKey) {
        TournamentFormatLoader loader = new TournamentFormatLoader();
        return formatFile.isBlank()
            ? loader.loadResource("formats.yaml", formatKey)
            : loader.load(Path.of(formatFile), formatKey);
    }
}

package com.dexarena.tournament.format;

import com.dexarena.tournament.json.ObjectMapperFactory;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Loads named tournament setups from a YAML file. Each top-level key is one setup:
 *
 * <pre>
 * favorite-monster:
 *   format: swiss-tournament
 *   playoff: double-elimination
 *   playoff-cutoff: 16
 *   playoff-reset: true
 * </pre>
 *
 * {@code format} defaults to {@code swiss-tournament}; {@code playoff} is optional and,
 * when present, requires a power-of-two {@code playoff-cutoff}. {@code playoff-reset}
 * defaults to true.
 */
public class TournamentFormatLoader {

    private final ObjectMapper yaml;

    public TournamentFormatLoader() {
        this.yaml = ObjectMapperFactory.createYaml();
    }

    public TournamentFormat load(Path path, String key) {
        if (!Files.isRegularFile(path)) {
            throw new InvalidTournamentInputException("Tournament config file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, key, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tournament config " + path, e);
        }
    }

    /**
     * Loads a setup from a classpath resource such as {@code formats.yaml}.
     */
    public TournamentFormat loadResource(String resource, String key) {
        try (InputStream in = TournamentFormatLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new InvalidTournamentInputException("Tournament config resource not found: " + resource);
            }
            return load(in, key, resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tournament config " + resource, e);
        }
    }

    private TournamentFormat load(InputStream in, String key, String source) throws IOException {
        JsonNode root = yaml.readTree(in);
        if (root == null || !root.isObject() || !root.path(key).isObject()) {
            throw new InvalidTournamentInputException("Tournament config '" + key + "' not found in " + source);
        }
        JsonNode cfg = root.get(key);
        String format = cfg.path("format").asText(TournamentFormat.SWISS);
        Optional<PlayoffType> playoff = cfg.hasNonNull("playoff")
            ? Optional.of(PlayoffType.fromConfigName(cfg.get("playoff").asText()))
            : Optional.empty();
        OptionalInt cutoff = cfg.hasNonNull("playoff-cutoff")
            ? OptionalInt.of(readCutoff(cfg.get("playoff-cutoff")))
            : OptionalInt.empty();
        boolean reset = cfg.hasNonNull("playoff-reset") ? readReset(cfg.get("playoff-reset")) : true;
        return new TournamentFormat(format, playoff, cutoff, reset);
    }

    private static boolean readReset(JsonNode node) {
        if (!node.isBoolean()) {
            throw new InvalidTournamentInputException("playoff-reset must be true or false, got " + node.asText());
        }
        return node.booleanValue();
    }

    private static int readCutoff(JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InvalidTournamentInputException("playoff-cutoff must be an integer, got " + node.asText());
        }
        return node.asInt();
    }
}

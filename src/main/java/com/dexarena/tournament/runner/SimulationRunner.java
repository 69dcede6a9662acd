package com.dexarena.tournament.runner;

import com.dexarena.tournament.format.PlayoffType;
import com.dexarena.tournament.format.TournamentFormat;
import com.dexarena.tournament.format.TournamentFormatLoader;
import com.dexarena.tournament.json.ObjectMapperFactory;
import com.dexarena.tournament.manager.FileTournamentRepository;
import com.dexarena.tournament.manager.TournamentManager;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.Standing;
import com.dexarena.tournament.strategy.DeciderDiscoveryService;
import com.dexarena.tournament.strategy.DiscoveredDecider;
import com.dexarena.tournament.strategy.MatchDecider;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Main entry point for the tournament simulation CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -cp dex-tournament.jar com.dexarena.tournament.runner.SimulationRunner \
 *   --participants-file ./monsters.txt \
 *   --decider higher-stat --stats ./base-hp.json \
 *   --format-file ./formats.yaml --format-key favorite-monster \
 *   --output ./data
 * </pre>
 */
public class SimulationRunner {

    public static void main(String[] args) {
        if (args.length >= 1 && "--list-deciders".equals(args[0])) {
            listDeciders();
            System.exit(0);
        }

        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }

        try {
            SimulationOptions options = parseArgs(args);
            SimulationResult result = run(options);
            printResult(result);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid arguments: " + e.getMessage());
            printUsage();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Simulation failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static SimulationResult run(SimulationOptions options) throws IOException, ReflectiveOperationException {
        DeciderDiscoveryService discoveryService = new DeciderDiscoveryService();
        discoveryService.initialize();
        MatchDecider decider = discoveryService.createDecider(options.decider(), loadStats(options.statsFile()));

        List<CompetitorId> participants = new ArrayList<>(options.participants());
        if (options.participantsFile() != null) {
            for (String line : Files.readAllLines(options.participantsFile())) {
                if (!line.isBlank() && !line.trim().startsWith("#")) {
                    participants.add(CompetitorId.of(line));
                }
            }
        }

        TournamentManager manager = new TournamentManager(new FileTournamentRepository(options.outputDir()));
        TournamentSimulator simulator = new TournamentSimulator(manager, decider, System.out::println);
        return simulator.run(participants, options.owner(), options.format());
    }

    private static ToIntFunction<CompetitorId> loadStats(Path statsFile) throws IOException {
        if (statsFile == null) {
            return id -> 0;
        }
        Map<String, Integer> raw = ObjectMapperFactory.create()
            .readValue(statsFile.toFile(), new TypeReference<Map<String, Integer>>() {});
        Map<CompetitorId, Integer> stats = new HashMap<>();
        raw.forEach((name, value) -> stats.put(CompetitorId.of(name), value));
        return id -> stats.getOrDefault(id, 0);
    }

    private static void listDeciders() {
        DeciderDiscoveryService discoveryService = new DeciderDiscoveryService();
        discoveryService.initialize();

        List<DiscoveredDecider> deciders = discoveryService.getDiscoveredDeciders();
        if (deciders.isEmpty()) {
            System.out.println("No deciders discovered on classpath.");
            return;
        }

        System.out.println("Discovered deciders:");
        System.out.println();
        for (DiscoveredDecider d : deciders) {
            System.out.printf("  %-20s %s - %s%n", d.key(), d.className(), d.description());
        }
    }

    private static void printResult(SimulationResult result) {
        System.out.println();
        System.out.printf("Final standings of %s after %d rounds:%n", result.tournamentId(), result.rounds());
        int rank = 1;
        for (Standing s : result.standings()) {
            System.out.printf("  %3d. %-30s %3d pts (%d-%d-%d)%n",
                rank++, s.participant(), s.score(), s.wins(), s.losses(), s.draws());
        }
        result.champion().ifPresent(champion -> System.out.printf("%nPlayoff champion (%s): %s%n",
            result.playoff().map(PlayoffType::configName).orElse("playoff"), champion));
    }

    /**
     * Parses CLI arguments into SimulationOptions.
     *
     * @throws IllegalArgumentException if required arguments are missing or malformed
     */
    static SimulationOptions parseArgs(String[] args) {
        List<CompetitorId> participants = new ArrayList<>();
        Path participantsFile = null;
        String owner = "simulator";
        String decider = "lower-lexical";
        Path statsFile = null;
        Path formatFile = null;
        String formatKey = null;
        String playoff = null;
        Integer cutoff = null;
        Path outputDir = Path.of("./data");

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--participants" -> {
                    for (String name : value(args, ++i).split(",")) {
                        if (!name.isBlank()) {
                            participants.add(CompetitorId.of(name));
                        }
                    }
                }
                case "--participants-file" -> participantsFile = Path.of(value(args, ++i));
                case "--owner" -> owner = value(args, ++i);
                case "--decider" -> decider = value(args, ++i);
                case "--stats" -> statsFile = Path.of(value(args, ++i));
                case "--format-file" -> formatFile = Path.of(value(args, ++i));
                case "--format-key" -> formatKey = value(args, ++i);
                case "--playoff" -> playoff = value(args, ++i);
                case "--cutoff" -> cutoff = Integer.parseInt(value(args, ++i));
                case "--output" -> outputDir = Path.of(value(args, ++i));
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (participants.isEmpty() && participantsFile == null) {
            throw new IllegalArgumentException("Missing required argument: --participants or --participants-file");
        }
        if ((formatFile == null) != (formatKey == null)) {
            throw new IllegalArgumentException("--format-file and --format-key must be given together");
        }
        if (formatFile != null && playoff != null) {
            throw new IllegalArgumentException("Use either --format-file or --playoff, not both");
        }

        TournamentFormat format;
        if (formatFile != null) {
            format = new TournamentFormatLoader().load(formatFile, formatKey);
        } else if (playoff != null) {
            PlayoffType type = PlayoffType.fromConfigName(playoff);
            int size = cutoff != null ? cutoff : 16;
            format = TournamentFormat.withPlayoff(type, size);
        } else {
            format = TournamentFormat.swissOnly();
        }

        return new SimulationOptions(participants, participantsFile, owner, decider, statsFile, format, outputDir);
    }

    private static String value(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }

    /**
     * Parsed command-line options.
     */
    record SimulationOptions(
        List<CompetitorId> participants,
        Path participantsFile,
        String owner,
        String decider,
        Path statsFile,
        TournamentFormat format,
        Path outputDir
    ) {}

    private static void printUsage() {
        System.err.println("Usage: java -cp dex-tournament.jar com.dexarena.tournament.runner.SimulationRunner [options]");
        System.err.println("       java -cp dex-tournament.jar com.dexarena.tournament.runner.SimulationRunner --list-deciders");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --participants <a,b,...>    Comma-separated competitor ids");
        System.err.println("  --participants-file <file>  One competitor id per line (# starts a comment)");
        System.err.println("  --owner <name>              Tournament owner (default: simulator)");
        System.err.println("  --decider <key>             Match decider (default: lower-lexical)");
        System.err.println("  --stats <file>              JSON map of competitor id to stat, for higher-stat");
        System.err.println("  --format-file <file>        YAML file with tournament formats");
        System.err.println("  --format-key <key>          Format to use from --format-file");
        System.err.println("  --playoff <type>            single-elimination or double-elimination");
        System.err.println("  --cutoff <n>                Playoff size, a power of two (default: 16)");
        System.err.println("  --output <dir>              Data directory (default: ./data)");
        System.err.println("  --list-deciders             List available deciders and exit");
    }
}

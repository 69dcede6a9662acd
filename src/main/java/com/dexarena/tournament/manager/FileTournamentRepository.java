package com.dexarena.tournament.manager;

import com.dexarena.tournament.bracket.DoubleEliminationBracket;
import com.dexarena.tournament.json.ObjectMapperFactory;
import com.dexarena.tournament.model.MatchRecord;
import com.dexarena.tournament.model.Tournament;
import com.dexarena.tournament.model.TournamentId;
import com.dexarena.tournament.model.TournamentStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each tournament in its own directory under the data dir:
 * {@code tournament.json}, {@code matches.json} and {@code bracket.json}.
 * Files are written atomically to prevent partial writes.
 */
public class FileTournamentRepository implements TournamentRepository {

    private static final Logger log = LoggerFactory.getLogger(FileTournamentRepository.class);

    static final String TOURNAMENT_FILE = "tournament.json";
    static final String MATCHES_FILE = "matches.json";
    static final String BRACKET_FILE = "bracket.json";

    private static final TypeReference<List<MatchRecord>> MATCH_LIST = new TypeReference<>() {};

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public FileTournamentRepository(Path dataDir) {
        this(dataDir, ObjectMapperFactory.createPretty());
    }

    public FileTournamentRepository(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(Tournament tournament) {
        write(tournamentDir(tournament.id()).resolve(TOURNAMENT_FILE), tournament);
    }

    @Override
    public Optional<Tournament> findById(TournamentId id) {
        Path file = tournamentDir(id).resolve(TOURNAMENT_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file, Tournament.class));
    }

    @Override
    public List<Tournament> findByOwner(String owner) {
        return findAll().stream().filter(t -> t.owner().equals(owner)).toList();
    }

    @Override
    public List<Tournament> findAll() {
        List<Tournament> result = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir)) {
            for (Path entry : stream) {
                Path file = entry.resolve(TOURNAMENT_FILE);
                if (Files.isDirectory(entry) && Files.exists(file)) {
                    result.add(read(file, Tournament.class));
                }
            }
        } catch (IOException e) {
            throw new TournamentStorageException("Failed to list tournaments in " + dataDir, e);
        }
        result.sort(Comparator.comparing(t -> t.id().value()));
        return result;
    }

    @Override
    public boolean exists(TournamentId id) {
        return Files.exists(tournamentDir(id).resolve(TOURNAMENT_FILE));
    }

    @Override
    public void delete(TournamentId id) {
        Path dir = tournamentDir(id);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new TournamentStorageException("Failed to delete tournament " + id, e);
        }
        log.debug("Deleted tournament directory {}", dir);
    }

    @Override
    public void saveMatch(TournamentId tournamentId, MatchRecord match) {
        List<MatchRecord> matches = new ArrayList<>(loadMatches(tournamentId));
        matches.add(match);
        write(tournamentDir(tournamentId).resolve(MATCHES_FILE), matches);
    }

    /**
     * Stages both files first, so a serialization or disk failure changes nothing. If
     * the tournament file cannot be moved into place, the previous match list is restored.
     */
    @Override
    public void saveResult(Tournament tournament, MatchRecord match) {
        Path dir = tournamentDir(tournament.id());
        Path matchesFile = dir.resolve(MATCHES_FILE);
        Path tournamentFile = dir.resolve(TOURNAMENT_FILE);
        List<MatchRecord> previous = loadMatches(tournament.id());
        List<MatchRecord> updated = new ArrayList<>(previous);
        updated.add(match);

        Path stagedMatches = stage(matchesFile, updated);
        Path stagedTournament;
        try {
            stagedTournament = stage(tournamentFile, tournament);
        } catch (TournamentStorageException e) {
            discard(stagedMatches, e);
            throw e;
        }

        boolean hadMatches = Files.exists(matchesFile);
        commit(stagedMatches, matchesFile);
        try {
            commit(stagedTournament, tournamentFile);
        } catch (TournamentStorageException e) {
            discard(stagedTournament, e);
            try {
                if (hadMatches) {
                    write(matchesFile, previous);
                } else {
                    Files.deleteIfExists(matchesFile);
                }
            } catch (IOException | TournamentStorageException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            log.error("Result for {} not stored; rolled back {}", tournament.id(), matchesFile);
            throw e;
        }
    }

    @Override
    public List<MatchRecord> loadMatches(TournamentId tournamentId) {
        Path file = tournamentDir(tournamentId).resolve(MATCHES_FILE);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(file.toFile(), MATCH_LIST));
        } catch (IOException e) {
            throw new TournamentStorageException("Corrupt match data in " + file, e);
        }
    }

    @Override
    public Optional<DoubleEliminationBracket> loadBracketData(TournamentId tournamentId) {
        Path file = tournamentDir(tournamentId).resolve(BRACKET_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file, DoubleEliminationBracket.class));
    }

    @Override
    public void saveBracketData(TournamentId tournamentId, DoubleEliminationBracket bracket) {
        write(tournamentDir(tournamentId).resolve(BRACKET_FILE), bracket);
    }

    private Path tournamentDir(TournamentId id) {
        return dataDir.resolve(id.value());
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new TournamentStorageException("Corrupt data in " + file, e);
        }
    }

    private void write(Path target, Object value) {
        commit(stage(target, value), target);
    }

    private Path stage(Path target, Object value) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writeValue(temp.toFile(), value);
            return temp;
        } catch (IOException e) {
            throw new TournamentStorageException("Failed to write " + target, e);
        }
    }

    private static void commit(Path temp, Path target) {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TournamentStorageException("Failed to write " + target, e);
        }
    }

    private static void discard(Path temp, TournamentStorageException cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}

package com.dexarena.tournament.manager;

import com.dexarena.tournament.bracket.DoubleEliminationBracket;
import com.dexarena.tournament.model.MatchRecord;
import com.dexarena.tournament.model.Tournament;
import com.dexarena.tournament.model.TournamentId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe repository kept in memory. Used by tests and by the web app with
 * {@code tournament.storage=memory}.
 */
public class InMemoryTournamentRepository implements TournamentRepository {

    private final Map<TournamentId, Tournament> tournaments = new ConcurrentHashMap<>();
    private final Map<TournamentId, List<MatchRecord>> matches = new ConcurrentHashMap<>();
    private final Map<TournamentId, DoubleEliminationBracket> brackets = new ConcurrentHashMap<>();

    @Override
    public void save(Tournament tournament) {
        tournaments.put(tournament.id(), tournament.copy());
    }

    @Override
    public Optional<Tournament> findById(TournamentId id) {
        return Optional.ofNullable(tournaments.get(id)).map(Tournament::copy);
    }

    @Override
    public List<Tournament> findByOwner(String owner) {
        return findAll().stream().filter(t -> t.owner().equals(owner)).toList();
    }

    @Override
    public List<Tournament> findAll() {
        return tournaments.values().stream()
            .sorted(Comparator.comparing(t -> t.id().value()))
            .map(Tournament::copy)
            .toList();
    }

    @Override
    public boolean exists(TournamentId id) {
        return tournaments.containsKey(id);
    }

    @Override
    public void delete(TournamentId id) {
        tournaments.remove(id);
        matches.remove(id);
        brackets.remove(id);
    }

    @Override
    public void saveMatch(TournamentId tournamentId, MatchRecord match) {
        matches.computeIfAbsent(tournamentId, id -> new CopyOnWriteArrayList<>()).add(match);
    }

    @Override
    public synchronized void saveResult(Tournament tournament, MatchRecord match) {
        save(tournament);
        saveMatch(tournament.id(), match);
    }

    @Override
    public List<MatchRecord> loadMatches(TournamentId tournamentId) {
        return new ArrayList<>(matches.getOrDefault(tournamentId, List.of()));
    }

    @Override
    public Optional<DoubleEliminationBracket> loadBracketData(TournamentId tournamentId) {
        return Optional.ofNullable(brackets.get(tournamentId));
    }

    @Override
    public void saveBracketData(TournamentId tournamentId, DoubleEliminationBracket bracket) {
        brackets.put(tournamentId, bracket);
    }
}

package com.dexarena.tournament.manager;

import com.dexarena.tournament.bracket.DoubleEliminationBracket;
import com.dexarena.tournament.model.MatchRecord;
import com.dexarena.tournament.model.Tournament;
import com.dexarena.tournament.model.TournamentId;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for tournaments, their qualification matches and the playoff bracket.
 *
 * <p>Implementations must hand out and keep independent copies: changing a returned
 * {@link Tournament} has no effect until it is passed back to {@link #save}.
 */
public interface TournamentRepository {

    void save(Tournament tournament);

    Optional<Tournament> findById(TournamentId id);

    List<Tournament> findByOwner(String owner);

    List<Tournament> findAll();

    boolean exists(TournamentId id);

    /**
     * Removes the tournament together with its matches and bracket.
     */
    void delete(TournamentId id);

    void saveMatch(TournamentId tournamentId, MatchRecord match);

    /**
     * Stores a completed match together with the tournament whose participant counters it
     * updated. Either both become visible or neither does.
     */
    void saveResult(Tournament tournament, MatchRecord match);

    /**
     * All stored matches of a tournament in the order they were saved.
     */
    List<MatchRecord> loadMatches(TournamentId tournamentId);

    Optional<DoubleEliminationBracket> loadBracketData(TournamentId tournamentId);

    void saveBracketData(TournamentId tournamentId, DoubleEliminationBracket bracket);
}

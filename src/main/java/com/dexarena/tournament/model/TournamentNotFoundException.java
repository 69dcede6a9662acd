package com.dexarena.tournament.model;

/**
 * Thrown when a requested tournament does not exist in the repository.
 */
public class TournamentNotFoundException extends TournamentStateException {
    public TournamentNotFoundException(TournamentId id) {
        super("Tournament not found: " + id);
    }
}

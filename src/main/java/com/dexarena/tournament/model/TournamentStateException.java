package com.dexarena.tournament.model;

/**
 * Thrown when an operation is not legal in the tournament's current state,
 * e.g. advancing an unfinished round or seeding a bracket before qualification ends.
 */
public class TournamentStateException extends IllegalStateException {
    public TournamentStateException(String message) {
        super(message);
    }
}

package com.dexarena.tournament.model;

/**
 * Thrown when a caller supplies input the tournament engine cannot accept.
 * Nothing is persisted when this is raised.
 */
public class InvalidTournamentInputException extends IllegalArgumentException {
    public InvalidTournamentInputException(String message) {
        super(message);
    }
}

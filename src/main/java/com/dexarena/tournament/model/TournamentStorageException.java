package com.dexarena.tournament.model;

/**
 * Thrown when persisted tournament data cannot be read or written.
 * Corrupted state is reported, never repaired.
 */
public class TournamentStorageException extends RuntimeException {
    public TournamentStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public TournamentStorageException(String message) {
        super(message);
    }
}

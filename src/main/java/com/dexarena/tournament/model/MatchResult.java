package com.dexarena.tournament.model;

import java.util.Optional;

/**
 * Result of a qualification match. A draw carries no winner, every other outcome carries exactly one.
 */
public record MatchResult(Outcome outcome, Optional<CompetitorId> winner) {

    public MatchResult {
        if (outcome == null) {
            throw new InvalidTournamentInputException("Outcome cannot be null");
        }
        winner = winner == null ? Optional.empty() : winner;
        if (outcome == Outcome.DRAW && winner.isPresent()) {
            throw new InvalidTournamentInputException("Winner must be null for draw outcomes");
        }
        if (outcome.hasWinner() && winner.isEmpty()) {
            throw new InvalidTournamentInputException("Winner cannot be null for win/loss outcomes");
        }
    }

    public static MatchResult of(Outcome outcome, CompetitorId winner) {
        return new MatchResult(outcome, Optional.ofNullable(winner));
    }

    public static MatchResult won(CompetitorId winner) {
        return new MatchResult(Outcome.WIN, Optional.of(winner));
    }

    public static MatchResult draw() {
        return new MatchResult(Outcome.DRAW, Optional.empty());
    }

    public boolean isDraw() {
        return outcome == Outcome.DRAW;
    }
}

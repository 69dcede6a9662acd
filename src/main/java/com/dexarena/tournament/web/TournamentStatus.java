package com.dexarena.tournament.web;

import com.dexarena.tournament.bracket.BracketMatch;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.Standing;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a tournament pushed to subscribers after every change.
 */
public record TournamentStatus(
    String id,
    String owner,
    Phase phase,
    int currentRound,
    int totalRounds,
    boolean roundComplete,
    List<Standing> standings,
    Optional<BracketMatch> nextBracketMatch,
    Optional<CompetitorId> champion
) {
    public enum Phase {
        QUALIFYING,
        PLAYOFF,
        COMPLETED
    }
}

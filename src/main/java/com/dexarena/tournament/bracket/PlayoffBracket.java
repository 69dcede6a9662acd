package com.dexarena.tournament.bracket;

import com.dexarena.tournament.model.CompetitorId;

import java.util.Optional;

/**
 * An elimination playoff that advances one recorded result at a time.
 * Implementations are immutable; recording a result returns the advanced bracket.
 */
public interface PlayoffBracket {

    /**
     * The next match to be played, if one is ready.
     */
    Optional<BracketMatch> nextMatch();

    PlayoffBracket recordResult(String matchId, CompetitorId winner);

    boolean isComplete();

    Optional<CompetitorId> champion();
}

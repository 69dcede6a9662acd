package com.dexarena.tournament.strategy;

import com.dexarena.tournament.model.CompetitorId;

/**
 * Decides the winner of a match between two competitors without human input.
 * Implementations must be deterministic and return one of the two arguments.
 */
public interface MatchDecider {

    CompetitorId chooseWinner(CompetitorId participant1, CompetitorId participant2);
}

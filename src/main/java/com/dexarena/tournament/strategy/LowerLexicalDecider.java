package com.dexarena.tournament.strategy;

import com.dexarena.tournament.model.CompetitorId;

@DeciderDescription(key = "lower-lexical", value = "Alphabetically earlier competitor wins")
public class LowerLexicalDecider implements MatchDecider {

    @Override
    public CompetitorId chooseWinner(CompetitorId participant1, CompetitorId participant2) {
        return participant1.compareTo(participant2) <= 0 ? participant1 : participant2;
    }
}

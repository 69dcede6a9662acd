package com.dexarena.tournament.strategy;

import com.dexarena.tournament.model.CompetitorId;

import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Picks the competitor with the higher stat, e.g. base HP. Equal stats fall back to
 * the alphabetically earlier competitor.
 */
@DeciderDescription(key = "higher-stat", value = "Competitor with the higher stat wins, ties go to the earlier name")
public class HigherStatDecider implements MatchDecider {

    private final ToIntFunction<CompetitorId> statLookup;
    private final LowerLexicalDecider tieBreaker = new LowerLexicalDecider();

    public HigherStatDecider(ToIntFunction<CompetitorId> statLookup) {
        this.statLookup = Objects.requireNonNull(statLookup, "statLookup");
    }

    @Override
    public CompetitorId chooseWinner(CompetitorId participant1, CompetitorId participant2) {
        int stat1 = statLookup.applyAsInt(participant1);
        int stat2 = statLookup.applyAsInt(participant2);
        if (stat1 != stat2) {
            return stat1 > stat2 ? participant1 : participant2;
        }
        return tieBreaker.chooseWinner(participant1, participant2);
    }
}

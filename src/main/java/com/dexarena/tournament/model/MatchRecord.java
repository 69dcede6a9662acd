package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Persisted form of a completed qualification match. Byes are stored one-sided
 * and never count as a matchup between two competitors.
 */
public record MatchRecord(
    @JsonProperty("round") int round,
    @JsonProperty("participant1") CompetitorId participant1,
    @JsonProperty("participant2") Optional<CompetitorId> participant2,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("winner") Optional<CompetitorId> winner
) {

    public MatchRecord {
        participant2 = participant2 == null ? Optional.empty() : participant2;
        winner = winner == null ? Optional.empty() : winner;
    }

    @JsonIgnore
    public boolean isBye() {
        return participant2.isEmpty();
    }

    /**
     * Whether this record involves the given competitor on either side.
     */
    public boolean involves(CompetitorId competitor) {
        return participant1.equals(competitor) || participant2.map(competitor::equals).orElse(false);
    }
}

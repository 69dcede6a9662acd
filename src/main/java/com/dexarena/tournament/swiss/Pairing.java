package com.dexarena.tournament.swiss;

import com.dexarena.tournament.model.CompetitorId;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One pairing of a round: two competitors, or a single competitor receiving a bye.
 */
public record Pairing(
    @JsonProperty("first") CompetitorId first,
    @JsonProperty("second") Optional<CompetitorId> second
) {

    public Pairing {
        Objects.requireNonNull(first, "first");
        second = second == null ? Optional.empty() : second;
    }

    public static Pairing of(CompetitorId first, CompetitorId second) {
        return new Pairing(first, Optional.of(second));
    }

    public static Pairing bye(CompetitorId competitor) {
        return new Pairing(competitor, Optional.empty());
    }

    @JsonIgnore
    public boolean isBye() {
        return second.isEmpty();
    }

    @JsonIgnore
    public List<CompetitorId> members() {
        return second.map(s -> List.of(first, s)).orElseGet(() -> List.of(first));
    }

    /**
     * Order-independent key for a two-member pairing, e.g. {@code "bulbasaur:pikachu"}.
     */
    @JsonIgnore
    public String key() {
        return matchupKey(first, second.orElseThrow(() ->
            new IllegalStateException("A bye has no matchup key: " + first)));
    }

    public static String matchupKey(CompetitorId a, CompetitorId b) {
        return a.compareTo(b) <= 0 ? a + ":" + b : b + ":" + a;
    }
}

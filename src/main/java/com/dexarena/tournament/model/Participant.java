package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A competitor's cumulative qualification record. Counters only grow; the score
 * is always {@code 3 * wins + draws}.
 */
public final class Participant {

    private final CompetitorId id;
    private int wins;
    private int losses;
    private int draws;
    private int score;

    public Participant(CompetitorId id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    @JsonCreator
    Participant(
            @JsonProperty("id") CompetitorId id,
            @JsonProperty("wins") int wins,
            @JsonProperty("losses") int losses,
            @JsonProperty("draws") int draws,
            @JsonProperty("score") int score) {
        this(id);
        this.wins = wins;
        this.losses = losses;
        this.draws = draws;
        this.score = score;
        assertInvariants();
    }

    @JsonProperty("id")
    public CompetitorId id() {
        return id;
    }

    @JsonProperty("wins")
    public int wins() {
        return wins;
    }

    @JsonProperty("losses")
    public int losses() {
        return losses;
    }

    @JsonProperty("draws")
    public int draws() {
        return draws;
    }

    @JsonProperty("score")
    public int score() {
        return score;
    }

    public void addWin() {
        wins++;
        score += Outcome.WIN.points();
        assertInvariants();
    }

    public void addLoss() {
        losses++;
        assertInvariants();
    }

    public void addDraw() {
        draws++;
        score += Outcome.DRAW.points();
        assertInvariants();
    }

    public Standing toStanding() {
        return new Standing(id, score, wins, losses, draws);
    }

    public Participant copy() {
        return new Participant(id, wins, losses, draws, score);
    }

    private void assertInvariants() {
        if (wins < 0 || losses < 0 || draws < 0) {
            throw new TournamentStateException("Negative counters for " + id);
        }
        int expected = wins * Outcome.WIN.points() + draws * Outcome.DRAW.points();
        if (score != expected) {
            throw new TournamentStateException(
                "Score invariant violated for " + id + ": expected " + expected + ", got " + score);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Participant other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%s (Score: %d, W:%d L:%d D:%d)", id, score, wins, losses, draws);
    }
}

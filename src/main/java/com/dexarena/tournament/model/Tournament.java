package com.dexarena.tournament.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A Swiss qualification tournament owned by one user.
 *
 * <p>The participant list order is kept as given; it only matters for reporting
 * standings. The tournament is complete once {@code currentRound >= totalRounds}.
 */
public final class Tournament {

    private final TournamentId id;
    private final String owner;
    private final List<Participant> participants;
    private final int totalRounds;
    private int currentRound;

    public Tournament(TournamentId id, String owner, List<Participant> participants, int totalRounds) {
        this(id, owner, participants, totalRounds, 0);
    }

    @JsonCreator
    Tournament(
            @JsonProperty("id") TournamentId id,
            @JsonProperty("owner") String owner,
            @JsonProperty("participants") List<Participant> participants,
            @JsonProperty("totalRounds") int totalRounds,
            @JsonProperty("currentRound") int currentRound) {
        this.id = Objects.requireNonNull(id, "id");
        this.owner = Objects.requireNonNull(owner, "owner");
        if (participants == null || participants.isEmpty()) {
            throw new InvalidTournamentInputException("Tournament must have at least one participant");
        }
        Set<CompetitorId> seen = new HashSet<>();
        for (Participant p : participants) {
            if (!seen.add(p.id())) {
                throw new InvalidTournamentInputException("Duplicate participant: " + p.id());
            }
        }
        if (totalRounds < 0) {
            throw new InvalidTournamentInputException("Total rounds cannot be negative");
        }
        this.participants = new ArrayList<>(participants);
        this.totalRounds = totalRounds;
        this.currentRound = currentRound;
        if (currentRound < 0 || currentRound > totalRounds) {
            throw new TournamentStateException(
                "Current round " + currentRound + " outside [0, " + totalRounds + "] for " + id);
        }
    }

    @JsonProperty("id")
    public TournamentId id() {
        return id;
    }

    @JsonProperty("owner")
    public String owner() {
        return owner;
    }

    @JsonProperty("participants")
    public List<Participant> participants() {
        return Collections.unmodifiableList(participants);
    }

    @JsonProperty("totalRounds")
    public int totalRounds() {
        return totalRounds;
    }

    @JsonProperty("currentRound")
    public int currentRound() {
        return currentRound;
    }

    @JsonIgnore
    public boolean isComplete() {
        return currentRound >= totalRounds;
    }

    @JsonIgnore
    public List<CompetitorId> competitorIds() {
        return participants.stream().map(Participant::id).toList();
    }

    public Optional<Participant> participant(CompetitorId competitor) {
        return participants.stream().filter(p -> p.id().equals(competitor)).findFirst();
    }

    public void advanceRound() {
        if (isComplete()) {
            throw new TournamentStateException("Cannot advance round: tournament is already complete");
        }
        currentRound++;
    }

    /**
     * Deep copy, so repositories can hand out state without sharing mutable participants.
     */
    public Tournament copy() {
        List<Participant> copies = participants.stream().map(Participant::copy).toList();
        return new Tournament(id, owner, copies, totalRounds, currentRound);
    }

    @Override
    public String toString() {
        return String.format("Tournament %s (%s) - Round %d/%d - %d participants - %s",
            id, owner, currentRound, totalRounds, participants.size(), isComplete() ? "Complete" : "In Progress");
    }
}

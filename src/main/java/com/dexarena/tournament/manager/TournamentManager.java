package com.dexarena.tournament.manager;

import com.dexarena.tournament.bracket.BracketMatch;
import com.dexarena.tournament.bracket.DoubleEliminationBracket;
import com.dexarena.tournament.bracket.DoubleEliminationBracketEngine;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.Match;
import com.dexarena.tournament.model.MatchRecord;
import com.dexarena.tournament.model.MatchResult;
import com.dexarena.tournament.model.Outcome;
import com.dexarena.tournament.model.Participant;
import com.dexarena.tournament.model.ScoredCompetitor;
import com.dexarena.tournament.model.Standing;
import com.dexarena.tournament.model.Tournament;
import com.dexarena.tournament.model.TournamentId;
import com.dexarena.tournament.model.TournamentNotFoundException;
import com.dexarena.tournament.model.TournamentStateException;
import com.dexarena.tournament.swiss.Pairing;
import com.dexarena.tournament.swiss.SwissPairingEngine;
import com.google.common.util.concurrent.Striped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Drives a tournament from creation through Swiss qualification into the playoff bracket.
 *
 * <p>Every operation reads the tournament from the repository, computes, and writes back;
 * nothing is cached between calls. Mutations on the same tournament are serialized with
 * striped locks, so concurrent submissions in this process cannot interleave their
 * read-modify-write cycles. All validation happens before the first write.
 *
 * <p>Pairings are computed from the standings at the start of the current round, so they
 * stay stable while the round's results come in.
 */
public class TournamentManager {

    private static final Logger log = LoggerFactory.getLogger(TournamentManager.class);
    private static final int LOCK_STRIPES = 64;

    private final TournamentRepository repository;
    private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

    public TournamentManager(TournamentRepository repository) {
        this.repository = repository;
    }

    public Tournament createTournament(List<CompetitorId> participants, String owner) {
        if (participants == null || participants.isEmpty()) {
            throw new InvalidTournamentInputException("Tournament must have at least one participant");
        }
        if (owner == null || owner.isBlank()) {
            throw new InvalidTournamentInputException("Tournament owner is required");
        }
        Set<CompetitorId> distinct = new LinkedHashSet<>(participants);
        if (distinct.size() != participants.size()) {
            throw new InvalidTournamentInputException("Participants must be distinct");
        }

        TournamentId id = TournamentId.generate();
        while (repository.exists(id)) {
            id = TournamentId.generate();
        }
        List<Participant> entries = participants.stream().map(Participant::new).toList();
        Tournament tournament = new Tournament(
            id, owner.trim(), entries, SwissPairingEngine.calculateTotalRounds(entries.size()));
        repository.save(tournament);
        log.info("Created tournament {} for {} with {} participants over {} rounds",
            id, tournament.owner(), entries.size(), tournament.totalRounds());
        return tournament;
    }

    public Tournament getTournament(TournamentId id) {
        return repository.findById(id).orElseThrow(() -> new TournamentNotFoundException(id));
    }

    /**
     * Tournaments of one owner. The owner is matched the way it was stored, trimmed.
     */
    public List<Tournament> getUserTournaments(String owner) {
        if (owner == null || owner.isBlank()) {
            return List.of();
        }
        return repository.findByOwner(owner.trim());
    }

    public List<Tournament> listTournaments() {
        return repository.findAll();
    }

    /**
     * Pairings for the current round, or an empty list once qualification is complete.
     */
    public List<Pairing> getCurrentRoundPairings(TournamentId id) {
        Tournament tournament = getTournament(id);
        if (tournament.isComplete()) {
            return List.of();
        }
        return pairingsFor(tournament, repository.loadMatches(id));
    }

    public void recordMatchResult(
            TournamentId id, CompetitorId participant1, CompetitorId participant2,
            Outcome outcome, CompetitorId winner) {
        mutate(id, () -> {
            Tournament tournament = getTournament(id);
            requireInProgress(tournament, "record a result");
            Participant p1 = requireParticipant(tournament, participant1);
            Participant p2 = requireParticipant(tournament, participant2);
            if (outcome == null) {
                throw new InvalidTournamentInputException("Invalid outcome: must be 'win', 'loss', or 'draw'");
            }
            MatchResult result = MatchResult.of(outcome, winner);

            int round = tournament.currentRound();
            String key = Pairing.matchupKey(participant1, participant2);
            boolean duplicate = repository.loadMatches(id).stream()
                .anyMatch(m -> m.round() == round && !m.isBye()
                    && Pairing.matchupKey(m.participant1(), m.participant2().get()).equals(key));
            if (duplicate) {
                throw new TournamentStateException(
                    "Result for " + key + " already recorded in round " + round + " of " + id);
            }

            Match match = Match.between(p1, p2, round);
            match.recordResult(result);
            repository.saveResult(tournament, match.toRecord());
            log.info("Recorded {} for {} vs {} in round {} of {}",
                outcome.wireName(), participant1, participant2, round, id);
        });
    }

    /**
     * Credits a participant with a win for sitting out the current round.
     */
    public void recordBye(TournamentId id, CompetitorId participant) {
        mutate(id, () -> {
            Tournament tournament = getTournament(id);
            requireInProgress(tournament, "record a bye");
            Participant p = requireParticipant(tournament, participant);
            int round = tournament.currentRound();
            boolean duplicate = repository.loadMatches(id).stream()
                .anyMatch(m -> m.round() == round && m.isBye() && m.participant1().equals(participant));
            if (duplicate) {
                throw new TournamentStateException(
                    "Bye for " + participant + " already recorded in round " + round + " of " + id);
            }

            Match bye = Match.bye(p, round);
            bye.recordResult(MatchResult.won(participant));
            repository.saveResult(tournament, bye.toRecord());
            log.info("Recorded bye for {} in round {} of {}", participant, round, id);
        });
    }

    /**
     * True once every two-member pairing of the current round has a stored result in
     * this round. Byes need no stored match.
     */
    public boolean isCurrentRoundComplete(TournamentId id) {
        Tournament tournament = getTournament(id);
        if (tournament.isComplete()) {
            return true;
        }
        List<MatchRecord> matches = repository.loadMatches(id);
        List<Pairing> pairings = pairingsFor(tournament, matches);
        if (pairings.isEmpty()) {
            return true;
        }

        Set<String> completed = new HashSet<>();
        for (MatchRecord match : matches) {
            if (match.round() == tournament.currentRound() && !match.isBye()) {
                completed.add(Pairing.matchupKey(match.participant1(), match.participant2().get()));
            }
        }
        return pairings.stream()
            .filter(pairing -> !pairing.isBye())
            .allMatch(pairing -> completed.contains(pairing.key()));
    }

    /**
     * Moves to the next round. Finishing the last Swiss round initializes the playoff
     * bracket when the field is large enough for one.
     */
    public Tournament advanceToNextRound(TournamentId id) {
        return mutateAndGet(id, () -> {
            Tournament tournament = getTournament(id);
            if (tournament.isComplete()) {
                throw new TournamentStateException("Cannot advance round: tournament is already complete");
            }
            if (!isCurrentRoundComplete(id)) {
                throw new TournamentStateException(
                    "Cannot advance round: not all matches in current round are complete");
            }
            tournament.advanceRound();
            repository.save(tournament);
            log.info("Tournament {} advanced to round {}/{}", id, tournament.currentRound(), tournament.totalRounds());

            if (tournament.isComplete()) {
                if (tournament.participants().size() >= DoubleEliminationBracketEngine.BRACKET_SIZE) {
                    initializeBracket(id);
                } else {
                    log.info("Qualification of {} complete; {} participants is too few for a bracket",
                        id, tournament.participants().size());
                }
            }
            return tournament;
        });
    }

    /**
     * Seeds the top 16 of the final standings into a new double-elimination bracket.
     * Does nothing if the bracket already exists.
     */
    public DoubleEliminationBracket initializeBracket(TournamentId id) {
        return mutateAndGet(id, () -> {
            Optional<DoubleEliminationBracket> existing = repository.loadBracketData(id);
            if (existing.isPresent()) {
                return existing.get();
            }
            Tournament tournament = getTournament(id);
            if (!tournament.isComplete()) {
                throw new TournamentStateException("Cannot initialize bracket: Swiss rounds not complete");
            }
            List<ScoredCompetitor> ranked = SwissPairingEngine.sortStandingsByTieBreaker(
                scores(tournament), tournament.competitorIds());
            if (ranked.size() < DoubleEliminationBracketEngine.BRACKET_SIZE) {
                throw new TournamentStateException(
                    "Cannot initialize bracket: Need at least " + DoubleEliminationBracketEngine.BRACKET_SIZE
                        + " participants, have " + ranked.size());
            }
            List<CompetitorId> seeded = ranked.subList(0, DoubleEliminationBracketEngine.BRACKET_SIZE).stream()
                .map(ScoredCompetitor::participant)
                .toList();
            DoubleEliminationBracket bracket = DoubleEliminationBracketEngine.createBracket(seeded);
            repository.saveBracketData(id, bracket);
            log.info("Initialized bracket for {} with top seed {}", id, seeded.get(0));
            return bracket;
        });
    }

    public Optional<DoubleEliminationBracket> getBracket(TournamentId id) {
        getTournament(id);
        return repository.loadBracketData(id);
    }

    public DoubleEliminationBracket recordBracketMatchResult(TournamentId id, String matchId, CompetitorId winner) {
        return mutateAndGet(id, () -> {
            getTournament(id);
            DoubleEliminationBracket bracket = repository.loadBracketData(id)
                .orElseThrow(() -> new TournamentStateException("Bracket not initialized for tournament " + id));
            DoubleEliminationBracket updated = DoubleEliminationBracketEngine.recordMatchResult(bracket, matchId, winner);
            repository.saveBracketData(id, updated);
            log.info("Bracket match {} of {} won by {}", matchId, id, winner);
            if (updated.isComplete()) {
                log.info("Bracket of {} complete; champion {}", id, updated.champion().orElseThrow());
            }
            return updated;
        });
    }

    public Optional<BracketMatch> getNextBracketMatch(TournamentId id) {
        return getBracket(id)
            .flatMap(bracket -> DoubleEliminationBracketEngine.getMatchesReadyForVoting(bracket).stream().findFirst());
    }

    public boolean isBracketComplete(TournamentId id) {
        return getBracket(id).map(DoubleEliminationBracketEngine::isBracketComplete).orElse(false);
    }

    /**
     * Standings in participant-list order.
     */
    public List<Standing> getCurrentStandings(TournamentId id) {
        return getTournament(id).participants().stream().map(Participant::toStanding).toList();
    }

    public List<Standing> getFinalStandings(TournamentId id) {
        Tournament tournament = getTournament(id);
        if (!tournament.isComplete()) {
            throw new TournamentStateException("Tournament " + id + " is not complete");
        }
        return tournament.participants().stream().map(Participant::toStanding).toList();
    }

    public void deleteTournament(TournamentId id) {
        mutate(id, () -> {
            if (!repository.exists(id)) {
                throw new TournamentNotFoundException(id);
            }
            repository.delete(id);
            log.info("Deleted tournament {}", id);
        });
    }

    private List<Pairing> pairingsFor(Tournament tournament, List<MatchRecord> matches) {
        int round = tournament.currentRound();
        List<MatchRecord> prior = matches.stream().filter(m -> m.round() < round).toList();
        List<Pairing> previousMatchups = prior.stream()
            .filter(m -> !m.isBye())
            .map(m -> Pairing.of(m.participant1(), m.participant2().get()))
            .toList();
        Map<CompetitorId, Integer> standings = SwissPairingEngine.calculateStandings(tournament.competitorIds(), prior);
        return SwissPairingEngine.generatePairings(tournament.competitorIds(), previousMatchups, standings);
    }

    private static Map<CompetitorId, Integer> scores(Tournament tournament) {
        Map<CompetitorId, Integer> scores = new LinkedHashMap<>();
        for (Participant participant : tournament.participants()) {
            scores.put(participant.id(), participant.score());
        }
        return scores;
    }

    private static Participant requireParticipant(Tournament tournament, CompetitorId competitor) {
        if (competitor == null) {
            throw new InvalidTournamentInputException("Participant is required");
        }
        return tournament.participant(competitor).orElseThrow(() -> new InvalidTournamentInputException(
            "Participant not found in tournament " + tournament.id() + ": " + competitor));
    }

    private static void requireInProgress(Tournament tournament, String action) {
        if (tournament.isComplete()) {
            throw new TournamentStateException(
                "Cannot " + action + ": qualification of " + tournament.id() + " is already complete");
        }
    }

    private void mutate(TournamentId id, Runnable action) {
        mutateAndGet(id, () -> {
            action.run();
            return null;
        });
    }

    private <T> T mutateAndGet(TournamentId id, Supplier<T> action) {
        Lock lock = locks.get(id);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

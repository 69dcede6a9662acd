package com.dexarena.tournament.runner;

import com.dexarena.tournament.bracket.BracketMatch;
import com.dexarena.tournament.bracket.PlayoffBracket;
import com.dexarena.tournament.bracket.PlayoffBracketFactory;
import com.dexarena.tournament.format.PlayoffType;
import com.dexarena.tournament.format.TournamentFormat;
import com.dexarena.tournament.manager.TournamentManager;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.Outcome;
import com.dexarena.tournament.model.Standing;
import com.dexarena.tournament.model.Tournament;
import com.dexarena.tournament.model.TournamentId;
import com.dexarena.tournament.strategy.MatchDecider;
import com.dexarena.tournament.swiss.Pairing;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plays a whole tournament through the {@link TournamentManager}, letting a
 * {@link MatchDecider} pick every winner.
 *
 * <p>A double-elimination playoff runs on the bracket the manager persists. A
 * single-elimination playoff is built from the final standings and played in memory.
 */
public class TournamentSimulator {

    /**
     * Progress listener callback for simulation steps.
     */
    public interface ProgressListener {
        void onProgress(String message);
    }

    private static final Comparator<Standing> BEST_FIRST =
        Comparator.comparingInt(Standing::score).reversed().thenComparing(Standing::participant);

    private final TournamentManager manager;
    private final MatchDecider decider;
    private final ProgressListener listener;

    public TournamentSimulator(TournamentManager manager, MatchDecider decider) {
        this(manager, decider, message -> { });
    }

    public TournamentSimulator(TournamentManager manager, MatchDecider decider, ProgressListener listener) {
        this.manager = manager;
        this.decider = decider;
        this.listener = listener;
    }

    public SimulationResult run(List<CompetitorId> participants, String owner, TournamentFormat format) {
        Tournament tournament = manager.createTournament(participants, owner);
        TournamentId id = tournament.id();
        listener.onProgress(String.format("Created %s with %d participants, %d Swiss rounds",
            id, participants.size(), tournament.totalRounds()));

        while (!tournament.isComplete()) {
            playRound(id, tournament.currentRound() + 1, tournament.totalRounds());
            tournament = manager.advanceToNextRound(id);
        }

        List<Standing> standings = manager.getFinalStandings(id).stream().sorted(BEST_FIRST).toList();
        listener.onProgress("Swiss phase complete, leader " + standings.get(0).participant());

        Optional<PlayoffType> playoff = format.playoff();
        int cutoff = format.playoffCutoff().orElse(0);
        if (playoff.isPresent() && standings.size() < cutoff) {
            listener.onProgress(String.format("Skipping %s playoff: %d participants, cutoff %d",
                playoff.get().configName(), standings.size(), cutoff));
            playoff = Optional.empty();
        }
        if (playoff.isEmpty()) {
            return new SimulationResult(id, tournament.totalRounds(), standings, Optional.empty(), 0, Optional.empty());
        }

        PlayoffRun run = playoff.get() == PlayoffType.DOUBLE_ELIMINATION
            ? playDoubleElimination(id)
            : playSingleElimination(tournament, format);
        listener.onProgress("Champion: " + run.champion());
        return new SimulationResult(
            id, tournament.totalRounds(), standings, playoff, run.matches(), Optional.of(run.champion()));
    }

    private void playRound(TournamentId id, int roundNumber, int totalRounds) {
        List<Pairing> pairings = manager.getCurrentRoundPairings(id);
        int byes = 0;
        for (Pairing pairing : pairings) {
            if (pairing.isBye()) {
                manager.recordBye(id, pairing.first());
                byes++;
                continue;
            }
            CompetitorId first = pairing.first();
            CompetitorId second = pairing.second().get();
            manager.recordMatchResult(id, first, second, Outcome.WIN, decider.chooseWinner(first, second));
        }
        listener.onProgress(String.format("Round %d/%d complete (%d matches, %d byes)",
            roundNumber, totalRounds, pairings.size() - byes, byes));
    }

    private PlayoffRun playDoubleElimination(TournamentId id) {
        manager.initializeBracket(id);
        int played = 0;
        Optional<BracketMatch> next = manager.getNextBracketMatch(id);
        while (next.isPresent()) {
            BracketMatch match = next.get();
            CompetitorId winner = decider.chooseWinner(match.participant1().get(), match.participant2().get());
            manager.recordBracketMatchResult(id, match.id(), winner);
            played++;
            next = manager.getNextBracketMatch(id);
        }
        if (!manager.isBracketComplete(id)) {
            throw new IllegalStateException("Bracket of " + id + " stalled after " + played + " matches");
        }
        CompetitorId champion = manager.getBracket(id)
            .flatMap(bracket -> bracket.champion())
            .orElseThrow();
        listener.onProgress(String.format("Double elimination complete after %d matches", played));
        return new PlayoffRun(played, champion);
    }

    private PlayoffRun playSingleElimination(Tournament tournament, TournamentFormat format) {
        Map<CompetitorId, Integer> scores = new LinkedHashMap<>();
        tournament.participants().forEach(p -> scores.put(p.id(), p.score()));
        PlayoffBracket bracket = PlayoffBracketFactory.createFromStandings(tournament.participants(), scores, format);
        int played = 0;
        Optional<BracketMatch> next = bracket.nextMatch();
        while (next.isPresent()) {
            BracketMatch match = next.get();
            bracket = bracket.recordResult(
                match.id(), decider.chooseWinner(match.participant1().get(), match.participant2().get()));
            played++;
            next = bracket.nextMatch();
        }
        listener.onProgress(String.format("Single elimination complete after %d matches", played));
        return new PlayoffRun(played, bracket.champion().orElseThrow());
    }

    private record PlayoffRun(int matches, CompetitorId champion) {}
}

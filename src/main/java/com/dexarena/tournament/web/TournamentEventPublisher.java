package com.dexarena.tournament.web;

import com.dexarena.tournament.bracket.DoubleEliminationBracket;
import com.dexarena.tournament.manager.TournamentManager;
import com.dexarena.tournament.model.Tournament;
import com.dexarena.tournament.model.TournamentId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Builds {@link TournamentStatus} snapshots and pushes them to
 * {@code /topic/tournaments/{tournamentId}}.
 */
@Service
public class TournamentEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(TournamentEventPublisher.class);

    private final TournamentManager manager;
    private final SimpMessagingTemplate messagingTemplate;

    public TournamentEventPublisher(TournamentManager manager, SimpMessagingTemplate messagingTemplate) {
        this.manager = manager;
        this.messagingTemplate = messagingTemplate;
    }

    public TournamentStatus snapshot(TournamentId id) {
        Tournament tournament = manager.getTournament(id);
        Optional<DoubleEliminationBracket> bracket = manager.getBracket(id);

        TournamentStatus.Phase phase;
        if (!tournament.isComplete()) {
            phase = TournamentStatus.Phase.QUALIFYING;
        } else if (bracket.isPresent() && !bracket.get().isComplete()) {
            phase = TournamentStatus.Phase.PLAYOFF;
        } else {
            phase = TournamentStatus.Phase.COMPLETED;
        }

        return new TournamentStatus(
            id.value(),
            tournament.owner(),
            phase,
            tournament.currentRound(),
            tournament.totalRounds(),
            manager.isCurrentRoundComplete(id),
            manager.getCurrentStandings(id),
            bracket.flatMap(DoubleEliminationBracket::nextMatch),
            bracket.flatMap(DoubleEliminationBracket::champion));
    }

    /**
     * Sends the current snapshot. Failures are logged and never propagate to the caller,
     * since the change itself has already been stored.
     */
    public void publish(TournamentId id) {
        try {
            messagingTemplate.convertAndSend("/topic/tournaments/" + id.value(), snapshot(id));
        } catch (RuntimeException e) {
            log.warn("Failed to send WebSocket update for tournament {}: {}", id, e.getMessage());
        }
    }
}

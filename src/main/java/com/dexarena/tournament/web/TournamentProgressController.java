package com.dexarena.tournament.web;

import com.dexarena.tournament.model.TournamentId;
import com.dexarena.tournament.model.TournamentStateException;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for tournament progress updates.
 * Clients can subscribe to /topic/tournaments/{tournamentId} to receive a status snapshot after every change.
 */
@Controller
public class TournamentProgressController {

    private final TournamentEventPublisher publisher;

    public TournamentProgressController(TournamentEventPublisher publisher) {
        this.publisher = publisher;
    }

    /**
     * Handles subscription requests for tournament status.
     * When a client subscribes, returns the current status immediately.
     *
     * @param tournamentId the tournament ID to subscribe to
     * @return the current tournament status, or null if not found
     */
    @MessageMapping("/tournaments/{tournamentId}/subscribe")
    @SendTo("/topic/tournaments/{tournamentId}")
    public TournamentStatus subscribeTournament(@DestinationVariable String tournamentId) {
        try {
            return publisher.snapshot(TournamentId.of(tournamentId));
        } catch (IllegalArgumentException | TournamentStateException e) {
            return null;
        }
    }
}

package com.dexarena.tournament.web;

import com.dexarena.tournament.manager.InMemoryTournamentRepository;
import com.dexarena.tournament.manager.TournamentManager;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.Tournament;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class TournamentProgressControllerTest {

    private TournamentManager manager;
    private TournamentProgressController controller;

    @BeforeEach
    void setUp() {
        manager = new TournamentManager(new InMemoryTournamentRepository());
        controller = new TournamentProgressController(
            new TournamentEventPublisher(manager, mock(SimpMessagingTemplate.class)));
    }

    @Test
    void subscribe_returnsCurrentSnapshot() {
        Tournament tournament = manager.createTournament(
            List.of(CompetitorId.of("vulpix"), CompetitorId.of("growlithe")), "misty");

        TournamentStatus status = controller.subscribeTournament(tournament.id().value());

        assertEquals(tournament.id().value(), status.id());
        assertEquals("misty", status.owner());
        assertEquals(TournamentStatus.Phase.QUALIFYING, status.phase());
        assertFalse(status.roundComplete());
        assertTrue(status.nextBracketMatch().isEmpty());
    }

    @Test
    void subscribe_unknownOrMalformedIdReturnsNull() {
        assertNull(controller.subscribeTournament("no-such-tournament"));
        assertNull(controller.subscribeTournament("x"));
    }

    @Test
    void snapshot_completedWithoutBracket() {
        Tournament tournament = manager.createTournament(List.of(CompetitorId.of("mew")), "misty");

        TournamentStatus status = controller.subscribeTournament(tournament.id().value());

        assertEquals(TournamentStatus.Phase.COMPLETED, status.phase());
        assertTrue(status.champion().isEmpty());
    }
}

package com.dexarena.tournament.web;

import com.dexarena.tournament.bracket.BracketMatch;
import com.dexarena.tournament.bracket.DoubleEliminationBracket;
import com.dexarena.tournament.format.PlayoffType;
import com.dexarena.tournament.format.TournamentFormat;
import com.dexarena.tournament.manager.TournamentManager;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.Outcome;
import com.dexarena.tournament.model.Standing;
import com.dexarena.tournament.model.Tournament;
import com.dexarena.tournament.model.TournamentId;
import com.dexarena.tournament.model.TournamentNotFoundException;
import com.dexarena.tournament.model.TournamentStateException;
import com.dexarena.tournament.model.TournamentStorageException;
import com.dexarena.tournament.runner.SimulationResult;
import com.dexarena.tournament.runner.TournamentSimulator;
import com.dexarena.tournament.strategy.DeciderDiscoveryService;
import com.dexarena.tournament.strategy.DiscoveredDecider;
import com.dexarena.tournament.strategy.MatchDecider;
import com.dexarena.tournament.swiss.Pairing;
import com.dexarena.tournament.web.dto.BracketResultRequest;
import com.dexarena.tournament.web.dto.ByeRequest;
import com.dexarena.tournament.web.dto.CreateTournamentRequest;
import com.dexarena.tournament.web.dto.MatchResultRequest;
import com.dexarena.tournament.web.dto.SimulationRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing one endpoint per tournament manager operation.
 * Every mutation is followed by a status push to the tournament's topic.
 */
@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private static final Logger log = LoggerFactory.getLogger(TournamentController.class);

    private final TournamentManager manager;
    private final TournamentEventPublisher publisher;
    private final DeciderDiscoveryService deciderDiscoveryService;
    private final TournamentFormat defaultFormat;

    public TournamentController(
            TournamentManager manager,
            TournamentEventPublisher publisher,
            DeciderDiscoveryService deciderDiscoveryService,
            TournamentFormat defaultFormat) {
        this.manager = manager;
        this.publisher = publisher;
        this.deciderDiscoveryService = deciderDiscoveryService;
        this.defaultFormat = defaultFormat;
    }

    /**
     * Lists tournaments, optionally only those of one owner.
     */
    @GetMapping
    public List<Tournament> listTournaments(@RequestParam(required = false) String owner) {
        return owner == null ? manager.listTournaments() : manager.getUserTournaments(owner);
    }

    @PostMapping
    public ResponseEntity<Tournament> createTournament(@Valid @RequestBody CreateTournamentRequest request) {
        List<CompetitorId> participants = request.participants().stream().map(CompetitorId::of).toList();
        Tournament tournament = manager.createTournament(participants, request.owner());
        publisher.publish(tournament.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(tournament);
    }

    @GetMapping("/{tournamentId}")
    public Tournament getTournament(@PathVariable String tournamentId) {
        return manager.getTournament(TournamentId.of(tournamentId));
    }

    @DeleteMapping("/{tournamentId}")
    public ResponseEntity<Void> deleteTournament(@PathVariable String tournamentId) {
        manager.deleteTournament(TournamentId.of(tournamentId));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{tournamentId}/status")
    public TournamentStatus getStatus(@PathVariable String tournamentId) {
        return publisher.snapshot(TournamentId.of(tournamentId));
    }

    @GetMapping("/{tournamentId}/pairings")
    public List<Pairing> getPairings(@PathVariable String tournamentId) {
        return manager.getCurrentRoundPairings(TournamentId.of(tournamentId));
    }

    @PostMapping("/{tournamentId}/results")
    public TournamentStatus recordResult(
            @PathVariable String tournamentId, @Valid @RequestBody MatchResultRequest request) {
        TournamentId id = TournamentId.of(tournamentId);
        CompetitorId winner = request.winner() == null || request.winner().isBlank()
            ? null
            : CompetitorId.of(request.winner());
        manager.recordMatchResult(
            id,
            CompetitorId.of(request.participant1()),
            CompetitorId.of(request.participant2()),
            Outcome.fromString(request.outcome()),
            winner);
        return publishAndSnapshot(id);
    }

    @PostMapping("/{tournamentId}/byes")
    public TournamentStatus recordBye(@PathVariable String tournamentId, @Valid @RequestBody ByeRequest request) {
        TournamentId id = TournamentId.of(tournamentId);
        manager.recordBye(id, CompetitorId.of(request.participant()));
        return publishAndSnapshot(id);
    }

    @GetMapping("/{tournamentId}/round-complete")
    public Map<String, Boolean> isRoundComplete(@PathVariable String tournamentId) {
        return Map.of("complete", manager.isCurrentRoundComplete(TournamentId.of(tournamentId)));
    }

    @PostMapping("/{tournamentId}/advance")
    public TournamentStatus advanceRound(@PathVariable String tournamentId) {
        TournamentId id = TournamentId.of(tournamentId);
        manager.advanceToNextRound(id);
        return publishAndSnapshot(id);
    }

    @GetMapping("/{tournamentId}/standings")
    public List<Standing> getStandings(@PathVariable String tournamentId) {
        return manager.getCurrentStandings(TournamentId.of(tournamentId));
    }

    @GetMapping("/{tournamentId}/standings/final")
    public List<Standing> getFinalStandings(@PathVariable String tournamentId) {
        return manager.getFinalStandings(TournamentId.of(tournamentId));
    }

    @PostMapping("/{tournamentId}/bracket")
    public DoubleEliminationBracket initializeBracket(@PathVariable String tournamentId) {
        TournamentId id = TournamentId.of(tournamentId);
        DoubleEliminationBracket bracket = manager.initializeBracket(id);
        publisher.publish(id);
        return bracket;
    }

    @GetMapping("/{tournamentId}/bracket")
    public ResponseEntity<DoubleEliminationBracket> getBracket(@PathVariable String tournamentId) {
        return manager.getBracket(TournamentId.of(tournamentId))
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Next bracket match to vote on, or 204 when none is ready.
     */
    @GetMapping("/{tournamentId}/bracket/next")
    public ResponseEntity<BracketMatch> getNextBracketMatch(@PathVariable String tournamentId) {
        return manager.getNextBracketMatch(TournamentId.of(tournamentId))
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/{tournamentId}/bracket/matches/{matchId}")
    public DoubleEliminationBracket recordBracketResult(
            @PathVariable String tournamentId,
            @PathVariable String matchId,
            @Valid @RequestBody BracketResultRequest request) {
        TournamentId id = TournamentId.of(tournamentId);
        DoubleEliminationBracket bracket =
            manager.recordBracketMatchResult(id, matchId, CompetitorId.of(request.winner()));
        publisher.publish(id);
        return bracket;
    }

    @GetMapping("/{tournamentId}/bracket/complete")
    public Map<String, Boolean> isBracketComplete(@PathVariable String tournamentId) {
        return Map.of("complete", manager.isBracketComplete(TournamentId.of(tournamentId)));
    }

    @GetMapping("/format")
    public TournamentFormat getFormat() {
        return defaultFormat;
    }

    @GetMapping("/deciders")
    public List<DiscoveredDecider> listDeciders() {
        return deciderDiscoveryService.getDiscoveredDeciders();
    }

    /**
     * Plays a complete tournament with an automatic decider and returns the outcome.
     * Without an explicit playoff the configured format applies.
     */
    @PostMapping("/simulations")
    public ResponseEntity<SimulationResult> simulate(@Valid @RequestBody SimulationRequest request)
            throws ReflectiveOperationException {
        Map<CompetitorId, Integer> stats = new HashMap<>();
        if (request.stats() != null) {
            request.stats().forEach((name, value) -> stats.put(CompetitorId.of(name), value));
        }
        MatchDecider decider = deciderDiscoveryService.createDecider(
            request.decider(), competitor -> stats.getOrDefault(competitor, 0));

        TournamentFormat format = request.playoff() == null
            ? defaultFormat
            : TournamentFormat.withPlayoff(
                PlayoffType.fromConfigName(request.playoff()), request.cutoff() == null ? 16 : request.cutoff());
        List<CompetitorId> participants = request.participants().stream().map(CompetitorId::of).toList();

        SimulationResult result = new TournamentSimulator(manager, decider, message -> log.debug("{}", message))
            .run(participants, request.owner(), format);
        publisher.publish(result.tournamentId());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    private TournamentStatus publishAndSnapshot(TournamentId id) {
        publisher.publish(id);
        return publisher.snapshot(id);
    }

    @ExceptionHandler(InvalidTournamentInputException.class)
    public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidTournamentInputException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");
        return ResponseEntity.badRequest().body(Map.of("error", detail));
    }

    @ExceptionHandler(TournamentNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(TournamentNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(TournamentStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(TournamentStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(TournamentStorageException.class)
    public ResponseEntity<Map<String, String>> handleStorage(TournamentStorageException ex) {
        log.error("Tournament storage failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "Tournament storage failure: " + ex.getMessage()));
    }
}

package com.dexarena.tournament.runner;

import com.dexarena.tournament.format.PlayoffType;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.Standing;
import com.dexarena.tournament.model.TournamentId;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a simulated tournament.
 *
 * @param tournamentId    id under which the tournament was stored
 * @param rounds          number of Swiss rounds played
 * @param standings       final Swiss standings, best first
 * @param playoff         playoff that was played, if any
 * @param playoffMatches  number of playoff matches decided by the decider
 * @param champion        playoff winner, if a playoff was played
 */
public record SimulationResult(
    @JsonProperty("tournamentId") TournamentId tournamentId,
    @JsonProperty("rounds") int rounds,
    @JsonProperty("standings") List<Standing> standings,
    @JsonProperty("playoff") Optional<PlayoffType> playoff,
    @JsonProperty("playoffMatches") int playoffMatches,
    @JsonProperty("champion") Optional<CompetitorId> champion
) {}

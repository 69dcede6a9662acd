package com.dexarena.tournament.bracket;

import com.dexarena.tournament.format.PlayoffType;
import com.dexarena.tournament.format.TournamentFormat;
import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import com.dexarena.tournament.model.Participant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cuts a scored field down to a seeded top-N and builds the playoff bracket for it.
 *
 * <p>Seeds follow score (descending) then identifier (ascending). Standings entries with
 * no matching participant in the pool get a fresh placeholder participant, so a bracket
 * can also be built straight from an externally supplied top-N.
 */
public final class PlayoffBracketFactory {

    private PlayoffBracketFactory() {}

    public static List<Participant> seedTopN(
            Collection<Participant> pool, Map<CompetitorId, Integer> standings, int topN) {
        if (topN < 1) {
            throw new InvalidTournamentInputException("topN must be positive, got " + topN);
        }
        Map<CompetitorId, Participant> byId = new LinkedHashMap<>();
        for (Participant participant : pool) {
            byId.put(participant.id(), participant);
        }

        List<CompetitorId> ranked = new ArrayList<>(standings.keySet());
        ranked.sort(Comparator
            .comparingInt((CompetitorId id) -> standings.getOrDefault(id, 0)).reversed()
            .thenComparing(Comparator.naturalOrder()));

        List<Participant> seeded = new ArrayList<>();
        for (CompetitorId id : ranked.subList(0, Math.min(topN, ranked.size()))) {
            seeded.add(byId.computeIfAbsent(id, Participant::new));
        }
        return seeded;
    }

    public static SingleEliminationBracket createTopSingleElimination(
            Collection<Participant> pool, Map<CompetitorId, Integer> standings, int topN) {
        if (topN < 2) {
            throw new InvalidTournamentInputException("topN must be at least 2");
        }
        return SingleEliminationBracket.create(ids(seedTopN(pool, standings, topN)));
    }

    public static DoubleEliminationBracket createTopDoubleElimination(
            Collection<Participant> pool, Map<CompetitorId, Integer> standings) {
        return createTopDoubleElimination(pool, standings, false);
    }

    public static DoubleEliminationBracket createTopDoubleElimination(
            Collection<Participant> pool, Map<CompetitorId, Integer> standings, boolean reset) {
        return DoubleEliminationBracketEngine.createBracket(
            ids(seedTopN(pool, standings, DoubleEliminationBracketEngine.BRACKET_SIZE)), reset);
    }

    /**
     * Builds the playoff the format asks for.
     *
     * @throws InvalidTournamentInputException if the format has no playoff, or the
     *         standings cannot fill the cutoff
     */
    public static PlayoffBracket createFromStandings(
            Collection<Participant> pool, Map<CompetitorId, Integer> standings, TournamentFormat format) {
        PlayoffType type = format.playoff()
            .orElseThrow(() -> new InvalidTournamentInputException("Format " + format.format() + " has no playoff"));
        int cutoff = format.playoffCutoff().getAsInt();
        if (standings.size() < cutoff) {
            throw new InvalidTournamentInputException(
                "Playoff needs " + cutoff + " qualifiers but standings only have " + standings.size());
        }
        return switch (type) {
            case SINGLE_ELIMINATION -> createTopSingleElimination(pool, standings, cutoff);
            case DOUBLE_ELIMINATION -> createTopDoubleElimination(pool, standings, format.playoffReset());
        };
    }

    private static List<CompetitorId> ids(List<Participant> participants) {
        return participants.stream().map(Participant::id).toList();
    }
}

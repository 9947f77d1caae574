package com.tcg.duel.match;

import com.tcg.duel.engine.DuelEngine;
import com.tcg.duel.engine.PlayerView;
import com.tcg.duel.engine.SpectatorView;
import com.tcg.duel.game.Command;
import com.tcg.duel.game.Event;
import com.tcg.duel.game.GameState;
import com.tcg.duel.game.Seat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One live duel: the current snapshot plus an append-only log of accepted event batches.
 * <p>
 * Submissions are serialised. Each carries the version the caller last saw; a mismatch is
 * refused before the rules run, so two clients can never both act on the same snapshot.
 * Version 0 is the opening state and every accepted command adds exactly one version.
 */
public class DuelSession {
    private static final Logger log = LoggerFactory.getLogger(DuelSession.class);

    private final DuelEngine engine;
    private final String hostPlayerId;
    private final String awayPlayerId;
    private final List<VersionedEventBatch> history = new ArrayList<>();
    private GameState state;
    private long version;

    public DuelSession(DuelEngine engine, GameState initialState, String hostPlayerId, String awayPlayerId) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.hostPlayerId = Objects.requireNonNull(hostPlayerId, "hostPlayerId");
        this.awayPlayerId = Objects.requireNonNull(awayPlayerId, "awayPlayerId");
    }

    // ==================== SUBMISSION ====================

    /**
     * Apply a command for a seat.
     *
     * @param expectedVersion version the caller's view was taken at
     * @return the events and the resulting version; an illegal command yields no events
     * @throws StaleVersionException   if another command was accepted in between
     * @throws NotParticipantException if no seat is given
     * @throws DuelFinishedException   if the duel has already ended
     */
    public synchronized SubmitResult submit(Seat seat, Command command, long expectedVersion)
            throws MatchException {
        if (seat == null) {
            throw new NotParticipantException("No seat given");
        }
        if (expectedVersion != version) {
            throw new StaleVersionException(expectedVersion, version);
        }
        if (state.gameOver()) {
            throw new DuelFinishedException(state.winner());
        }

        List<Event> events = engine.decide(state, seat, command);
        if (events.isEmpty()) {
            return new SubmitResult(List.of(), version);
        }
        state = engine.evolve(state, events);
        version++;
        history.add(new VersionedEventBatch(version, seat, command, events));
        log.debug("v{}: {} {} -> {} events", version, seat, command.kind(), events.size());
        if (state.gameOver()) {
            log.info("Duel ended at v{}: {} wins by {}", version, state.winner(), state.winReason());
        }
        return new SubmitResult(events, version);
    }

    /**
     * Apply a command for a player id.
     *
     * @throws NotParticipantException if the player is not seated in this duel
     */
    public SubmitResult submit(String playerId, Command command, long expectedVersion) throws MatchException {
        return submit(seatOf(playerId), command, expectedVersion);
    }

    public Seat seatOf(String playerId) throws NotParticipantException {
        if (hostPlayerId.equals(playerId)) {
            return Seat.HOST;
        }
        if (awayPlayerId.equals(playerId)) {
            return Seat.AWAY;
        }
        throw new NotParticipantException("Player " + playerId + " is not seated in this duel");
    }

    // ==================== QUERIES ====================

    /**
     * Batches with a version strictly greater than {@code sinceVersion}, oldest first.
     */
    public synchronized List<VersionedEventBatch> eventsSince(long sinceVersion) {
        List<VersionedEventBatch> batches = new ArrayList<>();
        for (VersionedEventBatch batch : history) {
            if (batch.version() > sinceVersion) {
                batches.add(batch);
            }
        }
        return batches;
    }

    public synchronized PlayerView view(Seat seat) {
        return engine.mask(state, seat);
    }

    public synchronized SpectatorView spectatorView() {
        return engine.spectate(state);
    }

    public synchronized List<Command> legalMoves(Seat seat) {
        return engine.legalMoves(state, seat);
    }

    public synchronized GameState getState() {
        return state;
    }

    public synchronized long getVersion() {
        return version;
    }
}

package com.reqminer.core.persistence;

import java.util.Optional;

/**
 * Durable storage of paused sessions, keyed by session id.
 * <p>
 * Implementations must give last-write-wins semantics per session id. The engine
 * serializes access to a single session, so implementations only need to be safe
 * across different sessions.
 */
public interface CheckpointStore {

    /**
     * Persists the snapshot, replacing any earlier snapshot of the same session.
     */
    void save(MiningSnapshot snapshot);

    /**
     * Loads the last saved snapshot.
     *
     * @throws CheckpointCorruptedException if a snapshot exists but cannot be decoded
     */
    Optional<MiningSnapshot> load(String sessionId);

    /**
     * Removes the snapshot of a session. Returns {@code true} if one existed.
     */
    boolean delete(String sessionId);

    /**
     * Human-readable description used in health reports.
     */
    String describe();
}

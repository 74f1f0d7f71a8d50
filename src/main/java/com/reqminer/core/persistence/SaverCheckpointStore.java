package com.reqminer.core.persistence;

import com.reqminer.core.graph.MiningNode;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link CheckpointStore} on top of a LangGraph4j {@link BaseCheckpointSaver}.
 * <p>
 * Each session maps to a saver thread. The snapshot travels as a JSON string
 * inside the checkpoint state, so any saver works regardless of how it copies
 * or serializes state maps. With a {@link MemorySaver} nothing survives a restart.
 */
public class SaverCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(SaverCheckpointStore.class);

    static final String SNAPSHOT_KEY = "snapshot";

    private final BaseCheckpointSaver saver;
    private final SnapshotCodec codec;

    public SaverCheckpointStore(BaseCheckpointSaver saver, SnapshotCodec codec) {
        this.saver = Objects.requireNonNull(saver, "saver must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    public SaverCheckpointStore() {
        this(new MemorySaver(), new SnapshotCodec());
    }

    @Override
    public void save(MiningSnapshot snapshot) {
        var checkpoint = Checkpoint.builder()
                .id(UUID.randomUUID().toString())
                .state(Map.of(SNAPSHOT_KEY, codec.encode(snapshot)))
                .nodeId(MiningNode.WAIT_FOR_USER_FEEDBACK.id())
                .nextNodeId(StateGraph.START)
                .build();
        try {
            saver.put(threadConfig(snapshot.sessionId()), checkpoint);
            log.debug("Saved checkpoint '{}' for session '{}'", checkpoint.getId(), snapshot.sessionId());
        } catch (Exception e) {
            log.error("Failed to save checkpoint for session '{}'", snapshot.sessionId(), e);
            throw new IllegalStateException("Failed to save checkpoint for session " + snapshot.sessionId(), e);
        }
    }

    @Override
    public Optional<MiningSnapshot> load(String sessionId) {
        Optional<Checkpoint> latest = saver.get(threadConfig(sessionId));
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        Object raw = latest.get().getState().get(SNAPSHOT_KEY);
        if (!(raw instanceof String json)) {
            throw new CheckpointCorruptedException(sessionId,
                    "Checkpoint for session " + sessionId + " carries no snapshot", null);
        }
        return Optional.of(codec.decode(sessionId, json));
    }

    @Override
    public boolean delete(String sessionId) {
        var config = threadConfig(sessionId);
        if (saver.get(config).isEmpty()) {
            return false;
        }
        try {
            saver.release(config);
        } catch (Exception e) {
            log.error("Failed to release checkpoints for session '{}'", sessionId, e);
            throw new IllegalStateException("Failed to delete checkpoint for session " + sessionId, e);
        }
        return true;
    }

    @Override
    public String describe() {
        return "langgraph4j " + saver.getClass().getSimpleName();
    }

    private static RunnableConfig threadConfig(String sessionId) {
        return RunnableConfig.builder().threadId(sessionId).build();
    }
}

package com.reqminer.core.health;

import com.reqminer.core.graph.MiningGraph;
import com.reqminer.core.persistence.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String PROBE_SESSION = "health-probe";

    private final MiningGraph miningGraph;
    private final CheckpointStore checkpointStore;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) MiningGraph miningGraph,
            @Autowired(required = false) CheckpointStore checkpointStore,
            @Autowired(required = false) DataSource dataSource) {
        this.miningGraph = miningGraph;
        this.checkpointStore = checkpointStore;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkCheckpointStore());
        results.add(checkDatabase());
        return results;
    }

    private HealthStatus checkGraph() {
        if (miningGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkCheckpointStore() {
        if (checkpointStore == null) {
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "No checkpoint store configured", Map.of());
        }
        try {
            checkpointStore.load(PROBE_SESSION);
            return new HealthStatus("checkpoints", HealthStatus.Status.UP,
                    "Checkpoint store readable", Map.of("store", checkpointStore.describe()));
        } catch (RuntimeException e) {
            log.warn("Checkpoint store health check failed: {}", e.getMessage());
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "Checkpoint store error: " + e.getMessage(), Map.of("store", checkpointStore.describe()));
        }
    }

    /**
     * The database is optional. Without one, checkpoints live in memory.
     */
    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.UP,
                    "No DataSource configured; checkpoints held in memory", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }
}

package com.reqminer.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables of the mining workflow, bound from {@code reqminer.mining.*}.
 * <p>
 * Passed explicitly into the adapters that need them.
 */
@Component
@ConfigurationProperties(prefix = "reqminer.mining")
public class MiningProperties {

    private int maxClarificationRounds = 3;
    private int shortInputWordThreshold = 4;
    private int largeScopeWordThreshold = 25;
    private int maxPlanningHistory = 20;
    private Duration lockTimeout = Duration.ofSeconds(30);
    private String checkpointTable = "mining_checkpoints";

    public int getMaxClarificationRounds() {
        return maxClarificationRounds;
    }

    public void setMaxClarificationRounds(int maxClarificationRounds) {
        if (maxClarificationRounds < 0) {
            throw new IllegalArgumentException("maxClarificationRounds must not be negative");
        }
        this.maxClarificationRounds = maxClarificationRounds;
    }

    public int getShortInputWordThreshold() {
        return shortInputWordThreshold;
    }

    public void setShortInputWordThreshold(int shortInputWordThreshold) {
        this.shortInputWordThreshold = shortInputWordThreshold;
    }

    public int getLargeScopeWordThreshold() {
        return largeScopeWordThreshold;
    }

    public void setLargeScopeWordThreshold(int largeScopeWordThreshold) {
        this.largeScopeWordThreshold = largeScopeWordThreshold;
    }

    public int getMaxPlanningHistory() {
        return maxPlanningHistory;
    }

    public void setMaxPlanningHistory(int maxPlanningHistory) {
        if (maxPlanningHistory < 0) {
            throw new IllegalArgumentException("maxPlanningHistory must not be negative");
        }
        this.maxPlanningHistory = maxPlanningHistory;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public String getCheckpointTable() {
        return checkpointTable;
    }

    public void setCheckpointTable(String checkpointTable) {
        this.checkpointTable = checkpointTable;
    }
}

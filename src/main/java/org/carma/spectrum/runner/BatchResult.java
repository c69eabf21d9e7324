package org.carma.spectrum.runner;

import org.carma.spectrum.mechanism.*;
import org.carma.spectrum.model.*;

import java.util.*;

/**
 * Result of one scheduler batch for one algorithm.
 *
 * Contains:
 * - Successful and blocked counts, blocked counts per reason
 * - Final watermark and utilization of the run's ledger
 * - Decisions taken per load mode (adaptive strategies only)
 * - The committed circuits, in commit order
 */
public class BatchResult {

    private final String algorithm;
    private final Map<BlockReason, Integer> blockedByReason;
    private final Map<LoadMode, Integer> decisionsByMode;
    private final List<Circuit> circuits;
    private int successful;
    private int blocked;
    private int watermark;
    private double utilization;
    private long computationTimeMs;

    public BatchResult(String algorithm) {
        this.algorithm = algorithm;
        this.blockedByReason = new EnumMap<>(BlockReason.class);
        this.decisionsByMode = new EnumMap<>(LoadMode.class);
        this.circuits = new ArrayList<>();
    }

    // ========================================================================
    // Recording
    // ========================================================================

    BatchResult record(AllocationOutcome outcome) {
        if (outcome.isEstablished()) {
            successful++;
            outcome.getCircuit().ifPresent(circuits::add);
        } else {
            blocked++;
            outcome.getBlockReason().ifPresent(reason -> blockedByReason.merge(reason, 1, Integer::sum));
        }
        outcome.getLoadMode().ifPresent(mode -> decisionsByMode.merge(mode, 1, Integer::sum));
        return this;
    }

    BatchResult complete(SpectrumLedger ledger, long computationTimeMs) {
        this.watermark = ledger.getWatermark();
        this.utilization = ledger.utilization();
        this.computationTimeMs = computationTimeMs;
        return this;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public String getAlgorithm() { return algorithm; }
    public int getSuccessful() { return successful; }
    public int getBlocked() { return blocked; }
    public int getWatermark() { return watermark; }
    public double getUtilization() { return utilization; }
    public long getComputationTimeMs() { return computationTimeMs; }

    public int getTotalDemands() {
        return successful + blocked;
    }

    public int getBlocked(BlockReason reason) {
        return blockedByReason.getOrDefault(reason, 0);
    }

    public Map<BlockReason, Integer> getBlockedByReason() {
        return Collections.unmodifiableMap(blockedByReason);
    }

    public int getDecisions(LoadMode mode) {
        return decisionsByMode.getOrDefault(mode, 0);
    }

    public Map<LoadMode, Integer> getDecisionsByMode() {
        return Collections.unmodifiableMap(decisionsByMode);
    }

    public List<Circuit> getCircuits() {
        return Collections.unmodifiableList(circuits);
    }

    // ========================================================================
    // Computed Properties
    // ========================================================================

    /**
     * blocked / total, 0 for an empty batch.
     */
    public double getBlockingProbability() {
        int total = getTotalDemands();
        if (total == 0) return 0.0;
        return (double) blocked / total;
    }

    public double getSuccessRate() {
        int total = getTotalDemands();
        if (total == 0) return 0.0;
        return (double) successful / total;
    }

    /**
     * Established demands per slot of watermark, 0 when nothing is placed.
     */
    public double getSpectrumEfficiency() {
        if (watermark == 0) return 0.0;
        return (double) successful / watermark;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("BatchResult[").append(algorithm).append("]:\n");
        sb.append("  Demands: ").append(getTotalDemands())
          .append(" (successful=").append(successful).append(", blocked=").append(blocked).append(")\n");
        sb.append("  Watermark: ").append(watermark).append("\n");
        sb.append("  Utilization: ").append(String.format("%.4f", utilization)).append("\n");
        sb.append("  Blocking probability: ").append(String.format("%.4f", getBlockingProbability())).append("\n");
        if (!blockedByReason.isEmpty()) {
            sb.append("  Blocked by reason: ").append(blockedByReason).append("\n");
        }
        if (!decisionsByMode.isEmpty()) {
            sb.append("  Decisions by mode: ").append(decisionsByMode).append("\n");
        }
        return sb.toString();
    }
}

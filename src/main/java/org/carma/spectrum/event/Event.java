package org.carma.spectrum.event;

import org.carma.spectrum.mechanism.BlockReason;
import org.carma.spectrum.mechanism.LoadMode;

import java.time.Instant;
import java.util.List;

/**
 * Base interface for all allocation events.
 * Events give an audit trail of a batch run and let observers react to it.
 */
public sealed interface Event permits
        Event.CircuitEstablishedEvent,
        Event.DemandBlockedEvent,
        Event.LoadModeChangedEvent,
        Event.BatchCompleteEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * A demand was placed and its slots committed.
     */
    record CircuitEstablishedEvent(
            Instant timestamp,
            String algorithm,
            String demandId,
            List<String> path,
            int startSlot,
            int slotCount,
            String modulation,
            int watermarkAfter
    ) implements Event {
        public String eventType() { return "CIRCUIT_ESTABLISHED"; }
    }

    /**
     * A demand could not be placed.
     */
    record DemandBlockedEvent(
            Instant timestamp,
            String algorithm,
            String demandId,
            BlockReason reason
    ) implements Event {
        public String eventType() { return "DEMAND_BLOCKED"; }
    }

    /**
     * The adaptive allocator switched search regime.
     */
    record LoadModeChangedEvent(
            Instant timestamp,
            String algorithm,
            LoadMode previous,
            LoadMode current,
            int demandIndex
    ) implements Event {
        public String eventType() { return "LOAD_MODE_CHANGED"; }
    }

    /**
     * A scheduler batch finished.
     */
    record BatchCompleteEvent(
            Instant timestamp,
            String algorithm,
            int successful,
            int blocked,
            int watermark,
            double utilization,
            long computationTimeMs
    ) implements Event {
        public String eventType() { return "BATCH_COMPLETE"; }
    }
}

package org.carma.spectrum.mechanism;

import org.carma.spectrum.config.SpectrumConfig;
import org.carma.spectrum.model.*;
import org.carma.spectrum.network.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FirstFitAllocatorTest {

    /** Direct A-B (100 km) and a detour A-C-B (200 km). */
    private static NetworkGraph triangle() {
        return new NetworkGraph()
            .addLink("A", "B", 100)
            .addLink("A", "C", 100)
            .addLink("C", "B", 100);
    }

    @Test
    void placesOnShortestPathAtLowestFreeOffset() {
        NetworkGraph graph = triangle();
        SpectrumLedger ledger = new SpectrumLedger(graph, 320);
        assertTrue(ledger.commit(new int[] {0}, 0, 10));

        FirstFitAllocator allocator = new FirstFitAllocator(graph);
        AllocationOutcome outcome = allocator.allocate(new Demand("A", "B", 200), ledger);

        assertTrue(outcome.isEstablished());
        Circuit circuit = outcome.getCircuit().orElseThrow();
        assertEquals(List.of("A", "B"), circuit.getPath().getNodes());
        assertEquals(10, circuit.getStartSlot());
        // 200 Gbps on 16-QAM: 200 / 50 = 4 data slots + 1 guard
        assertEquals(5, circuit.getSlotCount());
        assertEquals("16-QAM", circuit.getModulation().getName());
        assertEquals(15, ledger.getWatermark());
        assertTrue(outcome.getLoadMode().isEmpty());
    }

    @Test
    void consecutiveDemandsStackUpward() {
        NetworkGraph graph = triangle();
        SpectrumLedger ledger = new SpectrumLedger(graph, 320);
        FirstFitAllocator allocator = new FirstFitAllocator(graph);

        Circuit first = allocator.allocate(new Demand("A", "B", 100), ledger).getCircuit().orElseThrow();
        Circuit second = allocator.allocate(new Demand("B", "A", 100), ledger).getCircuit().orElseThrow();

        assertEquals(0, first.getStartSlot());
        assertEquals(first.getEndSlot(), second.getStartSlot());
    }

    @Test
    void blocksWhenNodesAreDisconnected() {
        NetworkGraph graph = triangle().addNode("Z");
        AllocationOutcome outcome = new FirstFitAllocator(graph)
            .allocate(new Demand("A", "Z", 100), new SpectrumLedger(graph, 320));

        assertFalse(outcome.isEstablished());
        assertEquals(BlockReason.NO_PATH, outcome.getBlockReason().orElseThrow());
    }

    @Test
    void blocksWhenDemandExceedsCapacity() {
        NetworkGraph graph = triangle();
        SpectrumConfig small = new SpectrumConfig.Builder().slotCapacity(10).build();
        SpectrumLedger ledger = new SpectrumLedger(graph, small.getSlotCapacity());

        AllocationOutcome outcome = new FirstFitAllocator(graph, new YenPathFinder(), small)
            .allocate(new Demand("A", "B", 1000), ledger);

        assertEquals(BlockReason.NO_SPECTRUM, outcome.getBlockReason().orElseThrow());
        assertEquals(0, ledger.occupiedSlotCount());
    }

    @Test
    void blocksWhenPathDoesNotMapToLedger() {
        NetworkGraph graph = triangle();
        AllocationOutcome outcome = new FirstFitAllocator(graph)
            .allocate(new Demand("A", "B", 100), new SpectrumLedger(3, 320));

        assertEquals(BlockReason.UNRESOLVED_LINK, outcome.getBlockReason().orElseThrow());
    }

    @Test
    void failedCommitBlocksWithoutRetry() {
        NetworkGraph graph = triangle();
        RejectingLedger ledger = new RejectingLedger(graph, 320);

        AllocationOutcome outcome = new FirstFitAllocator(graph).allocate(new Demand("A", "B", 200), ledger);

        assertFalse(outcome.isEstablished());
        assertEquals(BlockReason.COMMIT_CONFLICT, outcome.getBlockReason().orElseThrow());
        assertEquals(1, ledger.commitCalls());
        assertArrayEquals(new int[] {0}, ledger.attemptedLinks.get(0));
        assertEquals(0, ledger.occupiedSlotCount());
        assertEquals(0, ledger.getWatermark());
    }

    @Test
    void doesNotTryAlternatePathWhenShortestIsFull() {
        NetworkGraph graph = triangle();
        SpectrumLedger ledger = new SpectrumLedger(graph, 20);
        assertTrue(ledger.commit(new int[] {0}, 0, 20));

        SpectrumConfig config = new SpectrumConfig.Builder().slotCapacity(20).build();
        AllocationOutcome outcome = new FirstFitAllocator(graph, new YenPathFinder(), config)
            .allocate(new Demand("A", "B", 100), ledger);

        assertEquals(BlockReason.NO_SPECTRUM, outcome.getBlockReason().orElseThrow());
    }
}

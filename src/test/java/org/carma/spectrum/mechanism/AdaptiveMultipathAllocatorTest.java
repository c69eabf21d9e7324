package org.carma.spectrum.mechanism;

import org.carma.spectrum.config.SpectrumConfig;
import org.carma.spectrum.model.*;
import org.carma.spectrum.network.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveMultipathAllocatorTest {

    private static final int[] DIRECT = {0};

    /** Direct A-B (1 hop) and a detour A-C-B (2 hops), all 16-QAM distances. */
    private static NetworkGraph triangle() {
        return new NetworkGraph()
            .addLink("A", "B", 100)
            .addLink("A", "C", 100)
            .addLink("C", "B", 100);
    }

    /** Direct link holds [0, 10), so the global watermark is 10. */
    private static SpectrumLedger ledgerWithBusyDirectLink(NetworkGraph graph) {
        SpectrumLedger ledger = new SpectrumLedger(graph, 320);
        assertTrue(ledger.commit(DIRECT, 0, 10));
        return ledger;
    }

    @Test
    void normalModePrefersZeroWatermarkIncreaseOverShorterPath() {
        NetworkGraph graph = triangle();
        SpectrumLedger ledger = ledgerWithBusyDirectLink(graph);
        AdaptiveMultipathAllocator allocator = new AdaptiveMultipathAllocator(graph);
        assertEquals(LoadMode.NORMAL, allocator.currentMode(ledger));

        // 5 slots: direct path raises the watermark by 5, the detour fits below it
        AllocationOutcome outcome = allocator.allocate(new Demand("A", "B", 200), ledger);

        assertTrue(outcome.isEstablished());
        Circuit circuit = outcome.getCircuit().orElseThrow();
        assertEquals(List.of("A", "C", "B"), circuit.getPath().getNodes());
        assertEquals(0, circuit.getStartSlot());
        assertEquals(5, circuit.getSlotCount());
        assertEquals(10, ledger.getWatermark());
        assertEquals(LoadMode.NORMAL, outcome.getLoadMode().orElseThrow());
    }

    @Test
    void failedCommitBlocksWithoutTryingSecondCandidate() {
        NetworkGraph graph = triangle();
        RejectingLedger ledger = new RejectingLedger(graph, 320);
        AdaptiveMultipathAllocator allocator = new AdaptiveMultipathAllocator(graph);

        // both the direct path and the detour are feasible; only the best is attempted
        AllocationOutcome outcome = allocator.allocate(new Demand("A", "B", 200), ledger);

        assertFalse(outcome.isEstablished());
        assertEquals(BlockReason.COMMIT_CONFLICT, outcome.getBlockReason().orElseThrow());
        assertEquals(LoadMode.NORMAL, outcome.getLoadMode().orElseThrow());
        assertEquals(1, ledger.commitCalls());
        assertArrayEquals(DIRECT, ledger.attemptedLinks.get(0));
        assertEquals(0, ledger.occupiedSlotCount());
        assertEquals(0, ledger.getWatermark());
    }

    @Test
    void normalModeFallsBackToShortPathOnEqualWatermark() {
        NetworkGraph graph = triangle();
        SpectrumLedger ledger = new SpectrumLedger(graph, 320);

        AllocationOutcome outcome = new AdaptiveMultipathAllocator(graph)
            .allocate(new Demand("A", "B", 200), ledger);

        assertEquals(List.of("A", "B"), outcome.getCircuit().orElseThrow().getPath().getNodes());
        assertEquals(0, outcome.getCircuit().orElseThrow().getStartSlot());
    }

    @Test
    void highModeRanksShortPathFirst() {
        NetworkGraph graph = triangle();
        SpectrumConfig config = new SpectrumConfig.Builder()
            .highLoadThresholds(0.0, 0.0)
            .build();
        SpectrumLedger ledger = ledgerWithBusyDirectLink(graph);
        AdaptiveMultipathAllocator allocator =
            new AdaptiveMultipathAllocator(graph, new YenPathFinder(), config);
        assertEquals(LoadMode.HIGH, allocator.currentMode(ledger));

        AllocationOutcome outcome = allocator.allocate(new Demand("A", "B", 200), ledger);

        Circuit circuit = outcome.getCircuit().orElseThrow();
        assertEquals(List.of("A", "B"), circuit.getPath().getNodes());
        assertEquals(10, circuit.getStartSlot());
        assertEquals(LoadMode.HIGH, outcome.getLoadMode().orElseThrow());
    }

    @Test
    void extremeModeTakesFirstFeasibleCandidate() {
        NetworkGraph graph = triangle();
        SpectrumConfig config = new SpectrumConfig.Builder()
            .highLoadThresholds(0.0, 0.0)
            .extremeLoadThresholds(0.0, 0.0)
            .build();
        SpectrumLedger ledger = ledgerWithBusyDirectLink(graph);
        AdaptiveMultipathAllocator allocator =
            new AdaptiveMultipathAllocator(graph, new YenPathFinder(), config);
        assertEquals(LoadMode.EXTREME, allocator.currentMode(ledger));

        AllocationOutcome outcome = allocator.allocate(new Demand("A", "B", 200), ledger);

        Circuit circuit = outcome.getCircuit().orElseThrow();
        assertEquals(List.of("A", "B"), circuit.getPath().getNodes());
        assertEquals(10, circuit.getStartSlot());
        assertEquals(LoadMode.EXTREME, outcome.getLoadMode().orElseThrow());
    }

    @Test
    void emptyLedgerIsNormalEvenWithZeroThresholds() {
        NetworkGraph graph = triangle();
        SpectrumConfig config = new SpectrumConfig.Builder()
            .highLoadThresholds(0.0, 0.0)
            .extremeLoadThresholds(0.0, 0.0)
            .build();
        AdaptiveMultipathAllocator allocator =
            new AdaptiveMultipathAllocator(graph, new YenPathFinder(), config);

        assertEquals(LoadMode.NORMAL, allocator.currentMode(new SpectrumLedger(graph, 320)));
    }

    @Test
    void usesAlternatePathWhenShortestIsFull() {
        NetworkGraph graph = triangle();
        SpectrumConfig config = new SpectrumConfig.Builder().slotCapacity(20).build();
        SpectrumLedger ledger = new SpectrumLedger(graph, 20);
        assertTrue(ledger.commit(DIRECT, 0, 20));

        AllocationOutcome outcome = new AdaptiveMultipathAllocator(graph, new YenPathFinder(), config)
            .allocate(new Demand("A", "B", 100), ledger);

        assertTrue(outcome.isEstablished());
        assertEquals(List.of("A", "C", "B"), outcome.getCircuit().orElseThrow().getPath().getNodes());
        // a full direct link puts the ledger in extreme mode
        assertEquals(LoadMode.EXTREME, outcome.getLoadMode().orElseThrow());
    }

    @Test
    void blockReasons() {
        NetworkGraph graph = triangle().addNode("Z");
        AdaptiveMultipathAllocator allocator = new AdaptiveMultipathAllocator(graph);

        assertEquals(BlockReason.NO_PATH, allocator
            .allocate(new Demand("A", "Z", 100), new SpectrumLedger(graph, 320))
            .getBlockReason().orElseThrow());

        assertEquals(BlockReason.UNRESOLVED_LINK, allocator
            .allocate(new Demand("A", "B", 100), new SpectrumLedger(3, 320))
            .getBlockReason().orElseThrow());

        SpectrumConfig small = new SpectrumConfig.Builder().slotCapacity(10).build();
        SpectrumLedger ledger = new SpectrumLedger(graph, 10);
        AllocationOutcome outcome = new AdaptiveMultipathAllocator(graph, new YenPathFinder(), small)
            .allocate(new Demand("A", "B", 1000), ledger);
        assertEquals(BlockReason.NO_SPECTRUM, outcome.getBlockReason().orElseThrow());
        assertEquals(LoadMode.NORMAL, outcome.getLoadMode().orElseThrow());
        assertEquals(0, ledger.occupiedSlotCount());
    }

    @Test
    void candidateEvaluationDoesNotMutateLedger() {
        NetworkGraph graph = triangle();
        SpectrumLedger ledger = ledgerWithBusyDirectLink(graph);
        NetworkPath detour = new NetworkPath(List.of("A", "C", "B"), 200);
        int[] links = ledger.resolveLinks(detour).orElseThrow();

        PlacementCandidate candidate = PlacementCandidate.evaluate(
            ledger, detour, links, 12, 5, ModulationTable.DEFAULT.select(200));

        assertEquals(7, candidate.getWatermarkIncrease());
        assertEquals(17, candidate.getResultingWatermark());
        assertEquals(17.0, candidate.getAverageWatermark());
        assertEquals(2, candidate.getPathLength());
        assertEquals(10, ledger.getWatermark());
        assertEquals(10, ledger.occupiedSlotCount());
    }

    @Test
    void comparatorsAreLexicographic() {
        NetworkGraph graph = triangle();
        SpectrumLedger ledger = ledgerWithBusyDirectLink(graph);
        ModulationFormat format = ModulationTable.DEFAULT.select(100);
        NetworkPath direct = new NetworkPath(List.of("A", "B"), 100);
        NetworkPath detour = new NetworkPath(List.of("A", "C", "B"), 200);

        PlacementCandidate directHigh = PlacementCandidate.evaluate(ledger, direct, DIRECT, 10, 5, format);
        PlacementCandidate detourLow = PlacementCandidate.evaluate(
            ledger, detour, ledger.resolveLinks(detour).orElseThrow(), 0, 5, format);

        assertTrue(PlacementCandidate.WATERMARK_ORDER.compare(detourLow, directHigh) < 0);
        assertTrue(PlacementCandidate.SHORT_PATH_ORDER.compare(directHigh, detourLow) < 0);
    }
}

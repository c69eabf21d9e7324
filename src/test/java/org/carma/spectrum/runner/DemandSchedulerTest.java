package org.carma.spectrum.runner;

import org.carma.spectrum.config.SpectrumConfig;
import org.carma.spectrum.event.*;
import org.carma.spectrum.mechanism.*;
import org.carma.spectrum.model.*;
import org.carma.spectrum.network.*;
import org.carma.spectrum.runner.DemandScheduler.ComparisonResult;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class DemandSchedulerTest {

    private static NetworkGraph triangle() {
        return new NetworkGraph()
            .addLink("A", "B", 100)
            .addLink("A", "C", 100)
            .addLink("C", "B", 100);
    }

    private static List<Demand> threeDirectDemands() {
        return List.of(
            new Demand("D1", "A", "B", 200),
            new Demand("D2", "A", "B", 200),
            new Demand("D3", "A", "B", 200));
    }

    @Test
    void sortsByDescendingBandwidthKeepingInputOrderOnTies() {
        Demand d1 = new Demand("D1", "A", "B", 100);
        Demand d2 = new Demand("D2", "A", "C", 300);
        Demand d3 = new Demand("D3", "B", "C", 100);
        Demand d4 = new Demand("D4", "C", "A", 300);

        List<Demand> sorted = DemandScheduler.sortByBandwidth(List.of(d1, d2, d3, d4));
        assertEquals(List.of(d2, d4, d1, d3), sorted);
    }

    @Test
    void processesLargestDemandFirst() {
        NetworkGraph graph = triangle();
        DemandScheduler scheduler = new DemandScheduler(graph, SpectrumConfig.DEFAULT);

        BatchResult result = scheduler.run(List.of(
            new Demand("small", "A", "B", 50),
            new Demand("large", "A", "B", 400)), new FirstFitAllocator(graph));

        assertEquals("large", result.getCircuits().get(0).getDemand().getId());
        assertEquals(0, result.getCircuits().get(0).getStartSlot());
    }

    @Test
    void emptyBatch() {
        EventBus bus = new EventBus();
        DemandScheduler scheduler = new DemandScheduler(triangle(), SpectrumConfig.DEFAULT).eventBus(bus);

        BatchResult result = scheduler.run(List.of(), new FirstFitAllocator(triangle()));

        assertEquals(0, result.getTotalDemands());
        assertEquals(0.0, result.getBlockingProbability());
        assertEquals(0.0, result.getSuccessRate());
        assertEquals(0.0, result.getSpectrumEfficiency());
        assertEquals(0, result.getWatermark());
        assertEquals(1, bus.getEventCount(Event.BatchCompleteEvent.class));
    }

    @Test
    void countsOutcomesAndBlockReasons() {
        NetworkGraph graph = triangle().addNode("Z");
        DemandScheduler scheduler = new DemandScheduler(graph, SpectrumConfig.DEFAULT);

        BatchResult result = scheduler.run(List.of(
            new Demand("ok1", "A", "B", 100),
            new Demand("lost", "A", "Z", 100),
            new Demand("ok2", "B", "C", 100)), new FirstFitAllocator(graph));

        assertEquals(3, result.getTotalDemands());
        assertEquals(2, result.getSuccessful());
        assertEquals(1, result.getBlocked());
        assertEquals(1, result.getBlocked(BlockReason.NO_PATH));
        assertEquals(0, result.getBlocked(BlockReason.NO_SPECTRUM));
        assertEquals(1.0 / 3, result.getBlockingProbability(), 1e-12);
        assertEquals(2.0 / 3, result.getSuccessRate(), 1e-12);
        assertEquals(2.0 / result.getWatermark(), result.getSpectrumEfficiency(), 1e-12);
        assertTrue(result.getDecisionsByMode().isEmpty());
    }

    @Test
    void selfDemandIsBlockedAndBatchCompletes() {
        NetworkGraph nsfnet = Topologies.nsfnet();
        List<Demand> demands = List.of(
            new Demand("self", "0", "0", 100),
            new Demand("ok", "0", "1", 100));

        for (SpectrumAllocator allocator : List.of(
                new FirstFitAllocator(nsfnet), new AdaptiveMultipathAllocator(nsfnet))) {
            EventBus bus = new EventBus();
            List<String> blockedIds = new ArrayList<>();
            bus.subscribe(Event.DemandBlockedEvent.class, e -> blockedIds.add(e.demandId()));

            BatchResult result = new DemandScheduler(nsfnet, SpectrumConfig.DEFAULT).eventBus(bus)
                .run(demands, allocator);

            assertEquals(2, result.getTotalDemands());
            assertEquals(1, result.getSuccessful());
            assertEquals(1, result.getBlocked());
            assertEquals(1, result.getBlocked(BlockReason.NO_PATH));
            assertEquals(List.of("self"), blockedIds);
            assertEquals(1, bus.getEventCount(Event.BatchCompleteEvent.class));
        }
    }

    @Test
    void zeroBandwidthDemandTakesOneSlot() {
        NetworkGraph graph = triangle();
        DemandScheduler scheduler = new DemandScheduler(graph, SpectrumConfig.DEFAULT);

        BatchResult result = scheduler.run(List.of(new Demand("empty", "A", "B", 0)),
            new FirstFitAllocator(graph));

        assertEquals(1, result.getSuccessful());
        assertEquals(1, result.getCircuits().get(0).getSlotCount());
        assertEquals(1, result.getWatermark());
    }

    @Test
    void blockingProbabilityStaysInUnitInterval() {
        NetworkGraph graph = Topologies.nsfnet();
        SpectrumConfig tight = new SpectrumConfig.Builder().slotCapacity(40).build();
        DemandScheduler scheduler = new DemandScheduler(graph, tight);

        List<Demand> demands = new ArrayList<>();
        Random random = new Random(3);
        for (int i = 0; i < 60; i++) {
            int o = random.nextInt(14);
            int d = (o + 1 + random.nextInt(13)) % 14;
            demands.add(new Demand(String.valueOf(o), String.valueOf(d), 50 + random.nextInt(350)));
        }

        for (SpectrumAllocator allocator : List.of(
                new FirstFitAllocator(graph, new YenPathFinder(), tight),
                new AdaptiveMultipathAllocator(graph, new YenPathFinder(), tight))) {
            BatchResult result = scheduler.run(demands, allocator);
            assertEquals(60, result.getTotalDemands());
            assertTrue(result.getBlockingProbability() >= 0.0 && result.getBlockingProbability() <= 1.0);
            assertEquals((double) result.getBlocked() / 60, result.getBlockingProbability(), 1e-12);
            assertTrue(result.getWatermark() <= 40);
            assertEquals(result.getSuccessful(), result.getCircuits().size());
        }
    }

    @Test
    void publishesOneEventPerDemandPlusCompletion() {
        NetworkGraph graph = triangle().addNode("Z");
        EventBus bus = new EventBus();
        List<String> blockedIds = new ArrayList<>();
        bus.subscribe(Event.DemandBlockedEvent.class, e -> blockedIds.add(e.demandId()));

        new DemandScheduler(graph, SpectrumConfig.DEFAULT).eventBus(bus).run(List.of(
            new Demand("ok", "A", "B", 100),
            new Demand("lost", "A", "Z", 100)), new AdaptiveMultipathAllocator(graph));

        assertEquals(1, bus.getEventCount(Event.CircuitEstablishedEvent.class));
        assertEquals(1, bus.getEventCount(Event.DemandBlockedEvent.class));
        assertEquals(List.of("lost"), blockedIds);

        Event.BatchCompleteEvent done = bus.getHistory(Event.BatchCompleteEvent.class).get(0);
        assertEquals(AdaptiveMultipathAllocator.NAME, done.algorithm());
        assertEquals(1, done.successful());
        assertEquals(1, done.blocked());
    }

    @Test
    void reportsLoadModeChanges() {
        NetworkGraph graph = triangle();
        SpectrumConfig config = new SpectrumConfig.Builder().highLoadThresholds(0.0, 0.0).build();
        EventBus bus = new EventBus();

        BatchResult result = new DemandScheduler(graph, config).eventBus(bus)
            .run(threeDirectDemands(), new AdaptiveMultipathAllocator(graph, new YenPathFinder(), config));

        assertEquals(1, result.getDecisions(LoadMode.NORMAL));
        assertEquals(2, result.getDecisions(LoadMode.HIGH));
        assertEquals(0, result.getDecisions(LoadMode.EXTREME));

        List<Event.LoadModeChangedEvent> changes = bus.getHistory(Event.LoadModeChangedEvent.class);
        assertEquals(1, changes.size());
        assertEquals(LoadMode.NORMAL, changes.get(0).previous());
        assertEquals(LoadMode.HIGH, changes.get(0).current());
        assertEquals(1, changes.get(0).demandIndex());
    }

    @Test
    void eachRunGetsAFreshLedger() {
        NetworkGraph graph = triangle();
        DemandScheduler scheduler = new DemandScheduler(graph, SpectrumConfig.DEFAULT);
        FirstFitAllocator allocator = new FirstFitAllocator(graph);

        BatchResult first = scheduler.run(threeDirectDemands(), allocator);
        BatchResult second = scheduler.run(threeDirectDemands(), allocator);

        assertEquals(15, first.getWatermark());
        assertEquals(first.getWatermark(), second.getWatermark());
    }

    @Test
    void runsOnCallerOwnedLedger() {
        NetworkGraph graph = triangle();
        DemandScheduler scheduler = new DemandScheduler(graph, SpectrumConfig.DEFAULT);
        SpectrumLedger ledger = scheduler.newLedger();
        assertTrue(ledger.commit(new int[] {0}, 0, 20));

        BatchResult result = scheduler.run(threeDirectDemands(), new FirstFitAllocator(graph), ledger);

        assertEquals(35, result.getWatermark());
        assertEquals(35, ledger.getWatermark());
        assertEquals(20, result.getCircuits().get(0).getStartSlot());
    }

    @Test
    void compareUsesIndependentLedgers() {
        NetworkGraph graph = triangle();
        DemandScheduler scheduler = new DemandScheduler(graph, SpectrumConfig.DEFAULT);

        ComparisonResult result = scheduler.compare(threeDirectDemands(),
            new FirstFitAllocator(graph), new AdaptiveMultipathAllocator(graph));

        // first-fit stacks all three on the direct link; the adaptive allocator
        // moves the second demand onto the detour below the watermark
        assertEquals(15, result.baseline.getWatermark());
        assertEquals(10, result.candidate.getWatermark());
        assertEquals(5, result.getWatermarkImprovement());
        assertEquals(0.0, result.getBlockingImprovement());
        assertEquals(FirstFitAllocator.NAME, result.baseline.getAlgorithm());
        assertEquals(AdaptiveMultipathAllocator.NAME, result.candidate.getAlgorithm());
    }
}

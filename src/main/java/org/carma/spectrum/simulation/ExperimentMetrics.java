package org.carma.spectrum.simulation;

import org.carma.spectrum.runner.BatchResult;
import org.carma.spectrum.runner.DemandScheduler.ComparisonResult;

import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * Collects head-to-head comparisons across demand loads and reports per-load averages.
 */
public class ExperimentMetrics {

    private final Map<Integer, List<ComparisonResult>> resultsByLoad;
    private final long startTimeMs;
    private long elapsedMs;

    public ExperimentMetrics() {
        this.resultsByLoad = new TreeMap<>();
        this.startTimeMs = System.currentTimeMillis();
    }

    // ========================================================================
    // Recording
    // ========================================================================

    public void record(int demandLoad, ComparisonResult result) {
        resultsByLoad.computeIfAbsent(demandLoad, k -> new ArrayList<>()).add(result);
        elapsedMs = System.currentTimeMillis() - startTimeMs;
    }

    // ========================================================================
    // Analysis
    // ========================================================================

    public Set<Integer> getLoads() {
        return Collections.unmodifiableSet(resultsByLoad.keySet());
    }

    public int getRunCount(int demandLoad) {
        return resultsByLoad.getOrDefault(demandLoad, List.of()).size();
    }

    public int getTotalRuns() {
        return resultsByLoad.values().stream().mapToInt(List::size).sum();
    }

    public List<ComparisonResult> getResults(int demandLoad) {
        return new ArrayList<>(resultsByLoad.getOrDefault(demandLoad, List.of()));
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    /**
     * Averages over every run recorded for one load.
     */
    public LoadSummary summarize(int demandLoad) {
        List<ComparisonResult> runs = resultsByLoad.getOrDefault(demandLoad, List.of());
        return new LoadSummary(demandLoad, runs.size(),
            average(runs, r -> r.baseline.getWatermark()),
            average(runs, r -> r.candidate.getWatermark()),
            average(runs, r -> r.baseline.getBlockingProbability()),
            average(runs, r -> r.candidate.getBlockingProbability()),
            average(runs, r -> r.baseline.getUtilization()),
            average(runs, r -> r.candidate.getUtilization()));
    }

    public List<LoadSummary> summarizeAll() {
        List<LoadSummary> summaries = new ArrayList<>();
        for (int load : resultsByLoad.keySet()) {
            summaries.add(summarize(load));
        }
        return summaries;
    }

    /**
     * Mean of the per-load watermark improvements.
     */
    public double getAverageWatermarkImprovement() {
        return summarizeAll().stream()
            .mapToDouble(LoadSummary::getWatermarkImprovement)
            .average().orElse(0);
    }

    public double getAverageBlockingImprovement() {
        return summarizeAll().stream()
            .mapToDouble(LoadSummary::getBlockingImprovement)
            .average().orElse(0);
    }

    private static double average(List<ComparisonResult> runs, ToDoubleFunction<ComparisonResult> metric) {
        return runs.stream().mapToDouble(metric).average().orElse(0);
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public String getSummary() {
        String baseline = algorithmName(true);
        String candidate = algorithmName(false);

        StringBuilder sb = new StringBuilder();
        sb.append("Experiment Summary:\n");
        sb.append(String.format("  Runs: %d across %d loads (%.2f seconds)\n",
            getTotalRuns(), resultsByLoad.size(), elapsedMs / 1000.0));
        sb.append(String.format("  %6s | %10s %10s %8s | %10s %10s %8s%n",
            "Load", baseline + " WM", candidate + " WM", "Δ WM",
            baseline + " BP", candidate + " BP", "Δ BP"));
        sb.append("  ").append("-".repeat(78)).append("\n");
        for (LoadSummary s : summarizeAll()) {
            sb.append(String.format("  %6d | %10.2f %10.2f %8.2f | %10.4f %10.4f %8.4f%n",
                s.getDemandLoad(),
                s.getBaselineWatermark(), s.getCandidateWatermark(), s.getWatermarkImprovement(),
                s.getBaselineBlocking(), s.getCandidateBlocking(), s.getBlockingImprovement()));
        }
        sb.append(String.format("  Average watermark improvement: %.2f slots\n", getAverageWatermarkImprovement()));
        sb.append(String.format("  Average blocking improvement: %.4f\n", getAverageBlockingImprovement()));
        return sb.toString();
    }

    private String algorithmName(boolean baseline) {
        for (List<ComparisonResult> runs : resultsByLoad.values()) {
            if (!runs.isEmpty()) {
                BatchResult batch = baseline ? runs.get(0).baseline : runs.get(0).candidate;
                return batch.getAlgorithm();
            }
        }
        return baseline ? "baseline" : "candidate";
    }

    @Override
    public String toString() {
        return String.format("ExperimentMetrics[%d loads, %d runs, Δwatermark=%.2f]",
            resultsByLoad.size(), getTotalRuns(), getAverageWatermarkImprovement());
    }

    // ========================================================================
    // LoadSummary
    // ========================================================================

    /**
     * Averages for one demand load. Improvements are baseline minus candidate.
     */
    public static class LoadSummary {
        private final int demandLoad;
        private final int runs;
        private final double baselineWatermark;
        private final double candidateWatermark;
        private final double baselineBlocking;
        private final double candidateBlocking;
        private final double baselineUtilization;
        private final double candidateUtilization;

        LoadSummary(int demandLoad, int runs,
                    double baselineWatermark, double candidateWatermark,
                    double baselineBlocking, double candidateBlocking,
                    double baselineUtilization, double candidateUtilization) {
            this.demandLoad = demandLoad;
            this.runs = runs;
            this.baselineWatermark = baselineWatermark;
            this.candidateWatermark = candidateWatermark;
            this.baselineBlocking = baselineBlocking;
            this.candidateBlocking = candidateBlocking;
            this.baselineUtilization = baselineUtilization;
            this.candidateUtilization = candidateUtilization;
        }

        public int getDemandLoad() { return demandLoad; }
        public int getRuns() { return runs; }
        public double getBaselineWatermark() { return baselineWatermark; }
        public double getCandidateWatermark() { return candidateWatermark; }
        public double getBaselineBlocking() { return baselineBlocking; }
        public double getCandidateBlocking() { return candidateBlocking; }
        public double getBaselineUtilization() { return baselineUtilization; }
        public double getCandidateUtilization() { return candidateUtilization; }

        public double getWatermarkImprovement() {
            return baselineWatermark - candidateWatermark;
        }

        public double getBlockingImprovement() {
            return baselineBlocking - candidateBlocking;
        }
    }
}

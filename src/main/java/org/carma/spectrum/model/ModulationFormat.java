package org.carma.spectrum.model;

import java.util.Objects;

/**
 * A signal encoding scheme trading optical reach for spectral efficiency.
 * Each format has a display name, a maximum transparent reach and the
 * number of bits carried per second per Hz.
 */
public final class ModulationFormat {

    private final String name;
    private final double maxReachKm;
    private final double spectralEfficiency;

    public ModulationFormat(String name, double maxReachKm, double spectralEfficiency) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Modulation name cannot be empty");
        }
        if (maxReachKm <= 0) {
            throw new IllegalArgumentException("Reach must be positive for " + name + ": " + maxReachKm);
        }
        if (spectralEfficiency <= 0) {
            throw new IllegalArgumentException(
                "Spectral efficiency must be positive for " + name + ": " + spectralEfficiency);
        }
        this.name = name;
        this.maxReachKm = maxReachKm;
        this.spectralEfficiency = spectralEfficiency;
    }

    public String getName() {
        return name;
    }

    public double getMaxReachKm() {
        return maxReachKm;
    }

    /**
     * Bits per second per Hz.
     */
    public double getSpectralEfficiency() {
        return spectralEfficiency;
    }

    public boolean reaches(double distanceKm) {
        return distanceKm <= maxReachKm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModulationFormat)) return false;
        ModulationFormat other = (ModulationFormat) o;
        return name.equals(other.name)
            && Double.compare(maxReachKm, other.maxReachKm) == 0
            && Double.compare(spectralEfficiency, other.spectralEfficiency) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, maxReachKm, spectralEfficiency);
    }

    @Override
    public String toString() {
        return String.format("%s(%.0f km, %.1f b/s/Hz)", name, maxReachKm, spectralEfficiency);
    }
}

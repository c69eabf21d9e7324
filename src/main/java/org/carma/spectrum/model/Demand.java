package org.carma.spectrum.model;

/**
 * A bandwidth request between two nodes.
 *
 * Demands are created by a generator, consumed once by the scheduler and end
 * either as a committed circuit or as blocked.
 *
 * A demand whose origin equals its destination is accepted here and blocked
 * by the allocators for lack of a path. A non-positive bandwidth still sizes
 * to the one-slot minimum.
 */
public final class Demand {

    private final String id;
    private final String origin;
    private final String destination;
    private final double bandwidthGbps;

    public Demand(String id, String origin, String destination, double bandwidthGbps) {
        if (origin == null || destination == null) {
            throw new IllegalArgumentException("Demand endpoints cannot be null");
        }
        if (Double.isNaN(bandwidthGbps) || Double.isInfinite(bandwidthGbps)) {
            throw new IllegalArgumentException("Bandwidth must be finite: " + bandwidthGbps);
        }
        this.id = id;
        this.origin = origin;
        this.destination = destination;
        this.bandwidthGbps = bandwidthGbps;
    }

    public Demand(String origin, String destination, double bandwidthGbps) {
        this(origin + "->" + destination, origin, destination, bandwidthGbps);
    }

    public String getId() {
        return id;
    }

    public String getOrigin() {
        return origin;
    }

    public String getDestination() {
        return destination;
    }

    public double getBandwidthGbps() {
        return bandwidthGbps;
    }

    @Override
    public String toString() {
        return String.format("Demand[%s: %s -> %s, %.1f Gbps]", id, origin, destination, bandwidthGbps);
    }
}

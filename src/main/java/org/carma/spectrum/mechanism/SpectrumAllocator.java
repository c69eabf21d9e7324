package org.carma.spectrum.mechanism;

import org.carma.spectrum.model.*;

/**
 * Strategy that routes one demand and reserves its spectrum.
 *
 * Implementations read and commit to the ledger they are given; they keep no
 * ledger state of their own, so one allocator can serve independent runs as
 * long as each run has its own ledger.
 *
 * Failures to place a demand are reported as blocked outcomes, never thrown.
 */
public interface SpectrumAllocator {

    /**
     * Short identifier used in results and reports.
     */
    String getName();

    /**
     * Route the demand, choose a slot window and commit it to the ledger.
     *
     * @param demand the demand to place
     * @param ledger occupancy the placement is checked against and committed to
     * @return established circuit or block reason
     */
    AllocationOutcome allocate(Demand demand, SpectrumLedger ledger);
}

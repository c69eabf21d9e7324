package org.carma.spectrum.config;

import org.carma.spectrum.model.ModulationFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpectrumConfigTest {

    @Test
    void defaults() {
        SpectrumConfig config = SpectrumConfig.DEFAULT;
        assertEquals(320, config.getSlotCapacity());
        assertEquals(12.5, config.getSlotWidthGhz());
        assertEquals(1, config.getGuardBandSlots());
        assertEquals(4, config.getModulationTable().getFormats().size());
        assertEquals(3, config.getDefaultPathCount());
        assertEquals(5, config.getHighLoadPathCount());
        assertEquals(3, config.getExtremeLoadPathCount());
        assertEquals(0.70, config.getHighWatermarkRatio());
        assertEquals(0.18, config.getExtremeUtilization());
        assertEquals(10, config.getNormalOffsetLimit());
        assertEquals(3, config.getHighOffsetLimit());
    }

    @Test
    void collectsEveryValidationError() {
        ConfigValidationException e = assertThrows(ConfigValidationException.class, () ->
            new SpectrumConfig.Builder()
                .slotCapacity(0)
                .defaultPathCount(0)
                .highLoadThresholds(1.5, 0.1)
                .build());

        assertEquals("spectrum", e.getSource());
        assertEquals(4, e.getErrors().size(), e.getErrors().toString());
        assertTrue(e.getErrors().stream().anyMatch(err -> err.contains("slotCapacity")));
        assertTrue(e.getErrors().stream().anyMatch(err -> err.contains("defaultPathCount")));
    }

    @Test
    void extremeThresholdsMayNotUndercutHighThresholds() {
        ConfigValidationException e = assertThrows(ConfigValidationException.class, () ->
            new SpectrumConfig.Builder()
                .highLoadThresholds(0.8, 0.2)
                .extremeLoadThresholds(0.5, 0.1)
                .build());
        assertEquals(2, e.getErrors().size());
    }

    @Test
    void modulationTableProblemsAreReportedAsConfigErrors() {
        ConfigValidationException e = assertThrows(ConfigValidationException.class, () ->
            new SpectrumConfig.Builder()
                .modulationFormats(List.of())
                .slotWidthGhz(12.5)
                .build());
        assertEquals(1, e.getErrors().size());
        assertTrue(e.getMessage().contains("spectrum"));
    }

    @Test
    void toBuilderRoundTripsSettings() {
        SpectrumConfig custom = new SpectrumConfig.Builder()
            .slotCapacity(160)
            .guardBandSlots(0)
            .modulationFormats(List.of(new ModulationFormat("QPSK", 2000, 2)))
            .offsetLimits(4, 2)
            .build();

        SpectrumConfig copy = custom.toBuilder().build();
        assertEquals(160, copy.getSlotCapacity());
        assertEquals(0, copy.getGuardBandSlots());
        assertEquals("QPSK", copy.getModulationTable().select(100).getName());
        assertEquals(4, copy.getNormalOffsetLimit());
        assertEquals(2, copy.getHighOffsetLimit());
    }
}

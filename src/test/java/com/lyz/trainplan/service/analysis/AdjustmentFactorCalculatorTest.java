package com.lyz.trainplan.service.analysis;

import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.enums.AdjustmentMode;
import com.lyz.trainplan.service.analysis.AdjustmentFactorCalculator.LoadAdjustment;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdjustmentFactorCalculatorTest {

    private final AdjustmentFactorCalculator calculator = new AdjustmentFactorCalculator();

    private static ReadinessSnapshot readiness(int score, Integer sleep, Integer stress) {
        return ReadinessSnapshot.builder().score(score).sleepQuality(sleep).stressLevel(stress).build();
    }

    @Test
    void low_score_and_poor_sleep_compose() {
        LoadAdjustment load = calculator.calculate(AdjustmentMode.AUTO, readiness(40, 30, null));

        assertEquals(0.63, load.getFactor(), 1e-9);
        assertTrue(load.isNeedsMoreRecovery());
        assertEquals(2, load.getRationale().size());
        assertEquals("Reduced intensity due to low readiness", load.getRationale().get(0));
    }

    @Test
    void all_auto_rules_multiply() {
        LoadAdjustment load = calculator.calculate(AdjustmentMode.AUTO, readiness(60, 45, 75));

        assertEquals(0.85 * 0.9 * 0.85, load.getFactor(), 1e-9);
        assertEquals(3, load.getRationale().size());
    }

    @Test
    void high_readiness_increases_load() {
        LoadAdjustment load = calculator.calculate(AdjustmentMode.AUTO, readiness(90, 85, 10));

        assertEquals(1.1, load.getFactor(), 1e-9);
        assertFalse(load.isNeedsMoreRecovery());
    }

    @Test
    void middle_band_leaves_load_unchanged() {
        LoadAdjustment load = calculator.calculate(AdjustmentMode.AUTO, readiness(70, null, null));

        assertEquals(1.0, load.getFactor(), 1e-9);
        assertTrue(load.getRationale().isEmpty());
    }

    @Test
    void manual_modes_use_fixed_factors() {
        assertEquals(1.15, calculator.calculate(AdjustmentMode.MANUAL_INCREASE, null).getFactor(), 1e-9);
        assertEquals(0.8, calculator.calculate(AdjustmentMode.MANUAL_DECREASE, null).getFactor(), 1e-9);

        LoadAdjustment recovery = calculator.calculate(AdjustmentMode.ADD_RECOVERY, readiness(90, 90, 10));
        assertEquals(1.0, recovery.getFactor(), 1e-9);
        assertTrue(recovery.isNeedsMoreRecovery());
    }

    @Test
    void mode_codes_accept_legacy_spelling() {
        assertEquals(AdjustmentMode.AUTO, AdjustmentMode.fromCode(null));
        assertEquals(AdjustmentMode.MANUAL_INCREASE, AdjustmentMode.fromCode("increase_intensity"));
        assertEquals(AdjustmentMode.ADD_RECOVERY, AdjustmentMode.fromCode("add-recovery"));
        assertThrows(IllegalArgumentException.class, () -> AdjustmentMode.fromCode("sideways"));
    }
}

package com.lyz.trainplan.model.dto.readiness;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.OptionalInt;

/**
 * 就绪度评估输入
 * 每个信号独立可选，缺失通过 OptionalInt 显式表达
 */
@Builder
@ToString
@EqualsAndHashCode
public class BiometricInputs {

    @Getter
    private final LocalDate asOf;
    private final Integer energyReserve;
    private final Integer sleepQuality;
    private final HrvStatus hrvStatus;
    private final Integer restingHeartRate;
    private final Integer stressLevel;

    public static BiometricInputs empty(LocalDate asOf) {
        return BiometricInputs.builder().asOf(asOf).build();
    }

    public OptionalInt energyReserve() {
        return toOptional(energyReserve);
    }

    public OptionalInt sleepQuality() {
        return toOptional(sleepQuality);
    }

    public OptionalInt restingHeartRate() {
        return toOptional(restingHeartRate);
    }

    public OptionalInt stressLevel() {
        return toOptional(stressLevel);
    }

    public HrvStatus hrvStatus() {
        return hrvStatus != null ? hrvStatus : HrvStatus.UNKNOWN;
    }

    private static OptionalInt toOptional(Integer value) {
        return value != null ? OptionalInt.of(value) : OptionalInt.empty();
    }
}

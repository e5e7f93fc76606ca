package com.lyz.trainplan.service.component;

import com.lyz.trainplan.model.dto.readiness.BiometricInputs;
import com.lyz.trainplan.model.dto.readiness.DailyBiometrics;
import com.lyz.trainplan.model.dto.readiness.HrvStatus;
import com.lyz.trainplan.provider.BiometricProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.function.Function;

/**
 * 合并今天与昨天的读数
 * 能量储备、睡眠、静息心率今天缺失时取昨天；压力与 HRV 只看今天
 */
@Slf4j
@Component
public class BiometricReadingMerger {

    public BiometricInputs merge(LocalDate asOf, DailyBiometrics today, DailyBiometrics yesterday) {
        return BiometricInputs.builder()
                .asOf(asOf)
                .energyReserve(preferToday(today, yesterday, DailyBiometrics::getEnergyReserve))
                .sleepQuality(preferToday(today, yesterday, DailyBiometrics::getSleepQuality))
                .restingHeartRate(preferToday(today, yesterday, DailyBiometrics::getRestingHeartRate))
                .stressLevel(today != null ? today.getStressLevel() : null)
                .hrvStatus(today != null ? HrvStatus.parse(today.getHrvStatus()) : HrvStatus.UNKNOWN)
                .build();
    }

    /**
     * 从数据源拉取今天和昨天并合并，某一天拉取失败按无数据处理
     */
    public BiometricInputs fetchAndMerge(BiometricProvider provider, LocalDate asOf) {
        DailyBiometrics today = safeFetch(provider, asOf);
        DailyBiometrics yesterday = safeFetch(provider, asOf.minusDays(1));
        return merge(asOf, today, yesterday);
    }

    private DailyBiometrics safeFetch(BiometricProvider provider, LocalDate date) {
        try {
            return provider.fetchDaily(date);
        } catch (Exception e) {
            log.warn("获取生理数据失败, date={}, 按无数据处理", date, e);
            return null;
        }
    }

    private static Integer preferToday(DailyBiometrics today, DailyBiometrics yesterday,
                                       Function<DailyBiometrics, Integer> getter) {
        Integer value = today != null ? getter.apply(today) : null;
        if (value == null && yesterday != null) {
            value = getter.apply(yesterday);
        }
        return value;
    }
}

package com.lyz.trainplan.service.impl;

import com.lyz.trainplan.model.dto.ReadinessRequestDTO;
import com.lyz.trainplan.model.dto.readiness.BiometricInputs;
import com.lyz.trainplan.model.dto.readiness.HrvStatus;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.provider.BiometricProvider;
import com.lyz.trainplan.service.ReadinessService;
import com.lyz.trainplan.service.analysis.ReadinessEvaluator;
import com.lyz.trainplan.service.component.BiometricReadingMerger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReadinessServiceImpl implements ReadinessService {

    private final ReadinessEvaluator readinessEvaluator;
    private final BiometricReadingMerger biometricReadingMerger;

    @Override
    public ReadinessSnapshot evaluate(BiometricInputs inputs) {
        BiometricInputs effective = inputs != null ? inputs : BiometricInputs.empty(LocalDate.now());
        return readinessEvaluator.evaluate(effective);
    }

    @Override
    public ReadinessSnapshot getTodayReadiness(BiometricProvider provider, LocalDate date) {
        LocalDate asOf = date != null ? date : LocalDate.now();
        if (provider == null) {
            log.warn("未配置生理数据源, 按无数据评估. date={}", asOf);
            return evaluate(BiometricInputs.empty(asOf));
        }
        ReadinessSnapshot snapshot = evaluate(biometricReadingMerger.fetchAndMerge(provider, asOf));
        log.info("今日就绪度, date={}, score={}, directive={}", asOf, snapshot.getScore(), snapshot.getDirective());
        return snapshot;
    }

    @Override
    public BiometricInputs toInputs(ReadinessRequestDTO dto) {
        if (dto == null) {
            return BiometricInputs.empty(LocalDate.now());
        }
        return BiometricInputs.builder()
                .asOf(dto.getDate() != null ? dto.getDate() : LocalDate.now())
                .energyReserve(dto.getEnergyReserve())
                .sleepQuality(dto.getSleepQuality())
                .hrvStatus(HrvStatus.parse(dto.getHrvStatus()))
                .restingHeartRate(dto.getRestingHeartRate())
                .stressLevel(dto.getStressLevel())
                .build();
    }
}

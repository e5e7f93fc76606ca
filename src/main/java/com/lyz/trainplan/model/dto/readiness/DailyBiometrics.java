package com.lyz.trainplan.model.dto.readiness;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 数据源某一天返回的原始读数，任意字段都可能缺失
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyBiometrics {
    private LocalDate date;
    private Integer energyReserve;
    private Integer sleepQuality;
    private String hrvStatus;
    private Integer restingHeartRate;
    private Integer stressLevel;
}

package com.lyz.trainplan.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.time.LocalDate;

/**
 * 就绪度评估请求DTO，所有读数可选
 */
@Data
public class ReadinessRequestDTO {

    private LocalDate date;

    @Min(value = 0, message = "能量储备范围 0-100")
    @Max(value = 100, message = "能量储备范围 0-100")
    private Integer energyReserve;

    @Min(value = 0, message = "睡眠评分范围 0-100")
    @Max(value = 100, message = "睡眠评分范围 0-100")
    private Integer sleepQuality;

    private String hrvStatus;

    private Integer restingHeartRate;

    @Min(value = 0, message = "压力值范围 0-100")
    @Max(value = 100, message = "压力值范围 0-100")
    private Integer stressLevel;
}

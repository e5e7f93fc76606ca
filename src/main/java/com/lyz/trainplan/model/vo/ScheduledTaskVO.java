package com.lyz.trainplan.model.vo;

import com.fasterxml.jackson.databind.JsonNode;
import com.lyz.trainplan.model.enums.IntensityTier;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 训练任务展示VO
 */
@Data
public class ScheduledTaskVO {
    private Long id;
    private Long planId;
    private LocalDate scheduledDate;
    private Integer slot;
    private String category;
    private String title;
    private String description;
    private Integer durationMinutes;
    private IntensityTier intensity;
    private String targetHr;
    private String targetHrBpm;
    private Integer estimatedCalories;
    private BigDecimal estimatedDistanceKm;
    private String keyFocus;
    private String optimalTime;

    /**
     * 分段步骤，原样返回
     */
    private JsonNode steps;

    private Boolean isCompleted;
    private LocalDateTime completedAt;
    private String linkedActivityId;
    private Integer actualDurationMinutes;
    private Integer actualCalories;
    private Integer actualAvgHr;
    private String notes;

    private Integer originalDurationMinutes;
    private IntensityTier originalIntensity;
    private String adjustmentReason;
}

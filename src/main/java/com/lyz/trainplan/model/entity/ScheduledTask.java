package com.lyz.trainplan.model.entity;

import com.lyz.trainplan.model.enums.IntensityTier;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 已排期训练任务实体
 */
@Data
public class ScheduledTask {
    private Long id;
    private Long planId;
    private LocalDate scheduledDate;

    /**
     * 同一天内的序号，主训练与补充活动各占一个
     */
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
     * 分段步骤 JSON，原样保存不做解释
     */
    private String stepsJson;

    private Boolean isCompleted;
    private LocalDateTime completedAt;
    private String linkedActivityId;
    private Integer actualDurationMinutes;
    private Integer actualCalories;
    private Integer actualAvgHr;
    private String notes;

    // 调整标注，仅由计划调整写入
    private Integer originalDurationMinutes;
    private IntensityTier originalIntensity;
    private String adjustmentReason;
    private LocalDateTime adjustedAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

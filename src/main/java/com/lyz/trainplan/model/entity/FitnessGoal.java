package com.lyz.trainplan.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 训练目标实体（如月跑量、周训练次数）
 */
@Data
public class FitnessGoal {
    private Long id;
    private String name;
    private String description;

    /**
     * activity / sleep / strength / cardio / weight
     */
    private String category;

    private BigDecimal targetValue;
    private BigDecimal currentValue;
    private String unit;

    /**
     * daily / weekly / monthly
     */
    private String timeframe;

    private LocalDate startDate;
    private LocalDate targetDate;
    private Boolean isActive;
    private Boolean isCompleted;
    private LocalDateTime completedAt;

    private Boolean aiRecommended;
    private String difficulty;
    private Integer priority;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

package com.lyz.trainplan.model.vo;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
public class FitnessGoalVO {
    private Long id;
    private String name;
    private String description;
    private String category;
    private BigDecimal targetValue;
    private BigDecimal currentValue;
    private String unit;
    private String timeframe;
    private LocalDate startDate;
    private LocalDate targetDate;

    /**
     * 完成百分比，封顶 100，保留两位小数
     */
    private BigDecimal progressPercentage;

    private Boolean isActive;
    private Boolean isCompleted;
    private LocalDateTime completedAt;
    private Boolean aiRecommended;
    private String difficulty;
    private Integer priority;
}

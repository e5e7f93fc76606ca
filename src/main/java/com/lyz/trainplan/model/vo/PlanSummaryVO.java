package com.lyz.trainplan.model.vo;

import com.lyz.trainplan.model.enums.PlanShape;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 计划概要VO
 */
@Data
public class PlanSummaryVO {
    private Long id;
    private String planName;
    private PlanShape shape;
    private LocalDate startDate;
    private LocalDate endDate;
    private String primaryGoal;
    private Boolean isActive;
    private Integer totalTaskCount;
    private Integer completedTaskCount;

    /**
     * 完成进度百分比 (0-100)
     */
    private BigDecimal progressPercentage;

    private LocalDateTime createdAt;
}

package com.lyz.trainplan.model.entity;

import com.lyz.trainplan.model.enums.PlanShape;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 训练计划实体（一次被接受的训练意图）
 */
@Data
public class TrainingPlan {
    private Long id;
    private String planName;
    private PlanShape shape;

    /**
     * 归一化后的周一
     */
    private LocalDate startDate;
    private LocalDate endDate;
    private String primaryGoal;

    /**
     * 原始计划文档 JSON，仅用于追溯，落地后不再解析
     */
    private String planJson;

    private Boolean isActive;
    private Integer totalTaskCount;
    private Integer completedTaskCount;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

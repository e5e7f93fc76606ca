package com.lyz.trainplan.model.vo;

import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.enums.AdjustmentMode;
import com.lyz.trainplan.model.enums.IntensityTier;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 计划调整结果VO
 */
@Data
public class AdjustmentResultVO {
    private Long planId;
    private AdjustmentMode mode;

    /**
     * 组合后的负荷系数
     */
    private double adjustmentFactor;

    private boolean needsMoreRecovery;

    /**
     * 实际改写的任务数
     */
    private int adjustedCount;

    /**
     * 给前端展示的调整理由
     */
    private List<String> rationale = new ArrayList<>();

    private List<TaskChange> changes = new ArrayList<>();

    private ReadinessSnapshot readiness;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskChange {
        private Long taskId;
        private String title;
        private Integer durationBefore;
        private Integer durationAfter;
        private IntensityTier intensityBefore;
        private IntensityTier intensityAfter;
    }
}

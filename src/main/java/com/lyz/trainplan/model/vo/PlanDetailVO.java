package com.lyz.trainplan.model.vo;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

/**
 * 计划详情VO（概要 + 全部任务）
 */
@Data
public class PlanDetailVO {
    private PlanSummaryVO summary;

    /**
     * 原始计划文档
     */
    private JsonNode document;

    private List<ScheduledTaskVO> tasks;
}

package com.lyz.trainplan.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;

/**
 * 接受计划请求DTO
 */
@Data
public class MaterializePlanDTO {

    /**
     * 计划文档原文（days 或 weeks 结构）
     */
    @NotNull(message = "计划文档不能为空")
    private JsonNode document;

    /**
     * 锚定日期，默认当天
     */
    private LocalDate anchorDate;

    /**
     * single-week / multi-week-block，为空时按文档结构推断
     */
    private String shape;

    private String planName;

    private String primaryGoal;

    /**
     * 是否同时停用其他进行中的计划
     */
    private boolean deactivateOthers;
}

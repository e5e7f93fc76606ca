package com.lyz.trainplan.model.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * 手动完成任务DTO，所有字段可选
 */
@Data
public class TaskCompletionDTO {

    @Min(value = 0, message = "实际时长不能为负")
    private Integer actualDurationMinutes;

    @Min(value = 0, message = "实际消耗不能为负")
    private Integer actualCalories;

    private Integer actualAvgHr;

    private String linkedActivityId;

    private String notes;
}

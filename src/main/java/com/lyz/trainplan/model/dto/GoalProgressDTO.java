package com.lyz.trainplan.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 目标进度更新DTO
 */
@Data
public class GoalProgressDTO {

    @NotNull(message = "当前值不能为空")
    @DecimalMin(value = "0", message = "当前值不能为负数")
    private BigDecimal currentValue;
}

package com.lyz.trainplan.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 创建训练目标请求DTO
 */
@Data
public class GoalDTO {

    /**
     * 为空时默认 "Goal"
     */
    private String name;

    private String description;

    private String category;

    @NotNull(message = "目标值不能为空")
    @DecimalMin(value = "0", message = "目标值不能为负数")
    private BigDecimal targetValue;

    @DecimalMin(value = "0", message = "当前值不能为负数")
    private BigDecimal currentValue;

    private String unit;

    private String timeframe;

    /**
     * 默认当天
     */
    private LocalDate startDate;

    private LocalDate targetDate;

    private boolean aiRecommended;

    private String difficulty;

    private Integer priority;
}

package com.lyz.trainplan.model.dto;

import jakarta.validation.Valid;
import lombok.Data;

/**
 * 计划调整请求DTO
 */
@Data
public class AdjustPlanDTO {

    /**
     * auto / manual-increase / manual-decrease / add-recovery
     */
    private String mode;

    /**
     * 当前读数，AUTO 模式据此计算就绪度
     */
    @Valid
    private ReadinessRequestDTO readiness;
}

package com.lyz.trainplan.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.apache.commons.lang3.StringUtils;

/**
 * 计划强度档位
 */
public enum IntensityTier {
    LOW,
    MODERATE,
    HIGH;

    /**
     * 解析文档中的强度描述，无法识别时返回 null
     */
    @JsonCreator
    public static IntensityTier parse(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        return switch (value.trim().toLowerCase()) {
            case "low", "easy", "very_low", "very low" -> LOW;
            case "moderate", "medium", "mid" -> MODERATE;
            case "high", "hard", "very_high", "very high" -> HIGH;
            default -> null;
        };
    }
}

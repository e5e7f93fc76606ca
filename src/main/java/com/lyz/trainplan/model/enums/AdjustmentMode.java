package com.lyz.trainplan.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 计划调整模式
 */
public enum AdjustmentMode {
    AUTO("auto"),
    MANUAL_INCREASE("manual-increase"),
    MANUAL_DECREASE("manual-decrease"),
    ADD_RECOVERY("add-recovery");

    private final String code;

    AdjustmentMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 为空时默认 AUTO；兼容 increase_intensity / decrease_intensity 旧写法
     */
    @JsonCreator
    public static AdjustmentMode fromCode(String value) {
        if (StringUtils.isBlank(value)) {
            return AUTO;
        }
        String v = value.trim().toLowerCase().replace('_', '-');
        return switch (v) {
            case "auto" -> AUTO;
            case "manual-increase", "increase-intensity", "increase" -> MANUAL_INCREASE;
            case "manual-decrease", "decrease-intensity", "decrease" -> MANUAL_DECREASE;
            case "add-recovery", "recovery" -> ADD_RECOVERY;
            default -> throw new IllegalArgumentException("未知的调整模式: " + value);
        };
    }
}

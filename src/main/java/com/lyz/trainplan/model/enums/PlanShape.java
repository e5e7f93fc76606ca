package com.lyz.trainplan.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 计划形态：单周 / 多周训练块
 */
public enum PlanShape {
    SINGLE_WEEK("single-week"),
    MULTI_WEEK_BLOCK("multi-week-block");

    private final String code;

    PlanShape(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 兼容旧版 week/month 写法，无法识别返回 null 由调用方推断
     */
    @JsonCreator
    public static PlanShape fromCode(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String v = value.trim().toLowerCase().replace('_', '-');
        return switch (v) {
            case "single-week", "week", "weekly" -> SINGLE_WEEK;
            case "multi-week-block", "multi-week", "month", "monthly", "block" -> MULTI_WEEK_BLOCK;
            default -> null;
        };
    }
}

package com.lyz.trainplan.model.dto.readiness;

import org.apache.commons.lang3.StringUtils;

/**
 * HRV 状态
 */
public enum HrvStatus {
    BALANCED,
    UNBALANCED,
    UNKNOWN;

    /**
     * 设备返回的状态字符串各不相同，含 unbalanced 即视为失衡
     */
    public static HrvStatus parse(String raw) {
        if (StringUtils.isBlank(raw)) {
            return UNKNOWN;
        }
        String v = raw.trim().toLowerCase();
        if (v.contains("unbalanced")) {
            return UNBALANCED;
        }
        if (v.equals("balanced") || v.equals("high")) {
            return BALANCED;
        }
        return UNKNOWN;
    }
}

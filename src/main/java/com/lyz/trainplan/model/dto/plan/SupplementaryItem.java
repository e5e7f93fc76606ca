package com.lyz.trainplan.model.dto.plan;

import com.lyz.trainplan.model.enums.IntensityTier;
import lombok.Builder;
import lombok.Value;

/**
 * 附属于某一天的补充/恢复活动（如拉伸、冷水浴）
 */
@Value
@Builder
public class SupplementaryItem {
    String title;
    String category;
    String description;
    Integer durationMinutes;
    IntensityTier intensity;
}

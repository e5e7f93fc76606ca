package com.lyz.trainplan.model.dto.plan;

import com.lyz.trainplan.model.enums.IntensityTier;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * 文档中的一天训练描述
 */
@Value
@Builder
public class PlanDayEntry {
    /**
     * 星期标签原文，可能缺失或无法识别
     */
    String dayLabel;
    String title;
    String category;
    String description;
    Integer durationMinutes;
    IntensityTier intensity;
    String targetHr;
    String targetHrBpm;
    Integer estimatedCalories;
    BigDecimal estimatedDistanceKm;

    /**
     * 本次训练重点，如 "aerobic base"
     */
    String keyFocus;

    /**
     * 建议训练时段原文
     */
    String optimalTime;

    /**
     * 分段步骤原文 JSON
     */
    String stepsJson;

    @Singular("supplementaryItem")
    List<SupplementaryItem> supplementary;
}

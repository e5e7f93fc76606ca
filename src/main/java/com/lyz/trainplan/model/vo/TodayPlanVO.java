package com.lyz.trainplan.model.vo;

import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.enums.IntensityTier;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 今日训练视图：当天任务 + 就绪度自动调节建议（只读，不改写任务）
 */
@Data
public class TodayPlanVO {
    private LocalDate date;
    private ReadinessSnapshot readiness;
    private List<Item> items = new ArrayList<>();

    @Data
    public static class Item {
        private ScheduledTaskVO task;

        /**
         * 是否因就绪度触发了建议
         */
        private boolean autoregulated;

        private IntensityTier suggestedIntensity;

        private String guidance;
    }
}

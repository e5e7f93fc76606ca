package com.lyz.trainplan.model.dto.plan;

import lombok.Value;

import java.util.List;

/**
 * 多周计划中的一周，下标决定相对首个周一的偏移
 */
@Value
public class PlanWeek {
    List<PlanDayEntry> days;

    public PlanWeek(List<PlanDayEntry> days) {
        this.days = List.copyOf(days);
    }
}

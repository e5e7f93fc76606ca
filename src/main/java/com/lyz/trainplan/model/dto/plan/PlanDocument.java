package com.lyz.trainplan.model.dto.plan;

import com.lyz.trainplan.model.enums.PlanShape;

import java.util.List;

/**
 * 已校验的计划文档：单周（SingleWeekDocument）或多周训练块（MultiWeekDocument）
 */
public interface PlanDocument {

    PlanShape getShape();

    /**
     * 按周展开，单周文档只有一周
     */
    List<PlanWeek> getWeeks();

    default int dayEntryCount() {
        int count = 0;
        for (PlanWeek week : getWeeks()) {
            count += week.getDays().size();
        }
        return count;
    }
}

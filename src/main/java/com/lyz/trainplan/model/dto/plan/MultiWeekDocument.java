package com.lyz.trainplan.model.dto.plan;

import com.lyz.trainplan.model.enums.PlanShape;
import lombok.Value;

import java.util.List;

@Value
public class MultiWeekDocument implements PlanDocument {
    List<PlanWeek> weeks;

    public MultiWeekDocument(List<PlanWeek> weeks) {
        this.weeks = List.copyOf(weeks);
    }

    @Override
    public PlanShape getShape() {
        return PlanShape.MULTI_WEEK_BLOCK;
    }
}

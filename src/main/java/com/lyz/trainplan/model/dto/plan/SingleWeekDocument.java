package com.lyz.trainplan.model.dto.plan;

import com.lyz.trainplan.model.enums.PlanShape;
import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
public class SingleWeekDocument implements PlanDocument {
    List<PlanDayEntry> days;

    public SingleWeekDocument(List<PlanDayEntry> days) {
        this.days = List.copyOf(days);
    }

    @Override
    public PlanShape getShape() {
        return PlanShape.SINGLE_WEEK;
    }

    @Override
    public List<PlanWeek> getWeeks() {
        return Collections.singletonList(new PlanWeek(days));
    }
}

package com.lyz.trainplan.service;

import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.enums.AdjustmentMode;
import com.lyz.trainplan.model.vo.AdjustmentResultVO;

public interface PlanAdjustmentService {

    /**
     * 按就绪度调整计划中剩余未完成任务的时长与强度
     *
     * @param planId    计划ID
     * @param readiness 就绪度快照，非 AUTO 模式可为空
     * @param mode      调整模式
     * @return 调整结果，无未完成任务时调整数为 0
     */
    AdjustmentResultVO adjust(Long planId, ReadinessSnapshot readiness, AdjustmentMode mode);
}

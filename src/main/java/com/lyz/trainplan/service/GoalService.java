package com.lyz.trainplan.service;

import com.lyz.trainplan.model.dto.GoalDTO;
import com.lyz.trainplan.model.dto.GoalProgressDTO;
import com.lyz.trainplan.model.vo.FitnessGoalVO;

import java.util.List;

public interface GoalService {

    FitnessGoalVO createGoal(GoalDTO dto);

    /**
     * @param activeOnly 为 true 时只返回进行中的目标
     */
    List<FitnessGoalVO> listGoals(boolean activeOnly);

    /**
     * 更新目标当前值，达到目标值时自动标记完成
     *
     * @param goalId 目标ID
     * @param dto    新的当前值
     * @return 更新后的目标
     */
    FitnessGoalVO updateProgress(Long goalId, GoalProgressDTO dto);
}

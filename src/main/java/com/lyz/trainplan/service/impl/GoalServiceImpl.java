package com.lyz.trainplan.service.impl;

import com.lyz.trainplan.common.exception.ResourceNotFoundException;
import com.lyz.trainplan.mapper.FitnessGoalMapper;
import com.lyz.trainplan.model.dto.GoalDTO;
import com.lyz.trainplan.model.dto.GoalProgressDTO;
import com.lyz.trainplan.model.entity.FitnessGoal;
import com.lyz.trainplan.model.vo.FitnessGoalVO;
import com.lyz.trainplan.service.GoalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 训练目标管理
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoalServiceImpl implements GoalService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final FitnessGoalMapper fitnessGoalMapper;

    @Override
    public FitnessGoalVO createGoal(GoalDTO dto) {
        LocalDateTime now = LocalDateTime.now();
        FitnessGoal goal = new FitnessGoal();
        goal.setName(StringUtils.defaultIfBlank(dto.getName(), "Goal"));
        goal.setDescription(dto.getDescription());
        goal.setCategory(dto.getCategory());
        goal.setTargetValue(dto.getTargetValue());
        goal.setCurrentValue(dto.getCurrentValue() != null ? dto.getCurrentValue() : BigDecimal.ZERO);
        goal.setUnit(dto.getUnit());
        goal.setTimeframe(dto.getTimeframe());
        goal.setStartDate(dto.getStartDate() != null ? dto.getStartDate() : LocalDate.now());
        goal.setTargetDate(dto.getTargetDate());
        goal.setIsActive(true);
        goal.setIsCompleted(false);
        goal.setAiRecommended(dto.isAiRecommended());
        goal.setDifficulty(dto.getDifficulty());
        goal.setPriority(dto.getPriority() != null ? dto.getPriority() : 0);
        goal.setCreatedAt(now);
        goal.setUpdatedAt(now);
        fitnessGoalMapper.insert(goal);

        log.info("目标已创建, goalId={}, name={}, target={}{}",
                goal.getId(), goal.getName(), goal.getTargetValue(), StringUtils.defaultString(goal.getUnit()));
        return toVO(goal);
    }

    @Override
    public List<FitnessGoalVO> listGoals(boolean activeOnly) {
        List<FitnessGoal> goals = activeOnly ? fitnessGoalMapper.selectActive() : fitnessGoalMapper.selectAll();
        return goals.stream()
                .map(this::toVO)
                .collect(Collectors.toList());
    }

    @Override
    public FitnessGoalVO updateProgress(Long goalId, GoalProgressDTO dto) {
        FitnessGoal goal = fitnessGoalMapper.selectById(goalId);
        if (goal == null) {
            throw new ResourceNotFoundException("FitnessGoal", goalId);
        }

        LocalDateTime now = LocalDateTime.now();
        goal.setCurrentValue(dto.getCurrentValue());
        goal.setUpdatedAt(now);
        // 达标即完成；已完成的目标保留首次完成时间
        if (!Boolean.TRUE.equals(goal.getIsCompleted())
                && dto.getCurrentValue().compareTo(goal.getTargetValue()) >= 0) {
            goal.setIsCompleted(true);
            goal.setCompletedAt(now);
            log.info("目标已达成, goalId={}, current={}, target={}", goalId, dto.getCurrentValue(), goal.getTargetValue());
        }
        fitnessGoalMapper.updateProgress(goal);
        return toVO(goal);
    }

    private FitnessGoalVO toVO(FitnessGoal goal) {
        FitnessGoalVO vo = new FitnessGoalVO();
        vo.setId(goal.getId());
        vo.setName(goal.getName());
        vo.setDescription(goal.getDescription());
        vo.setCategory(goal.getCategory());
        vo.setTargetValue(goal.getTargetValue());
        vo.setCurrentValue(goal.getCurrentValue());
        vo.setUnit(goal.getUnit());
        vo.setTimeframe(goal.getTimeframe());
        vo.setStartDate(goal.getStartDate());
        vo.setTargetDate(goal.getTargetDate());
        vo.setProgressPercentage(progress(goal.getCurrentValue(), goal.getTargetValue()));
        vo.setIsActive(goal.getIsActive());
        vo.setIsCompleted(goal.getIsCompleted());
        vo.setCompletedAt(goal.getCompletedAt());
        vo.setAiRecommended(goal.getAiRecommended());
        vo.setDifficulty(goal.getDifficulty());
        vo.setPriority(goal.getPriority());
        return vo;
    }

    private BigDecimal progress(BigDecimal current, BigDecimal target) {
        if (current == null || target == null || target.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal percentage = current.multiply(HUNDRED).divide(target, 2, RoundingMode.HALF_UP);
        return percentage.min(HUNDRED.setScale(2));
    }
}

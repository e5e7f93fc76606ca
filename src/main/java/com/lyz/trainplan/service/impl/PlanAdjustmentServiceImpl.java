package com.lyz.trainplan.service.impl;

import com.lyz.trainplan.common.exception.ResourceNotFoundException;
import com.lyz.trainplan.mapper.ScheduledTaskMapper;
import com.lyz.trainplan.mapper.TrainingPlanMapper;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.entity.ScheduledTask;
import com.lyz.trainplan.model.enums.AdjustmentMode;
import com.lyz.trainplan.model.enums.IntensityTier;
import com.lyz.trainplan.model.vo.AdjustmentResultVO;
import com.lyz.trainplan.service.PlanAdjustmentService;
import com.lyz.trainplan.service.analysis.AdjustmentFactorCalculator;
import com.lyz.trainplan.service.analysis.AdjustmentFactorCalculator.LoadAdjustment;
import com.lyz.trainplan.service.component.PlanDetailCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 按就绪度调整剩余任务
 * 每个任务单独条件更新，调整过程中被完成的任务不会被改写
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanAdjustmentServiceImpl implements PlanAdjustmentService {

    private final TrainingPlanMapper trainingPlanMapper;
    private final ScheduledTaskMapper scheduledTaskMapper;
    private final AdjustmentFactorCalculator adjustmentFactorCalculator;
    private final PlanDetailCache planDetailCache;

    @Override
    public AdjustmentResultVO adjust(Long planId, ReadinessSnapshot readiness, AdjustmentMode mode) {
        if (trainingPlanMapper.selectById(planId) == null) {
            throw new ResourceNotFoundException("TrainingPlan", planId);
        }

        AdjustmentMode effectiveMode = mode != null ? mode : AdjustmentMode.AUTO;
        LoadAdjustment load = adjustmentFactorCalculator.calculate(effectiveMode, readiness);

        AdjustmentResultVO result = new AdjustmentResultVO();
        result.setPlanId(planId);
        result.setMode(effectiveMode);
        result.setAdjustmentFactor(load.getFactor());
        result.setNeedsMoreRecovery(load.isNeedsMoreRecovery());
        result.setRationale(load.getRationale());
        result.setReadiness(readiness);

        List<ScheduledTask> incomplete = scheduledTaskMapper.selectIncompleteByPlanId(planId);
        if (incomplete.isEmpty()) {
            log.info("计划无未完成任务, 无需调整. planId={}", planId);
            return result;
        }

        String reason = buildReason(load);
        LocalDateTime now = LocalDateTime.now();
        for (ScheduledTask task : incomplete) {
            try {
                AdjustmentResultVO.TaskChange change = applyTo(task, load, reason, now);
                if (change != null) {
                    result.getChanges().add(change);
                }
            } catch (Exception e) {
                log.error("任务调整失败, 跳过. taskId={}", task.getId(), e);
            }
        }
        result.setAdjustedCount(result.getChanges().size());

        if (result.getAdjustedCount() > 0) {
            planDetailCache.evict(planId);
        }
        log.info("计划调整完成, planId={}, mode={}, factor={}, 调整任务数={}",
                planId, effectiveMode, String.format("%.3f", load.getFactor()), result.getAdjustedCount());
        return result;
    }

    /**
     * 计算单个任务的新时长/强度，有变化才写库
     *
     * @return 实际生效的变更，未变化或任务已被完成时返回 null
     */
    private AdjustmentResultVO.TaskChange applyTo(ScheduledTask task, LoadAdjustment load,
                                                  String reason, LocalDateTime now) {
        Integer durationBefore = task.getDurationMinutes();
        IntensityTier intensityBefore = task.getIntensity();

        IntensityTier intensityAfter = intensityBefore;
        if (load.isNeedsMoreRecovery() && intensityBefore == IntensityTier.HIGH) {
            intensityAfter = IntensityTier.MODERATE;
        }
        Integer durationAfter = durationBefore != null
                ? (int) Math.round(durationBefore * load.getFactor())
                : null;

        if (Objects.equals(durationBefore, durationAfter) && intensityBefore == intensityAfter) {
            return null;
        }

        ScheduledTask update = new ScheduledTask();
        update.setId(task.getId());
        update.setDurationMinutes(durationAfter);
        update.setIntensity(intensityAfter);
        update.setOriginalDurationMinutes(durationBefore);
        update.setOriginalIntensity(intensityBefore);
        update.setAdjustmentReason(reason);
        update.setAdjustedAt(now);

        if (scheduledTaskMapper.updateAdjustment(update) == 0) {
            log.info("任务已在调整期间完成, 跳过. taskId={}", task.getId());
            return null;
        }
        return new AdjustmentResultVO.TaskChange(
                task.getId(), task.getTitle(), durationBefore, durationAfter, intensityBefore, intensityAfter);
    }

    private String buildReason(LoadAdjustment load) {
        String summary = String.format("Adjusted to %d%% of planned load", Math.round(load.getFactor() * 100));
        if (load.getRationale() == null || load.getRationale().isEmpty()) {
            return summary;
        }
        return summary + ": " + String.join("; ", load.getRationale());
    }
}

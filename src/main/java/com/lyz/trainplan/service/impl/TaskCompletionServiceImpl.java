package com.lyz.trainplan.service.impl;

import com.lyz.trainplan.common.exception.ResourceNotFoundException;
import com.lyz.trainplan.mapper.ScheduledTaskMapper;
import com.lyz.trainplan.mapper.TrainingPlanMapper;
import com.lyz.trainplan.model.dto.TaskCompletionDTO;
import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import com.lyz.trainplan.model.entity.ScheduledTask;
import com.lyz.trainplan.model.entity.TrainingPlan;
import com.lyz.trainplan.model.vo.MatchResultVO;
import com.lyz.trainplan.model.vo.ScheduledTaskVO;
import com.lyz.trainplan.service.TaskCompletionService;
import com.lyz.trainplan.service.component.ActivityMatcher;
import com.lyz.trainplan.service.component.PlanDetailCache;
import com.lyz.trainplan.service.component.PlanViewAssembler;
import com.lyz.trainplan.service.component.TaskCompletionRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 任务完成：活动对账 + 手动完成
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskCompletionServiceImpl implements TaskCompletionService {

    private final TrainingPlanMapper trainingPlanMapper;
    private final ScheduledTaskMapper scheduledTaskMapper;
    private final ActivityMatcher activityMatcher;
    private final TaskCompletionRecorder taskCompletionRecorder;
    private final PlanViewAssembler planViewAssembler;
    private final PlanDetailCache planDetailCache;

    @Override
    public List<MatchResultVO> reconcile(Long planId, List<RecordedActivity> activities) {
        TrainingPlan plan = trainingPlanMapper.selectById(planId);
        if (plan == null) {
            throw new ResourceNotFoundException("TrainingPlan", planId);
        }
        return reconcilePlan(plan, activities, new HashSet<>());
    }

    @Override
    public List<MatchResultVO> reconcileActivePlans(List<RecordedActivity> activities) {
        List<MatchResultVO> results = new ArrayList<>();
        // 跨计划共享，同一活动不会完成两个计划的任务
        Set<String> usedActivityIds = new HashSet<>();
        for (TrainingPlan plan : trainingPlanMapper.selectActive()) {
            results.addAll(reconcilePlan(plan, activities, usedActivityIds));
        }
        log.info("进行中计划对账完成, 新匹配任务数={}", results.size());
        return results;
    }

    @Override
    public ScheduledTaskVO completeTaskManually(Long taskId, TaskCompletionDTO dto) {
        ScheduledTask task = scheduledTaskMapper.selectById(taskId);
        if (task == null) {
            throw new ResourceNotFoundException("ScheduledTask", taskId);
        }

        if (Boolean.TRUE.equals(task.getIsCompleted())) {
            log.info("任务已完成，忽略重复提交. taskId={}", taskId);
            return planViewAssembler.toTaskVO(task);
        }

        if (taskCompletionRecorder.completeManually(task, dto)) {
            planDetailCache.evict(task.getPlanId());
            log.info("任务已手动完成, taskId={}, planId={}", taskId, task.getPlanId());
        }
        return planViewAssembler.toTaskVO(scheduledTaskMapper.selectById(taskId));
    }

    /**
     * 单个计划对账
     *
     * @param usedActivityIds 本轮已使用的活动ID，匹配成功后追加
     */
    private List<MatchResultVO> reconcilePlan(TrainingPlan plan,
                                              List<RecordedActivity> activities,
                                              Set<String> usedActivityIds) {
        List<MatchResultVO> results = new ArrayList<>();
        if (activities == null || activities.isEmpty()) {
            return results;
        }

        // 已关联过的活动先排除，重复对账不会重复计数
        Set<String> excluded = new HashSet<>(usedActivityIds);
        excluded.addAll(scheduledTaskMapper.selectLinkedActivityIds(plan.getId()));

        List<ScheduledTask> incomplete = scheduledTaskMapper.selectIncompleteByPlanId(plan.getId());
        List<ActivityMatcher.Pairing> pairings = activityMatcher.match(incomplete, activities, excluded);

        for (ActivityMatcher.Pairing pairing : pairings) {
            ScheduledTask task = pairing.getTask();
            RecordedActivity activity = pairing.getActivity();
            try {
                if (taskCompletionRecorder.completeWithActivity(task, activity)) {
                    usedActivityIds.add(activity.getActivityId());
                    results.add(MatchResultVO.builder()
                            .planId(plan.getId())
                            .taskId(task.getId())
                            .taskTitle(task.getTitle())
                            .taskDate(task.getScheduledDate())
                            .activityId(activity.getActivityId())
                            .activityName(activity.getActivityName())
                            .activityType(activity.getActivityType())
                            .build());
                }
            } catch (Exception e) {
                log.error("任务完成写入失败, 跳过. taskId={}, activityId={}", task.getId(), activity.getActivityId(), e);
            }
        }

        if (!results.isEmpty()) {
            planDetailCache.evict(plan.getId());
        }
        log.info("计划对账完成, planId={}, 活动数={}, 新匹配={}", plan.getId(), activities.size(), results.size());
        return results;
    }
}

package com.lyz.trainplan.service.component;

import com.lyz.trainplan.mapper.ScheduledTaskMapper;
import com.lyz.trainplan.mapper.TrainingPlanMapper;
import com.lyz.trainplan.model.dto.TaskCompletionDTO;
import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import com.lyz.trainplan.model.entity.ScheduledTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 单个任务的完成写入：标记完成 + 计划完成数 +1，同一事务
 * 标记完成是条件更新，任务已完成时两步都不执行
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskCompletionRecorder {

    private final ScheduledTaskMapper scheduledTaskMapper;
    private final TrainingPlanMapper trainingPlanMapper;

    /**
     * 用匹配到的活动完成任务
     *
     * @return 本次是否真正完成了任务
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean completeWithActivity(ScheduledTask task, RecordedActivity activity) {
        return complete(task,
                activity.getActivityId(),
                activity.getDurationMinutes(),
                activity.getCalories(),
                activity.getAverageHr(),
                null);
    }

    /**
     * 手动完成，实际数据均可为空
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean completeManually(ScheduledTask task, TaskCompletionDTO dto) {
        TaskCompletionDTO values = dto != null ? dto : new TaskCompletionDTO();
        return complete(task,
                values.getLinkedActivityId(),
                values.getActualDurationMinutes(),
                values.getActualCalories(),
                values.getActualAvgHr(),
                values.getNotes());
    }

    private boolean complete(ScheduledTask task, String activityId, Integer duration,
                             Integer calories, Integer avgHr, String notes) {
        int rows = scheduledTaskMapper.markCompleted(
                task.getId(), LocalDateTime.now(), activityId, duration, calories, avgHr, notes);
        if (rows == 0) {
            log.info("任务已完成，跳过. taskId={}", task.getId());
            return false;
        }
        trainingPlanMapper.incrementCompletedCount(task.getPlanId());
        return true;
    }
}

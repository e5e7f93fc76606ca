package com.lyz.trainplan.service.component;

import com.lyz.trainplan.common.TaskCategoryConstants;
import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import com.lyz.trainplan.model.entity.ScheduledTask;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 任务与活动匹配组件（纯计算，不落库）
 */
@Component
public class ActivityMatcher {

    @Data
    @AllArgsConstructor
    public static class Pairing {
        private ScheduledTask task;
        private RecordedActivity activity;
    }

    /**
     * 为每个未完成任务找至多一个活动，每个活动至多使用一次
     *
     * @param tasks           候选任务，内部按日期、序号排序
     * @param activities      活动窗口，内部按开始时间倒序
     * @param excludedIds     已被关联过的活动ID
     */
    public List<Pairing> match(List<ScheduledTask> tasks,
                               List<RecordedActivity> activities,
                               Collection<String> excludedIds) {
        List<Pairing> pairings = new ArrayList<>();
        if (tasks == null || tasks.isEmpty() || activities == null || activities.isEmpty()) {
            return pairings;
        }

        Set<String> used = new HashSet<>();
        if (excludedIds != null) {
            used.addAll(excludedIds);
        }

        List<ScheduledTask> orderedTasks = tasks.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ScheduledTask::getScheduledDate)
                        .thenComparing(ScheduledTask::getSlot, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
        List<RecordedActivity> recentFirst = activities.stream()
                .filter(a -> a != null && a.getActivityId() != null && a.getStartTime() != null)
                .sorted(Comparator.comparing(RecordedActivity::getStartTime).reversed())
                .collect(Collectors.toList());

        for (ScheduledTask task : orderedTasks) {
            if (Boolean.TRUE.equals(task.getIsCompleted()) || TaskCategoryConstants.isRest(task.getCategory())) {
                continue;
            }
            for (RecordedActivity activity : recentFirst) {
                if (used.contains(activity.getActivityId())) {
                    continue;
                }
                if (!task.getScheduledDate().equals(activity.getActivityDate())) {
                    continue;
                }
                if (isCompatible(task.getCategory(), activity.getActivityType())) {
                    used.add(activity.getActivityId());
                    pairings.add(new Pairing(task, activity));
                    break;
                }
            }
        }
        return pairings;
    }

    /**
     * 耐力类只认跑步，力量类只认力量/HIIT，其余类别当天任意活动均可
     */
    public boolean isCompatible(String category, String activityType) {
        if (TaskCategoryConstants.isRest(category)) {
            return false;
        }
        if (TaskCategoryConstants.isEnduranceCategory(category)) {
            return TaskCategoryConstants.isRunningActivity(activityType);
        }
        if (TaskCategoryConstants.isStrengthCategory(category)) {
            return TaskCategoryConstants.isStrengthActivity(activityType);
        }
        return true;
    }
}

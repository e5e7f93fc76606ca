package com.lyz.trainplan.service.builder;

import com.lyz.trainplan.common.TaskCategoryConstants;
import com.lyz.trainplan.model.dto.plan.PlanDayEntry;
import com.lyz.trainplan.model.dto.plan.PlanDocument;
import com.lyz.trainplan.model.dto.plan.PlanWeek;
import com.lyz.trainplan.model.dto.plan.SupplementaryItem;
import com.lyz.trainplan.model.entity.ScheduledTask;
import com.lyz.trainplan.model.enums.IntensityTier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 把按星期描述的计划文档展开为具体日期的任务
 */
@Slf4j
@Component
public class TaskScheduleBuilder {

    @Getter
    public static class Schedule {
        private final LocalDate startDate;
        private final LocalDate endDate;
        private final List<ScheduledTask> tasks;

        Schedule(LocalDate startDate, LocalDate endDate, List<ScheduledTask> tasks) {
            this.startDate = startDate;
            this.endDate = endDate;
            this.tasks = tasks;
        }
    }

    /**
     * 展开任务（尚未设置 planId）
     *
     * @param anchorDate 锚定日期，会归一到所在周的周一
     */
    public Schedule build(PlanDocument document, LocalDate anchorDate) {
        LocalDate weekStart = normalizeToMonday(anchorDate);
        List<PlanWeek> weeks = document.getWeeks();

        List<ScheduledTask> tasks = new ArrayList<>();
        // 每个日期的下一个可用序号
        Map<LocalDate, Integer> nextSlot = new HashMap<>();

        for (int k = 0; k < weeks.size(); k++) {
            LocalDate currentWeekStart = weekStart.plusWeeks(k);
            for (PlanDayEntry entry : weeks.get(k).getDays()) {
                LocalDate date = currentWeekStart.plusDays(weekdayOffset(entry.getDayLabel()));

                tasks.add(fromEntry(entry, date, nextSlot.merge(date, 1, Integer::sum) - 1));
                for (SupplementaryItem item : entry.getSupplementary()) {
                    tasks.add(fromSupplementary(item, date, nextSlot.merge(date, 1, Integer::sum) - 1));
                }
            }
        }

        LocalDate endDate = weekStart.plusDays(7L * weeks.size() - 1);
        return new Schedule(weekStart, endDate, tasks);
    }

    public static LocalDate normalizeToMonday(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /**
     * 周一=0 ... 周日=6；缺失或无法识别时按周一处理
     */
    static int weekdayOffset(String dayLabel) {
        if (StringUtils.isBlank(dayLabel)) {
            log.warn("星期标签缺失，按周一排期");
            return 0;
        }
        String label = dayLabel.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek dow : DayOfWeek.values()) {
            String name = dow.name();
            if (name.equals(label) || (label.length() >= 3 && name.startsWith(label))) {
                return dow.getValue() - 1;
            }
        }
        log.warn("无法识别的星期标签: {}，按周一排期", dayLabel);
        return 0;
    }

    private ScheduledTask fromEntry(PlanDayEntry entry, LocalDate date, int slot) {
        ScheduledTask task = newTask(date, slot);
        task.setTitle(StringUtils.defaultIfBlank(entry.getTitle(), "Workout"));
        task.setCategory(TaskCategoryConstants.normalize(entry.getCategory()));
        task.setDescription(entry.getDescription());
        task.setDurationMinutes(entry.getDurationMinutes());
        task.setIntensity(entry.getIntensity() != null ? entry.getIntensity() : IntensityTier.MODERATE);
        task.setTargetHr(entry.getTargetHr());
        task.setTargetHrBpm(entry.getTargetHrBpm());
        task.setEstimatedCalories(entry.getEstimatedCalories());
        task.setEstimatedDistanceKm(entry.getEstimatedDistanceKm());
        task.setKeyFocus(entry.getKeyFocus());
        task.setOptimalTime(entry.getOptimalTime());
        task.setStepsJson(entry.getStepsJson());
        return task;
    }

    private ScheduledTask fromSupplementary(SupplementaryItem item, LocalDate date, int slot) {
        ScheduledTask task = newTask(date, slot);
        task.setTitle(StringUtils.defaultIfBlank(item.getTitle(), "Supplementary"));
        task.setCategory(StringUtils.isBlank(item.getCategory())
                ? TaskCategoryConstants.SUPPLEMENTARY
                : TaskCategoryConstants.normalize(item.getCategory()));
        task.setDescription(item.getDescription());
        task.setDurationMinutes(item.getDurationMinutes());
        task.setIntensity(item.getIntensity() != null ? item.getIntensity() : IntensityTier.LOW);
        return task;
    }

    private ScheduledTask newTask(LocalDate date, int slot) {
        ScheduledTask task = new ScheduledTask();
        task.setScheduledDate(date);
        task.setSlot(slot);
        task.setIsCompleted(false);
        return task;
    }
}

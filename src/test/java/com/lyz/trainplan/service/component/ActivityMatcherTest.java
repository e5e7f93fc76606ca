package com.lyz.trainplan.service.component;

import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import com.lyz.trainplan.model.entity.ScheduledTask;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ActivityMatcherTest {

    private final ActivityMatcher matcher = new ActivityMatcher();

    static ScheduledTask task(long id, LocalDate date, int slot, String category) {
        ScheduledTask t = new ScheduledTask();
        t.setId(id);
        t.setPlanId(1L);
        t.setScheduledDate(date);
        t.setSlot(slot);
        t.setCategory(category);
        t.setTitle(category + "-" + id);
        t.setIsCompleted(false);
        return t;
    }

    static RecordedActivity activity(String id, String type, LocalDateTime start) {
        return RecordedActivity.builder()
                .activityId(id).activityName(type).activityType(type)
                .startTime(start).durationSeconds(1800).calories(300).averageHr(140)
                .build();
    }

    @Test
    void running_activity_matches_endurance_task_only() {
        LocalDate june3 = LocalDate.of(2024, 6, 3);
        ScheduledTask endurance = task(1, june3, 0, "endurance");
        ScheduledTask rest = task(2, june3.plusDays(1), 0, "rest");
        RecordedActivity run = activity("a1", "running", june3.atTime(7, 0));

        List<ActivityMatcher.Pairing> pairings = matcher.match(List.of(endurance, rest), List.of(run), Set.of());

        assertEquals(1, pairings.size());
        assertEquals(1L, pairings.get(0).getTask().getId());
        assertEquals("a1", pairings.get(0).getActivity().getActivityId());
    }

    @Test
    void activity_on_another_day_never_matches() {
        LocalDate day = LocalDate.of(2024, 6, 3);
        ScheduledTask easy = task(1, day, 0, "easy_run");
        RecordedActivity run = activity("a1", "running", day.plusDays(1).atTime(6, 30));

        assertTrue(matcher.match(List.of(easy), List.of(run), Set.of()).isEmpty());
    }

    @Test
    void each_activity_completes_at_most_one_task() {
        LocalDate day = LocalDate.of(2024, 6, 3);
        ScheduledTask first = task(1, day, 0, "easy_run");
        ScheduledTask second = task(2, day, 1, "mobility");
        RecordedActivity run = activity("a1", "treadmill_running", day.atTime(7, 0));

        List<ActivityMatcher.Pairing> pairings = matcher.match(List.of(second, first), List.of(run), Set.of());

        assertEquals(1, pairings.size());
        // 按序号排序后先处理 slot 0
        assertEquals(1L, pairings.get(0).getTask().getId());
    }

    @Test
    void most_recent_compatible_activity_wins() {
        LocalDate day = LocalDate.of(2024, 6, 3);
        ScheduledTask gym = task(1, day, 0, "strength");
        RecordedActivity morning = activity("early", "strength_training", day.atTime(6, 0));
        RecordedActivity evening = activity("late", "hiit", day.atTime(19, 0));
        RecordedActivity run = activity("run", "running", day.atTime(20, 0));

        List<ActivityMatcher.Pairing> pairings = matcher.match(List.of(gym), List.of(morning, evening, run), Set.of());

        assertEquals("late", pairings.get(0).getActivity().getActivityId());
    }

    @Test
    void excluded_activities_are_skipped() {
        LocalDate day = LocalDate.of(2024, 6, 3);
        ScheduledTask easy = task(1, day, 0, "easy_run");
        RecordedActivity run = activity("a1", "running", day.atTime(7, 0));

        assertTrue(matcher.match(List.of(easy), List.of(run), Set.of("a1")).isEmpty());
    }

    @Test
    void compatibility_rules() {
        assertTrue(matcher.isCompatible("long_run", "trail_running"));
        assertFalse(matcher.isCompatible("tempo", "cycling"));
        assertTrue(matcher.isCompatible("gym", "strength_training"));
        assertFalse(matcher.isCompatible("strength", "running"));
        assertTrue(matcher.isCompatible("yoga", "cycling"));
        assertTrue(matcher.isCompatible(null, "walking"));
        assertFalse(matcher.isCompatible("rest", "running"));
    }
}

package com.lyz.trainplan.task;

import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import com.lyz.trainplan.provider.ActivityHistoryProvider;
import com.lyz.trainplan.service.TaskCompletionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class ActivityReconcileTaskTest {

    private TaskCompletionService taskCompletionService;
    private ActivityHistoryProvider provider;
    private ObjectProvider<ActivityHistoryProvider> providerRef;
    private ActivityReconcileTask task;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        taskCompletionService = mock(TaskCompletionService.class);
        provider = mock(ActivityHistoryProvider.class);
        providerRef = mock(ObjectProvider.class);
        task = new ActivityReconcileTask(taskCompletionService, providerRef);
        ReflectionTestUtils.setField(task, "activityLimit", 15);
    }

    @Test
    void skips_when_no_provider_registered() {
        when(providerRef.getIfAvailable()).thenReturn(null);

        task.reconcileActivePlans();

        verifyNoInteractions(taskCompletionService);
    }

    @Test
    void reconciles_recent_activities() {
        List<RecordedActivity> activities = List.of(RecordedActivity.builder()
                .activityId("a1")
                .activityType("running")
                .startTime(LocalDateTime.of(2024, 6, 3, 7, 0))
                .durationSeconds(1800)
                .build());
        when(providerRef.getIfAvailable()).thenReturn(provider);
        when(provider.recentActivities(15)).thenReturn(activities);
        when(taskCompletionService.reconcileActivePlans(activities)).thenReturn(List.of());

        task.reconcileActivePlans();

        verify(taskCompletionService).reconcileActivePlans(activities);
    }

    @Test
    void empty_window_does_not_reconcile() {
        when(providerRef.getIfAvailable()).thenReturn(provider);
        when(provider.recentActivities(15)).thenReturn(List.of());

        task.reconcileActivePlans();

        verify(taskCompletionService, never()).reconcileActivePlans(anyList());
    }

    @Test
    void provider_failure_is_logged_not_thrown() {
        when(providerRef.getIfAvailable()).thenReturn(provider);
        when(provider.recentActivities(15)).thenThrow(new IllegalStateException("upstream down"));

        assertDoesNotThrow(() -> task.reconcileActivePlans());
        verifyNoInteractions(taskCompletionService);
    }
}

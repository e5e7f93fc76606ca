package com.lyz.trainplan.task;

import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import com.lyz.trainplan.model.vo.MatchResultVO;
import com.lyz.trainplan.provider.ActivityHistoryProvider;
import com.lyz.trainplan.service.TaskCompletionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 活动对账定时任务
 * 定期拉取近期活动，自动完成进行中计划里能匹配上的任务
 *
 * 配置说明：
 * - schedule.activity-reconcile.enabled=true 开启（默认关闭）
 * - schedule.activity-reconcile.cron 自定义执行时间
 * - 未注册 ActivityHistoryProvider 时每次执行直接跳过
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "schedule.activity-reconcile", name = "enabled", havingValue = "true")
public class ActivityReconcileTask {

    private final TaskCompletionService taskCompletionService;
    private final ObjectProvider<ActivityHistoryProvider> activityHistoryProvider;

    @Value("${trainplan.reconcile.activity-limit:20}")
    private int activityLimit;

    /**
     * 默认每2小时执行一次
     */
    @Scheduled(cron = "${schedule.activity-reconcile.cron:0 0 */2 * * ?}")
    public void reconcileActivePlans() {
        ActivityHistoryProvider provider = activityHistoryProvider.getIfAvailable();
        if (provider == null) {
            log.debug("未配置活动数据源，跳过对账");
            return;
        }

        log.info("========== 开始执行活动对账定时任务 ==========");
        long startTime = System.currentTimeMillis();

        try {
            List<RecordedActivity> activities = provider.recentActivities(activityLimit);
            if (activities == null || activities.isEmpty()) {
                log.info("暂无近期活动，跳过对账");
                return;
            }

            List<MatchResultVO> matches = taskCompletionService.reconcileActivePlans(activities);

            long duration = (System.currentTimeMillis() - startTime) / 1000;
            log.info("========== 活动对账任务完成 ==========");
            log.info("活动数: {}, 新完成任务: {}, 耗时: {}秒", activities.size(), matches.size(), duration);
        } catch (Exception e) {
            log.error("活动对账任务执行异常", e);
        }
    }
}

package com.lyz.trainplan.provider;

import com.lyz.trainplan.model.dto.activity.RecordedActivity;

import java.util.List;

/**
 * 活动历史数据源（外部设备平台）
 */
public interface ActivityHistoryProvider {

    /**
     * 最近的活动记录
     *
     * @param limit 最多条数
     */
    List<RecordedActivity> recentActivities(int limit);
}

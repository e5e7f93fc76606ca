package com.lyz.trainplan.service;

import com.lyz.trainplan.model.dto.TaskCompletionDTO;
import com.lyz.trainplan.model.dto.activity.RecordedActivity;
import com.lyz.trainplan.model.vo.MatchResultVO;
import com.lyz.trainplan.model.vo.ScheduledTaskVO;

import java.util.List;

public interface TaskCompletionService {

    /**
     * 用活动窗口对账某个计划的未完成任务，重复调用结果一致
     *
     * @param planId     计划ID
     * @param activities 调用方拉取的近期活动
     * @return 本次新匹配的任务
     */
    List<MatchResultVO> reconcile(Long planId, List<RecordedActivity> activities);

    /**
     * 对所有进行中的计划执行对账，同一活动只会完成一个任务
     */
    List<MatchResultVO> reconcileActivePlans(List<RecordedActivity> activities);

    /**
     * 手动完成任务，已完成时为空操作
     *
     * @param taskId 任务ID
     * @param dto    实际数据，可为空
     * @return 任务当前状态
     */
    ScheduledTaskVO completeTaskManually(Long taskId, TaskCompletionDTO dto);
}

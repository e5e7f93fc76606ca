package com.lyz.trainplan.service;

import com.lyz.trainplan.model.dto.MaterializePlanDTO;
import com.lyz.trainplan.model.dto.readiness.BiometricInputs;
import com.lyz.trainplan.model.vo.MaterializeResultVO;
import com.lyz.trainplan.model.vo.PlanDetailVO;
import com.lyz.trainplan.model.vo.PlanSummaryVO;
import com.lyz.trainplan.model.vo.ScheduledTaskVO;
import com.lyz.trainplan.model.vo.TodayPlanVO;

import java.time.LocalDate;
import java.util.List;

public interface TrainingPlanService {

    /**
     * 接受计划文档并落地为具体日期的任务
     *
     * @param dto 计划文档、锚定日期、形态
     * @return 新计划ID与日期范围
     */
    MaterializeResultVO materializePlan(MaterializePlanDTO dto);

    /**
     * 进行中的计划（含完成进度）
     */
    List<PlanSummaryVO> listActivePlans();

    /**
     * 计划详情（含全部任务）
     *
     * @param planId 计划ID
     * @return 详情VO
     */
    PlanDetailVO getPlanDetail(Long planId);

    /**
     * 进行中计划在日期范围内的任务
     */
    List<ScheduledTaskVO> getTasksByDateRange(LocalDate startDate, LocalDate endDate);

    void deactivatePlan(Long planId);

    /**
     * 删除计划及其全部任务
     */
    void deletePlan(Long planId);

    /**
     * 今日训练视图：当天任务 + 就绪度建议，不改写任务
     *
     * @param inputs 当前读数
     * @param date   日期
     */
    TodayPlanVO getTodayPlan(BiometricInputs inputs, LocalDate date);
}

package com.lyz.trainplan.controller;

import com.lyz.trainplan.common.Result;
import com.lyz.trainplan.model.dto.AdjustPlanDTO;
import com.lyz.trainplan.model.dto.MaterializePlanDTO;
import com.lyz.trainplan.model.dto.ReconcileRequestDTO;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.enums.AdjustmentMode;
import com.lyz.trainplan.model.vo.AdjustmentResultVO;
import com.lyz.trainplan.model.vo.MatchResultVO;
import com.lyz.trainplan.model.vo.MaterializeResultVO;
import com.lyz.trainplan.model.vo.PlanDetailVO;
import com.lyz.trainplan.model.vo.PlanSummaryVO;
import com.lyz.trainplan.service.PlanAdjustmentService;
import com.lyz.trainplan.service.ReadinessService;
import com.lyz.trainplan.service.TaskCompletionService;
import com.lyz.trainplan.service.TrainingPlanService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/plans")
@Slf4j
public class TrainingPlanController {

    @Autowired
    private TrainingPlanService trainingPlanService;

    @Autowired
    private TaskCompletionService taskCompletionService;

    @Autowired
    private PlanAdjustmentService planAdjustmentService;

    @Autowired
    private ReadinessService readinessService;

    /**
     * 接受计划文档，落地为具体日期的任务
     */
    @PostMapping
    public Result<MaterializeResultVO> materialize(@Valid @RequestBody MaterializePlanDTO dto) {
        log.info("接受计划, anchorDate={}, shape={}", dto.getAnchorDate(), dto.getShape());
        MaterializeResultVO vo = trainingPlanService.materializePlan(dto);
        return Result.success("计划已创建", vo);
    }

    @GetMapping("/active")
    public Result<List<PlanSummaryVO>> listActivePlans() {
        return Result.success(trainingPlanService.listActivePlans());
    }

    @GetMapping("/{planId}")
    public Result<PlanDetailVO> getPlanDetail(@PathVariable Long planId) {
        return Result.success(trainingPlanService.getPlanDetail(planId));
    }

    /**
     * 用调用方提供的活动窗口对账
     */
    @PostMapping("/{planId}/reconcile")
    public Result<List<MatchResultVO>> reconcile(@PathVariable Long planId,
                                                 @RequestBody ReconcileRequestDTO dto) {
        List<MatchResultVO> matches = taskCompletionService.reconcile(planId, dto.getActivities());
        return Result.success("本次匹配 " + matches.size() + " 个任务", matches);
    }

    /**
     * 对所有进行中的计划对账
     */
    @PostMapping("/reconcile")
    public Result<List<MatchResultVO>> reconcileActivePlans(@RequestBody ReconcileRequestDTO dto) {
        List<MatchResultVO> matches = taskCompletionService.reconcileActivePlans(dto.getActivities());
        return Result.success("本次匹配 " + matches.size() + " 个任务", matches);
    }

    /**
     * 按当前读数调整剩余任务
     */
    @PostMapping("/{planId}/adjust")
    public Result<AdjustmentResultVO> adjust(@PathVariable Long planId,
                                             @Valid @RequestBody AdjustPlanDTO dto) {
        AdjustmentMode mode = AdjustmentMode.fromCode(dto.getMode());
        ReadinessSnapshot readiness = readinessService.evaluate(readinessService.toInputs(dto.getReadiness()));
        log.info("调整计划, planId={}, mode={}, score={}", planId, mode, readiness.getScore());
        return Result.success(planAdjustmentService.adjust(planId, readiness, mode));
    }

    @PostMapping("/{planId}/deactivate")
    public Result<Void> deactivate(@PathVariable Long planId) {
        trainingPlanService.deactivatePlan(planId);
        return Result.success("计划已停用", null);
    }

    @DeleteMapping("/{planId}")
    public Result<Void> delete(@PathVariable Long planId) {
        trainingPlanService.deletePlan(planId);
        return Result.success("计划已删除", null);
    }
}

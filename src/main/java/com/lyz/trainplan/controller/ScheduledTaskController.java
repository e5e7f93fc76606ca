package com.lyz.trainplan.controller;

import com.lyz.trainplan.common.Result;
import com.lyz.trainplan.model.dto.TaskCompletionDTO;
import com.lyz.trainplan.model.vo.ScheduledTaskVO;
import com.lyz.trainplan.service.TaskCompletionService;
import com.lyz.trainplan.service.TrainingPlanService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/tasks")
@Slf4j
public class ScheduledTaskController {

    @Autowired
    private TrainingPlanService trainingPlanService;

    @Autowired
    private TaskCompletionService taskCompletionService;

    /**
     * 进行中计划在日期范围内的任务（包含两端）
     */
    @GetMapping
    public Result<List<ScheduledTaskVO>> listByDateRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return Result.success(trainingPlanService.getTasksByDateRange(startDate, endDate));
    }

    /**
     * 手动完成任务，重复提交无副作用
     */
    @PostMapping("/{taskId}/complete")
    public Result<ScheduledTaskVO> complete(@PathVariable Long taskId,
                                            @Valid @RequestBody(required = false) TaskCompletionDTO dto) {
        log.info("手动完成任务, taskId={}", taskId);
        return Result.success("任务已完成", taskCompletionService.completeTaskManually(taskId, dto));
    }
}

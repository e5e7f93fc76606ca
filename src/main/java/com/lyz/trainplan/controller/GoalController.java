package com.lyz.trainplan.controller;

import com.lyz.trainplan.common.Result;
import com.lyz.trainplan.model.dto.GoalDTO;
import com.lyz.trainplan.model.dto.GoalProgressDTO;
import com.lyz.trainplan.model.vo.FitnessGoalVO;
import com.lyz.trainplan.service.GoalService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/goals")
@Slf4j
public class GoalController {

    @Autowired
    private GoalService goalService;

    @GetMapping
    public Result<List<FitnessGoalVO>> listGoals(@RequestParam(defaultValue = "true") boolean activeOnly) {
        return Result.success(goalService.listGoals(activeOnly));
    }

    @PostMapping
    public Result<FitnessGoalVO> createGoal(@Valid @RequestBody GoalDTO dto) {
        return Result.success("目标已创建", goalService.createGoal(dto));
    }

    /**
     * 更新进度，达到目标值时自动完成
     */
    @PutMapping("/{goalId}/progress")
    public Result<FitnessGoalVO> updateProgress(@PathVariable Long goalId,
                                                @Valid @RequestBody GoalProgressDTO dto) {
        log.info("更新目标进度, goalId={}, current={}", goalId, dto.getCurrentValue());
        return Result.success("目标进度已更新", goalService.updateProgress(goalId, dto));
    }
}

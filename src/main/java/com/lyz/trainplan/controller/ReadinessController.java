package com.lyz.trainplan.controller;

import com.lyz.trainplan.common.Result;
import com.lyz.trainplan.model.dto.ReadinessRequestDTO;
import com.lyz.trainplan.model.dto.readiness.BiometricInputs;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.vo.TodayPlanVO;
import com.lyz.trainplan.service.ReadinessService;
import com.lyz.trainplan.service.TrainingPlanService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/readiness")
@Slf4j
public class ReadinessController {

    @Autowired
    private ReadinessService readinessService;

    @Autowired
    private TrainingPlanService trainingPlanService;

    /**
     * 评估就绪度，读数均可缺省
     */
    @PostMapping("/evaluate")
    public Result<ReadinessSnapshot> evaluate(@Valid @RequestBody ReadinessRequestDTO dto) {
        return Result.success(readinessService.evaluate(readinessService.toInputs(dto)));
    }

    /**
     * 今日训练 + 自动调节建议
     */
    @PostMapping("/today-plan")
    public Result<TodayPlanVO> todayPlan(@Valid @RequestBody ReadinessRequestDTO dto) {
        BiometricInputs inputs = readinessService.toInputs(dto);
        return Result.success(trainingPlanService.getTodayPlan(inputs, inputs.getAsOf()));
    }
}

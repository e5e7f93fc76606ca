package com.lyz.trainplan.service.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.trainplan.model.entity.ScheduledTask;
import com.lyz.trainplan.model.entity.TrainingPlan;
import com.lyz.trainplan.model.vo.PlanSummaryVO;
import com.lyz.trainplan.model.vo.ScheduledTaskVO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Entity -> VO 转换
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanViewAssembler {

    private final ObjectMapper objectMapper;

    public PlanSummaryVO toSummaryVO(TrainingPlan plan) {
        PlanSummaryVO vo = new PlanSummaryVO();
        vo.setId(plan.getId());
        vo.setPlanName(plan.getPlanName());
        vo.setShape(plan.getShape());
        vo.setStartDate(plan.getStartDate());
        vo.setEndDate(plan.getEndDate());
        vo.setPrimaryGoal(plan.getPrimaryGoal());
        vo.setIsActive(plan.getIsActive());
        vo.setTotalTaskCount(plan.getTotalTaskCount());
        vo.setCompletedTaskCount(plan.getCompletedTaskCount());
        vo.setProgressPercentage(progress(plan.getCompletedTaskCount(), plan.getTotalTaskCount()));
        vo.setCreatedAt(plan.getCreatedAt());
        return vo;
    }

    public ScheduledTaskVO toTaskVO(ScheduledTask task) {
        ScheduledTaskVO vo = new ScheduledTaskVO();
        vo.setId(task.getId());
        vo.setPlanId(task.getPlanId());
        vo.setScheduledDate(task.getScheduledDate());
        vo.setSlot(task.getSlot());
        vo.setCategory(task.getCategory());
        vo.setTitle(task.getTitle());
        vo.setDescription(task.getDescription());
        vo.setDurationMinutes(task.getDurationMinutes());
        vo.setIntensity(task.getIntensity());
        vo.setTargetHr(task.getTargetHr());
        vo.setTargetHrBpm(task.getTargetHrBpm());
        vo.setEstimatedCalories(task.getEstimatedCalories());
        vo.setEstimatedDistanceKm(task.getEstimatedDistanceKm());
        vo.setKeyFocus(task.getKeyFocus());
        vo.setOptimalTime(task.getOptimalTime());
        vo.setSteps(readJson(task.getStepsJson(), task.getId()));
        vo.setIsCompleted(task.getIsCompleted());
        vo.setCompletedAt(task.getCompletedAt());
        vo.setLinkedActivityId(task.getLinkedActivityId());
        vo.setActualDurationMinutes(task.getActualDurationMinutes());
        vo.setActualCalories(task.getActualCalories());
        vo.setActualAvgHr(task.getActualAvgHr());
        vo.setNotes(task.getNotes());
        vo.setOriginalDurationMinutes(task.getOriginalDurationMinutes());
        vo.setOriginalIntensity(task.getOriginalIntensity());
        vo.setAdjustmentReason(task.getAdjustmentReason());
        return vo;
    }

    /**
     * 原始 JSON 字符串 -> JsonNode，解析失败返回 null
     */
    public JsonNode readJson(String json, Long ownerId) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            log.error("JSON解析失败, id={}", ownerId, e);
            return null;
        }
    }

    private BigDecimal progress(Integer completed, Integer total) {
        if (total == null || total == 0) {
            return BigDecimal.ZERO;
        }
        int done = completed != null ? completed : 0;
        return BigDecimal.valueOf(done * 100L)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }
}

package com.lyz.trainplan.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.trainplan.common.TaskCategoryConstants;
import com.lyz.trainplan.common.exception.PlanValidationException;
import com.lyz.trainplan.common.exception.ResourceNotFoundException;
import com.lyz.trainplan.mapper.ScheduledTaskMapper;
import com.lyz.trainplan.mapper.TrainingPlanMapper;
import com.lyz.trainplan.model.dto.MaterializePlanDTO;
import com.lyz.trainplan.model.dto.plan.PlanDocument;
import com.lyz.trainplan.model.dto.readiness.BiometricInputs;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.entity.ScheduledTask;
import com.lyz.trainplan.model.entity.TrainingPlan;
import com.lyz.trainplan.model.enums.IntensityTier;
import com.lyz.trainplan.model.enums.PlanShape;
import com.lyz.trainplan.model.vo.MaterializeResultVO;
import com.lyz.trainplan.model.vo.PlanDetailVO;
import com.lyz.trainplan.model.vo.PlanSummaryVO;
import com.lyz.trainplan.model.vo.ScheduledTaskVO;
import com.lyz.trainplan.model.vo.TodayPlanVO;
import com.lyz.trainplan.service.ReadinessService;
import com.lyz.trainplan.service.TrainingPlanService;
import com.lyz.trainplan.service.builder.TaskScheduleBuilder;
import com.lyz.trainplan.service.component.PlanDetailCache;
import com.lyz.trainplan.service.component.PlanDocumentParser;
import com.lyz.trainplan.service.component.PlanViewAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 训练计划落地与查询
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingPlanServiceImpl implements TrainingPlanService {

    static final String REST_GUIDANCE = "Swap for rest or a Zone 1 recovery session";
    static final String REDUCE_GUIDANCE = "Easy pace only, no intervals";

    private final TrainingPlanMapper trainingPlanMapper;
    private final ScheduledTaskMapper scheduledTaskMapper;
    private final PlanDocumentParser planDocumentParser;
    private final TaskScheduleBuilder taskScheduleBuilder;
    private final PlanViewAssembler planViewAssembler;
    private final PlanDetailCache planDetailCache;
    private final ReadinessService readinessService;
    private final ObjectMapper objectMapper;

    /**
     * 落地计划：解析 -> 展开日期 -> 计划与任务同一事务写入
     */
    @Override
    @Transactional(rollbackFor = Exception.class)
    public MaterializeResultVO materializePlan(MaterializePlanDTO dto) {
        // 1. 校验文档（落库前）
        PlanShape requestedShape = PlanShape.fromCode(dto.getShape());
        PlanDocument document = planDocumentParser.parse(dto.getDocument(), requestedShape);

        // 2. 展开为具体日期
        LocalDate anchor = dto.getAnchorDate() != null ? dto.getAnchorDate() : LocalDate.now();
        TaskScheduleBuilder.Schedule schedule = taskScheduleBuilder.build(document, anchor);
        List<ScheduledTask> tasks = schedule.getTasks();

        // 3. 写入计划
        LocalDateTime now = LocalDateTime.now();
        TrainingPlan plan = new TrainingPlan();
        plan.setPlanName(StringUtils.defaultIfBlank(dto.getPlanName(), defaultPlanName(document.getShape(), schedule.getStartDate())));
        plan.setShape(document.getShape());
        plan.setStartDate(schedule.getStartDate());
        plan.setEndDate(schedule.getEndDate());
        plan.setPrimaryGoal(dto.getPrimaryGoal());
        plan.setPlanJson(toJson(dto));
        plan.setIsActive(true);
        plan.setTotalTaskCount(tasks.size());
        plan.setCompletedTaskCount(0);
        plan.setCreatedAt(now);
        plan.setUpdatedAt(now);
        trainingPlanMapper.insert(plan);

        // 4. 批量写入任务
        for (ScheduledTask task : tasks) {
            task.setPlanId(plan.getId());
            task.setCreatedAt(now);
            task.setUpdatedAt(now);
        }
        scheduledTaskMapper.insertBatch(tasks);

        if (dto.isDeactivateOthers()) {
            List<TrainingPlan> previouslyActive = trainingPlanMapper.selectActive();
            int deactivated = trainingPlanMapper.deactivateAllExcept(plan.getId());
            // 被停用计划的详情缓存同步失效
            for (TrainingPlan other : previouslyActive) {
                if (!plan.getId().equals(other.getId())) {
                    planDetailCache.evict(other.getId());
                }
            }
            log.info("已停用其他进行中计划 {} 个", deactivated);
        }

        log.info("计划已落地, planId={}, shape={}, {} ~ {}, 任务数={}",
                plan.getId(), plan.getShape(), plan.getStartDate(), plan.getEndDate(), tasks.size());
        return new MaterializeResultVO(plan.getId(), plan.getStartDate(), plan.getEndDate(), tasks.size());
    }

    @Override
    public List<PlanSummaryVO> listActivePlans() {
        return trainingPlanMapper.selectActive().stream()
                .map(planViewAssembler::toSummaryVO)
                .collect(Collectors.toList());
    }

    @Override
    public PlanDetailVO getPlanDetail(Long planId) {
        PlanDetailVO cached = planDetailCache.get(planId);
        if (cached != null) {
            return cached;
        }

        TrainingPlan plan = requirePlan(planId);
        PlanDetailVO detail = new PlanDetailVO();
        detail.setSummary(planViewAssembler.toSummaryVO(plan));
        detail.setDocument(planViewAssembler.readJson(plan.getPlanJson(), planId));
        detail.setTasks(scheduledTaskMapper.selectByPlanId(planId).stream()
                .map(planViewAssembler::toTaskVO)
                .collect(Collectors.toList()));

        planDetailCache.put(planId, detail);
        return detail;
    }

    @Override
    public List<ScheduledTaskVO> getTasksByDateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("开始日期不能晚于结束日期");
        }
        return scheduledTaskMapper.selectByDateRange(startDate, endDate).stream()
                .map(planViewAssembler::toTaskVO)
                .collect(Collectors.toList());
    }

    @Override
    public void deactivatePlan(Long planId) {
        requirePlan(planId);
        trainingPlanMapper.deactivate(planId);
        planDetailCache.evict(planId);
        log.info("计划已停用, planId={}", planId);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deletePlan(Long planId) {
        requirePlan(planId);
        int taskCount = scheduledTaskMapper.deleteByPlanId(planId);
        trainingPlanMapper.deleteById(planId);
        planDetailCache.evict(planId);
        log.info("计划已删除, planId={}, 删除任务数={}", planId, taskCount);
    }

    /**
     * 今日视图只给建议，不改写任务
     */
    @Override
    public TodayPlanVO getTodayPlan(BiometricInputs inputs, LocalDate date) {
        LocalDate today = date != null ? date : LocalDate.now();
        ReadinessSnapshot readiness = readinessService.evaluate(
                inputs != null ? inputs : BiometricInputs.empty(today));

        TodayPlanVO vo = new TodayPlanVO();
        vo.setDate(today);
        vo.setReadiness(readiness);

        for (ScheduledTask task : scheduledTaskMapper.selectByDateRange(today, today)) {
            vo.getItems().add(autoregulate(task, readiness));
        }
        return vo;
    }

    private TodayPlanVO.Item autoregulate(ScheduledTask task, ReadinessSnapshot readiness) {
        TodayPlanVO.Item item = new TodayPlanVO.Item();
        item.setTask(planViewAssembler.toTaskVO(task));
        item.setSuggestedIntensity(task.getIntensity());

        if (Boolean.TRUE.equals(task.getIsCompleted()) || TaskCategoryConstants.isRest(task.getCategory())) {
            return item;
        }

        switch (readiness.getDirective()) {
            case REST -> {
                item.setAutoregulated(true);
                item.setSuggestedIntensity(IntensityTier.LOW);
                item.setGuidance(REST_GUIDANCE);
            }
            case REDUCE -> {
                if (task.getIntensity() == IntensityTier.HIGH) {
                    item.setAutoregulated(true);
                    item.setSuggestedIntensity(IntensityTier.MODERATE);
                    item.setGuidance(REDUCE_GUIDANCE);
                }
            }
            case PROCEED -> item.setAutoregulated(false);
        }
        return item;
    }

    private TrainingPlan requirePlan(Long planId) {
        TrainingPlan plan = trainingPlanMapper.selectById(planId);
        if (plan == null) {
            throw new ResourceNotFoundException("TrainingPlan", planId);
        }
        return plan;
    }

    private String defaultPlanName(PlanShape shape, LocalDate startDate) {
        String prefix = shape == PlanShape.MULTI_WEEK_BLOCK ? "Training Block" : "Weekly Plan";
        return prefix + " " + startDate.format(DateTimeFormatter.ISO_DATE);
    }

    private String toJson(MaterializePlanDTO dto) {
        try {
            return objectMapper.writeValueAsString(dto.getDocument());
        } catch (JsonProcessingException e) {
            log.error("计划文档序列化失败", e);
            throw new PlanValidationException("计划文档无法序列化", e);
        }
    }
}

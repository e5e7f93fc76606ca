package com.lyz.trainplan.mapper;

import com.lyz.trainplan.model.entity.ScheduledTask;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface ScheduledTaskMapper {

    /**
     * 批量插入某计划的全部任务
     */
    int insertBatch(@Param("tasks") List<ScheduledTask> tasks);

    ScheduledTask selectById(@Param("id") Long id);

    /**
     * 查询计划下全部任务（按日期、序号排序）
     */
    List<ScheduledTask> selectByPlanId(@Param("planId") Long planId);

    List<ScheduledTask> selectIncompleteByPlanId(@Param("planId") Long planId);

    /**
     * 查询进行中计划在日期范围内的任务（包含两端）
     */
    List<ScheduledTask> selectByDateRange(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    /**
     * 计划下已关联的活动ID，对账时排除
     */
    List<String> selectLinkedActivityIds(@Param("planId") Long planId);

    /**
     * 标记完成，仅当任务仍未完成时生效
     *
     * @return 受影响行数，0 表示任务已完成或不存在
     */
    int markCompleted(
            @Param("id") Long id,
            @Param("completedAt") LocalDateTime completedAt,
            @Param("linkedActivityId") String linkedActivityId,
            @Param("actualDurationMinutes") Integer actualDurationMinutes,
            @Param("actualCalories") Integer actualCalories,
            @Param("actualAvgHr") Integer actualAvgHr,
            @Param("notes") String notes
    );

    /**
     * 写入调整后的时长/强度与标注，仅当任务仍未完成时生效
     * 原始值只在第一次调整时记录
     */
    int updateAdjustment(ScheduledTask task);

    int deleteByPlanId(@Param("planId") Long planId);
}

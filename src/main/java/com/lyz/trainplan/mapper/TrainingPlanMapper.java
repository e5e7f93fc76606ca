package com.lyz.trainplan.mapper;

import com.lyz.trainplan.model.entity.TrainingPlan;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface TrainingPlanMapper {

    /**
     * 插入计划，回填自增ID
     */
    int insert(TrainingPlan plan);

    TrainingPlan selectById(@Param("id") Long id);

    /**
     * 查询进行中的计划（按开始日期倒序）
     */
    List<TrainingPlan> selectActive();

    /**
     * 完成数 +1，不超过总任务数
     */
    int incrementCompletedCount(@Param("id") Long id);

    int deactivate(@Param("id") Long id);

    /**
     * 停用除指定计划外的所有进行中计划
     */
    int deactivateAllExcept(@Param("keepId") Long keepId);

    int deleteById(@Param("id") Long id);
}

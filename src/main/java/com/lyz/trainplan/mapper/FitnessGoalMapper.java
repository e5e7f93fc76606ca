package com.lyz.trainplan.mapper;

import com.lyz.trainplan.model.entity.FitnessGoal;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface FitnessGoalMapper {

    /**
     * 插入目标，回填自增ID
     */
    int insert(FitnessGoal goal);

    FitnessGoal selectById(@Param("id") Long id);

    /**
     * 进行中的目标，优先级高的在前
     */
    List<FitnessGoal> selectActive();

    List<FitnessGoal> selectAll();

    /**
     * 更新当前值与完成状态
     */
    int updateProgress(FitnessGoal goal);
}

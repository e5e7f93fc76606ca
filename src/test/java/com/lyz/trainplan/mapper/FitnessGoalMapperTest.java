package com.lyz.trainplan.mapper;

import com.lyz.trainplan.model.entity.FitnessGoal;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.jdbc.Sql;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@MybatisTest
@Sql("/schema.sql")
class FitnessGoalMapperTest {

    @Autowired
    private FitnessGoalMapper fitnessGoalMapper;

    private FitnessGoal insertGoal(String name, int priority, boolean active) {
        LocalDateTime now = LocalDateTime.now();
        FitnessGoal goal = new FitnessGoal();
        goal.setName(name);
        goal.setCategory("cardio");
        goal.setTargetValue(new BigDecimal("120.00"));
        goal.setCurrentValue(BigDecimal.ZERO);
        goal.setUnit("km");
        goal.setTimeframe("monthly");
        goal.setStartDate(LocalDate.of(2024, 6, 1));
        goal.setIsActive(active);
        goal.setIsCompleted(false);
        goal.setAiRecommended(false);
        goal.setPriority(priority);
        goal.setCreatedAt(now);
        goal.setUpdatedAt(now);
        fitnessGoalMapper.insert(goal);
        return goal;
    }

    @Test
    void active_goals_ordered_by_priority() {
        insertGoal("low", 1, true);
        insertGoal("high", 5, true);
        insertGoal("archived", 9, false);

        List<FitnessGoal> active = fitnessGoalMapper.selectActive();

        assertEquals(2, active.size());
        assertEquals("high", active.get(0).getName());
        assertEquals("low", active.get(1).getName());
        assertEquals(3, fitnessGoalMapper.selectAll().size());
    }

    @Test
    void progress_update_persists_completion() {
        FitnessGoal goal = insertGoal("distance", 0, true);
        assertNotNull(goal.getId());

        LocalDateTime now = LocalDateTime.of(2024, 6, 20, 9, 30);
        goal.setCurrentValue(new BigDecimal("121.50"));
        goal.setIsCompleted(true);
        goal.setCompletedAt(now);
        goal.setUpdatedAt(now);
        assertEquals(1, fitnessGoalMapper.updateProgress(goal));

        FitnessGoal loaded = fitnessGoalMapper.selectById(goal.getId());
        assertEquals(0, new BigDecimal("121.50").compareTo(loaded.getCurrentValue()));
        assertTrue(loaded.getIsCompleted());
        assertEquals(now, loaded.getCompletedAt());
    }
}

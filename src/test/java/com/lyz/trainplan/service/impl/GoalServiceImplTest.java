package com.lyz.trainplan.service.impl;

import com.lyz.trainplan.common.exception.ResourceNotFoundException;
import com.lyz.trainplan.mapper.FitnessGoalMapper;
import com.lyz.trainplan.model.dto.GoalDTO;
import com.lyz.trainplan.model.dto.GoalProgressDTO;
import com.lyz.trainplan.model.entity.FitnessGoal;
import com.lyz.trainplan.model.vo.FitnessGoalVO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class GoalServiceImplTest {

    private FitnessGoalMapper fitnessGoalMapper;
    private GoalServiceImpl service;

    @BeforeEach
    void setUp() {
        fitnessGoalMapper = mock(FitnessGoalMapper.class);
        service = new GoalServiceImpl(fitnessGoalMapper);
    }

    private static FitnessGoal goal(String current, String target, boolean completed) {
        FitnessGoal goal = new FitnessGoal();
        goal.setId(3L);
        goal.setName("Monthly distance");
        goal.setCurrentValue(new BigDecimal(current));
        goal.setTargetValue(new BigDecimal(target));
        goal.setIsActive(true);
        goal.setIsCompleted(completed);
        return goal;
    }

    @Test
    void create_applies_defaults() {
        doAnswer(inv -> {
            FitnessGoal g = inv.getArgument(0);
            g.setId(11L);
            return 1;
        }).when(fitnessGoalMapper).insert(any(FitnessGoal.class));
        GoalDTO dto = new GoalDTO();
        dto.setTargetValue(new BigDecimal("120"));
        dto.setUnit("km");

        FitnessGoalVO vo = service.createGoal(dto);

        ArgumentCaptor<FitnessGoal> captor = ArgumentCaptor.forClass(FitnessGoal.class);
        verify(fitnessGoalMapper).insert(captor.capture());
        FitnessGoal saved = captor.getValue();
        assertEquals("Goal", saved.getName());
        assertEquals(0, BigDecimal.ZERO.compareTo(saved.getCurrentValue()));
        assertEquals(LocalDate.now(), saved.getStartDate());
        assertTrue(saved.getIsActive());
        assertFalse(saved.getIsCompleted());
        assertEquals(0, saved.getPriority());
        assertEquals(11L, vo.getId());
        assertEquals(0, BigDecimal.ZERO.compareTo(vo.getProgressPercentage()));
    }

    @Test
    void progress_below_target_stays_open() {
        when(fitnessGoalMapper.selectById(3L)).thenReturn(goal("10", "120", false));
        GoalProgressDTO dto = new GoalProgressDTO();
        dto.setCurrentValue(new BigDecimal("30"));

        FitnessGoalVO vo = service.updateProgress(3L, dto);

        assertFalse(vo.getIsCompleted());
        assertNull(vo.getCompletedAt());
        assertEquals(new BigDecimal("25.00"), vo.getProgressPercentage());
        verify(fitnessGoalMapper).updateProgress(argThat(g -> !g.getIsCompleted()
                && g.getCurrentValue().compareTo(new BigDecimal("30")) == 0));
    }

    @Test
    void reaching_target_completes_goal() {
        when(fitnessGoalMapper.selectById(3L)).thenReturn(goal("100", "120", false));
        GoalProgressDTO dto = new GoalProgressDTO();
        dto.setCurrentValue(new BigDecimal("120"));

        FitnessGoalVO vo = service.updateProgress(3L, dto);

        assertTrue(vo.getIsCompleted());
        assertNotNull(vo.getCompletedAt());
        assertEquals(new BigDecimal("100.00"), vo.getProgressPercentage());
    }

    @Test
    void overshoot_is_capped_and_first_completion_time_kept() {
        FitnessGoal done = goal("120", "120", true);
        LocalDateTime firstCompletion = LocalDateTime.of(2024, 6, 1, 8, 0);
        done.setCompletedAt(firstCompletion);
        when(fitnessGoalMapper.selectById(3L)).thenReturn(done);
        GoalProgressDTO dto = new GoalProgressDTO();
        dto.setCurrentValue(new BigDecimal("150"));

        FitnessGoalVO vo = service.updateProgress(3L, dto);

        assertEquals(firstCompletion, vo.getCompletedAt());
        assertEquals(new BigDecimal("100.00"), vo.getProgressPercentage());
    }

    @Test
    void unknown_goal() {
        GoalProgressDTO dto = new GoalProgressDTO();
        dto.setCurrentValue(BigDecimal.ONE);

        assertThrows(ResourceNotFoundException.class, () -> service.updateProgress(99L, dto));
        verify(fitnessGoalMapper, never()).updateProgress(any());
    }

    @Test
    void list_switches_on_active_flag() {
        when(fitnessGoalMapper.selectActive()).thenReturn(List.of(goal("1", "2", false)));
        when(fitnessGoalMapper.selectAll()).thenReturn(List.of(goal("1", "2", false), goal("2", "2", true)));

        assertEquals(1, service.listGoals(true).size());
        assertEquals(2, service.listGoals(false).size());
    }
}

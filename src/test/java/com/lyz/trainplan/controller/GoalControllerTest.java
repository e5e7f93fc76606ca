package com.lyz.trainplan.controller;

import com.lyz.trainplan.common.exception.ResourceNotFoundException;
import com.lyz.trainplan.model.dto.GoalProgressDTO;
import com.lyz.trainplan.model.vo.FitnessGoalVO;
import com.lyz.trainplan.service.GoalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GoalController.class)
class GoalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GoalService goalService;

    @Test
    void list_defaults_to_active_goals() throws Exception {
        when(goalService.listGoals(true)).thenReturn(List.of(new FitnessGoalVO()));

        mockMvc.perform(get("/api/goals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));

        verify(goalService).listGoals(true);
    }

    @Test
    void create_requires_target_value() throws Exception {
        mockMvc.perform(post("/api/goals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Run more\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("目标值不能为空"));

        verifyNoInteractions(goalService);
    }

    @Test
    void progress_on_unknown_goal_is_404() throws Exception {
        when(goalService.updateProgress(eq(9L), any(GoalProgressDTO.class)))
                .thenThrow(new ResourceNotFoundException("FitnessGoal", 9L));

        mockMvc.perform(put("/api/goals/9/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentValue\": 42}"))
                .andExpect(status().isNotFound());
    }
}

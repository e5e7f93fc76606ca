package com.lyz.trainplan.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 单条匹配结果：任务 <- 活动
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResultVO {
    private Long planId;
    private Long taskId;
    private String taskTitle;
    private LocalDate taskDate;
    private String activityId;
    private String activityName;
    private String activityType;
}

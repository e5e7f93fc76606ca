package com.lyz.trainplan.model.dto.activity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 设备记录的真实活动
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordedActivity {
    private String activityId;
    private String activityName;

    /**
     * 活动类型，如 running / treadmill_running / strength_training
     */
    private String activityType;

    /**
     * 本地开始时间
     */
    private LocalDateTime startTime;

    private Integer durationSeconds;
    private Double distanceMeters;
    private Integer calories;
    private Integer averageHr;

    public LocalDate getActivityDate() {
        return startTime != null ? startTime.toLocalDate() : null;
    }

    /**
     * 秒转分钟，四舍五入
     */
    public Integer getDurationMinutes() {
        return durationSeconds != null ? (int) Math.round(durationSeconds / 60.0) : null;
    }
}

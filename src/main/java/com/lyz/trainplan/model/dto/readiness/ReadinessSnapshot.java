package com.lyz.trainplan.model.dto.readiness;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * 当日就绪度快照（不落库）
 */
@Data
@Builder
public class ReadinessSnapshot {

    // 指令：PROCEED(照常), REDUCE(降强度), REST(休息)
    public enum Directive {
        PROCEED,
        REDUCE,
        REST
    }

    private LocalDate asOf;

    // 输入信号，缺失为 null
    private Integer energyReserve;
    private Integer sleepQuality;
    private HrvStatus hrvStatus;
    private Integer restingHeartRate;
    private Integer stressLevel;

    // 派生结果
    private int score;
    private Directive directive;
    private String reason;
}

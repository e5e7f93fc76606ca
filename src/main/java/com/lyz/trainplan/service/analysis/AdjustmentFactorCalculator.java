package com.lyz.trainplan.service.analysis;

import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.enums.AdjustmentMode;
import lombok.Builder;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 负荷系数计算组件
 * AUTO 模式下各条规则相乘叠加；手动模式给出固定系数
 */
@Component
public class AdjustmentFactorCalculator {

    @Data
    @Builder
    public static class LoadAdjustment {
        private double factor;              // 组合后的时长系数
        private boolean needsMoreRecovery;  // 为 true 时 HIGH 降为 MODERATE
        private List<String> rationale;
    }

    public LoadAdjustment calculate(AdjustmentMode mode, ReadinessSnapshot readiness) {
        AdjustmentMode effective = mode != null ? mode : AdjustmentMode.AUTO;
        return switch (effective) {
            case MANUAL_INCREASE -> LoadAdjustment.builder()
                    .factor(1.15)
                    .rationale(List.of("Manual increase in intensity"))
                    .build();
            case MANUAL_DECREASE -> LoadAdjustment.builder()
                    .factor(0.8)
                    .rationale(List.of("Manual decrease in intensity"))
                    .build();
            case ADD_RECOVERY -> LoadAdjustment.builder()
                    .factor(1.0)
                    .needsMoreRecovery(true)
                    .rationale(List.of("Added extra recovery emphasis"))
                    .build();
            case AUTO -> calculateAuto(readiness);
        };
    }

    private LoadAdjustment calculateAuto(ReadinessSnapshot readiness) {
        double factor = 1.0;
        boolean needsMoreRecovery = false;
        List<String> rationale = new ArrayList<>();

        if (readiness == null) {
            return LoadAdjustment.builder().factor(factor).rationale(rationale).build();
        }

        // 1. 综合分
        double normalized = readiness.getScore() / 100.0;
        if (normalized < 0.5) {
            factor = 0.7;
            rationale.add("Reduced intensity due to low readiness");
        } else if (normalized < 0.7) {
            factor = 0.85;
            rationale.add("Slightly reduced intensity");
        } else if (normalized > 0.85) {
            factor = 1.1;
            rationale.add("Increased intensity due to good readiness");
        }

        // 2. 睡眠差需要更多恢复
        Integer sleep = readiness.getSleepQuality();
        if (sleep != null && sleep < 50) {
            factor *= 0.9;
            needsMoreRecovery = true;
            rationale.add("Sleep quality low - prioritizing recovery");
        }

        // 3. 高压力
        Integer stress = readiness.getStressLevel();
        if (stress != null && stress > 60) {
            factor *= 0.85;
            rationale.add("High stress detected - favoring easy workouts");
        }

        return LoadAdjustment.builder()
                .factor(factor)
                .needsMoreRecovery(needsMoreRecovery)
                .rationale(rationale)
                .build();
    }
}

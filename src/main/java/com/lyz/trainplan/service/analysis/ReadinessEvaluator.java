package com.lyz.trainplan.service.analysis;

import com.lyz.trainplan.model.dto.readiness.BiometricInputs;
import com.lyz.trainplan.model.dto.readiness.HrvStatus;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot;
import com.lyz.trainplan.model.dto.readiness.ReadinessSnapshot.Directive;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * 当日就绪度评估器
 * 基础分 + 各信号加减分得到连续分数；急性疲劳信号（能量储备、睡眠）作为硬性覆盖，优先于分数
 */
@Slf4j
@Component
public class ReadinessEvaluator {

    static final int BASELINE_SCORE = 70;
    static final int MIN_SCORE = 0;
    static final int MAX_SCORE = 100;

    // 硬性休息阈值
    static final int REST_ENERGY_THRESHOLD = 30;
    static final int REST_SLEEP_THRESHOLD = 40;

    static final int REDUCE_SCORE_THRESHOLD = 50;

    /**
     * 主评估入口，缺失信号不参与计算，永不抛错
     */
    public ReadinessSnapshot evaluate(BiometricInputs inputs) {
        EvaluationContext ctx = new EvaluationContext(
                inputs.energyReserve(),
                inputs.sleepQuality(),
                inputs.stressLevel(),
                inputs.hrvStatus());

        int score = computeScore(ctx);

        ReadinessSnapshot snapshot = ReadinessSnapshot.builder()
                .asOf(inputs.getAsOf())
                .energyReserve(boxed(ctx.energy))
                .sleepQuality(boxed(ctx.sleep))
                .stressLevel(boxed(ctx.stress))
                .restingHeartRate(boxed(inputs.restingHeartRate()))
                .hrvStatus(ctx.hrv)
                .score(score)
                .directive(Directive.PROCEED)
                .build();

        // 优先级：休息 > HRV失衡 > 低分
        if (checkRest(ctx, snapshot)) {
            return logged(snapshot);
        }
        if (checkHrv(ctx, snapshot)) {
            return logged(snapshot);
        }
        checkScore(snapshot);
        return logged(snapshot);
    }

    // ================== 打分 ==================

    private int computeScore(EvaluationContext ctx) {
        int score = BASELINE_SCORE;

        if (ctx.energy.isPresent()) {
            int energy = ctx.energy.getAsInt();
            if (energy >= 70) {
                score += 15;
            } else if (energy >= 50) {
                score += 5;
            } else if (energy < 30) {
                score -= 20;
            } else {
                score -= 10;
            }
        }

        if (ctx.sleep.isPresent()) {
            int sleep = ctx.sleep.getAsInt();
            if (sleep >= 80) {
                score += 10;
            } else if (sleep >= 60) {
                score += 5;
            } else if (sleep < 40) {
                score -= 15;
            }
        }

        if (ctx.stress.isPresent()) {
            int stress = ctx.stress.getAsInt();
            if (stress < 25) {
                score += 5;
            } else if (stress > 60) {
                score -= 10;
            }
        }

        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    // ================== 指令判定 ==================

    private boolean checkRest(EvaluationContext ctx, ReadinessSnapshot snapshot) {
        boolean lowEnergy = ctx.energy.isPresent() && ctx.energy.getAsInt() < REST_ENERGY_THRESHOLD;
        boolean poorSleep = ctx.sleep.isPresent() && ctx.sleep.getAsInt() < REST_SLEEP_THRESHOLD;
        if (!lowEnergy && !poorSleep) {
            return false;
        }
        snapshot.setDirective(Directive.REST);
        snapshot.setReason("REST REQUIRED: energy reserve=" + display(ctx.energy)
                + ", sleep quality=" + display(ctx.sleep));
        return true;
    }

    private boolean checkHrv(EvaluationContext ctx, ReadinessSnapshot snapshot) {
        if (ctx.hrv != HrvStatus.UNBALANCED) {
            return false;
        }
        snapshot.setDirective(Directive.REDUCE);
        snapshot.setReason("REDUCE INTENSITY: HRV status is " + ctx.hrv);
        return true;
    }

    private void checkScore(ReadinessSnapshot snapshot) {
        if (snapshot.getScore() < REDUCE_SCORE_THRESHOLD) {
            snapshot.setDirective(Directive.REDUCE);
            snapshot.setReason("REDUCE INTENSITY: readiness score=" + snapshot.getScore());
        }
    }

    private ReadinessSnapshot logged(ReadinessSnapshot snapshot) {
        log.debug("就绪度评估完成, date={}, score={}, directive={}",
                snapshot.getAsOf(), snapshot.getScore(), snapshot.getDirective());
        return snapshot;
    }

    private static String display(OptionalInt value) {
        return value.isPresent() ? String.valueOf(value.getAsInt()) : "n/a";
    }

    private static Integer boxed(OptionalInt value) {
        return value.isPresent() ? value.getAsInt() : null;
    }

    @AllArgsConstructor
    private static class EvaluationContext {
        private final OptionalInt energy;
        private final OptionalInt sleep;
        private final OptionalInt stress;
        private final HrvStatus hrv;
    }
}

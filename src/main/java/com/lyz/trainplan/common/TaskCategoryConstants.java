package com.lyz.trainplan.common;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Set;

/**
 * 任务类别与活动类型常量
 * 计划文档、完成匹配与调整逻辑共用同一套类别编码
 */
public class TaskCategoryConstants {

    // ===================== 耐力类 Endurance =====================
    public static final String ENDURANCE = "endurance";
    public static final String EASY_RUN = "easy_run";
    public static final String LONG_RUN = "long_run";
    public static final String TEMPO = "tempo";
    public static final String INTERVAL = "interval";
    public static final String RECOVERY = "recovery";
    public static final String RUN = "run";
    public static final String RUNNING = "running";

    // ===================== 力量类 Strength =====================
    public static final String STRENGTH = "strength";
    public static final String GYM = "gym";

    // ===================== 其他 =====================
    public static final String REST = "rest";
    public static final String SUPPLEMENTARY = "supplementary";
    public static final String OTHER = "other";

    /**
     * 耐力类任务类别，匹配跑步类活动
     */
    public static final Set<String> ENDURANCE_FAMILY = Set.of(
            ENDURANCE, EASY_RUN, LONG_RUN, TEMPO, INTERVAL, RECOVERY, RUN, RUNNING);

    /**
     * 力量类任务类别，匹配力量/HIIT 活动
     */
    public static final Set<String> STRENGTH_FAMILY = Set.of(STRENGTH, GYM);

    /**
     * 跑步类活动类型关键字（活动类型中包含即视为跑步）
     */
    public static final Set<String> RUNNING_ACTIVITY_KEYWORDS = Set.of("running", "treadmill");

    /**
     * 力量类活动类型关键字
     */
    public static final Set<String> STRENGTH_ACTIVITY_KEYWORDS = Set.of("strength", "hiit");

    private TaskCategoryConstants() {
    }

    /**
     * 统一为小写编码，空值返回 other
     */
    public static String normalize(String category) {
        if (StringUtils.isBlank(category)) {
            return OTHER;
        }
        return category.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isRest(String category) {
        return REST.equals(normalize(category));
    }

    public static boolean isEnduranceCategory(String category) {
        return ENDURANCE_FAMILY.contains(normalize(category));
    }

    public static boolean isStrengthCategory(String category) {
        return STRENGTH_FAMILY.contains(normalize(category));
    }

    public static boolean isRunningActivity(String activityType) {
        return containsAny(activityType, RUNNING_ACTIVITY_KEYWORDS);
    }

    public static boolean isStrengthActivity(String activityType) {
        return containsAny(activityType, STRENGTH_ACTIVITY_KEYWORDS);
    }

    private static boolean containsAny(String activityType, Set<String> keywords) {
        if (StringUtils.isBlank(activityType)) {
            return false;
        }
        String type = activityType.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(type::contains);
    }
}

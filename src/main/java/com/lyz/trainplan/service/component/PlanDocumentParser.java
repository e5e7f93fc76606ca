package com.lyz.trainplan.service.component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.trainplan.common.TaskCategoryConstants;
import com.lyz.trainplan.common.exception.PlanValidationException;
import com.lyz.trainplan.model.dto.plan.MultiWeekDocument;
import com.lyz.trainplan.model.dto.plan.PlanDayEntry;
import com.lyz.trainplan.model.dto.plan.PlanDocument;
import com.lyz.trainplan.model.dto.plan.PlanWeek;
import com.lyz.trainplan.model.dto.plan.SingleWeekDocument;
import com.lyz.trainplan.model.dto.plan.SupplementaryItem;
import com.lyz.trainplan.model.enums.IntensityTier;
import com.lyz.trainplan.model.enums.PlanShape;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 计划文档解析组件
 * 外部生成的 JSON 字段命名并不统一，这里统一兼容各种别名后转为强类型文档
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanDocumentParser {

    private static final String[] DAYS_KEYS = {"days", "workouts", "daily_workouts"};
    private static final String[] WEEKS_KEYS = {"weeks", "weekly_plans"};

    private static final String[] DAY_LABEL_KEYS = {"day_label", "day"};
    private static final String[] TITLE_KEYS = {"title", "name"};
    private static final String[] CATEGORY_KEYS = {"category", "type", "workout_type"};
    private static final String[] DESCRIPTION_KEYS = {"description", "rationale"};
    private static final String[] DURATION_KEYS = {"duration", "duration_minutes", "total_duration_minutes"};
    private static final String[] TARGET_HR_KEYS = {"target_hr", "target_hr_zone", "hr_zone"};
    private static final String[] TARGET_HR_BPM_KEYS = {"target_hr_bpm", "hr_bpm"};
    private static final String[] CALORIES_KEYS = {"estimated_calories", "calories"};
    private static final String[] DISTANCE_KEYS = {"estimated_distance_km", "distance_km"};
    private static final String[] STEPS_KEYS = {"steps", "exercises"};

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d{1,6})");
    private static final Pattern LEADING_DECIMAL = Pattern.compile("^\\s*(\\d{1,6}(\\.\\d+)?)");

    /**
     * 时长、热量等整数字段的上限，超出视为缺失
     */
    private static final int MAX_INT_VALUE = 999_999;

    private final ObjectMapper objectMapper;

    /**
     * 校验并解析计划文档
     *
     * @param shape 调用方声明的形态，为空时按文档结构推断
     * @throws PlanValidationException 文档不是对象或不含任何训练日
     */
    public PlanDocument parse(JsonNode root, PlanShape shape) {
        if (root == null || !root.isObject()) {
            throw new PlanValidationException("计划文档必须是 JSON 对象");
        }

        PlanShape resolved = shape != null ? shape : inferShape(root);
        PlanDocument document = resolved == PlanShape.MULTI_WEEK_BLOCK
                ? parseMultiWeek(root)
                : parseSingleWeek(root);

        if (document.dayEntryCount() == 0) {
            throw new PlanValidationException("计划文档不包含任何训练日");
        }
        return document;
    }

    public PlanShape inferShape(JsonNode root) {
        return firstArray(root, WEEKS_KEYS) != null ? PlanShape.MULTI_WEEK_BLOCK : PlanShape.SINGLE_WEEK;
    }

    // ================== 文档结构 ==================

    private SingleWeekDocument parseSingleWeek(JsonNode root) {
        JsonNode days = firstArray(root, DAYS_KEYS);
        if (days == null) {
            // 单周计划误用了 weeks 结构时取第一周
            JsonNode weeks = firstArray(root, WEEKS_KEYS);
            if (weeks != null && weeks.size() > 0) {
                days = firstArray(weeks.get(0), DAYS_KEYS);
            }
        }
        return new SingleWeekDocument(parseDays(days));
    }

    private MultiWeekDocument parseMultiWeek(JsonNode root) {
        JsonNode weeks = firstArray(root, WEEKS_KEYS);
        List<PlanWeek> result = new ArrayList<>();
        if (weeks == null) {
            // 声明为多周但只给了 days，视为一周
            JsonNode days = firstArray(root, DAYS_KEYS);
            if (days != null) {
                result.add(new PlanWeek(parseDays(days)));
            }
            return new MultiWeekDocument(result);
        }
        for (JsonNode week : weeks) {
            if (!week.isObject()) {
                // 保留空周占位，后续各周的日期不前移
                log.warn("非对象的周条目按空周处理: {}", week);
                result.add(new PlanWeek(Collections.emptyList()));
                continue;
            }
            result.add(new PlanWeek(parseDays(firstArray(week, DAYS_KEYS))));
        }
        return new MultiWeekDocument(result);
    }

    private List<PlanDayEntry> parseDays(JsonNode days) {
        List<PlanDayEntry> entries = new ArrayList<>();
        if (days == null) {
            return entries;
        }
        for (JsonNode day : days) {
            if (!day.isObject()) {
                log.warn("忽略非对象的训练日条目: {}", day);
                continue;
            }
            entries.add(parseDay(day));
        }
        return entries;
    }

    // ================== 单日条目 ==================

    private PlanDayEntry parseDay(JsonNode day) {
        IntensityTier intensity = IntensityTier.parse(firstText(day, "intensity"));

        PlanDayEntry.PlanDayEntryBuilder builder = PlanDayEntry.builder()
                .dayLabel(firstText(day, DAY_LABEL_KEYS))
                .title(StringUtils.defaultIfBlank(firstText(day, TITLE_KEYS), "Workout"))
                .category(TaskCategoryConstants.normalize(firstText(day, CATEGORY_KEYS)))
                .description(firstText(day, DESCRIPTION_KEYS))
                .durationMinutes(firstInt(day, DURATION_KEYS))
                .intensity(intensity != null ? intensity : IntensityTier.MODERATE)
                .targetHr(firstText(day, TARGET_HR_KEYS))
                .targetHrBpm(firstText(day, TARGET_HR_BPM_KEYS))
                .estimatedCalories(firstInt(day, CALORIES_KEYS))
                .estimatedDistanceKm(firstDecimal(day, DISTANCE_KEYS))
                .keyFocus(firstText(day, "key_focus"))
                .optimalTime(firstText(day, "optimal_time"))
                .stepsJson(stepsJson(first(day, STEPS_KEYS)));

        JsonNode supplementary = day.get("supplementary");
        if (supplementary != null && supplementary.isObject()) {
            builder.supplementaryItem(parseSupplementary(supplementary));
        } else if (supplementary != null && supplementary.isArray()) {
            for (JsonNode item : supplementary) {
                if (item.isObject() || item.isTextual()) {
                    builder.supplementaryItem(parseSupplementary(item));
                }
            }
        }
        return builder.build();
    }

    private SupplementaryItem parseSupplementary(JsonNode item) {
        // 只给了名称的写法，如 ["mobility", "cold_plunge"]
        if (item.isTextual()) {
            return SupplementaryItem.builder()
                    .title(item.asText())
                    .category(TaskCategoryConstants.SUPPLEMENTARY)
                    .intensity(IntensityTier.LOW)
                    .build();
        }
        IntensityTier intensity = IntensityTier.parse(firstText(item, "intensity"));
        String category = firstText(item, CATEGORY_KEYS);
        return SupplementaryItem.builder()
                .title(StringUtils.defaultIfBlank(firstText(item, TITLE_KEYS), "Supplementary"))
                .category(StringUtils.isBlank(category)
                        ? TaskCategoryConstants.SUPPLEMENTARY
                        : TaskCategoryConstants.normalize(category))
                .description(firstText(item, DESCRIPTION_KEYS))
                .durationMinutes(firstInt(item, DURATION_KEYS))
                .intensity(intensity != null ? intensity : IntensityTier.LOW)
                .build();
    }

    private String stepsJson(JsonNode steps) {
        if (steps == null || steps.isNull() || (steps.isContainerNode() && steps.isEmpty())) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(steps);
        } catch (JsonProcessingException e) {
            throw new PlanValidationException("训练步骤无法序列化", e);
        }
    }

    // ================== 字段读取 ==================

    private static JsonNode first(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static JsonNode firstArray(JsonNode node, String... keys) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isArray()) {
                return value;
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        return StringUtils.trimToNull(value.asText());
    }

    /**
     * 兼容 45 / "45" / "45 min" 等写法
     */
    private static Integer firstInt(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            double number = value.asDouble();
            if (Double.isNaN(number) || number < 0 || number > MAX_INT_VALUE) {
                log.warn("数值超出范围, 按缺失处理: {}", value);
                return null;
            }
            return (int) Math.round(number);
        }
        if (value.isTextual()) {
            Matcher m = LEADING_NUMBER.matcher(value.asText());
            if (m.find()) {
                return Integer.parseInt(m.group(1));
            }
        }
        return null;
    }

    /**
     * 兼容 8.5 / "8.5" / "8.5 km"，保留两位小数
     */
    private static BigDecimal firstDecimal(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        if (value == null) {
            return null;
        }
        BigDecimal result = null;
        if (value.isNumber()) {
            result = value.decimalValue();
        } else if (value.isTextual()) {
            Matcher m = LEADING_DECIMAL.matcher(value.asText());
            if (m.find()) {
                result = new BigDecimal(m.group(1));
            }
        }
        if (result == null || result.signum() < 0 || result.compareTo(BigDecimal.valueOf(MAX_INT_VALUE)) > 0) {
            return null;
        }
        return result.setScale(2, RoundingMode.HALF_UP);
    }
}

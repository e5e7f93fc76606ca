package com.lyz.trainplan.service.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.trainplan.common.exception.PlanValidationException;
import com.lyz.trainplan.model.dto.plan.MultiWeekDocument;
import com.lyz.trainplan.model.dto.plan.PlanDayEntry;
import com.lyz.trainplan.model.dto.plan.PlanDocument;
import com.lyz.trainplan.model.dto.plan.SingleWeekDocument;
import com.lyz.trainplan.model.enums.IntensityTier;
import com.lyz.trainplan.model.enums.PlanShape;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanDocumentParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PlanDocumentParser parser = new PlanDocumentParser(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void single_week_with_aliases() throws Exception {
        JsonNode doc = json("""
                {"workouts": [
                  {"day": "Tuesday", "name": "Tempo", "workout_type": "Tempo",
                   "rationale": "threshold work", "duration_minutes": 50, "intensity": "high",
                   "target_hr_zone": "Z4", "exercises": [{"step": "warmup", "minutes": 10}]}
                ]}
                """);

        PlanDocument parsed = parser.parse(doc, null);

        SingleWeekDocument single = assertInstanceOf(SingleWeekDocument.class, parsed);
        PlanDayEntry entry = single.getDays().get(0);
        assertEquals("Tuesday", entry.getDayLabel());
        assertEquals("Tempo", entry.getTitle());
        assertEquals("tempo", entry.getCategory());
        assertEquals("threshold work", entry.getDescription());
        assertEquals(50, entry.getDurationMinutes());
        assertEquals(IntensityTier.HIGH, entry.getIntensity());
        assertEquals("Z4", entry.getTargetHr());
        assertEquals(objectMapper.readTree("[{\"step\":\"warmup\",\"minutes\":10}]"),
                objectMapper.readTree(entry.getStepsJson()));
    }

    @Test
    void weeks_key_infers_multi_week_block() throws Exception {
        JsonNode doc = json("""
                {"weeks": [
                  {"days": [{"day_label": "Monday", "title": "Easy"}]},
                  {"daily_workouts": [{"day_label": "Monday", "title": "Easy"}, {"day_label": "Friday"}]}
                ]}
                """);

        PlanDocument parsed = parser.parse(doc, null);

        MultiWeekDocument multi = assertInstanceOf(MultiWeekDocument.class, parsed);
        assertEquals(PlanShape.MULTI_WEEK_BLOCK, multi.getShape());
        assertEquals(2, multi.getWeeks().size());
        assertEquals(3, multi.dayEntryCount());
    }

    @Test
    void single_week_falls_back_to_first_week() throws Exception {
        JsonNode doc = json("""
                {"weekly_plans": [
                  {"workouts": [{"day": "Monday"}, {"day": "Wednesday"}]},
                  {"workouts": [{"day": "Friday"}]}
                ]}
                """);

        PlanDocument parsed = parser.parse(doc, PlanShape.SINGLE_WEEK);

        assertEquals(PlanShape.SINGLE_WEEK, parsed.getShape());
        assertEquals(2, parsed.dayEntryCount());
    }

    @Test
    void supplementary_object_or_array() throws Exception {
        JsonNode doc = json("""
                {"days": [
                  {"day": "Monday", "supplementary": {"title": "Yoga", "duration": "20 min"}},
                  {"day": "Tuesday", "supplementary": [{"name": "Mobility", "type": "mobility"}, "cold_plunge"]}
                ]}
                """);

        SingleWeekDocument parsed = (SingleWeekDocument) parser.parse(doc, null);

        PlanDayEntry monday = parsed.getDays().get(0);
        assertEquals(1, monday.getSupplementary().size());
        assertEquals("Yoga", monday.getSupplementary().get(0).getTitle());
        assertEquals(20, monday.getSupplementary().get(0).getDurationMinutes());
        assertEquals("supplementary", monday.getSupplementary().get(0).getCategory());
        assertEquals(IntensityTier.LOW, monday.getSupplementary().get(0).getIntensity());

        PlanDayEntry tuesday = parsed.getDays().get(1);
        assertEquals(2, tuesday.getSupplementary().size());
        assertEquals("mobility", tuesday.getSupplementary().get(0).getCategory());
        assertEquals("cold_plunge", tuesday.getSupplementary().get(1).getTitle());
    }

    @Test
    void defaults_for_bare_entry() throws Exception {
        SingleWeekDocument parsed = (SingleWeekDocument) parser.parse(json("{\"days\": [{}]}"), null);

        PlanDayEntry entry = parsed.getDays().get(0);
        assertEquals("Workout", entry.getTitle());
        assertEquals("other", entry.getCategory());
        assertEquals(IntensityTier.MODERATE, entry.getIntensity());
        assertNull(entry.getDayLabel());
        assertNull(entry.getStepsJson());
    }

    @Test
    void empty_or_non_object_documents_are_rejected() throws Exception {
        assertThrows(PlanValidationException.class, () -> parser.parse(json("{\"days\": []}"), null));
        assertThrows(PlanValidationException.class, () -> parser.parse(json("{\"weeks\": [{\"days\": []}]}"), null));
        assertThrows(PlanValidationException.class, () -> parser.parse(json("[1, 2]"), null));
        assertThrows(PlanValidationException.class, () -> parser.parse(json("{}"), PlanShape.MULTI_WEEK_BLOCK));
        assertThrows(PlanValidationException.class, () -> parser.parse(null, null));
    }

    @Test
    void malformed_week_becomes_empty_placeholder() throws Exception {
        JsonNode doc = json("{\"weeks\": [\"oops\", {\"days\": [{\"day\": \"Monday\"}]}, 7]}");

        MultiWeekDocument parsed = (MultiWeekDocument) parser.parse(doc, null);

        assertEquals(3, parsed.getWeeks().size());
        assertTrue(parsed.getWeeks().get(0).getDays().isEmpty());
        assertEquals(1, parsed.getWeeks().get(1).getDays().size());
        assertTrue(parsed.getWeeks().get(2).getDays().isEmpty());
        assertEquals(1, parsed.dayEntryCount());
    }

    @Test
    void out_of_range_numbers_are_treated_as_absent() throws Exception {
        JsonNode doc = json("""
                {"days": [
                  {"day": "Monday", "duration": 1e12, "estimated_calories": -300},
                  {"day": "Tuesday", "duration": "45 min", "estimated_calories": 520.4, "distance_km": 1e9},
                  {"day": "Wednesday", "duration": 2147483648}
                ]}
                """);

        SingleWeekDocument parsed = (SingleWeekDocument) parser.parse(doc, null);

        assertNull(parsed.getDays().get(0).getDurationMinutes());
        assertNull(parsed.getDays().get(0).getEstimatedCalories());
        assertEquals(45, parsed.getDays().get(1).getDurationMinutes());
        assertEquals(520, parsed.getDays().get(1).getEstimatedCalories());
        assertNull(parsed.getDays().get(1).getEstimatedDistanceKm());
        assertNull(parsed.getDays().get(2).getDurationMinutes());
    }

    @Test
    void heart_rate_zone_and_bpm_are_kept_apart() throws Exception {
        SingleWeekDocument parsed = (SingleWeekDocument) parser.parse(
                json("{\"days\": [{\"day\": \"Monday\", \"hr_zone\": \"Z3\", \"hr_bpm\": \"150-160\"}]}"), null);

        assertEquals("Z3", parsed.getDays().get(0).getTargetHr());
        assertEquals("150-160", parsed.getDays().get(0).getTargetHrBpm());
    }
}

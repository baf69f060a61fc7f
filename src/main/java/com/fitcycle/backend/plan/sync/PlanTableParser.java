package com.fitcycle.backend.plan.sync;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fitcycle.backend.plan.model.DayContent;
import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.ExerciseEntry;
import com.fitcycle.backend.plan.model.Level;
import com.fitcycle.backend.plan.model.MacroTarget;
import com.fitcycle.backend.plan.model.PlanDefinition;
import com.fitcycle.backend.plan.web.PlanValidationException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 三張表（PLAN / MACROS / CYCLE 的 CSV）→ PlanDefinition。
 * 任何一列格式錯（缺必要欄、未知 level / day_type、數字不是整數）整批拒絕，
 * 不像舊版那樣默默跳過。全空白的列會略過（sheet 匯出常帶尾巴空列）。
 */
@Component
public class PlanTableParser {

    static final String TABLE_PLAN = "PLAN";
    static final String TABLE_MACROS = "MACROS";
    static final String TABLE_CYCLE = "CYCLE";

    private static final List<String> PLAN_COLUMNS = List.of("workout_key", "level", "name", "sets", "reps");
    private static final List<String> MACROS_COLUMNS = List.of("day_type", "kcal", "protein", "fat", "carbs");
    private static final List<String> CYCLE_COLUMNS = List.of("workout_key");

    private final CsvMapper csv = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public PlanDefinition parse(String planCsv, String macrosCsv, String cycleCsv) {
        return new PlanDefinition(
                parseCycle(cycleCsv),
                parseWorkouts(planCsv),
                parseMacros(macrosCsv)
        );
    }

    Map<String, DayContent> parseWorkouts(String text) {
        Map<String, String> titles = new LinkedHashMap<>();
        Map<String, Map<Level, List<ExerciseEntry>>> levels = new LinkedHashMap<>();

        for (Row row : readTable(TABLE_PLAN, text, PLAN_COLUMNS)) {
            String key = row.require("workout_key");
            String rawLevel = row.require("level");
            Level level = Level.parseOrNull(rawLevel);
            if (level == null) throw row.invalid("LEVEL_UNKNOWN", "unknown level '" + rawLevel + "'");

            String title = row.get("title");
            if (!title.isEmpty()) titles.put(key, title);
            else titles.putIfAbsent(key, key);

            String weight = row.get("weight");
            ExerciseEntry entry = new ExerciseEntry(
                    row.require("name"),
                    row.intOrZero("sets"),
                    row.get("reps"),
                    weight.isEmpty() ? null : weight
            );
            levels.computeIfAbsent(key, k -> new EnumMap<>(Level.class))
                    .computeIfAbsent(level, l -> new ArrayList<>())
                    .add(entry);
        }

        Map<String, DayContent> out = new LinkedHashMap<>();
        for (var e : levels.entrySet()) {
            out.put(e.getKey(), new DayContent(titles.get(e.getKey()), e.getValue()));
        }
        return out;
    }

    Map<DayType, MacroTarget> parseMacros(String text) {
        Map<DayType, MacroTarget> out = new EnumMap<>(DayType.class);
        for (Row row : readTable(TABLE_MACROS, text, MACROS_COLUMNS)) {
            String raw = row.require("day_type");
            DayType t = DayType.parseOrNull(raw);
            if (t == null) throw row.invalid("DAY_TYPE_UNKNOWN", "unknown day_type '" + raw + "'");
            if (out.containsKey(t)) throw row.invalid("DAY_TYPE_DUPLICATE", "day_type '" + raw + "' appears twice");

            out.put(t, new MacroTarget(t,
                    row.intOrZero("kcal"),
                    row.intOrZero("protein"),
                    row.intOrZero("fat"),
                    row.intOrZero("carbs")));
        }
        return out;
    }

    List<String> parseCycle(String text) {
        List<String> out = new ArrayList<>();
        for (Row row : readTable(TABLE_CYCLE, text, CYCLE_COLUMNS)) {
            out.add(row.require("workout_key"));
        }
        return out;
    }

    private List<Row> readTable(String table, String text, List<String> requiredColumns) {
        if (text == null) throw new PlanValidationException("TABLE_MISSING", table + " table is missing");

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Row> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csv.readerForMapOf(String.class).with(schema).readValues(text)) {
            boolean any = it.hasNext(); // 讀到 header 之後 parser schema 才有欄位
            CsvSchema header = (CsvSchema) it.getParserSchema();
            for (String col : requiredColumns) {
                if (header == null || header.column(col) == null) {
                    throw new PlanValidationException("COLUMN_MISSING", table + ": required column '" + col + "' is missing");
                }
            }
            int line = 1;
            while (any && it.hasNext()) {
                line++;
                Map<String, String> raw = it.next();
                Row row = new Row(table, line, raw);
                if (!row.isBlank()) rows.add(row);
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof PlanValidationException pve) throw pve;
            throw new PlanValidationException("CSV_MALFORMED", table + ": " + e.getMessage());
        }
        return rows;
    }

    private record Row(String table, int line, Map<String, String> cells) {

        String get(String col) {
            String v = cells.get(col);
            return v == null ? "" : v.trim();
        }

        String require(String col) {
            String v = get(col);
            if (v.isEmpty()) throw invalid("CELL_REQUIRED", "column '" + col + "' is empty");
            return v;
        }

        int intOrZero(String col) {
            String v = get(col);
            if (v.isEmpty()) return 0;
            try {
                int n = Integer.parseInt(v);
                if (n < 0) throw invalid("NUMBER_INVALID", "column '" + col + "' must be >= 0");
                return n;
            } catch (NumberFormatException e) {
                throw invalid("NUMBER_INVALID", "column '" + col + "' is not an integer: '" + v + "'");
            }
        }

        boolean isBlank() {
            for (String v : cells.values()) {
                if (v != null && !v.isBlank()) return false;
            }
            return true;
        }

        PlanValidationException invalid(String code, String message) {
            return new PlanValidationException(code, table + " row " + line + ": " + message);
        }
    }
}

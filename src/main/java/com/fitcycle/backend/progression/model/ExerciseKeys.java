package com.fitcycle.backend.progression.model;

import com.fitcycle.backend.common.crypto.HmacSha256;

/**
 * 動作名稱的精確比對 key（SHA-256 hex，固定 64 字元小寫）。
 * unique 與查詢都走這個欄位，大小寫不同的名稱一定是不同的 key，跟 DB collation 無關。
 */
public final class ExerciseKeys {

    public static final int LENGTH = 64;

    private ExerciseKeys() {}

    public static String nameKey(String exerciseName) {
        if (exerciseName == null) throw new IllegalArgumentException("EXERCISE_NAME_REQUIRED");
        return HmacSha256.sha256Hex(exerciseName);
    }

    /** workoutKey 與名稱中間用 \0 隔開，("ab","c") 與 ("a","bc") 不會撞 */
    public static String ruleKey(String workoutKey, String exerciseName) {
        if (workoutKey == null) throw new IllegalArgumentException("WORKOUT_KEY_REQUIRED");
        if (exerciseName == null) throw new IllegalArgumentException("EXERCISE_NAME_REQUIRED");
        return HmacSha256.sha256Hex(workoutKey + '\0' + exerciseName);
    }
}

package com.fitcycle.backend.plan.sync;

public final class SheetIds {

    private SheetIds() {}

    /**
     * "1AbC..." → 原樣；
     * "https://docs.google.com/spreadsheets/d/1AbC.../edit#gid=0" → "1AbC..."
     */
    public static String extract(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("SHEET_ID_REQUIRED");
        String s = raw.trim();
        int idx = s.indexOf("/d/");
        if (idx < 0) return s;

        String rest = s.substring(idx + 3);
        int end = rest.length();
        for (char stop : new char[]{'/', '?', '#'}) {
            int p = rest.indexOf(stop);
            if (p >= 0 && p < end) end = p;
        }
        String id = rest.substring(0, end);
        if (id.isBlank()) throw new IllegalArgumentException("SHEET_ID_INVALID");
        return id;
    }
}

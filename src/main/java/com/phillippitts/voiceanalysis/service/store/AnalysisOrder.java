package com.phillippitts.voiceanalysis.service.store;

import java.util.Locale;

/**
 * Supported orderings for analysis listings. Callers never pass raw SQL.
 */
public enum AnalysisOrder {
    CREATION_DATE_DESC("CREATION_DATE DESC, ID DESC"),
    CREATION_DATE_ASC("CREATION_DATE ASC, ID ASC"),
    ID_ASC("ID ASC"),
    ID_DESC("ID DESC");

    private final String sql;

    AnalysisOrder(String sql) {
        this.sql = sql;
    }

    String sql() {
        return sql;
    }

    /**
     * Case-insensitive lookup; {@code null} or blank yields {@link #CREATION_DATE_DESC}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static AnalysisOrder parse(String name) {
        if (name == null || name.isBlank()) {
            return CREATION_DATE_DESC;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}

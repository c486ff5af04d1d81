package com.ivamare.callsession.model;

import com.ivamare.callsession.exception.ValidationException;

/**
 * Columns a session listing may be ordered by. Only these names ever reach
 * the ORDER BY clause.
 */
public enum SortField {
    STARTED_AT("started_at"),
    ENDED_AT("ended_at"),
    CREATED_AT("created_at"),
    UPDATED_AT("updated_at"),
    CALLER_ID("caller_id"),
    CALLEE_ID("callee_id"),
    STATUS("status");

    private final String column;

    SortField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    /**
     * Resolve a column name against the allow-list.
     *
     * @throws ValidationException if the column is not sortable
     */
    public static SortField fromValue(String value) {
        for (SortField field : values()) {
            if (field.column.equals(value)) {
                return field;
            }
        }
        throw new ValidationException("invalid sort_by value: " + value);
    }
}

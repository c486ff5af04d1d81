package com.ivamare.callsession.model;

import com.ivamare.callsession.exception.ValidationException;

import java.util.Locale;

/**
 * Sort direction for session listings.
 */
public enum SortOrder {
    ASC,
    DESC;

    public String sql() {
        return name();
    }

    /**
     * Parse a direction, case-insensitively.
     *
     * @throws ValidationException if the value is neither asc nor desc
     */
    public static SortOrder fromValue(String value) {
        if (value != null) {
            switch (value.toLowerCase(Locale.ROOT)) {
                case "asc":
                    return ASC;
                case "desc":
                    return DESC;
                default:
                    break;
            }
        }
        throw new ValidationException("invalid sort_order value: " + value);
    }
}

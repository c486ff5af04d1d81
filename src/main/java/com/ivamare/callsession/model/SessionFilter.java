package com.ivamare.callsession.model;

import com.ivamare.callsession.exception.ValidationException;

import java.time.Instant;

/**
 * Filter, sort and pagination parameters for listing sessions.
 *
 * <p>All filters are optional. The date range applies to {@code startedAt}
 * and is inclusive at both ends.
 *
 * @param startDate Lower bound on startedAt (nullable)
 * @param endDate Upper bound on startedAt (nullable)
 * @param status Exact status (nullable)
 * @param callerId Exact caller (nullable)
 * @param calleeId Exact callee (nullable)
 * @param limit Page size
 * @param offset Rows to skip
 * @param sortBy Sort column
 * @param sortOrder Sort direction
 */
public record SessionFilter(
    Instant startDate,
    Instant endDate,
    SessionStatus status,
    String callerId,
    String calleeId,
    int limit,
    int offset,
    SortField sortBy,
    SortOrder sortOrder
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int DEFAULT_OFFSET = 0;

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy with a different page window. Filters are unchanged, so
     * the matching total is unchanged too.
     */
    public SessionFilter withPage(int newLimit, int newOffset) {
        return new SessionFilter(startDate, endDate, status, callerId, calleeId,
            newLimit, newOffset, sortBy, sortOrder);
    }

    /**
     * Builder accepting raw request values. Unknown status, sort column or
     * direction are rejected rather than ignored.
     */
    public static class Builder {
        private Instant startDate;
        private Instant endDate;
        private SessionStatus status;
        private String callerId;
        private String calleeId;
        private int limit = DEFAULT_LIMIT;
        private int offset = DEFAULT_OFFSET;
        private SortField sortBy = SortField.STARTED_AT;
        private SortOrder sortOrder = SortOrder.DESC;

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder status(String status) {
            if (status == null || status.isEmpty()) {
                this.status = null;
                return this;
            }
            try {
                this.status = SessionStatus.fromValue(status);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("invalid status value: " + status);
            }
            return this;
        }

        public Builder callerId(String callerId) {
            this.callerId = blankToNull(callerId);
            return this;
        }

        public Builder calleeId(String calleeId) {
            this.calleeId = blankToNull(calleeId);
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit != null ? limit : DEFAULT_LIMIT;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset != null ? offset : DEFAULT_OFFSET;
            return this;
        }

        public Builder sortBy(String sortBy) {
            this.sortBy = sortBy == null || sortBy.isEmpty() ? SortField.STARTED_AT : SortField.fromValue(sortBy);
            return this;
        }

        public Builder sortOrder(String sortOrder) {
            this.sortOrder = sortOrder == null || sortOrder.isEmpty() ? SortOrder.DESC : SortOrder.fromValue(sortOrder);
            return this;
        }

        public SessionFilter build() {
            return new SessionFilter(startDate, endDate, status, callerId, calleeId,
                limit, offset, sortBy, sortOrder);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }
}

package com.keyregistry.groups.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO for advancing the caller's read marker.
 * {@code readAt} is in epoch seconds; when omitted the server time is used.
 */
public class MarkReadRequest {

    /** Largest epoch second an {@link java.time.Instant} can hold. */
    static final long MAX_READ_AT = 31_556_889_864_403_199L;

    @PositiveOrZero(message = "Read timestamp cannot be negative")
    @Max(value = MAX_READ_AT, message = "Read timestamp is out of range")
    private Long readAt;

    public MarkReadRequest() {}

    public MarkReadRequest(Long readAt) {
        this.readAt = readAt;
    }

    public Long getReadAt() {
        return readAt;
    }

    public void setReadAt(Long readAt) {
        this.readAt = readAt;
    }
}

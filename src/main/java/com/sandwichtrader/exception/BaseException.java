package com.sandwichtrader.exception;

import com.sandwichtrader.domain.enums.LifecycleState;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the sandwich service's unchecked exceptions.
 *
 * <p>The {@link ErrorCode} picks the HTTP status. A failure raised against the strategy
 * lifecycle records the state it found, which the error body reports as
 * {@code details.state}.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final LifecycleState state;

    protected BaseException(ErrorCode errorCode, String message, LifecycleState state, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.state = state;
    }

    /** Details for the error body; subclasses add their own keys after {@code state}. */
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (state != null) {
            details.put("state", state);
        }
        return details;
    }
}

package de.bsommerfeld.eventpulse.core.result;

import java.util.Objects;

/**
 * A {@link CallStatus} plus the value on success or a human-readable detail
 * on failure.
 *
 * @param status outcome of the call
 * @param value  result on {@link CallStatus#OK}, otherwise {@code null}
 * @param detail failure description, {@code null} on success
 */
public record CallResult<T>(CallStatus status, T value, String detail) {

    public CallResult {
        Objects.requireNonNull(status, "status");
    }

    public static <T> CallResult<T> ok(T value) {
        return new CallResult<>(CallStatus.OK, value, null);
    }

    public static <T> CallResult<T> duplicate(String detail) {
        return new CallResult<>(CallStatus.DUPLICATE, null, detail);
    }

    public static <T> CallResult<T> notFound(String detail) {
        return new CallResult<>(CallStatus.NOT_FOUND, null, detail);
    }

    public static <T> CallResult<T> forbidden(String detail) {
        return new CallResult<>(CallStatus.FORBIDDEN, null, detail);
    }

    public static <T> CallResult<T> transientError(String detail) {
        return new CallResult<>(CallStatus.TRANSIENT_ERROR, null, detail);
    }

    public boolean isOk() {
        return status == CallStatus.OK;
    }

    /** {@code true} for NOT_FOUND and FORBIDDEN, the target cannot be used at all. */
    public boolean isInaccessible() {
        return status == CallStatus.NOT_FOUND || status == CallStatus.FORBIDDEN;
    }

    /** Re-types a failed result so it can be propagated without its value. */
    public <R> CallResult<R> asFailure() {
        if (isOk()) {
            throw new IllegalStateException("Cannot convert a successful result into a failure");
        }
        return new CallResult<>(status, null, detail);
    }
}

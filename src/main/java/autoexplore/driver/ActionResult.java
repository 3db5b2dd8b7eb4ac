package autoexplore.driver;

import java.util.Objects;

/**
 * Outcome of a single {@link ActionDriver} call: either a value or a
 * {@link FailureKind} with a human-readable reason. Backend failures are
 * reported through this type instead of exceptions.
 *
 * @param <T> success value type ({@link Void} for calls without a value)
 */
public final class ActionResult<T> {

    private final T           value;
    private final FailureKind failureKind;
    private final String      reason;

    private ActionResult(T value, FailureKind failureKind, String reason) {
        this.value       = value;
        this.failureKind = failureKind;
        this.reason      = reason;
    }

    public static <T> ActionResult<T> success(T value) {
        return new ActionResult<>(value, null, null);
    }

    public static ActionResult<Void> done() {
        return new ActionResult<>(null, null, null);
    }

    public static <T> ActionResult<T> failure(FailureKind kind, String reason) {
        return new ActionResult<>(null, Objects.requireNonNull(kind, "kind"), reason);
    }

    /** True when the call succeeded. */
    public boolean isSuccess()          { return failureKind == null; }

    /** Success value; {@code null} for failures and for {@link Void} results. */
    public T getValue()                 { return value; }

    /** Failure category, or {@code null} on success. */
    public FailureKind getFailureKind() { return failureKind; }

    /** Failure reason, or {@code null} on success. */
    public String getReason()           { return reason; }

    @Override
    public String toString() {
        return isSuccess()
                ? "ActionResult{SUCCESS}"
                : String.format("ActionResult{%s: %s}", failureKind, reason);
    }
}

package io.memorybank;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a memory bank operation: either a value or a typed failure.
 *
 * @param <T> type of the success payload ({@link Void} for operations without one)
 */
public final class OperationResult<T> {
    
    private static final OperationResult<Void> OK = new OperationResult<>(null, null);
    
    private final T value;
    private final MemoryBankException error;
    
    private OperationResult(T value, MemoryBankException error) {
        this.value = value;
        this.error = error;
    }
    
    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null);
    }
    
    public static OperationResult<Void> ok() {
        return OK;
    }
    
    public static <T> OperationResult<T> failure(MemoryBankException error) {
        Objects.requireNonNull(error, "error cannot be null");
        return new OperationResult<>(null, error);
    }
    
    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return failure(new MemoryBankException(kind, message));
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    public boolean isFailure() {
        return error != null;
    }
    
    /**
     * Returns the success payload.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.getMessage(), error);
        }
        return value;
    }
    
    /**
     * Returns the failure, or null for a successful result.
     */
    public MemoryBankException error() {
        return error;
    }
    
    /**
     * Returns the failure kind, or null for a successful result.
     */
    public ErrorKind errorKind() {
        return error != null ? error.getKind() : null;
    }
    
    public boolean hasErrorKind(ErrorKind kind) {
        return error != null && error.getKind() == kind;
    }
    
    public Optional<T> toOptional() {
        return error == null ? Optional.ofNullable(value) : Optional.empty();
    }
    
    /**
     * Returns the payload or throws the carried failure.
     */
    public T orElseThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }
    
    public <U> OperationResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }
    
    public <U> OperationResult<U> flatMap(Function<? super T, OperationResult<U>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }
    
    /**
     * Re-types a failed result; only valid on failures.
     */
    public <U> OperationResult<U> asFailure() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return failure(error);
    }
    
    @Override
    public String toString() {
        if (error != null) {
            return "Failure[" + error.getKind() + "/" + error.getCode() + ": " + error.getMessage() + "]";
        }
        return "Success[" + value + "]";
    }
}

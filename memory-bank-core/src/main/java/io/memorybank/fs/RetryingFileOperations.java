package io.memorybank.fs;

import io.memorybank.MemoryBankException;
import io.memorybank.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * File operations with bounded retry of transient failures.
 *
 * <p>Every operation returns an {@link OperationResult} whose failure carries a
 * {@link FileErrorCode} name as its code. Permanent failures (missing file,
 * permission denied) are reported after a single attempt; transient ones are
 * retried according to the {@link RetryPolicy} and reported as
 * {@link FileErrorCode#TRANSIENT_EXHAUSTED} once the budget runs out.</p>
 */
public class RetryingFileOperations {
    
    private static final Logger log = LoggerFactory.getLogger(RetryingFileOperations.class);
    
    private final FileOperations delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    
    public RetryingFileOperations(RetryPolicy policy) {
        this(new NioFileOperations(), policy, Sleeper.threadSleep());
    }
    
    public RetryingFileOperations(FileOperations delegate, RetryPolicy policy, Sleeper sleeper) {
        this.delegate = delegate;
        this.policy = policy;
        this.sleeper = sleeper;
    }
    
    // ==================== Operations ====================
    
    public OperationResult<String> read(Path path) {
        return withRetry("read", path, () -> delegate.read(path));
    }
    
    /**
     * Writes content all-or-nothing; on failure the previous content is untouched.
     */
    public OperationResult<Void> write(Path path, String content) {
        return withRetry("write", path, () -> {
            delegate.writeAtomically(path, content);
            return null;
        });
    }
    
    /**
     * Creates a directory and its parents. An existing directory is a success.
     */
    public OperationResult<Void> mkdir(Path path) {
        OperationResult<Void> result = withRetry("mkdir", path, () -> {
            delegate.createDirectories(path);
            return null;
        });
        if (result.isFailure() && FileErrorCode.EEXIST.name().equals(result.error().getCode())) {
            OperationResult<FileStat> existing = stat(path);
            if (existing.isSuccess() && existing.value().directory()) {
                return OperationResult.ok();
            }
        }
        return result;
    }
    
    public OperationResult<FileStat> stat(Path path) {
        return withRetry("stat", path, () -> delegate.stat(path));
    }
    
    /**
     * Lists regular files below a directory, recursively.
     */
    public OperationResult<List<Path>> walk(Path directory) {
        return withRetry("walk", directory, () -> delegate.listFiles(directory));
    }
    
    public RetryPolicy getPolicy() {
        return policy;
    }
    
    // ==================== Internal ====================
    
    private <T> OperationResult<T> withRetry(String operation, Path path, IoAction<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return OperationResult.success(action.run());
            } catch (IOException e) {
                FileErrorCode code = FileErrorCode.classify(e);
                if (!code.isTransient()) {
                    log.debug("{} failed for {} with {}: {}", operation, path, code, e.getMessage());
                    return failure(code, String.format("%s failed for %s: %s", operation, path, e.getMessage()), e);
                }
                if (attempt >= policy.maxAttempts()) {
                    log.error("{} failed for {} after {} attempts ({})", operation, path, attempt, code);
                    return failure(FileErrorCode.TRANSIENT_EXHAUSTED, String.format(
                        "%s failed for %s after %d attempts: %s", operation, path, attempt, e.getMessage()), e);
                }
                Duration delay = policy.delayForAttempt(attempt);
                log.warn("{} failed for {} ({}), retrying in {} ms (attempt {}/{})",
                    operation, path, code, delay.toMillis(), attempt, policy.maxAttempts());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return failure(FileErrorCode.INTERRUPTED, String.format(
                        "%s interrupted while retrying %s", operation, path), ie);
                }
                attempt++;
            }
        }
    }
    
    private static <T> OperationResult<T> failure(FileErrorCode code, String message, Throwable cause) {
        return OperationResult.failure(new MemoryBankException(code.toErrorKind(), code.name(), message, cause));
    }
    
    @FunctionalInterface
    private interface IoAction<T> {
        T run() throws IOException;
    }
    
    /**
     * Backoff hook; tests substitute a non-blocking implementation.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
        
        static Sleeper threadSleep() {
            return duration -> Thread.sleep(duration.toMillis());
        }
    }
}

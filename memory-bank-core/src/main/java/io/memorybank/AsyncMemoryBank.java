package io.memorybank;

import io.memorybank.cache.CacheStats;
import io.memorybank.metadata.IndexRebuildResult;
import io.memorybank.metadata.IndexStats;
import io.memorybank.metadata.MetadataFilter;
import io.memorybank.metadata.SearchResult;
import io.memorybank.metadata.ValidationStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Future-based facade over a {@link MemoryBank}.
 *
 * <p>Every call runs on the executor supplied by the caller; this class never
 * creates threads. Startup operations accept a timeout that bounds how long the
 * returned future waits. A timed-out operation is not cancelled: the underlying
 * call finishes in the background and its result is discarded.</p>
 */
public class AsyncMemoryBank {
    
    private final MemoryBank delegate;
    private final Executor executor;
    
    public AsyncMemoryBank(MemoryBank delegate, Executor executor) {
        this.delegate = delegate;
        this.executor = executor;
    }
    
    public CompletableFuture<OperationResult<Void>> init() {
        return submit(delegate::init);
    }
    
    public CompletableFuture<OperationResult<Void>> initializeFolders() {
        return submit(delegate::initializeFolders);
    }
    
    public CompletableFuture<OperationResult<List<MemoryBankFileType>>> loadFiles() {
        return submit(delegate::loadFiles);
    }
    
    /**
     * Loads all files, completing with a TIMEOUT failure if loading takes longer than {@code timeout}.
     */
    public CompletableFuture<OperationResult<List<MemoryBankFileType>>> loadFiles(Duration timeout) {
        return withTimeout(loadFiles(), timeout, "loadFiles");
    }
    
    public CompletableFuture<OperationResult<String>> checkHealth() {
        return submit(delegate::checkHealth);
    }
    
    /**
     * Runs the health check, completing with a TIMEOUT failure if it takes longer than {@code timeout}.
     */
    public CompletableFuture<OperationResult<String>> checkHealth(Duration timeout) {
        return withTimeout(checkHealth(), timeout, "checkHealth");
    }
    
    public CompletableFuture<Optional<MemoryBankFile>> getFile(MemoryBankFileType type) {
        return CompletableFuture.supplyAsync(() -> delegate.getFile(type), executor);
    }
    
    public CompletableFuture<List<MemoryBankFile>> getAllFiles() {
        return CompletableFuture.supplyAsync(delegate::getAllFiles, executor);
    }
    
    public CompletableFuture<Map<String, String>> getFilesWithFilenames() {
        return CompletableFuture.supplyAsync(delegate::getFilesWithFilenames, executor);
    }
    
    public CompletableFuture<OperationResult<MemoryBankFile>> updateFile(MemoryBankFileType type, String content) {
        return submit(() -> delegate.updateFile(type, content));
    }
    
    public CompletableFuture<OperationResult<MemoryBankFile>> updateFile(String typeIdOrPath, String content) {
        return submit(() -> delegate.updateFile(typeIdOrPath, content));
    }
    
    public CompletableFuture<OperationResult<Void>> writeFileByPath(String relativePath, String content) {
        return submit(() -> delegate.writeFileByPath(relativePath, content));
    }
    
    public CompletableFuture<OperationResult<ValidationStatus>> validateFile(MemoryBankFileType type) {
        return submit(() -> delegate.validateFile(type));
    }
    
    public CompletableFuture<OperationResult<Void>> invalidateCache() {
        return submit(delegate::invalidateCache);
    }
    
    public CompletableFuture<OperationResult<Void>> invalidateCache(String relativePath) {
        return submit(() -> delegate.invalidateCache(relativePath));
    }
    
    public CompletableFuture<OperationResult<CacheStats>> getCacheStats() {
        return submit(delegate::getCacheStats);
    }
    
    public CompletableFuture<OperationResult<Void>> resetCacheStats() {
        return submit(delegate::resetCacheStats);
    }
    
    public CompletableFuture<OperationResult<SearchResult>> searchMetadata(MetadataFilter filter) {
        return submit(() -> delegate.searchMetadata(filter));
    }
    
    public CompletableFuture<OperationResult<IndexStats>> getIndexStats() {
        return submit(delegate::getIndexStats);
    }
    
    public CompletableFuture<OperationResult<IndexRebuildResult>> rebuildIndex() {
        return submit(delegate::rebuildIndex);
    }
    
    public MemoryBank getDelegate() {
        return delegate;
    }
    
    private <T> CompletableFuture<OperationResult<T>> submit(Supplier<OperationResult<T>> call) {
        return CompletableFuture.supplyAsync(call, executor);
    }
    
    private static <T> CompletableFuture<OperationResult<T>> withTimeout(
            CompletableFuture<OperationResult<T>> future, Duration timeout, String operation) {
        OperationResult<T> timedOut = OperationResult.failure(ErrorKind.TIMEOUT,
            String.format("%s did not complete within %d ms", operation, timeout.toMillis()));
        return future.completeOnTimeout(timedOut, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}

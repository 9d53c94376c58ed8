package io.memorybank.fs;

import io.memorybank.MemoryBankException;
import io.memorybank.MemoryBankFileType;
import io.memorybank.OperationResult;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Confines file access to a single root directory.
 *
 * <p>All checks are lexical: the validator never touches the file system.</p>
 */
public class PathValidator {
    
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");
    
    private final Path root;
    
    public PathValidator(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.root = root.toAbsolutePath().normalize();
    }
    
    public Path getRoot() {
        return root;
    }
    
    /**
     * Resolves a known file type.
     */
    public OperationResult<Path> resolve(MemoryBankFileType type) {
        return resolveRelative(type.relativePath());
    }
    
    /**
     * Resolves a file type given by id or relative path.
     *
     * <p>Malformed identifiers fail with INVALID_PATH before the type lookup,
     * so {@code ../x} is never reported as an unknown type.</p>
     */
    public OperationResult<Path> resolveType(String idOrPath) {
        MemoryBankException malformed = checkIdentifier(idOrPath);
        if (malformed != null) {
            return OperationResult.failure(malformed);
        }
        return MemoryBankFileType.lookup(idOrPath)
            .map(this::resolve)
            .orElseGet(() -> OperationResult.failure(MemoryBankException.unknownFileType(idOrPath)));
    }
    
    /**
     * Resolves an arbitrary path relative to the root.
     */
    public OperationResult<Path> resolveRelative(String relativePath) {
        MemoryBankException malformed = checkIdentifier(relativePath);
        if (malformed != null) {
            return OperationResult.failure(malformed);
        }
        
        Path resolved;
        try {
            resolved = root.resolve(relativePath).normalize();
        } catch (InvalidPathException e) {
            return OperationResult.failure(MemoryBankException.invalidPath(relativePath, e.getReason()));
        }
        
        if (!resolved.startsWith(root)) {
            return OperationResult.failure(MemoryBankException.pathEscape(relativePath));
        }
        if (resolved.equals(root)) {
            return OperationResult.failure(MemoryBankException.invalidPath(relativePath, "resolves to the root itself"));
        }
        return OperationResult.success(resolved);
    }
    
    /**
     * Returns the root-relative key of an absolute path, using {@code /} separators.
     */
    public String relativize(Path absolutePath) {
        Path relative = root.relativize(absolutePath.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }
    
    private static MemoryBankException checkIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return MemoryBankException.invalidPath(String.valueOf(identifier), "empty identifier");
        }
        if (identifier.indexOf('\0') >= 0) {
            return MemoryBankException.invalidPath(identifier.replace("\0", "\\0"), "contains a NUL byte");
        }
        if (identifier.contains("..")) {
            return MemoryBankException.invalidPath(identifier, "contains '..'");
        }
        if (identifier.startsWith("/") || identifier.startsWith("\\") || DRIVE_PREFIX.matcher(identifier).matches()) {
            return MemoryBankException.invalidPath(identifier, "absolute paths are not allowed");
        }
        return null;
    }
}

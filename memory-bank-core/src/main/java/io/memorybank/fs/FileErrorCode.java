package io.memorybank.fs;

import io.memorybank.ErrorKind;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.Locale;

/**
 * Structured error codes for file operations.
 */
public enum FileErrorCode {
    ENOENT,
    EACCES,
    EEXIST,
    ENOTDIR,
    EISDIR,
    ENOSPC,
    EAGAIN,
    EBUSY,
    EMFILE,
    ENFILE,
    ETIMEDOUT,
    EIO,
    
    /** A transient failure persisted through every retry attempt */
    TRANSIENT_EXHAUSTED,
    
    /** The thread was interrupted while backing off */
    INTERRUPTED;
    
    /**
     * Returns true for failures that may succeed when retried.
     */
    public boolean isTransient() {
        return switch (this) {
            case EAGAIN, EBUSY, EMFILE, ENFILE, ETIMEDOUT -> true;
            default -> false;
        };
    }
    
    public ErrorKind toErrorKind() {
        return switch (this) {
            case ENOENT -> ErrorKind.NOT_FOUND;
            case EACCES -> ErrorKind.PERMISSION_DENIED;
            case TRANSIENT_EXHAUSTED -> ErrorKind.TRANSIENT_IO;
            default -> ErrorKind.IO_ERROR;
        };
    }
    
    /**
     * Maps an I/O exception onto an error code.
     *
     * <p>NIO reports most platform errors as a plain {@link FileSystemException}
     * whose reason is the OS message, so the reason text is inspected as a
     * fallback.</p>
     */
    public static FileErrorCode classify(IOException e) {
        if (e instanceof NoSuchFileException || e instanceof java.io.FileNotFoundException) {
            return ENOENT;
        }
        if (e instanceof AccessDeniedException) {
            return EACCES;
        }
        if (e instanceof FileAlreadyExistsException) {
            return EEXIST;
        }
        if (e instanceof NotDirectoryException) {
            return ENOTDIR;
        }
        if (e instanceof DirectoryNotEmptyException) {
            return EIO;
        }
        if (e instanceof InterruptedIOException) {
            return ETIMEDOUT;
        }
        
        String reason = e instanceof FileSystemException fse ? fse.getReason() : e.getMessage();
        if (reason == null) {
            return EIO;
        }
        String lower = reason.toLowerCase(Locale.ROOT);
        if (lower.contains("too many open files in system")) {
            return ENFILE;
        }
        if (lower.contains("too many open files")) {
            return EMFILE;
        }
        if (lower.contains("resource temporarily unavailable") || lower.contains("try again")) {
            return EAGAIN;
        }
        if (lower.contains("busy")) {
            return EBUSY;
        }
        if (lower.contains("timed out")) {
            return ETIMEDOUT;
        }
        if (lower.contains("is a directory")) {
            return EISDIR;
        }
        if (lower.contains("no space left")) {
            return ENOSPC;
        }
        if (lower.contains("permission denied")) {
            return EACCES;
        }
        if (lower.contains("no such file")) {
            return ENOENT;
        }
        return EIO;
    }
}

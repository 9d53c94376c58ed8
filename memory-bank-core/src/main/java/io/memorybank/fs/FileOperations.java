package io.memorybank.fs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Raw, single-attempt file system access.
 *
 * <p>Implementations throw the native {@link IOException}; classification and
 * retry happen in {@link RetryingFileOperations}.</p>
 */
public interface FileOperations {
    
    String read(Path path) throws IOException;
    
    /**
     * Replaces the file content so that readers see either the old or the new
     * content, never a partial write.
     */
    void writeAtomically(Path path, String content) throws IOException;
    
    void createDirectories(Path path) throws IOException;
    
    FileStat stat(Path path) throws IOException;
    
    /**
     * Lists regular files below a directory, recursively.
     */
    List<Path> listFiles(Path directory) throws IOException;
}

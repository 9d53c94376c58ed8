package io.memorybank;

/**
 * Supplies the initial content of a memory bank file that is missing on disk.
 */
@FunctionalInterface
public interface TemplateProvider {
    
    /**
     * Returns the markdown body for a new file of the given type, without front-matter.
     */
    String templateFor(MemoryBankFileType type);
}

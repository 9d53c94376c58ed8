package io.memorybank;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Built-in templates for every {@link MemoryBankFileType}.
 */
public class DefaultTemplateProvider implements TemplateProvider {
    
    private final Map<MemoryBankFileType, String> templates;
    
    public DefaultTemplateProvider() {
        this(builtInTemplates());
    }
    
    /**
     * @throws IllegalArgumentException if a file type has no template
     */
    public DefaultTemplateProvider(Map<MemoryBankFileType, String> templates) {
        Set<MemoryBankFileType> missing = EnumSet.allOf(MemoryBankFileType.class);
        missing.removeAll(templates.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("No template for file types: " + missing);
        }
        this.templates = Collections.unmodifiableMap(new EnumMap<>(templates));
    }
    
    @Override
    public String templateFor(MemoryBankFileType type) {
        return templates.get(type);
    }
    
    private static Map<MemoryBankFileType, String> builtInTemplates() {
        Map<MemoryBankFileType, String> map = new EnumMap<>(MemoryBankFileType.class);
        map.put(MemoryBankFileType.PROJECT_BRIEF, template("Project Brief",
            "the foundation document that shapes all other files",
            "Core Requirements", "Project Goals", "Project Scope"));
        map.put(MemoryBankFileType.PRODUCT_CONTEXT, template("Product Context",
            "why this project exists, the problems it solves and how it should work",
            "Why this project exists", "Problems it solves", "How it should work", "User experience goals"));
        map.put(MemoryBankFileType.ACTIVE_CONTEXT, template("Active Context",
            "the current work focus, recent changes, next steps and active decisions",
            "Current work focus", "Recent changes", "Next steps", "Active decisions and considerations"));
        map.put(MemoryBankFileType.PROGRESS_CURRENT, template("Current Progress",
            "current work, blockers and next steps"));
        map.put(MemoryBankFileType.PROGRESS_HISTORY, template("Progress History",
            "a log of past progress and milestones"));
        map.put(MemoryBankFileType.PROGRESS_INDEX, template("Progress Index",
            "a summary of project progress"));
        map.put(MemoryBankFileType.SYSTEM_PATTERNS_INDEX, template("System Patterns Index",
            "a summary of system patterns and architecture"));
        map.put(MemoryBankFileType.SYSTEM_PATTERNS_ARCHITECTURE, template("System Architecture",
            "the overall system architecture"));
        map.put(MemoryBankFileType.SYSTEM_PATTERNS_PATTERNS, template("Patterns",
            "the design patterns in use"));
        map.put(MemoryBankFileType.SYSTEM_PATTERNS_SCANNING, template("Scanning",
            "scanning and analysis patterns"));
        map.put(MemoryBankFileType.TECH_CONTEXT_INDEX, template("Tech Context Index",
            "a summary of the technology stack and constraints"));
        map.put(MemoryBankFileType.TECH_CONTEXT_STACK, template("Technology Stack",
            "the major technologies used"));
        map.put(MemoryBankFileType.TECH_CONTEXT_DEPENDENCIES, template("Dependencies",
            "the project dependencies"));
        map.put(MemoryBankFileType.TECH_CONTEXT_ENVIRONMENT, template("Environment",
            "the development and production environments"));
        return map;
    }
    
    private static String template(String heading, String purpose, String... sections) {
        StringBuilder sb = new StringBuilder()
            .append("# ").append(heading).append("\n\n")
            .append("This file should describe ").append(purpose).append(".\n");
        for (String section : sections) {
            sb.append("\n## ").append(section).append('\n');
        }
        return sb.toString();
    }
}

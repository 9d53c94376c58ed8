package io.memorybank;

import java.util.List;

/**
 * Aggregated result of a health check.
 */
public record HealthReport(
    boolean healthy,
    
    /** Every problem found, in check order */
    List<String> issues,
    
    /** Human-readable multi-line summary */
    String summary
) {
    public HealthReport {
        issues = List.copyOf(issues);
    }
    
    static HealthReport of(List<String> issues, int checkedFiles) {
        if (issues.isEmpty()) {
            return new HealthReport(true, List.of(),
                String.format("Memory bank is healthy: %d files present and readable", checkedFiles));
        }
        StringBuilder sb = new StringBuilder()
            .append(String.format("Memory bank has %d issue(s):", issues.size()));
        for (String issue : issues) {
            sb.append("\n - ").append(issue);
        }
        return new HealthReport(false, issues, sb.toString());
    }
}

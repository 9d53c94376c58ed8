package io.memorybank;

import java.util.List;

/**
 * Failure of a health check, carrying every issue found.
 */
public class HealthCheckException extends MemoryBankException {
    
    private final HealthReport report;
    
    public HealthCheckException(HealthReport report) {
        super(ErrorKind.HEALTH_CHECK_FAILED, report.summary());
        this.report = report;
    }
    
    public List<String> getIssues() {
        return report.issues();
    }
    
    public HealthReport getReport() {
        return report;
    }
}

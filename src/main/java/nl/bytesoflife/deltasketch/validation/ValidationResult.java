package nl.bytesoflife.deltasketch.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Findings of one validation run, in check order.
 */
public class ValidationResult {

    private final List<ValidationIssue> issues = new ArrayList<>();

    public void addIssue(ValidationIssue issue) {
        issues.add(issue);
    }

    public void addIssues(List<ValidationIssue> newIssues) {
        issues.addAll(newIssues);
    }

    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public List<ValidationIssue> getErrors() {
        return issues.stream()
                .filter(i -> i.getSeverity() == Severity.ERROR)
                .toList();
    }

    public List<ValidationIssue> getWarnings() {
        return issues.stream()
                .filter(i -> i.getSeverity() == Severity.WARNING)
                .toList();
    }

    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public boolean hasIssue(ValidationCode code) {
        return issues.stream().anyMatch(i -> i.getCode() == code);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Validation Result:\n");
        sb.append("  Valid: ").append(isValid()).append("\n");
        sb.append("  Issues: ").append(issues.size())
          .append(" (").append(getErrors().size()).append(" errors, ")
          .append(getWarnings().size()).append(" warnings)\n");
        for (ValidationIssue issue : issues) {
            sb.append("  - ").append(issue).append("\n");
        }
        return sb.toString();
    }
}

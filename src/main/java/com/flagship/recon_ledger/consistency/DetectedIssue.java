package com.flagship.recon_ledger.consistency;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * What a detector found, before it is recorded as a check.
 */
@Value
public class DetectedIssue {
    CheckType type;
    Severity severity;
    List<CheckSubject> subjects;
    Map<String, Object> details;

    /**
     * Check type plus the sorted subjects. Identical for the same issue found twice.
     */
    public String fingerprint() {
        return type + "|" + subjects.stream().sorted().distinct().map(CheckSubject::toString)
            .collect(Collectors.joining(","));
    }
}

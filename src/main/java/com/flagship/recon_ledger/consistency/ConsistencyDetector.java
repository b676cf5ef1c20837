package com.flagship.recon_ledger.consistency;

import java.util.List;

/**
 * One kind of data-quality scan. Implementations are Spring beans picked up by
 * {@link ConsistencyChecker}; they only read, recording is done by the checker.
 */
public interface ConsistencyDetector {

    CheckType type();

    List<DetectedIssue> detect();
}

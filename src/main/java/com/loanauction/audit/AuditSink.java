package com.loanauction.audit;

/**
 * Append-only destination for audit records.
 */
public interface AuditSink {

    void record(AuditRecord record);
}

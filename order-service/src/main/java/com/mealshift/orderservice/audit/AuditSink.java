package com.mealshift.orderservice.audit;

import com.mealshift.common.contracts.AuditRecordContract;

/**
 * Receives a structured record of every engine action. Implementations must not throw:
 * a failing audit trail never fails the operation being audited.
 */
public interface AuditSink {

    void record(AuditRecordContract record);
}

package com.aimanager.rbac.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test sink that keeps everything it is given.
 */
public class RecordingAuditSink implements AuditSink {

    public final List<AuditEvent> recorded = new CopyOnWriteArrayList<>();
    public final List<AuditEvent> alerts = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEvent event) {
        recorded.add(event);
    }

    @Override
    public void alert(AuditEvent event) {
        alerts.add(event);
    }

    public AuditEvent last() {
        return recorded.isEmpty() ? null : recorded.get(recorded.size() - 1);
    }

    /**
     * Synchronous dispatcher delivering to this sink only.
     */
    public AuditDispatcher dispatcher() {
        return new AuditDispatcher(List.of(this), Runnable::run, true);
    }
}

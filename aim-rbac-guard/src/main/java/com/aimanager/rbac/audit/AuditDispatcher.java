package com.aimanager.rbac.audit;

import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.model.policy.AccessDecision;
import com.aimanager.rbac.util.ExceptionLoggingUtils;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Logs every access decision and forwards audit events to the registered {@link AuditSink}s.
 * <p>
 * Sinks run on a separate, bounded executor after the decision has been made. A failing sink,
 * or a full queue, is logged and otherwise ignored: nothing here can change or delay a decision.
 */
@ApplicationScoped
public class AuditDispatcher {

    @Inject
    Instance<AuditSink> sinkBeans;

    @ConfigProperty(name = "aim.rbac.audit.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "aim.rbac.audit.log-allowed", defaultValue = "true")
    boolean logAllowed;

    @ConfigProperty(name = "aim.rbac.audit.queue-capacity", defaultValue = "1000")
    int queueCapacity;

    private Iterable<AuditSink> sinks = List.of();
    private Executor executor;
    private ExecutorService ownedExecutor;

    public AuditDispatcher() {
    }

    /**
     * Manual wiring, mainly for tests. Pass {@code Runnable::run} to deliver synchronously.
     */
    public AuditDispatcher(List<AuditSink> sinks, Executor executor, boolean logAllowed) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
        this.enabled = true;
        this.logAllowed = logAllowed;
    }

    @PostConstruct
    void init() {
        if (sinkBeans != null) {
            sinks = sinkBeans;
        }
        ownedExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("aim-rbac-audit-%d").build());
        executor = ownedExecutor;
        Log.infof("Audit dispatcher started: enabled=%s, queueCapacity=%d", enabled, queueCapacity);
    }

    @PreDestroy
    void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    /**
     * Logs {@code decision} and forwards it to the sinks as an access granted/denied event.
     */
    public void recordDecision(AccessDecision decision, UserContext context) {
        if (decision == null || context == null) {
            return;
        }
        if (decision.isAllowed()) {
            if (logAllowed) {
                Log.infof("RBAC access decision: allowed user=%s role=%s resource=%s policy=%s",
                    context.getUserId(), context.getRole(), decision.getResource(), decision.getPolicyId());
            } else if (Log.isDebugEnabled()) {
                Log.debugf("RBAC access decision: allowed user=%s role=%s resource=%s policy=%s",
                    context.getUserId(), context.getRole(), decision.getResource(), decision.getPolicyId());
            }
        } else {
            Log.warnf("RBAC access decision: denied user=%s role=%s resource=%s reason=%s",
                context.getUserId(), context.getRole(), decision.getResource(), decision.getReason());
        }
        dispatch(AuditEvent.fromDecision(decision, context));
    }

    public void recordChatResponse(UserContext context, String agentName, int sourcesCount, boolean filtered) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("agent", agentName);
        metadata.put("sources_count", sourcesCount);
        metadata.put("filtered", filtered);
        record(AuditEvent.forContext(filtered ? AuditEventType.CHAT_FILTERED : AuditEventType.CHAT_RESPONSE, context)
            .resourceType("chat")
            .action("respond")
            .result(AuditEvent.RESULT_SUCCESS)
            .metadata(metadata)
            .build());
    }

    public void recordToolCall(UserContext context, String toolName, boolean allowed, Map<String, Object> scope) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool", toolName);
        if (allowed && scope != null) {
            metadata.put("scope", scope);
        }
        record(AuditEvent.forContext(allowed ? AuditEventType.MCP_TOOL_CALL : AuditEventType.MCP_TOOL_BLOCKED, context)
            .resourceType("mcp_tool")
            .action(toolName)
            .result(allowed ? AuditEvent.RESULT_SUCCESS : AuditEvent.RESULT_DENIED)
            .metadata(metadata)
            .build());
    }

    public void recordRoleChange(UserContext context, Role from, Role to, String source) {
        record(AuditEvent.forContext(AuditEventType.ROLE_CHANGE, context)
            .action(source)
            .result(AuditEvent.RESULT_SUCCESS)
            .metadata(Map.of("from", String.valueOf(from), "to", String.valueOf(to)))
            .build());
    }

    /**
     * Logs and forwards an arbitrary event.
     */
    public void record(AuditEvent event) {
        if (event == null) {
            return;
        }
        if (event.getEventType() != null && event.getEventType().isSensitive()) {
            Log.warnf("Audit event %s user=%s resource=%s result=%s", event.getEventType().toValue(),
                event.getUserId(), event.getResourceType(), event.getResult());
        } else {
            Log.infof("Audit event %s user=%s resource=%s result=%s",
                event.getEventType() != null ? event.getEventType().toValue() : null,
                event.getUserId(), event.getResourceType(), event.getResult());
        }
        dispatch(event);
    }

    void dispatch(AuditEvent event) {
        if (!enabled || executor == null) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            ExceptionLoggingUtils.logWarn(null, "Audit queue full or closed, dropping %s event for user %s",
                event.getEventType(), event.getUserId());
        }
    }

    private void deliver(AuditEvent event) {
        boolean sensitive = event.getEventType() != null && event.getEventType().isSensitive();
        for (AuditSink sink : sinks) {
            try {
                sink.record(event);
                if (sensitive) {
                    sink.alert(event);
                }
            } catch (RuntimeException e) {
                ExceptionLoggingUtils.logError(e, "Audit sink %s failed for event %s",
                    sink.getClass().getSimpleName(), event.getEventId());
            }
        }
    }
}

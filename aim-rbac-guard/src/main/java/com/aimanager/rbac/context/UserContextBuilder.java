package com.aimanager.rbac.context;

import com.aimanager.rbac.audit.AuditDispatcher;
import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.model.UserContext;
import com.aimanager.rbac.util.AttributeUtils;
import com.aimanager.rbac.util.ExceptionLoggingUtils;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the per-request {@link UserContext} from an already validated identity token.
 * <p>
 * Recognised claims: {@code sub} (required), {@code role}, {@code team_id},
 * {@code department_id}, {@code org_id}, {@code email}, {@code name}. Values in the token
 * win over values from the {@link OrgChartResolver}; reporting lines and projects come only
 * from the resolver.
 */
@ApplicationScoped
public class UserContextBuilder {

    public static final String ANONYMOUS_USER_ID = "anonymous";

    static final String CLAIM_SUBJECT = "sub";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TEAM = "team_id";
    static final String CLAIM_DEPARTMENT = "department_id";
    static final String CLAIM_ORGANIZATION = "org_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_NAME = "name";

    @Inject
    Instance<OrgChartResolver> resolverBeans;

    @Inject
    AuditDispatcher auditDispatcher;

    @ConfigProperty(name = "aim.rbac.context.default-organization", defaultValue = "default")
    String defaultOrganization;

    @ConfigProperty(name = "aim.rbac.context.demo-role-override.enabled", defaultValue = "false")
    boolean demoRoleOverrideEnabled;

    private OrgChartResolver orgChartResolver;

    public UserContextBuilder() {
    }

    public UserContextBuilder(OrgChartResolver orgChartResolver, AuditDispatcher auditDispatcher,
                              String defaultOrganization, boolean demoRoleOverrideEnabled) {
        this.orgChartResolver = orgChartResolver;
        this.auditDispatcher = auditDispatcher;
        this.defaultOrganization = defaultOrganization;
        this.demoRoleOverrideEnabled = demoRoleOverrideEnabled;
    }

    @PostConstruct
    void init() {
        if (resolverBeans != null && resolverBeans.isResolvable()) {
            orgChartResolver = resolverBeans.get();
        }
        if (demoRoleOverrideEnabled) {
            Log.warn("Demo role override is enabled; callers can choose their role with a request header");
        }
    }

    /**
     * @throws IllegalArgumentException when the claims carry no subject
     */
    public UserContext fromClaims(Map<String, ?> claims, RequestMetadata metadata) {
        String userId = AttributeUtils.getString(claims, CLAIM_SUBJECT);
        if (StringUtils.isBlank(userId)) {
            throw new IllegalArgumentException("Token missing 'sub' (user id)");
        }
        RequestMetadata meta = metadata == null ? RequestMetadata.NONE : metadata;
        OrgChartEntry entry = lookup(userId).orElse(null);

        String roleClaim = AttributeUtils.getString(claims, CLAIM_ROLE);
        if (roleClaim == null && entry != null) {
            roleClaim = entry.role();
        }

        UserContext context = new UserContext.Builder()
            .withUserId(userId)
            .withRole(Role.fromString(roleClaim))
            .withTeamId(firstNonBlank(AttributeUtils.getString(claims, CLAIM_TEAM), entry == null ? null : entry.teamId(), ""))
            .withDepartmentId(firstNonBlank(AttributeUtils.getString(claims, CLAIM_DEPARTMENT), entry == null ? null : entry.departmentId(), ""))
            .withOrganizationId(firstNonBlank(AttributeUtils.getString(claims, CLAIM_ORGANIZATION), entry == null ? null : entry.organizationId(), defaultOrganization))
            .withEmail(firstNonBlank(AttributeUtils.getString(claims, CLAIM_EMAIL), entry == null ? null : entry.email(), null))
            .withName(firstNonBlank(AttributeUtils.getString(claims, CLAIM_NAME), entry == null ? null : entry.name(), null))
            .withManagerId(entry == null ? null : entry.managerId())
            .withDirectReports(entry == null ? List.of() : entry.directReports())
            .withProjectIds(entry == null ? List.of() : entry.projectIds())
            .withSessionId(meta.sessionId())
            .withIpAddress(meta.ipAddress())
            .withUserAgent(meta.userAgent())
            .build();
        return applyDemoRole(context, meta);
    }

    public UserContext fromJsonWebToken(JsonWebToken token, RequestMetadata metadata) {
        Map<String, Object> claims = new HashMap<>();
        if (token.getClaimNames() != null) {
            for (String name : token.getClaimNames()) {
                Object value = ClaimValues.toJava(token.getClaim(name));
                if (value != null) {
                    claims.put(name, value);
                }
            }
        }
        if (!claims.containsKey(CLAIM_SUBJECT) && token.getSubject() != null) {
            claims.put(CLAIM_SUBJECT, token.getSubject());
        }
        return fromClaims(claims, metadata);
    }

    /**
     * Builds a context purely from the org chart, for callers identified by id only.
     *
     * @throws IllegalArgumentException when no resolver is configured or the user is unknown
     */
    public UserContext fromUserId(String userId, RequestMetadata metadata) {
        OrgChartEntry entry = lookup(userId)
            .orElseThrow(() -> new IllegalArgumentException("User not found: " + userId));
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_SUBJECT, userId);
        if (entry.role() != null) {
            claims.put(CLAIM_ROLE, entry.role());
        }
        return fromClaims(claims, metadata);
    }

    /**
     * The context for unauthenticated callers: the most restricted role and no organization.
     */
    public UserContext anonymous(RequestMetadata metadata) {
        RequestMetadata meta = metadata == null ? RequestMetadata.NONE : metadata;
        return new UserContext.Builder()
            .withUserId(ANONYMOUS_USER_ID)
            .withRole(Role.NEW_HIRE)
            .withSessionId(meta.sessionId())
            .withIpAddress(meta.ipAddress())
            .withUserAgent(meta.userAgent())
            .build();
    }

    /**
     * Token claims when present, otherwise the anonymous context.
     */
    public UserContext resolve(Map<String, ?> claims, RequestMetadata metadata) {
        if (claims == null || claims.isEmpty()) {
            return anonymous(metadata);
        }
        return fromClaims(claims, metadata);
    }

    private UserContext applyDemoRole(UserContext context, RequestMetadata meta) {
        if (StringUtils.isBlank(meta.demoRole())) {
            return context;
        }
        if (!demoRoleOverrideEnabled) {
            Log.warnf("Ignoring demo role '%s' for user %s: override disabled", meta.demoRole(), context.getUserId());
            return context;
        }
        Role demoRole = Role.fromString(meta.demoRole());
        if (demoRole == context.getRole()) {
            return context;
        }
        UserContext overridden = context.withRole(demoRole);
        if (auditDispatcher != null) {
            auditDispatcher.recordRoleChange(overridden, context.getRole(), demoRole, "demo-role-override");
        }
        return overridden;
    }

    private Optional<OrgChartEntry> lookup(String userId) {
        if (orgChartResolver == null) {
            return Optional.empty();
        }
        try {
            return orgChartResolver.lookup(userId);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Org chart lookup failed for user %s; using token data only", userId);
            return Optional.empty();
        }
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (StringUtils.isNotBlank(first)) {
            return first;
        }
        if (StringUtils.isNotBlank(second)) {
            return second;
        }
        return fallback;
    }
}

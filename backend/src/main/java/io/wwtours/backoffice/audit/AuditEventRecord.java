package io.wwtours.backoffice.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "proposal", "booking")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param actorType OPERATOR, CLIENT or SYSTEM
 * @param source origin of the action: API, PORTAL, INTERNAL, SCHEDULED
 * @param ipAddress client IP; null for non-HTTP sources
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorType,
    String source,
    String ipAddress,
    Map<String, Object> details) {}

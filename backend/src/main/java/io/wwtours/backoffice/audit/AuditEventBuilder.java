package io.wwtours.backoffice.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Fills source, actor type and IP address from
 * the current request when they are not set explicitly.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("proposal.sent")
 *     .entityType("proposal")
 *     .entityId(proposal.getId())
 *     .details(Map.of("proposal_number", proposal.getProposalNumber()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. Without explicit values, {@code source} is "API" inside an HTTP request and
   * "INTERNAL" otherwise, and {@code actorType} is "OPERATOR" or "SYSTEM" accordingly.
   */
  public AuditEventRecord build() {
    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = source != null ? source : (request != null ? "API" : "INTERNAL");
    String resolvedActorType =
        actorType != null ? actorType : (request != null ? "OPERATOR" : "SYSTEM");
    String ipAddress = request != null ? request.getRemoteAddr() : null;

    return new AuditEventRecord(
        eventType, entityType, entityId, resolvedActorType, resolvedSource, ipAddress, details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}

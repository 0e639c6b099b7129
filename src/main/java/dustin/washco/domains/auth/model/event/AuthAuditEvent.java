package dustin.washco.domains.auth.model.event;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 인증 감사 이벤트
 * Authentication audit event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthAuditEvent {

    private AuthAuditAction action;

    private Long userId;

    private Long tenantId;

    private String email;

    private Instant occurredAt;
}

package dustin.washco.domains.auth.model.token;

import java.time.Instant;

import dustin.washco.domains.auth.model.entity.UserRole;
import lombok.Builder;
import lombok.Getter;

/**
 * 검증된 Access Token의 클레임
 * Claims of a verified access token
 */
@Getter
@Builder
public class AccessTokenClaims {

    private final Long userId;

    private final String email;

    private final UserRole role;

    private final Long tenantId;

    private final Instant expiresAt;
}

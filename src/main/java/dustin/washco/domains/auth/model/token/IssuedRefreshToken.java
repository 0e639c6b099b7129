package dustin.washco.domains.auth.model.token;

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 발급된 Refresh Token
 * Freshly issued refresh token
 *
 * plaintext는 클라이언트에게 한 번만 전달되고, DB에는 tokenHash만 저장됨
 */
@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class IssuedRefreshToken {

    private final String plaintext;

    private final String tokenHash;

    @ToString.Include
    private final LocalDateTime expiresAt;
}

package dustin.washco.domains.auth.identity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 검증된 외부 신원
 * Verified external identity
 */
@Getter
@Builder
@ToString
public class VerifiedIdentity {

    /**
     * 제공자 내 고유 사용자 ID (sub)
     * Stable subject id at the provider
     */
    private final String subject;

    /**
     * 제공자가 확인한 이메일. 확인되지 않았으면 null
     * Provider-verified email, null when absent or unverified
     */
    private final String email;

    private final String displayName;

    private final String pictureUrl;
}

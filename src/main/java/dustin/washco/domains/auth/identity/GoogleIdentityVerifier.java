package dustin.washco.domains.auth.identity;

import java.security.Key;
import java.time.Duration;
import java.util.Set;

import org.springframework.stereotype.Component;

import dustin.washco.domains.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import lombok.extern.slf4j.Slf4j;

/**
 * Google ID 토큰 검증기
 * Google ID token verifier
 *
 * 검증 항목:
 * - RS256 서명 (Google JWKS 공개키)
 * - aud == 이 서비스의 client id
 * - iss == accounts.google.com
 * - exp (허용 오차 clockSkew)
 * - sub 존재
 *
 * email_verified=false 인 이메일은 신뢰하지 않고 버림
 */
@Slf4j
@Component
public class GoogleIdentityVerifier implements IdentityVerifier {

    private static final Set<String> GOOGLE_ISSUERS = Set.of("accounts.google.com", "https://accounts.google.com");

    private final JwksKeySource keySource;
    private final Duration clockSkew;

    public GoogleIdentityVerifier(JwksKeySource keySource, AuthProperties authProperties) {
        this.keySource = keySource;
        this.clockSkew = authProperties.getGoogle().getClockSkew();
    }

    @Override
    public VerifiedIdentity verify(String rawAssertion, String expectedAudience) {
        if (rawAssertion == null || rawAssertion.isBlank()) {
            throw new InvalidAssertionException("Empty identity assertion");
        }

        try {
            Claims claims = Jwts.parser()
                    .keyLocator(new LocatorAdapter<Key>() {
                        @Override
                        protected Key locate(JwsHeader header) {
                            return keySource.findKey(header.getKeyId())
                                    .orElseThrow(() -> new UnsupportedJwtException("Unknown signing key: " + header.getKeyId()));
                        }
                    })
                    .requireAudience(expectedAudience)
                    .clockSkewSeconds(clockSkew.toSeconds())
                    .build()
                    .parseSignedClaims(rawAssertion)
                    .getPayload();

            if (!GOOGLE_ISSUERS.contains(claims.getIssuer())) {
                throw new InvalidAssertionException("Unexpected issuer: " + claims.getIssuer());
            }
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new InvalidAssertionException("Assertion has no subject");
            }

            return VerifiedIdentity.builder()
                    .subject(subject)
                    .email(trustedEmail(claims))
                    .displayName(claims.get("name", String.class))
                    .pictureUrl(claims.get("picture", String.class))
                    .build();
        } catch (InvalidAssertionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("[GoogleIdentityVerifier] ID 토큰 검증 실패: {}", e.getMessage());
            throw new InvalidAssertionException("Invalid Google ID token", e);
        }
    }

    private String trustedEmail(Claims claims) {
        String email = claims.get("email", String.class);
        Object emailVerified = claims.get("email_verified");
        if (Boolean.FALSE.equals(emailVerified) || "false".equals(emailVerified)) {
            return null;
        }
        return email;
    }
}

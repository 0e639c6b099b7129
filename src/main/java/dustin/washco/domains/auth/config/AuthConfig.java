package dustin.washco.domains.auth.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import javax.crypto.SecretKey;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import io.jsonwebtoken.security.Keys;

/**
 * 인증 빈 설정
 * Auth bean configuration
 *
 * JWT 서명 키는 프로세스 수명 동안 유지되는 빈으로 생성하여 JwtService에 주입
 */
@Configuration
public class AuthConfig {

    private static final int MIN_SECRET_BYTES = 32;

    /**
     * Access Token 서명 키
     * Access token signing key
     */
    @Bean
    public SecretKey accessTokenSigningKey(AuthProperties authProperties) {
        String secret = authProperties.getJwt().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("auth.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Google JWKS 조회용 HTTP 클라이언트
     * HTTP client for Google JWKS lookups
     */
    @Bean
    public RestTemplate jwksRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }
}

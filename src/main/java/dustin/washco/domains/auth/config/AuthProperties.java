package dustin.washco.domains.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * 인증 설정
 * Auth Configuration
 *
 * 역할:
 * - JWT 서명 키 및 토큰 수명
 * - Argon2 비밀번호 해싱 파라미터
 * - Google 로그인 설정 (client id, JWKS)
 * - Refresh Token 정리 주기, 감사 이벤트 발행 여부
 *
 * 설정 방법:
 * - application.properties에서 설정 (prefix: auth)
 * - 환경변수로 오버라이드 가능 (JWT_SECRET, GOOGLE_CLIENT_ID 등)
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private Jwt jwt = new Jwt();

    private Password password = new Password();

    private Google google = new Google();

    private RefreshToken refreshToken = new RefreshToken();

    private Audit audit = new Audit();

    @Data
    public static class Jwt {

        /**
         * HS256 서명 키 (최소 32바이트)
         * HS256 signing secret (at least 32 bytes)
         */
        private String secret;

        /**
         * Access Token 수명
         * Access token lifetime
         */
        private Duration accessTokenTtl = Duration.ofMinutes(15);

        /**
         * Refresh Token 수명
         * Refresh token lifetime
         */
        private Duration refreshTokenTtl = Duration.ofDays(7);
    }

    @Data
    public static class Password {

        private int iterations = 3;

        private int memoryKb = 65536;

        private int parallelism = 1;
    }

    @Data
    public static class Google {

        /**
         * OAuth client id. 비어 있으면 Google 로그인 비활성화
         * OAuth client id; Google sign-in is disabled when blank
         */
        private String clientId;

        private String jwksUri = "https://www.googleapis.com/oauth2/v3/certs";

        private Duration jwksCacheTtl = Duration.ofHours(1);

        /**
         * 모르는 kid로 인한 강제 재조회 최소 간격
         * Minimum interval between refetches forced by an unknown key id
         */
        private Duration jwksMinRefreshInterval = Duration.ofSeconds(30);

        private Duration clockSkew = Duration.ofSeconds(60);

        public boolean isConfigured() {
            return clientId != null && !clientId.isBlank();
        }
    }

    @Data
    public static class RefreshToken {

        private String cleanupCron = "0 0 3 * * ?";
    }

    @Data
    public static class Audit {

        private boolean enabled = true;

        private String topic = "auth-audit-events";
    }
}

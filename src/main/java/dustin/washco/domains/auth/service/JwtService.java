package dustin.washco.domains.auth.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

import dustin.washco.domains.auth.config.AuthProperties;
import dustin.washco.domains.auth.exception.AuthErrorCode;
import dustin.washco.domains.auth.exception.AuthException;
import dustin.washco.domains.auth.model.entity.UserRole;
import dustin.washco.domains.auth.model.token.AccessTokenClaims;
import dustin.washco.domains.auth.model.token.IssuedRefreshToken;

import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Date;
import java.util.HexFormat;

/**
 * JWT 서비스
 * JWT Service for token generation and verification
 *
 * - Access Token: HS256 서명, 상태 없음 (DB 조회 없이 검증)
 * - Refresh Token: 32바이트 랜덤 문자열, DB에는 SHA-256 해시만 저장
 */
@Service
public class JwtService {
    
    private static final int REFRESH_TOKEN_BYTES = 32;
    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLE = "role";
    private static final String CLAIM_TENANT_ID = "tenantId";
    
    private final SecretKey signingKey;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final SecureRandom secureRandom;
    
    public JwtService(SecretKey accessTokenSigningKey, AuthProperties authProperties) {
        this.signingKey = accessTokenSigningKey;
        this.accessTokenTtl = authProperties.getJwt().getAccessTokenTtl();
        this.refreshTokenTtl = authProperties.getJwt().getRefreshTokenTtl();
        this.secureRandom = new SecureRandom();
    }
    
    /**
     * Access Token 발급
     * Generate Access Token
     */
    public String issueAccessToken(Long userId, String email, UserRole role, Long tenantId) {
        Instant now = Instant.now();
        Instant expiration = now.plus(accessTokenTtl);
        
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLE, role.name())
                .claim(CLAIM_TENANT_ID, tenantId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(signingKey)
                .compact();
    }
    
    /**
     * Access Token 검증 및 Claims 추출
     * Verify Access Token and extract Claims
     *
     * @throws AuthException ACCESS_TOKEN_EXPIRED (만료) 또는 INVALID_ACCESS_TOKEN (서명/형식 오류)
     */
    public AccessTokenClaims verifyAccessToken(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorCode.ACCESS_TOKEN_EXPIRED);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.INVALID_ACCESS_TOKEN);
        }
        
        try {
            Object tenantId = claims.get(CLAIM_TENANT_ID);
            return AccessTokenClaims.builder()
                    .userId(Long.parseLong(claims.getSubject()))
                    .email(claims.get(CLAIM_EMAIL, String.class))
                    .role(UserRole.valueOf(claims.get(CLAIM_ROLE, String.class)))
                    .tenantId(tenantId == null ? null : ((Number) tenantId).longValue())
                    .expiresAt(claims.getExpiration().toInstant())
                    .build();
        } catch (RuntimeException e) {
            // 서명은 유효하지만 클레임 구조가 다른 토큰
            throw new AuthException(AuthErrorCode.INVALID_ACCESS_TOKEN);
        }
    }
    
    /**
     * Refresh Token 생성 (랜덤 문자열 + 해시 + 만료 시간)
     * Generate Refresh Token (random string, hash, expiry)
     */
    public IssuedRefreshToken issueRefreshToken() {
        byte[] randomBytes = new byte[REFRESH_TOKEN_BYTES];
        secureRandom.nextBytes(randomBytes);
        String plaintext = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
        
        return IssuedRefreshToken.builder()
                .plaintext(plaintext)
                .tokenHash(hashRefreshToken(plaintext))
                .expiresAt(LocalDateTime.now().plus(refreshTokenTtl))
                .build();
    }
    
    /**
     * Refresh Token 해싱 (DB 저장 및 조회용)
     * Hash Refresh Token (for database storage and lookup)
     */
    public String hashRefreshToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
    
    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }
}

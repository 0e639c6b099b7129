package dustin.washco.domains.auth.service;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.washco.domains.auth.model.entity.RefreshToken;
import dustin.washco.domains.auth.model.token.IssuedRefreshToken;
import dustin.washco.domains.auth.repository.RefreshTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 저장/조회/무효화
 * Refresh token persistence
 *
 * 상태 전이:
 * - active --(logout / logout-all)--> revoked
 * - active --(만료 시간 경과)--> expired (저장 상태 아님, 조회 시 계산)
 * - revoked, expired 는 종료 상태 (되살리지 않음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshTokenRepository refreshTokenRepository;
    private final JwtService jwtService;

    /**
     * Refresh Token 생성 및 DB 저장
     * Create and store refresh token
     *
     * @return 원본 토큰을 포함한 발급 결과 (원본은 저장하지 않음)
     */
    @Transactional
    public IssuedRefreshToken issue(Long userId) {
        IssuedRefreshToken issued = jwtService.issueRefreshToken();

        RefreshToken token = RefreshToken.builder()
                .userId(userId)
                .tokenHash(issued.getTokenHash())
                .expiresAt(issued.getExpiresAt())
                .revoked(false)
                .build();
        refreshTokenRepository.save(token);

        return issued;
    }

    /**
     * 원본 토큰으로 저장된 레코드 조회
     * Find the stored record for a plaintext token
     */
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findByPlaintext(String refreshToken) {
        return refreshTokenRepository.findByTokenHash(jwtService.hashRefreshToken(refreshToken));
    }

    /**
     * 토큰 무효화 (멱등)
     * Revoke a token; idempotent
     *
     * @return 토큰 소유자 ID (일치하는 레코드가 없으면 empty)
     */
    @Transactional
    public Optional<Long> revoke(String refreshToken) {
        String tokenHash = jwtService.hashRefreshToken(refreshToken);
        Optional<Long> owner = refreshTokenRepository.findByTokenHash(tokenHash).map(RefreshToken::getUserId);
        refreshTokenRepository.revokeByTokenHash(tokenHash, LocalDateTime.now());
        return owner;
    }

    /**
     * 사용자의 모든 Refresh Token 무효화 (모든 기기에서 로그아웃)
     * Revoke all refresh tokens for user
     */
    @Transactional
    public int revokeAll(Long userId) {
        return refreshTokenRepository.revokeAllByUserId(userId, LocalDateTime.now());
    }

    @Transactional(readOnly = true)
    public long countActive(Long userId) {
        return refreshTokenRepository.countValidByUserId(userId, LocalDateTime.now());
    }

    /**
     * 만료되었거나 무효화된 토큰 삭제
     * Delete expired or revoked tokens
     */
    @Transactional
    public int purgeExpiredOrRevoked() {
        int deleted = refreshTokenRepository.deleteExpiredOrRevoked(LocalDateTime.now());
        log.info("[RefreshTokenService] 만료/무효화 토큰 정리 완료: deleted={}", deleted);
        return deleted;
    }
}

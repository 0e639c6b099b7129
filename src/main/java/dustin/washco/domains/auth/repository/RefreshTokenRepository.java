package dustin.washco.domains.auth.repository;

import dustin.washco.domains.auth.model.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Refresh Token Repository
 * Refresh Token Repository
 *
 * 벌크 UPDATE/DELETE 후에는 영속성 컨텍스트를 비워서
 * 같은 트랜잭션에서 이전 상태의 엔티티가 조회되지 않도록 함
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {
    
    /**
     * 토큰 해시로 Refresh Token 조회
     * Find refresh token by token hash
     */
    Optional<RefreshToken> findByTokenHash(String tokenHash);
    
    /**
     * 토큰 해시로 Refresh Token 무효화 (이미 무효화된 토큰이면 변경 없음)
     * Revoke a refresh token by hash
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.updatedAt = :now WHERE rt.tokenHash = :tokenHash AND rt.revoked = false")
    int revokeByTokenHash(@Param("tokenHash") String tokenHash, @Param("now") LocalDateTime now);
    
    /**
     * 사용자의 모든 Refresh Token 무효화
     * Revoke all refresh tokens for a user
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.updatedAt = :now WHERE rt.userId = :userId AND rt.revoked = false")
    int revokeAllByUserId(@Param("userId") Long userId, @Param("now") LocalDateTime now);
    
    /**
     * 만료되었거나 무효화된 토큰 삭제
     * Delete expired or revoked tokens
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RefreshToken rt WHERE rt.expiresAt <= :now OR rt.revoked = true")
    int deleteExpiredOrRevoked(@Param("now") LocalDateTime now);
    
    /**
     * 사용자의 유효한 Refresh Token 개수 조회
     * Count valid refresh tokens for a user
     */
    @Query("SELECT COUNT(rt) FROM RefreshToken rt WHERE rt.userId = :userId AND rt.revoked = false AND rt.expiresAt > :now")
    long countValidByUserId(@Param("userId") Long userId, @Param("now") LocalDateTime now);
}

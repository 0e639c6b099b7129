package dustin.washco.domains.auth.scheduler;

import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.washco.domains.auth.service.RefreshTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 정리 스케줄러
 * Refresh Token Cleanup Scheduler
 * 
 * 역할:
 * - 만료되었거나 무효화된 Refresh Token 행 삭제
 * - 이미 종료 상태인 행만 삭제하므로 요청 처리와 동시에 실행되어도 무방
 * 
 * 실행 시점:
 * - auth.refresh-token.cleanup-cron (기본값: 매일 03:00:00)
 * 
 * 재시도 전략:
 * - 최대 3회, 지수 백오프 (2초 -> 4초)
 * - 모두 실패하면 로그만 남기고 다음 주기에 재시도
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefreshTokenCleanupScheduler {
    
    private final RefreshTokenService refreshTokenService;
    
    @Scheduled(cron = "${auth.refresh-token.cleanup-cron:0 0 3 * * ?}")
    @Retryable(
            retryFor = {RuntimeException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 2000, multiplier = 2)
    )
    public void purgeRefreshTokens() {
        log.info("[RefreshTokenCleanupScheduler] Refresh Token 정리 시작");
        int deleted = refreshTokenService.purgeExpiredOrRevoked();
        log.info("[RefreshTokenCleanupScheduler] Refresh Token 정리 완료: deleted={}", deleted);
    }
    
    /**
     * 재시도 모두 실패 시 호출
     * Called after all retries are exhausted
     */
    @Recover
    public void recover(RuntimeException e) {
        log.error("[RefreshTokenCleanupScheduler] Refresh Token 정리 최종 실패, 다음 주기에 재시도", e);
    }
}

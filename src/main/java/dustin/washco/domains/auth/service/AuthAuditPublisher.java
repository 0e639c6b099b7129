package dustin.washco.domains.auth.service;

import java.time.Instant;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.washco.domains.auth.config.AuthProperties;
import dustin.washco.domains.auth.model.event.AuthAuditAction;
import dustin.washco.domains.auth.model.event.AuthAuditEvent;
import dustin.washco.shared.kafka.KafkaEventProducer;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증 감사 이벤트 발행
 * Publishes authentication audit events
 *
 * fire-and-forget: 발행 실패가 인증 처리를 중단시키지 않음
 * 트랜잭션 안에서 호출되면 커밋 이후에만 발행 (롤백 시 버림)
 */
@Slf4j
@Component
public class AuthAuditPublisher {

    private final KafkaEventProducer kafkaEventProducer;
    private final ObjectMapper objectMapper;
    private final Executor auditExecutor;
    private final AuthProperties.Audit config;

    public AuthAuditPublisher(
            KafkaEventProducer kafkaEventProducer,
            ObjectMapper objectMapper,
            @Qualifier("auditExecutor") Executor auditExecutor,
            AuthProperties authProperties
    ) {
        this.kafkaEventProducer = kafkaEventProducer;
        this.objectMapper = objectMapper;
        this.auditExecutor = auditExecutor;
        this.config = authProperties.getAudit();
    }

    public void publish(AuthAuditAction action, Long userId, Long tenantId, String email) {
        AuthAuditEvent event = AuthAuditEvent.builder()
                .action(action)
                .userId(userId)
                .tenantId(tenantId)
                .email(email)
                .occurredAt(Instant.now())
                .build();

        if (!config.isEnabled()) {
            log.debug("[AuthAuditPublisher] 감사 이벤트 (발행 비활성화): {}", event);
            return;
        }

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(event);
                }
            });
            return;
        }
        dispatch(event);
    }

    private void dispatch(AuthAuditEvent event) {
        try {
            auditExecutor.execute(() -> send(event));
        } catch (RuntimeException e) {
            log.warn("[AuthAuditPublisher] 감사 이벤트 예약 실패: action={}, userId={}", event.getAction(), event.getUserId(), e);
        }
    }

    private void send(AuthAuditEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            String key = event.getUserId() == null ? null : String.valueOf(event.getUserId());
            kafkaEventProducer.publish(config.getTopic(), key, payload);
        } catch (JsonProcessingException e) {
            log.error("[AuthAuditPublisher] 감사 이벤트 직렬화 실패: action={}", event.getAction(), e);
        } catch (RuntimeException e) {
            log.error("[AuthAuditPublisher] 감사 이벤트 발행 실패: action={}", event.getAction(), e);
        }
    }
}

package dustin.washco.domains.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.washco.domains.auth.config.AuthProperties;
import dustin.washco.domains.auth.model.event.AuthAuditAction;
import dustin.washco.shared.kafka.KafkaEventProducer;

/**
 * 감사 이벤트 발행 테스트
 * AuthAuditPublisher test
 *
 * 발행 실패가 호출자에게 전파되지 않는지, 트랜잭션 커밋 이후에만 발행되는지 확인 (동기 Executor 사용)
 */
class AuthAuditPublisherTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Executor directExecutor = Runnable::run;

    private KafkaEventProducer kafkaEventProducer;
    private AuthProperties authProperties;

    @BeforeEach
    void setUp() {
        kafkaEventProducer = mock(KafkaEventProducer.class);
        authProperties = new AuthProperties();
        authProperties.getAudit().setTopic("auth-audit-events");
    }

    @Test
    @DisplayName("사용자 ID를 키로 JSON 이벤트를 발행한다")
    void publishesJsonEvent() throws Exception {
        AuthAuditPublisher publisher = new AuthAuditPublisher(kafkaEventProducer, objectMapper, directExecutor, authProperties);

        publisher.publish(AuthAuditAction.LOGIN, 42L, 7L, "user@washco.com");

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaEventProducer).publish(eq("auth-audit-events"), eq("42"), payload.capture());

        JsonNode event = objectMapper.readTree(payload.getValue());
        assertThat(event.get("action").asText()).isEqualTo("LOGIN");
        assertThat(event.get("userId").asLong()).isEqualTo(42L);
        assertThat(event.get("tenantId").asLong()).isEqualTo(7L);
        assertThat(event.get("email").asText()).isEqualTo("user@washco.com");
        assertThat(event.hasNonNull("occurredAt")).isTrue();
    }

    @Test
    @DisplayName("발행 중 예외가 나도 호출자에게 전파되지 않는다")
    void producerFailureIsSwallowed() {
        doThrow(new IllegalStateException("broker down"))
                .when(kafkaEventProducer).publish(anyString(), any(), anyString());
        AuthAuditPublisher publisher = new AuthAuditPublisher(kafkaEventProducer, objectMapper, directExecutor, authProperties);

        assertThatCode(() -> publisher.publish(AuthAuditAction.REGISTER, 1L, null, "a@washco.com"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Executor가 작업을 거부해도 호출자에게 전파되지 않는다")
    void rejectedExecutionIsSwallowed() {
        Executor rejecting = command -> {
            throw new RejectedExecutionException("queue full");
        };
        AuthAuditPublisher publisher = new AuthAuditPublisher(kafkaEventProducer, objectMapper, rejecting, authProperties);

        assertThatCode(() -> publisher.publish(AuthAuditAction.LOGOUT, 1L, null, null))
                .doesNotThrowAnyException();
        verify(kafkaEventProducer, never()).publish(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("트랜잭션 안에서 호출되면 커밋 후에만 발행한다")
    void publishesAfterCommit() {
        AuthAuditPublisher publisher = new AuthAuditPublisher(kafkaEventProducer, objectMapper, directExecutor, authProperties);
        TransactionSynchronizationManager.initSynchronization();
        try {
            publisher.publish(AuthAuditAction.REGISTER, 5L, null, "new@washco.com");

            verify(kafkaEventProducer, never()).publish(anyString(), any(), anyString());

            List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
            synchronizations.forEach(TransactionSynchronization::afterCommit);

            verify(kafkaEventProducer).publish(eq("auth-audit-events"), eq("5"), anyString());
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("트랜잭션이 롤백되면 발행하지 않는다")
    void rollbackDiscardsEvent() {
        AuthAuditPublisher publisher = new AuthAuditPublisher(kafkaEventProducer, objectMapper, directExecutor, authProperties);
        TransactionSynchronizationManager.initSynchronization();
        try {
            publisher.publish(AuthAuditAction.LOGIN, 5L, null, "new@washco.com");

            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

            verify(kafkaEventProducer, never()).publish(anyString(), any(), anyString());
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("발행이 비활성화되면 Kafka로 보내지 않는다")
    void disabled() {
        authProperties.getAudit().setEnabled(false);
        AuthAuditPublisher publisher = new AuthAuditPublisher(kafkaEventProducer, objectMapper, directExecutor, authProperties);

        publisher.publish(AuthAuditAction.LOGOUT_ALL, 1L, null, null);

        verify(kafkaEventProducer, never()).publish(anyString(), any(), anyString());
    }
}

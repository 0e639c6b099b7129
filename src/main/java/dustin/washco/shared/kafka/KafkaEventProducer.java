package dustin.washco.shared.kafka;

import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 이벤트 발행자
 * Kafka Event Producer
 * 
 * 주의사항:
 * - 발행 결과는 기다리지 않음 (논블로킹)
 * - 실패해도 호출자에게 예외를 전파하지 않음 (로깅만)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaEventProducer {
    
    private final KafkaTemplate<String, String> kafkaTemplate;
    
    /**
     * 이벤트 발행
     * Publish an event
     * 
     * @param topic 토픽
     * @param key 파티션 키 (사용자 ID 등, null 허용)
     * @param payloadJson 이벤트 본문 (JSON 문자열)
     */
    public void publish(String topic, String key, String payloadJson) {
        try {
            kafkaTemplate.send(topic, key, payloadJson)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("[KafkaEventProducer] 이벤트 발행 실패: topic={}, error={}", topic, ex.getMessage());
                        }
                    });
        } catch (Exception e) {
            log.error("[KafkaEventProducer] 이벤트 발행 실패: topic={}, error={}", topic, e.getMessage());
        }
    }
}

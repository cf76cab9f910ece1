package info.mouts.foodorders.push;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import info.mouts.foodorders.dto.PushMessageDTO;
import info.mouts.foodorders.exception.PushDeliveryException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link PushDeliveryClient} publishing messages to the push gateway's Kafka
 * topic. Messages are keyed by device token so that every message for one
 * device lands on the same partition.
 */
@Component
@Slf4j
public class KafkaPushDeliveryClient implements PushDeliveryClient {
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final Duration sendTimeout;

    /**
     * Constructs an instance of {@code KafkaPushDeliveryClient}.
     *
     * @param kafkaTemplate The template messages are sent with.
     * @param topic         The push gateway topic.
     * @param sendTimeout   How long to wait for the broker acknowledgement.
     */
    public KafkaPushDeliveryClient(KafkaTemplate<String, Object> kafkaTemplate,
            @Value("${app.push.topic}") String topic,
            @Value("${app.push.send-timeout:5s}") Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void send(PushMessageDTO message) {
        try {
            SendResult<String, Object> result = kafkaTemplate.send(topic, message.getToken(), message)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

            log.debug("Push message '{}' published to {} at offset {}", message.getTitle(), topic,
                    result.getRecordMetadata() != null ? result.getRecordMetadata().offset() : -1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PushDeliveryException("Interrupted while publishing push message", e);
        } catch (ExecutionException e) {
            throw new PushDeliveryException("Push gateway rejected the message: " + e.getCause().getMessage(),
                    e.getCause());
        } catch (TimeoutException e) {
            throw new PushDeliveryException("Push gateway did not acknowledge within " + sendTimeout, e);
        }
    }
}

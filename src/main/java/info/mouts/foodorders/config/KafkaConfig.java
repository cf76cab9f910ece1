package info.mouts.foodorders.config;

import java.time.Duration;
import java.util.Map;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.DefaultKafkaProducerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaConfig {
    @Value("${app.push.topic}")
    private String pushTopic;

    @Value("${app.push.partitions:3}")
    private int pushTopicPartitions;

    @Value("${app.push.send-timeout:5s}")
    private Duration sendTimeout;

    /**
     * Declares the topic the push gateway consumes from.
     *
     * @return The topic definition, created on startup if missing.
     */
    @Bean
    public NewTopic pushTopic() {
        log.info("Declaring push topic {} with {} partition(s)", pushTopic, pushTopicPartitions);

        return TopicBuilder.name(pushTopic)
                .partitions(pushTopicPartitions)
                .replicas(1)
                .build();
    }

    /**
     * Bounds how long a send may block on broker metadata, so a missing broker
     * fails a push within the same timeout the client waits for the
     * acknowledgement.
     *
     * @return The customizer applied to the auto-configured producer factory.
     */
    @Bean
    public DefaultKafkaProducerFactoryCustomizer pushProducerCustomizer() {
        return producerFactory -> producerFactory.updateConfigs(
                Map.of(ProducerConfig.MAX_BLOCK_MS_CONFIG, sendTimeout.toMillis()));
    }
}

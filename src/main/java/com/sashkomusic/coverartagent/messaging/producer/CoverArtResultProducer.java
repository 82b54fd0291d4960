package com.sashkomusic.coverartagent.messaging.producer;

import com.sashkomusic.coverartagent.config.KafkaTopicConfig;
import com.sashkomusic.coverartagent.messaging.producer.dto.CoverArtResolvedDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class CoverArtResultProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void send(CoverArtResolvedDto message) {
        log.info("Sending cover art result to Kafka: requestId={}, found={}",
                message.requestId(), message.found());

        kafkaTemplate.send(KafkaTopicConfig.COVER_ART_RESOLVED_TOPIC, message.requestId(), message);
    }
}

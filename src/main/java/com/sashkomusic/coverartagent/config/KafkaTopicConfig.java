package com.sashkomusic.coverartagent.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

    public static final String NOW_PLAYING_TOPIC = "now-playing-events";
    public static final String COVER_ART_RESOLVED_TOPIC = "cover-art-resolved";

    @Bean
    public NewTopic nowPlayingTopic() {
        return TopicBuilder.name(NOW_PLAYING_TOPIC).partitions(1).replicas(1).build();
    }

    @Bean
    public NewTopic coverArtResolvedTopic() {
        return TopicBuilder.name(COVER_ART_RESOLVED_TOPIC).partitions(1).replicas(1).build();
    }
}

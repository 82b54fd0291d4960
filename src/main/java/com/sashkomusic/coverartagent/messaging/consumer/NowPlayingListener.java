package com.sashkomusic.coverartagent.messaging.consumer;

import com.sashkomusic.coverartagent.config.KafkaTopicConfig;
import com.sashkomusic.coverartagent.domain.exception.MalformedLookupResponseException;
import com.sashkomusic.coverartagent.domain.model.TrackMetadata;
import com.sashkomusic.coverartagent.domain.service.AlbumArtResolver;
import com.sashkomusic.coverartagent.domain.service.TrackMetadataReader;
import com.sashkomusic.coverartagent.messaging.consumer.dto.NowPlayingEventDto;
import com.sashkomusic.coverartagent.messaging.producer.CoverArtResultProducer;
import com.sashkomusic.coverartagent.messaging.producer.dto.CoverArtResolvedDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class NowPlayingListener {

    private final AlbumArtResolver albumArtResolver;
    private final TrackMetadataReader trackMetadataReader;
    private final CoverArtResultProducer resultProducer;

    @KafkaListener(topics = KafkaTopicConfig.NOW_PLAYING_TOPIC, groupId = "cover-art-agent-group")
    public void handleNowPlaying(NowPlayingEventDto event) {
        log.info("Received now playing event: requestId={}, path={}", event.requestId(), event.path());

        TrackMetadata metadata = toMetadata(event);

        try {
            Optional<String> coverUrl = albumArtResolver.resolveArtUrl(metadata);

            resultProducer.send(new CoverArtResolvedDto(
                    event.requestId(),
                    metadata.relativePath(),
                    metadata.artist(),
                    metadata.album(),
                    coverUrl.orElse(null),
                    coverUrl.isPresent(),
                    null
            ));

        } catch (MalformedLookupResponseException ex) {
            log.error("MusicBrainz response format changed: {}", ex.getMessage(), ex);
            sendFailure(event, metadata, "unexpected MusicBrainz response: " + ex.getMessage());

        } catch (Exception ex) {
            log.error("Error resolving cover art: {}", ex.getMessage(), ex);
            sendFailure(event, metadata, "fatal error: " + ex.getMessage());
        }
    }

    private TrackMetadata toMetadata(NowPlayingEventDto event) {
        TrackMetadata fromEvent = event.toTrackMetadata();
        if (fromEvent.hasArtistAndAlbum() || !StringUtils.hasText(event.path())) {
            return fromEvent;
        }

        log.debug("Event for {} carries no artist/album, reading tags from file", event.path());
        return trackMetadataReader.read(event.path());
    }

    private void sendFailure(NowPlayingEventDto event, TrackMetadata metadata, String error) {
        resultProducer.send(new CoverArtResolvedDto(
                event.requestId(),
                metadata.relativePath(),
                metadata.artist(),
                metadata.album(),
                null,
                false,
                error
        ));
    }
}

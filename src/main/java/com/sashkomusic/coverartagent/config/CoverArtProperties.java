package com.sashkomusic.coverartagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "cover-art")
public class CoverArtProperties {

    private String musicRoot;
    private String pendingQueueDir;
    private String userAgent = "sm-cover-art-agent/1.0";
    private MusicBrainz musicbrainz = new MusicBrainz();
    private Archive archive = new Archive();
    private Ffmpeg ffmpeg = new Ffmpeg();
    private PendingExecutor pendingExecutor = new PendingExecutor();

    @Data
    public static class MusicBrainz {
        private String baseUrl = "https://musicbrainz.org/ws/2";
    }

    @Data
    public static class Archive {
        private String baseUrl = "https://coverartarchive.org";
    }

    @Data
    public static class Ffmpeg {
        private String binary = "ffmpeg";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class PendingExecutor {
        private int poolSize = 1;
    }
}

package com.sashkomusic.coverartagent.infrastructure.client.coverartarchive;

import com.sashkomusic.coverartagent.config.CoverArtProperties;
import com.sashkomusic.coverartagent.domain.model.ResolvedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
@Component
public class CoverArtArchiveClient {

    private static final String FRONT_THUMBNAIL = "front-250";

    private final RestClient restClient;
    private final String baseUrl;

    public CoverArtArchiveClient(RestClient.Builder restClientBuilder, CoverArtProperties properties) {
        this.restClient = restClientBuilder.build();
        this.baseUrl = stripTrailingSlash(properties.getArchive().getBaseUrl());
    }

    public String frontCoverUrl(ResolvedRecord record) {
        return baseUrl + "/" + record.kind().pathSegment() + "/" + record.id() + "/" + FRONT_THUMBNAIL;
    }

    /**
     * HEAD probe for the 250px front thumbnail. A failed request counts as "no cover".
     */
    public boolean frontCoverExists(ResolvedRecord record) {
        String url = frontCoverUrl(record);
        try {
            Boolean exists = restClient.head()
                    .uri(url)
                    .exchange((request, response) -> response.getStatusCode().is2xxSuccessful());

            log.debug("Cover Art Archive probe {} -> {}", url, exists);
            return Boolean.TRUE.equals(exists);
        } catch (RestClientException e) {
            log.warn("Cover Art Archive probe failed for {}: {}", url, e.getMessage());
            return false;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

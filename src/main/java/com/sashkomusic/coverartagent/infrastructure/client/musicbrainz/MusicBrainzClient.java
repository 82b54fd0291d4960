package com.sashkomusic.coverartagent.infrastructure.client.musicbrainz;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.coverartagent.config.CoverArtProperties;
import com.sashkomusic.coverartagent.domain.exception.MalformedLookupResponseException;
import com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.dto.MusicBrainzRelease;
import com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.dto.MusicBrainzReleaseGroup;
import com.sashkomusic.coverartagent.infrastructure.client.musicbrainz.dto.ReleaseGroupSearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Read-only access to the MusicBrainz web service. Transport failures and non-200
 * answers are reported as "nothing found"; nothing is retried.
 */
@Slf4j
@Component
public class MusicBrainzClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public MusicBrainzClient(RestClient.Builder restClientBuilder, ObjectMapper objectMapper, CoverArtProperties properties) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getMusicbrainz().getBaseUrl();
    }

    /**
     * Looks up a release together with its release group.
     * Malformed payloads are treated the same as a missing release.
     */
    public Optional<MusicBrainzRelease> lookupRelease(String releaseId) {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/release/{id}")
                .queryParam("inc", "release-groups")
                .encode()
                .buildAndExpand(releaseId)
                .toUri();

        Optional<String> body = fetch(uri);
        if (body.isEmpty()) {
            return Optional.empty();
        }

        try {
            MusicBrainzRelease release = objectMapper.readValue(body.get(), MusicBrainzRelease.class);
            if (release == null || !release.isComplete()) {
                log.warn("Incomplete MusicBrainz release payload for {}", releaseId);
                return Optional.empty();
            }
            return Optional.of(release);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable MusicBrainz release payload for {}: {}", releaseId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Searches release groups by artist and album and returns the id of the single best hit.
     *
     * @throws MalformedLookupResponseException if MusicBrainz answered 200 with an unexpected body
     */
    public Optional<String> searchReleaseGroupId(String artist, String album) {
        String query = "artist:" + artist + " AND release:" + album;
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/release-group/")
                .queryParam("query", "{query}")
                .queryParam("limit", 1)
                .encode()
                .buildAndExpand(query)
                .toUri();

        Optional<String> body = fetch(uri);
        if (body.isEmpty()) {
            return Optional.empty();
        }

        ReleaseGroupSearchResult result;
        try {
            result = objectMapper.readValue(body.get(), ReleaseGroupSearchResult.class);
        } catch (JsonProcessingException e) {
            throw new MalformedLookupResponseException(
                    "Received release-group search response from MusicBrainz in unexpected format", e);
        }

        if (result == null || result.releaseGroups() == null) {
            throw new MalformedLookupResponseException(
                    "Release-group search response from MusicBrainz has no release-groups list");
        }

        if (result.releaseGroups().isEmpty()) {
            return Optional.empty();
        }

        MusicBrainzReleaseGroup best = result.releaseGroups().get(0);
        if (best == null || !best.isComplete()) {
            throw new MalformedLookupResponseException(
                    "Release-group search hit from MusicBrainz has no id");
        }
        return Optional.of(best.id());
    }

    private Optional<String> fetch(URI uri) {
        log.debug("MusicBrainz request: {}", uri);
        try {
            String body = restClient.get()
                    .uri(uri)
                    .exchange((request, response) -> {
                        if (response.getStatusCode().value() != HttpStatus.OK.value()) {
                            log.debug("MusicBrainz answered {} for {}", response.getStatusCode(), uri);
                            return null;
                        }
                        return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                    });
            return Optional.ofNullable(body);
        } catch (RestClientException e) {
            log.warn("MusicBrainz request failed for {}: {}", uri, e.getMessage());
            return Optional.empty();
        }
    }
}

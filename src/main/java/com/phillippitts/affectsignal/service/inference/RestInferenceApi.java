package com.phillippitts.affectsignal.service.inference;

import com.phillippitts.affectsignal.config.properties.InferenceProperties;
import com.phillippitts.affectsignal.domain.ImageArtifact;
import com.phillippitts.affectsignal.exception.AffectSignalException;
import com.phillippitts.affectsignal.exception.InferenceExceptionBuilder;
import com.phillippitts.affectsignal.util.LogSanitizer;
import com.phillippitts.affectsignal.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * {@link InferenceApi} over Spring's {@link RestClient}.
 *
 * <p>The API key travels as a default header configured by {@link #create}; it is never logged.
 */
public final class RestInferenceApi implements InferenceApi {

    private static final Logger LOG = LogManager.getLogger(RestInferenceApi.class);

    /** Requests the face model only, with default settings. */
    static final String FACE_MODEL_DESCRIPTOR = "{\"models\":{\"face\":{}}}";

    private final RestClient restClient;
    private final boolean keyConfigured;

    RestInferenceApi(RestClient restClient, boolean keyConfigured) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.keyConfigured = keyConfigured;
    }

    /**
     * Applies base URL and API key header to the builder and builds the client. Timeouts and the
     * request factory are left to the caller so tests can bind a mock server to the same builder.
     */
    public static RestInferenceApi create(RestClient.Builder builder, InferenceProperties props) {
        Objects.requireNonNull(builder, "builder");
        Objects.requireNonNull(props, "props");
        builder.baseUrl(props.getBaseUrl());
        if (props.hasApiKey()) {
            builder.defaultHeader(props.getApiKeyHeader(), props.getApiKey());
        } else {
            LOG.warn("No inference API key configured; every capture will use a synthetic vector");
        }
        return new RestInferenceApi(builder.build(), props.hasApiKey());
    }

    @Override
    public String createJob(ImageArtifact image) {
        Objects.requireNonNull(image, "image");
        if (!keyConfigured) {
            throw InferenceExceptionBuilder.create("Job submission skipped: no API key configured").build();
        }
        long start = System.nanoTime();
        String body;
        try {
            body = restClient.post()
                    .uri("/jobs")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(multipartBody(image))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw InferenceExceptionBuilder.create("Job submission rejected")
                    .statusCode(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("body", LogSanitizer.preview(e.getResponseBodyAsString()))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw InferenceExceptionBuilder.create("Job submission failed")
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("reason", e.getMessage())
                    .cause(e)
                    .build();
        }
        String jobId = InferenceJsonParser.parseJobId(body);
        if (jobId == null) {
            throw InferenceExceptionBuilder.create("Job submission returned no job id")
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("body", LogSanitizer.preview(body))
                    .build();
        }
        LOG.debug("Created inference job {} for {} in {} ms", jobId, image, TimeUtils.elapsedMillis(start));
        return jobId;
    }

    @Override
    public String fetchStatus(String jobId) {
        return get("/jobs/{id}", jobId, "Status check");
    }

    @Override
    public String fetchPredictions(String jobId) {
        return get("/jobs/{id}/predictions", jobId, "Predictions fetch");
    }

    private String get(String path, String jobId, String action) {
        try {
            return restClient.get()
                    .uri(path, jobId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new AffectSignalException(action + " for job " + jobId + " returned status "
                    + e.getStatusCode().value() + ": " + LogSanitizer.preview(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            throw new AffectSignalException(action + " for job " + jobId + " failed: " + e.getMessage(), e);
        }
    }

    private static MultiValueMap<String, Object> multipartBody(ImageArtifact image) {
        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(mediaTypeOf(image.mimeType()));
        ByteArrayResource resource = new ByteArrayResource(image.payload()) {
            @Override
            public String getFilename() {
                return image.fileName();
            }
        };
        HttpHeaders jsonHeaders = new HttpHeaders();
        jsonHeaders.setContentType(MediaType.APPLICATION_JSON);

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("file", new HttpEntity<>(resource, fileHeaders));
        parts.add("json", new HttpEntity<>(FACE_MODEL_DESCRIPTOR, jsonHeaders));
        return parts;
    }

    private static MediaType mediaTypeOf(String mimeType) {
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (InvalidMediaTypeException e) {
            LOG.debug("Unparseable image MIME type '{}', sending as image/jpeg", mimeType);
            return MediaType.IMAGE_JPEG;
        }
    }
}

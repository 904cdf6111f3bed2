package com.example.securechat.generation;

import com.example.securechat.config.ChatProperties;
import com.example.securechat.error.GenerationUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

/**
 * Calls the generation backend over HTTP with the timeouts configured on the
 * {@code generationRestTemplate}. Every failure mode is reported as
 * {@link GenerationUnavailableException}.
 */
@Slf4j
@Component
public class HttpGenerationClient implements GenerationClient {

    private final RestTemplate restTemplate;
    private final String url;

    public HttpGenerationClient(@Qualifier("generationRestTemplate") RestTemplate restTemplate,
                                ChatProperties properties) {
        this.restTemplate = restTemplate;
        ChatProperties.Generation generation = properties.getGeneration();
        this.url = stripTrailingSlash(generation.getBaseUrl()) + generation.getPath();
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        long started = System.nanoTime();
        ResponseEntity<GenerationResponse> response;
        try {
            response = restTemplate.postForEntity(url, request, GenerationResponse.class);
        } catch (HttpStatusCodeException e) {
            throw new GenerationUnavailableException(
                    "Generation backend returned " + e.getStatusCode().value(), e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            throw new GenerationUnavailableException("Generation backend unreachable or timed out", e);
        } catch (RestClientException e) {
            throw new GenerationUnavailableException("Generation call failed", e);
        }

        GenerationResponse body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null
                || body.answer() == null || body.answer().isBlank()) {
            throw new GenerationUnavailableException(
                    "Generation backend returned no answer", response.getStatusCode().value());
        }

        List<String> sources = body.sources() == null ? List.of() : body.sources().stream()
                .filter(Objects::nonNull)
                .map(GenerationResponse.SourceDocument::source)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        log.info("Generation answered in {}ms ({} sources)", (System.nanoTime() - started) / 1_000_000, sources.size());
        return new GenerationResult(body.answer(), sources);
    }

    private static String stripTrailingSlash(String baseUrl) {
        if (baseUrl == null) {
            return "";
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}

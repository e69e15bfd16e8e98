package com.newsintel.curator.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsintel.curator.config.CurationProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pattern normalizer backed by an OpenAI-compatible chat completions endpoint.
 *
 * Only created when {@code curation.normalizer.enabled=true}. Transport errors
 * (timeouts, 429, 5xx) are retried by Resilience4j; a response that arrives but
 * cannot be parsed raises {@link MalformedNormalizationException}, which is not retried
 * here because the coordinator retries it with a smaller, stricter request.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "curation.normalizer", name = "enabled", havingValue = "true")
public class LlmPatternNormalizer implements PatternNormalizer {

    static final String SYSTEM_PROMPT = """
            You group URL regex patterns that describe the same page structure.
            Patterns in one group must differ only in a variable component such as a slug,
            a numeric id or a date. Propose one anchored regex per group that matches every
            URL matched by the originals. Never merge a section listing with article pages.
            Answer with JSON only: {"groups":[{"normalized_pattern":"...","original_patterns":["..."],"reason":"..."}]}
            Every input pattern must appear in exactly one group.""";

    static final String STRICT_SUFFIX = """

            Your previous answer was not valid JSON. Return only the JSON object, without
            markdown fences or commentary, and keep backslashes escaped.""";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CurationProperties properties;

    @Override
    @Retry(name = "patternNormalizer")
    public List<NormalizedGroup> normalize(NormalizationRequest request) {
        CurationProperties.Normalizer config = properties.getNormalizer();
        log.debug("Requesting normalization of {} patterns (temperature {}, strict {})",
                request.patterns().size(), request.temperature(), request.strict());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.setBearerAuth(config.getApiKey());
        }

        String content = extractContent(restTemplate.postForObject(
                config.getBaseUrl() + "/chat/completions",
                new HttpEntity<>(requestBody(request, config), headers),
                String.class));
        return parseGroups(content);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Map<String, Object> requestBody(NormalizationRequest request, CurationProperties.Normalizer config) {
        StringBuilder user = new StringBuilder("Normalize these ")
                .append(request.patterns().size()).append(" patterns:\n");
        request.patterns().forEach(p -> user.append(p).append('\n'));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("temperature", request.temperature());
        body.put("max_tokens", config.getMaxTokens());
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", request.strict() ? SYSTEM_PROMPT + STRICT_SUFFIX : SYSTEM_PROMPT),
                Map.of("role", "user", "content", user.toString())));
        return body;
    }

    String extractContent(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new MalformedNormalizationException("Empty response from normalizer");
        }
        try {
            JsonNode content = objectMapper.readTree(responseBody).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new MalformedNormalizationException("Response has no message content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new MalformedNormalizationException("Response is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    List<NormalizedGroup> parseGroups(String content) {
        String json = stripFences(content);
        try {
            JsonNode groups = objectMapper.readTree(json).get("groups");
            if (groups == null || !groups.isArray()) {
                throw new MalformedNormalizationException("Missing 'groups' array");
            }
            List<NormalizedGroup> parsed = new ArrayList<>();
            for (JsonNode node : groups) {
                parsed.add(objectMapper.treeToValue(node, NormalizedGroup.class));
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new MalformedNormalizationException("Unparseable groups: " + e.getOriginalMessage(), e);
        }
    }

    private static String stripFences(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}

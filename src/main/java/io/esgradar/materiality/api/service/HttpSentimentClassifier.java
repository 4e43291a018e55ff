package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.dto.analysis.SentimentResult;
import io.esgradar.materiality.config.SentimentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * Client for the external sentiment model. The service accepts {@code {"text": ...}} and answers
 * {@code {"label": ..., "confidence": ...}} with any label {@link SentimentLabel#fromRaw} knows.
 */
@Service
public class HttpSentimentClassifier implements SentimentClassifier {

    private static final Logger logger = LoggerFactory.getLogger(HttpSentimentClassifier.class);

    private static final int MAX_TEXT_LENGTH = 512;

    private final SentimentConfig config;
    private final RestTemplate restTemplate;

    public HttpSentimentClassifier(SentimentConfig config) {
        this.config = config;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(orDefault(config.connectTimeout(), Duration.ofSeconds(5)));
        requestFactory.setReadTimeout(orDefault(config.readTimeout(), Duration.ofSeconds(10)));
        this.restTemplate = new RestTemplate(requestFactory);
    }

    @Override
    public SentimentResult classify(String text) {
        if (!config.enabled() || config.url() == null || config.url().isBlank()) {
            return SentimentResult.unknown();
        }
        if (text == null || text.isBlank()) {
            return SentimentResult.unknown();
        }

        String input = text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;

        try {
            SentimentResponse response = restTemplate.postForObject(
                    config.url(), Map.of("text", input), SentimentResponse.class);

            if (response == null) {
                logger.warn("Sentiment service returned an empty body");
                return SentimentResult.unknown();
            }
            return new SentimentResult(SentimentLabel.fromRaw(response.label()), response.confidence());

        } catch (RestClientException e) {
            logger.warn("Sentiment classification failed, treating as neutral: {}", e.getMessage());
            return SentimentResult.unknown();
        }
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        return value != null ? value : fallback;
    }

    record SentimentResponse(String label, double confidence) {}
}

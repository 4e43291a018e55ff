package io.esgradar.materiality.api.service;

import io.esgradar.materiality.config.KeywordDictionary;
import io.esgradar.materiality.config.MaterialityConfig;
import io.esgradar.materiality.config.StandardMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Looks names up in the static {@code materiality.standards} table: an exact match first, then
 * the code whose listed name shares the most words, above the configured similarity.
 */
@Service
public class ConfiguredStandardMapper implements StandardMapper {

    private static final Logger logger = LoggerFactory.getLogger(ConfiguredStandardMapper.class);

    private final StandardMapping mapping;

    public ConfiguredStandardMapper(MaterialityConfig config) {
        this.mapping = config.standards();
    }

    @Override
    public Optional<String> mapTopicToCode(String topicName) {
        if (topicName == null || topicName.isBlank()) return Optional.empty();

        String wanted = topicName.trim().toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> entry : mapping.codes().entrySet()) {
            for (String name : entry.getValue()) {
                if (name.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                    return Optional.of(entry.getKey());
                }
            }
        }

        String bestCode = null;
        double bestSimilarity = mapping.similarityThreshold();
        for (Map.Entry<String, List<String>> entry : mapping.codes().entrySet()) {
            for (String name : entry.getValue()) {
                double similarity = KeywordDictionary.nameSimilarity(wanted, name.trim().toLowerCase(Locale.ROOT));
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestCode = entry.getKey();
                }
            }
        }

        if (bestCode == null) {
            logger.info("No standard code found for '{}'", topicName);
        } else {
            logger.debug("Mapped '{}' to {} by name similarity {}", topicName, bestCode, bestSimilarity);
        }
        return Optional.ofNullable(bestCode);
    }
}

package io.esgradar.materiality.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only keyword tables loaded once from configuration.
 *
 * @param topics         topic name to the keywords that signal it in news text
 * @param companyAliases company name to alternative spellings used in news text
 */
public record KeywordDictionary(
        Map<String, List<String>> topics,
        Map<String, List<String>> companyAliases
) {
    private static final int SIMILAR_TOPIC_KEYWORDS = 8;
    private static final double SIMILAR_TOPIC_THRESHOLD = 0.5;

    public KeywordDictionary {
        topics = topics == null ? Map.of() : Map.copyOf(topics);
        companyAliases = companyAliases == null ? Map.of() : Map.copyOf(companyAliases);
    }

    public static KeywordDictionary empty() {
        return new KeywordDictionary(Map.of(), Map.of());
    }

    /**
     * Builds the lowercase keyword set for a topic: its own dictionary entry, the
     * leading entries of any topic whose name shares most words with it, and the
     * words of the topic name itself.
     */
    public Set<String> keywordsFor(String topicName) {
        if (topicName == null || topicName.isBlank()) return Set.of();

        Set<String> keywords = new LinkedHashSet<>();
        addAll(keywords, topics.getOrDefault(topicName, List.of()));

        topics.forEach((dictionaryTopic, dictionaryKeywords) -> {
            if (!dictionaryTopic.equals(topicName)
                    && nameSimilarity(topicName, dictionaryTopic) > SIMILAR_TOPIC_THRESHOLD) {
                addAll(keywords, dictionaryKeywords.stream().limit(SIMILAR_TOPIC_KEYWORDS).toList());
            }
        });

        addAll(keywords, Arrays.stream(topicName.split("\\s+"))
                .map(word -> word.replaceAll("[^\\p{L}\\p{N}]", ""))
                .toList());

        return Collections.unmodifiableSet(keywords);
    }

    /**
     * Company name plus configured aliases, lowercase.
     */
    public Set<String> aliasesFor(String companyName) {
        if (companyName == null || companyName.isBlank()) return Set.of();

        Set<String> aliases = new LinkedHashSet<>();
        aliases.add(companyName.trim().toLowerCase(Locale.ROOT));
        addAll(aliases, companyAliases.getOrDefault(companyName, List.of()));
        return Collections.unmodifiableSet(aliases);
    }

    public Set<String> findKeywords(String topicName, String text) {
        if (text == null) return Set.of();

        String lowerText = text.toLowerCase(Locale.ROOT);

        return keywordsFor(topicName).stream()
                .filter(lowerText::contains)
                .collect(Collectors.toSet());
    }

    public static double nameSimilarity(String first, String second) {
        Set<String> words1 = new HashSet<>(Arrays.asList(first.trim().split("\\s+")));
        Set<String> words2 = new HashSet<>(Arrays.asList(second.trim().split("\\s+")));

        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        if (union.isEmpty()) return 0.0;

        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);

        return (double) intersection.size() / union.size();
    }

    private static void addAll(Set<String> target, List<String> keywords) {
        for (String keyword : keywords) {
            if (keyword == null) continue;

            String cleaned = keyword.trim().toLowerCase(Locale.ROOT);
            if (cleaned.length() > 1) {
                target.add(cleaned);
            }
        }
    }
}

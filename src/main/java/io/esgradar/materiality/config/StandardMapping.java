package io.esgradar.materiality.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Static topic-to-standard table: standard issue code to the topic names filed under it.
 * Codes are kept sorted so lookups resolve ties the same way on every run.
 */
public record StandardMapping(
        Map<String, List<String>> codes,
        @DefaultValue("0.7") double similarityThreshold
) {
    public StandardMapping {
        codes = codes == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(codes));
    }

    public static StandardMapping empty() {
        return new StandardMapping(Map.of(), 0.7);
    }
}

package io.esgradar.materiality.api.service;

import java.util.Optional;

/**
 * Resolves a topic or issue name to an external reporting-standard issue code.
 */
public interface StandardMapper {

    Optional<String> mapTopicToCode(String topicName);
}

package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.SentimentResult;

public interface SentimentClassifier {

    /**
     * Never throws; an unavailable classifier yields {@link SentimentResult#unknown()}.
     */
    SentimentResult classify(String text);
}

package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.DateRange;

import java.util.Collection;
import java.util.List;

/**
 * Retrieves articles mentioning any of the given keywords within a date range.
 */
public interface NewsSource {

    List<Article> fetch(Collection<String> keywords, DateRange dateRange, int limit);
}

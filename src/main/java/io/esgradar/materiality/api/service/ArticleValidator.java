package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.MalformedArticle;
import io.esgradar.materiality.api.exception.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ArticleValidator {

    private static final Logger logger = LoggerFactory.getLogger(ArticleValidator.class);

    public Validation validate(List<Article> articles) {
        List<Article> accepted = new ArrayList<>();
        List<MalformedArticle> rejected = new ArrayList<>();

        for (Article article : articles) {
            if (article == null) continue;

            if (article.title().isBlank()) {
                rejected.add(new MalformedArticle(article.id(), article.title(),
                        ErrorCategory.MISSING_TITLE, "Article has no title"));
            } else if (article.body().isBlank()) {
                rejected.add(new MalformedArticle(article.id(), article.title(),
                        ErrorCategory.MISSING_BODY, "Article has neither content nor description"));
            } else {
                accepted.add(article);
            }
        }

        if (!rejected.isEmpty()) {
            logger.warn("Skipped {} malformed articles out of {}", rejected.size(), articles.size());
        }

        return new Validation(accepted, rejected);
    }

    public record Validation(
            List<Article> accepted,
            List<MalformedArticle> rejected
    ) {}
}

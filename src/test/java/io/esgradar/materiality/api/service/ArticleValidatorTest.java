package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.MalformedArticle;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.exception.ErrorCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.esgradar.materiality.TestArticles.NOW;
import static io.esgradar.materiality.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ArticleValidatorTest {

    private final ArticleValidator validator = new ArticleValidator();

    @Test
    void shouldSeparateMalformedArticles() {
        Article valid = article("ok", "Headline", "Body text");
        Article untitled = article("no-title", "  ", "Body text");
        Article empty = article("no-body", "Headline", "");
        Article descriptionOnly = new Article("desc", "Headline", "Summary only", null, null, null,
                NOW, SentimentLabel.NEUTRAL, 1.0, Set.of(), 1);

        ArticleValidator.Validation validation = validator.validate(List.of(valid, untitled, empty, descriptionOnly));

        assertThat(validation.accepted()).extracting(Article::id).containsExactly("ok", "desc");
        assertThat(validation.rejected()).extracting(MalformedArticle::articleId, MalformedArticle::reason)
                .containsExactly(
                        tuple("no-title", ErrorCategory.MISSING_TITLE),
                        tuple("no-body", ErrorCategory.MISSING_BODY));
    }
}

package io.esgradar.materiality.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordDictionaryTest {

    private final KeywordDictionary dictionary = new KeywordDictionary(
            Map.of(
                    "기후변화 대응", List.of("기후변화", "온실가스", "탄소중립"),
                    "기후변화 적응", List.of("폭염", "홍수"),
                    "인재 육성", List.of("교육", "HRD")
            ),
            Map.of("LS ELECTRIC", List.of("LS일렉트릭", "엘에스일렉트릭"))
    );

    @Test
    void shouldCombineOwnEntriesAndNameWords() {
        assertThat(dictionary.keywordsFor("인재 육성")).containsExactly("교육", "hrd", "인재", "육성");
    }

    @Test
    void shouldBorrowKeywordsFromSimilarTopics() {
        // the two climate topics share one of three words, below the borrowing bar
        assertThat(dictionary.keywordsFor("기후변화 대응")).doesNotContain("폭염");
        assertThat(dictionary.keywordsFor("기후변화 대응 전략"))
                .contains("기후변화", "온실가스", "탄소중립", "대응", "전략");
    }

    @Test
    void shouldFallBackToNameWordsForUnknownTopics() {
        assertThat(dictionary.keywordsFor("Water, management")).containsExactly("water", "management");
        assertThat(dictionary.keywordsFor(" ")).isEmpty();
    }

    @Test
    void shouldIncludeCompanyNameWithAliases() {
        assertThat(dictionary.aliasesFor("LS ELECTRIC")).containsExactly("ls electric", "ls일렉트릭", "엘에스일렉트릭");
        assertThat(dictionary.aliasesFor("Acme")).containsExactly("acme");
    }

    @Test
    void shouldFindKeywordsInText() {
        assertThat(dictionary.findKeywords("기후변화 대응", "정부가 탄소중립 로드맵을 발표했다"))
                .containsExactly("탄소중립");
    }

    @Test
    void shouldMeasureNameSimilarityByWords() {
        assertThat(KeywordDictionary.nameSimilarity("a b c d", "a b c d e")).isEqualTo(0.8);
        assertThat(KeywordDictionary.nameSimilarity("a", "b")).isZero();
    }
}

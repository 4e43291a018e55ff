package io.esgradar.materiality.api.service;

import io.esgradar.materiality.config.MaterialityConfig;
import io.esgradar.materiality.config.StandardMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfiguredStandardMapperTest {

    private ConfiguredStandardMapper mapper;

    @BeforeEach
    void setUp() {
        StandardMapping mapping = new StandardMapping(Map.of(
                "E-GHG", List.of("기후변화 대응", "climate change response strategy"),
                "S-SAFETY", List.of("사업장 안전보건")
        ), 0.7);

        mapper = new ConfiguredStandardMapper(new MaterialityConfig(null, null, null, null, null, null, mapping));
    }

    @Test
    void shouldMapExactNameIgnoringCase() {
        assertThat(mapper.mapTopicToCode("기후변화 대응")).contains("E-GHG");
        assertThat(mapper.mapTopicToCode("Climate Change Response Strategy")).contains("E-GHG");
        assertThat(mapper.mapTopicToCode(" 사업장 안전보건 ")).contains("S-SAFETY");
    }

    @Test
    void shouldFallBackToNameSimilarity() {
        // 4 of 5 words shared
        assertThat(mapper.mapTopicToCode("climate change response plan strategy")).contains("E-GHG");
    }

    @Test
    void shouldReturnEmptyWhenUnmapped() {
        assertThat(mapper.mapTopicToCode("hydrogen")).isEmpty();
        assertThat(mapper.mapTopicToCode("climate response")).isEmpty();
        assertThat(mapper.mapTopicToCode(" ")).isEmpty();
        assertThat(mapper.mapTopicToCode(null)).isEmpty();
    }
}

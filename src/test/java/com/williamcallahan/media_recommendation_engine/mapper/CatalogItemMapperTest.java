package com.williamcallahan.media_recommendation_engine.mapper;

import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.dto.CatalogItem;
import com.williamcallahan.media_recommendation_engine.model.DiscoveryCandidate;
import com.williamcallahan.media_recommendation_engine.model.EnrichedCandidate;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.model.ScoredCandidate;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.williamcallahan.media_recommendation_engine.testutil.RecommendationFixtures.enriched;
import static org.assertj.core.api.Assertions.assertThat;

class CatalogItemMapperTest {

    @Test
    void toItem_buildsAbsoluteImageUrlsAndFormatsRating() {
        CatalogItemMapper mapper = new CatalogItemMapper(new RecommendationProperties());

        CatalogItem item = mapper.toItem(new ScoredCandidate(enriched("604", "tt0234215", 7.2, 4000), 3.0, 7.0, 12.4));

        assertThat(item.id()).isEqualTo("tt0234215");
        assertThat(item.type()).isEqualTo("movie");
        assertThat(item.name()).isEqualTo("Title 604");
        assertThat(item.poster()).isEqualTo("https://image.tmdb.org/t/p/w500/604.jpg");
        assertThat(item.background()).isNull();
        assertThat(item.description()).isEqualTo("Overview of Title 604");
        assertThat(item.releaseInfo()).isEqualTo("2019");
        assertThat(item.imdbRating()).isEqualTo("7.0");
    }

    @Test
    void toItem_seriesWithSparseData() {
        RecommendationProperties properties = new RecommendationProperties();
        properties.getUpstream().setImageBaseUrl("https://images.test/t/p/");
        CatalogItemMapper mapper = new CatalogItemMapper(properties);
        DiscoveryCandidate series = new DiscoveryCandidate("1399", MediaType.SERIES, "Game of Thrones", 8.4, 21000,
            Set.of(), null, "backdrop.jpg", "  ", "unknown");

        CatalogItem item = mapper.toItem(new ScoredCandidate(new EnrichedCandidate(series, 10.0, "tt0944947"),
            1.0, 10.0, 20.0));

        assertThat(item.type()).isEqualTo("series");
        assertThat(item.poster()).isNull();
        assertThat(item.background()).isEqualTo("https://images.test/t/p/original/backdrop.jpg");
        assertThat(item.description()).isNull();
        assertThat(item.releaseInfo()).isNull();
        assertThat(item.imdbRating()).isEqualTo("10.0");
    }

    @Test
    void releaseYear_requiresFourLeadingDigits() {
        assertThat(CatalogItemMapper.releaseYear("1999-03-31")).isEqualTo("1999");
        assertThat(CatalogItemMapper.releaseYear("99")).isNull();
        assertThat(CatalogItemMapper.releaseYear(null)).isNull();
    }
}

package com.williamcallahan.media_recommendation_engine.util;

import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyUtilsTest {

    @Test
    void fingerprint_isStableAndDoesNotExposeCredential() {
        String fingerprint = CacheKeyUtils.fingerprint("secret-auth-key");

        assertThat(fingerprint).hasSize(32).doesNotContain("secret");
        assertThat(CacheKeyUtils.fingerprint(" secret-auth-key ")).isEqualTo(fingerprint);
        assertThat(CacheKeyUtils.fingerprint("other-auth-key")).isNotEqualTo(fingerprint);
    }

    @Test
    void fingerprint_blankCredential_isRejected() {
        assertThatThrownBy(() -> CacheKeyUtils.fingerprint("  "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void key_isDeterministicAndSensitiveToEveryPart() {
        String key = CacheKeyUtils.key("mre", ArtifactClass.CATALOG_ROW, "user", MediaType.MOVIE, 5, 6.0, true);

        assertThat(key).startsWith("mre:catalog:")
            .isEqualTo(CacheKeyUtils.key("mre", ArtifactClass.CATALOG_ROW, "user", MediaType.MOVIE, 5, 6.0, true));
        assertThat(CacheKeyUtils.key("mre", ArtifactClass.CATALOG_ROW, "user", MediaType.MOVIE, 5, 6.5, true))
            .isNotEqualTo(key);
        assertThat(CacheKeyUtils.key("mre", ArtifactClass.CATALOG_ROW, "other", MediaType.MOVIE, 5, 6.0, true))
            .isNotEqualTo(key);
        assertThat(CacheKeyUtils.key("mre", ArtifactClass.SEED_DISCOVERY, "user", MediaType.MOVIE, 5, 6.0, true))
            .isNotEqualTo(key);
    }

    @Test
    void key_sharedArtifactsIgnoreTheUser() {
        String shared = CacheKeyUtils.key("mre", ArtifactClass.RATING_LOOKUP, CacheKeyUtils.SHARED_FINGERPRINT,
            MediaType.MOVIE, "604");

        assertThat(shared).isEqualTo(CacheKeyUtils.key("mre", ArtifactClass.RATING_LOOKUP,
            CacheKeyUtils.SHARED_FINGERPRINT, MediaType.MOVIE, "604"));
        assertThat(CacheKeyUtils.lockKey(shared)).isEqualTo("lock:" + shared);
    }

    @Test
    void logSafe_truncatesFingerprint() {
        assertThat(CacheKeyUtils.logSafe("0123456789abcdef")).isEqualTo("01234567");
        assertThat(CacheKeyUtils.logSafe(null)).isEqualTo("unknown");
    }
}

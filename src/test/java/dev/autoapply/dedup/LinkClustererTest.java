package dev.autoapply.dedup;

import dev.autoapply.dedup.LinkClusterer.Result;
import dev.autoapply.dedup.LinkClusterer.SlugSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinkClustererTest {

    private static final String BASE = "https://apply.workable.com/blueground/view/";

    private final LinkClusterer clusterer = new LinkClusterer(new SlugTokenizer("/view/", 3), 0.8);

    @Test
    @DisplayName("Should keep the lowest id and demote its near-duplicate")
    void shouldDemoteNearDuplicate() {
        Result result = clusterer.cluster(List.of(
                new SlugSource(11, BASE + "B22/fullstack-software-engineer-remote-athens-at-blueground"),
                new SlugSource(10, BASE + "A11/remote-fullstack-software-engineer-in-athens-at-blueground")));

        assertThat(result.clusters()).containsExactly(List.of(10L, 11L));
        assertThat(result.duplicateIds()).containsExactly(11L);
    }

    @Test
    @DisplayName("Should leave dissimilar postings alone")
    void shouldIgnoreDissimilar() {
        Result result = clusterer.cluster(List.of(
                new SlugSource(1, BASE + "A/senior-java-engineer-berlin"),
                new SlugSource(2, BASE + "B/product-designer-lisbon"),
                new SlugSource(3, BASE + "C/senior-data-engineer-berlin")));

        assertThat(result.clusters()).isEmpty();
        assertThat(result.duplicateIds()).isEmpty();
    }

    @Test
    @DisplayName("Should merge clusters transitively")
    void shouldMergeTransitively() {
        // 1~2 and 2~3 score 5/6, 1~3 only 4/6
        Result result = clusterer.cluster(List.of(
                new SlugSource(1, BASE + "A/alpha-bravo-charlie-delta-echo"),
                new SlugSource(2, BASE + "B/alpha-bravo-charlie-delta-echo-foxtrot"),
                new SlugSource(3, BASE + "C/bravo-charlie-delta-echo-foxtrot")));

        assertThat(result.clusters()).containsExactly(List.of(1L, 2L, 3L));
        assertThat(result.duplicateIds()).containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("Should never cluster links without a slug")
    void shouldSkipLinksWithoutSlug() {
        Result result = clusterer.cluster(List.of(
                new SlugSource(1, "https://boards.greenhouse.io/acme/jobs/1"),
                new SlugSource(2, "https://boards.greenhouse.io/acme/jobs/2")));

        assertThat(result.duplicateIds()).isEmpty();
        assertThat(result.comparisons()).isZero();
    }

    @Test
    @DisplayName("Should compare each candidate pair at most once")
    void shouldCompareEachPairOnce() {
        Result result = clusterer.cluster(List.of(
                new SlugSource(1, BASE + "A/java-backend-engineer"),
                new SlugSource(2, BASE + "B/golang-backend-developer")));

        // only "backend" is shared
        assertThat(result.comparisons()).isEqualTo(1);
    }
}

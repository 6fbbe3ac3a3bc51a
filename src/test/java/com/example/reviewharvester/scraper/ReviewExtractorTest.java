package com.example.reviewharvester.scraper;

import com.example.reviewharvester.browser.BrowserSession;
import com.example.reviewharvester.model.ReviewRecord;
import com.example.reviewharvester.util.Sleeper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewExtractorTest {

    private static SiteProfile profile;

    @Mock
    private BrowserSession session;

    @Mock
    private Sleeper sleeper;

    @BeforeAll
    static void loadProfile() throws IOException {
        profile = SiteProfile.load();
    }

    private ReviewExtractor extractor() {
        return new ReviewExtractor(profile, new Retrier(3, Duration.ZERO, Sleeper.NONE), sleeper,
                Duration.ofMillis(400));
    }

    @Test
    void expandsThenReadsTheLoadedNodes() throws Exception {
        // Given
        when(session.evaluate(eq(profile.expandScript()), any())).thenReturn(2L);
        when(session.evaluate(eq(profile.extractScript()), any())).thenReturn(List.of(
                SimulatedPlacePage.review("kim", "2주 전", "맛있어요"),
                SimulatedPlacePage.review("lee", "3일 전", "친절합니다")));

        // When
        List<ReviewRecord> records = extractor().extractBatch(session);

        // Then
        assertThat(records).extracting(ReviewRecord::getAuthor).containsExactly("kim", "lee");
        verify(sleeper).sleep(Duration.ofMillis(400));
    }

    @Test
    void doesNotWaitWhenNothingWasExpanded() throws Exception {
        when(session.evaluate(eq(profile.expandScript()), any())).thenReturn(0L);
        when(session.evaluate(eq(profile.extractScript()), any())).thenReturn(List.of());

        assertThat(extractor().extractBatch(session)).isEmpty();
        verify(sleeper, never()).sleep(any());
    }

    @Test
    void nonListResultIsRetriedThenFails() throws Exception {
        when(session.evaluate(eq(profile.expandScript()), any())).thenReturn(0L);
        when(session.evaluate(eq(profile.extractScript()), any())).thenReturn("undefined");

        assertThatThrownBy(() -> extractor().extractBatch(session))
                .isInstanceOf(ScriptExecutionException.class);
        verify(session, times(3)).evaluate(eq(profile.extractScript()), any());
    }

    @Test
    void mapsANodeToARecord() {
        Map<String, Object> node = SimulatedPlacePage.review("kim", "2주 전", "  맛있어요  ");
        node.put("ratingLabel", "별표 4개");

        ReviewRecord record = ReviewExtractor.toRecord(node);

        assertThat(record).isNotNull();
        assertThat(record.getAuthor()).isEqualTo("kim");
        assertThat(record.getReviewId()).isEqualTo("r-kim");
        assertThat(record.getRating()).isEqualTo(4);
        assertThat(record.getDateText()).isEqualTo("2주 전");
        assertThat(record.getBody()).isEqualTo("맛있어요");
        assertThat(record.getLanguage()).isEqualTo("ko");
        assertThat(record.getFingerprint())
                .isEqualTo(Fingerprints.of("https://maps.example/contrib/kim", "2주 전", "맛있어요"));
    }

    @Test
    void fallsBackToTheAuthorNameWithoutAProfileLink() {
        Map<String, Object> node = SimulatedPlacePage.review("kim", "2주 전", "맛있어요");
        node.remove("authorId");

        assertThat(ReviewExtractor.toRecord(node).getFingerprint())
                .isEqualTo(Fingerprints.of("kim", "2주 전", "맛있어요"));
    }

    @Test
    void skipsTruncatedAndEmptyNodes() {
        Map<String, Object> truncated = SimulatedPlacePage.review("kim", "2주 전", "맛있어요 그런데…");
        truncated.put("truncated", true);
        Map<String, Object> empty = SimulatedPlacePage.review("lee", "3일 전", "   ");
        Map<String, Object> ok = SimulatedPlacePage.review("park", "1일 전", "좋아요");

        List<ReviewRecord> records = ReviewExtractor.toRecords(List.of(truncated, empty, ok, "garbage"));

        assertThat(records).extracting(ReviewRecord::getAuthor).containsExactly("park");
    }

    @Test
    void parsesRatingLabels() {
        assertThat(ReviewExtractor.parseRating("별표 5개")).isEqualTo(5);
        assertThat(ReviewExtractor.parseRating("별표 3.0개")).isEqualTo(3);
        assertThat(ReviewExtractor.parseRating("4 stars")).isEqualTo(4);
        assertThat(ReviewExtractor.parseRating("1 star")).isEqualTo(1);
        assertThat(ReviewExtractor.parseRating("Rated 2.0 out of 5")).isEqualTo(2);
        assertThat(ReviewExtractor.parseRating("별표 0개")).isNull();
        assertThat(ReviewExtractor.parseRating("9 stars")).isNull();
        assertThat(ReviewExtractor.parseRating("great")).isNull();
        assertThat(ReviewExtractor.parseRating(null)).isNull();
    }
}

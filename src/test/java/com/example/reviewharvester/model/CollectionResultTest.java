package com.example.reviewharvester.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionResultTest {

    private static TargetResult complete(String id, String name) {
        return TargetResult.finished(TargetRecord.of(id, name), TargetStatus.COMPLETE, true,
                ScrollTermination.STAGNATION, List.of());
    }

    @Test
    void secondResultForAKeyIsFlaggedAndTheFirstKept() {
        CollectionResult result = new CollectionResult();

        assertThat(result.put(complete("p1", "first"))).isTrue();
        assertThat(result.put(complete("p1", "second"))).isFalse();

        assertThat(result.size()).isEqualTo(1);
        assertThat(result.get("p1").orElseThrow().getName()).isEqualTo("first");
        assertThat(result.getCollisions()).containsExactly("p1");
    }

    @Test
    void mergeCarriesPartialCollisionsAlong() {
        CollectionResult partial = new CollectionResult();
        partial.put(complete("p1", "a"));
        partial.flagCollision("p9");
        CollectionResult merged = new CollectionResult();
        merged.put(complete("p2", "b"));

        merged.merge(partial);

        assertThat(merged.keys()).containsExactly("p2", "p1");
        assertThat(merged.getCollisions()).containsExactly("p9");
    }

    @Test
    void finishedResultsCannotBeFailed() {
        assertThatThrownBy(() -> TargetResult.finished(TargetRecord.of("p1", "x"), TargetStatus.FAILED, false,
                null, List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failedResultKeepsPartialReviews() {
        ReviewRecord r = new ReviewRecord("fp", null, "kim", 4, "1일 전", "good", "en");

        TargetResult failed = TargetResult.failed(TargetRecord.of("p1", "x"), FailureKind.EXECUTION,
                "SCROLLING: stale", true, List.of(r));

        assertThat(failed.getStatus()).isEqualTo(TargetStatus.FAILED);
        assertThat(failed.getReviewCount()).isEqualTo(1);
        assertThat(failed.getTermination()).isNull();
        assertThat(failed.getStatus().isSettled()).isFalse();
    }

    @Test
    void runOutcomesMapToExitCodes() {
        assertThat(RunOutcome.CLEAN.exitCode()).isZero();
        assertThat(RunOutcome.PARTIAL_FAILURES.exitCode()).isEqualTo(1);
        assertThat(RunOutcome.ABORTED.exitCode()).isEqualTo(2);
    }
}

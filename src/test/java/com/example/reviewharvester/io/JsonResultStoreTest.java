package com.example.reviewharvester.io;

import com.example.reviewharvester.model.CollectionLog;
import com.example.reviewharvester.model.FailedTarget;
import com.example.reviewharvester.model.FailureKind;
import com.example.reviewharvester.model.ReviewRecord;
import com.example.reviewharvester.model.RunOutcome;
import com.example.reviewharvester.model.ScrollTermination;
import com.example.reviewharvester.model.TargetRecord;
import com.example.reviewharvester.model.TargetResult;
import com.example.reviewharvester.model.TargetStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResultStoreTest {

    @TempDir
    Path outputDir;

    private final TargetRecord target =
            new TargetRecord("ChIJ123", "Gangnam Noodles", "Seoul", 4.3, 120, "02-000-0000", "gangnam_1");

    private static ReviewRecord review(String author, String body) {
        return new ReviewRecord(author + "-fp", "r-" + author, author, 5, "1주 전", body, "ko");
    }

    @Test
    void writesUnderTheGridAndReadsItBack() throws IOException {
        // Given
        JsonResultStore store = new JsonResultStore(outputDir);
        TargetResult result = TargetResult.finished(target, TargetStatus.COMPLETE, true,
                ScrollTermination.STAGNATION, List.of(review("kim", "맛있어요"), review("lee", "좋아요")));

        // When
        Path file = store.write(result);
        TargetResult loaded = store.read(target).orElseThrow();

        // Then
        assertThat(file).isEqualTo(outputDir.resolve("gangnam_1").resolve("ChIJ123.json"));
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).contains("\"targetId\": \"ChIJ123\"", "맛있어요");
        assertThat(loaded.getStatus()).isEqualTo(TargetStatus.COMPLETE);
        assertThat(loaded.isSortApplied()).isTrue();
        assertThat(loaded.getTermination()).isEqualTo(ScrollTermination.STAGNATION);
        assertThat(loaded.getKnownReviewCount()).isEqualTo(120);
        assertThat(loaded.getReviewCount()).isEqualTo(2);
        assertThat(loaded.getReviews()).extracting(ReviewRecord::getBody).containsExactly("맛있어요", "좋아요");
        assertThat(loaded.getCollectedAt()).isEqualTo(result.getCollectedAt());
    }

    @Test
    void failedResultsKeepTheirFailureKind() throws IOException {
        JsonResultStore store = new JsonResultStore(outputDir);
        store.write(TargetResult.failed(target, FailureKind.BLOCKED, "INIT: blocked", false, List.of()));

        TargetResult loaded = store.read(target).orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(TargetStatus.FAILED);
        assertThat(loaded.getFailureKind()).isEqualTo(FailureKind.BLOCKED);
        assertThat(loaded.getErrorDetail()).isEqualTo("INIT: blocked");
        assertThat(loaded.getReviews()).isEmpty();
    }

    @Test
    void missingOrCorruptFilesReadAsAbsent() throws IOException {
        JsonResultStore store = new JsonResultStore(outputDir);
        assertThat(store.read(target)).isEmpty();

        Path file = store.pathFor(target);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        assertThat(store.exists(target)).isTrue();
        assertThat(store.read(target)).isEmpty();
    }

    @Test
    void leavesNoTemporaryFilesBehind() throws IOException {
        JsonResultStore store = new JsonResultStore(outputDir);
        store.write(TargetResult.finished(TargetRecord.of("p1", "x"), TargetStatus.COMPLETE, true,
                ScrollTermination.TARGET_REACHED, List.of()));

        try (Stream<Path> files = Files.walk(outputDir)) {
            assertThat(files.filter(Files::isRegularFile).map(p -> p.getFileName().toString()))
                    .containsExactly("p1.json");
        }
    }

    @Test
    void writesTheRunLog() throws IOException {
        JsonResultStore store = new JsonResultStore(outputDir);
        CollectionLog runLog = new CollectionLog("2026-01-01T00:00:00Z", "2026-01-01T00:01:00Z", 60_000,
                3, 2, 1, 0, 0, 40, RunOutcome.PARTIAL_FAILURES,
                List.of(new FailedTarget("p3", FailureKind.NAVIGATION, "HTTP 503")), List.of());

        Path file = store.writeRunLog(runLog);

        assertThat(file.getFileName().toString()).isEqualTo(JsonResultStore.RUN_LOG_FILE);
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .contains("\"outcome\": \"PARTIAL_FAILURES\"", "\"targetId\": \"p3\"");
    }

    @Test
    void sanitizesIdsIntoFileNames() {
        assertThat(JsonResultStore.safeName("a/b:c d")).isEqualTo("a_b_c_d");
        assertThat(JsonResultStore.safeName("  ")).isEqualTo("_");
    }
}

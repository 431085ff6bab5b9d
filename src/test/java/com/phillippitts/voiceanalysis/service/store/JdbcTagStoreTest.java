package com.phillippitts.voiceanalysis.service.store;

import com.phillippitts.voiceanalysis.domain.AnalysisRecord;
import com.phillippitts.voiceanalysis.domain.Tag;
import com.phillippitts.voiceanalysis.exception.ValidationException;
import com.phillippitts.voiceanalysis.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcTagStoreTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbc;
    private JdbcAnalysisStore analyses;
    private JdbcTagStore tags;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        jdbc = TestDatabase.jdbcTemplate(database);
        analyses = new JdbcAnalysisStore(jdbc);
        tags = new JdbcTagStore(jdbc);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void replaceTagsShouldNormalizeAndReturnSortedOnRead() {
        long id = newAnalysis();

        tags.replaceTags(id, List.of(" work ", "voice", "work"));

        assertThat(tags.findByAnalysisId(id)).containsExactly("voice", "work");
    }

    @Test
    void replaceTagsShouldReplaceNotAppend() {
        long id = newAnalysis();
        tags.replaceTags(id, List.of("a", "b"));

        tags.replaceTags(id, List.of("c"));

        assertThat(tags.findByAnalysisId(id)).containsExactly("c");
        assertThat(tags.findAll()).extracting(Tag::name).containsExactly("a", "b", "c");
    }

    @Test
    void tagNamesShouldBeSharedAcrossAnalyses() {
        long first = newAnalysis();
        long second = newAnalysis();

        tags.replaceTags(first, List.of("shared"));
        tags.replaceTags(second, List.of("shared"));

        assertThat(tags.findAll()).hasSize(1);
        assertThat(tags.findByAnalysisId(second)).containsExactly("shared");
    }

    @Test
    void replaceTagsShouldRejectBlankAndOverlongNames() {
        long id = newAnalysis();

        assertThatThrownBy(() -> tags.replaceTags(id, List.of("ok", " ")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> tags.replaceTags(id, List.of("x".repeat(JdbcTagStore.MAX_NAME_LENGTH + 1))))
                .isInstanceOf(ValidationException.class);
        assertThat(tags.findByAnalysisId(id)).isEmpty();
    }

    @Test
    void nullNamesShouldClearTags() {
        long id = newAnalysis();
        tags.replaceTags(id, List.of("a"));

        assertThat(tags.replaceTags(id, null)).isEmpty();
        assertThat(tags.findByAnalysisId(id)).isEmpty();
    }

    @Test
    void deletingAnalysisShouldCascadeToLinks() {
        long id = newAnalysis();
        tags.replaceTags(id, List.of("a", "b"));

        analyses.delete(id);

        Integer links = jdbc.queryForObject("SELECT COUNT(*) FROM ANALYSIS_TAG", Integer.class);
        assertThat(links).isZero();
    }

    @Test
    void deleteForAnalysisShouldReturnRemovedLinkCount() {
        long id = newAnalysis();
        tags.replaceTags(id, List.of("a", "b"));

        assertThat(tags.deleteForAnalysis(id)).isEqualTo(2);
        assertThat(tags.deleteForAnalysis(id)).isZero();
    }

    @Test
    void concurrentWritersShouldShareNewlyCreatedTag() throws Exception {
        long first = newAnalysis();
        long second = newAnalysis();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                List<String> names = List.of("tag-" + round);
                CyclicBarrier barrier = new CyclicBarrier(2);
                Future<Set<String>> a = pool.submit(() -> {
                    barrier.await();
                    return tags.replaceTags(first, names);
                });
                Future<Set<String>> b = pool.submit(() -> {
                    barrier.await();
                    return tags.replaceTags(second, names);
                });

                assertThat(a.get(10, TimeUnit.SECONDS)).containsExactly("tag-" + round);
                assertThat(b.get(10, TimeUnit.SECONDS)).containsExactly("tag-" + round);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(tags.findAll()).hasSize(50);
        assertThat(tags.findByAnalysisId(first)).containsExactly("tag-49");
        assertThat(tags.findByAnalysisId(second)).containsExactly("tag-49");
    }

    private long newAnalysis() {
        return analyses.insert(AnalysisRecord.pending("t", null, "/p", Instant.parse("2024-01-01T00:00:00Z")));
    }
}

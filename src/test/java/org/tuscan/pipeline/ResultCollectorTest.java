package org.tuscan.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tuscan.sequence.Candidate;
import org.tuscan.sequence.Strand;

@Tag("unit")
class ResultCollectorTest {

    private final BlockingQueue<ResultMessage> results = new ArrayBlockingQueue<>(16);

    private static ScoredCandidate scored(double score) {
        return new ScoredCandidate(new Candidate(0, "A".repeat(25) + "GGA", Strand.FORWARD), "chr1", 6, 28, score);
    }

    @Test
    void forwardsEverythingUntilAllWorkersAreDone() throws Exception {
        List<ScoredCandidate> sink = new ArrayList<>();
        results.add(new ResultMessage.ScoredBatch(List.of(scored(0.1), scored(0.2))));
        results.add(new ResultMessage.WorkerDone(0));
        results.add(new ResultMessage.ScoredBatch(List.of(scored(0.3))));
        results.add(new ResultMessage.WorkerDone(1));

        ResultCollector collector = new ResultCollector(results, 2, sink::add, OptionalDouble.empty());
        collector.collect();

        assertThat(sink).extracting(ScoredCandidate::score).containsExactly(0.1, 0.2, 0.3);
        assertThat(collector.received()).isEqualTo(3);
        assertThat(collector.reported()).isEqualTo(3);
    }

    @Test
    void minScoreFiltersButStillCounts() throws Exception {
        List<ScoredCandidate> sink = new ArrayList<>();
        results.add(new ResultMessage.ScoredBatch(List.of(scored(0.2), scored(0.5), scored(0.8))));
        results.add(new ResultMessage.WorkerDone(0));

        ResultCollector collector = new ResultCollector(results, 1, sink::add, OptionalDouble.of(0.5));
        collector.collect();

        assertThat(sink).extracting(ScoredCandidate::score).containsExactly(0.5, 0.8);
        assertThat(collector.received()).isEqualTo(3);
        assertThat(collector.reported()).isEqualTo(2);
    }

    @Test
    void failureMessageIsRethrown() {
        IllegalStateException cause = new IllegalStateException("boom");
        results.add(new ResultMessage.Failure("scoring-worker-1", cause));

        ResultCollector collector = new ResultCollector(results, 2, result -> { }, OptionalDouble.empty());

        assertThatThrownBy(collector::collect)
            .isInstanceOf(PipelineException.class)
            .hasMessage("Scoring failed in scoring-worker-1: boom")
            .hasCause(cause);
    }
}

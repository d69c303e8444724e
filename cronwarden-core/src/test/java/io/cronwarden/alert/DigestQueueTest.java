package io.cronwarden.alert;

import io.cronwarden.core.Issue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DigestQueueTest {

    @Test
    void sevenWarningsAcrossThreeRunsAreFlushedOnce() {
        DigestQueue queue = new DigestQueue();
        queue.append(warnings("run1", 2));
        queue.append(warnings("run2", 3));
        queue.append(warnings("run3", 2));

        List<Issue> flushed = queue.flush();

        assertThat(flushed).hasSize(7);
        assertThat(flushed.get(0).entity()).isEqualTo("run1");
        assertThat(flushed.get(6).entity()).isEqualTo("run3");
        assertThat(queue.flush()).isEmpty();
        assertThat(queue.size()).isZero();
    }

    @Test
    void requeuedIssuesComeBeforeNewerOnes() {
        DigestQueue queue = new DigestQueue();
        queue.append(warnings("old", 2));
        List<Issue> failedDelivery = queue.flush();
        queue.append(warnings("new", 1));

        queue.requeue(failedDelivery);

        assertThat(queue.flush()).extracting(Issue::entity).containsExactly("old", "old", "new");
    }

    @Test
    void concurrentAppendsAreNeitherLostNorDuplicated() throws Exception {
        DigestQueue queue = new DigestQueue();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        List<Issue> collected = new ArrayList<>();

        for (int t = 0; t < 4; t++) {
            String entity = "producer-" + t;
            pool.submit(() -> {
                for (int i = 0; i < 250; i++) {
                    queue.append(List.of(Issue.warning("w", entity, "n" + i)));
                }
                done.countDown();
            });
        }
        while (done.getCount() > 0) {
            collected.addAll(queue.flush());
        }
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        collected.addAll(queue.flush());
        pool.shutdown();

        assertThat(collected).hasSize(1000);
    }

    @Test
    void emptyAppendIsIgnored() {
        DigestQueue queue = new DigestQueue();
        queue.append(List.of());
        queue.append(null);

        assertThat(queue.size()).isZero();
    }

    private static List<Issue> warnings(String entity, int n) {
        List<Issue> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Issue.warning("missing_field", entity, "issue " + i));
        }
        return out;
    }
}

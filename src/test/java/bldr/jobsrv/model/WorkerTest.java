package bldr.jobsrv.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkerTest {

    private static Worker.Builder worker() {
        return Worker.builder()
                .id("w1")
                .tags(Set.of("x86_64-linux", "docker"))
                .capacity(2)
                .lastHeartbeat(Instant.now());
    }

    @Test
    void supportsRequiresTagSuperset() {
        Worker w = worker().build();
        assertTrue(w.supports(Set.of("x86_64-linux")));
        assertTrue(w.supports(Set.of("x86_64-linux", "docker")));
        assertFalse(w.supports(Set.of("x86_64-linux", "gpu")));
        assertTrue(w.supports(Set.of()));
    }

    @Test
    void availabilityFollowsLoadSuspicionAndStatus() {
        assertTrue(worker().activeJobs(1).build().isAvailable());
        assertFalse(worker().activeJobs(2).build().isAvailable());
        assertFalse(worker().suspect(true).build().isAvailable());
        assertFalse(worker().status(WorkerStatus.DEAD).build().isAvailable());
        assertEquals(1, worker().activeJobs(1).build().spareCapacity());
    }
}

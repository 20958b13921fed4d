package leadflow.workflow.core;

import leadflow.workflow.model.SignalType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryResumeSignalBusTest {

    private InMemoryResumeSignalBus bus;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        bus = new InMemoryResumeSignalBus();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void deliverWithoutWaiterIsNotDelivered() {
        assertFalse(bus.deliver("job-1", SignalType.RESUME));
        assertFalse(bus.isWaiting("job-1"));
    }

    @Test
    @DisplayName("Waiter wakes with the delivered signal; a second delivery is dropped")
    void deliversOnce() throws Exception {
        Future<SignalType> waiting = executor.submit(() -> bus.await("job-1"));
        awaitWaiter("job-1");

        assertTrue(bus.deliver("job-1", SignalType.RESUME));
        assertFalse(bus.deliver("job-1", SignalType.CANCEL));

        assertEquals(SignalType.RESUME, waiting.get(5, TimeUnit.SECONDS));
        assertFalse(bus.isWaiting("job-1"));
    }

    @Test
    void secondWaiterForSameJobRejected() throws Exception {
        Future<SignalType> waiting = executor.submit(() -> bus.await("job-1"));
        awaitWaiter("job-1");

        assertThrows(IllegalStateException.class, () -> bus.await("job-1"));

        bus.deliver("job-1", SignalType.CANCEL);
        assertEquals(SignalType.CANCEL, waiting.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A cancel that landed before the wait started returns CANCEL immediately")
    void cancelBeforeWait() throws Exception {
        assertEquals(SignalType.CANCEL, bus.await("job-1", () -> true));
        assertFalse(bus.isWaiting("job-1"));
    }

    @Test
    @DisplayName("The waiter is registered before onWaiting runs, so a signal sent from it is kept")
    void signalDuringOnWaitingIsDelivered() throws Exception {
        SignalType signal = bus.await("job-1", () -> false, () -> {
            assertTrue(bus.isWaiting("job-1"));
            assertTrue(bus.deliver("job-1", SignalType.RESUME));
        });

        assertEquals(SignalType.RESUME, signal);
        assertFalse(bus.isWaiting("job-1"));
    }

    @Test
    void waitersAreIndependentPerJob() throws Exception {
        Future<SignalType> waiting = executor.submit(() -> bus.await("job-1"));
        awaitWaiter("job-1");

        assertFalse(bus.deliver("job-2", SignalType.RESUME));
        assertTrue(bus.isWaiting("job-1"));

        bus.deliver("job-1", SignalType.RESUME);
        waiting.get(5, TimeUnit.SECONDS);
    }

    private void awaitWaiter(String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!bus.isWaiting(jobId)) {
            if (System.currentTimeMillis() > deadline) {
                fail("no waiter registered for " + jobId);
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
    }
}

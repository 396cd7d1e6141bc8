package io.deltaflow.core.time;

import io.deltaflow.core.EngineClosedException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class EpochCounterTest {

    @Test
    void assign_returns_current_epoch_until_advanced() {
        var counter = new EpochCounter();
        assertEquals(0, counter.assign());
        assertEquals(0, counter.assign());

        assertEquals(0, counter.advance());
        assertEquals(1, counter.assign());
    }

    @Test
    void draining_rejects_ingestion_but_still_closes_last_epoch() {
        var counter = new EpochCounter(5, null);
        counter.drain();

        assertThrows(EngineClosedException.class, counter::assign);
        assertEquals(5, counter.advance());
        assertEquals(EpochCounter.State.DRAINING, counter.state());
    }

    @Test
    void failed_counter_rejects_everything() {
        var counter = new EpochCounter();
        counter.fail();

        assertThrows(EngineClosedException.class, counter::assign);
        assertThrows(EngineClosedException.class, counter::advance);
    }

    @Test
    void waiter_is_released_when_epoch_advances() throws Exception {
        var counter = new EpochCounter();
        var waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return counter.awaitEpochAfter(0);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        counter.advance();

        assertEquals(1L, waiter.get(2, TimeUnit.SECONDS));
    }

    @Test
    void flush_hands_next_epoch_to_persistence() {
        var persisted = new AtomicLong(-1);
        var counter = EpochCounter.restoredFrom(7, persisted::set);
        counter.advance();
        counter.flush();

        assertEquals(8, persisted.get());
    }
}

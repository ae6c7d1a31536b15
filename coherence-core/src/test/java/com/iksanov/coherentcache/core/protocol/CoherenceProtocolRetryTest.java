package com.iksanov.coherentcache.core.protocol;

import com.iksanov.coherentcache.common.exception.StoreCorruptionException;
import com.iksanov.coherentcache.common.exception.TransientStoreException;
import com.iksanov.coherentcache.common.model.LogicalTimestamp;
import com.iksanov.coherentcache.common.model.ReadResult;
import com.iksanov.coherentcache.common.model.WriteOutcome;
import com.iksanov.coherentcache.core.metrics.CoherenceMetrics;
import com.iksanov.coherentcache.core.store.AtomicStore;
import com.iksanov.coherentcache.core.store.RecordOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CoherenceProtocol - store failure handling")
class CoherenceProtocolRetryTest {

    @Mock
    private AtomicStore store;

    private CoherenceMetrics metrics;
    private CoherenceProtocol protocol;

    @BeforeEach
    void setUp() {
        metrics = new CoherenceMetrics();
        protocol = new CoherenceProtocol(store, metrics, 2, 1, 1000);
    }

    @Test
    @DisplayName("Transient failure is retried until the store answers")
    void shouldRetryTransientFailure() {
        when(store.executeAtomic(eq("k"), any(RecordOperation.class)))
                .thenThrow(new TransientStoreException("connection reset"))
                .thenReturn(WriteOutcome.ACCEPTED);

        WriteOutcome outcome = protocol.set("k", "v".getBytes(StandardCharsets.UTF_8), LogicalTimestamp.of(1, 0));

        assertEquals(WriteOutcome.ACCEPTED, outcome);
        verify(store, times(2)).executeAtomic(eq("k"), any(RecordOperation.class));
        assertEquals(1.0, metrics.getRegistry().counter("coherence.retries").count());
    }

    @Test
    @DisplayName("Transient failure propagates once retries are exhausted")
    void shouldPropagateAfterRetriesExhausted() {
        when(store.executeAtomic(eq("k"), any(RecordOperation.class)))
                .thenThrow(new TransientStoreException("timeout"));

        TransientStoreException ex = assertThrows(TransientStoreException.class,
                () -> protocol.invalidate("k", LogicalTimestamp.of(1, 0)));

        assertEquals("timeout", ex.getMessage());
        verify(store, times(3)).executeAtomic(eq("k"), any(RecordOperation.class));
        assertEquals(1.0, metrics.getRegistry()
                .counter("coherence.errors", "operation", "invalidate", "type", "TransientStoreException").count());
    }

    @Test
    @DisplayName("Corruption is surfaced immediately, never reported as a miss")
    void shouldNotRetryCorruption() {
        when(store.executeAtomic(eq("k"), any(RecordOperation.class)))
                .thenThrow(new StoreCorruptionException("bad ts_sec"));

        assertThrows(StoreCorruptionException.class, () -> protocol.get("k"));

        verify(store, times(1)).executeAtomic(eq("k"), any(RecordOperation.class));
        assertEquals(0.0, metrics.getRegistry().counter("coherence.get.misses").count());
    }

    @Test
    @DisplayName("Read result from the store is passed through")
    void shouldPassReadResultThrough() {
        when(store.executeAtomic(eq("k"), any(RecordOperation.class))).thenReturn(ReadResult.miss());

        assertTrue(protocol.get("k").isMiss());
    }
}

package com.iksanov.coherentcache.population;

import com.iksanov.coherentcache.common.codec.JsonValueCodec;
import com.iksanov.coherentcache.common.model.LogicalTimestamp;
import com.iksanov.coherentcache.core.metrics.CoherenceMetrics;
import com.iksanov.coherentcache.core.protocol.CoherenceProtocol;
import com.iksanov.coherentcache.core.store.InMemoryAtomicStore;
import com.iksanov.coherentcache.population.jdbc.QueryExecutor;
import com.iksanov.coherentcache.population.jdbc.SqlStatement;
import com.iksanov.coherentcache.population.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PopulationPipeline - read-through and invalidate-after-commit")
class PopulationPipelineTest {

    public record Book(long id, String title) {}

    private static final SqlStatement ALL_BOOKS = SqlStatement.of("SELECT id, title FROM books");
    private static final SqlStatement RENAME = SqlStatement.of("UPDATE books SET title = ? WHERE id = ?", "New", 1L);

    @Mock
    private QueryExecutor executor;

    private InMemoryAtomicStore store;
    private CoherenceProtocol protocol;
    private SimpleMeterRegistry registry;
    private SteppingClock clock;
    private PopulationPipeline<Book> pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryAtomicStore(Duration.ofSeconds(120));
        protocol = new CoherenceProtocol(store, new CoherenceMetrics(), 0, 0, 1000);
        registry = new SimpleMeterRegistry();
        clock = new SteppingClock(1_700_000_000_000L);
        pipeline = new PopulationPipeline<>(protocol, executor,
                rs -> new Book(rs.getLong("id"), rs.getString("title")),
                JsonValueCodec.forClass(Book.class),
                book -> "book:" + book.id(),
                clock,
                new PipelineMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("readThrough() queries on a miss and serves the next call from cache")
    void readThroughShouldPopulateOnMiss() {
        doReturn(List.of(new Book(1, "Dune"), new Book(2, "Emma"))).when(executor).query(any(), any());

        assertThat(pipeline.readThrough("book:2", ALL_BOOKS)).contains(new Book(2, "Emma"));
        assertThat(pipeline.readThrough("book:2", ALL_BOOKS)).contains(new Book(2, "Emma"));

        verify(executor, times(1)).query(any(), any());
        assertThat(protocol.get("book:2").isHit()).isTrue();
        assertThat(protocol.get("book:1").isMiss()).isTrue();
    }

    @Test
    @DisplayName("readThrough() returns empty when the source has no matching row")
    void readThroughShouldReturnEmptyWhenRowMissing() {
        doReturn(List.of(new Book(1, "Dune"))).when(executor).query(any(), any());

        assertThat(pipeline.readThrough("book:9", ALL_BOOKS)).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("lookup() reads through without filling the cache")
    void lookupShouldNotPopulate() {
        doReturn(List.of(new Book(1, "Dune"))).when(executor).query(any(), any());

        assertThat(pipeline.lookup("book:1", ALL_BOOKS)).contains(new Book(1, "Dune"));
        assertThat(protocol.get("book:1").isMiss()).isTrue();
    }

    @Test
    @DisplayName("loadAndPopulate() caches every returned row")
    void loadAndPopulateShouldCacheAllRows() {
        doReturn(List.of(new Book(1, "Dune"), new Book(2, "Emma"))).when(executor).query(any(), any());

        List<Book> rows = pipeline.loadAndPopulate(ALL_BOOKS);

        assertThat(rows).hasSize(2);
        assertThat(protocol.get("book:1").isHit()).isTrue();
        assertThat(protocol.get("book:2").isHit()).isTrue();
        assertThat(registry.counter("population.source.reads").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("readThroughAll() queries once for all misses and keeps key order")
    void readThroughAllShouldBatchMisses() {
        doReturn(List.of(new Book(1, "Dune"))).when(executor).query(any(), any());
        pipeline.readThrough("book:1", ALL_BOOKS);
        reset(executor);
        doReturn(List.of(new Book(2, "Emma"), new Book(3, "Ulysses"))).when(executor).query(any(), any());

        List<Book> result = pipeline.readThroughAll(List.of("book:3", "book:1", "book:404", "book:2"), ALL_BOOKS);

        assertThat(result).containsExactly(new Book(3, "Ulysses"), new Book(1, "Dune"), new Book(2, "Emma"));
        verify(executor, times(1)).query(any(), any());
        assertThat(protocol.get("book:3").isHit()).isTrue();
    }

    @Test
    @DisplayName("readThroughAll() skips the source when everything is cached")
    void readThroughAllShouldNotQueryOnFullHit() {
        doReturn(List.of(new Book(1, "Dune"), new Book(2, "Emma"))).when(executor).query(any(), any());
        pipeline.loadAndPopulate(ALL_BOOKS);
        reset(executor);

        assertThat(pipeline.readThroughAll(List.of("book:2", "book:1"), ALL_BOOKS))
                .containsExactly(new Book(2, "Emma"), new Book(1, "Dune"));
        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("updateAndInvalidate() hides cached rows after the update")
    void updateShouldInvalidateAffectedKeys() {
        doReturn(List.of(new Book(1, "Dune"))).when(executor).query(any(), any());
        pipeline.readThrough("book:1", ALL_BOOKS);
        when(executor.update(RENAME)).thenReturn(1);

        assertThat(pipeline.updateAndInvalidate(RENAME, List.of("book:1"))).isEqualTo(1);

        assertThat(protocol.get("book:1").isMiss()).isTrue();
    }

    @Test
    @DisplayName("Fill that read pre-update data loses to the update's invalidation")
    void fillRacingUpdateShouldBeRejected() {
        when(executor.update(RENAME)).thenReturn(1);
        doAnswer(invocation -> {
            // the update commits while the source read is in flight
            pipeline.updateAndInvalidate(RENAME, List.of("book:1"));
            return List.of(new Book(1, "Old"));
        }).when(executor).query(any(), any());

        Optional<Book> served = pipeline.readThrough("book:1", ALL_BOOKS);

        assertThat(served).contains(new Book(1, "Old"));
        assertThat(protocol.get("book:1").isMiss()).isTrue();
    }

    @Test
    @DisplayName("Invalidation timestamp is taken after the update returns")
    void invalidationShouldBeStampedAfterCommit() {
        LogicalTimestamp[] duringUpdate = new LogicalTimestamp[1];
        when(executor.update(RENAME)).thenAnswer(invocation -> {
            duringUpdate[0] = LogicalTimestamp.now(clock);
            return 1;
        });

        pipeline.updateAndInvalidate(RENAME, List.of("book:7"));

        LogicalTimestamp invalidatedAt = protocol.scan("book:7").get("book:7").invalidateTs();
        assertThat(invalidatedAt.isAfter(duringUpdate[0])).isTrue();
    }
}

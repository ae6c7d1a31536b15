package com.iksanov.coherentcache.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CacheRecord visibility rules")
class CacheRecordTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("ABSENT has no value and zero timestamps")
    void absentShouldBeEmpty() {
        assertThat(CacheRecord.ABSENT.hasValue()).isFalse();
        assertThat(CacheRecord.ABSENT.isVisible()).isFalse();
        assertThat(CacheRecord.ABSENT.writeTs()).isEqualTo(LogicalTimestamp.ZERO);
        assertThat(CacheRecord.ABSENT.invalidateTs()).isEqualTo(LogicalTimestamp.ZERO);
    }

    @Test
    @DisplayName("A value written at or after the invalidation is visible")
    void shouldBeVisibleWhenWriteNotOlderThanInvalidation() {
        CacheRecord equal = new CacheRecord(bytes("v"), LogicalTimestamp.of(150, 0), LogicalTimestamp.of(150, 0));
        CacheRecord newer = new CacheRecord(bytes("v"), LogicalTimestamp.of(151, 0), LogicalTimestamp.of(150, 0));

        assertThat(equal.isVisible()).isTrue();
        assertThat(newer.isVisible()).isTrue();
    }

    @Test
    @DisplayName("A value older than the invalidation keeps its bytes but is hidden")
    void shouldHideStaleValue() {
        CacheRecord stale = new CacheRecord(bytes("v"), LogicalTimestamp.of(100, 0), LogicalTimestamp.of(100, 1));

        assertThat(stale.hasValue()).isTrue();
        assertThat(stale.isFresh()).isFalse();
        assertThat(stale.isVisible()).isFalse();
    }

    @Test
    @DisplayName("withValue() and withInvalidation() touch only their own fields")
    void transitionsShouldPreserveOtherFields() {
        CacheRecord tombstone = CacheRecord.ABSENT.withInvalidation(LogicalTimestamp.of(50, 0));
        assertThat(tombstone.isTombstone()).isTrue();
        assertThat(tombstone.writeTs()).isEqualTo(LogicalTimestamp.ZERO);

        CacheRecord written = tombstone.withValue(bytes("x"), LogicalTimestamp.of(60, 0));
        assertThat(written.invalidateTs()).isEqualTo(LogicalTimestamp.of(50, 0));
        assertThat(written.value()).isEqualTo(bytes("x"));
    }

    @Test
    @DisplayName("Records with equal content are equal")
    void shouldCompareByContent() {
        CacheRecord a = new CacheRecord(bytes("same"), LogicalTimestamp.of(1, 0), LogicalTimestamp.ZERO);
        CacheRecord b = new CacheRecord(bytes("same"), LogicalTimestamp.of(1, 0), LogicalTimestamp.ZERO);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(new CacheRecord(bytes("other"), LogicalTimestamp.of(1, 0), LogicalTimestamp.ZERO));
    }

    @Test
    @DisplayName("An empty payload still counts as a written value")
    void emptyPayloadShouldBeAValue() {
        CacheRecord record = CacheRecord.ABSENT.withValue(new byte[0], LogicalTimestamp.of(1, 0));

        assertThat(record.isVisible()).isTrue();
    }

    @Test
    @DisplayName("Value bytes are copied in and out")
    void shouldCopyValueBytes() {
        byte[] source = bytes("abc");
        CacheRecord record = new CacheRecord(source, LogicalTimestamp.of(1, 0), LogicalTimestamp.ZERO);
        source[0] = 'x';
        record.value()[1] = 'y';

        assertThat(record.value()).isEqualTo(bytes("abc"));
        assertThat(record.withInvalidation(LogicalTimestamp.of(2, 0)).value()).isEqualTo(bytes("abc"));
    }
}

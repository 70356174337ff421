package com.williamcallahan.book_import_engine.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedLogsTest {

    @Test
    void appendKeepsNewestEntries() {
        List<Integer> result = BoundedLogs.append(List.of(1, 2, 3), List.of(4, 5), 3);

        assertThat(result).containsExactly(3, 4, 5);
    }

    @Test
    void appendToleratesNullSides() {
        assertThat(BoundedLogs.append(null, List.of("a"), 5)).containsExactly("a");
        assertThat(BoundedLogs.append(List.of("a"), null, 5)).containsExactly("a");
    }

    @Test
    void keepNewestWithZeroCapacityIsEmpty() {
        assertThat(BoundedLogs.keepNewest(List.of(1, 2), 0)).isEmpty();
    }
}

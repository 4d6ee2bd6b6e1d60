package com.flagship.subscription_billing.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class LedgerHistoryTest {

    private static final UUID SUBSCRIPTION_ID = UUID.randomUUID();

    /** Sequence numbers 1..count, served newest first like the database. */
    private static class RecordingLoader implements LedgerHistory.PageLoader {
        private final List<LedgerEntry> entries;
        private final List<Long> cursors = new ArrayList<>();

        RecordingLoader(int count) {
            entries = LongStream.rangeClosed(1, count)
                .mapToObj(seq -> new LedgerEntry(UUID.randomUUID(), seq, SUBSCRIPTION_ID, BigDecimal.TEN,
                    ChargeOutcome.FAILED, LocalDate.of(2024, 2, 15), "key-" + seq, null, "declined",
                    Instant.EPOCH))
                .collect(Collectors.toList());
        }

        @Override
        public List<LedgerEntry> load(Long beforeSequence, int pageSize) {
            cursors.add(beforeSequence);
            List<LedgerEntry> page = new ArrayList<>();
            for (int i = entries.size() - 1; i >= 0 && page.size() < pageSize; i--) {
                LedgerEntry entry = entries.get(i);
                if (beforeSequence == null || entry.getSequenceNumber() < beforeSequence) {
                    page.add(entry);
                }
            }
            return page;
        }
    }

    private static List<Long> sequences(Iterable<LedgerEntry> history) {
        List<Long> sequences = new ArrayList<>();
        history.forEach(entry -> sequences.add(entry.getSequenceNumber()));
        return sequences;
    }

    @Test
    @DisplayName("Pages newest first with a sequence cursor and stops at the limit")
    void pagesUpToLimit() {
        RecordingLoader loader = new RecordingLoader(10);
        LedgerHistory history = new LedgerHistory(loader, 7, 3);

        assertEquals(List.of(10L, 9L, 8L, 7L, 6L, 5L, 4L), sequences(history));
        assertEquals(Arrays.asList(null, 8L, 5L), loader.cursors.subList(0, 3));
    }

    @Test
    @DisplayName("Nothing is loaded until iteration starts")
    void lazy() {
        RecordingLoader loader = new RecordingLoader(5);
        new LedgerHistory(loader, 5, 2);

        assertTrue(loader.cursors.isEmpty());
    }

    @Test
    @DisplayName("Each iteration starts again from the newest entry")
    void restartable() {
        LedgerHistory history = new LedgerHistory(new RecordingLoader(4), 10, 3);

        assertEquals(List.of(4L, 3L, 2L, 1L), sequences(history));
        assertEquals(List.of(4L, 3L, 2L, 1L), history.toList().stream()
            .map(LedgerEntry::getSequenceNumber).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Iterator honours the Iterator contract when exhausted")
    void exhaustedIterator() {
        Iterator<LedgerEntry> iterator = new LedgerHistory(new RecordingLoader(1), 5).iterator();

        assertTrue(iterator.hasNext());
        iterator.next();
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    void zeroLimitIsEmpty() {
        RecordingLoader loader = new RecordingLoader(3);
        assertTrue(new LedgerHistory(loader, 0).toList().isEmpty());
    }

    @Test
    void invalidArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LedgerHistory(new RecordingLoader(1), -1));
        assertThrows(IllegalArgumentException.class, () -> new LedgerHistory(new RecordingLoader(1), 1, 0));
    }
}

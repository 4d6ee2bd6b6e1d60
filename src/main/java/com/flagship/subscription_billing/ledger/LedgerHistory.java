package com.flagship.subscription_billing.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Most-recent-first view of a subscription's ledger, bounded by a limit.
 *
 * Nothing is read until iteration starts. Pages are fetched with a
 * sequence-number cursor, and every call to {@link #iterator()} starts again
 * from the newest entry.
 */
public class LedgerHistory implements Iterable<LedgerEntry> {

    static final int DEFAULT_PAGE_SIZE = 50;

    /**
     * Loads up to {@code pageSize} entries with a sequence number below
     * {@code beforeSequence} (no bound when null), newest first.
     */
    @FunctionalInterface
    public interface PageLoader {
        List<LedgerEntry> load(Long beforeSequence, int pageSize);
    }

    private final PageLoader loader;
    private final int limit;
    private final int pageSize;

    public LedgerHistory(PageLoader loader, int limit) {
        this(loader, limit, DEFAULT_PAGE_SIZE);
    }

    public LedgerHistory(PageLoader loader, int limit, int pageSize) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.loader = loader;
        this.limit = limit;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<LedgerEntry> iterator() {
        return new PagingIterator();
    }

    public List<LedgerEntry> toList() {
        List<LedgerEntry> entries = new ArrayList<>();
        forEach(entries::add);
        return entries;
    }

    private class PagingIterator implements Iterator<LedgerEntry> {

        private Iterator<LedgerEntry> page = Collections.emptyIterator();
        private Long cursor;
        private int returned;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (returned >= limit) {
                return false;
            }
            if (!page.hasNext() && !exhausted) {
                fetchNextPage();
            }
            return page.hasNext();
        }

        @Override
        public LedgerEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            LedgerEntry entry = page.next();
            cursor = entry.getSequenceNumber();
            returned++;
            return entry;
        }

        private void fetchNextPage() {
            int size = Math.min(pageSize, limit - returned);
            List<LedgerEntry> entries = loader.load(cursor, size);
            if (entries.size() < size) {
                exhausted = true;
            }
            page = entries.iterator();
        }
    }
}

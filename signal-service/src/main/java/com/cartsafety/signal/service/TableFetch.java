package com.cartsafety.signal.service;

import com.cartsafety.common.signal.ContingencyTable;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * The counts gathered for one drug-event pair. {@code table} is null when the source had
 * no reports for the drug or the event; {@code insufficiency} then says which.
 */
record TableFetch(String searchTerm, ContingencyTable table, List<CountLookup> lookups, String insufficiency) {

    static TableFetch complete(String searchTerm, ContingencyTable table, List<CountLookup> lookups) {
        return new TableFetch(searchTerm, table, List.copyOf(lookups), null);
    }

    static TableFetch insufficient(String searchTerm, List<CountLookup> lookups, String reason) {
        return new TableFetch(searchTerm, null, List.copyOf(lookups), reason);
    }

    long cacheHits() {
        return lookups.stream().filter(CountLookup::cacheHit).count();
    }

    /** Fetch time of the stalest count in the table. */
    Instant oldestData() {
        return lookups.stream().map(CountLookup::fetchedAt).min(Comparator.naturalOrder()).orElse(null);
    }
}

////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspproxy.router;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.tomaszrup.lspproxy.message.MessageId;

/**
 * Correlates server-bound request ids with the method they were sent with,
 * so that a response (which carries only the id) can be handed to the
 * response hook of the right method.
 *
 * <p>The client-to-server loop {@link #record records} and the
 * server-to-client loop {@link #resolve resolves}; every operation is atomic
 * and holds the table lock only for the map update itself. Entries whose
 * response never arrives are dropped by {@link #evictOlderThan(Duration)}.</p>
 *
 * <p>Invariant: {@code size() == recorded - replaced - resolved - evicted}.</p>
 */
public class PendingRequestTable {

    private final Clock clock;
    private final Map<MessageId, PendingEntry> entries = new HashMap<>();

    private long recordedCount;
    private long replacedCount;
    private long resolvedCount;
    private long evictedCount;

    public PendingRequestTable() {
        this(Clock.systemUTC());
    }

    public PendingRequestTable(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records a request forwarded to the server.
     *
     * <p>An id that is already in flight is a protocol violation by the
     * client. The newer mapping wins and the displaced entry is returned so
     * the caller can report it.</p>
     *
     * @return the entry that was already recorded under {@code id}, or
     *         {@code null} if the id was not in flight
     */
    public synchronized PendingEntry record(MessageId id, String method) {
        PendingEntry previous = entries.put(id, new PendingEntry(id, method, clock.instant()));
        recordedCount++;
        if (previous != null) {
            replacedCount++;
        }
        return previous;
    }

    /**
     * Removes and returns the method recorded for {@code id}.
     *
     * @return empty if no request with that id is in flight (never recorded,
     *         already resolved, or evicted)
     */
    public synchronized Optional<String> resolve(MessageId id) {
        PendingEntry entry = entries.remove(id);
        if (entry == null) {
            return Optional.empty();
        }
        resolvedCount++;
        return Optional.of(entry.getMethod());
    }

    /**
     * Drops entries recorded more than {@code timeout} ago; their responses
     * are treated as never arriving. A late response is then unmatched.
     *
     * @return the evicted entries, oldest first
     */
    public synchronized List<PendingEntry> evictOlderThan(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<PendingEntry> evicted = new ArrayList<>();
        Iterator<PendingEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            PendingEntry entry = it.next();
            if (entry.getRecordedAt().isBefore(cutoff)) {
                it.remove();
                evicted.add(entry);
            }
        }
        evictedCount += evicted.size();
        evicted.sort((a, b) -> a.getRecordedAt().compareTo(b.getRecordedAt()));
        return evicted;
    }

    public synchronized boolean contains(MessageId id) {
        return entries.containsKey(id);
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Empties the table at session end. */
    public synchronized int clear() {
        int dropped = entries.size();
        entries.clear();
        return dropped;
    }

    public synchronized long getRecordedCount() {
        return recordedCount;
    }

    public synchronized long getReplacedCount() {
        return replacedCount;
    }

    public synchronized long getResolvedCount() {
        return resolvedCount;
    }

    public synchronized long getEvictedCount() {
        return evictedCount;
    }
}

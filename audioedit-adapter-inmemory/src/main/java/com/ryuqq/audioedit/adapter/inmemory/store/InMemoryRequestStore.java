package com.ryuqq.audioedit.adapter.inmemory.store;

import com.ryuqq.audioedit.core.exception.RequestNotFoundException;
import com.ryuqq.audioedit.core.model.ClientId;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.RequestFilter;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.spi.RequestStore;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import com.ryuqq.audioedit.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link RequestStore} SPI for tests and single-process deployments.
 *
 * <p>Requests live in a {@link ConcurrentHashMap}; every mutation runs inside
 * {@link ConcurrentHashMap#compute}-family calls, so updates of one id are serialized
 * while different ids proceed in parallel.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>requests:</strong> ConcurrentHashMap&lt;RequestId, Entry&gt; - current record plus insertion sequence</li>
 *   <li><strong>sequence:</strong> AtomicLong - insertion order used for newest-first listing</li>
 * </ul>
 *
 * <p><strong>Transition Guarantee:</strong></p>
 * <ul>
 *   <li>The edge is validated against the current record inside the per-key critical section</li>
 *   <li>An exception thrown there leaves the mapping untouched (no partial update, no updatedAt change)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>list/countActive scan all entries (O(N))</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class InMemoryRequestStore implements RequestStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRequestStore.class);

    private final ConcurrentHashMap<RequestId, Entry> requests = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void create(EditRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.status() != RequestStatus.QUEUED) {
            throw new IllegalArgumentException("new requests must be queued (current: " + request.status() + ")");
        }
        Entry previous = requests.putIfAbsent(request.id(), new Entry(request, sequence.incrementAndGet()));
        if (previous != null) {
            throw new IllegalStateException("Request already exists: " + request.id());
        }
    }

    @Override
    public EditRequest get(RequestId id) {
        return find(id).orElseThrow(() -> new RequestNotFoundException(id));
    }

    @Override
    public Optional<EditRequest> find(RequestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Entry entry = requests.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.request());
    }

    @Override
    public EditRequest transition(RequestId id, RequestStatus target, UnaryOperator<EditRequest> mutation) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }

        Entry updated = requests.computeIfPresent(id, (key, entry) -> {
            EditRequest current = entry.request();
            StateTransition.validate(current.status(), target);
            EditRequest next = mutation.apply(current);
            if (next == null || next.status() != target || !next.id().equals(id)) {
                throw new IllegalStateException(
                    "mutation must keep id " + id + " and produce status " + target + " (got: "
                        + (next == null ? null : next.status()) + ")"
                );
            }
            return entry.with(next);
        });
        if (updated == null) {
            throw new RequestNotFoundException(id);
        }
        log.trace("{}: {}", id, updated.request().status());
        return updated.request();
    }

    @Override
    public EditRequest recordProgress(RequestId id, int completedSteps) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Entry updated = requests.computeIfPresent(id, (key, entry) -> {
            if (entry.request().status() != RequestStatus.PROCESSING) {
                return entry;
            }
            return entry.with(entry.request().withProgress(completedSteps));
        });
        if (updated == null) {
            throw new RequestNotFoundException(id);
        }
        return updated.request();
    }

    @Override
    public List<EditRequest> list(RequestFilter filter) {
        RequestFilter effective = filter == null ? RequestFilter.all() : filter;
        return requests.values().stream()
            .filter(entry -> effective.matches(entry.request()))
            .sorted(Comparator.comparingLong(Entry::sequence).reversed())
            .limit(effective.limit())
            .map(Entry::request)
            .toList();
    }

    @Override
    public EditRequest delete(RequestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        AtomicReference<EditRequest> removed = new AtomicReference<>();
        requests.computeIfPresent(id, (key, entry) -> {
            if (!entry.request().isTerminal()) {
                throw new IllegalStateException(
                    "Only terminal requests can be deleted (" + id + " is " + entry.request().status() + ")"
                );
            }
            removed.set(entry.request());
            return null;
        });
        if (removed.get() == null) {
            throw new RequestNotFoundException(id);
        }
        return removed.get();
    }

    @Override
    public int countActive(ClientId clientId) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        return (int) requests.values().stream()
            .map(Entry::request)
            .filter(request -> request.clientId().equals(clientId) && request.status().isActive())
            .count();
    }

    /**
     * Number of stored requests.
     *
     * @return request count
     */
    public int size() {
        return requests.size();
    }

    private record Entry(EditRequest request, long sequence) {

        Entry with(EditRequest next) {
            return new Entry(next, sequence);
        }
    }
}

package org.adg.canonical;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe table keeping one representative diagram per canonical key.
 * <p>
 * The first form offered for a key wins; later offers are counted as duplicates.
 * </p>
 */
public final class DeduplicationTable {
    private final ConcurrentHashMap<CanonicalKey, CanonicalForm> representatives = new ConcurrentHashMap<>();
    private final LongAdder offered = new LongAdder();
    private final LongAdder duplicates = new LongAdder();

    /**
     * Offers one canonical form.
     *
     * @return true when the form became the representative of its key.
     */
    public boolean offer(CanonicalForm form) {
        CanonicalForm nonNullForm = Objects.requireNonNull(form, "form");
        offered.increment();
        CanonicalForm previous = representatives.putIfAbsent(nonNullForm.getKey(), nonNullForm);
        if (previous != null) {
            duplicates.increment();
            return false;
        }
        return true;
    }

    public boolean contains(CanonicalKey key) {
        return representatives.containsKey(key);
    }

    /**
     * Returns the representative for a key, or null when absent.
     */
    public CanonicalForm get(CanonicalKey key) {
        if (key == null) {
            return null;
        }
        return representatives.get(key);
    }

    public int size() {
        return representatives.size();
    }

    public long offeredCount() {
        return offered.sum();
    }

    public long duplicateCount() {
        return duplicates.sum();
    }

    /**
     * Snapshot of all representatives in ascending key order.
     */
    public List<CanonicalForm> sortedForms() {
        List<CanonicalForm> forms = new ArrayList<>(representatives.values());
        forms.sort((a, b) -> a.getKey().compareTo(b.getKey()));
        return forms;
    }
}

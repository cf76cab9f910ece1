package info.mouts.foodorders.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import info.mouts.foodorders.domain.Category;

/**
 * Time-bounded copy of the active category list.
 * <p>
 * The data and its refresh time are swapped together as one snapshot. Two
 * threads reading an expired cache may both reload it; the last load wins.
 * </p>
 */
public class CategoryCache {
    private final Duration ttl;
    private final Clock clock;

    private volatile Snapshot snapshot;

    public CategoryCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached categories, reloading them with {@code loader} when
     * the cache is empty or older than its time-to-live.
     *
     * @param loader source of fresh data
     * @return the cached or freshly loaded categories
     */
    public List<Category> get(Supplier<List<Category>> loader) {
        Snapshot current = snapshot;
        Instant now = clock.instant();
        if (current != null && now.isBefore(current.refreshedAt.plus(ttl))) {
            return current.categories;
        }

        List<Category> fresh = List.copyOf(loader.get());
        snapshot = new Snapshot(fresh, now);
        return fresh;
    }

    public void invalidate() {
        snapshot = null;
    }

    public Instant lastRefreshed() {
        Snapshot current = snapshot;
        return current == null ? null : current.refreshedAt;
    }

    private static final class Snapshot {
        private final List<Category> categories;
        private final Instant refreshedAt;

        private Snapshot(List<Category> categories, Instant refreshedAt) {
            this.categories = categories;
            this.refreshedAt = refreshedAt;
        }
    }
}

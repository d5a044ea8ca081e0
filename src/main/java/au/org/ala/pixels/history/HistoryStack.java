package au.org.ala.pixels.history;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded undo/redo history.
 * <p>
 * The cursor points at the entry matching what is on screen. Pushing after an undo throws away
 * everything after the cursor, so an abandoned redo branch can never come back. When the stack
 * grows past its limit the oldest entry is evicted and the cursor shifts with it.
 *
 * @param <T> the snapshot type
 */
public class HistoryStack<T> {

    private static final Logger log = LoggerFactory.getLogger(HistoryStack.class);

    public static final int DEFAULT_LIMIT = 20;

    private final int limit;
    private final List<T> snapshots = new ArrayList<>();
    private int cursor = -1;

    public HistoryStack() {
        this(DEFAULT_LIMIT);
    }

    public HistoryStack(int limit) {
        Preconditions.checkArgument(limit > 0, "History limit must be positive: %s", limit);
        this.limit = limit;
    }

    public void push(T snapshot) {
        Preconditions.checkNotNull(snapshot, "snapshot");
        if (cursor < snapshots.size() - 1) {
            int discarded = snapshots.size() - cursor - 1;
            snapshots.subList(cursor + 1, snapshots.size()).clear();
            log.debug("Discarded {} redo entries", discarded);
        }
        snapshots.add(snapshot);
        cursor++;
        if (snapshots.size() > limit) {
            snapshots.remove(0);
            cursor--;
        }
    }

    /**
     * Step back one entry.
     *
     * @return the entry now at the cursor, or empty if already at the oldest entry
     */
    public Optional<T> undo() {
        if (cursor <= 0) {
            return Optional.empty();
        }
        cursor--;
        return Optional.of(snapshots.get(cursor));
    }

    /**
     * Step forward one entry.
     *
     * @return the entry now at the cursor, or empty if already at the newest entry
     */
    public Optional<T> redo() {
        if (cursor >= snapshots.size() - 1) {
            return Optional.empty();
        }
        cursor++;
        return Optional.of(snapshots.get(cursor));
    }

    public Optional<T> current() {
        return cursor < 0 ? Optional.empty() : Optional.of(snapshots.get(cursor));
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < snapshots.size() - 1;
    }

    public void clear() {
        snapshots.clear();
        cursor = -1;
    }

    public int size() {
        return snapshots.size();
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    /**
     * @return the cursor index, or -1 when empty
     */
    public int getCursor() {
        return cursor;
    }

    public int getLimit() {
        return limit;
    }
}

package de.bsommerfeld.nestedset.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens and closes contiguous ranges of bound values.
 *
 * <p>
 * Every node occupies exactly two bound slots, so gaps always have an even
 * size. An odd or zero size would leave the numbering with a hole or a
 * collision and is rejected before anything is written.
 */
public class GapAllocator {

    private static final Logger LOG = LoggerFactory.getLogger(GapAllocator.class);

    private final BoundsStore store;

    public GapAllocator(BoundsStore store) {
        this.store = store;
    }

    /**
     * Shifts every bound {@code >= cut} by {@code size}. A positive size opens
     * the empty range {@code [cut, cut + size)}; a negative size closes the
     * range of {@code |size|} values ending right before {@code cut}.
     *
     * @return number of column updates performed
     * @throws IllegalArgumentException if {@code size} is zero or odd
     */
    public int makeGap(int cut, int size) {
        if (size == 0 || size % 2 != 0) {
            throw new IllegalArgumentException("Gap size must be a non-zero even number, got " + size);
        }
        int touched = store.shiftBounds(cut, size);
        LOG.debug("[Tree] {} gap of {} at {}", size > 0 ? "Opened" : "Closed", Math.abs(size), cut);
        return touched;
    }
}

package org.tpch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The refresh data consumed by one refresh pair: the orders inserted by RF1 and
 * the order keys removed by RF2.
 *
 * <p>Insert order follows the generator's emission order.
 */
public final class RefreshSet {
    private final List<NewOrder> inserts;
    private final List<Long> deleteKeys;

    public RefreshSet(List<NewOrder> inserts, List<Long> deleteKeys) {
        this.inserts = Collections.unmodifiableList(new ArrayList<>(inserts));
        this.deleteKeys = Collections.unmodifiableList(new ArrayList<>(deleteKeys));
    }

    public List<NewOrder> getInserts() {
        return inserts;
    }

    public List<Long> getDeleteKeys() {
        return deleteKeys;
    }
}

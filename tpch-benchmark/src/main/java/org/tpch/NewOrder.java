package org.tpch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One order to insert by refresh function 1, with its line items.
 *
 * <p>Rows are the generator's pipe-delimited text; a trailing delimiter is
 * tolerated. The order row is always inserted before its line items.
 */
public final class NewOrder {
    private final String orderRow;
    private final List<String> lineItemRows;

    public NewOrder(String orderRow, List<String> lineItemRows) {
        if (orderRow == null || orderRow.isBlank()) {
            throw new IllegalArgumentException("order row is empty");
        }
        this.orderRow = orderRow;
        this.lineItemRows = Collections.unmodifiableList(new ArrayList<>(lineItemRows));
    }

    public String getOrderRow() {
        return orderRow;
    }

    public List<String> getLineItemRows() {
        return lineItemRows;
    }

    public long getOrderKey() {
        return orderKeyOf(orderRow);
    }

    /**
     * Splits a generator row into its field values.
     */
    public static List<String> fields(String row) {
        String trimmed = row.strip();
        if (trimmed.endsWith("|")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return Arrays.asList(trimmed.split("\\|", -1));
    }

    /**
     * Reads the order key, the first field of both ORDERS and LINEITEM rows.
     */
    public static long orderKeyOf(String row) {
        String key = fields(row).get(0).trim();
        try {
            return Long.parseLong(key);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("row does not start with an order key: " + row, e);
        }
    }
}

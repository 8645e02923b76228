package org.arcx.migration.trigger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Dialect-neutral form of the exclusivity trigger: count the non-null values of {@link #columns}
 * on the final row image and abort with {@link #message} unless the count is exactly one.
 *
 * <p>When {@link #uniqueAcrossColumns} is set, a row whose active value already appears in the
 * same column of another row (identified by {@link #ownerPrimaryKey}) is rejected with
 * {@link #uniqueMessage}.
 */
@Value
@Builder
public class ExclusivityCheck {
    String ownerTable;
    String ownerPrimaryKey;
    String triggerName;
    @Singular List<String> columns;
    String message;
    boolean uniqueAcrossColumns;
    String uniqueMessage;

    /** Number of non-null columns a valid row carries. */
    public int expectedCount() {
        return 1;
    }
}

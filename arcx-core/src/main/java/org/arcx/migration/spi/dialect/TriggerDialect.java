package org.arcx.migration.spi.dialect;

import org.arcx.migration.trigger.ExclusivityCheck;
import org.arcx.model.DdlStatement;
import org.arcx.naming.Naming;

import java.util.List;

/**
 * Renders the dialect-neutral {@link ExclusivityCheck} as procedural SQL.
 *
 * <p>A dialect may need several objects for one logical trigger (one trigger per event, or a
 * function plus a trigger). The drop list must remove exactly the objects the create list made.
 */
public interface TriggerDialect {
    List<DdlStatement> getCreateExclusivityTriggerSql(ExclusivityCheck check, Naming naming);
    List<DdlStatement> getDropExclusivityTriggerSql(ExclusivityCheck check, Naming naming);
}

package org.arcx.migration.contributor.drop;

import org.arcx.migration.contributor.DdlContributor;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.migration.trigger.ExclusivityCheck;
import org.arcx.model.DdlStatement;
import org.arcx.naming.Naming;

import java.util.List;

public record ExclusivityTriggerDropContributor(ExclusivityCheck check, Naming naming) implements DdlContributor {
    @Override
    public int priority() {
        return 10; // Trigger Drop
    }

    @Override
    public void contribute(List<DdlStatement> out, DdlDialect dialect) {
        out.addAll(dialect.getDropExclusivityTriggerSql(check, naming));
    }
}

package org.arcx.migration.contributor.create;

import org.arcx.migration.contributor.DdlContributor;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.migration.trigger.ExclusivityCheck;
import org.arcx.model.DdlStatement;
import org.arcx.naming.Naming;

import java.util.List;

public record ExclusivityTriggerAddContributor(ExclusivityCheck check, Naming naming) implements DdlContributor {
    @Override
    public int priority() {
        return 50; // after every FK and index
    }

    @Override
    public void contribute(List<DdlStatement> out, DdlDialect dialect) {
        out.addAll(dialect.getCreateExclusivityTriggerSql(check, naming));
    }
}

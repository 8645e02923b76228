package org.arcx.migration.contributor.drop;

import org.arcx.migration.contributor.DdlContributor;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.DdlObjectKind;
import org.arcx.model.DdlStatement;
import org.arcx.model.ForeignKeyModel;

import java.util.List;

public record ForeignKeyDropContributor(ForeignKeyModel fk) implements DdlContributor {
    @Override
    public int priority() {
        return 20; // FK Drop
    }

    @Override
    public void contribute(List<DdlStatement> out, DdlDialect dialect) {
        out.add(new DdlStatement(DdlObjectKind.FOREIGN_KEY, fk.getName(), dialect.getDropForeignKeySql(fk)));
    }
}

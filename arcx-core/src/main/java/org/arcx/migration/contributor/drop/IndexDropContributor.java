package org.arcx.migration.contributor.drop;

import org.arcx.migration.contributor.DdlContributor;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.DdlObjectKind;
import org.arcx.model.DdlStatement;
import org.arcx.model.IndexModel;

import java.util.List;

public record IndexDropContributor(IndexModel index) implements DdlContributor {
    @Override
    public int priority() {
        return 30; // Index Drop, FK가 먼저 제거되어야 한다
    }

    @Override
    public void contribute(List<DdlStatement> out, DdlDialect dialect) {
        out.add(new DdlStatement(DdlObjectKind.INDEX, index.getIndexName(), dialect.getDropIndexSql(index)));
    }
}

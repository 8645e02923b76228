package org.arcx.migration.contributor.create;

import org.arcx.migration.contributor.DdlContributor;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.DdlObjectKind;
import org.arcx.model.DdlStatement;
import org.arcx.model.IndexModel;

import java.util.List;

public record IndexAddContributor(IndexModel index) implements DdlContributor {
    @Override
    public int priority() {
        return 10;
    }

    @Override
    public void contribute(List<DdlStatement> out, DdlDialect dialect) {
        out.add(new DdlStatement(DdlObjectKind.INDEX, index.getIndexName(), dialect.indexStatement(index)));
    }
}

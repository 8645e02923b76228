package org.arcx.migration.contributor;

import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.DdlStatement;

import java.util.List;

public interface DdlContributor extends SqlContributor {
    void contribute(List<DdlStatement> out, DdlDialect dialect);
}

package org.arcx.migration;

import lombok.Getter;
import org.arcx.migration.contributor.DdlContributor;
import org.arcx.migration.contributor.SqlContributor;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.DdlStatement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class ConstraintSetBuilder {
    @Getter
    private final DdlDialect dialect;
    @Getter
    private final List<DdlContributor> units = new ArrayList<>();

    public ConstraintSetBuilder(DdlDialect dialect) {
        this.dialect = dialect;
    }

    public ConstraintSetBuilder add(DdlContributor unit) {
        units.add(unit);
        return this;
    }

    public List<DdlStatement> build() {
        List<DdlStatement> out = new ArrayList<>();
        // stable sort: equal priorities stay in declaration order
        units.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> c.contribute(out, dialect));
        return List.copyOf(out);
    }
}

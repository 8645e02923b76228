package org.arcx.migration.spi.dialect;

import org.arcx.exception.UnsupportedMappingException;
import org.arcx.model.DdlStatement;
import org.arcx.model.ForeignKeyModel;
import org.arcx.model.IndexModel;
import org.arcx.model.PolymorphicMapping;

import java.util.List;

public interface DdlDialect extends BaseDialect, TriggerDialect {
    // Foreign keys
    String getAddForeignKeySql(ForeignKeyModel fk);
    String getDropForeignKeySql(ForeignKeyModel fk);

    // Indexes
    String indexStatement(IndexModel idx);
    String getDropIndexSql(IndexModel idx);

    /**
     * @throws UnsupportedMappingException when the engine cannot enforce the mapping
     */
    void checkSupported(PolymorphicMapping mapping);

    /**
     * Joins statements into a script runnable by the engine's command line client.
     */
    String renderScript(List<DdlStatement> statements);
}

package org.arcx.migration.output;

import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.CompiledConstraintSet;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface OutputHandler {
    /**
     * @return files written
     */
    List<Path> handle(CompiledConstraintSet compiled, DdlDialect dialect, Path outputDir) throws IOException;
}

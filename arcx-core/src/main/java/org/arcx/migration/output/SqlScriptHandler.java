package org.arcx.migration.output;

import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.CompiledConstraintSet;
import org.arcx.model.PolymorphicMapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes {@code <table>__<role>.up.sql} and {@code <table>__<role>.down.sql}.
 */
public class SqlScriptHandler implements OutputHandler {

    @Override
    public List<Path> handle(CompiledConstraintSet compiled, DdlDialect dialect, Path outputDir) throws IOException {
        PolymorphicMapping mapping = compiled.mapping();
        Files.createDirectories(outputDir);

        String baseName = baseName(mapping);
        Path up = outputDir.resolve(baseName + ".up.sql");
        Path down = outputDir.resolve(baseName + ".down.sql");

        Files.writeString(up, generateHeader(mapping, dialect, "up") + "\n" + dialect.renderScript(compiled.addStatements()));
        Files.writeString(down, generateHeader(mapping, dialect, "down") + "\n" + dialect.renderScript(compiled.removeStatements()));
        return List.of(up, down);
    }

    static String baseName(PolymorphicMapping mapping) {
        return (mapping.getOwnerTable() + "__" + mapping.getRole()).replaceAll("[^A-Za-z0-9_]", "_");
    }

    private String generateHeader(PolymorphicMapping mapping, DdlDialect dialect, String direction) {
        return String.format("""
            -- arcx exclusive arc
            -- arcx:table=%s
            -- arcx:role=%s
            -- arcx:columns=%s
            -- arcx:dialect=%s
            -- arcx:direction=%s
            -- arcx:generated=%s
            """,
            mapping.getOwnerTable(),
            mapping.getRole(),
            String.join(",", mapping.columns()),
            dialect.getDatabaseType().name().toLowerCase(),
            direction,
            LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        );
    }
}

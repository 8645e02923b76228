package org.arcx.cli;

import org.arcx.config.ConfigurationLoader;
import org.arcx.config.mapping.LoadedMappings;
import org.arcx.config.mapping.MappingLoader;
import org.arcx.exception.ArcxException;
import org.arcx.migration.DatabaseType;
import org.arcx.migration.ExclusiveArcCompiler;
import org.arcx.migration.output.SqlScriptHandler;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.CompiledConstraintSet;
import org.arcx.model.PolymorphicMapping;
import org.arcx.naming.DefaultNaming;
import org.arcx.options.ArcxOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Compiles every mapping of a declaration file into {@code .up.sql} / {@code .down.sql} scripts.
 */
@CommandLine.Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "매핑 선언으로부터 FK/인덱스/배타성 트리거 SQL을 생성합니다."
)
public class CompileCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-m", "--mappings"}, required = true, description = "매핑 선언 YAML 파일")
    private Path mappingFile;
    @CommandLine.Option(names = {"-d", "--dialect"}, description = "사용할 DB 방언(mysql, postgresql, h2). 기본값: 설정 파일 또는 mysql")
    private String dialectName;
    @CommandLine.Option(names = "--out", description = "생성된 SQL 저장 위치. 기본값: 설정 파일 또는 build/arcx")
    private Path outputDir;
    @CommandLine.Option(names = "--max-length", description = "생성되는 제약조건/인덱스/트리거 이름의 최대 길이")
    private Integer maxLength;
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;
    @CommandLine.Option(names = "--print", description = "파일 대신 표준 출력으로 SQL을 출력합니다.")
    private boolean print;

    @Override
    public Integer call() {
        try {
            applyConfiguration();

            LoadedMappings loaded = new MappingLoader().load(mappingFile);
            DdlDialect dialect = DatabaseType.fromName(dialectName).newDialect();
            int nameLength = Math.min(maxLength, dialect.getMaxIdentifierLength());
            ExclusiveArcCompiler compiler = new ExclusiveArcCompiler(dialect, new DefaultNaming(nameLength), loaded.catalog());

            // 모든 매핑을 먼저 컴파일해 하나라도 실패하면 아무 파일도 쓰지 않는다
            List<CompiledConstraintSet> compiled = new ArrayList<>();
            for (PolymorphicMapping mapping : loaded.mappings()) {
                compiled.add(compiler.compile(mapping));
            }

            if (print) {
                printScripts(compiled, dialect);
                return 0;
            }

            SqlScriptHandler handler = new SqlScriptHandler();
            for (CompiledConstraintSet set : compiled) {
                List<Path> written = handler.handle(set, dialect, outputDir);
                System.out.printf("%s (%s): %d add / %d remove statements -> %s%n",
                        set.mapping().getOwnerTable(), set.mapping().getRole(),
                        set.addStatements().size(), set.removeStatements().size(),
                        written.stream().map(p -> p.getFileName().toString()).toList());
            }
            System.out.println("Migration scripts generated successfully in " + outputDir);
            return 0;

        } catch (ArcxException | IllegalArgumentException e) {
            System.err.println("Compile failed: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Compile failed: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private void printScripts(List<CompiledConstraintSet> compiled, DdlDialect dialect) {
        for (CompiledConstraintSet set : compiled) {
            System.out.println("-- " + set.mapping().getOwnerTable() + " (" + set.mapping().getRole() + ") up");
            System.out.println(dialect.renderScript(set.addStatements()));
            System.out.println("-- " + set.mapping().getOwnerTable() + " (" + set.mapping().getRole() + ") down");
            System.out.println(dialect.renderScript(set.removeStatements()));
        }
    }

    /**
     * CLI 옵션이 없으면 설정 파일 값을 사용한다.
     */
    private void applyConfiguration() {
        ConfigurationLoader loader = new ConfigurationLoader();
        Map<String, String> config = loader.loadConfiguration(profile);

        if (dialectName == null) {
            dialectName = config.getOrDefault(ArcxOptions.Database.DIALECT_KEY, ArcxOptions.Database.DIALECT_DEFAULT);
        }
        if (outputDir == null) {
            outputDir = Path.of(config.getOrDefault(ArcxOptions.Output.DIRECTORY_KEY, ArcxOptions.Output.DIRECTORY_DEFAULT));
        }
        if (maxLength == null) {
            String configMaxLength = config.get(ArcxOptions.Naming.MAX_LENGTH_KEY);
            maxLength = ArcxOptions.Naming.MAX_LENGTH_DEFAULT;
            if (configMaxLength != null) {
                try {
                    maxLength = Integer.parseInt(configMaxLength);
                } catch (NumberFormatException e) {
                    System.err.println("Warning: Invalid maxLength in configuration: " + configMaxLength +
                                     ". Using default: " + ArcxOptions.Naming.MAX_LENGTH_DEFAULT);
                }
            }
        }
    }
}

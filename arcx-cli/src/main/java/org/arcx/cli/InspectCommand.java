package org.arcx.cli;

import org.arcx.config.mapping.LoadedMappings;
import org.arcx.config.mapping.MappingLoader;
import org.arcx.exception.ArcxException;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.Relation;
import org.arcx.runtime.AttributeReader;
import org.arcx.runtime.ExclusiveAssociation;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Prints the declared keys and relation names of each mapping, as the runtime accessor sees them.
 */
@CommandLine.Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        description = "매핑 선언의 FK 컬럼과 관계 이름을 출력합니다."
)
public class InspectCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-m", "--mappings"}, required = true, description = "매핑 선언 YAML 파일")
    private Path mappingFile;

    @Override
    public Integer call() {
        try {
            LoadedMappings loaded = new MappingLoader().load(mappingFile);
            for (PolymorphicMapping mapping : loaded.mappings()) {
                // 값이 없는 인스턴스: 선언 정보만 조회한다
                ExclusiveAssociation view = new ExclusiveAssociation(
                        mapping, AttributeReader.of(null), (table, id) -> Optional.empty());

                System.out.println(mapping.getOwnerTable() + " (" + mapping.getRole() + ")");
                System.out.println("  keys:      " + String.join(", ", view.declaredKeys()));
                System.out.println("  relations: " + String.join(", ", view.declaredRelationNames()));
                for (Relation rel : mapping.getRelations()) {
                    System.out.println("    " + rel.getColumn() + " -> " + rel.getReferencedTable() + "."
                            + rel.getReferencedColumn() + " [" + rel.shortName() + ", on delete "
                            + rel.getOnDelete().sql().toLowerCase() + "]");
                }
            }
            return 0;
        } catch (ArcxException e) {
            System.err.println("Inspect failed: " + e.getMessage());
            return 1;
        }
    }
}

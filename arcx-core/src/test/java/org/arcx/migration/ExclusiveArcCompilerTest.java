package org.arcx.migration;

import org.arcx.exception.UnsupportedMappingException;
import org.arcx.migration.dialect.h2.H2Dialect;
import org.arcx.migration.dialect.mysql.MySqlDialect;
import org.arcx.migration.dialect.postgresql.PostgreSqlDialect;
import org.arcx.migration.spi.dialect.DdlDialect;
import org.arcx.model.CompiledConstraintSet;
import org.arcx.model.DdlObjectKind;
import org.arcx.model.DdlStatement;
import org.arcx.model.MappingOptions;
import org.arcx.model.OnDeleteAction;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.ReferencedKeyCatalog;
import org.arcx.model.Relation;
import org.arcx.naming.DefaultNaming;
import org.arcx.testing.Mappings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExclusiveArcCompilerTest {

    private final ExclusiveArcCompiler mysql = new ExclusiveArcCompiler(new MySqlDialect(), new DefaultNaming(64));

    private static List<DdlObjectKind> kinds(List<DdlStatement> statements) {
        return statements.stream().map(DdlStatement::kind).toList();
    }

    private static List<String> names(List<DdlStatement> statements) {
        return statements.stream().map(DdlStatement::objectName).toList();
    }

    @Nested
    @DisplayName("compileAdd")
    class CompileAdd {

        @Test
        @DisplayName("관계마다 FK, 인덱스 순서로 만들고 마지막에 트리거")
        void orderPerRelationThenTrigger() {
            List<DdlStatement> add = mysql.compileAdd(Mappings.comments());

            assertThat(kinds(add)).containsExactly(
                    DdlObjectKind.FOREIGN_KEY, DdlObjectKind.INDEX,
                    DdlObjectKind.FOREIGN_KEY, DdlObjectKind.INDEX,
                    DdlObjectKind.TRIGGER, DdlObjectKind.TRIGGER);
            assertThat(names(add)).containsExactly(
                    "fk_comments__employee_id__employees", "ix_comments__employee_id",
                    "fk_comments__product_id__products", "ix_comments__product_id",
                    "trg_comments__owner_bi", "trg_comments__owner_bu");
        }

        @Test
        @DisplayName("FK/인덱스 SQL")
        void foreignKeyAndIndexSql() {
            List<DdlStatement> add = mysql.compileAdd(Mappings.comments());

            assertEquals("ALTER TABLE `comments` ADD CONSTRAINT `fk_comments__employee_id__employees`"
                    + " FOREIGN KEY (`employee_id`) REFERENCES `employees` (`id`)", add.get(0).sql());
            assertEquals("CREATE INDEX `ix_comments__employee_id` ON `comments` (`employee_id`)", add.get(1).sql());
        }

        @Test
        @DisplayName("이름 접두어 옵션을 따른다")
        void namePrefixes() {
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("assignments")
                    .role("assignee")
                    .relation(Relation.of("employee_id", "employees", "id"))
                    .relation(Relation.of("team_id", "teams", "id"))
                    .options(MappingOptions.builder()
                            .foreignKeyNamePrefix("fk_assign_")
                            .indexNamePrefix("ix_assign_")
                            .build())
                    .build();

            List<DdlStatement> add = mysql.compileAdd(mapping);

            assertThat(names(add)).startsWith("fk_assign_employee_id", "ix_assign_employee_id",
                    "fk_assign_team_id", "ix_assign_team_id");
        }

        @Test
        @DisplayName("indexed=false 관계는 인덱스를 만들지 않는다")
        void skipsExistingIndex() {
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .role("owner")
                    .relation(Relation.builder().column("employee_id").referencedTable("employees").indexed(false).build())
                    .relation(Relation.of("product_id", "products", "id"))
                    .build();

            CompiledConstraintSet set = mysql.compile(mapping);

            assertThat(names(set.addStatements())).doesNotContain("ix_comments__employee_id");
            assertThat(names(set.removeStatements())).doesNotContain("ix_comments__employee_id");
            assertThat(names(set.addStatements())).contains("ix_comments__product_id");
        }

        @Test
        @DisplayName("ON DELETE 동작을 FK에 반영한다")
        void onDelete() {
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.builder().column("employee_id").referencedTable("employees")
                            .onDelete(OnDeleteAction.CASCADE).build())
                    .relation(Relation.of("product_id", "products", "id"))
                    .build();

            List<DdlStatement> add = mysql.compileAdd(mapping);

            assertThat(add.get(0).sql()).endsWith("REFERENCES `employees` (`id`) ON DELETE CASCADE");
            assertThat(add.get(2).sql()).doesNotContain("ON DELETE");
        }

        @Test
        @DisplayName("트리거는 참조 테이블이 아니라 컬럼 목록에만 의존한다")
        void triggerDependsOnlyOnColumns() {
            PolymorphicMapping other = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .role("owner")
                    .relation(Relation.of("employee_id", "staff", "staff_no"))
                    .relation(Relation.of("product_id", "catalog.items", "sku"))
                    .build();

            List<DdlStatement> a = mysql.compileAdd(Mappings.comments());
            List<DdlStatement> b = mysql.compileAdd(other);

            assertThat(a.subList(4, 6)).isEqualTo(b.subList(4, 6));
        }
    }

    @Nested
    @DisplayName("compileRemove")
    class CompileRemove {

        @Test
        @DisplayName("트리거, FK, 인덱스 순으로 제거한다")
        void removeOrder() {
            List<DdlStatement> remove = mysql.compileRemove(Mappings.comments());

            assertThat(kinds(remove)).containsExactly(
                    DdlObjectKind.TRIGGER, DdlObjectKind.TRIGGER,
                    DdlObjectKind.FOREIGN_KEY, DdlObjectKind.FOREIGN_KEY,
                    DdlObjectKind.INDEX, DdlObjectKind.INDEX);
            assertThat(remove.get(2).sql())
                    .isEqualTo("ALTER TABLE `comments` DROP FOREIGN KEY `fk_comments__employee_id__employees`");
            assertThat(remove.get(4).sql())
                    .isEqualTo("DROP INDEX `ix_comments__employee_id` ON `comments`");
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(DatabaseType.class)
        @DisplayName("추가한 객체와 제거하는 객체 집합이 같다")
        void symmetric(DatabaseType type) {
            ExclusiveArcCompiler compiler = new ExclusiveArcCompiler(type.newDialect(), new DefaultNaming(30));
            for (PolymorphicMapping mapping : List.of(Mappings.comments(), Mappings.uniqueComments())) {
                CompiledConstraintSet set = compiler.compile(mapping);

                Set<String> added = set.addStatements().stream()
                        .map(s -> s.kind() + ":" + s.objectName()).collect(Collectors.toSet());
                Set<String> removed = set.removeStatements().stream()
                        .map(s -> s.kind() + ":" + s.objectName()).collect(Collectors.toSet());

                assertThat(removed).isEqualTo(added);
                assertThat(set.removeStatements()).hasSameSizeAs(set.addStatements());
            }
        }

        @Test
        @DisplayName("매번 같은 매핑에서 같은 문장을 계산한다")
        void deterministic() {
            assertThat(mysql.compileRemove(Mappings.comments())).isEqualTo(mysql.compileRemove(Mappings.comments()));
        }
    }

    @Nested
    @DisplayName("UnsupportedMappingException")
    class Unsupported {

        private final ReferencedKeyCatalog catalog = ReferencedKeyCatalog.builder()
                .table("employees", "id")
                .table("products", "id", "sku")
                .build();

        @Test
        @DisplayName("참조 컬럼이 선언된 키가 아니면 거부")
        void referencedColumnNotKey() {
            ExclusiveArcCompiler compiler = new ExclusiveArcCompiler(new PostgreSqlDialect(), new DefaultNaming(63), catalog);
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("employee_id", "employees", "email"))
                    .relation(Relation.of("product_id", "products", "id"))
                    .build();

            assertThatThrownBy(() -> compiler.compileAdd(mapping))
                    .isInstanceOf(UnsupportedMappingException.class)
                    .hasMessageContaining("employees.email")
                    .hasMessageStartingWith("[POSTGRESQL]");
            assertThatThrownBy(() -> compiler.compileRemove(mapping))
                    .isInstanceOf(UnsupportedMappingException.class);
        }

        @Test
        @DisplayName("카탈로그에 없는 테이블과 선언된 unique 키는 허용")
        void declaredOrUnknownTablesPass() {
            ExclusiveArcCompiler compiler = new ExclusiveArcCompiler(new PostgreSqlDialect(), new DefaultNaming(63), catalog);
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("product_sku", "products", "sku"))
                    .relation(Relation.of("order_id", "orders", "order_no"))
                    .build();

            assertThat(compiler.compileAdd(mapping)).isNotEmpty();
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = OnDeleteAction.class, names = {"SET_NULL", "SET_DEFAULT"})
        @DisplayName("MySQL 은 트리거가 실행되지 않는 ON DELETE 동작을 거부")
        void mysqlRejectsBypassingActions(OnDeleteAction action) {
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.builder().column("employee_id").referencedTable("employees").onDelete(action).build())
                    .relation(Relation.of("product_id", "products", "id"))
                    .build();

            assertThatThrownBy(() -> mysql.compile(mapping))
                    .isInstanceOf(UnsupportedMappingException.class)
                    .hasMessageContaining("comments.employee_id ON DELETE " + action.sql());
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = OnDeleteAction.class, names = {"SET_NULL", "SET_DEFAULT"})
        @DisplayName("PostgreSQL/H2 도 활성 키를 바꾸는 ON DELETE 동작을 거부")
        void otherDialectsRejectKeyRewritingActions(OnDeleteAction action) {
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.builder().column("employee_id").referencedTable("employees")
                            .onDelete(action).build())
                    .relation(Relation.of("product_id", "products", "id"))
                    .build();

            for (DdlDialect dialect : List.of(new PostgreSqlDialect(), new H2Dialect())) {
                ExclusiveArcCompiler compiler = new ExclusiveArcCompiler(dialect, new DefaultNaming(63));
                assertThatThrownBy(() -> compiler.compileAdd(mapping))
                        .isInstanceOf(UnsupportedMappingException.class)
                        .hasMessageContaining("comments.employee_id ON DELETE " + action.sql())
                        .hasMessageContaining("rewrites the active key");
                assertThatThrownBy(() -> compiler.compileRemove(mapping))
                        .isInstanceOf(UnsupportedMappingException.class);
            }
        }

        @Test
        @DisplayName("CASCADE 는 소유 행을 지우므로 모든 dialect 에서 허용")
        void cascadeAccepted() {
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.builder().column("employee_id").referencedTable("employees")
                            .onDelete(OnDeleteAction.CASCADE).build())
                    .relation(Relation.of("product_id", "products", "id"))
                    .build();

            for (DdlDialect dialect : List.of(new MySqlDialect(), new PostgreSqlDialect(), new H2Dialect())) {
                List<DdlStatement> add = new ExclusiveArcCompiler(dialect, new DefaultNaming(63)).compileAdd(mapping);
                assertThat(add.get(0).sql()).endsWith("ON DELETE CASCADE");
            }
        }
    }

    @Test
    @DisplayName("이름은 최대 길이 안으로 잘린다")
    void namesRespectMaxLength() {
        ExclusiveArcCompiler compiler = new ExclusiveArcCompiler(new MySqlDialect(), new DefaultNaming(30));

        CompiledConstraintSet set = compiler.compile(Mappings.comments());

        Set<String> all = new HashSet<>(names(set.addStatements()));
        assertThat(all).allSatisfy(name -> assertThat(name.length()).isLessThanOrEqualTo(30));
        assertThat(all).hasSize(set.addStatements().size());
    }
}

package org.arcx.model;

import org.arcx.exception.InvalidMappingException;
import org.arcx.testing.Mappings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolymorphicMappingTest {

    @Nested
    @DisplayName("정상 생성")
    class Valid {

        @Test
        @DisplayName("선언 순서대로 컬럼을 노출한다")
        void columnsInDeclarationOrder() {
            PolymorphicMapping mapping = Mappings.comments();

            assertThat(mapping.columns()).containsExactly("employee_id", "product_id");
            assertThat(mapping.getOwnerPrimaryKey()).isEqualTo("id");
            assertThat(mapping.getOptions()).isEqualTo(MappingOptions.DEFAULTS);
        }

        @Test
        @DisplayName("role 미지정 시 기본값 association")
        void defaultRole() {
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("employee_id", "employees", "id"))
                    .relation(Relation.of("product_id", "products", "id"))
                    .build();

            assertThat(mapping.getRole()).isEqualTo(PolymorphicMapping.DEFAULT_ROLE);
        }

        @Test
        @DisplayName("relation 조회는 대소문자를 무시한다")
        void relationLookup() {
            PolymorphicMapping mapping = Mappings.comments();

            assertThat(mapping.relation("PRODUCT_ID")).get()
                    .extracting(Relation::getReferencedTable).isEqualTo("products");
            assertThat(mapping.relation("nope")).isEmpty();
        }

        @Test
        @DisplayName("relations 목록은 수정할 수 없다")
        void relationsUnmodifiable() {
            PolymorphicMapping mapping = Mappings.comments();

            assertThatThrownBy(() -> mapping.getRelations().add(Relation.of("x_id", "xs", "id")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("빌더에 넘긴 리스트를 바꿔도 매핑은 변하지 않는다")
        void defensiveCopy() {
            List<Relation> relations = new ArrayList<>(List.of(
                    Relation.of("employee_id", "employees", "id"),
                    Relation.of("product_id", "products", "id")));
            PolymorphicMapping mapping = PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relations(relations)
                    .build();

            relations.add(Relation.of("order_id", "orders", "id"));

            assertThat(mapping.columns()).hasSize(2);
        }

        @Test
        @DisplayName("짧은 관계 이름은 명시값 또는 참조 테이블 단수형")
        void shortNames() {
            Relation explicit = Relation.builder().column("author_id").referencedTable("people").name("author").build();
            Relation derived = Relation.of("category_id", "categories", "id");

            assertThat(explicit.shortName()).isEqualTo("author");
            assertThat(derived.shortName()).isEqualTo("category");
            assertThat(derived.getOnDelete()).isEqualTo(OnDeleteAction.NO_ACTION);
            assertThat(derived.isIndexed()).isTrue();
        }
    }

    @Nested
    @DisplayName("생성 실패")
    class Invalid {

        @Test
        @DisplayName("관계가 2개 미만이면 거부")
        void tooFewRelations() {
            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("employee_id", "employees", "id"))
                    .build())
                    .isInstanceOf(InvalidMappingException.class)
                    .hasMessageContaining("at least 2 relations");
        }

        @Test
        @DisplayName("uniqueAcrossColumns 인데 관계가 2개 미만이면 별도 메시지")
        void uniqueWithTooFewRelations() {
            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("employee_id", "employees", "id"))
                    .options(MappingOptions.builder().uniqueAcrossColumns(true).build())
                    .build())
                    .isInstanceOf(InvalidMappingException.class)
                    .hasMessageContaining("uniqueAcrossColumns");
        }

        @Test
        @DisplayName("컬럼 이름 중복(대소문자 무시) 거부")
        void duplicateColumns() {
            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("employee_id", "employees", "id"))
                    .relation(Relation.of("EMPLOYEE_ID", "products", "id"))
                    .build())
                    .isInstanceOf(InvalidMappingException.class)
                    .hasMessageContaining("Duplicate relation column");
        }

        @Test
        @DisplayName("빈 테이블 이름 거부")
        void blankTable() {
            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("  ")
                    .relation(Relation.of("employee_id", "employees", "id"))
                    .relation(Relation.of("product_id", "products", "id"))
                    .build())
                    .isInstanceOf(InvalidMappingException.class)
                    .hasMessageContaining("owner table");
        }

        @Test
        @DisplayName("빈 컬럼/참조 식별자 거부")
        void blankColumn() {
            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("", "employees", "id"))
                    .relation(Relation.of("product_id", "products", "id"))
                    .build())
                    .isInstanceOf(InvalidMappingException.class);

            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .relation(Relation.of("employee_id", null, "id"))
                    .relation(Relation.of("product_id", "products", "id"))
                    .build())
                    .isInstanceOf(InvalidMappingException.class)
                    .hasMessageContaining("referenced table");
        }

        @Test
        @DisplayName("빈 role 거부")
        void blankRole() {
            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .role("")
                    .relation(Relation.of("employee_id", "employees", "id"))
                    .relation(Relation.of("product_id", "products", "id"))
                    .build())
                    .isInstanceOf(InvalidMappingException.class)
                    .hasMessageContaining("role");
        }

        @Test
        @DisplayName("관계 컬럼이 소유 테이블의 PK와 같으면 거부")
        void columnIsPrimaryKey() {
            assertThatThrownBy(() -> PolymorphicMapping.builder()
                    .ownerTable("comments")
                    .ownerPrimaryKey("comment_id")
                    .relation(Relation.of("comment_id", "employees", "id"))
                    .relation(Relation.of("product_id", "products", "id"))
                    .build())
                    .isInstanceOf(InvalidMappingException.class)
                    .hasMessageContaining("primary key");
        }
    }
}

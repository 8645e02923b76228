package org.arcx.runtime;

import org.arcx.model.ActiveKeyState;
import org.arcx.model.PolymorphicMapping;
import org.arcx.model.Relation;
import org.arcx.testing.Mappings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActiveKeyResolverTest {

    private final PolymorphicMapping threeWay = PolymorphicMapping.builder()
            .ownerTable("attachments")
            .role("target")
            .relation(Relation.of("employee_id", "employees", "id"))
            .relation(Relation.of("product_id", "products", "id"))
            .relation(Relation.of("order_id", "orders", "id"))
            .build();

    @Test
    @DisplayName("모든 부분집합에 대해 0개 Unset, 1개 Resolved, 2개 이상 Conflict")
    void exhaustiveOverSubsets() {
        ActiveKeyResolver resolver = new ActiveKeyResolver(threeWay);
        List<String> columns = threeWay.columns();

        for (int mask = 0; mask < (1 << columns.size()); mask++) {
            Map<String, Object> values = new HashMap<>();
            List<String> set = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    values.put(columns.get(i), 100 + i);
                    set.add(columns.get(i));
                } else if (i % 2 == 0) {
                    values.put(columns.get(i), null); // 명시적 null 과 누락을 섞는다
                }
            }

            ActiveKeyState state = resolver.resolve(values);

            switch (set.size()) {
                case 0 -> assertThat(state).isEqualTo(ActiveKeyState.UNSET);
                case 1 -> assertThat(state).isEqualTo(new ActiveKeyState.Resolved(set.get(0)));
                default -> assertThat(state).isEqualTo(new ActiveKeyState.Conflict(set));
            }
        }
    }

    @Test
    @DisplayName("선언되지 않은 키는 무시한다")
    void ignoresUndeclaredKeys() {
        ActiveKeyResolver resolver = new ActiveKeyResolver(Mappings.comments());

        ActiveKeyState state = resolver.resolve(Map.of("employee_id", 5, "author_id", 9, "id", 1));

        assertThat(state).isEqualTo(new ActiveKeyState.Resolved("employee_id"));
    }

    @Test
    @DisplayName("null 맵은 Unset")
    void nullMapIsUnset() {
        ActiveKeyResolver resolver = new ActiveKeyResolver(Mappings.comments());

        assertThat(resolver.resolve((Map<String, ?>) null)).isEqualTo(ActiveKeyState.UNSET);
    }

    @Test
    @DisplayName("Conflict는 선언 순서를 유지한다")
    void conflictKeepsDeclarationOrder() {
        ActiveKeyResolver resolver = new ActiveKeyResolver(threeWay);
        Map<String, Object> values = new HashMap<>();
        values.put("order_id", 3);
        values.put("employee_id", 1);

        ActiveKeyState state = resolver.resolve(values);

        assertThat(state).isInstanceOf(ActiveKeyState.Conflict.class);
        assertThat(((ActiveKeyState.Conflict) state).setColumns()).containsExactly("employee_id", "order_id");
    }

    @Test
    @DisplayName("reader 값이 바뀌면 다음 resolve에 즉시 반영된다")
    void notCached() {
        ActiveKeyResolver resolver = new ActiveKeyResolver(Mappings.comments());
        Map<String, Object> attributes = new HashMap<>();
        AttributeReader reader = attributes::get;

        assertThat(resolver.resolve(reader)).isEqualTo(ActiveKeyState.UNSET);

        attributes.put("product_id", 7L);
        assertThat(resolver.resolve(reader)).isEqualTo(new ActiveKeyState.Resolved("product_id"));

        attributes.put("employee_id", 5L);
        assertThat(resolver.resolve(reader).isResolved()).isFalse();
    }
}

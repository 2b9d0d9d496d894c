package com.lexis.activation.planner.dispatch;

import com.lexis.activation.api.model.Variable;
import com.lexis.activation.api.model.VariableSnapshot;
import com.lexis.activation.api.model.VariableType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotHasherTest {

    private final SnapshotHasher hasher = new SnapshotHasher();

    @Test
    @DisplayName("Should not depend on insertion order")
    void shouldIgnoreInsertionOrder() {
        VariableSnapshot one = VariableSnapshot.builder()
                .put("a", VariableType.STRING, "x")
                .put("b", VariableType.NUMBER, 10)
                .build();
        VariableSnapshot two = VariableSnapshot.builder()
                .put("b", VariableType.NUMBER, 10L)
                .put("a", VariableType.STRING, "x")
                .build();

        assertThat(hasher.hash(one)).isEqualTo(hasher.hash(two)).hasSize(64);
    }

    @Test
    @DisplayName("Should change with value, type or applicability")
    void shouldChangeWithContent() {
        VariableSnapshot base = VariableSnapshot.builder().put("a", VariableType.STRING, "x").build();
        VariableSnapshot otherValue = VariableSnapshot.builder().put("a", VariableType.STRING, "y").build();
        VariableSnapshot otherType = VariableSnapshot.builder().put("a", VariableType.LIST_OF_STRING, "x").build();
        VariableSnapshot notApplicable = VariableSnapshot.of(List.of(Variable.notApplicable("a", VariableType.STRING)));
        VariableSnapshot absentValue = VariableSnapshot.builder().put("a", VariableType.STRING, null).build();

        assertThat(List.of(hasher.hash(otherValue), hasher.hash(otherType), hasher.hash(notApplicable), hasher.hash(absentValue)))
                .doesNotContain(hasher.hash(base))
                .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should render lists element by element")
    void shouldRenderLists() {
        VariableSnapshot snapshot = VariableSnapshot.builder()
                .put("tags", VariableType.LIST_OF_STRING, List.of("a", "b"))
                .build();

        assertThat(hasher.canonicalJson(snapshot)).isEqualTo("{\"tags\":[\"list\",[\"a\",\"b\"],false]}");
    }
}

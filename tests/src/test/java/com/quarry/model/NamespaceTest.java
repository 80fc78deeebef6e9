package com.quarry.model;

import com.quarry.test.TestBase;
import com.quarry.test.TestCategories;
import com.quarry.types.NumberType;
import com.quarry.types.StringType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Namespace")
public class NamespaceTest extends TestBase {

    private final DimensionDef code = DimensionDef.column("code", StringType.get());
    private final DimensionDef state = DimensionDef.column("state", StringType.get());
    private final DimensionDef elevation = DimensionDef.column("elevation", NumberType.get());

    private Namespace airports() {
        return Namespace.EMPTY.with("code", code).with("state", state).with("elevation", elevation);
    }

    @Test
    @DisplayName("TC-NS-001: names keep declaration order")
    void testDeclarationOrder() {
        Namespace namespace = airports();

        assertThat(namespace.names()).containsExactly("code", "state", "elevation");
        assertThat(namespace.lookup("state")).isSameAs(state);
        assertThat(Namespace.EMPTY.size()).isZero();
    }

    @Test
    @DisplayName("TC-NS-002: operations leave the receiver unchanged")
    void testImmutability() {
        Namespace original = airports();
        Namespace smaller = original.without(List.of("state"));

        assertThat(original.names()).containsExactly("code", "state", "elevation");
        assertThat(smaller.names()).containsExactly("code", "elevation");
        assertThat(smaller.lookup("code")).isSameAs(original.lookup("code"));
    }

    @Test
    @DisplayName("TC-NS-003: accept keeps the listed names in declaration order")
    void testKeeping() {
        assertThat(airports().keeping(List.of("elevation", "code")).names())
            .containsExactly("code", "elevation");
    }

    @Test
    @DisplayName("TC-NS-004: rename keeps position and definition")
    void testRenamed() {
        Namespace renamed = airports().renamed("region", "state");

        assertThat(renamed.names()).containsExactly("code", "region", "elevation");
        assertThat(renamed.lookup("region")).isSameAs(state);
        assertThat(renamed.contains("state")).isFalse();
    }

    @Test
    @DisplayName("TC-NS-005: invalid names are known but not resolvable")
    void testInvalidNames() {
        Namespace namespace = airports().withInvalid("broken");

        assertThat(namespace.contains("broken")).isTrue();
        assertThat(namespace.isInvalid("broken")).isTrue();
        assertThat(namespace.lookup("broken")).isNull();
        assertThat(namespace.names()).doesNotContain("broken");
        assertThat(namespace.isInvalid("nothing")).isFalse();
        assertThat(namespace.contains("nothing")).isFalse();
    }

    @Test
    @DisplayName("TC-NS-006: redefining an invalid name makes it valid again")
    void testRedefineInvalid() {
        Namespace namespace = airports().withInvalid("broken").with("broken", code);

        assertThat(namespace.isInvalid("broken")).isFalse();
        assertThat(namespace.lookup("broken")).isSameAs(code);
    }

    @Test
    @DisplayName("TC-NS-007: renaming an invalid name carries the invalid mark")
    void testRenameInvalid() {
        Namespace namespace = airports().withInvalid("broken").renamed("fixed", "broken");

        assertThat(namespace.isInvalid("fixed")).isTrue();
        assertThat(namespace.isInvalid("broken")).isFalse();
    }
}

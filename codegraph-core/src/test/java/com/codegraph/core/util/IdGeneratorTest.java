package com.codegraph.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void generate_withSameComponents_returnsDeterministicId() {
        String id1 = IdGenerator.generate("shop", "pkg.a.foo", "pkg/a.py");
        String id2 = IdGenerator.generate("shop", "pkg.a.foo", "pkg/a.py");

        assertThat(id1).isEqualTo(id2);
        assertThat(id1).hasSize(16).matches("[0-9a-f]+");
    }

    @Test
    void generate_withDifferentProjects_returnsDifferentIds() {
        String id1 = IdGenerator.generate("shop", "pkg.a.foo", "pkg/a.py");
        String id2 = IdGenerator.generate("billing", "pkg.a.foo", "pkg/a.py");

        assertThat(id1).isNotEqualTo(id2);
    }

    @Test
    void generate_withShiftedComponentBoundaries_returnsDifferentIds() {
        String id1 = IdGenerator.generate("ab", "c");
        String id2 = IdGenerator.generate("a", "bc");

        assertThat(id1).isNotEqualTo(id2);
    }

    @Test
    void generate_withNullComponent_treatsItAsEmpty() {
        assertThat(IdGenerator.generate("a", null)).isEqualTo(IdGenerator.generate("a", ""));
    }

    @Test
    void generate_withNoComponents_throwsException() {
        assertThatThrownBy(() -> IdGenerator.generate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component required");
        assertThatThrownBy(() -> IdGenerator.generate((String[]) null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t"})
    void generateFromString_withBlankInput_throwsException(String input) {
        assertThatThrownBy(() -> IdGenerator.generateFromString(input))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not be null or blank");
    }

    @Test
    void generateFullHash_returnsSha256HexDigest() {
        String hash = IdGenerator.generateFullHash("abc");

        assertThat(hash)
            .hasSize(64)
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(IdGenerator.generateFromString("abc")).isEqualTo(hash.substring(0, 16));
    }
}

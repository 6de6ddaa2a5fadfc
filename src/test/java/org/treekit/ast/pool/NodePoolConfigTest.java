package org.treekit.ast.pool;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class NodePoolConfigTest {

    @Test
    void referenceConfMatchesDefaults() {
        NodePoolConfig fromReference = NodePoolConfig.fromConfig(ConfigFactory.parseResources("reference.conf").resolve());

        assertThat(fromReference).isEqualTo(NodePoolConfig.DEFAULT);
    }

    @Test
    void capacitiesFollowTheLimits() {
        NodePoolConfig config = NodePoolConfig.DEFAULT;

        assertThat(config.capacity(PoolCategory.INTEGER)).isEqualTo(256);
        assertThat(config.capacity(PoolCategory.BOOLEAN)).isEqualTo(2);
        assertThat(config.capacity(PoolCategory.STRING)).isEqualTo(1000);
        assertThat(config.capacity(PoolCategory.IDENTIFIER)).isEqualTo(500);
    }

    @Test
    void admissionChecksBoundsAndLengths() {
        NodePoolConfig config = NodePoolConfig.DEFAULT;

        assertThat(config.admits(PoolCategory.INTEGER, -128)).isTrue();
        assertThat(config.admits(PoolCategory.INTEGER, 128)).isFalse();
        assertThat(config.admits(PoolCategory.STRING, "x".repeat(50))).isTrue();
        assertThat(config.admits(PoolCategory.STRING, "x".repeat(51))).isFalse();
        assertThat(config.admits(PoolCategory.IDENTIFIER, "x".repeat(31))).isFalse();
        assertThat(config.admits(PoolCategory.BOOLEAN, false)).isTrue();
    }

    @Test
    void rejectsInvalidLimits() {
        assertThatThrownBy(() -> new NodePoolConfig(5, 4, 1, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min 5 > max 4");
        assertThatThrownBy(() -> new NodePoolConfig(0, 1, -1, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("string max-length");
    }

    @Test
    void hugeIntegerRangeDoesNotOverflowCapacity() {
        NodePoolConfig wide = new NodePoolConfig(Integer.MIN_VALUE, Integer.MAX_VALUE, 1, 1, 1, 1);

        assertThat(wide.capacity(PoolCategory.INTEGER)).isEqualTo(Integer.MAX_VALUE);
    }
}

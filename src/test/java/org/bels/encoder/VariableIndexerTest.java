package org.bels.encoder;

import org.bels.network.BayesianNetwork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class VariableIndexerTest {

    private EncodingStatistics statistics;
    private VariableIndexer indexer;
    private BayesianNetwork network;

    @BeforeEach
    void setUp() {
        statistics = new EncodingStatistics();
        indexer = new VariableIndexer(statistics);
        network = BayesianNetwork.builder("indexing")
                .addVariable("A", List.of("a0", "a1"))
                .addVariable("B", List.of("b0", "b1", "b2"))
                .setCpt("A", List.of(), new double[]{0.5, 0.5})
                .setCpt("B", List.of("A"), new double[]{0.2, 0.3, 0.5, 0.1, 0.1, 0.8})
                .build();
    }

    @Test
    @DisplayName("Should index states densely in declaration order starting from 1")
    void testDeclarationOrder() {
        indexer.registerIndicators(network);

        assertThat(indexer.indexOf("A", "a0")).isEqualTo(1);
        assertThat(indexer.indexOf("A", "a1")).isEqualTo(2);
        assertThat(indexer.indexOf("B", "b0")).isEqualTo(3);
        assertThat(indexer.indexOf("B", "b2")).isEqualTo(5);
        assertThat(indexer.peekNextIndex()).isEqualTo(6);
        assertThat(statistics.getVariables()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should continue auxiliary allocation after the indicators")
    void testAuxiliaryAllocation() {
        indexer.registerIndicators(network);

        assertThat(indexer.allocate()).isEqualTo(6);
        assertThat(indexer.allocate()).isEqualTo(7);
        assertThat(statistics.getVariables()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should expose the legend grouped by variable")
    void testLegend() {
        indexer.registerIndicators(network);

        assertThat(indexer.getLegend()).containsOnlyKeys("A", "B");
        assertThat(indexer.getLegend().get("B")).containsExactly(
                entry("b0", 3), entry("b1", 4), entry("b2", 5));
    }

    @Test
    @DisplayName("Should fail on unknown variable/state pairs")
    void testUnknownPair() {
        indexer.registerIndicators(network);

        assertThatThrownBy(() -> indexer.indexOf("A", "a7"))
                .isInstanceOf(UnknownVariableStateException.class)
                .hasMessageContaining("A = a7");
        assertThatThrownBy(() -> indexer.indexOf("Z", "a0"))
                .isInstanceOf(UnknownVariableStateException.class);
    }

    @Test
    @DisplayName("Should refuse to register indicators after other allocations")
    void testRegisterTwice() {
        indexer.allocate();

        assertThatThrownBy(() -> indexer.registerIndicators(network))
                .isInstanceOf(EncodingConsistencyException.class);
    }

    @Test
    @DisplayName("Should restart from 1 after reset")
    void testReset() {
        indexer.registerIndicators(network);
        indexer.reset();

        assertThat(indexer.peekNextIndex()).isEqualTo(1);
        assertThat(indexer.getLegend()).isEmpty();
    }
}

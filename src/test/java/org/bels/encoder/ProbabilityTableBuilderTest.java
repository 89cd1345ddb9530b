package org.bels.encoder;

import org.bels.network.BayesianNetwork;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ProbabilityTableBuilderTest {

    private final ClauseCanonicalizer canonicalizer = new ClauseCanonicalizer();
    private final ProbabilityTableBuilder builder = new ProbabilityTableBuilder(canonicalizer);

    private static CptScope scopeOf(BayesianNetwork network, String variable) {
        EncodingSession session = new EncodingSession();
        session.getIndexer().registerIndicators(network);
        return CptScope.of(network, variable, session.getIndexer());
    }

    @Test
    @DisplayName("Should map every assignment to its row-major value with the variable fastest")
    void testRowMajorLayout() {
        BayesianNetwork network = BayesianNetwork.builder("layout")
                .addVariable("A", List.of("a0", "a1"))
                .addVariable("B", List.of("b0", "b1", "b2"))
                .setCpt("A", List.of(), new double[]{0.5, 0.5})
                .setCpt("B", List.of("A"), new double[]{0.1, 0.2, 0.7, 0.3, 0.3, 0.4})
                .build();
        CptScope scope = scopeOf(network, "B");

        ProbabilityTable table = builder.build(scope, network.getValues("B"));

        assertThat(table.size()).isEqualTo(6);
        assertThat(table.get(canonicalizer.buildCoreClause(new int[]{0, 2}, scope))).isEqualTo(0.7);
        assertThat(table.get(canonicalizer.buildCoreClause(new int[]{1, 0}, scope))).isEqualTo(0.3);
        assertThat(table.get(canonicalizer.buildCoreClause(new int[]{1, 2}, scope))).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Should reject a value count that differs from the product of the domains")
    void testMalformedCount() {
        BayesianNetwork network = BayesianNetwork.builder("malformed")
                .addVariable("A", List.of("a0", "a1"))
                .addVariable("B", List.of("b0", "b1"))
                .setCpt("A", List.of(), new double[]{0.5, 0.5})
                .setCpt("B", List.of("A"), new double[]{0.1, 0.9, 0.5})
                .build();
        CptScope scope = scopeOf(network, "B");

        assertThatThrownBy(() -> builder.build(scope, network.getValues("B")))
                .isInstanceOf(MalformedTableException.class)
                .hasMessageContaining("attesi 4");
    }

    @Test
    @DisplayName("Should detect two assignments collapsing on the same key")
    void testDuplicateKey() {
        BayesianNetwork network = BayesianNetwork.builder("duplicate")
                .addVariable("A", List.of("a0", "a1"))
                .addVariable("B", List.of("b0", "b1"))
                .setCpt("A", List.of(), new double[]{0.5, 0.5})
                .setCpt("B", List.of("A", "A"), new double[]{0.1, 0.9, 0.2, 0.8, 0.3, 0.7, 0.4, 0.6})
                .build();
        CptScope scope = scopeOf(network, "B");

        assertThatThrownBy(() -> builder.build(scope, network.getValues("B")))
                .isInstanceOf(EncodingConsistencyException.class)
                .hasMessageContaining("Chiave duplicata");
    }

    @Test
    @DisplayName("Should fail lookups of rows outside the table")
    void testMissingRow() {
        BayesianNetwork network = EncoderTestNetworks.independentChild();
        CptScope scope = scopeOf(network, "A");
        ProbabilityTable table = builder.build(scope, network.getValues("A"));

        CptScope otherScope = scopeOf(network, "B");
        CoreClause foreignKey = canonicalizer.buildCoreClause(new int[]{0, 0}, otherScope);

        assertThatThrownBy(() -> table.get(foreignKey))
                .isInstanceOf(EncodingConsistencyException.class);
    }
}

package org.bels.encoder;

import org.bels.network.BayesianNetwork;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class IndependenceAnalyzerTest {

    private final ClauseCanonicalizer canonicalizer = new ClauseCanonicalizer();
    private final IndependenceAnalyzer analyzer = new IndependenceAnalyzer(canonicalizer);

    private ProbabilityTable tableOf(BayesianNetwork network, String variable) {
        EncodingSession session = new EncodingSession();
        session.getIndexer().registerIndicators(network);
        CptScope scope = CptScope.of(network, variable, session.getIndexer());
        return new ProbabilityTableBuilder(canonicalizer).build(scope, network.getValues(variable));
    }

    @Test
    @DisplayName("Should find a parent that does not influence the row")
    void testSingleIndependentParent() {
        ProbabilityTable table = tableOf(EncoderTestNetworks.independentChild(), "B");

        assertThat(analyzer.isVariableIndependent(0, new int[]{0, 0}, table, 0.2)).isTrue();
        assertThat(analyzer.findIndependentVariables(new int[]{0, 0}, table, 0.2)).containsExactly(0);
    }

    @Test
    @DisplayName("Should accept only candidates that stay independent jointly")
    void testJointCheck() {
        ProbabilityTable table = tableOf(EncoderTestNetworks.pairwiseOnlyIndependence(), "C");
        int[] assignment = {0, 0, 0};

        assertThat(analyzer.isVariableIndependent(0, assignment, table, 0.1)).isTrue();
        assertThat(analyzer.isVariableIndependent(1, assignment, table, 0.1)).isTrue();
        assertThat(analyzer.isJointlyIndependent(1, List.of(0), assignment, table, 0.1)).isFalse();

        // A precede B a parità di dominio
        assertThat(analyzer.findIndependentVariables(assignment, table, 0.1)).containsExactly(0);
    }

    @Test
    @DisplayName("Should return an empty set when every parent matters")
    void testNoIndependence() {
        ProbabilityTable table = tableOf(EncoderTestNetworks.pairwiseOnlyIndependence(), "C");

        assertThat(analyzer.findIndependentVariables(new int[]{1, 1, 0}, table, 0.9)).isEmpty();
    }

    @Test
    @DisplayName("Should try larger domains first and never drop the CPT variable")
    void testOrderingAndSelfRetention() {
        BayesianNetwork network = BayesianNetwork.builder("uniform")
                .addVariable("A", List.of("a0", "a1"))
                .addVariable("Z", List.of("z0", "z1", "z2"))
                .addVariable("C", List.of("c0", "c1"))
                .setCpt("A", List.of(), new double[]{0.5, 0.5})
                .setCpt("Z", List.of(), new double[]{0.2, 0.3, 0.5})
                .setCpt("C", List.of("A", "Z"), new double[]{
                        0.5, 0.5, 0.5, 0.5, 0.5, 0.5,
                        0.5, 0.5, 0.5, 0.5, 0.5, 0.5})
                .build();
        ProbabilityTable table = tableOf(network, "C");

        Set<Integer> independent = analyzer.findIndependentVariables(new int[]{0, 0, 0}, table, 0.5);

        assertThat(independent).containsExactly(1, 0);
        assertThat(independent).doesNotContain(table.getScope().selfPosition());
    }

    @Test
    @DisplayName("Should not analyze scopes made of the CPT variable alone")
    void testRootVariable() {
        ProbabilityTable table = tableOf(EncoderTestNetworks.singleVariable(), "A");

        assertThat(analyzer.findIndependentVariables(new int[]{0}, table, 0.3)).isEmpty();
    }

    @Test
    @DisplayName("Should refuse a joint check on an already accepted position")
    void testJointCheckOnAcceptedPosition() {
        ProbabilityTable table = tableOf(EncoderTestNetworks.pairwiseOnlyIndependence(), "C");

        assertThatThrownBy(() -> analyzer.isJointlyIndependent(0, List.of(0), new int[]{0, 0, 0}, table, 0.1))
                .isInstanceOf(EncodingConsistencyException.class);
    }
}

package org.bels.encoder;

import org.bels.network.BayesianNetwork;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EmitterTest {

    private final EncodingSession session = new EncodingSession();
    private final StringWriter output = new StringWriter();
    private final CnfBodyWriter writer = new CnfBodyWriter(output, session.getStatistics());
    private final ClauseCanonicalizer canonicalizer = new ClauseCanonicalizer();

    private void prepare(BayesianNetwork network, EncoderOptions options) {
        session.reset();
        session.getIndexer().registerIndicators(network);
        session.openSelectorBlock(options.selectorType());
    }

    private void emitParameters(BayesianNetwork network, EncoderOptions options, String variable) {
        CptScope scope = CptScope.of(network, variable, session.getIndexer());
        ProbabilityTable table = new ProbabilityTableBuilder(canonicalizer).build(scope, network.getValues(variable));
        new ParameterClauseEmitter(session, options, writer, canonicalizer).emit(table);
    }

    @Test
    @DisplayName("Should emit at-least-one and pairwise at-most-one clauses and skip leaves")
    void testIndicatorConstraints() {
        BayesianNetwork network = BayesianNetwork.builder("indicators")
                .addVariable("A", List.of("x", "y", "z"))
                .addVariable("B", List.of("b0", "b1"))
                .setCpt("A", List.of(), new double[]{0.2, 0.3, 0.5})
                .setCpt("B", List.of("A"), new double[]{0.1, 0.9, 0.2, 0.8, 0.3, 0.7})
                .build();
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.NW_DNNF);
        prepare(network, options);

        List<String> skipped = new IndicatorConstraintEmitter(session, options, writer).emit(network);

        assertThat(skipped).containsExactly("B");
        assertThat(output.toString()).isEqualTo("""
                1 2 3 0
                -1 -2 0
                -1 -3 0
                -2 -3 0
                """);
        assertThat(session.getStatistics().getClauses()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should emit only the at-least-one clause without indicator clauses")
    void testWithoutIndicatorClauses() {
        BayesianNetwork network = EncoderTestNetworks.singleVariable();
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.D_DNNF).withIndicatorClauses(false);
        prepare(network, options);

        new IndicatorConstraintEmitter(session, options, writer).emit(network);

        assertThat(output.toString()).isEqualTo("1 2 0\n");
    }

    @Test
    @DisplayName("Should emit one parameter clause per row with a fresh parameter variable")
    void testParameterClauses() {
        BayesianNetwork network = EncoderTestNetworks.singleVariable();
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.D_DNNF);
        prepare(network, options);

        emitParameters(network, options, "A");

        assertThat(output.toString()).isEqualTo("""
                c 0.3
                -1 3 0
                c 0.7
                -2 4 0
                """);
        assertThat(session.getStatistics().getVariables()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should collapse rows that reduce to the same clause")
    void testContextSpecificIndependence() {
        BayesianNetwork network = EncoderTestNetworks.independentChild();
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.D_DNNF).withContextSpecificIndependence(true);
        prepare(network, options);

        emitParameters(network, options, "B");

        assertThat(output.toString()).isEqualTo("""
                c 0.2
                -3 5 0
                c 0.8
                -4 6 0
                """);
        assertThat(session.getStatistics().getShrinks()).isEqualTo(4);
        assertThat(session.getStatistics().getIndependentVariables()).isEqualTo(4);
        assertThat(session.getStatistics().getClauses()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should elide certain rows and harden impossible rows under determinism")
    void testDeterminism() {
        BayesianNetwork network = EncoderTestNetworks.deterministicVariable();
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.D_DNNF).withDeterminism(true);
        prepare(network, options);

        emitParameters(network, options, "A");

        assertThat(output.toString()).isEqualTo("""
                c 0.0
                -2 0
                """);
        assertThat(session.getStatistics().getOnes()).isEqualTo(1);
        assertThat(session.getStatistics().getZeros()).isEqualTo(1);
        assertThat(session.getStatistics().getVariables()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep probability one rows when determinism is off")
    void testNoDeterminism() {
        BayesianNetwork network = EncoderTestNetworks.deterministicVariable();
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.D_DNNF);
        prepare(network, options);

        emitParameters(network, options, "A");

        assertThat(output.toString()).isEqualTo("""
                c 1.0
                -1 3 0
                c 0.0
                -2 4 0
                """);
        assertThat(session.getStatistics().getOnes()).isZero();
        assertThat(session.getStatistics().getZeros()).isZero();
    }

    @Test
    @DisplayName("Should add the binary minor clauses for every parameter clause")
    void testMinorClauses() {
        BayesianNetwork network = EncoderTestNetworks.singleVariable();
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.SD_DNNF);
        prepare(network, options);

        emitParameters(network, options, "A");

        assertThat(output.toString()).isEqualTo("""
                c 0.3
                -1 3 0
                1 -3 0
                c 0.7
                -2 4 0
                2 -4 0
                """);
        assertThat(session.getStatistics().getClauses()).isEqualTo(4);
    }
}

package org.bels.encoder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EncoderOptionsTest {

    @Test
    @DisplayName("Should derive leaf constraints and minor clauses from the circuit type")
    void testCircuitDefaults() {
        EncoderOptions nw = EncoderOptions.forCircuitType(CircuitType.NW_DNNF);
        EncoderOptions d = EncoderOptions.forCircuitType(CircuitType.D_DNNF);
        EncoderOptions sd = EncoderOptions.forCircuitType(CircuitType.SD_DNNF);

        assertThat(nw.leafConstraints()).isFalse();
        assertThat(nw.minorClauses()).isFalse();
        assertThat(d.leafConstraints()).isTrue();
        assertThat(d.minorClauses()).isFalse();
        assertThat(sd.leafConstraints()).isTrue();
        assertThat(sd.minorClauses()).isTrue();
        assertThat(sd.indicatorClauses()).isTrue();
        assertThat(sd.selectorType()).isEqualTo(SelectorVariableType.NONE);
    }

    @Test
    @DisplayName("Should reject selectors or missing indicators together with minor clauses")
    void testMinorClauseConstraints() {
        EncoderOptions sd = EncoderOptions.forCircuitType(CircuitType.SD_DNNF);

        assertThatThrownBy(() -> sd.withSelectorType(SelectorVariableType.ONE))
                .isInstanceOf(EncodingConsistencyException.class);
        assertThatThrownBy(() -> sd.withIndicatorClauses(false))
                .isInstanceOf(EncodingConsistencyException.class);
        assertThatThrownBy(() -> new EncoderOptions(false, true, false, false, true, SelectorVariableType.NONE))
                .isInstanceOf(EncodingConsistencyException.class);
    }

    @Test
    @DisplayName("Should describe active options in header order")
    void testDescribe() {
        EncoderOptions options = EncoderOptions.forCircuitType(CircuitType.SD_DNNF)
                .withDeterminism(true)
                .withContextSpecificIndependence(true);

        assertThat(options.describe()).containsExactly(
                "determinism",
                "minor clauses",
                "indicator clauses",
                "context-specific independence",
                "constraint clauses for leaf variables",
                "selector variable type: NONE");
        assertThat(EncoderOptions.forCircuitType(CircuitType.NW_DNNF).withSelectorType(SelectorVariableType.NEW).describe())
                .containsExactly("indicator clauses", "selector variable type: NEW");
    }

    @Test
    @DisplayName("Should parse circuit labels and selector names")
    void testLabels() {
        assertThat(CircuitType.fromLabel("sdDNNF")).isEqualTo(CircuitType.SD_DNNF);
        assertThat(CircuitType.fromLabel("ddnnf")).isEqualTo(CircuitType.D_DNNF);
        assertThat(SelectorVariableType.fromName("one")).isEqualTo(SelectorVariableType.ONE);
        assertThatThrownBy(() -> CircuitType.fromLabel("OBDD")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SelectorVariableType.fromName("MANY")).isInstanceOf(IllegalArgumentException.class);
    }
}

package org.bels.cnf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DimacsReaderTest {

    private final DimacsReader reader = new DimacsReader();

    @Test
    @DisplayName("Should read comments, header and clauses")
    void testValidFile() {
        DimacsFormula formula = reader.readString("""
                c net
                c
                c \tselector variable type: NONE
                p cnf 4 3
                1 2 0
                c 0.3
                -1 3 0

                -2 4 0
                """);

        assertThat(formula.getVariableCount()).isEqualTo(4);
        assertThat(formula.getClauseCount()).isEqualTo(3);
        assertThat(formula.getClauses().get(1)).containsExactly(-1, 3);
        assertThat(formula.getComments()).containsExactly("net", "", "selector variable type: NONE", "0.3");
        assertThat(formula.getHighestVariable()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject a clause count different from the header")
    void testClauseCountMismatch() {
        assertThatThrownBy(() -> reader.readString("p cnf 2 2\n1 2 0\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dichiara 2 clausole, trovate 1");
    }

    @Test
    @DisplayName("Should reject literals beyond the declared variables")
    void testVariableOutOfRange() {
        assertThatThrownBy(() -> reader.readString("p cnf 2 1\n1 -3 0\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Riga 2");
    }

    @Test
    @DisplayName("Should reject malformed clauses and headers")
    void testMalformedInput() {
        assertThatThrownBy(() -> reader.readString("p cnf 2 1\n1 2\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("terminatore");
        assertThatThrownBy(() -> reader.readString("p cnf 2 1\n1 0 2\n"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reader.readString("1 2 0\np cnf 2 1\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("prima dell'header");
        assertThatThrownBy(() -> reader.readString("p cnf 2 0\np cnf 2 0\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicato");
        assertThatThrownBy(() -> reader.readString("c only comments\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mancante");
        assertThatThrownBy(() -> reader.readString("p cnf x 1\n"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

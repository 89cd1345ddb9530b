package org.bels.network;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

class BifReaderTest {

    private final BifReader reader = new BifReader();

    private static Path fixture(String name) throws Exception {
        return Paths.get(BifReaderTest.class.getResource("/networks/" + name).toURI());
    }

    @Test
    @DisplayName("Should read asia with conditional rows in row-major order")
    void testAsia() throws Exception {
        BayesianNetwork network = reader.readFile(fixture("asia.bif"));

        assertThat(network.getName()).isEqualTo("unknown");
        assertThat(network.getVariables()).containsExactly(
                "asia", "tub", "smoke", "lung", "bronc", "either", "xray", "dysp");
        assertThat(network.getParents("either")).containsExactly("lung", "tub");
        assertThat(network.getValues("either")).containsExactly(1.0, 0.0, 1.0, 0.0, 1.0, 0.0, 0.0, 1.0);
        assertThat(network.getValues("dysp")).containsExactly(0.9, 0.1, 0.8, 0.2, 0.7, 0.3, 0.1, 0.9);
        assertThat(network.getEdges()).hasSize(8);
        assertThat(network.getLeafVariables()).containsExactly("xray", "dysp");
    }

    @Test
    @DisplayName("Should apply default rows and ignore properties and comments")
    void testDefaultRowsAndProperties() throws Exception {
        BayesianNetwork network = reader.readFile(fixture("weather.bif"));

        assertThat(network.getName()).isEqualTo("weather");
        assertThat(network.getStates("sky")).containsExactly("sunny", "cloudy", "rainy");
        assertThat(network.getValues("umbrella")).containsExactly(0.2, 0.8, 0.2, 0.8, 0.9, 0.1);
    }

    @Test
    @DisplayName("Should use the fallback name when the network block is missing")
    void testFallbackName() {
        BayesianNetwork network = reader.readString("""
                variable A {
                  type discrete [ 2 ] { a0, a1 };
                }
                probability ( A ) {
                  table 0.4 0.6;
                }
                """, "fallback");

        assertThat(network.getName()).isEqualTo("fallback");
        assertThat(network.getValues("A")).containsExactly(0.4, 0.6);
    }

    @Test
    @DisplayName("Should accept network names starting with digits")
    void testNumericNetworkName() {
        BayesianNetwork network = reader.readString("""
                network 5_2_100 {}
                variable A {
                  type discrete [ 2 ] { a0, a1 };
                }
                probability ( A ) {
                  table 1.0, 0.0;
                }
                """, "ignored");

        assertThat(network.getName()).isEqualTo("5_2_100");
    }

    @Test
    @DisplayName("Should fail fast on syntax errors")
    void testSyntaxError() {
        assertThatThrownBy(() -> reader.readString("variable A { type discrete [ 2 ] { a0, a1 } }", "bad"))
                .isInstanceOf(BifFormatException.class)
                .hasMessageContaining("Errore sintattico BIF");
    }

    @Test
    @DisplayName("Should reject incomplete CPTs without a default row")
    void testIncompleteCpt() {
        String bif = """
                variable A {
                  type discrete [ 2 ] { a0, a1 };
                }
                variable B {
                  type discrete [ 2 ] { b0, b1 };
                }
                probability ( A ) {
                  table 0.5, 0.5;
                }
                probability ( B | A ) {
                  (a0) 0.1, 0.9;
                }
                """;

        assertThatThrownBy(() -> reader.readString(bif, "incomplete"))
                .isInstanceOf(BifFormatException.class)
                .hasMessageContaining("CPT incompleta");
    }

    @Test
    @DisplayName("Should reject mismatched domain sizes, unknown states and missing CPTs")
    void testInconsistentDeclarations() {
        assertThatThrownBy(() -> reader.readString("""
                variable A {
                  type discrete [ 3 ] { a0, a1 };
                }
                """, "size"))
                .isInstanceOf(BifFormatException.class)
                .hasMessageContaining("dichiara 3 stati");

        assertThatThrownBy(() -> reader.readString("""
                variable A {
                  type discrete [ 2 ] { a0, a1 };
                }
                variable B {
                  type discrete [ 2 ] { b0, b1 };
                }
                probability ( A ) {
                  table 0.5, 0.5;
                }
                probability ( B | A ) {
                  (a9) 0.1, 0.9;
                  default 0.5, 0.5;
                }
                """, "state"))
                .isInstanceOf(BifFormatException.class)
                .hasMessageContaining("Stato sconosciuto a9");

        assertThatThrownBy(() -> reader.readString("""
                variable A {
                  type discrete [ 2 ] { a0, a1 };
                }
                """, "missing"))
                .isInstanceOf(BifFormatException.class)
                .hasMessageContaining("CPT mancante");
    }

    @Test
    @DisplayName("Should reject tables with the wrong number of values")
    void testWrongTableSize() {
        assertThatThrownBy(() -> reader.readString("""
                variable A {
                  type discrete [ 2 ] { a0, a1 };
                }
                probability ( A ) {
                  table 0.2, 0.3, 0.5;
                }
                """, "table"))
                .isInstanceOf(BifFormatException.class)
                .hasMessageContaining("attesi 2");
    }
}

package org.bels.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MixedRadixCounterTest {

    private static List<String> enumerate(int... radices) {
        List<String> combinations = new ArrayList<>();
        MixedRadixCounter counter = new MixedRadixCounter(radices);
        do {
            StringBuilder digits = new StringBuilder();
            for (int digit : counter.digits()) {
                digits.append(digit);
            }
            combinations.add(digits.toString());
        } while (counter.next());
        return combinations;
    }

    @Test
    @DisplayName("Should enumerate combinations with the last position fastest")
    void testRowMajorOrder() {
        assertThat(enumerate(2, 3)).containsExactly("00", "01", "02", "10", "11", "12");
    }

    @Test
    @DisplayName("Should wrap back to zero after the last combination")
    void testWrapAround() {
        MixedRadixCounter counter = new MixedRadixCounter(new int[]{2});
        assertThat(counter.next()).isTrue();
        assertThat(counter.next()).isFalse();
        assertThat(counter.digits()).containsExactly(0);
    }

    @Test
    @DisplayName("Should yield exactly one empty combination with no positions")
    void testEmptyRadices() {
        assertThat(enumerate()).containsExactly("");
        assertThat(MixedRadixCounter.combinations(new int[0])).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count combinations as the product of the radices")
    void testCombinations() {
        assertThat(MixedRadixCounter.combinations(new int[]{2, 3, 4})).isEqualTo(24);
        assertThat(enumerate(2, 3, 4)).hasSize(24).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should reject radices below one and overflowing products")
    void testInvalidRadices() {
        assertThatThrownBy(() -> new MixedRadixCounter(new int[]{2, 0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MixedRadixCounter.combinations(new int[]{1 << 16, 1 << 16}))
                .isInstanceOf(ArithmeticException.class);
    }
}

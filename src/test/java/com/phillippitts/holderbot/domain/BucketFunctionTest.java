package com.phillippitts.holderbot.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BucketFunctionTest {

    @Test
    void projectsIdIntoBuckets() {
        assertThat(BucketFunction.MOD_10.apply(120)).isZero();
        assertThat(BucketFunction.MOD_15.apply(121)).isEqualTo(1);
        assertThat(BucketFunction.MOD_20.apply(125)).isEqualTo(5);
        assertThat(BucketFunction.DIV_50.apply(120)).isEqualTo(2);
        assertThat(BucketFunction.DIV_100.apply(120)).isEqualTo(1);
    }

    @Test
    void keysRoundTrip() {
        for (BucketFunction f : BucketFunction.values()) {
            assertThat(BucketFunction.fromKey(f.key())).contains(f);
        }
        assertThat(BucketFunction.fromKey("mod7")).isEmpty();
    }

    @Test
    void onlyPlainDigitsAreNumericIds() {
        assertThat(BucketFunction.numericId(" 120 ")).hasValue(120);
        assertThat(BucketFunction.numericId("007")).hasValue(7);
        assertThat(BucketFunction.numericId("A-17")).isEmpty();
        assertThat(BucketFunction.numericId("-5")).isEmpty();
        assertThat(BucketFunction.numericId("")).isEmpty();
        assertThat(BucketFunction.numericId(null)).isEmpty();
        assertThat(BucketFunction.numericId("1234567890123456789")).isEmpty();
    }
}

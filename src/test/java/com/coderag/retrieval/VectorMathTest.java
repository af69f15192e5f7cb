package com.coderag.retrieval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    @Test
    void cosineOfKnownVectors() {
        assertThat(VectorMath.cosine(new float[]{1, 0}, new float[]{1, 0})).isCloseTo(1.0, within(1e-9));
        assertThat(VectorMath.cosine(new float[]{1, 0}, new float[]{0, 1})).isCloseTo(0.0, within(1e-9));
        assertThat(VectorMath.cosine(new float[]{1, 0}, new float[]{-1, 0})).isCloseTo(-1.0, within(1e-9));
        assertThat(VectorMath.cosine(new float[]{1, 1}, new float[]{1, 0})).isCloseTo(Math.sqrt(0.5), within(1e-6));
    }

    @Test
    void cosineStaysWithinBounds() {
        float[] a = {0.1f, 0.2f, 0.3f, 0.4f};
        float[] b = {0.1f, 0.2f, 0.3f, 0.4f};

        double score = VectorMath.cosine(a, b);

        assertThat(score).isBetween(-1.0, 1.0).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void zeroVectorScoresZeroInsteadOfNaN() {
        assertThat(VectorMath.cosine(new float[]{0, 0, 0}, new float[]{1, 2, 3})).isZero();
    }

    @Test
    void rejectsDifferentLengths() {
        assertThatThrownBy(() -> VectorMath.cosine(new float[]{1, 2}, new float[]{1, 2, 3}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeProducesUnitLength() {
        float[] normalized = VectorMath.normalize(new float[]{3, 4});

        assertThat(normalized).containsExactly(new float[]{0.6f, 0.8f}, within(1e-6f));
        assertThat(VectorMath.norm(normalized)).isCloseTo(1.0, within(1e-6));

        float[] zero = {0, 0};
        assertThat(VectorMath.normalize(zero)).containsExactly(0f, 0f).isNotSameAs(zero);
    }
}

/* (C)2026 */
package com.ammann.vibration.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DiscreteFourierTransformTest {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 8, 12, 100, 257, 1000})
    void matchesDirectEvaluation(int n) {
        Random random = new Random(n);
        double[] signal = new double[n];
        for (int i = 0; i < n; i++) {
            signal[i] = random.nextDouble() * 2 - 1;
        }

        Complex[] actual = DiscreteFourierTransform.forward(signal);
        Complex[] expected = directTransform(signal);

        assertThat(actual).hasSize(n);
        for (int k = 0; k < n; k++) {
            assertThat(actual[k].getReal()).as("re[%d]", k).isCloseTo(expected[k].getReal(), within(1e-9));
            assertThat(actual[k].getImaginary()).as("im[%d]", k).isCloseTo(expected[k].getImaginary(), within(1e-9));
        }
    }

    @Test
    void pureToneLandsInItsBin() {
        int n = 30;
        double[] signal = new double[n];
        for (int i = 0; i < n; i++) {
            signal[i] = Math.cos(2 * Math.PI * 4 * i / n);
        }

        Complex[] bins = DiscreteFourierTransform.forward(signal);

        assertThat(bins[4].abs()).isCloseTo(n / 2.0, within(1e-9));
        assertThat(bins[3].abs()).isCloseTo(0.0, within(1e-9));
        assertThat(bins[0].abs()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void emptySignalIsRejected() {
        assertThatThrownBy(() -> DiscreteFourierTransform.forward(new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Complex[] directTransform(double[] signal) {
        int n = signal.length;
        Complex[] result = new Complex[n];
        for (int k = 0; k < n; k++) {
            double re = 0;
            double im = 0;
            for (int j = 0; j < n; j++) {
                double angle = -2 * Math.PI * (((long) j * k) % n) / n;
                re += signal[j] * Math.cos(angle);
                im += signal[j] * Math.sin(angle);
            }
            result[k] = new Complex(re, im);
        }
        return result;
    }
}

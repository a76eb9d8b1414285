/* (C)2026 */
package com.ammann.vibration.service;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Forward discrete Fourier transform of real input of any length.
 *
 * <p>Power-of-two lengths go straight to the commons-math radix-2 transformer. Other
 * lengths are evaluated exactly with Bluestein's chirp-z algorithm, which rewrites the
 * transform as a convolution and evaluates that convolution with the same radix-2
 * transformer on a zero-padded length. No padding leaks into the result: bin {@code k}
 * is {@code sum_j x[j] * exp(-2 pi i j k / n)} for the original {@code n}.
 */
public final class DiscreteFourierTransform {

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private DiscreteFourierTransform() {}

    /**
     * Computes the unnormalized forward transform.
     *
     * @param signal real-valued samples, at least one
     * @return {@code signal.length} complex bins
     */
    public static Complex[] forward(double[] signal) {
        int n = signal.length;
        if (n == 0) {
            throw new IllegalArgumentException("Cannot transform an empty signal");
        }
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            return FFT.transform(signal, TransformType.FORWARD);
        }
        return bluestein(signal);
    }

    private static Complex[] bluestein(double[] signal) {
        int n = signal.length;
        int m = nextPowerOfTwo(2 * n - 1);

        // chirp w[k] = exp(-i pi k^2 / n); k^2 is reduced mod 2n to keep the angle exact
        Complex[] chirp = new Complex[n];
        long period = 2L * n;
        for (int k = 0; k < n; k++) {
            long kSquared = ((long) k * k) % period;
            double angle = Math.PI * kSquared / n;
            chirp[k] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        for (int i = 0; i < m; i++) {
            a[i] = Complex.ZERO;
            b[i] = Complex.ZERO;
        }
        for (int k = 0; k < n; k++) {
            a[k] = chirp[k].multiply(signal[k]);
        }
        b[0] = chirp[0].conjugate();
        for (int k = 1; k < n; k++) {
            Complex conj = chirp[k].conjugate();
            b[k] = conj;
            b[m - k] = conj;
        }

        Complex[] aHat = FFT.transform(a, TransformType.FORWARD);
        Complex[] bHat = FFT.transform(b, TransformType.FORWARD);
        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = aHat[i].multiply(bHat[i]);
        }
        Complex[] convolution = FFT.transform(product, TransformType.INVERSE);

        Complex[] result = new Complex[n];
        for (int k = 0; k < n; k++) {
            result[k] = chirp[k].multiply(convolution[k]);
        }
        return result;
    }

    private static int nextPowerOfTwo(int value) {
        int power = Integer.highestOneBit(value);
        return power == value ? value : power << 1;
    }
}

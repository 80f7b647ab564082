/*
 * Copyright (c) 2015 LCMS Project Authors.
 * 
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * 
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 * 
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.seasonality.timeseries;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import net.larse.seasonality.helper.SeriesHelper;
import org.apache.commons.math.complex.Complex;

/**
 * Radix-2 discrete Fourier transform of a real-valued series.
 *
 * <p>The series is zero-padded to the smallest power of two that holds it and then transformed in
 * place. The butterflies are applied iteratively after a bit-reversal permutation; this produces
 * the same values (up to rounding) as the recursive decimation-in-time split into even and odd
 * samples, without allocating at each level.
 *
 * <p>Typical use:
 * <pre>
 *   SpectralTransform transform = new SpectralTransform(signal);
 *   transform.compute();
 *   List&lt;DominantFrequency&gt; top = transform.getDominantFrequencies(5);
 * </pre>
 *
 * <p>Instances are not thread safe, but they share no state, so separate instances can be used
 * from separate threads.
 */
public final class SpectralTransform {
  // The unpadded input, length n.
  private final double[] samples;

  // Transform length N, a power of two >= n.
  private final int size;

  // The complex buffer of length N, split into real and imaginary parts.
  private final double[] real;
  private final double[] imag;

  // exp(-2*pi*i*k/N) for k in [0, N/2).
  private final double[] cosTable;
  private final double[] sinTable;

  private boolean computed;

  /**
   * @param signal the series to transform. Must be non-empty and finite. It is copied.
   */
  public SpectralTransform(double[] signal) {
    SeriesHelper.checkSignal(signal);
    this.samples = signal.clone();
    this.size = SeriesHelper.nextPowerOfTwo(signal.length);
    this.real = new double[size];
    this.imag = new double[size];
    this.cosTable = new double[size / 2];
    this.sinTable = new double[size / 2];
    fillTwiddles(cosTable, sinTable, size);
  }

  /** The length n of the original series. */
  public int getSignalLength() {
    return samples.length;
  }

  /** The padded transform length N. */
  public int getTransformLength() {
    return size;
  }

  public boolean isComputed() {
    return computed;
  }

  /**
   * Pad the series with zeros to the transform length and apply the forward transform. Each call
   * starts again from the original samples, so calling it twice gives the same spectrum.
   */
  public void compute() {
    System.arraycopy(samples, 0, real, 0, samples.length);
    Arrays.fill(real, samples.length, size, 0.0);
    Arrays.fill(imag, 0.0);
    transform(real, imag, cosTable, sinTable);
    computed = true;
  }

  /** A copy of the full transformed sequence, length N. */
  public Complex[] getTransformed() {
    checkComputed();
    Complex[] result = new Complex[size];
    for (int i = 0; i < size; i++) {
      result[i] = entry(i);
    }
    return result;
  }

  /**
   * The inverse transform of the current buffer, length N. For a computed transform this is the
   * zero-padded input. The buffer itself is left untouched.
   */
  public Complex[] getInverse() {
    checkComputed();
    double[] re = real.clone();
    double[] im = imag.clone();
    conjugate(im);
    transform(re, im, cosTable, sinTable);
    Complex[] result = new Complex[size];
    for (int i = 0; i < size; i++) {
      result[i] = new Complex(re[i] / size, -im[i] / size);
    }
    return result;
  }

  /**
   * Absolute values of bins [0, N/2). The upper half mirrors the lower half for real input and is
   * not returned.
   */
  public double[] getMagnitudeSpectrum() {
    checkComputed();
    double[] magnitude = new double[size / 2];
    for (int i = 0; i < magnitude.length; i++) {
      magnitude[i] = entry(i).abs();
    }
    return magnitude;
  }

  /** Principal arguments of bins [0, N/2), aligned with getMagnitudeSpectrum(). */
  public double[] getPhaseSpectrum() {
    checkComputed();
    double[] phase = new double[size / 2];
    for (int i = 0; i < phase.length; i++) {
      phase[i] = entry(i).getArgument();
    }
    return phase;
  }

  /**
   * Rank bins [1, N/2) by descending magnitude and return the first topK. Bin 0 is never
   * returned. Bins of equal magnitude keep their bin order.
   */
  public List<DominantFrequency> getDominantFrequencies(int topK) {
    Preconditions.checkArgument(topK >= 0, "topK must not be negative: %s", topK);
    double[] magnitude = getMagnitudeSpectrum();

    List<DominantFrequency> ranked = new ArrayList<>();
    for (int i = 1; i < magnitude.length; i++) {
      ranked.add(new DominantFrequency(i, magnitude[i]));
    }
    // List.sort is stable, which keeps ties in bin order.
    ranked.sort(Comparator.comparingDouble((DominantFrequency f) -> f.magnitude).reversed());

    return new ArrayList<>(ranked.subList(0, Math.min(topK, ranked.size())));
  }

  /**
   * Forward transform of (re, im) in place. The length must already be a power of two; use an
   * instance and compute() for arbitrary lengths.
   */
  public static void forward(double[] re, double[] im) {
    checkRawInput(re, im);
    int n = re.length;
    double[] cos = new double[n / 2];
    double[] sin = new double[n / 2];
    fillTwiddles(cos, sin, n);
    transform(re, im, cos, sin);
  }

  /**
   * Inverse transform of (re, im) in place: conjugate, forward transform, conjugate and divide by
   * the length.
   */
  public static void inverse(double[] re, double[] im) {
    checkRawInput(re, im);
    int n = re.length;
    conjugate(im);
    forward(re, im);
    conjugate(im);
    for (int i = 0; i < n; i++) {
      re[i] /= n;
      im[i] /= n;
    }
  }

  private Complex entry(int i) {
    return new Complex(real[i], imag[i]);
  }

  private void checkComputed() {
    Preconditions.checkState(computed, "compute() has not been called");
  }

  private static void checkRawInput(double[] re, double[] im) {
    Preconditions.checkArgument(re.length == im.length,
        "real and imaginary parts differ in length: %s != %s", re.length, im.length);
    Preconditions.checkArgument(SeriesHelper.isPowerOfTwo(re.length),
        "transform length must be a power of two: %s", re.length);
  }

  private static void conjugate(double[] im) {
    for (int i = 0; i < im.length; i++) {
      im[i] = -im[i];
    }
  }

  @VisibleForTesting
  static void fillTwiddles(double[] cos, double[] sin, int n) {
    for (int k = 0; k < cos.length; k++) {
      double angle = -2.0 * Math.PI * k / n;
      cos[k] = Math.cos(angle);
      sin[k] = Math.sin(angle);
    }
  }

  /*
   * Iterative decimation-in-time. After the bit-reversal permutation, the pass with half width h
   * combines pairs of length-h transforms: for k in [0, h)
   *   out[k]     = even[k] + w^k * odd[k]
   *   out[k + h] = even[k] - w^k * odd[k]
   * with w = exp(-2*pi*i / 2h), read from the length-N table at stride N / 2h.
   */
  private static void transform(double[] re, double[] im, double[] cos, double[] sin) {
    int n = re.length;
    if (n <= 1) {
      return;
    }

    for (int i = 1, j = 0; i < n; i++) {
      int bit = n >> 1;
      for (; (j & bit) != 0; bit >>= 1) {
        j ^= bit;
      }
      j ^= bit;

      if (i < j) {
        double t = re[i];
        re[i] = re[j];
        re[j] = t;
        t = im[i];
        im[i] = im[j];
        im[j] = t;
      }
    }

    for (int half = 1; half < n; half <<= 1) {
      int stride = n / (half << 1);
      for (int k = 0; k < half; k++) {
        double c = cos[k * stride];
        double s = sin[k * stride];
        for (int lo = k; lo < n; lo += half << 1) {
          int hi = lo + half;
          double tr = c * re[hi] - s * im[hi];
          double ti = s * re[hi] + c * im[hi];
          re[hi] = re[lo] - tr;
          im[hi] = im[lo] - ti;
          re[lo] += tr;
          im[lo] += ti;
        }
      }
    }
  }
}

package net.larse.seasonality.timeseries;

/**
 * A frequency bin of a transformed series together with its magnitude.
 *
 * @see SpectralTransform#getDominantFrequencies(int)
 */
public final class DominantFrequency {
  /**
   * Index of the bin in the transform, never 0 (the DC component).
   */
  public final int bin;

  /**
   * Absolute value of the transformed entry at bin.
   */
  public final double magnitude;

  public DominantFrequency(int bin, double magnitude) {
    this.bin = bin;
    this.magnitude = magnitude;
  }

  /**
   * Period in samples of this bin when read against a series of the given length, ie: length / bin.
   */
  public double getPeriod(int length) {
    return (double) length / bin;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DominantFrequency)) {
      return false;
    }
    DominantFrequency other = (DominantFrequency) o;
    return bin == other.bin && Double.compare(magnitude, other.magnitude) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * bin + Double.hashCode(magnitude);
  }

  @Override
  public String toString() {
    return String.format("DominantFrequency{bin=%d, magnitude=%.4f}", bin, magnitude);
  }
}

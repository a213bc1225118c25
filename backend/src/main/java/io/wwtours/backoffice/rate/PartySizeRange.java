package io.wwtours.backoffice.rate;

/** Inclusive guest-count bracket, e.g. 3-4 guests. */
public record PartySizeRange(int min, int max) {

  public PartySizeRange {
    if (min < 1 || max < min) {
      throw new IllegalArgumentException("Invalid party size range " + min + "-" + max);
    }
  }

  public boolean contains(int partySize) {
    return partySize >= min && partySize <= max;
  }

  public int width() {
    return max - min;
  }

  public String label() {
    return min + "-" + max + " guests";
  }
}

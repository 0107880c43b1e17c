package com.scholary.subtitle.editor.timeline;

/** Resolution of possibly negative ordinal references against a timeline length. */
public final class OrdinalIndex {

  private OrdinalIndex() {}

  /**
   * Resolve an ordinal against a sequence of {@code length} elements.
   *
   * <p>Non-negative values are positions; negative values count back from the end, so {@code -1}
   * is the last element and {@code -length} the first.
   *
   * @param index the raw ordinal
   * @param length the current number of elements
   * @return a position in {@code [0, length)}
   * @throws SubtitleIndexOutOfRangeException if the ordinal falls outside the sequence
   */
  public static int resolve(int index, int length) {
    int resolved = index < 0 ? length + index : index;
    if (resolved < 0 || resolved >= length) {
      throw new SubtitleIndexOutOfRangeException(index, length);
    }
    return resolved;
  }
}

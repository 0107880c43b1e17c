package com.scholary.subtitle.editor.timeline;

import java.util.Objects;

/**
 * A single change to a timeline: either an insertion or a partial update of one entry.
 *
 * <p>The update index is an ordinal into the insertion-ordered timeline. Negative values count
 * from the end ({@code -1} is the most recently added subtitle) and are resolved by {@link
 * OrdinalIndex} when the mutation is applied.
 */
public interface Mutation {

  Kind kind();

  enum Kind {
    INSERT,
    UPDATE
  }

  /** Append a new subtitle. */
  record Insert(SubtitleDraft draft) implements Mutation {

    public Insert {
      Objects.requireNonNull(draft, "draft");
    }

    @Override
    public Kind kind() {
      return Kind.INSERT;
    }
  }

  /** Overlay the present fields of {@code patch} onto the subtitle at {@code index}. */
  record Update(int index, SubtitlePatch patch) implements Mutation {

    public Update {
      Objects.requireNonNull(patch, "patch");
    }

    @Override
    public Kind kind() {
      return Kind.UPDATE;
    }
  }
}

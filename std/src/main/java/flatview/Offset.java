//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.Objects;

/**
 * The outcome of a bounded offset: where the walk stopped, and whether it took every requested
 * step or stopped at its limit.
 */
public final class Offset<I> {

  /** Returns an offset that took every requested step and landed on {@code index}. */
  public static <I> Offset<I> completed (I index) {
    return new Offset<I>(index, true);
  }

  /** Returns an offset that hit {@code limit} before taking every requested step. */
  public static <I> Offset<I> limited (I limit) {
    return new Offset<I>(limit, false);
  }

  /** The position the walk stopped at. */
  public I index () { return index; }

  /** Whether every requested step was taken. */
  public boolean isCompleted () { return completed; }

  @Override public boolean equals (Object other) {
    if (!(other instanceof Offset)) return false;
    Offset<?> o = (Offset<?>)other;
    return completed == o.completed && Objects.equals(index, o.index);
  }

  @Override public int hashCode () {
    return Objects.hashCode(index) ^ (completed ? 1 : 0);
  }

  @Override public String toString () {
    return (completed ? "completed(" : "limited(") + index + ")";
  }

  private Offset (I index, boolean completed) {
    this.index = index;
    this.completed = completed;
  }

  private final I index;
  private final boolean completed;
}

//
// Flatview - lazy flattened views over nested collections
//

package flatview;

/**
 * A per-element operation that may fail with a checked exception of type {@code X}.
 */
@FunctionalInterface
public interface ThrowingConsumer<E, X extends Exception> {

  void accept (E elem) throws X;
}

//
// Flatview - lazy flattened views over nested collections
//

package flatview;

/**
 * A {@link FlattenedCollectionView} over a base whose outer and inner collections can both step
 * backward. Adds {@link #indexBefore}; every forward operation is inherited.
 */
public class BidirectionalFlattenedCollectionView<E, O extends Comparable<? super O>,
                                                  I extends Comparable<? super I>>
  extends FlattenedCollectionView<E, O, I>
  implements BiIndexed<E, FlattenedIndex<O, I>> {

  public BidirectionalFlattenedCollectionView (BiIndexed<? extends BiIndexed<E, I>, O> base) {
    super(base);
  }

  /**
   * Returns the position of the element before {@code index}, skipping back over empty inner
   * collections.
   * @throws IndexOutOfBoundsException if {@code index} is the start index.
   */
  @Override public FlattenedIndex<O, I> indexBefore (FlattenedIndex<O, I> index) {
    return stepBack(index);
  }
}

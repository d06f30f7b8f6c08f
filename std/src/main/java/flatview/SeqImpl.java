//
// Flatview - lazy flattened views over nested collections
//

package flatview;

import java.util.Iterator;
import java.util.NoSuchElementException;

class SeqImpl {

  static abstract class Base<E> implements Seq<E> {
    public Iterator<E> iterator () {
      return new Iterables.ImmIterator<E>() {
        private int index = 0;
        public boolean hasNext () {
          return index < size();
        }
        public E next () {
          if (index < size()) try { return get(index); } finally { index += 1; }
          else throw new NoSuchElementException();
        }
      };
    }

    @Override public boolean equals (Object other) {
      if (other == this) return true;
      if (!(other instanceof Seq)) return false;
      Seq<?> oseq = (Seq<?>)other;
      return size() == oseq.size() && Iterables.equals(this, oseq);
    }
    @Override public int hashCode () { return Iterables.hashCode(this); }
    @Override public String toString () { return Iterables.toString(this); }
  }

  static final Seq<Object> EMPTY = new Base<Object>() {
    public int size () { return 0; }
    public Object get (int index) { throw new IndexOutOfBoundsException(index + " not in [0,0)"); }
    public Iterator<Object> iterator () { return Iterables.EMPTY_ITER; }
  };

  static class Seq1<E> extends Base<E> {
    private final E elem0;
    public Seq1 (E elem) {
      elem0 = elem;
    }

    public int size () { return 1; }
    public E get (int index) {
      if (index == 0) return elem0;
      else throw new IndexOutOfBoundsException(index + " not in [0,1)");
    }
  }

  static class Seq2<E> extends Base<E> {
    private final E elem0;
    private final E elem1;

    public Seq2 (E elem0, E elem1) {
      this.elem0 = elem0;
      this.elem1 = elem1;
    }

    public int size () { return 2; }
    public E get (int index) {
      switch (index) {
        case 0: return elem0;
        case 1: return elem1;
        default: throw new IndexOutOfBoundsException(index + " not in [0,2)");
      }
    }
  }

  static class SeqN<E> extends Base<E> {
    private final Object[] elems;

    public SeqN (Object[] elems) {
      this.elems = elems;
    }

    public int size () { return elems.length; }
    public E get (int index) {
      Indexes.checkIndex(index, elems.length);
      @SuppressWarnings("unchecked") E elem = (E)elems[index];
      return elem;
    }
  }

  // a read-only view over a JDK list; reads go straight through to it
  static class Wrapped<E> extends Base<E> {
    private final java.util.List<? extends E> list;

    public Wrapped (java.util.List<? extends E> list) {
      if (list == null) throw new IllegalArgumentException("Wrapped list must not be null.");
      this.list = list;
    }

    public int size () { return list.size(); }
    public E get (int index) {
      Indexes.checkIndex(index, list.size());
      return list.get(index);
    }
  }
}

//
// Flatview - lazy flattened views over nested collections
//

package flatview;

class Indexes {

  static final void checkIndex (int index, int max) {
    if (index < 0 || index >= max) throw new IndexOutOfBoundsException(
      index + " not in [0," + max + ")");
  }

  static final void checkPosition (int index, int max) {
    if (index < 0 || index > max) throw new IndexOutOfBoundsException(
      index + " not in [0," + max + "]");
  }

  static UnsupportedOperationException backwardUnsupported (Object coll) {
    return new UnsupportedOperationException(
      coll.getClass().getName() + " is forward-only and cannot step backward");
  }
}

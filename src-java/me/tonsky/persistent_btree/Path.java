package me.tonsky.persistent_btree;

import java.util.*;

/**
 * Read-only path holding plain references to the nodes it visits. Used by
 * indices, iterators and the merge engine; never changes the tree.
 */
@SuppressWarnings("unchecked")
public class Path<Key, Value> extends APath<Key, Value> {

  public Path(Node<Key, Value> root, Comparator<Key> cmp) {
    super(cmp);
    reset(root, root._count);
  }

  public static <Key, Value> Path<Key, Value> startOf(Node<Key, Value> root, Comparator<Key> cmp) {
    Path<Key, Value> path = new Path<Key, Value>(root, cmp);
    path.descendToOffset(0);
    return path;
  }

  // The end spot right after the last element of the root
  public static <Key, Value> Path<Key, Value> endOf(Node<Key, Value> root, Comparator<Key> cmp) {
    Path<Key, Value> path = new Path<Key, Value>(root, cmp);
    path.pushToSlots(root._len, root._count);
    return path;
  }

  public static <Key, Value> Path<Key, Value> atOffset(Node<Key, Value> root, int offset, Comparator<Key> cmp) {
    if (offset < 0 || offset > root._count)
      throw new IndexOutOfBoundsException("Offset " + offset + " out of bounds for count " + root._count);
    Path<Key, Value> path = new Path<Key, Value>(root, cmp);
    path.descendToOffset(offset);
    return path;
  }

  public static <Key, Value> Path<Key, Value> atKey(Node<Key, Value> root, Key key, Selector selector, Comparator<Key> cmp) {
    Path<Key, Value> path = new Path<Key, Value>(root, cmp);
    path.descendToKey(key, selector);
    return path;
  }

  public Path<Key, Value> copy() {
    Path<Key, Value> path = new Path<Key, Value>(_root, _cmp);
    path._nodes = _nodes.clone();
    path._slots = _slots.clone();
    path._length = _length;
    path._slotCount = _slotCount;
    path._offset = _offset;
    return path;
  }

  @Override
  public int count() {
    return _root._count;
  }

  @Override
  protected int popFromSlots() {
    assert _slotCount == _length;
    int slot = _slots[--_slotCount];
    Node<Key, Value> node = node();
    _offset += node._count - node.offsetOfSlot(slot);
    return slot;
  }

  @Override
  protected Node<Key, Value> popFromPath() {
    assert _length > 1 && _slotCount == _length - 1;
    Node<Key, Value> child = _nodes[--_length];
    _nodes[_length] = null;
    return child;
  }

  @Override
  protected Node<Key, Value> pushToPath() {
    assert _slotCount == _length;
    grow();
    Node<Key, Value> child = node()._children[_slots[_slotCount - 1]];
    _nodes[_length++] = child;
    return child;
  }

  @Override
  protected void pushToSlots(int slot, int offsetOfSlot) {
    assert _slotCount == _length - 1;
    _offset -= node()._count - offsetOfSlot;
    _slots[_slotCount++] = slot;
  }

  // Merge engine support

  // Parent of the current node, null at the root
  Node<Key, Value> parent() {
    return _length > 1 ? _nodes[_length - 2] : null;
  }

  // Moves n slots to the right in the current node, jumping over the subtrees between them
  void skipForward(int n) {
    Node<Key, Value> node = node();
    int slot = slot();
    if (!node.isLeaf())
      for (int i = 0; i < n; ++i)
        _offset += node._children[slot + i + 1]._count;
    _offset += n;
    _slots[_slotCount - 1] = slot + n;
    if (_offset != count())
      ascendToKey();
  }

  /**
   * Drops the deepest node, moving to the element after its subtree. At the
   * root this moves to the end. Returns true iff the path is at the end.
   */
  boolean ascendOneLevel() {
    if (_length == 1) {
      _offset = count();
      if (_slotCount == 1)
        _slots[0] = node()._len;
      else
        _slots[_slotCount++] = node()._len;
      return true;
    }
    popFromSlots();
    popFromPath();
    return isAtEnd();
  }

  private boolean match(Key k, Key key, boolean inclusive) {
    int d = _cmp.compare(k, key);
    return inclusive ? d <= 0 : d < 0;
  }

  /**
   * Moves past the next run of elements below {@code key} (or equal to it when
   * {@code inclusive}), appending it to {@code builder} unless that is null.
   * A run is either a single element or a range of slots of one node together
   * with the subtrees between them. Requires the current element to qualify.
   */
  void nextPart(Key key, boolean inclusive, Builder<Key, Value> builder) {
    assert !isAtEnd() && match(key(), key, inclusive);

    // Climb to the furthest ancestor whose leftmost subtree is known to qualify
    boolean includeLeftmostSubtree = false;
    if (slot() == 0 && node().isLeaf()) {
      while (slot() == 0) {
        Node<Key, Value> parent = parent();
        if (parent == null)
          break;
        int parentSlot = _slots[_slotCount - 2];
        if (parentSlot >= parent._len || !match(parent._keys[parentSlot], key, inclusive))
          break;
        ascendOneLevel();
        includeLeftmostSubtree = true;
      }
    }
    Node<Key, Value> node = node();
    if (!includeLeftmostSubtree && !node.isLeaf()) {
      if (builder != null)
        builder.append(node._keys[slot()], node._values[slot()]);
      moveForward();
      return;
    }

    int startSlot = slot();
    int endSlot = startSlot + 1;
    while (endSlot < node._len && match(node._keys[endSlot], key, inclusive))
      endSlot += 1;

    Map.Entry<Key, Value> last = node.isLeaf() ? null : node._children[endSlot].last();
    if (last == null || match(last.getKey(), key, inclusive)) {
      if (builder != null)
        builder.appendSlice(node, startSlot, endSlot);
      skipForward(endSlot - startSlot);
      return;
    }
    // The last subtree has elements that do not qualify
    if (endSlot == startSlot + 1) {
      if (builder != null)
        builder.append(node._children[startSlot]);
      return;
    }
    if (builder != null)
      builder.appendSlice(node, startSlot, endSlot - 1);
    skipForward(endSlot - startSlot - 1);
  }

  // Moves past every element equal to key, appending them to builder unless it is null
  void skipEqual(Key key, Builder<Key, Value> builder) {
    while (!isAtEnd() && _cmp.compare(key(), key) == 0)
      nextPart(key, true, builder);
  }
}

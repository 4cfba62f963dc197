package me.tonsky.persistent_btree;

import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import clojure.lang.*;

@SuppressWarnings("unchecked")
public class Node<Key, Value> {
  // Max children per node
  public final int _order;

  // 0 for leaves, 1+ for branches
  public final int _depth;

  // >= 0
  public int _len;

  // Elements in this node and all of its descendants
  public int _count;

  // NotNull
  // Only valid [0 ... _len-1]
  public Key[] _keys;
  public Value[] _values;

  // Null for leaves
  // Only valid [0 ... _len]
  public Node<Key, Value>[] _children;

  // Nullable
  // A node may only be changed in place by the holder of its live _edit
  public final AtomicBoolean _edit;

  public Node(int order, int depth, int len, Key[] keys, Value[] values, Node<Key, Value>[] children, int count, AtomicBoolean edit) {
    assert keys.length >= len && values.length == keys.length;
    assert (depth == 0) == (children == null);

    _order    = order;
    _depth    = depth;
    _len      = len;
    _count    = count;
    _keys     = keys;
    _values   = values;
    _children = children;
    _edit     = edit;
  }

  public Node(int order, AtomicBoolean edit) {
    this(order, 0, 0, (Key[]) new Object[newLen(0, order, edit)], (Value[]) new Object[newLen(0, order, edit)], null, 0, edit);
  }

  public Node(Node<Key, Value> left, Key key, Value value, Node<Key, Value> right, AtomicBoolean edit) {
    this(left._order, left._depth + 1, 1,
         (Key[]) new Object[newLen(1, left._order, edit)],
         (Value[]) new Object[newLen(1, left._order, edit)],
         new Node[newLen(1, left._order, edit) + 1],
         left._count + 1 + right._count,
         edit);
    assert left._depth == right._depth;
    _keys[0] = key;
    _values[0] = value;
    _children[0] = left;
    _children[1] = right;
  }

  // Transient nodes get room for one element over the limit so they can overflow before a split
  protected static int newLen(int len, int order, AtomicBoolean edit) {
    if (edit != null && edit.get())
      return Math.max(len, order);
    else
      return len;
  }

  public static <Key, Value> Map.Entry<Key, Value> entry(Key key, Value value) {
    return (Map.Entry<Key, Value>) MapEntry.create(key, value);
  }

  // Limits

  public int maxKeys() {
    return _order - 1;
  }

  public int minKeys() {
    return ((_order + 1) >>> 1) - 1;
  }

  public boolean isLeaf() {
    return _children == null;
  }

  public boolean isEmpty() {
    return _count == 0;
  }

  public boolean isTooSmall() {
    return _len < minKeys();
  }

  public boolean isTooLarge() {
    return _len > maxKeys();
  }

  // Accessors

  public Key key(int slot) {
    return _keys[slot];
  }

  public Value value(int slot) {
    return _values[slot];
  }

  public Map.Entry<Key, Value> entry(int slot) {
    return entry(_keys[slot], _values[slot]);
  }

  public Node<Key, Value> child(int slot) {
    return _children[slot];
  }

  // Null for an empty subtree. Empty subtrees below the first element are passed over
  public Map.Entry<Key, Value> first() {
    if (_count == 0)
      return null;
    Node<Key, Value> node = this;
    while (node._children != null && node._children[0]._count > 0)
      node = node._children[0];
    return node.entry(0);
  }

  public Map.Entry<Key, Value> last() {
    if (_count == 0)
      return null;
    Node<Key, Value> node = this;
    while (node._children != null && node._children[node._len]._count > 0)
      node = node._children[node._len];
    return node.entry(node._len - 1);
  }

  // Ownership

  public boolean editable(AtomicBoolean edit) {
    return edit != null && _edit == edit && edit.get();
  }

  public Node<Key, Value> clone(AtomicBoolean edit) {
    int cap = newLen(_len, _order, edit);
    Key[] keys = ArrayUtil.copy(_keys, 0, _len, (Key[]) new Object[cap], 0);
    Value[] values = ArrayUtil.copy(_values, 0, _len, (Value[]) new Object[cap], 0);
    Node<Key, Value>[] children = null;
    if (_children != null)
      children = ArrayUtil.copy(_children, 0, _len + 1, new Node[cap + 1], 0);
    return new Node<Key, Value>(_order, _depth, _len, keys, values, children, _count, edit);
  }

  public Node<Key, Value> isolate(AtomicBoolean edit) {
    return editable(edit) ? this : clone(edit);
  }

  // Requires editable(edit)
  public Node<Key, Value> isolateChild(int slot, AtomicBoolean edit) {
    Node<Key, Value> child = _children[slot];
    if (child.editable(edit))
      return child;
    child = child.clone(edit);
    _children[slot] = child;
    return child;
  }

  void ensureCapacity(int len) {
    if (_keys.length < len) {
      int cap = Math.max(len, _order);
      _keys = Arrays.copyOf(_keys, cap);
      _values = Arrays.copyOf(_values, cap);
      if (_children != null)
        _children = Arrays.copyOf(_children, cap + 1);
    }
  }

  // Search

  public int searchFirst(Key key, Comparator<Key> cmp) {
    int low = 0, high = _len;
    while (low < high) {
      int mid = (high + low) >>> 1;
      int d = cmp.compare(_keys[mid], key);
      if (d < 0)
        low = mid + 1;
      else
        high = mid;
    }
    return low;
  }

  public int searchLast(Key key, Comparator<Key> cmp) {
    int low = 0, high = _len;
    while (low < high) {
      int mid = (high + low) >>> 1;
      int d = cmp.compare(_keys[mid], key);
      if (d <= 0)
        low = mid + 1;
      else
        high = mid;
    }
    return low - 1;
  }

  /**
   * Slot of the element matching {@code key} under {@code selector}, or
   * {@code (-descend - 1)} when no element of this node matches. For
   * {@link Selector#AFTER} the match is the first element with a greater key.
   */
  public int slotOf(Key key, Selector selector, Comparator<Key> cmp) {
    switch (selector) {
    case FIRST: {
      int start = searchFirst(key, cmp);
      if (start < _len && cmp.compare(_keys[start], key) == 0)
        return start;
      return -start - 1;
    }
    case LAST: {
      int end = searchLast(key, cmp);
      if (end >= 0 && cmp.compare(_keys[end], key) == 0)
        return end;
      return -(end + 1) - 1;
    }
    case ANY:
      return Arrays.binarySearch(_keys, 0, _len, key, cmp);
    case AFTER: {
      int start = searchLast(key, cmp) + 1;
      if (start < _len)
        return start;
      return -start - 1;
    }
    default:
      throw new IllegalArgumentException("Unexpected selector: " + selector);
    }
  }

  // The child to descend into after slotOf
  public static int descendSlot(int slot, Selector selector) {
    if (slot < 0)
      return -slot - 1;
    return selector == Selector.LAST ? slot + 1 : slot;
  }

  public static <Key> boolean matches(Key candidate, Key key, Selector selector, Comparator<Key> cmp) {
    int d = cmp.compare(candidate, key);
    return selector == Selector.AFTER ? d > 0 : d == 0;
  }

  // True iff the element selected by key must be inside this subtree, whatever its ancestors hold
  public boolean contains(Key key, Selector selector, Comparator<Key> cmp) {
    if (_len == 0)
      return false;
    int first = cmp.compare(key, _keys[0]);
    if (first < 0 || (first == 0 && selector == Selector.FIRST))
      return false;
    int last = cmp.compare(key, _keys[_len - 1]);
    if (last > 0 || (last == 0 && (selector == Selector.LAST || selector == Selector.AFTER)))
      return false;
    return true;
  }

  /**
   * Slot holding the element at {@code offset} within this subtree, or
   * {@code (-child - 1)} for the child whose subtree contains it.
   * {@code offset == _count} maps to slot {@code _len}.
   */
  public int slotOfOffset(int offset) {
    assert offset >= 0 && offset <= _count;
    if (offset == _count)
      return _len;
    if (_children == null)
      return offset;
    if (offset <= _count / 2) {
      int p = 0;
      for (int i = 0; i < _len; ++i) {
        int c = _children[i]._count;
        if (offset == p + c)
          return i;
        if (offset < p + c)
          return -i - 1;
        p += c + 1;
      }
      return -_len - 1;
    }
    int p = _count;
    for (int i = _len; i > 0; --i) {
      int c = _children[i]._count;
      if (offset == p - c - 1)
        return i - 1;
      if (offset > p - c - 1)
        return -i - 1;
      p -= c + 1;
    }
    return -1;
  }

  // Offset of the element in slot within this subtree; slot == _len maps to _count
  public int offsetOfSlot(int slot) {
    assert slot >= 0 && slot <= _len;
    if (_children == null)
      return slot;
    if (slot == _len)
      return _count;
    if (slot <= _len / 2)
      return slot + ArrayUtil.countAll(_children, 0, slot + 1);
    return _count - (_len - slot) - ArrayUtil.countAll(_children, slot + 1, _len + 1);
  }

  public Map.Entry<Key, Value> elementAt(int offset) {
    Node<Key, Value> node = this;
    while (true) {
      int slot = node.slotOfOffset(offset);
      if (slot >= 0)
        return node.entry(slot);
      int child = -slot - 1;
      offset -= node.offsetOfSlot(child) - node._children[child]._count;
      node = node._children[child];
    }
  }

  // In-place edits. All of these require editable(edit)

  public void insertElement(int slot, Key key, Value value) {
    assert _children == null;
    ensureCapacity(_len + 1);
    ArrayUtil.shift(_keys, slot, _len, 1);
    ArrayUtil.shift(_values, slot, _len, 1);
    _keys[slot] = key;
    _values[slot] = value;
    _len += 1;
    _count += 1;
  }

  public Map.Entry<Key, Value> removeElement(int slot) {
    assert _children == null;
    Map.Entry<Key, Value> removed = entry(slot);
    ArrayUtil.shift(_keys, slot + 1, _len, -1);
    ArrayUtil.shift(_values, slot + 1, _len, -1);
    _len -= 1;
    _count -= 1;
    return removed;
  }

  // Drops the element at slot along with the empty child beside it, at slot or slot + 1
  public Map.Entry<Key, Value> removeWithEmptyChild(int slot, int child) {
    assert _children != null && _children[child]._count == 0 && (child == slot || child == slot + 1);
    Map.Entry<Key, Value> removed = entry(slot);
    ArrayUtil.shift(_keys, slot + 1, _len, -1);
    ArrayUtil.shift(_values, slot + 1, _len, -1);
    ArrayUtil.shift(_children, child + 1, _len + 1, -1);
    _len -= 1;
    _count -= 1;
    return removed;
  }

  public void setElement(int slot, Key key, Value value) {
    _keys[slot] = key;
    _values[slot] = value;
  }

  public void insertSplinter(int slot, Splinter<Key, Value> splinter) {
    ensureCapacity(_len + 1);
    ArrayUtil.shift(_keys, slot, _len, 1);
    ArrayUtil.shift(_values, slot, _len, 1);
    ArrayUtil.shift(_children, slot + 1, _len + 1, 1);
    _keys[slot] = splinter._key;
    _values[slot] = splinter._value;
    _children[slot + 1] = splinter._node;
    _len += 1;
  }

  // Appends a separator and a subtree one level down
  public void graft(Key key, Value value, Node<Key, Value> child) {
    assert child._depth == _depth - 1;
    ensureCapacity(_len + 1);
    _keys[_len] = key;
    _values[_len] = value;
    _children[_len + 1] = child;
    _len += 1;
    _count += 1 + child._count;
  }

  public Splinter<Key, Value> split(AtomicBoolean edit) {
    assert isTooLarge();
    return split(_len / 2, edit);
  }

  // Keeps [0 ... median-1] here, moves [median+1 ... _len-1] to a new sibling
  public Splinter<Key, Value> split(int median, AtomicBoolean edit) {
    int len = _len - median - 1;
    int cap = newLen(len, _order, edit);
    Key[] keys = ArrayUtil.copy(_keys, median + 1, _len, (Key[]) new Object[cap], 0);
    Value[] values = ArrayUtil.copy(_values, median + 1, _len, (Value[]) new Object[cap], 0);
    Node<Key, Value>[] children = null;
    int count = len;
    if (_children != null) {
      children = ArrayUtil.copy(_children, median + 1, _len + 1, new Node[cap + 1], 0);
      count += ArrayUtil.countAll(children, 0, len + 1);
      Arrays.fill(_children, median + 1, _len + 1, null);
    }
    Splinter<Key, Value> splinter = new Splinter<Key, Value>(_keys[median], _values[median],
      new Node<Key, Value>(_order, _depth, len, keys, values, children, count, edit));
    Arrays.fill(_keys, median, _len, null);
    Arrays.fill(_values, median, _len, null);
    _len = median;
    _count -= count + 1;
    return splinter;
  }

  // Rebalancing

  // Requires child at slot to be balanced apart from at most one missing element
  public void fixDeficiency(int slot, AtomicBoolean edit) {
    if (!_children[slot].isTooSmall())
      return;
    if (slot > 0 && _children[slot - 1]._len > minKeys())
      rotateRight(slot, edit);
    else if (slot < _len && _children[slot + 1]._len > minKeys())
      rotateLeft(slot, edit);
    else if (slot > 0)
      collapse(slot - 1, edit);
    else
      collapse(slot, edit);
  }

  // Moves the last element of the child before slot up, and the separator down into the child at slot
  public void rotateRight(int slot, AtomicBoolean edit) {
    assert slot > 0;
    Node<Key, Value> left = isolateChild(slot - 1, edit);
    Node<Key, Value> child = isolateChild(slot, edit);
    child.ensureCapacity(child._len + 1);
    ArrayUtil.shift(child._keys, 0, child._len, 1);
    ArrayUtil.shift(child._values, 0, child._len, 1);
    child._keys[0] = _keys[slot - 1];
    child._values[0] = _values[slot - 1];
    if (child._children != null) {
      Node<Key, Value> moved = left._children[left._len];
      left._children[left._len] = null;
      ArrayUtil.shift(child._children, 0, child._len + 1, 1);
      child._children[0] = moved;
      left._count -= moved._count;
      child._count += moved._count;
    }
    child._len += 1;
    child._count += 1;
    _keys[slot - 1] = left._keys[left._len - 1];
    _values[slot - 1] = left._values[left._len - 1];
    left._keys[left._len - 1] = null;
    left._values[left._len - 1] = null;
    left._len -= 1;
    left._count -= 1;
  }

  // Moves the first element of the child after slot up, and the separator down into the child at slot
  public void rotateLeft(int slot, AtomicBoolean edit) {
    assert slot < _len;
    Node<Key, Value> child = isolateChild(slot, edit);
    Node<Key, Value> right = isolateChild(slot + 1, edit);
    child.ensureCapacity(child._len + 1);
    child._keys[child._len] = _keys[slot];
    child._values[child._len] = _values[slot];
    if (child._children != null) {
      Node<Key, Value> moved = right._children[0];
      ArrayUtil.shift(right._children, 1, right._len + 1, -1);
      child._children[child._len + 1] = moved;
      right._count -= moved._count;
      child._count += moved._count;
    }
    child._len += 1;
    child._count += 1;
    _keys[slot] = right._keys[0];
    _values[slot] = right._values[0];
    ArrayUtil.shift(right._keys, 1, right._len, -1);
    ArrayUtil.shift(right._values, 1, right._len, -1);
    right._len -= 1;
    right._count -= 1;
  }

  // Merges the children at slot and slot + 1 together with their separator
  public void collapse(int slot, AtomicBoolean edit) {
    assert slot < _len;
    Node<Key, Value> left = isolateChild(slot, edit);
    Node<Key, Value> right = _children[slot + 1];
    int len = left._len + 1 + right._len;
    left.ensureCapacity(len);
    left._keys[left._len] = _keys[slot];
    left._values[left._len] = _values[slot];
    ArrayUtil.copy(right._keys, 0, right._len, left._keys, left._len + 1);
    ArrayUtil.copy(right._values, 0, right._len, left._values, left._len + 1);
    if (left._children != null)
      ArrayUtil.copy(right._children, 0, right._len + 1, left._children, left._len + 1);
    left._len = len;
    left._count += 1 + right._count;

    ArrayUtil.shift(_keys, slot + 1, _len, -1);
    ArrayUtil.shift(_values, slot + 1, _len, -1);
    ArrayUtil.shift(_children, slot + 2, _len + 1, -1);
    _len -= 1;
  }

  // Replaces contents of this node with lo ++ [separator] ++ hi
  void concat(Node<Key, Value> lo, Key key, Value value, Node<Key, Value> hi) {
    Stitch<Key, Value> stitch = new Stitch<Key, Value>(Math.max(lo._len + 1 + hi._len, _order), _children != null)
      .node(lo)
      .element(key, value)
      .node(hi);
    _keys = stitch._keys;
    _values = stitch._values;
    if (_children != null)
      _children = stitch._children;
    _len = stitch.len();
  }

  /**
   * Appends the separator and the slots of {@code node} (same depth) to this
   * node until it holds {@code target} elements. Returns the next separator
   * and the remainder of {@code node}, or null when everything fit.
   */
  public Splinter<Key, Value> shiftSlots(Key key, Value value, Node<Key, Value> node, int target, AtomicBoolean edit) {
    assert _depth == node._depth;
    if (_len + 1 + node._len <= target) {
      int count = _count + 1 + node._count;
      concat(this, key, value, node);
      _count = count;
      return null;
    }
    int take = target - _len - 1;
    assert take >= 0;
    ensureCapacity(target);
    _keys[_len] = key;
    _values[_len] = value;
    ArrayUtil.copy(node._keys, 0, take, _keys, _len + 1);
    ArrayUtil.copy(node._values, 0, take, _values, _len + 1);
    int moved = take;
    if (_children != null) {
      ArrayUtil.copy(node._children, 0, take + 1, _children, _len + 1);
      moved += ArrayUtil.countAll(node._children, 0, take + 1);
    }
    _len = target;
    _count += 1 + moved;
    Node<Key, Value> rest = slice(node, take + 1, node._len, edit);
    return new Splinter<Key, Value>(node._keys[take], node._values[take], rest);
  }

  // Subtree operations on an editable node. Counts are kept exact on the way back up

  public Splinter<Key, Value> insert(Key key, Value value, Selector selector, Comparator<Key> cmp, AtomicBoolean edit) {
    int slot = descendSlot(slotOf(key, selector, cmp), selector);
    if (_children == null) {
      insertElement(slot, key, value);
    } else {
      Splinter<Key, Value> splinter = isolateChild(slot, edit).insert(key, value, selector, cmp, edit);
      if (splinter != null)
        insertSplinter(slot, splinter);
      _count += 1;
    }
    return isTooLarge() ? split(edit) : null;
  }

  public Splinter<Key, Value> insertAt(int offset, Key key, Value value, AtomicBoolean edit) {
    if (_children == null) {
      insertElement(offset, key, value);
    } else {
      int start = 0, slot = 0;
      for (; slot < _len; ++slot) {
        int c = _children[slot]._count;
        if (offset <= start + c)
          break;
        start += c + 1;
      }
      Splinter<Key, Value> splinter = isolateChild(slot, edit).insertAt(offset - start, key, value, edit);
      if (splinter != null)
        insertSplinter(slot, splinter);
      _count += 1;
    }
    return isTooLarge() ? split(edit) : null;
  }

  public Map.Entry<Key, Value> removeAt(int offset, AtomicBoolean edit) {
    if (_children == null)
      return removeElement(offset);
    int start = 0;
    for (int slot = 0; slot <= _len; ++slot) {
      int c = _children[slot]._count;
      Map.Entry<Key, Value> removed;
      if (offset < start + c) {
        removed = isolateChild(slot, edit).removeAt(offset - start, edit);
      } else if (offset == start + c) {
        if (c == 0)
          return removeWithEmptyChild(slot, slot);
        removed = entry(slot);
        Map.Entry<Key, Value> predecessor = isolateChild(slot, edit).removeLast(edit);
        setElement(slot, predecessor.getKey(), predecessor.getValue());
      } else {
        start += c + 1;
        continue;
      }
      _count -= 1;
      fixDeficiency(slot, edit);
      return removed;
    }
    throw new IndexOutOfBoundsException("Offset " + offset + " out of subtree of " + _count);
  }

  public Map.Entry<Key, Value> removeFirst(AtomicBoolean edit) {
    if (_children == null)
      return removeElement(0);
    if (_children[0]._count == 0)
      return removeWithEmptyChild(0, 0);
    Map.Entry<Key, Value> removed = isolateChild(0, edit).removeFirst(edit);
    _count -= 1;
    fixDeficiency(0, edit);
    return removed;
  }

  public Map.Entry<Key, Value> removeLast(AtomicBoolean edit) {
    if (_children == null)
      return removeElement(_len - 1);
    if (_children[_len]._count == 0)
      return removeWithEmptyChild(_len - 1, _len);
    Map.Entry<Key, Value> removed = isolateChild(_len, edit).removeLast(edit);
    _count -= 1;
    fixDeficiency(_len, edit);
    return removed;
  }

  // Returns the replaced element
  public Map.Entry<Key, Value> setElementAt(int offset, Key key, Value value, AtomicBoolean edit) {
    Node<Key, Value> node = this;
    while (true) {
      int slot = node.slotOfOffset(offset);
      if (slot >= 0) {
        Map.Entry<Key, Value> old = node.entry(slot);
        node.setElement(slot, key, value);
        return old;
      }
      int child = -slot - 1;
      offset -= node.offsetOfSlot(child) - node._children[child]._count;
      node = node.isolateChild(child, edit);
    }
  }

  // Structural operations producing new nodes

  /**
   * New node holding slots [from ... to-1] of {@code node} together with the
   * children around them. An empty range of a branch yields its single child.
   */
  public static <Key, Value> Node<Key, Value> slice(Node<Key, Value> node, int from, int to, AtomicBoolean edit) {
    assert 0 <= from && from <= to && to <= node._len;
    if (node._children != null && from == to)
      return node._children[from].clone(edit);
    int len = to - from;
    int cap = newLen(len, node._order, edit);
    Key[] keys = ArrayUtil.copy(node._keys, from, to, (Key[]) new Object[cap], 0);
    Value[] values = ArrayUtil.copy(node._values, from, to, (Value[]) new Object[cap], 0);
    Node<Key, Value>[] children = null;
    int count = len;
    if (node._children != null) {
      children = ArrayUtil.copy(node._children, from, to + 1, new Node[cap + 1], 0);
      count += ArrayUtil.countAll(children, 0, len + 1);
    }
    return new Node<Key, Value>(node._order, node._depth, len, keys, values, children, count, edit);
  }

  /**
   * Balanced tree holding the elements of {@code left}, the separator, then
   * the elements of {@code right}. Grafts the shallower tree onto the spine
   * of the taller one. Neither input is changed unless it is editable(edit).
   */
  public static <Key, Value> Node<Key, Value> join(Node<Key, Value> left, Key key, Value value, Node<Key, Value> right, AtomicBoolean edit) {
    if (left._order != right._order)
      throw new IllegalArgumentException("Cannot join nodes of order " + left._order + " and " + right._order);
    int delta = left._depth - right._depth;
    boolean append = delta >= 0;
    Node<Key, Value> stock = (append ? left : right).isolate(edit);
    Node<Key, Value> scion = append ? right : left;

    Node<Key, Value>[] path = new Node[Math.abs(delta) + 1];
    Node<Key, Value> node = stock;
    node._count += scion._count + 1;
    path[0] = node;
    for (int i = 1; i < path.length; ++i) {
      node = node.isolateChild(append ? node._len : 0, edit);
      node._count += scion._count + 1;
      path[i] = node;
    }

    assert node._depth == scion._depth;
    if (append)
      node.concat(node, key, value, scion);
    else
      node.concat(scion, key, value, node);

    if (!node.isTooLarge())
      return unwrap(stock, edit);

    Splinter<Key, Value> splinter = node.split(edit);
    for (int i = path.length - 2; splinter != null && i >= 0; --i) {
      Node<Key, Value> parent = path[i];
      parent.insertSplinter(append ? parent._len : 0, splinter);
      splinter = parent.isTooLarge() ? parent.split(edit) : null;
    }
    if (splinter != null)
      return new Node<Key, Value>(stock, splinter._key, splinter._value, splinter._node, edit);
    return unwrap(stock, edit);
  }

  /**
   * Steps down through branches holding no element and a single child, which
   * order 2 allows below the root but never as one.
   */
  public static <Key, Value> Node<Key, Value> unwrap(Node<Key, Value> root, AtomicBoolean edit) {
    while (root._children != null && root._len == 0)
      root = root._children[0].isolate(edit);
    return root;
  }

  // Traversal

  public void forEach(BiConsumer<? super Key, ? super Value> fn) {
    if (_children == null) {
      for (int i = 0; i < _len; ++i)
        fn.accept(_keys[i], _values[i]);
    } else {
      for (int i = 0; i < _len; ++i) {
        _children[i].forEach(fn);
        fn.accept(_keys[i], _values[i]);
      }
      _children[_len].forEach(fn);
    }
  }

  // Returns false iff fn asked to stop
  public boolean forEachWhile(BiPredicate<? super Key, ? super Value> fn) {
    if (_children == null) {
      for (int i = 0; i < _len; ++i)
        if (!fn.test(_keys[i], _values[i]))
          return false;
      return true;
    }
    for (int i = 0; i < _len; ++i) {
      if (!_children[i].forEachWhile(fn))
        return false;
      if (!fn.test(_keys[i], _values[i]))
        return false;
    }
    return _children[_len].forEachWhile(fn);
  }

  // Stops at and returns the first Reduced
  public Object reduce(IFn f, Object acc) {
    for (int i = 0; i < _len; ++i) {
      if (_children != null) {
        acc = _children[i].reduce(f, acc);
        if (acc instanceof Reduced)
          return acc;
      }
      acc = f.invoke(acc, entry(i));
      if (acc instanceof Reduced)
        return acc;
    }
    if (_children != null)
      acc = _children[_len].reduce(f, acc);
    return acc;
  }

  // Validation

  void validate(List<String> defects, String path, boolean isRoot, Comparator<Key> cmp, Key lower, boolean hasLower, Key upper, boolean hasUpper) {
    if (_len > maxKeys())
      defects.add(path + ": " + _len + " elements, max is " + maxKeys());
    if (!isRoot && _len < minKeys())
      defects.add(path + ": " + _len + " elements, min is " + minKeys());
    if (isRoot && _children != null && _len < 1)
      defects.add(path + ": branch root with a single child");
    for (int i = 0; i < _len; ++i) {
      if (i > 0 && cmp.compare(_keys[i - 1], _keys[i]) > 0)
        defects.add(path + ": keys out of order at slot " + i);
      if (hasLower && cmp.compare(lower, _keys[i]) > 0)
        defects.add(path + ": key at slot " + i + " below its separator");
      if (hasUpper && cmp.compare(_keys[i], upper) > 0)
        defects.add(path + ": key at slot " + i + " above its separator");
    }
    int count = _len;
    if (_children == null) {
      if (_depth != 0)
        defects.add(path + ": leaf at depth " + _depth);
    } else {
      for (int i = 0; i <= _len; ++i) {
        Node<Key, Value> child = _children[i];
        if (child == null) {
          defects.add(path + ": missing child " + i);
          continue;
        }
        if (child._depth != _depth - 1)
          defects.add(path + "/" + i + ": depth " + child._depth + " under depth " + _depth);
        if (child._order != _order)
          defects.add(path + "/" + i + ": order " + child._order + " under order " + _order);
        count += child._count;
        child.validate(defects, path + "/" + i, false, cmp,
                       i > 0 ? _keys[i - 1] : lower, i > 0 || hasLower,
                       i < _len ? _keys[i] : upper, i < _len || hasUpper);
      }
    }
    if (count != _count)
      defects.add(path + ": count " + _count + ", actual " + count);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    toString(sb, "");
    return sb.toString();
  }

  public void toString(StringBuilder sb, String indent) {
    sb.append(indent).append(_depth == 0 ? "Leaf" : "Branch").append("{count=").append(_count).append(", keys=[");
    for (int i = 0; i < _len; ++i) {
      if (i > 0) sb.append(" ");
      sb.append(_keys[i]);
    }
    sb.append("]}");
    if (_children != null)
      for (int i = 0; i <= _len; ++i) {
        sb.append("\n");
        _children[i].toString(sb, indent + "  ");
      }
  }
}

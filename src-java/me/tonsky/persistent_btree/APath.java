package me.tonsky.persistent_btree;

import java.util.*;
import java.util.concurrent.atomic.*;

/**
 * Mutable path from the root of a tree to one of its elements, or to the
 * spot after the last element. Navigation is shared here; subclasses decide
 * how nodes are pushed and popped.
 *
 * <p>A path is complete when every node on it has a slot. While incomplete,
 * {@code _offset} is the offset just past the subtree of the last node.
 */
@SuppressWarnings("unchecked")
public abstract class APath<Key, Value> {
  public Node<Key, Value> _root;

  public int _offset;

  // Only valid [0 ... _length-1]
  public Node<Key, Value>[] _nodes;

  // Only valid [0 ... _slotCount-1]
  public int[] _slots;

  public int _length;

  public int _slotCount;

  public final Comparator<Key> _cmp;

  protected APath(Comparator<Key> cmp) {
    _cmp = cmp;
  }

  // Incomplete path at the root
  protected void reset(Node<Key, Value> root, int count) {
    int cap = root._depth + 2;
    if (_nodes == null || _nodes.length < cap) {
      _nodes = new Node[cap];
      _slots = new int[cap];
    } else {
      Arrays.fill(_nodes, null);
    }
    _root = root;
    _nodes[0] = root;
    _length = 1;
    _slotCount = 0;
    _offset = count;
  }

  protected void grow() {
    if (_length + 1 > _nodes.length) {
      _nodes = Arrays.copyOf(_nodes, _nodes.length * 2);
      _slots = Arrays.copyOf(_slots, _slots.length * 2);
    }
  }

  public abstract int count();

  // Pops the last slot, leaving an incomplete path
  protected abstract int popFromSlots();

  // Pops the last node of an incomplete path, focusing the element after its subtree
  protected abstract Node<Key, Value> popFromPath();

  // Pushes the child before the focused element, leaving an incomplete path
  protected abstract Node<Key, Value> pushToPath();

  // Completes the path with a slot of the last node
  protected abstract void pushToSlots(int slot, int offsetOfSlot);

  protected void pushToSlots(int slot) {
    pushToSlots(slot, node().offsetOfSlot(slot));
  }

  public Node<Key, Value> node() {
    return _nodes[_length - 1];
  }

  // -1 while incomplete
  public int slot() {
    return _slotCount == _length ? _slots[_slotCount - 1] : -1;
  }

  public int offset() {
    return _offset;
  }

  public boolean isAtStart() {
    return _offset == 0;
  }

  public boolean isAtEnd() {
    return _offset == count();
  }

  protected void checkNotAtEnd() {
    if (isAtEnd())
      throw new IllegalStateException("No element at the end position");
  }

  public Key key() {
    checkNotAtEnd();
    return node()._keys[slot()];
  }

  public Value value() {
    checkNotAtEnd();
    return node()._values[slot()];
  }

  public Map.Entry<Key, Value> element() {
    checkNotAtEnd();
    return node().entry(slot());
  }

  // Empty at the end position
  public Optional<Map.Entry<Key, Value>> optionalElement() {
    return isAtEnd() ? Optional.empty() : Optional.of(node().entry(slot()));
  }

  // Navigation

  public void moveForward() {
    if (_offset >= count())
      throw new IllegalStateException("Cannot move forward from the end position");
    _offset += 1;
    Node<Key, Value> node = node();
    int slot = slot();
    if (node.isLeaf()) {
      if (slot < node._len - 1 || _offset == count()) {
        _slots[_slotCount - 1] = slot + 1;
      } else {
        do {
          _slotCount -= 1;
          popFromPath();
        } while (slot() == node()._len);
      }
    } else {
      _slots[_slotCount - 1] = slot + 1;
      node = pushToPath();
      while (!node.isLeaf()) {
        _slots[_slotCount++] = 0;
        node = pushToPath();
      }
      _slots[_slotCount++] = 0;
      if (node._len == 0 && _offset != count())
        ascendToKey();
    }
  }

  public void moveBackward() {
    if (_offset <= 0)
      throw new IllegalStateException("Cannot move backward from the start position");
    _offset -= 1;
    Node<Key, Value> node = node();
    int slot = slot();
    if (node.isLeaf()) {
      if (slot > 0) {
        _slots[_slotCount - 1] = slot - 1;
      } else {
        do {
          _slotCount -= 1;
          popFromPath();
        } while (slot() == 0);
        _slots[_slotCount - 1] -= 1;
      }
    } else {
      node = pushToPath();
      while (!node.isLeaf()) {
        _slots[_slotCount++] = node._len;
        node = pushToPath();
      }
      if (node._len > 0) {
        _slots[_slotCount++] = node._len - 1;
      } else {
        // Only empty subtrees between here and the previous element
        _slots[_slotCount++] = 0;
        do {
          _slotCount -= 1;
          popFromPath();
        } while (slot() == 0);
        _slots[_slotCount - 1] -= 1;
      }
    }
  }

  public void moveToStart() {
    moveTo(0);
  }

  public void moveToEnd() {
    popFromSlots();
    while (count() > _offset) {
      popFromPath();
      popFromSlots();
    }
    descendToOffset(count());
  }

  public void moveTo(int offset) {
    if (offset < 0 || offset > count())
      throw new IndexOutOfBoundsException("Offset " + offset + " out of bounds for count " + count());
    if (offset == count()) {
      moveToEnd();
      return;
    }
    popFromSlots();
    while (offset < _offset - node()._count || offset >= _offset) {
      popFromPath();
      popFromSlots();
    }
    descendToOffset(offset);
  }

  /**
   * Moves to the element selected by key. Without a match, moves to the first
   * element after key, or to the end.
   */
  public void moveTo(Key key, Selector selector) {
    popFromSlots();
    while (_length > 1 && !node().contains(key, selector, _cmp)) {
      popFromPath();
      popFromSlots();
    }
    descendToKey(key, selector);
  }

  protected void descendToOffset(int offset) {
    Node<Key, Value> node = node();
    int slot = node.slotOfOffset(offset - (_offset - node._count));
    while (slot < 0) {
      pushToSlots(-slot - 1);
      node = pushToPath();
      slot = node.slotOfOffset(offset - (_offset - node._count));
    }
    pushToSlots(slot);
    assert _offset == offset;
  }

  protected void descendToKey(Key key, Selector selector) {
    if (count() == 0) {
      pushToSlots(0);
      return;
    }
    int matchLength = -1, matchSlot = -1;
    while (true) {
      Node<Key, Value> node = node();
      int found = node.slotOf(key, selector, _cmp);
      if (found >= 0) {
        if (node.isLeaf() || selector == Selector.ANY) {
          pushToSlots(found);
          return;
        }
        matchLength = _length;
        matchSlot = found;
      }
      int slot = Node.descendSlot(found, selector);
      if (node.isLeaf()) {
        if (matchLength >= 0) {
          while (_length > matchLength) {
            popFromPath();
            popFromSlots();
          }
          pushToSlots(matchSlot);
        } else {
          pushToSlots(slot);
          if (slot == node._len && _offset != count())
            ascendToKey();
        }
        return;
      }
      pushToSlots(slot);
      pushToPath();
    }
  }

  // From a spot past the last slot of a node, climbs to the ancestor holding the element at the current offset
  protected void ascendToKey() {
    assert !isAtEnd();
    while (slot() == node()._len) {
      _slotCount -= 1;
      popFromPath();
    }
  }

  // Slicing around the focused element. Requires a complete path

  // Tree of the elements before the focused one
  public Node<Key, Value> prefix(AtomicBoolean edit) {
    Node<Key, Value> prefix = null;
    for (int i = _length - 1; i >= 0; --i) {
      Node<Key, Value> node = _nodes[i];
      int slot = _slots[i];
      if (prefix == null)
        prefix = Node.slice(node, 0, slot, edit);
      else if (slot >= 1)
        prefix = Node.join(Node.slice(node, 0, slot - 1, edit), node._keys[slot - 1], node._values[slot - 1], prefix, edit);
    }
    return Node.unwrap(prefix, edit);
  }

  // Tree of the elements after the focused one
  public Node<Key, Value> suffix(AtomicBoolean edit) {
    checkNotAtEnd();
    Node<Key, Value> suffix = null;
    for (int i = _length - 1; i >= 0; --i) {
      Node<Key, Value> node = _nodes[i];
      int slot = _slots[i];
      if (suffix == null)
        suffix = Node.slice(node, slot + 1, node._len, edit);
      else if (slot < node._len)
        suffix = Node.join(suffix, node._keys[slot], node._values[slot], Node.slice(node, slot + 1, node._len, edit), edit);
    }
    return Node.unwrap(suffix, edit);
  }
}

package me.tonsky.persistent_btree;

import java.util.*;
import java.util.concurrent.atomic.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch editor holding a tree exclusively. Sequential edits around the
 * focused element cost amortized O(1) since the path from the root is kept
 * between calls. The tree throws IllegalStateException on any use until
 * {@link #finish()} gives it back.
 *
 * <p>Every node on the path belongs to the cursor. The count of each node on
 * the path leaves out the node below it, so edits in the deepest node never
 * touch the counts of its ancestors.
 */
@SuppressWarnings("unchecked")
public class Cursor<Key, Value> extends APath<Key, Value> {
  private static final Logger logger = LoggerFactory.getLogger(Cursor.class);

  final BTree<Key, Value> _tree;
  AtomicBoolean _edit;
  int _count;
  boolean _finished;

  Cursor(BTree<Key, Value> tree) {
    super(tree._cmp);
    tree.checkNoCursor();
    _tree = tree;
    _edit = tree._edit;
    Node<Key, Value> root = tree._root.isolate(_edit);
    reset(root, root._count);
    _count = root._count;
    tree._cursor = this;
    logger.trace("Opened cursor on a tree of {} elements", _count);
  }

  // Incomplete path at the root, which becomes ours
  private void resetTo(Node<Key, Value> root) {
    root = root.isolate(_edit);
    reset(root, root._count);
    _count = root._count;
  }

  private void resetTo(Node<Key, Value> root, int offset) {
    resetTo(root);
    descendToOffset(offset);
  }

  private Node<Key, Value> emptyNode() {
    return new Node<Key, Value>(_tree.order(), _edit);
  }

  private void checkActive() {
    if (_finished)
      throw new IllegalStateException("Cursor is finished");
  }

  public boolean isFinished() {
    return _finished;
  }

  @Override
  public int count() {
    return _count;
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
    node()._count += child._count;
    return child;
  }

  @Override
  protected Node<Key, Value> pushToPath() {
    assert _slotCount == _length;
    grow();
    Node<Key, Value> parent = node();
    Node<Key, Value> child = parent.isolateChild(_slots[_slotCount - 1], _edit);
    parent._count -= child._count;
    _nodes[_length++] = child;
    return child;
  }

  @Override
  protected void pushToSlots(int slot, int offsetOfSlot) {
    assert _slotCount == _length - 1;
    _offset -= node()._count - offsetOfSlot;
    _slots[_slotCount++] = slot;
  }

  // Restores the counts along the path and returns the root. Leaves the path unusable
  private Node<Key, Value> detach() {
    for (int i = _length - 1; i > 0; --i)
      _nodes[i - 1]._count += _nodes[i]._count;
    _length = 1;
    _slotCount = 0;
    assert _root._count == _count;
    return _root;
  }

  /** Gives the tree back with all the edits applied. The cursor is unusable afterwards. */
  public BTree<Key, Value> finish() {
    checkActive();
    Node<Key, Value> root = detach();
    _finished = true;
    _tree._root = root;
    _tree._edit = _edit;
    _tree._cursor = null;
    _tree._version += 1;
    logger.trace("Finished cursor with {} elements", _count);
    return _tree;
  }

  // Navigation

  @Override
  public void moveForward() {
    checkActive();
    super.moveForward();
  }

  @Override
  public void moveBackward() {
    checkActive();
    super.moveBackward();
  }

  @Override
  public void moveToEnd() {
    checkActive();
    super.moveToEnd();
  }

  @Override
  public void moveTo(int offset) {
    checkActive();
    super.moveTo(offset);
  }

  @Override
  public void moveTo(Key key, Selector selector) {
    checkActive();
    super.moveTo(key, selector);
  }

  // Reading and writing the focused element

  @Override
  public Key key() {
    checkActive();
    return super.key();
  }

  @Override
  public Value value() {
    checkActive();
    return super.value();
  }

  @Override
  public Map.Entry<Key, Value> element() {
    checkActive();
    return super.element();
  }

  @Override
  public Optional<Map.Entry<Key, Value>> optionalElement() {
    checkActive();
    return super.optionalElement();
  }

  public Value setValue(Value value) {
    checkActive();
    checkNotAtEnd();
    Node<Key, Value> node = node();
    int slot = slot();
    Value old = node._values[slot];
    node._values[slot] = value;
    return old;
  }

  /** Replaces the key of the focused element. The new key must keep the tree ordered. */
  public Key setKey(Key key) {
    checkActive();
    checkNotAtEnd();
    Node<Key, Value> node = node();
    int slot = slot();
    Key old = node._keys[slot];
    node._keys[slot] = key;
    return old;
  }

  // Insertion

  /** Inserts before the focused element and stays on that element. */
  public void insert(Key key, Value value) {
    checkActive();
    _count += 1;
    Node<Key, Value> node = node();
    if (node.isLeaf()) {
      node.insertElement(slot(), key, value);
    } else {
      // Append to the last leaf of the subtree before the focused element
      node = descendToLeaf(false);
      node.insertElement(node._len, key, value);
      _slots[_slotCount++] = node._len - 1;
    }
    fixupAfterInsert();
    super.moveForward();
  }

  /** Inserts after the focused element and moves to the new one. */
  public void insertAfter(Key key, Value value) {
    checkActive();
    checkNotAtEnd();
    _count += 1;
    Node<Key, Value> node = node();
    if (node.isLeaf()) {
      int slot = slot();
      node.insertElement(slot + 1, key, value);
      _slots[_slotCount - 1] = slot + 1;
      _offset += 1;
    } else {
      // Prepend to the first leaf of the subtree after the focused element
      _slots[_slotCount - 1] += 1;
      _offset += 1;
      node = descendToLeaf(true);
      node.insertElement(0, key, value);
      _slots[_slotCount++] = 0;
    }
    fixupAfterInsert();
  }

  // Pushes the child at the last slot and its first or last descendants down to a leaf, leaving the leaf without a slot
  private Node<Key, Value> descendToLeaf(boolean first) {
    Node<Key, Value> node = pushToPath();
    while (!node.isLeaf()) {
      _slots[_slotCount++] = first ? 0 : node._len;
      node = pushToPath();
    }
    return node;
  }

  // Splits oversized nodes from the deepest one up, keeping the focus on the same element
  private void fixupAfterInsert() {
    int i = _length - 1;
    if (!_nodes[i].isTooLarge())
      return;
    while (_nodes[i].isTooLarge()) {
      Node<Key, Value> left = _nodes[i];
      int slot = _slots[i];
      boolean deepest = i == _length - 1;
      Splinter<Key, Value> splinter = left.split(_edit);
      Node<Key, Value> right = splinter._node;
      if (slot > left._len) {
        _slots[i] = slot - left._len - 1;
        _nodes[i] = right;
      } else if (slot == left._len && deepest) {
        // The focused element became the separator
        _nodes[i] = null;
        _length -= 1;
        _slotCount -= 1;
      }
      if (i > 0) {
        Node<Key, Value> parent = _nodes[i - 1];
        int parentSlot = _slots[i - 1];
        parent.insertSplinter(parentSlot, splinter);
        parent._count += left._count + right._count + 1;
        if (slot > left._len)
          _slots[i - 1] = parentSlot + 1;
        i -= 1;
      } else {
        _root = new Node<Key, Value>(left, splinter._key, splinter._value, right, _edit);
        grow();
        System.arraycopy(_nodes, 0, _nodes, 1, _length);
        System.arraycopy(_slots, 0, _slots, 1, _slotCount);
        _nodes[0] = _root;
        _slots[0] = slot > left._len ? 1 : 0;
        _length += 1;
        _slotCount += 1;
      }
    }
    // Counts from i down are exact now, take the focused children out again
    for (; i < _length - 1; ++i)
      _nodes[i]._count -= _nodes[i + 1]._count;
  }

  /**
   * Inserts every element of {@code tree} before the focused element and stays
   * on that element. The keys must fit between the neighbours. O(log n).
   */
  public void insert(BTree<Key, Value> tree) {
    checkActive();
    _tree._settings.checkCompatible(tree._settings);
    insertNode(tree.share());
  }

  /** Inserts an ascending run of elements before the focused element. */
  public void insert(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries) {
    checkActive();
    Builder<Key, Value> builder = new Builder<Key, Value>(_tree._settings, _cmp);
    builder.appendAll(entries);
    insertNode(builder.finishNode());
  }

  private void insertNode(Node<Key, Value> node) {
    int c = node._count;
    if (c == 0)
      return;
    if (c == 1) {
      Map.Entry<Key, Value> e = node.first();
      insert(e.getKey(), e.getValue());
      return;
    }
    if (_count == 0) {
      resetTo(node, c);
      return;
    }
    int offset = _offset;
    if (offset == _count) {
      super.moveBackward();
      Map.Entry<Key, Value> separator = remove();
      Node<Key, Value> left = detach();
      Node<Key, Value> root = Node.join(left, separator.getKey(), separator.getValue(), node, _edit);
      resetTo(root, root._count);
    } else if (offset == 0) {
      Map.Entry<Key, Value> separator = remove();
      Node<Key, Value> right = detach();
      resetTo(Node.join(node, separator.getKey(), separator.getValue(), right, _edit), c);
    } else {
      super.moveBackward();
      Map.Entry<Key, Value> before = remove();
      Node<Key, Value> prefix = prefix(_edit);
      Key key = super.key();
      Value value = super.value();
      Node<Key, Value> suffix = suffix(_edit);
      Node<Key, Value> joined = Node.join(prefix, before.getKey(), before.getValue(), node, _edit);
      resetTo(Node.join(joined, key, value, suffix, _edit), offset + c);
    }
  }

  // Removal

  /** Removes the focused element and moves to the one after it. */
  public Map.Entry<Key, Value> remove() {
    checkActive();
    checkNotAtEnd();
    Node<Key, Value> node = node();
    int slot = slot();
    Map.Entry<Key, Value> result = node.entry(slot);
    int target = _offset;
    if (node.isLeaf()) {
      node.removeElement(slot);
      popFromSlots();
    } else if (node._children[slot]._count > 0) {
      // Take out the predecessor and put it in place of the focused element
      super.moveBackward();
      Map.Entry<Key, Value> predecessor = remove();
      node = node();
      node.setElement(slot(), predecessor.getKey(), predecessor.getValue());
      super.moveForward();
      return result;
    } else {
      int start = _offset - node.offsetOfSlot(slot);
      node.removeWithEmptyChild(slot, slot);
      _slotCount -= 1;
      _offset = start + node._count;
    }
    _count -= 1;
    while (_length > 1 && node.isTooSmall()) {
      popFromPath();
      node = node();
      int childSlot = popFromSlots();
      node.fixDeficiency(childSlot, _edit);
    }
    while (target != _count && target == _offset && _length > 1) {
      popFromPath();
      node = node();
      popFromSlots();
    }
    while (_length == 1 && !_root.isLeaf() && _root._len == 0) {
      _root = _root.isolateChild(0, _edit);
      _nodes[0] = _root;
    }
    descendToOffset(target);
    return result;
  }

  /** Removes n elements starting at the focused one and moves to the element after them. */
  public void remove(int n) {
    checkActive();
    checkRemovable(n);
    if (n == 0)
      return;
    if (n == 1) {
      remove();
      return;
    }
    int offset = _offset;
    if (n == _count) {
      resetTo(emptyNode(), 0);
    } else if (offset == 0) {
      super.moveTo(n - 1);
      resetTo(suffix(_edit), 0);
    } else if (offset == _count - n) {
      Node<Key, Value> prefix = prefix(_edit);
      resetTo(prefix, prefix._count);
    } else {
      Node<Key, Value> left = prefix(_edit);
      resetTo(suffix(_edit), n - 1);
      Key key = super.key();
      Value value = super.value();
      Node<Key, Value> right = suffix(_edit);
      resetTo(Node.join(left, key, value, right, _edit), offset);
    }
  }

  private void checkRemovable(int n) {
    if (n < 0)
      throw new IllegalArgumentException("Cannot remove a negative number of elements: " + n);
    if (_offset + n > _count)
      throw new IllegalArgumentException("Cannot remove " + n + " elements, only " + (_count - _offset) + " remain");
  }

  /**
   * Removes n elements starting at the focused one and returns them as a new
   * tree. The cursor stays at the same offset.
   */
  public BTree<Key, Value> extract(int n) {
    checkActive();
    checkRemovable(n);
    AtomicBoolean edit = new AtomicBoolean(true);
    if (n == 0)
      return new BTree<Key, Value>(null, _cmp, _tree._settings, edit);
    int offset = _offset;

    // Cut after the run
    Node<Key, Value> left, right = null;
    Key key = null;
    Value value = null;
    boolean cut = offset + n < _count;
    if (cut) {
      super.moveTo(offset + n);
      left = prefix(_edit);
      key = super.key();
      value = super.value();
      right = suffix(_edit);
    } else {
      left = detach();
    }

    // Cut before the run
    resetTo(left, offset);
    Node<Key, Value> before = prefix(_edit);
    Key firstKey = super.key();
    Value firstValue = super.value();
    Node<Key, Value> run = Node.join(emptyNode(), firstKey, firstValue, suffix(_edit), _edit);

    // The extracted nodes leave with the current token
    _edit.set(false);
    _edit = new AtomicBoolean(true);
    Node<Key, Value> rest = cut ? Node.join(before, key, value, right, _edit) : before;
    resetTo(rest, offset);
    return new BTree<Key, Value>(run, _cmp, _tree._settings, edit);
  }

  public void removeAll() {
    checkActive();
    resetTo(emptyNode(), 0);
  }

  /** Removes every element before the focused one, and the focused one too when includingCurrent. */
  public void removeAllBefore(boolean includingCurrent) {
    checkActive();
    if (includingCurrent)
      checkNotAtEnd();
    int n = _offset + (includingCurrent ? 1 : 0);
    super.moveTo(0);
    remove(n);
  }

  /** Removes every element after the focused one, and the focused one too when includingCurrent. */
  public void removeAllAfter(boolean includingCurrent) {
    checkActive();
    if (!includingCurrent) {
      if (isAtEnd())
        return;
      super.moveForward();
    }
    remove(_count - _offset);
  }
}

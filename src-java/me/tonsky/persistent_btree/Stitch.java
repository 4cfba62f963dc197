package me.tonsky.persistent_btree;

/**
 * Fills fresh node arrays from whole nodes and single separators, left to right.
 */
@SuppressWarnings("unchecked")
public class Stitch<Key, Value> {
  final Key[] _keys;
  final Value[] _values;
  // null for leaves
  final Node<Key, Value>[] _children;
  int _len;
  int _childLen;

  public Stitch(int cap, boolean branch) {
    _keys     = (Key[]) new Object[cap];
    _values   = (Value[]) new Object[cap];
    _children = branch ? new Node[cap + 1] : null;
  }

  // All elements of node, and all of its children when stitching a branch
  public Stitch<Key, Value> node(Node<Key, Value> node) {
    System.arraycopy(node._keys, 0, _keys, _len, node._len);
    System.arraycopy(node._values, 0, _values, _len, node._len);
    _len += node._len;
    if (_children != null) {
      System.arraycopy(node._children, 0, _children, _childLen, node._len + 1);
      _childLen += node._len + 1;
    }
    return this;
  }

  public Stitch<Key, Value> element(Key key, Value value) {
    _keys[_len] = key;
    _values[_len] = value;
    ++_len;
    return this;
  }

  public int len() {
    return _len;
  }
}

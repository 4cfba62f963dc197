package me.tonsky.persistent_btree;

import java.util.*;
import java.util.concurrent.atomic.*;

/**
 * Assembles a balanced tree from elements and whole subtrees supplied in
 * ascending key order, in a single left-to-right pass.
 *
 * <p>Keeps a line of full saplings of decreasing depth with a separator
 * element between each two of them. New elements fill a leaf seedling; a
 * full seedling is merged into the line, joining or grafting saplings
 * together as they grow. {@link #finish()} joins the whole line into one root.
 */
@SuppressWarnings("unchecked")
public class Builder<Key, Value> {
  public final Settings _settings;
  public final Comparator<Key> _cmp;
  public final boolean _dropDuplicates;
  final int _order;
  final int _keysPerNode;

  AtomicBoolean _edit;
  final ArrayList<Node<Key, Value>> _saplings = new ArrayList<>();
  final ArrayList<Key> _separatorKeys = new ArrayList<>();
  final ArrayList<Value> _separatorValues = new ArrayList<>();
  Node<Key, Value> _seedling;
  // True when the next element goes between two saplings
  boolean _needsSeparator;

  Key _lastKey;
  boolean _hasLast;

  // With _dropDuplicates, the element waiting to see if a later one replaces it
  Key _pendingKey;
  Value _pendingValue;
  boolean _hasPending;

  public Builder(Settings settings, Comparator<Key> cmp) {
    this(settings, cmp, false);
  }

  public Builder(Settings settings, Comparator<Key> cmp, boolean dropDuplicates) {
    this(settings, cmp, dropDuplicates, settings.keysPerNode());
  }

  public Builder(Settings settings, Comparator<Key> cmp, boolean dropDuplicates, int keysPerNode) {
    int min = Math.max(1, settings.minKeys());
    if (keysPerNode < min || keysPerNode > settings.maxKeys())
      throw new IllegalArgumentException("Keys per node must be in [" + min + ", " + settings.maxKeys() + "], got " + keysPerNode);
    _settings = settings;
    _cmp = cmp;
    _dropDuplicates = dropDuplicates;
    _order = settings.order();
    _keysPerNode = keysPerNode;
    reset();
  }

  private void reset() {
    _edit = new AtomicBoolean(true);
    _saplings.clear();
    _separatorKeys.clear();
    _separatorValues.clear();
    _seedling = new Node<Key, Value>(_order, _edit);
    _needsSeparator = false;
    _lastKey = null;
    _hasLast = false;
    _pendingKey = null;
    _pendingValue = null;
    _hasPending = false;
  }

  public Builder<Key, Value> append(Key key, Value value) {
    if (_hasLast && _cmp.compare(_lastKey, key) > 0)
      throw new IllegalArgumentException("Keys must be appended in ascending order: " + key + " after " + _lastKey);
    _lastKey = key;
    _hasLast = true;
    if (!_dropDuplicates) {
      appendElement(key, value);
    } else {
      if (_hasPending && _cmp.compare(_pendingKey, key) != 0)
        appendElement(_pendingKey, _pendingValue);
      _pendingKey = key;
      _pendingValue = value;
      _hasPending = true;
    }
    return this;
  }

  public Builder<Key, Value> append(Map.Entry<? extends Key, ? extends Value> entry) {
    return append(entry.getKey(), entry.getValue());
  }

  public Builder<Key, Value> appendAll(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries) {
    for (Map.Entry<? extends Key, ? extends Value> e: entries)
      append(e.getKey(), e.getValue());
    return this;
  }

  /**
   * Appends every element of {@code tree}. Its nodes are shared with the
   * result, so the cost is logarithmic in its size. Duplicate dropping does
   * not look inside appended subtrees.
   */
  public Builder<Key, Value> append(BTree<Key, Value> tree) {
    _settings.checkCompatible(tree._settings);
    return append(tree.share());
  }

  // The descendants of node end up shared with the result, so they must be frozen
  Builder<Key, Value> append(Node<Key, Value> node) {
    if (node._count == 0)
      return this;
    appendWithoutCloning(node.clone(_edit));
    return this;
  }

  void appendSlice(Node<Key, Value> node, int from, int to) {
    appendWithoutCloning(Node.slice(node, from, to, _edit));
  }

  private void flushPending() {
    if (_hasPending) {
      appendElement(_pendingKey, _pendingValue);
      _pendingKey = null;
      _pendingValue = null;
      _hasPending = false;
    }
  }

  private void addSeparator(Key key, Value value) {
    _separatorKeys.add(key);
    _separatorValues.add(value);
  }

  private void appendElement(Key key, Value value) {
    if (_needsSeparator) {
      addSeparator(key, value);
      _needsSeparator = false;
    } else {
      _seedling.insertElement(_seedling._len, key, value);
      if (_seedling._len == _keysPerNode) {
        closeSeedling();
        _needsSeparator = true;
      }
    }
  }

  private void closeSeedling() {
    appendSapling(_seedling);
    _seedling = new Node<Key, Value>(_order, _edit);
  }

  // node must be editable(_edit); its descendants may be shared
  void appendWithoutCloning(Node<Key, Value> node) {
    if (node._order != _order)
      throw new IllegalArgumentException("Cannot append a node of order " + node._order + " to a builder of order " + _order);
    flushPending();
    if (node._count == 0)
      return;
    _lastKey = node.last().getKey();
    _hasLast = true;
    node = Node.unwrap(node, _edit);

    if (node._depth == 0) {
      if (_needsSeparator) {
        assert _seedling._len == 0;
        Map.Entry<Key, Value> separator = node.removeElement(0);
        addSeparator(separator.getKey(), separator.getValue());
        _needsSeparator = false;
        if (node._len == 0)
          return;
        _seedling = node;
      } else if (_seedling._len > 0) {
        Map.Entry<Key, Value> separator = _seedling.removeElement(_seedling._len - 1);
        Splinter<Key, Value> splinter = _seedling.shiftSlots(separator.getKey(), separator.getValue(), node, _keysPerNode, _edit);
        if (splinter != null) {
          closeSeedling();
          addSeparator(splinter._key, splinter._value);
          _seedling = splinter._node;
        }
      } else {
        _seedling = node;
      }
      if (_seedling._len >= _keysPerNode) {
        closeSeedling();
        _needsSeparator = true;
      }
      return;
    }

    if (!_needsSeparator && _seedling._len > 0) {
      Map.Entry<Key, Value> separator = _seedling.removeElement(_seedling._len - 1);
      closeSeedling();
      addSeparator(separator.getKey(), separator.getValue());
    }
    if (_needsSeparator) {
      // Borrow the last element of the line as the separator
      Node<Key, Value> last = _saplings.remove(_saplings.size() - 1).isolate(_edit);
      Map.Entry<Key, Value> separator = last.removeLast(_edit);
      _saplings.add(Node.unwrap(last, _edit));
      addSeparator(separator.getKey(), separator.getValue());
    }
    assert _seedling._len == 0;
    appendSapling(node);
    _needsSeparator = true;
  }

  private Node<Key, Value> popSapling() {
    return _saplings.remove(_saplings.size() - 1);
  }

  private void appendSapling(Node<Key, Value> sapling) {
    outer:
    while (!_saplings.isEmpty()) {
      assert _saplings.size() == _separatorKeys.size();
      Node<Key, Value> previous = popSapling();
      Key key = _separatorKeys.remove(_separatorKeys.size() - 1);
      Value value = _separatorValues.remove(_separatorValues.size() - 1);

      // Join saplings until the previous one is at least as deep as the new one
      while (previous._depth < sapling._depth) {
        if (_saplings.isEmpty()) {
          sapling = Node.join(previous, key, value, sapling, _edit);
          break outer;
        }
        Key k = _separatorKeys.remove(_separatorKeys.size() - 1);
        Value v = _separatorValues.remove(_separatorValues.size() - 1);
        previous = Node.join(popSapling(), k, v, previous, _edit);
      }

      boolean fullPrevious = previous._len >= _keysPerNode;
      boolean fullSapling = sapling._len >= _keysPerNode;

      if (previous._depth == sapling._depth + 1 && !fullPrevious && fullSapling) {
        // Graft as a new last child of the previous sapling
        previous = previous.isolate(_edit);
        previous.graft(key, value, sapling);
        sapling = previous;
      } else if (previous._depth == sapling._depth && fullPrevious && fullSapling) {
        sapling = new Node<Key, Value>(previous, key, value, sapling, _edit);
      } else if (previous._depth > sapling._depth || fullPrevious) {
        _saplings.add(previous);
        addSeparator(key, value);
        break;
      } else {
        previous = previous.isolate(_edit);
        Splinter<Key, Value> splinter = previous.shiftSlots(key, value, sapling, _keysPerNode, _edit);
        if (splinter != null) {
          // previous is full now, retry with the remainder
          appendSapling(previous);
          addSeparator(splinter._key, splinter._value);
          sapling = splinter._node;
        } else {
          sapling = previous;
        }
      }
    }
    _saplings.add(sapling);
  }

  // Joins the line into a single root and resets the builder
  Node<Key, Value> finishNode() {
    flushPending();
    Node<Key, Value> root;
    if (_needsSeparator) {
      assert _seedling._len == 0;
      root = popSapling();
    } else {
      root = _seedling;
    }
    assert _saplings.size() == _separatorKeys.size();
    while (!_saplings.isEmpty()) {
      Key key = _separatorKeys.remove(_separatorKeys.size() - 1);
      Value value = _separatorValues.remove(_separatorValues.size() - 1);
      root = Node.join(popSapling(), key, value, root, _edit);
    }
    return Node.unwrap(root, _edit);
  }

  public BTree<Key, Value> finish() {
    AtomicBoolean edit = _edit;
    Node<Key, Value> root = finishNode();
    reset();
    return new BTree<Key, Value>(root, _cmp, _settings, edit);
  }
}

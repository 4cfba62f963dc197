package me.tonsky.persistent_btree;

import clojure.lang.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered collection of key/value elements backed by a copy-on-write B-tree.
 * Duplicate keys are allowed; equal keys keep their insertion order.
 *
 * <p>A {@code BTree} is a mutable handle with value semantics: {@link #copy()}
 * is O(1) and shares every node, and from then on neither handle can observe
 * changes made through the other. Nodes are changed in place only while they
 * belong to the handle's edit token; anything else is cloned on first write.
 *
 * <p>Not thread-safe.
 */
@SuppressWarnings("unchecked")
public class BTree<Key, Value> implements Counted, Seqable, IReduce, Iterable<Map.Entry<Key, Value>> {
  private static final Logger logger = LoggerFactory.getLogger(BTree.class);

  public Node<Key, Value> _root;
  public final Comparator<Key> _cmp;
  public final Settings _settings;
  // Live token of the nodes this tree may change in place
  AtomicBoolean _edit;
  // Bumped by every change, invalidates indices and iterators
  public int _version;
  // Non-null while a cursor has the tree
  Cursor<Key, Value> _cursor;

  public BTree() {
    this(RT.DEFAULT_COMPARATOR, Settings.DEFAULT);
  }

  public BTree(Comparator<Key> cmp) {
    this(cmp, Settings.DEFAULT);
  }

  public BTree(Settings settings) {
    this(RT.DEFAULT_COMPARATOR, settings);
  }

  public BTree(Comparator<Key> cmp, Settings settings) {
    this(null, cmp, settings, new AtomicBoolean(true));
  }

  BTree(Node<Key, Value> root, Comparator<Key> cmp, Settings settings, AtomicBoolean edit) {
    _cmp      = cmp;
    _settings = settings;
    _edit     = edit;
    _root     = root != null ? root : new Node<Key, Value>(settings.order(), edit);
  }

  public static <Key, Value> BTree<Key, Value> fromSorted(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries, boolean dropDuplicates, Comparator<Key> cmp, Settings settings) {
    return new Builder<Key, Value>(settings, cmp, dropDuplicates).appendAll(entries).finish();
  }

  public static <Key, Value> BTree<Key, Value> fromUnsorted(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries, boolean dropDuplicates, Comparator<Key> cmp, Settings settings) {
    BTree<Key, Value> tree = new BTree<Key, Value>(cmp, settings);
    for (Map.Entry<? extends Key, ? extends Value> e: entries) {
      if (dropDuplicates)
        tree.insertOrReplace(e.getKey(), e.getValue(), Selector.ANY);
      else
        tree.insert(e.getKey(), e.getValue());
    }
    return tree;
  }

  // Ownership

  void checkNoCursor() {
    if (_cursor != null)
      throw new IllegalStateException("Tree is being edited by a cursor");
  }

  /**
   * Hands out the root for sharing with another structure. The current nodes
   * are frozen: this tree gets a fresh token and copies them on its next write.
   */
  Node<Key, Value> share() {
    checkNoCursor();
    _edit.set(false);
    _edit = new AtomicBoolean(true);
    return _root;
  }

  private Node<Key, Value> editableRoot() {
    checkNoCursor();
    _root = _root.isolate(_edit);
    return _root;
  }

  private void collapseRoot() {
    while (!_root.isLeaf() && _root._len == 0)
      _root = _root._children[0];
  }

  private void modified() {
    _version += 1;
  }

  private void replaceWith(BTree<Key, Value> tree) {
    _root = tree._root;
    _edit = tree._edit;
    modified();
  }

  private BTree<Key, Value> withRoot(Node<Key, Value> root, AtomicBoolean edit) {
    return new BTree<Key, Value>(root, _cmp, _settings, edit);
  }

  public BTree<Key, Value> copy() {
    return withRoot(share(), new AtomicBoolean(true));
  }

  public BTree<Key, Value> empty() {
    checkNoCursor();
    return new BTree<Key, Value>(_cmp, _settings);
  }

  // Shape

  @Override
  public int count() {
    checkNoCursor();
    return _root._count;
  }

  public boolean isEmpty() {
    return count() == 0;
  }

  public int depth() {
    checkNoCursor();
    return _root._depth;
  }

  public int order() {
    return _settings.order();
  }

  public Comparator<Key> comparator() {
    return _cmp;
  }

  public Settings settings() {
    return _settings;
  }

  // Ends

  public Optional<Map.Entry<Key, Value>> first() {
    checkNoCursor();
    return Optional.ofNullable(_root.first());
  }

  public Optional<Map.Entry<Key, Value>> last() {
    checkNoCursor();
    return Optional.ofNullable(_root.last());
  }

  public Optional<Map.Entry<Key, Value>> removeFirst() {
    if (isEmpty())
      return Optional.empty();
    Map.Entry<Key, Value> removed = editableRoot().removeFirst(_edit);
    collapseRoot();
    modified();
    return Optional.of(removed);
  }

  public Optional<Map.Entry<Key, Value>> removeLast() {
    if (isEmpty())
      return Optional.empty();
    Map.Entry<Key, Value> removed = editableRoot().removeLast(_edit);
    collapseRoot();
    modified();
    return Optional.of(removed);
  }

  public void removeFirst(int n) {
    checkRemoveCount(n);
    if (n > 0)
      replaceWith(subtree(n, count()));
  }

  public void removeLast(int n) {
    checkRemoveCount(n);
    if (n > 0)
      replaceWith(subtree(0, count() - n));
  }

  private void checkRemoveCount(int n) {
    if (n < 0)
      throw new IllegalArgumentException("Cannot remove a negative number of elements: " + n);
    if (n > count())
      throw new IllegalArgumentException("Cannot remove " + n + " elements from a tree of " + count());
  }

  public void clear() {
    checkNoCursor();
    _root = new Node<Key, Value>(order(), _edit);
    modified();
  }

  // Lookup by key

  public Optional<Map.Entry<Key, Value>> find(Key key, Selector selector) {
    checkNoCursor();
    Node<Key, Value> node = _root;
    Map.Entry<Key, Value> match = null;
    while (true) {
      int found = node.slotOf(key, selector, _cmp);
      if (found >= 0) {
        match = node.entry(found);
        if (selector == Selector.ANY)
          return Optional.of(match);
      }
      if (node.isLeaf())
        return Optional.ofNullable(match);
      node = node._children[Node.descendSlot(found, selector)];
    }
  }

  public Value get(Key key, Selector selector, Value notFound) {
    Optional<Map.Entry<Key, Value>> found = find(key, selector);
    return found.isPresent() ? found.get().getValue() : notFound;
  }

  public Value get(Key key, Value notFound) {
    return get(key, Selector.ANY, notFound);
  }

  public boolean contains(Key key) {
    return find(key, Selector.ANY).isPresent();
  }

  public OptionalInt offsetOf(Key key, Selector selector) {
    checkNoCursor();
    Path<Key, Value> path = Path.atKey(_root, key, selector, _cmp);
    if (path.isAtEnd() || !Node.matches(path.key(), key, selector, _cmp))
      return OptionalInt.empty();
    return OptionalInt.of(path.offset());
  }

  // Offset of the first element not below key
  int lowerBound(Key key) {
    return Path.atKey(_root, key, Selector.FIRST, _cmp).offset();
  }

  // Offset of the first element above key
  int upperBound(Key key) {
    return Path.atKey(_root, key, Selector.AFTER, _cmp).offset();
  }

  // Positional access

  private void checkOffset(int offset, int limit) {
    if (offset < 0 || offset > limit)
      throw new IndexOutOfBoundsException("Offset " + offset + " out of bounds for count " + count());
  }

  public Map.Entry<Key, Value> elementAt(int offset) {
    checkOffset(offset, count() - 1);
    return _root.elementAt(offset);
  }

  public Value setValueAt(int offset, Value value) {
    checkOffset(offset, count() - 1);
    Key key = _root.elementAt(offset).getKey();
    Map.Entry<Key, Value> old = editableRoot().setElementAt(offset, key, value, _edit);
    modified();
    return old.getValue();
  }

  /** Inserts at offset as is. Keeping the keys ordered is up to the caller. */
  public void insertAt(int offset, Key key, Value value) {
    checkOffset(offset, count());
    Splinter<Key, Value> splinter = editableRoot().insertAt(offset, key, value, _edit);
    if (splinter != null)
      _root = new Node<Key, Value>(_root, splinter._key, splinter._value, splinter._node, _edit);
    modified();
  }

  public Map.Entry<Key, Value> removeAt(int offset) {
    checkOffset(offset, count() - 1);
    Map.Entry<Key, Value> removed = editableRoot().removeAt(offset, _edit);
    collapseRoot();
    modified();
    return removed;
  }

  // Mutation by key

  public void insert(Key key, Value value) {
    insert(key, value, Selector.LAST);
  }

  /** {@link Selector#FIRST} inserts before equal keys, anything else after them. */
  public void insert(Key key, Value value, Selector selector) {
    Selector where = selector == Selector.FIRST ? Selector.FIRST : Selector.AFTER;
    Splinter<Key, Value> splinter = editableRoot().insert(key, value, where, _cmp, _edit);
    if (splinter != null)
      _root = new Node<Key, Value>(_root, splinter._key, splinter._value, splinter._node, _edit);
    modified();
  }

  private static void checkEqualKeySelector(Selector selector) {
    if (selector == Selector.AFTER)
      throw new IllegalArgumentException("Selector AFTER does not select an element with an equal key");
  }

  /** Replaces the element selected by key, or inserts a new one. Returns the replaced element. */
  public Optional<Map.Entry<Key, Value>> insertOrReplace(Key key, Value value, Selector selector) {
    checkEqualKeySelector(selector);
    OptionalInt offset = offsetOf(key, selector);
    if (!offset.isPresent()) {
      insert(key, value, selector);
      return Optional.empty();
    }
    Map.Entry<Key, Value> old = editableRoot().setElementAt(offset.getAsInt(), key, value, _edit);
    modified();
    return Optional.of(old);
  }

  /** Returns the element selected by key if there is one, otherwise inserts a new one. */
  public Optional<Map.Entry<Key, Value>> insertOrFind(Key key, Value value, Selector selector) {
    checkEqualKeySelector(selector);
    Optional<Map.Entry<Key, Value>> found = find(key, selector);
    if (!found.isPresent())
      insert(key, value, selector);
    return found;
  }

  public Optional<Map.Entry<Key, Value>> remove(Key key) {
    return remove(key, Selector.ANY);
  }

  public Optional<Map.Entry<Key, Value>> remove(Key key, Selector selector) {
    // Nothing gets copied for a missing key
    OptionalInt offset = offsetOf(key, selector);
    if (!offset.isPresent())
      return Optional.empty();
    return Optional.of(removeAt(offset.getAsInt()));
  }

  // Slicing. Results share nodes with this tree

  private Node<Key, Value> prefixNode(Node<Key, Value> root, int n, AtomicBoolean edit) {
    if (n == root._count)
      return root;
    return Path.atOffset(root, n, _cmp).prefix(edit);
  }

  private Node<Key, Value> suffixNode(Node<Key, Value> root, int from, AtomicBoolean edit) {
    if (from == 0)
      return root;
    return Path.atOffset(root, from - 1, _cmp).suffix(edit);
  }

  /** Elements at offsets [from, to). */
  public BTree<Key, Value> subtree(int from, int to) {
    checkOffset(to, count());
    checkOffset(from, to);
    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Key, Value> root = share();
    if (from == to)
      return withRoot(null, edit);
    return withRoot(suffixNode(prefixNode(root, to, edit), from, edit), edit);
  }

  public BTree<Key, Value> subtree(Index<Key, Value> from, Index<Key, Value> to) {
    from.checkValid(this);
    to.checkValid(this);
    return subtree(from.offset(), to.offset());
  }

  /** Elements with keys in [from, to). */
  public BTree<Key, Value> subtreeOfKeys(Key from, Key to) {
    checkNoCursor();
    if (_cmp.compare(from, to) > 0)
      throw new IllegalArgumentException("Range start " + from + " is after its end " + to);
    return subtree(lowerBound(from), lowerBound(to));
  }

  /** Elements with keys in [from, through]. */
  public BTree<Key, Value> subtreeThrough(Key from, Key through) {
    checkNoCursor();
    if (_cmp.compare(from, through) > 0)
      throw new IllegalArgumentException("Range start " + from + " is after its end " + through);
    return subtree(lowerBound(from), upperBound(through));
  }

  /** The first n elements. */
  public BTree<Key, Value> prefix(int n) {
    checkOffset(n, count());
    return subtree(0, n);
  }

  /** The last n elements. */
  public BTree<Key, Value> suffix(int n) {
    checkOffset(n, count());
    return subtree(count() - n, count());
  }

  public BTree<Key, Value> prefixBefore(Key key) {
    checkNoCursor();
    return subtree(0, lowerBound(key));
  }

  public BTree<Key, Value> prefixThrough(Key key) {
    checkNoCursor();
    return subtree(0, upperBound(key));
  }

  public BTree<Key, Value> suffixFrom(Key key) {
    checkNoCursor();
    return subtree(lowerBound(key), count());
  }

  public BTree<Key, Value> suffixAfter(Key key) {
    checkNoCursor();
    return subtree(upperBound(key), count());
  }

  /**
   * Tree of the elements of this tree followed by those of {@code other}.
   * Every key of this tree must be at most every key of {@code other}.
   * Neither tree changes.
   */
  public BTree<Key, Value> concat(BTree<Key, Value> other) {
    _settings.checkCompatible(other._settings);
    if (other.isEmpty())
      return copy();
    if (isEmpty())
      return other.copy();
    Map.Entry<Key, Value> last = _root.last();
    Map.Entry<Key, Value> first = other._root.first();
    if (_cmp.compare(last.getKey(), first.getKey()) > 0)
      throw new IllegalArgumentException("Cannot concatenate: " + last.getKey() + " is after " + first.getKey());
    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Key, Value> left = share();
    Node<Key, Value> right = other.share().clone(edit);
    Map.Entry<Key, Value> separator = right.removeFirst(edit);
    right = Node.unwrap(right, edit);
    return withRoot(Node.join(left, separator.getKey(), separator.getValue(), right, edit), edit);
  }

  // Traversal

  public void forEach(BiConsumer<? super Key, ? super Value> fn) {
    checkNoCursor();
    _root.forEach(fn);
  }

  /** Visits elements in order while fn returns true. Returns false iff fn stopped the walk. */
  public boolean forEachWhile(BiPredicate<? super Key, ? super Value> fn) {
    checkNoCursor();
    return _root.forEachWhile(fn);
  }

  // IReduce
  public Object reduce(IFn f) {
    Seq<Key, Value> seq = (Seq<Key, Value>) seq();
    return seq == null ? f.invoke() : seq.reduce(f);
  }

  public Object reduce(IFn f, Object start) {
    checkNoCursor();
    Object ret = _root.reduce(f, start);
    if (ret instanceof Reduced)
      return ((Reduced) ret).deref();
    return ret;
  }

  // Seqable
  /** Immutable seq over the current elements. Later changes to this tree do not show in it. */
  public ISeq seq() {
    if (isEmpty())
      return null;
    return new Seq<Key, Value>(null, Path.startOf(share(), _cmp));
  }

  // Iterable
  public Iterator<Map.Entry<Key, Value>> iterator() {
    return iteratorFrom(0);
  }

  public Iterator<Map.Entry<Key, Value>> iteratorFrom(int offset) {
    checkNoCursor();
    return new JavaIter<Key, Value>(this, Path.atOffset(_root, offset, _cmp));
  }

  public Iterator<Map.Entry<Key, Value>> iteratorFrom(Key key, Selector selector) {
    checkNoCursor();
    return new JavaIter<Key, Value>(this, Path.atKey(_root, key, selector, _cmp));
  }

  public Iterator<Map.Entry<Key, Value>> iterator(Index<Key, Value> from) {
    from.checkValid(this);
    return new JavaIter<Key, Value>(this, from._path.copy());
  }

  public List<Key> keys() {
    List<Key> keys = new ArrayList<>(count());
    forEach((k, v) -> keys.add(k));
    return keys;
  }

  public List<Value> values() {
    List<Value> values = new ArrayList<>(count());
    forEach((k, v) -> values.add(v));
    return values;
  }

  // Indices

  public Index<Key, Value> startIndex() {
    checkNoCursor();
    return new Index<Key, Value>(this, Path.startOf(_root, _cmp));
  }

  public Index<Key, Value> endIndex() {
    checkNoCursor();
    return new Index<Key, Value>(this, Path.endOf(_root, _cmp));
  }

  public Index<Key, Value> indexAt(int offset) {
    checkNoCursor();
    return new Index<Key, Value>(this, Path.atOffset(_root, offset, _cmp));
  }

  /** Index of the element selected by key, empty when there is none. */
  public Optional<Index<Key, Value>> indexOf(Key key, Selector selector) {
    checkNoCursor();
    Path<Key, Value> path = Path.atKey(_root, key, selector, _cmp);
    if (path.isAtEnd() || !Node.matches(path.key(), key, selector, _cmp))
      return Optional.empty();
    return Optional.of(new Index<Key, Value>(this, path));
  }

  // Comparison

  public boolean elementsEqual(BTree<Key, Value> other) {
    return elementsEqual(other, (a, b) -> _cmp.compare(a.getKey(), b.getKey()) == 0 && Util.equiv(a.getValue(), b.getValue()));
  }

  public boolean elementsEqual(BTree<Key, Value> other, BiPredicate<Map.Entry<Key, Value>, Map.Entry<Key, Value>> equivalence) {
    return Comparisons.elementsEqual(this, other, equivalence);
  }

  public boolean isDisjointWith(BTree<Key, Value> other) {
    return Comparisons.isDisjoint(this, other);
  }

  public boolean isSubsetOf(BTree<Key, Value> other) {
    return Comparisons.isSubset(this, other, false);
  }

  public boolean isStrictSubsetOf(BTree<Key, Value> other) {
    return Comparisons.isSubset(this, other, true);
  }

  public boolean isSupersetOf(BTree<Key, Value> other) {
    return Comparisons.isSubset(other, this, false);
  }

  public boolean isStrictSupersetOf(BTree<Key, Value> other) {
    return Comparisons.isSubset(other, this, true);
  }

  // Set algebra

  /** Every element of both trees; on equal keys the elements of this tree come first. */
  public BTree<Key, Value> union(BTree<Key, Value> other) {
    return union(other, MatchStrategy.COUNTING_MATCHES);
  }

  /** Union keeping a single group of elements per key, the one of {@code other} when both have it. */
  public BTree<Key, Value> distinctUnion(BTree<Key, Value> other) {
    return union(other, MatchStrategy.GROUPING_MATCHES);
  }

  public BTree<Key, Value> union(BTree<Key, Value> other, MatchStrategy strategy) {
    return new Merger<Key, Value>(this, other).union(strategy);
  }

  public BTree<Key, Value> subtracting(BTree<Key, Value> other) {
    return subtracting(other, MatchStrategy.GROUPING_MATCHES);
  }

  public BTree<Key, Value> subtracting(BTree<Key, Value> other, MatchStrategy strategy) {
    return new Merger<Key, Value>(this, other).subtracting(strategy);
  }

  public BTree<Key, Value> subtracting(Iterable<? extends Key> sortedKeys, MatchStrategy strategy) {
    return Merger.subtracting(this, sortedKeys, strategy);
  }

  public BTree<Key, Value> intersection(BTree<Key, Value> other) {
    return intersection(other, MatchStrategy.GROUPING_MATCHES);
  }

  public BTree<Key, Value> intersection(BTree<Key, Value> other, MatchStrategy strategy) {
    return new Merger<Key, Value>(this, other).intersection(strategy);
  }

  public BTree<Key, Value> intersection(Iterable<? extends Key> sortedKeys, MatchStrategy strategy) {
    return Merger.intersection(this, sortedKeys, strategy);
  }

  public BTree<Key, Value> symmetricDifference(BTree<Key, Value> other) {
    return symmetricDifference(other, MatchStrategy.GROUPING_MATCHES);
  }

  public BTree<Key, Value> symmetricDifference(BTree<Key, Value> other, MatchStrategy strategy) {
    return new Merger<Key, Value>(this, other).symmetricDifference(strategy);
  }

  // Cursors

  public Cursor<Key, Value> cursorAtStart() {
    return cursorAt(0);
  }

  public Cursor<Key, Value> cursorAtEnd() {
    return cursorAt(count());
  }

  public Cursor<Key, Value> cursorAt(int offset) {
    checkOffset(offset, count());
    Cursor<Key, Value> cursor = new Cursor<Key, Value>(this);
    cursor.descendToOffset(offset);
    return cursor;
  }

  /** Cursor at the element selected by key; without a match, at the first element after key. */
  public Cursor<Key, Value> cursorAt(Key key, Selector selector) {
    Cursor<Key, Value> cursor = new Cursor<Key, Value>(this);
    cursor.descendToKey(key, selector);
    return cursor;
  }

  public void withCursorAt(int offset, Consumer<Cursor<Key, Value>> fn) {
    withCursor(cursorAt(offset), fn);
  }

  public void withCursorAt(Key key, Selector selector, Consumer<Cursor<Key, Value>> fn) {
    withCursor(cursorAt(key, selector), fn);
  }

  private static <Key, Value> void withCursor(Cursor<Key, Value> cursor, Consumer<Cursor<Key, Value>> fn) {
    try {
      fn.accept(cursor);
    } finally {
      if (!cursor.isFinished())
        cursor.finish();
    }
  }

  // Validation

  /** Checks every structural invariant, throwing IllegalStateException listing the defects. */
  public void validate() {
    checkNoCursor();
    List<String> defects = new ArrayList<>();
    _root.validate(defects, "root", true, _cmp, null, false, null, false);
    if (!defects.isEmpty()) {
      for (String defect: defects)
        logger.debug("Invalid tree: {}", defect);
      throw new IllegalStateException("Invalid tree, " + defects.size() + " defect(s): " + String.join("; ", defects));
    }
  }

  // Object

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof BTree))
      return false;
    // Keys of another tree need not be comparable with ours
    return elementsEqual((BTree<Key, Value>) o, (a, b) -> Util.equiv(a.getKey(), b.getKey()) && Util.equiv(a.getValue(), b.getValue()));
  }

  @Override
  public int hashCode() {
    int[] hash = new int[] {1};
    forEach((k, v) -> hash[0] = 31 * (31 * hash[0] + Util.hasheq(k)) + Util.hasheq(v));
    return hash[0];
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("#btree[");
    forEach((k, v) -> sb.append("[").append(k).append(" ").append(v).append("] "));
    if (sb.charAt(sb.length() - 1) == ' ')
      sb.delete(sb.length() - 1, sb.length());
    sb.append("]");
    return sb.toString();
  }
}

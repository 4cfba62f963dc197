package me.tonsky.persistent_btree;

import java.util.*;
import java.util.concurrent.atomic.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tree fixtures and reference models shared by the tests. Every fixture maps
 * an integer key to a string payload.
 */
class TestUtil {
  static final Comparator<Integer> CMP = Comparator.naturalOrder();

  static BTree<Integer, String> empty(int order) {
    return new BTree<Integer, String>(CMP, new Settings(order));
  }

  // Bulk-loaded, payload is the key in decimal
  static BTree<Integer, String> tree(int order, int... keys) {
    return tagged(order, "", keys);
  }

  // Bulk-loaded, payload is tag followed by the key
  static BTree<Integer, String> tagged(int order, String tag, int... keys) {
    Builder<Integer, String> builder = new Builder<Integer, String>(new Settings(order), CMP);
    for (int key: keys)
      builder.append(key, tag + key);
    return builder.finish();
  }

  // Keys from ... to-1
  static BTree<Integer, String> range(int order, int from, int to) {
    return range(order, from, to, CMP);
  }

  // Natural order, counting the comparisons made through it
  static class CountingComparator implements Comparator<Integer> {
    int calls;

    @Override
    public int compare(Integer a, Integer b) {
      calls += 1;
      return Integer.compare(a, b);
    }
  }

  static BTree<Integer, String> range(int order, int from, int to, Comparator<Integer> cmp) {
    Builder<Integer, String> builder = new Builder<Integer, String>(new Settings(order), cmp);
    for (int i = from; i < to; ++i)
      builder.append(i, String.valueOf(i));
    return builder.finish();
  }

  // Same keys as range, grown one insert at a time
  static BTree<Integer, String> inserted(int order, int from, int to) {
    BTree<Integer, String> tree = empty(order);
    for (int i = from; i < to; ++i)
      tree.insert(i, String.valueOf(i));
    return tree;
  }

  /**
   * Tree where every node holds the maximum of order - 1 elements, with keys
   * 0 ... order^(depth + 1) - 2.
   */
  static BTree<Integer, String> maximalTree(int depth, int order) {
    AtomicBoolean edit = new AtomicBoolean(true);
    Node<Integer, String> root = maximalNode(depth, order, new int[] {0}, edit);
    return new BTree<Integer, String>(root, CMP, new Settings(order), edit);
  }

  @SuppressWarnings("unchecked")
  static Node<Integer, String> maximalNode(int depth, int order, int[] next, AtomicBoolean edit) {
    int len = order - 1;
    Integer[] keys = new Integer[order];
    String[] values = new String[order];
    Node<Integer, String>[] children = depth == 0 ? null : new Node[order + 1];
    int count = len;
    for (int i = 0; i <= len; ++i) {
      if (children != null) {
        children[i] = maximalNode(depth - 1, order, next, edit);
        count += children[i]._count;
      }
      if (i < len) {
        keys[i] = next[0];
        values[i] = String.valueOf(next[0]);
        next[0] += 1;
      }
    }
    return new Node<Integer, String>(order, depth, len, keys, values, children, count, edit);
  }

  static Map.Entry<Integer, String> entry(int key, String value) {
    return Node.entry(key, value);
  }

  static List<Integer> ints(int from, int to) {
    List<Integer> res = new ArrayList<>(Math.max(0, to - from));
    for (int i = from; i < to; ++i)
      res.add(i);
    return res;
  }

  static List<Integer> list(int... keys) {
    List<Integer> res = new ArrayList<>(keys.length);
    for (int key: keys)
      res.add(key);
    return res;
  }

  static List<Integer> concat(List<Integer> a, List<Integer> b) {
    List<Integer> res = new ArrayList<>(a);
    res.addAll(b);
    return res;
  }

  static <Key, Value> BTree<Key, Value> assertValid(BTree<Key, Value> tree) {
    tree.validate();
    return tree;
  }

  static void assertKeys(List<Integer> expected, BTree<Integer, String> tree) {
    assertEquals(expected, tree.keys());
    assertEquals(expected.size(), tree.count());
    tree.validate();
  }

  // Ascending random keys below bound, duplicates likely
  static int[] randomKeys(Random random, int size, int bound) {
    int[] keys = new int[size];
    for (int i = 0; i < size; ++i)
      keys[i] = random.nextInt(bound);
    Arrays.sort(keys);
    return keys;
  }

  // Multiset reference model

  static TreeMap<Integer, Integer> counts(List<Integer> keys) {
    TreeMap<Integer, Integer> res = new TreeMap<>();
    for (Integer key: keys)
      res.merge(key, 1, Integer::sum);
    return res;
  }

  static List<Integer> expand(Map<Integer, Integer> counts) {
    List<Integer> res = new ArrayList<>();
    for (Map.Entry<Integer, Integer> e: counts.entrySet())
      for (int i = 0; i < e.getValue(); ++i)
        res.add(e.getKey());
    return res;
  }

  // Expected keys of a merge, given the multiplicity rule for keys in one or both trees
  interface Multiplicity {
    int apply(int m, int n);
  }

  static List<Integer> merged(List<Integer> a, List<Integer> b, Multiplicity rule) {
    TreeMap<Integer, Integer> ca = counts(a), cb = counts(b);
    TreeSet<Integer> keys = new TreeSet<>(ca.keySet());
    keys.addAll(cb.keySet());
    TreeMap<Integer, Integer> res = new TreeMap<>();
    for (Integer key: keys) {
      int c = rule.apply(ca.getOrDefault(key, 0), cb.getOrDefault(key, 0));
      if (c > 0)
        res.put(key, c);
    }
    return expand(res);
  }
}

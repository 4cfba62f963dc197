package me.tonsky.persistent_btree;

import java.util.*;

public class ArrayUtil {
  public static <T> T[] copy(T[] src, int from, int to, T[] target, int offset) {
    System.arraycopy(src, from, target, offset, to-from);
    return target;
  }

  // Moves [from, to) by delta within the same array. Shifting left clears [to+delta, to)
  public static <T> void shift(T[] arr, int from, int to, int delta) {
    if (to > from) {
      System.arraycopy(arr, from, arr, from + delta, to - from);
    }
    if (delta < 0) {
      Arrays.fill(arr, to + delta, to, null);
    }
  }

  public static <Key, Value> int countAll(Node<Key, Value>[] children, int from, int to) {
    int count = 0;
    for (int i = from; i < to; ++i)
      count += children[i]._count;
    return count;
  }
}

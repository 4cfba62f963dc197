package me.tonsky.persistent_btree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables shared by a tree and every tree derived from it.
 */
public class Settings {
  private static final Logger logger = LoggerFactory.getLogger(Settings.class);

  // Target memory footprint of a single node, in bytes
  public static final int DEFAULT_NODE_SIZE = 16383;
  // Key reference + payload reference
  public static final int ELEMENT_SIZE = 16;
  public static final int MIN_DEFAULT_ORDER = 8;

  public static final Settings DEFAULT = new Settings();

  public final int _order;
  public final double _fillFactor;

  public Settings() {
    this(0, 0);
  }

  public Settings(int order) {
    this(order, 0);
  }

  public Settings(int order, double fillFactor) {
    if (order <= 0) {
      order = defaultOrder(DEFAULT_NODE_SIZE);
    }
    if (order < 2) {
      throw new IllegalArgumentException("Order must be at least 2, got " + order);
    }
    if (fillFactor <= 0) {
      fillFactor = 1;
    }
    if (fillFactor > 1 || Double.isNaN(fillFactor)) {
      throw new IllegalArgumentException("Fill factor must be in (0, 1], got " + fillFactor);
    }
    _order = order;
    _fillFactor = fillFactor;
  }

  public static int defaultOrder(int nodeSize) {
    int order = Math.max(MIN_DEFAULT_ORDER, nodeSize / ELEMENT_SIZE);
    logger.debug("Default order for node size {} is {}", nodeSize, order);
    return order;
  }

  public int order() {
    return _order;
  }

  public double fillFactor() {
    return _fillFactor;
  }

  public int maxKeys() {
    return _order - 1;
  }

  public int minChildren() {
    return (_order + 1) >>> 1;
  }

  public int minKeys() {
    return minChildren() - 1;
  }

  public int keysPerNode() {
    int keys = (int) (_fillFactor * maxKeys() + 0.5);
    return Math.max(minKeys(), Math.min(maxKeys(), Math.max(1, keys)));
  }

  public Settings withFillFactor(double fillFactor) {
    return new Settings(_order, fillFactor);
  }

  public void checkCompatible(Settings other) {
    if (_order != other._order) {
      throw new IllegalArgumentException("Trees have different orders: " + _order + " and " + other._order);
    }
  }

  @Override
  public String toString() {
    return "Settings{order=" + _order + ", fillFactor=" + _fillFactor + "}";
  }
}

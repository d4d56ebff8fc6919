package com.onthegomap.skycorr.collection;

import com.carrotsearch.hppc.LongDoubleHashMap;
import com.carrotsearch.hppc.LongIntHashMap;
import com.carrotsearch.hppc.LongObjectHashMap;

/**
 * Static factory method for <a href="https://github.com/carrotsearch/hppc">High Performance Primitive Collections</a>
 * keyed by pixel id.
 */
public class Hppc {

  private Hppc() {}

  public static LongIntHashMap newLongIntHashMap() {
    return new LongIntHashMap(10, 0.75);
  }

  public static LongIntHashMap newLongIntHashMap(int size) {
    return new LongIntHashMap(size, 0.75);
  }

  public static LongDoubleHashMap newLongDoubleHashMap(int size) {
    return new LongDoubleHashMap(size, 0.75);
  }

  public static <T> LongObjectHashMap<T> newLongObjectHashMap(int size) {
    return new LongObjectHashMap<>(size, 0.75);
  }
}

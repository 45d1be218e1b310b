package com.dialogstatekeeper.dialogstorage.proxy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Typed reads from raw store mappings. Numbers may come back narrowed by the store. */
final class RawValues {

  private RawValues() {}

  static String string(Map<String, Object> raw, String field, String fallback) {
    Object value = raw.get(field);
    return value == null ? fallback : value.toString();
  }

  static Long longValue(Map<String, Object> raw, String field) {
    return toLong(raw.get(field));
  }

  static boolean bool(Map<String, Object> raw, String field) {
    return Boolean.TRUE.equals(raw.get(field));
  }

  static Long toLong(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      return n.longValue();
    }
    return Long.parseLong(value.toString());
  }

  static List<String> strings(Map<String, Object> raw, String field) {
    Object value = raw.get(field);
    List<String> result = new ArrayList<>();
    if (value instanceof List<?> list) {
      for (Object item : list) {
        result.add(String.valueOf(item));
      }
    }
    return result;
  }

  /** Null elements are skipped. */
  static List<Long> longs(Object value) {
    List<Long> result = new ArrayList<>();
    if (value instanceof List<?> list) {
      for (Object item : list) {
        if (item != null) {
          result.add(toLong(item));
        }
      }
    }
    return result;
  }

  static Map<String, Object> map(Object value) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (value instanceof Map<?, ?> m) {
      for (Map.Entry<?, ?> e : m.entrySet()) {
        result.put(String.valueOf(e.getKey()), e.getValue());
      }
    }
    return result;
  }
}

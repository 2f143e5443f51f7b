package com.bassline.core.lattice;

import java.util.Map;

/** A collection value keyed by strings (dicts and tagged maps). */
public interface KeyedCollection extends LatticeValue {

    Map<String, LatticeValue> entries();

    default LatticeValue get(String key) {
        return entries().get(key);
    }
}

package com.bassline.core.lattice;

import java.util.List;

/** A collection value whose members are plain elements (sets and arrays). */
public interface ElementCollection extends LatticeValue {

    /** Members in storage order. Canonical order for sets and tagged arrays. */
    List<LatticeValue> elements();

    default int size() {
        return elements().size();
    }
}

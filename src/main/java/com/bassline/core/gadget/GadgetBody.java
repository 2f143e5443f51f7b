package com.bassline.core.gadget;

import com.bassline.core.lattice.LatticeValue;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * The computation of a gadget: present inputs in, complete output map out.
 *
 * The returned future completes with the whole output map at once; the
 * scheduler publishes nothing until it does. A body may throw or complete
 * exceptionally; either is reported as a fault for that invocation only.
 */
@FunctionalInterface
public interface GadgetBody {

    /**
     * @param inputs Values of the present input ports, keyed by port name.
     * @return Output values keyed by output port name. Ports left out of the map
     *         are not written.
     */
    CompletableFuture<Map<String, LatticeValue>> apply(Map<String, LatticeValue> inputs);

    /** Wraps a synchronous function. */
    static GadgetBody sync(Function<Map<String, LatticeValue>, Map<String, LatticeValue>> fn) {
        return inputs -> CompletableFuture.completedFuture(fn.apply(inputs));
    }
}

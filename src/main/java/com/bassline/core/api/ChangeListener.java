package com.bassline.core.api;

import java.util.List;

/**
 * Subscriber to the changes of one group.
 *
 * Structural changes arrive one at a time as they happen. Value changes are
 * collected during a propagation pass and delivered together once the pass
 * has converged.
 */
@FunctionalInterface
public interface ChangeListener {

    void onChanges(List<NetworkChange> changes);
}

package com.flowmodel.materializer.placement;

/** Planned element of an if tree as seen by the layout: a decision or an action. */
public interface BranchShape {
}

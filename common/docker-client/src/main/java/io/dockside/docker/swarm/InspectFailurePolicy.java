package io.dockside.docker.swarm;

/**
 * What the reconciler does when inspecting the existing service fails for a reason
 * other than the service being absent.
 */
public enum InspectFailurePolicy {

  /**
   * Propagate the failure; only a confirmed absence leads to a create. Opt-in.
   */
  STRICT,

  /**
   * Treat every inspect failure as absence and create the service. A transient
   * failure can then produce a duplicate create attempt. This is the default.
   */
  TREAT_AS_ABSENT
}

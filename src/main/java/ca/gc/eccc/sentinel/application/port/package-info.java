/**
 * Capability ports consumed by the decision-and-dispatch workflow, and the typed failures they raise.
 *
 * <p>Every external capability (observation source, classifier, response planner, notifier,
 * audit sink) is reached through an interface in this package so adapters can be swapped and
 * replaced by deterministic fakes in tests.</p>
 */
package ca.gc.eccc.sentinel.application.port;

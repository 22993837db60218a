/**
 * Concrete adapters for the capability ports: observation files, the threshold classifier, template
 * response plans, notifiers, audit sinks, the approval inbox, executors, clock and metrics.
 */
package ca.gc.eccc.sentinel.infrastructure;

/**
 * Decision-and-dispatch workflow: the per-incident state machine, severity gating, approval
 * suspension, the retry/timeout harness around external capabilities, and the audit trail.
 */
package ca.gc.eccc.sentinel.application.workflow;

/**
 * File-based operator surface for approval requests.
 */
package ca.gc.eccc.sentinel.infrastructure.approval;

/**
 * Input validation for configuration values and CLI arguments. Every helper throws
 * {@link java.lang.IllegalArgumentException} naming the offending key.
 */
package ca.gc.eccc.sentinel.validation;

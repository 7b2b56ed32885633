/**
 * Input validation helpers shared by the API, configuration, and logging layers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.validation;

/**
 * <strong>Purpose:</strong> YAML configuration loading and wiring of the logging facility.
 * <p><strong>Flow:</strong> {@link ca.gc.cra.fmtlog.config.YamlConfigLoader} flattens the document,
 * {@link ca.gc.cra.fmtlog.config.FacilityConfig} types it, and {@link ca.gc.cra.fmtlog.config.CompositionRoot}
 * builds the registry.</p>
 * <p><strong>Errors:</strong> Invalid documents raise {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fmtlog.config;

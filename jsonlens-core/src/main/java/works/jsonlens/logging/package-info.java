/**
 * Diagnostic context support for logging.
 * Backend-specific helpers live in separate modules, such as {@code jsonlens-logback}.
 */
package works.jsonlens.logging;

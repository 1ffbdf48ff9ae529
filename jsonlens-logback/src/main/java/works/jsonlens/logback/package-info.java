/**
 * Logback-specific logging utilities.
 */
package works.jsonlens.logback;

/**
 * Errors reported by session operations.
 * <p>
 * {@link works.jsonlens.exceptions.JsonLensException} and its four subclasses
 * describe why an operation failed;
 * {@link works.jsonlens.exceptions.MutationInProgressException} describes misuse
 * of the single-writer discipline, which is a programming error rather than a data error.
 */
package works.jsonlens.exceptions;

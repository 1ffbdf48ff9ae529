/**
 * Browsing and editing of a single JSON document.
 * <p>
 * Start with {@link works.jsonlens.Session}, which owns a document and its shadow tree index.
 * The index itself is described in {@link works.jsonlens.tree},
 * and the address expressions used to locate nodes in {@link works.jsonlens.address}.
 */
package works.jsonlens;

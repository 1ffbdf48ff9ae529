/**
 * The shadow tree: a flat pre-order index describing a document's structure,
 * plus the expansion and visibility state layered on top of it.
 */
package works.jsonlens.tree;

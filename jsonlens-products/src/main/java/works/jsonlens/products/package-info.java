/**
 * Products derived from a session's document: the intermediate listing built by the
 * {@link works.jsonlens.products.DerivationPipeline}, the final product built from it by the
 * {@link works.jsonlens.products.ProjectionTransform}, and the path back into the document taken by
 * {@link works.jsonlens.products.CorrectionsApplier}.
 * <p>
 * {@link works.jsonlens.products.ProductWorker} runs these off the session's owning thread.
 */
package works.jsonlens.products;

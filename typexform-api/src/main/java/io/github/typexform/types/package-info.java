/**
 * The type graph.
 * <p>
 * Graphs are built with a {@link io.github.typexform.types.TypeBuilder}, which deduplicates
 * structurally identical types, and are immutable once finished. A graph is changed by
 * {@link io.github.typexform.types.TypeGraph#rewrite rewriting} it into a new one.
 */
package io.github.typexform.types;

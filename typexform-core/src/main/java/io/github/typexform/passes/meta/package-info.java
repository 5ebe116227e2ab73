/**
 * Passes that inspect a graph without changing it.
 */
package io.github.typexform.passes.meta;

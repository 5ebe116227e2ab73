/**
 * The transformer IR: trees of decoding steps, and their reversal into encoding steps.
 */
package io.github.typexform.transformers;

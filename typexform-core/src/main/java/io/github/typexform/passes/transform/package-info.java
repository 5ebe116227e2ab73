/**
 * Passes that replace types a target can't represent with carrier types,
 * and the strategies they replace each kind of type with.
 */
package io.github.typexform.passes.transform;

/**
 * In-memory model of parsed TDL: conjunctions of types, literals and
 * attribute-value matrices, named type definitions with their
 * coreferences, and the morphological character classes used by
 * inflectional rules.
 */
package exm.tdl.common.lang;

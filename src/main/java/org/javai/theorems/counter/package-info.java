/**
 * Per-run hierarchical numbering of block occurrences.
 */
package org.javai.theorems.counter;

/**
 * Declaration ordering: dependency-respecting, style-batched order of the
 * environments a document uses.
 */
package org.javai.theorems.order;

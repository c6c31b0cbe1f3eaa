/**
 * Composition of the decision stages into a single per-observation call.
 *
 * @since 1.0.0
 */
package com.phoenix.core.pipeline;

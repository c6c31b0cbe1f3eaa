/**
 * Topology-aware correlation of deviations within a sliding time window.
 *
 * <p>
 * Reachability is directed: a deviation at an upstream component pulls in
 * deviations of everything it feeds, never the other way round.
 * </p>
 *
 * @since 1.0.0
 */
package com.phoenix.core.correlation;

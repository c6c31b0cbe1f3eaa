/**
 * Component topology: the directed dependency graph used for correlation and
 * the set of critical components used for escalation.
 *
 * <p>
 * {@link com.phoenix.core.topology.TopologyLoader} parses the JSON form and
 * validates it; {@link com.phoenix.core.topology.TopologyGraph} is the
 * downstream adjacency the correlator walks.
 * </p>
 *
 * @since 1.0.0
 */
package com.phoenix.core.topology;

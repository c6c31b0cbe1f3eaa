package com.phoenix.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered set of deviations linked through downstream topology reachability
 * within the correlation window.
 *
 * <p>
 * Deviations appear in traversal order: all active deviations of the first
 * visited component, then those of the next, and so on.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationGroup implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Deviation> deviations;

    /**
     * @param deviations the grouped deviations; copied
     * @throws NullPointerException if {@code deviations} is {@code null}
     */
    public CorrelationGroup(List<Deviation> deviations) {
        Objects.requireNonNull(deviations, "deviations must not be null");
        this.deviations = Collections.unmodifiableList(new ArrayList<>(deviations));
    }

    /**
     * @return unmodifiable list of the grouped deviations
     */
    public List<Deviation> getDeviations() {
        return deviations;
    }

    /**
     * @return distinct components in the group, in order of first appearance
     */
    public Set<String> components() {
        Set<String> components = new LinkedHashSet<>();
        for (Deviation d : deviations) {
            components.add(d.getComponent());
        }
        return Collections.unmodifiableSet(components);
    }

    /**
     * @return number of {@link DeviationLevel#STRONG} deviations in the group
     */
    public int strongCount() {
        int count = 0;
        for (Deviation d : deviations) {
            if (d.isStrong()) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return deviations.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationGroup that))
            return false;
        return deviations.equals(that.deviations);
    }

    @Override
    public int hashCode() {
        return deviations.hashCode();
    }

    @Override
    public String toString() {
        return "CorrelationGroup{components=" + components() + ", deviations=" + deviations.size() + '}';
    }
}

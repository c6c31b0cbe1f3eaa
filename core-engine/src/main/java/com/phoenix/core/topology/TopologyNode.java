package com.phoenix.core.topology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Objects;

/**
 * A component in the topology graph.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TopologyNode implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Component id; matches the {@code component} of observations. */
    private String id;

    /** High-impact component. Optional in JSON, defaults to {@code false}. */
    private boolean critical;

    /** No-arg constructor required by Jackson. */
    public TopologyNode() {
    }

    public TopologyNode(String id, boolean critical) {
        this.id = id;
        this.critical = critical;
    }

    public static TopologyNode of(String id) {
        return new TopologyNode(id, false);
    }

    public static TopologyNode critical(String id) {
        return new TopologyNode(id, true);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public boolean isCritical() {
        return critical;
    }

    public void setCritical(boolean critical) {
        this.critical = critical;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TopologyNode that))
            return false;
        return critical == that.critical && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, critical);
    }

    @Override
    public String toString() {
        return critical ? id + "(critical)" : String.valueOf(id);
    }
}

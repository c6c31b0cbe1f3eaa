package com.phoenix.core.topology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Objects;

/**
 * Directed dependency edge: a failure at {@code from} may affect {@code to}.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TopologyEdge implements Serializable {

    private static final long serialVersionUID = 1L;

    private String from;
    private String to;

    /** No-arg constructor required by Jackson. */
    public TopologyEdge() {
    }

    public TopologyEdge(String from, String to) {
        this.from = from;
        this.to = to;
    }

    public static TopologyEdge of(String from, String to) {
        return new TopologyEdge(from, to);
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TopologyEdge that))
            return false;
        return Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}

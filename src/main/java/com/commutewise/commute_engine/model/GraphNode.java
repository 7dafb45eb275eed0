package com.commutewise.commute_engine.model;

import java.util.List;

public final class GraphNode {
    public final int index;
    public final String id;
    public final String name;
    public final String address;
    public final Coordinate position;
    public final TerminalCategory terminalCategory;
    public final List<GraphEdge> edges;

    public GraphNode(int index, String id, String name, String address, Coordinate position,
                     TerminalCategory terminalCategory, List<GraphEdge> edges) {
        this.index = index;
        this.id = id;
        this.name = name;
        this.address = address;
        this.position = position;
        this.terminalCategory = terminalCategory;
        this.edges = List.copyOf(edges);
    }

    @Override
    public String toString() {
        return id + " " + position;
    }
}

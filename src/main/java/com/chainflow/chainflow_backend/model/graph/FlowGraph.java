package com.chainflow.chainflow_backend.model.graph;

import com.chainflow.chainflow_backend.exception.FlowValidationException;
import com.chainflow.chainflow_backend.model.domain.FlowEdge;
import com.chainflow.chainflow_backend.model.domain.FlowNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, indexed view of one flow's nodes and edges.
 *
 * Roots are nodes without an incoming edge; group membership is not considered.
 * Leaves are nodes without an outgoing edge that are not group members.
 * Both lists keep the node declaration order, so the partition is stable for a given document.
 */
public final class FlowGraph {

    private final Map<String, FlowNode> nodes;
    private final List<FlowEdge> edges;
    private final Map<String, List<FlowEdge>> outgoing;
    private final Map<String, List<FlowEdge>> incoming;
    private final List<String> roots;
    private final List<String> leaves;

    private FlowGraph(Map<String, FlowNode> nodes, List<FlowEdge> edges) {
        this.nodes = nodes;
        this.edges = edges;
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();
        nodes.keySet().forEach(id -> {
            outgoing.put(id, new ArrayList<>());
            incoming.put(id, new ArrayList<>());
        });
        for (FlowEdge e : edges) {
            outgoing.get(e.getSource()).add(e);
            incoming.get(e.getTarget()).add(e);
        }

        List<String> r = new ArrayList<>();
        List<String> l = new ArrayList<>();
        nodes.values().forEach(n -> {
            if (incoming.get(n.getId()).isEmpty()) r.add(n.getId());
            if (outgoing.get(n.getId()).isEmpty() && !n.isGroupMember()) l.add(n.getId());
        });
        this.roots = Collections.unmodifiableList(r);
        this.leaves = Collections.unmodifiableList(l);
    }

    /**
     * @throws FlowValidationException on a missing or duplicate node id, or an edge whose
     *                                 source or target is not a node of the flow
     */
    public static FlowGraph build(List<FlowNode> nodes, List<FlowEdge> edges) {
        Map<String, FlowNode> index = new LinkedHashMap<>();
        for (FlowNode n : nodes != null ? nodes : List.<FlowNode>of()) {
            if (n == null || n.getId() == null || n.getId().isBlank()) {
                throw new FlowValidationException("Node without id");
            }
            if (index.putIfAbsent(n.getId(), n) != null) {
                throw new FlowValidationException("Duplicate node id: " + n.getId());
            }
        }

        List<FlowEdge> validEdges = new ArrayList<>();
        for (FlowEdge e : edges != null ? edges : List.<FlowEdge>of()) {
            if (e == null) continue;
            String edgeName = e.getId() != null ? e.getId() : e.getSource() + "->" + e.getTarget();
            if (e.getSource() == null || !index.containsKey(e.getSource())) {
                throw new FlowValidationException("Edge " + edgeName + " references missing source node: " + e.getSource());
            }
            if (e.getTarget() == null || !index.containsKey(e.getTarget())) {
                throw new FlowValidationException("Edge " + edgeName + " references missing target node: " + e.getTarget());
            }
            validEdges.add(e);
        }
        return new FlowGraph(Collections.unmodifiableMap(index), Collections.unmodifiableList(validEdges));
    }

    public FlowNode getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public List<FlowNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    public List<FlowEdge> getEdges() {
        return edges;
    }

    public List<String> getRoots() {
        return roots;
    }

    public List<String> getLeaves() {
        return leaves;
    }

    /** Nodes with no outgoing edge, group members included. */
    public List<String> getTerminalNodes() {
        return nodes.keySet().stream()
                .filter(id -> outgoing.get(id).isEmpty())
                .toList();
    }

    public List<FlowEdge> getOutgoing(String nodeId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(nodeId, List.of()));
    }

    public List<FlowEdge> getIncoming(String nodeId) {
        return Collections.unmodifiableList(incoming.getOrDefault(nodeId, List.of()));
    }

    public int size() {
        return nodes.size();
    }
}

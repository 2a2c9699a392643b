package org.processdiagram.converter.layout;

import org.eclipse.elk.alg.layered.LayeredLayoutProvider;
import org.eclipse.elk.alg.layered.options.CycleBreakingStrategy;
import org.eclipse.elk.alg.layered.options.LayeredOptions;
import org.eclipse.elk.alg.layered.options.LayeringStrategy;
import org.eclipse.elk.alg.layered.options.OrderingStrategy;
import org.eclipse.elk.core.options.CoreOptions;
import org.eclipse.elk.core.util.BasicProgressMonitor;
import org.eclipse.elk.graph.ElkNode;
import org.eclipse.elk.graph.util.ElkGraphUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Layers a directed graph whose nodes are numbered in source order, using ELK layered.
 * <ol>
 *     <li>cycles are broken by a depth-first search,</li>
 *     <li>connected nodes are layered by longest path,</li>
 *     <li>nodes without any edge go to one extra layer after the last,</li>
 *     <li>inside a layer the crossing-minimized order of ELK is kept, with model order as tie breaker.</li>
 * </ol>
 * Only layers and in-layer order are taken from ELK; the caller sizes and places the nodes itself.
 */
public class RankAssigner {
    // Every node gets the same size so that all members of a layer share one coordinate
    private static final double NODE_SIZE = 20;
    private static final double LAYER_GAP = 20;
    private static final double NODE_GAP = 10;

    private final long budget;
    private final Direction direction;

    /**
     * @param budget    maximum estimated work (nodes times edges) before giving up
     * @param direction direction in which layers advance
     */
    public RankAssigner(long budget, Direction direction) {
        this.budget = budget;
        this.direction = direction;
    }

    public RankAssigner(long budget) {
        this(budget, Direction.LR);
    }

    /**
     * @param nodeCount number of nodes, numbered {@code 0..nodeCount-1}
     * @param edges     directed edges as {@code {from, to}} pairs; self loops are ignored
     * @throws LayoutBudgetExceededException when the estimated work exceeds the budget
     * @throws IllegalStateException         when ELK rejects the graph
     */
    public Ranking assign(int nodeCount, List<int[]> edges) {
        boolean[] connected = new boolean[nodeCount];
        List<int[]> kept = new ArrayList<>();
        for (int[] edge : edges) {
            if (edge[0] == edge[1]) {
                continue;
            }
            kept.add(edge);
            connected[edge[0]] = true;
            connected[edge[1]] = true;
        }

        long estimate = (long) nodeCount * (kept.size() + 1);
        if (estimate > budget) {
            throw new LayoutBudgetExceededException(estimate, budget);
        }

        int[] ranks = new int[nodeCount];
        int[] order = new int[nodeCount];
        int layerCount = kept.isEmpty() ? 0 : layerConnected(nodeCount, kept, connected, ranks, order);

        int position = 0;
        for (int i = 0; i < nodeCount; i++) {
            if (!connected[i]) {
                ranks[i] = layerCount;
                order[i] = position++;
            }
        }
        return new Ranking(ranks, order);
    }

    /**
     * Runs ELK on the connected nodes and reads layers back from the resulting coordinates.
     *
     * @return the number of layers used
     */
    private int layerConnected(int nodeCount, List<int[]> edges, boolean[] connected, int[] ranks, int[] order) {
        ElkNode graph = ElkGraphUtil.createGraph();
        graph.setProperty(CoreOptions.DIRECTION, elkDirection());
        graph.setProperty(CoreOptions.SEPARATE_CONNECTED_COMPONENTS, false);
        graph.setProperty(CoreOptions.RANDOM_SEED, 1);
        graph.setProperty(CoreOptions.SPACING_NODE_NODE, NODE_GAP);
        graph.setProperty(LayeredOptions.SPACING_NODE_NODE_BETWEEN_LAYERS, LAYER_GAP);
        graph.setProperty(LayeredOptions.CYCLE_BREAKING_STRATEGY, CycleBreakingStrategy.DEPTH_FIRST);
        graph.setProperty(LayeredOptions.LAYERING_STRATEGY, LayeringStrategy.LONGEST_PATH);
        graph.setProperty(LayeredOptions.CONSIDER_MODEL_ORDER_STRATEGY, OrderingStrategy.NODES_AND_EDGES);

        // Nodes are created in index order, which is the model order ELK falls back on
        ElkNode[] nodes = new ElkNode[nodeCount];
        List<Integer> members = new ArrayList<>();
        for (int i = 0; i < nodeCount; i++) {
            if (connected[i]) {
                nodes[i] = ElkGraphUtil.createNode(graph);
                nodes[i].setIdentifier(Integer.toString(i));
                nodes[i].setWidth(NODE_SIZE);
                nodes[i].setHeight(NODE_SIZE);
                members.add(i);
            }
        }
        for (int[] edge : edges) {
            ElkGraphUtil.createSimpleEdge(nodes[edge[0]], nodes[edge[1]]);
        }

        try {
            new LayeredLayoutProvider().layout(graph, new BasicProgressMonitor());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Layered layout failed: " + e.getMessage(), e);
        }

        members.sort(Comparator.<Integer>comparingDouble(i -> along(nodes[i])).thenComparingInt(i -> i));
        List<List<Integer>> layers = new ArrayList<>();
        double layerEnd = Double.NEGATIVE_INFINITY;
        for (int node : members) {
            double start = along(nodes[node]);
            if (layers.isEmpty() || start >= layerEnd) {
                layers.add(new ArrayList<>());
                layerEnd = start + NODE_SIZE;
            }
            layers.get(layers.size() - 1).add(node);
            layerEnd = Math.max(layerEnd, start + NODE_SIZE);
        }

        for (int rank = 0; rank < layers.size(); rank++) {
            List<Integer> layer = layers.get(rank);
            layer.sort(Comparator.<Integer>comparingDouble(i -> across(nodes[i])).thenComparingInt(i -> i));
            for (int position = 0; position < layer.size(); position++) {
                ranks[layer.get(position)] = rank;
                order[layer.get(position)] = position;
            }
        }
        return layers.size();
    }

    /**
     * Coordinate along the layer direction, growing from the first layer to the last.
     */
    private double along(ElkNode node) {
        double coordinate = direction.isHorizontal() ? node.getX() : node.getY();
        return direction.isReversed() ? -coordinate - NODE_SIZE : coordinate;
    }

    private double across(ElkNode node) {
        return direction.isHorizontal() ? node.getY() : node.getX();
    }

    private org.eclipse.elk.core.options.Direction elkDirection() {
        return switch (direction) {
            case LR -> org.eclipse.elk.core.options.Direction.RIGHT;
            case TB -> org.eclipse.elk.core.options.Direction.DOWN;
            case RL -> org.eclipse.elk.core.options.Direction.LEFT;
            case BT -> org.eclipse.elk.core.options.Direction.UP;
        };
    }
}

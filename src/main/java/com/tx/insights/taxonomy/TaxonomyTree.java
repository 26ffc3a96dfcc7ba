package com.tx.insights.taxonomy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Arena-backed taxonomy forest.
 *
 * <p>Nodes live in a flat list and refer to each other by integer index only, so the
 * tree is immutable once built and safe to read from many threads. Structural
 * problems in the supplied parent links are repaired and reported as anomalies:
 * <ul>
 *   <li>a parent id that does not exist makes the node a root ({@link AnomalyType#DANGLING_PARENT})</li>
 *   <li>a parent chain that loops is cut at one node of the loop ({@link AnomalyType#CYCLE})</li>
 *   <li>a declared depth that differs from the structural one is flagged ({@link AnomalyType#DEPTH_MISMATCH})</li>
 * </ul>
 */
public final class TaxonomyTree {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyTree.class);
    private static final int[] NO_CHILDREN = new int[0];

    private final List<TaxonomyNode> nodes;
    private final Map<String, Integer> indexById;
    private final int[] parent;
    private final int[][] children;
    private final int[] depth;
    private final int[] roots;
    private final int[] byDepthDescending;
    private final Map<Integer, int[]> byDepth;
    private final Map<String, Integer> productOwner;
    private final List<TreeAnomaly> anomalies;

    TaxonomyTree(List<TaxonomyNode> candidates, List<TreeAnomaly> buildAnomalies) {
        List<TreeAnomaly> found = new ArrayList<>(buildAnomalies);

        List<TaxonomyNode> accepted = new ArrayList<>(candidates.size());
        Map<String, Integer> ids = new HashMap<>();
        for (TaxonomyNode node : candidates) {
            if (ids.containsKey(node.getId())) {
                found.add(new TreeAnomaly(AnomalyType.DUPLICATE_PATH, node.getId(),
                    "Duplicate node id ignored: " + node.getCanonicalPath()));
                continue;
            }
            ids.put(node.getId(), accepted.size());
            accepted.add(node);
        }

        int n = accepted.size();
        this.nodes = Collections.unmodifiableList(accepted);
        this.indexById = Collections.unmodifiableMap(ids);
        this.parent = new int[n];

        for (int i = 0; i < n; i++) {
            TaxonomyNode node = accepted.get(i);
            String parentId = node.getParentId();
            if (parentId == null) {
                parent[i] = -1;
            } else if (!ids.containsKey(parentId) || parentId.equals(node.getId())) {
                parent[i] = -1;
                found.add(new TreeAnomaly(AnomalyType.DANGLING_PARENT, node.getId(),
                    "Parent '" + parentId + "' not found, treated as root"));
            } else {
                parent[i] = ids.get(parentId);
            }
        }

        breakCycles(found);

        this.children = buildChildren(n);
        this.depth = new int[n];
        List<Integer> rootList = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (parent[i] < 0) {
                rootList.add(i);
            }
        }
        this.roots = rootList.stream().mapToInt(Integer::intValue).toArray();
        assignDepths();

        for (int i = 0; i < n; i++) {
            TaxonomyNode node = accepted.get(i);
            if (node.getDepth() != depth[i]) {
                found.add(new TreeAnomaly(AnomalyType.DEPTH_MISMATCH, node.getId(),
                    "Declared depth " + node.getDepth() + " but structural depth " + depth[i]));
            }
        }

        this.byDepthDescending = sortByDepthDescending();
        this.byDepth = groupByDepth();
        this.productOwner = indexProducts(found);
        this.anomalies = List.copyOf(found);

        if (!anomalies.isEmpty()) {
            log.warn("Taxonomy assembled with {} anomalies", anomalies.size());
        }
    }

    /**
     * Assembles a tree from externally supplied nodes, e.g. nodes loaded from storage.
     */
    public static TaxonomyTree fromNodes(Collection<TaxonomyNode> nodes) {
        return new TaxonomyTree(new ArrayList<>(nodes), List.of());
    }

    public static TaxonomyTree empty() {
        return new TaxonomyTree(List.of(), List.of());
    }

    private void breakCycles(List<TreeAnomaly> found) {
        int n = parent.length;
        // 0 = unvisited, 1 = on current walk, 2 = reaches a root
        byte[] state = new byte[n];
        for (int start = 0; start < n; start++) {
            if (state[start] != 0) {
                continue;
            }
            List<Integer> walk = new ArrayList<>();
            int current = start;
            while (current >= 0 && state[current] == 0) {
                state[current] = 1;
                walk.add(current);
                current = parent[current];
            }
            if (current >= 0 && state[current] == 1) {
                // current is the first node seen twice, so it sits on the loop
                found.add(new TreeAnomaly(AnomalyType.CYCLE, nodes.get(current).getId(),
                    "Parent chain loops, node treated as root"));
                parent[current] = -1;
            }
            for (int index : walk) {
                state[index] = 2;
            }
        }
    }

    private int[][] buildChildren(int n) {
        int[] counts = new int[n];
        for (int i = 0; i < n; i++) {
            if (parent[i] >= 0) {
                counts[parent[i]]++;
            }
        }
        int[][] result = new int[n][];
        for (int i = 0; i < n; i++) {
            result[i] = counts[i] == 0 ? NO_CHILDREN : new int[counts[i]];
        }
        int[] fill = new int[n];
        for (int i = 0; i < n; i++) {
            int p = parent[i];
            if (p >= 0) {
                result[p][fill[p]++] = i;
            }
        }
        return result;
    }

    private void assignDepths() {
        Deque<Integer> queue = new ArrayDeque<>();
        for (int root : roots) {
            depth[root] = 0;
            queue.add(root);
        }
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int child : children[current]) {
                depth[child] = depth[current] + 1;
                queue.add(child);
            }
        }
    }

    private int[] sortByDepthDescending() {
        return IntStream.range(0, nodes.size())
            .boxed()
            .sorted((a, b) -> depth[a] != depth[b] ? Integer.compare(depth[b], depth[a]) : Integer.compare(a, b))
            .mapToInt(Integer::intValue)
            .toArray();
    }

    private Map<Integer, int[]> groupByDepth() {
        Map<Integer, List<Integer>> groups = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            groups.computeIfAbsent(depth[i], d -> new ArrayList<>()).add(i);
        }
        Map<Integer, int[]> result = new HashMap<>();
        groups.forEach((d, list) -> result.put(d, list.stream().mapToInt(Integer::intValue).toArray()));
        return result;
    }

    private Map<String, Integer> indexProducts(List<TreeAnomaly> found) {
        Map<String, Integer> owners = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            for (String productId : nodes.get(i).getDirectProductIds()) {
                Integer previous = owners.putIfAbsent(productId, i);
                if (previous != null) {
                    found.add(new TreeAnomaly(AnomalyType.DUPLICATE_PATH, nodes.get(i).getId(),
                        "Product '" + productId + "' already owned by " + nodes.get(previous).getId()));
                }
            }
        }
        return Collections.unmodifiableMap(owners);
    }

    // Lookup

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<TaxonomyNode> nodes() {
        return nodes;
    }

    public boolean contains(String nodeId) {
        return nodeId != null && indexById.containsKey(nodeId);
    }

    public Optional<TaxonomyNode> find(String nodeId) {
        int index = indexOf(nodeId);
        return index < 0 ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public TaxonomyNode get(String nodeId) {
        int index = indexOf(nodeId);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return nodes.get(index);
    }

    /**
     * Arena index of a node, or -1 when the id is unknown.
     */
    public int indexOf(String nodeId) {
        if (nodeId == null) {
            return -1;
        }
        Integer index = indexById.get(nodeId);
        return index == null ? -1 : index;
    }

    public TaxonomyNode nodeAt(int index) {
        return nodes.get(index);
    }

    /**
     * Parent index in the arena, or -1 for roots (including repaired dangling parents).
     */
    public int parentIndex(int index) {
        return parent[index];
    }

    public int[] childIndexes(int index) {
        return children[index].clone();
    }

    public int depthAt(int index) {
        return depth[index];
    }

    public int rootCount() {
        return roots.length;
    }

    public int[] rootIndexes() {
        return roots.clone();
    }

    /**
     * All node indexes ordered deepest first; nodes of equal depth keep insertion order.
     */
    public int[] indexesByDepthDescending() {
        return byDepthDescending.clone();
    }

    // Traversal by id

    public int depthOf(String nodeId) {
        return depth[requireIndex(nodeId)];
    }

    public Optional<TaxonomyNode> parentOf(String nodeId) {
        int p = parent[requireIndex(nodeId)];
        return p < 0 ? Optional.empty() : Optional.of(nodes.get(p));
    }

    public List<TaxonomyNode> childrenOf(String nodeId) {
        int[] childIndexes = children[requireIndex(nodeId)];
        List<TaxonomyNode> result = new ArrayList<>(childIndexes.length);
        for (int child : childIndexes) {
            result.add(nodes.get(child));
        }
        return result;
    }

    /**
     * The node followed by its ancestors up to the root.
     */
    public List<TaxonomyNode> ancestorsOf(String nodeId) {
        List<TaxonomyNode> result = new ArrayList<>();
        int current = requireIndex(nodeId);
        while (current >= 0) {
            result.add(nodes.get(current));
            current = parent[current];
        }
        return result;
    }

    /**
     * All nodes at the same structural depth, including the node itself.
     */
    public List<TaxonomyNode> peersOf(String nodeId) {
        int[] group = byDepth.getOrDefault(depth[requireIndex(nodeId)], NO_CHILDREN);
        List<TaxonomyNode> result = new ArrayList<>(group.length);
        for (int index : group) {
            result.add(nodes.get(index));
        }
        return result;
    }

    public List<TaxonomyNode> roots() {
        List<TaxonomyNode> result = new ArrayList<>(roots.length);
        for (int root : roots) {
            result.add(nodes.get(root));
        }
        return result;
    }

    public Optional<TaxonomyNode> nodeOfProduct(String productId) {
        Integer index = productId == null ? null : productOwner.get(productId);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public int maxDepth() {
        return byDepthDescending.length == 0 ? -1 : depth[byDepthDescending[0]];
    }

    public List<TreeAnomaly> anomalies() {
        return anomalies;
    }

    private int requireIndex(String nodeId) {
        int index = indexOf(nodeId);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return index;
    }

    @Override
    public String toString() {
        return "TaxonomyTree{nodes=" + nodes.size() + ", roots=" + roots.length
            + ", maxDepth=" + maxDepth() + ", anomalies=" + anomalies.size()
            + ", rootIds=" + Arrays.toString(roots().stream().map(TaxonomyNode::getId).toArray()) + '}';
    }
}

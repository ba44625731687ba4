package me.golemcore.knowledge.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.Complexity;
import me.golemcore.knowledge.domain.model.ConceptCluster;
import me.golemcore.knowledge.domain.model.ConceptEdge;
import me.golemcore.knowledge.domain.model.Entity;
import me.golemcore.knowledge.domain.model.EntityType;
import me.golemcore.knowledge.domain.model.ExtractionResult;
import me.golemcore.knowledge.domain.model.GraphExport;
import me.golemcore.knowledge.domain.model.GraphStatistics;
import me.golemcore.knowledge.domain.model.GraphUpdatedEvent;
import me.golemcore.knowledge.domain.model.KnowledgeNode;
import me.golemcore.knowledge.domain.model.NodeMetadata;
import me.golemcore.knowledge.domain.model.NodeType;
import me.golemcore.knowledge.domain.model.Relationship;
import me.golemcore.knowledge.domain.model.RelationshipType;
import me.golemcore.knowledge.domain.model.SearchOptions;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory semantic knowledge graph.
 *
 * <p>
 * The service exclusively owns nodes, edges and clusters. Mutation happens only
 * through {@link #addToGraph(ExtractionResult)} and {@link #clear()}, both under
 * the write lock; queries take the read lock. Access statistics of nodes are
 * refreshed on every read.
 *
 * <p>
 * Clusters are recomputed from scratch after every merge using single-link
 * grouping around seed nodes (O(n²), fine at local-developer scale).
 *
 * @since 1.0
 */
@Service
@Slf4j
public class KnowledgeGraphService {

    private static final Map<EntityType, NodeType> NODE_TYPES = new EnumMap<>(Map.of(
            EntityType.FUNCTION, NodeType.FUNCTION,
            EntityType.CLASS, NodeType.CLASS,
            EntityType.VARIABLE, NodeType.PATTERN,
            EntityType.CONCEPT, NodeType.CONCEPT,
            EntityType.BUSINESS_LOGIC, NodeType.CONCEPT,
            EntityType.PREFERENCE, NodeType.PATTERN,
            EntityType.TEAM_PATTERN, NodeType.PATTERN));

    private static final Map<NodeType, String> NODE_COLORS = new EnumMap<>(Map.of(
            NodeType.FUNCTION, "#4CAF50",
            NodeType.CLASS, "#2196F3",
            NodeType.MODULE, "#FF9800",
            NodeType.CONCEPT, "#9C27B0",
            NodeType.PATTERN, "#00BCD4"));

    private static final Map<RelationshipType, String> EDGE_COLORS = new EnumMap<>(Map.of(
            RelationshipType.IMPLEMENTS, "#4CAF50",
            RelationshipType.EXTENDS, "#2196F3",
            RelationshipType.USES, "#FF9800",
            RelationshipType.DEPENDS_ON, "#F44336",
            RelationshipType.SIMILAR_TO, "#9C27B0"));

    private static final String DEFAULT_NODE_COLOR = "#757575";
    private static final String DEFAULT_EDGE_COLOR = "#9E9E9E";

    private final EmbeddingService embeddingService;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final KnowledgeProperties.GraphProperties graphProperties;

    private final Map<String, KnowledgeNode> nodes = new LinkedHashMap<>();
    private final Map<String, ConceptEdge> edges = new LinkedHashMap<>();
    private final Map<String, Relationship> relationships = new LinkedHashMap<>();
    private List<ConceptCluster> clusters = List.of();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public KnowledgeGraphService(EmbeddingService embeddingService, SpringEventBus eventBus, Clock clock,
            KnowledgeProperties properties) {
        this.embeddingService = embeddingService;
        this.eventBus = eventBus;
        this.clock = clock;
        this.graphProperties = properties.getGraph();
    }

    /**
     * Merge an extraction into the graph.
     *
     * <p>
     * Upserts one node per entity and one edge per relationship whose endpoints
     * are known, recomputes clusters and publishes a {@link GraphUpdatedEvent}.
     *
     * @return summary of the merge
     */
    public GraphUpdatedEvent addToGraph(ExtractionResult extraction) {
        if (extraction == null) {
            return summary(0, 0);
        }

        GraphUpdatedEvent update;
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            for (Entity entity : extraction.entities()) {
                nodes.put(entity.getId(), toNode(entity, extraction.confidence(), now));
            }

            int edgesAdded = 0;
            for (Relationship relationship : extraction.relationships()) {
                if (!nodes.containsKey(relationship.getSourceEntityId())
                        || !nodes.containsKey(relationship.getTargetEntityId())) {
                    log.warn("[Graph] Skipping relationship {} ({}): unknown endpoint {} -> {}",
                            relationship.getId(), relationship.getType().getCode(),
                            relationship.getSourceEntityId(), relationship.getTargetEntityId());
                    continue;
                }
                relationships.put(relationship.getId(), relationship);
                edges.put(relationship.getId(), ConceptEdge.from(relationship));
                edgesAdded++;
            }

            recomputeClusters();
            update = summary(extraction.entities().size(), edgesAdded);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("[Graph] Merged {} nodes, {} edges (total: {} nodes, {} edges, {} clusters)",
                update.nodesAdded(), update.edgesAdded(), update.totalNodes(), update.totalEdges(),
                clusters.size());
        eventBus.publish(update);
        return update;
    }

    /**
     * Semantic search over node embeddings.
     *
     * <p>
     * Results are ordered by similarity (descending); equal similarities are
     * ordered by node id (ascending) so results are reproducible.
     */
    public List<SearchResult> search(SearchOptions options) {
        if (options == null || options.getQuery() == null) {
            return List.of();
        }

        int topK = options.getTopK() != null ? options.getTopK() : graphProperties.getDefaultTopK();
        double minSimilarity = options.getMinSimilarity() != null
                ? options.getMinSimilarity()
                : graphProperties.getDefaultMinSimilarity();
        if (topK <= 0) {
            return List.of();
        }

        Optional<float[]> queryEmbedding = embeddingService.embed(options.getQuery());
        if (queryEmbedding.isEmpty()) {
            log.warn("[Graph] Query could not be embedded, returning no results");
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (KnowledgeNode node : nodes.values()) {
                if (!node.hasEmbedding()) {
                    continue;
                }
                double similarity = embeddingService.similarity(queryEmbedding.get(), node.getEmbedding());
                if (similarity < minSimilarity) {
                    continue;
                }
                if (!SearchFilterMatcher.matchesAll(node, options.getFilters())) {
                    continue;
                }
                candidates.add(new Candidate(node, similarity));
            }
        } finally {
            lock.readLock().unlock();
        }

        List<Candidate> top = candidates.stream()
                .sorted(Comparator.comparingDouble(Candidate::similarity).reversed()
                        .thenComparing(candidate -> candidate.node().getId()))
                .limit(topK)
                .toList();

        List<SearchResult> results = new ArrayList<>(top.size());
        for (Candidate candidate : top) {
            KnowledgeNode node = touch(candidate.node().getId());
            results.add(SearchResult.builder()
                    .node(node)
                    .similarity(candidate.similarity())
                    .relationships(options.isIncludeRelationships() ? getRelationships(node.getId()) : null)
                    .build());
        }

        log.debug("[Graph] Search '{}' returned {} of {} candidates (minSimilarity={})",
                options.getQuery(), results.size(), candidates.size(), minSimilarity);
        return results;
    }

    /**
     * Shortest path by edge count. Edges are followed from source to target, and
     * in reverse only when the underlying relationship is bidirectional.
     *
     * @return ordered nodes from {@code sourceId} to {@code targetId}, or
     *         {@code null} when no path exists
     */
    public List<KnowledgeNode> findPath(String sourceId, String targetId) {
        lock.readLock().lock();
        try {
            if (sourceId == null || targetId == null || !nodes.containsKey(sourceId)
                    || !nodes.containsKey(targetId)) {
                return null;
            }
            if (sourceId.equals(targetId)) {
                return List.of(copyOf(nodes.get(sourceId)));
            }

            Map<String, List<String>> adjacency = buildAdjacency();
            Map<String, String> previous = new HashMap<>();
            Set<String> visited = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(sourceId);
            visited.add(sourceId);

            while (!queue.isEmpty()) {
                String current = queue.removeFirst();
                for (String next : adjacency.getOrDefault(current, List.of())) {
                    if (!visited.add(next)) {
                        continue;
                    }
                    previous.put(next, current);
                    if (next.equals(targetId)) {
                        return reconstructPath(previous, sourceId, targetId);
                    }
                    queue.addLast(next);
                }
            }
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public GraphStatistics getStatistics() {
        lock.readLock().lock();
        try {
            Map<String, Integer> nodeTypes = new TreeMap<>();
            for (KnowledgeNode node : nodes.values()) {
                nodeTypes.merge(node.getType().getCode(), 1, Integer::sum);
            }

            Map<String, Integer> edgeTypes = new TreeMap<>();
            Map<String, Integer> degrees = new HashMap<>();
            for (ConceptEdge edge : edges.values()) {
                edgeTypes.merge(edge.type().getCode(), 1, Integer::sum);
                degrees.merge(edge.sourceId(), 1, Integer::sum);
                if (!edge.targetId().equals(edge.sourceId())) {
                    degrees.merge(edge.targetId(), 1, Integer::sum);
                }
            }

            int n = nodes.size();
            int totalDegree = 0;
            for (String nodeId : nodes.keySet()) {
                totalDegree += degrees.getOrDefault(nodeId, 0);
            }
            double averageDegree = n == 0 ? 0.0 : (double) totalDegree / n;
            double density = density(edges.size(), n);

            return GraphStatistics.builder()
                    .totalNodes(n)
                    .totalEdges(edges.size())
                    .totalClusters(clusters.size())
                    .nodeTypes(nodeTypes)
                    .edgeTypes(edgeTypes)
                    .averageDegree(averageDegree)
                    .density(density)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Read-only projection for renderers. Node size grows logarithmically with
     * access count.
     */
    public GraphExport exportForVisualization() {
        lock.readLock().lock();
        try {
            List<GraphExport.VisualNode> visualNodes = new ArrayList<>(nodes.size());
            for (KnowledgeNode node : nodes.values()) {
                visualNodes.add(new GraphExport.VisualNode(
                        node.getId(),
                        node.getName(),
                        node.getType().getCode(),
                        Math.log(node.getAccessCount() + 1.0) * 10,
                        NODE_COLORS.getOrDefault(node.getType(), DEFAULT_NODE_COLOR)));
            }

            List<GraphExport.VisualEdge> visualEdges = new ArrayList<>(edges.size());
            for (ConceptEdge edge : edges.values()) {
                visualEdges.add(new GraphExport.VisualEdge(
                        edge.id(),
                        edge.sourceId(),
                        edge.targetId(),
                        edge.type().getCode(),
                        edge.weight(),
                        EDGE_COLORS.getOrDefault(edge.type(), DEFAULT_EDGE_COLOR)));
            }

            List<ConceptCluster> clusterCopies = clusters.stream()
                    .map(cluster -> cluster.toBuilder().centroid(cluster.centroid().clone()).build())
                    .toList();
            return new GraphExport(List.copyOf(visualNodes), List.copyOf(visualEdges), clusterCopies);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Look up a node, recording the access.
     */
    public Optional<KnowledgeNode> getNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(touch(nodeId));
    }

    /**
     * Relationships with the given node as source or target, in insertion order.
     */
    public List<Relationship> getRelationships(String nodeId) {
        lock.readLock().lock();
        try {
            return relationships.values().stream()
                    .filter(relationship -> relationship.touches(nodeId))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ConceptCluster> getClusters() {
        lock.readLock().lock();
        try {
            return clusters.stream()
                    .map(cluster -> cluster.toBuilder().centroid(cluster.centroid().clone()).build())
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove every node, edge and cluster.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            nodes.clear();
            edges.clear();
            relationships.clear();
            clusters = List.of();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Graph] Knowledge graph cleared");
    }

    private KnowledgeNode touch(String nodeId) {
        lock.writeLock().lock();
        try {
            KnowledgeNode node = nodes.get(nodeId);
            if (node == null) {
                return null;
            }
            node.setAccessCount(node.getAccessCount() + 1);
            node.setLastAccessed(clock.instant());
            return copyOf(node);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private KnowledgeNode toNode(Entity entity, double confidence, Instant now) {
        NodeType type = NODE_TYPES.getOrDefault(entity.getType(), NodeType.CONCEPT);
        if (entity.getType() == EntityType.CONCEPT && Entity.SOURCE_IMPORT.equals(entity.getSource())) {
            type = NodeType.MODULE;
        }

        return KnowledgeNode.builder()
                .id(entity.getId())
                .type(type)
                .name(entity.getText())
                .content(entity.getText())
                .embedding(entity.hasEmbedding() ? entity.getEmbedding().clone() : new float[0])
                .confidence(confidence)
                .lastAccessed(now)
                .accessCount(1)
                .metadata(NodeMetadata.builder()
                        .complexity(assessComplexity(entity.getText()))
                        .quality(confidence)
                        .relevance(1.0)
                        .build())
                .build();
    }

    /**
     * Edge count over the number of node pairs; 0 below two nodes.
     */
    static double density(int edgeCount, int nodeCount) {
        if (nodeCount < 2) {
            return 0.0;
        }
        return edgeCount / (nodeCount * (nodeCount - 1L) / 2.0);
    }

    static Complexity assessComplexity(String text) {
        int length = text != null ? text.length() : 0;
        if (length < 20) {
            return Complexity.LOW;
        }
        if (length < 50) {
            return Complexity.MEDIUM;
        }
        return Complexity.HIGH;
    }

    private void recomputeClusters() {
        double threshold = graphProperties.getClusterThreshold();
        List<KnowledgeNode> ordered = new ArrayList<>(nodes.values());
        Set<String> assigned = new HashSet<>();
        List<ConceptCluster> recomputed = new ArrayList<>();

        for (KnowledgeNode seed : ordered) {
            if (assigned.contains(seed.getId())) {
                continue;
            }
            assigned.add(seed.getId());

            List<KnowledgeNode> members = new ArrayList<>();
            members.add(seed);
            double similaritySum = 1.0;

            if (seed.hasEmbedding()) {
                for (KnowledgeNode other : ordered) {
                    if (assigned.contains(other.getId()) || !other.hasEmbedding()) {
                        continue;
                    }
                    double similarity = embeddingService.similarity(seed.getEmbedding(), other.getEmbedding());
                    if (similarity >= threshold) {
                        members.add(other);
                        assigned.add(other.getId());
                        similaritySum += similarity;
                    }
                }
            }

            recomputed.add(ConceptCluster.builder()
                    .id("cluster_" + seed.getId())
                    .name("Cluster_" + seed.getName())
                    .nodeIds(members.stream().map(KnowledgeNode::getId).toList())
                    .centroid(centroid(members))
                    .coherence(similaritySum / members.size())
                    .build());
        }

        clusters = List.copyOf(recomputed);
    }

    private static float[] centroid(List<KnowledgeNode> members) {
        KnowledgeNode seed = members.get(0);
        if (!seed.hasEmbedding()) {
            return new float[0];
        }
        float[] centroid = new float[seed.getEmbedding().length];
        for (KnowledgeNode member : members) {
            float[] embedding = member.getEmbedding();
            for (int i = 0; i < centroid.length && i < embedding.length; i++) {
                centroid[i] += embedding[i];
            }
        }
        for (int i = 0; i < centroid.length; i++) {
            centroid[i] /= members.size();
        }
        return centroid;
    }

    private Map<String, List<String>> buildAdjacency() {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (ConceptEdge edge : edges.values()) {
            adjacency.computeIfAbsent(edge.sourceId(), key -> new ArrayList<>()).add(edge.targetId());
            Relationship relationship = relationships.get(edge.id());
            if (relationship != null && relationship.isBidirectional()) {
                adjacency.computeIfAbsent(edge.targetId(), key -> new ArrayList<>()).add(edge.sourceId());
            }
        }
        return adjacency;
    }

    private List<KnowledgeNode> reconstructPath(Map<String, String> previous, String sourceId, String targetId) {
        Deque<KnowledgeNode> path = new ArrayDeque<>();
        String current = targetId;
        while (current != null) {
            path.addFirst(copyOf(nodes.get(current)));
            if (current.equals(sourceId)) {
                break;
            }
            current = previous.get(current);
        }
        return List.copyOf(path);
    }

    private GraphUpdatedEvent summary(int nodesAdded, int edgesAdded) {
        lock.readLock().lock();
        try {
            return new GraphUpdatedEvent(nodesAdded, edgesAdded, nodes.size(), edges.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static KnowledgeNode copyOf(KnowledgeNode node) {
        return node.toBuilder()
                .embedding(node.getEmbedding() != null ? node.getEmbedding().clone() : null)
                .metadata(node.getMetadata() != null ? node.getMetadata().toBuilder().build() : null)
                .build();
    }

    private record Candidate(KnowledgeNode node, double similarity) {
    }
}

package com.xammer.nodelabeler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xammer.nodelabeler.domain.ApplyResult;
import com.xammer.nodelabeler.domain.MetadataPatch;
import com.xammer.nodelabeler.domain.NodeSnapshot;
import com.xammer.nodelabeler.exception.NodeStoreException;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.Map;
import java.util.Optional;

/**
 * {@link NodeStore} backed by the Kubernetes API. Watches nodes through a shared informer
 * and writes metadata with JSON merge patches carrying {@code metadata.resourceVersion},
 * so a concurrent change to the node surfaces as {@link ApplyResult#CONFLICT}.
 */
@Slf4j
public class Fabric8NodeStore implements NodeStore {

    private final KubernetesClient client;
    private final ObjectMapper objectMapper;
    private final long resyncMillis;
    private volatile SharedIndexInformer<Node> informer;

    public Fabric8NodeStore(KubernetesClient client, ObjectMapper objectMapper, long resyncMillis) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.resyncMillis = resyncMillis;
    }

    @Override
    public void watch(NodeEventListener listener) {
        if (informer != null) {
            throw new IllegalStateException("Node watch already started");
        }
        SharedIndexInformer<Node> nodeInformer = client.nodes().runnableInformer(resyncMillis);
        nodeInformer.addEventHandler(new ResourceEventHandler<Node>() {
            @Override
            public void onAdd(Node node) {
                listener.onUpsert(toSnapshot(node));
            }

            @Override
            public void onUpdate(Node oldNode, Node newNode) {
                listener.onUpsert(toSnapshot(newNode));
            }

            @Override
            public void onDelete(Node node, boolean deletedFinalStateUnknown) {
                listener.onDelete(node.getMetadata().getName());
            }
        });
        nodeInformer.exceptionHandler((isStarted, t) -> {
            log.error("Node watch error (started={}): {}", isStarted, t.getMessage());
            listener.onWatchError(t);
            return isStarted;
        });

        log.info("Starting node informer (resync {} ms)", resyncMillis);
        informer = nodeInformer;
        try {
            nodeInformer.run();
        } catch (KubernetesClientException e) {
            informer = null;
            throw new NodeStoreException("Could not list nodes: " + e.getMessage(), e);
        }
        log.info("Node informer synced, {} node(s) cached", nodeInformer.getStore().list().size());
    }

    @Override
    public Optional<NodeSnapshot> get(String nodeName) {
        try {
            return Optional.ofNullable(client.nodes().withName(nodeName).get()).map(Fabric8NodeStore::toSnapshot);
        } catch (KubernetesClientException e) {
            throw new NodeStoreException("Could not read node " + nodeName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ApplyResult applyPatch(MetadataPatch patch) {
        String body = toMergePatch(patch);
        log.debug("Patching node {} with {}", patch.getNodeName(), body);
        try {
            client.nodes().withName(patch.getNodeName()).patch(PatchContext.of(PatchType.JSON_MERGE), body);
            return ApplyResult.APPLIED;
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                return ApplyResult.CONFLICT;
            }
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                return ApplyResult.NOT_FOUND;
            }
            throw new NodeStoreException("Could not patch node " + patch.getNodeName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        SharedIndexInformer<Node> current = informer;
        informer = null;
        if (current != null) {
            log.info("Stopping node informer");
            current.stop();
        }
    }

    String toMergePatch(MetadataPatch patch) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode metadata = root.putObject("metadata");
        if (patch.getResourceVersion() != null) {
            metadata.put("resourceVersion", patch.getResourceVersion());
        }
        putAll(metadata, "labels", patch.getLabels());
        putAll(metadata, "annotations", patch.getAnnotations());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize patch for node " + patch.getNodeName(), e);
        }
    }

    private static void putAll(ObjectNode metadata, String field, Map<String, String> values) {
        if (!values.isEmpty()) {
            ObjectNode node = metadata.putObject(field);
            values.forEach(node::put);
        }
    }

    static NodeSnapshot toSnapshot(Node node) {
        ObjectMeta meta = node.getMetadata();
        return NodeSnapshot.builder()
                .name(meta.getName())
                .resourceVersion(meta.getResourceVersion())
                .providerId(node.getSpec() == null ? null : node.getSpec().getProviderID())
                .labels(meta.getLabels())
                .annotations(meta.getAnnotations())
                .build();
    }
}

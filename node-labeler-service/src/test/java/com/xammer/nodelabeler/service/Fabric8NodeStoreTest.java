package com.xammer.nodelabeler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.nodelabeler.domain.ApplyResult;
import com.xammer.nodelabeler.domain.MetadataPatch;
import com.xammer.nodelabeler.domain.NodeSnapshot;
import com.xammer.nodelabeler.exception.NodeStoreException;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.NodeList;
import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Fabric8NodeStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private KubernetesClient client;

    @Mock
    private NonNamespaceOperation<Node, NodeList, Resource<Node>> nodes;

    @Mock
    private Resource<Node> nodeResource;

    private Fabric8NodeStore store;

    @BeforeEach
    void setUp() {
        lenient().when(client.nodes()).thenReturn(nodes);
        lenient().when(nodes.withName("node-1")).thenReturn(nodeResource);
        store = new Fabric8NodeStore(client, objectMapper, 0L);
    }

    private static MetadataPatch patch() {
        return new MetadataPatch("node-1", "17", Map.of("provider-id", "i-0abc"), Map.of());
    }

    @Test
    void snapshotCopiesNodeMetadata() {
        Node node = new NodeBuilder()
                .withNewMetadata()
                    .withName("node-1")
                    .withResourceVersion("17")
                    .addToLabels("kubernetes.io/os", "linux")
                    .addToAnnotations("note", "x")
                .endMetadata()
                .withNewSpec()
                    .withProviderID("aws:///us-east-1a/i-0abc")
                .endSpec()
                .build();

        NodeSnapshot snapshot = Fabric8NodeStore.toSnapshot(node);

        assertThat(snapshot.getName()).isEqualTo("node-1");
        assertThat(snapshot.getResourceVersion()).isEqualTo("17");
        assertThat(snapshot.getProviderId()).isEqualTo("aws:///us-east-1a/i-0abc");
        assertThat(snapshot.getLabels()).containsExactly(Map.entry("kubernetes.io/os", "linux"));
        assertThat(snapshot.getAnnotations()).containsExactly(Map.entry("note", "x"));
    }

    @Test
    void snapshotOfNodeWithoutSpecHasNoProviderId() {
        Node node = new NodeBuilder().withNewMetadata().withName("bare").endMetadata().build();

        NodeSnapshot snapshot = Fabric8NodeStore.toSnapshot(node);

        assertThat(snapshot.getProviderId()).isNull();
        assertThat(snapshot.getLabels()).isEmpty();
    }

    @Test
    void mergePatchCarriesResourceVersionAndOmitsEmptyMaps() throws Exception {
        JsonNode body = objectMapper.readTree(store.toMergePatch(patch()));

        assertThat(body.at("/metadata/resourceVersion").asText()).isEqualTo("17");
        assertThat(body.at("/metadata/labels/provider-id").asText()).isEqualTo("i-0abc");
        assertThat(body.at("/metadata").has("annotations")).isFalse();
    }

    @Test
    void appliedPatchIsSentAsJsonMerge() {
        assertThat(store.applyPatch(patch())).isEqualTo(ApplyResult.APPLIED);

        verify(nodeResource).patch(any(PatchContext.class), eq(store.toMergePatch(patch())));
    }

    @Test
    void conflictAndNotFoundAreMapped() {
        when(nodeResource.patch(any(PatchContext.class), anyString()))
                .thenThrow(new KubernetesClientException("conflict", 409, (Status) null))
                .thenThrow(new KubernetesClientException("gone", 404, (Status) null));

        assertThat(store.applyPatch(patch())).isEqualTo(ApplyResult.CONFLICT);
        assertThat(store.applyPatch(patch())).isEqualTo(ApplyResult.NOT_FOUND);
    }

    @Test
    void otherApiErrorsAreTransientFailures() {
        when(nodeResource.patch(any(PatchContext.class), anyString()))
                .thenThrow(new KubernetesClientException("server error", 500, (Status) null));

        assertThatThrownBy(() -> store.applyPatch(patch()))
                .isInstanceOf(NodeStoreException.class)
                .hasMessageContaining("node-1")
                .hasCauseInstanceOf(KubernetesClientException.class);
    }

    @Test
    void getReturnsEmptyForMissingNode() {
        when(nodeResource.get()).thenReturn(null);

        assertThat(store.get("node-1")).isEmpty();
    }
}

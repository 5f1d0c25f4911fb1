package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.protocol.json.JsonSupport;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.TransportRequest;
import io.github.drompincen.polarionclient.runtime.http.TransportResponse;
import io.github.drompincen.polarionclient.runtime.resource.Relationship;
import io.github.drompincen.polarionclient.runtime.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkItemRelationshipServiceTest {

    @Mock
    private HttpTransport transport;

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();
    private WorkItemRelationshipService relationships;

    @BeforeEach
    void setUp() {
        ClientConfig config = ClientConfig.builder("https://alm.example.com/rest/v1", "secret")
                .retryPolicy(RetryPolicy.none()).build();
        relationships = PolarionClient.create(config, transport).project("DEMO").relationships();
    }

    private TransportRequest sent() {
        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void getDecodesToManyRelationship() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":[{"type":"users","id":"jdoe"},{"type":"users","id":"asmith"}],
                 "links":{"self":"https://alm.example.com/rest/v1/projects/DEMO/workitems/WI-1/relationships/assignee"}}
                """));

        Relationship assignee = relationships.get("DEMO/WI-1", "assignee");

        assertThat(sent().uri().getPath()).isEqualTo("/rest/v1/projects/DEMO/workitems/WI-1/relationships/assignee");
        assertThat(assignee.shape()).isEqualTo(Relationship.Shape.LIST);
        assertThat(assignee.refs()).containsExactly(ResourceRef.user("jdoe"), ResourceRef.user("asmith"));
        assertThat(assignee.links()).isNotNull();
    }

    @Test
    void getDecodesEmptyToOneRelationship() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, "{\"data\":null}"));

        Relationship parent = relationships.get("WI-1", "parentItem");

        assertThat(parent.shape()).isEqualTo(Relationship.Shape.NULL);
    }

    @Test
    void addPostsTargetsAsDataArray() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));

        relationships.add("WI-1", "categories", List.of(ResourceRef.of("categories", "DEMO/ui")));

        TransportRequest request = sent();
        assertThat(request.method()).isEqualTo("POST");
        JsonNode data = mapper.readTree(request.body()).path("data");
        assertThat(data.isArray()).isTrue();
        assertThat(data.get(0).path("type").asText()).isEqualTo("categories");
        assertThat(data.get(0).path("id").asText()).isEqualTo("DEMO/ui");
    }

    @Test
    void addWithoutTargetsMakesNoRequest() {
        relationships.add("WI-1", "categories", List.of());

        verifyNoInteractions(transport);
    }

    @Test
    void replaceSendsSingleData() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));

        relationships.replace("WI-1", "author", Relationship.single(ResourceRef.user("jdoe")));

        TransportRequest request = sent();
        assertThat(request.method()).isEqualTo("PATCH");
        JsonNode body = mapper.readTree(request.body());
        assertThat(body.at("/data/id").asText()).isEqualTo("jdoe");
    }

    @Test
    void replaceWithNoneClearsRelationship() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));

        relationships.replace("WI-1", "parentItem", Relationship.none());

        JsonNode body = mapper.readTree(sent().body());
        assertThat(body.has("data")).isTrue();
        assertThat(body.get("data").isNull()).isTrue();
    }

    @Test
    void removeSendsTargetsAsDataArray() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));

        relationships.remove("WI-1", "assignee", List.of(ResourceRef.user("jdoe")));

        TransportRequest request = sent();
        assertThat(request.method()).isEqualTo("DELETE");
        assertThat(mapper.readTree(request.body()).at("/data/0/id").asText()).isEqualTo("jdoe");
    }
}

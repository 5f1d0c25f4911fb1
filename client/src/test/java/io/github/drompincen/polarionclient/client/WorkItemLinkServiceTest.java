package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.polarionclient.client.model.LinkFields;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.protocol.json.JsonSupport;
import io.github.drompincen.polarionclient.runtime.error.ValidationException;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.TransportRequest;
import io.github.drompincen.polarionclient.runtime.http.TransportResponse;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkItemLinkServiceTest {

    private static final String BASE = "https://alm.example.com/polarion/rest/v1";

    @Mock
    private HttpTransport transport;

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    private WorkItemLinkService service(ClientConfig.Builder builder) {
        return PolarionClient.create(builder.retryPolicy(RetryPolicy.none()).build(), transport)
                .project("DEMO").links();
    }

    private WorkItemLinkService service() {
        return service(ClientConfig.builder(BASE, "secret"));
    }

    private List<TransportRequest> sentRequests(int count) {
        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport, times(count)).send(captor.capture(), any());
        return captor.getAllValues();
    }

    @Test
    void getAddressesLinkThroughItsSourceWorkItem() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":{"type":"linkedworkitems","id":"DEMO/WI-1/relates_to/OTHER/WI-9",
                  "attributes":{"role":"relates_to","suspect":true},
                  "relationships":{"workItem":{"data":{"type":"workitems","id":"OTHER/WI-9"}}}}}
                """));

        Resource link = service().get("DEMO/WI-1/relates_to/OTHER/WI-9");

        assertThat(sentRequests(1).get(0).uri().getPath())
                .isEqualTo("/polarion/rest/v1/projects/DEMO/workitems/WI-1/linkedworkitems/relates_to/OTHER/WI-9");
        assertThat(link.get(LinkFields.SUSPECT)).contains(true);
        assertThat(link.relationships().refs(LinkFields.WORK_ITEM)).containsExactly(ResourceRef.workItem("OTHER/WI-9"));
    }

    @Test
    void listFollowsPages() {
        when(transport.send(any(), any())).thenReturn(
                TransportResponse.of(200, """
                        {"data":[{"type":"linkedworkitems","id":"DEMO/WI-1/parent/DEMO/WI-2"}],
                         "links":{"next":"page2"}}
                        """),
                TransportResponse.of(200, """
                        {"data":[{"type":"linkedworkitems","id":"DEMO/WI-1/relates_to/DEMO/WI-3"}]}
                        """));

        List<Resource> links = service().list("DEMO/WI-1");

        List<TransportRequest> requests = sentRequests(2);
        assertThat(requests.get(0).uri().getPath()).endsWith("/projects/DEMO/workitems/WI-1/linkedworkitems");
        assertThat(requests.get(1).uri().getQuery()).contains("page[number]=2");
        assertThat(links).extracting(Resource::getId)
                .containsExactly("DEMO/WI-1/parent/DEMO/WI-2", "DEMO/WI-1/relates_to/DEMO/WI-3");
    }

    @Test
    void createSendsRoleSuspectAndTargetInBatches() throws Exception {
        when(transport.send(any(), any())).thenReturn(
                TransportResponse.of(201, """
                        {"data":[{"type":"linkedworkitems","id":"DEMO/WI-1/relates_to/DEMO/WI-2"},
                                 {"type":"linkedworkitems","id":"DEMO/WI-1/parent/OTHER/WI-7"}]}
                        """),
                TransportResponse.of(201, """
                        {"data":[{"type":"linkedworkitems","id":"DEMO/WI-1/blocks/DEMO/WI-4"}]}
                        """));
        WorkItemLinkService links = service(ClientConfig.builder(BASE, "secret").batchSize(2));
        List<Resource> input = List.of(
                links.newLink("relates_to", "WI-2", false),
                links.newLink("parent", "OTHER/WI-7", true),
                links.newLink("blocks", "WI-4", false));

        List<Resource> created = links.create("DEMO/WI-1", input);

        List<TransportRequest> requests = sentRequests(2);
        assertThat(requests.get(0).method()).isEqualTo("POST");
        assertThat(requests.get(0).uri().getPath()).endsWith("/projects/DEMO/workitems/WI-1/linkedworkitems");
        JsonNode first = mapper.readTree(requests.get(0).body()).path("data");
        assertThat(first.size()).isEqualTo(2);
        assertThat(first.get(0).path("type").asText()).isEqualTo("linkedworkitems");
        assertThat(first.get(0).path("attributes").path("role").asText()).isEqualTo("relates_to");
        assertThat(first.get(0).path("attributes").path("suspect").isBoolean()).isTrue();
        assertThat(first.get(0).at("/relationships/workItem/data/id").asText()).isEqualTo("DEMO/WI-2");
        assertThat(first.get(1).at("/relationships/workItem/data/id").asText()).isEqualTo("OTHER/WI-7");
        assertThat(mapper.readTree(requests.get(1).body()).path("data").size()).isEqualTo(1);
        assertThat(created).extracting(Resource::getId).containsExactly(
                "DEMO/WI-1/relates_to/DEMO/WI-2", "DEMO/WI-1/parent/OTHER/WI-7", "DEMO/WI-1/blocks/DEMO/WI-4");
    }

    @Test
    void createRequiresRole() {
        WorkItemLinkService links = service();
        Resource link = links.newLink("", "WI-2", false);

        assertThatThrownBy(() -> links.create("WI-1", List.of(link)))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("links[0].role"));
        verifyNoInteractions(transport);
    }

    @Test
    void updateSendsOnlySuspectFlag() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));
        WorkItemLinkService links = service();
        Resource link = links.newLink("relates_to", "WI-2", true);
        link.setId("DEMO/WI-1/relates_to/DEMO/WI-2");

        links.update(link);

        TransportRequest request = sentRequests(1).get(0);
        assertThat(request.method()).isEqualTo("PATCH");
        assertThat(request.uri().getPath()).endsWith("/workitems/WI-1/linkedworkitems/relates_to/DEMO/WI-2");
        JsonNode data = mapper.readTree(request.body()).path("data");
        assertThat(data.path("id").asText()).isEqualTo("DEMO/WI-1/relates_to/DEMO/WI-2");
        assertThat(data.path("attributes").path("suspect").asBoolean()).isTrue();
        assertThat(data.path("attributes").has("role")).isFalse();
        assertThat(data.has("relationships")).isFalse();
    }

    @Test
    void deleteGroupsLinksBySourceWorkItem() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));

        service().delete("DEMO/WI-1/relates_to/DEMO/WI-2", "DEMO/WI-5/parent/DEMO/WI-1", "DEMO/WI-1/blocks/DEMO/WI-3");

        List<TransportRequest> requests = sentRequests(2);
        assertThat(requests).extracting(TransportRequest::method).containsOnly("DELETE");
        assertThat(requests.get(0).uri().getPath()).endsWith("/projects/DEMO/workitems/WI-1/linkedworkitems");
        JsonNode data = mapper.readTree(requests.get(0).body()).path("data");
        assertThat(data.size()).isEqualTo(2);
        assertThat(data.get(0).path("type").asText()).isEqualTo("linkedworkitems");
        assertThat(data.get(1).path("id").asText()).isEqualTo("DEMO/WI-1/blocks/DEMO/WI-3");
        assertThat(requests.get(1).uri().getPath()).endsWith("/projects/DEMO/workitems/WI-5/linkedworkitems");
    }

    @Test
    void malformedLinkIdIsRejected() {
        assertThatThrownBy(() -> service().delete("DEMO/WI-1/relates_to"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("DEMO/WI-1/relates_to");
        verifyNoInteractions(transport);
    }

    @Test
    void linkIdSplitsIntoSourceAndTarget() {
        WorkItemLinkId id = WorkItemLinkId.parse("DEMO/WI-1/relates_to/OTHER/WI-9");

        assertThat(id.sourceId()).isEqualTo("DEMO/WI-1");
        assertThat(id.role()).isEqualTo("relates_to");
        assertThat(id.targetId()).isEqualTo("OTHER/WI-9");
        assertThat(id).hasToString("DEMO/WI-1/relates_to/OTHER/WI-9");
    }
}

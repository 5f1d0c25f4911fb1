package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.client.model.ApprovalFields;
import io.github.drompincen.polarionclient.protocol.api.ApprovalStatus;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.protocol.json.JsonSupport;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.TransportRequest;
import io.github.drompincen.polarionclient.runtime.http.TransportResponse;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
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
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkItemApprovalServiceTest {

    @Mock
    private HttpTransport transport;

    private WorkItemApprovalService approvals;

    @BeforeEach
    void setUp() {
        ClientConfig config = ClientConfig.builder("https://alm.example.com/rest/v1", "secret")
                .retryPolicy(RetryPolicy.none()).build();
        approvals = PolarionClient.create(config, transport).project("DEMO").approvals();
    }

    private TransportRequest sent() {
        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void listDecodesApprovalRecords() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":[{"type":"workitem_approvals","id":"DEMO/WI-1/jdoe",
                  "attributes":{"status":"approved","comment":"lgtm","date":"2024-05-02T08:30:00Z"},
                  "relationships":{"user":{"data":{"type":"users","id":"jdoe"}}}}]}
                """));

        List<Resource> list = approvals.list("DEMO/WI-1");

        assertThat(sent().uri().getPath()).isEqualTo("/rest/v1/projects/DEMO/workitems/WI-1/approvals");
        assertThat(list).singleElement().satisfies(a -> {
            assertThat(a.get(ApprovalFields.STATUS).map(ApprovalStatus::fromWire)).contains(ApprovalStatus.APPROVED);
            assertThat(a.relationships().refs(ApprovalFields.USER)).containsExactly(ResourceRef.user("jdoe"));
        });
    }

    @Test
    void addPostsOneRecordPerUser() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(201, """
                {"data":[{"type":"workitem_approvals","id":"DEMO/WI-1/jdoe"},
                         {"type":"workitem_approvals","id":"DEMO/WI-1/asmith"}]}
                """));

        List<Resource> created = approvals.add("WI-1", ApprovalStatus.WAITING, "please review", "jdoe", "asmith");

        TransportRequest request = sent();
        assertThat(request.method()).isEqualTo("POST");
        JsonNode data = JsonSupport.newObjectMapper().readTree(request.body()).path("data");
        assertThat(data.size()).isEqualTo(2);
        assertThat(data.get(0).path("attributes").path("status").asText()).isEqualTo("waiting");
        assertThat(data.get(0).path("attributes").path("comment").asText()).isEqualTo("please review");
        assertThat(data.get(1).path("relationships").path("user").path("data").path("id").asText()).isEqualTo("asmith");
        assertThat(created).extracting(Resource::getId).containsExactly("DEMO/WI-1/jdoe", "DEMO/WI-1/asmith");
    }

    @Test
    void updateStatusPatchesUserApproval() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));

        approvals.updateStatus("DEMO/WI-1", "jdoe", ApprovalStatus.DISAPPROVED, null);

        TransportRequest request = sent();
        assertThat(request.method()).isEqualTo("PATCH");
        assertThat(request.uri().getPath()).endsWith("/workitems/WI-1/approvals/jdoe");
        JsonNode data = JsonSupport.newObjectMapper().readTree(request.body()).path("data");
        assertThat(data.path("id").asText()).isEqualTo("DEMO/WI-1/jdoe");
        assertThat(data.path("attributes").path("status").asText()).isEqualTo("disapproved");
        assertThat(data.path("attributes").has("comment")).isFalse();
    }

    @Test
    void deleteSendsOneRequestPerUser() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));

        approvals.delete("WI-1", "jdoe", "asmith");

        verify(transport, times(2)).send(any(), any());
    }
}

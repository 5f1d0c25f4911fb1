package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.client.model.ProjectFields;
import io.github.drompincen.polarionclient.client.model.UserFields;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
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

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private HttpTransport transport;

    private PolarionClient client;

    @BeforeEach
    void setUp() {
        ClientConfig config = ClientConfig.builder("https://alm.example.com/rest/v1", "secret")
                .pageSize(50).retryPolicy(RetryPolicy.none()).build();
        client = PolarionClient.create(config, transport);
    }

    private TransportRequest sent() {
        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void getUserKeepsUnknownAttributes() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":{"type":"users","id":"jdoe",
                  "attributes":{"name":"John Doe","email":"jdoe@example.com","disabled":false,"initials":"JD"}}}
                """));

        Resource user = client.users().get("jdoe");

        assertThat(sent().uri().getPath()).isEqualTo("/rest/v1/users/jdoe");
        assertThat(user.get(UserFields.NAME)).contains("John Doe");
        assertThat(user.get(UserFields.DISABLED)).contains(false);
        assertThat(user.attributes().getDynamic("initials")).map(n -> n.asText()).contains("JD");
    }

    @Test
    void queryUsesConfiguredPageSize() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":[{"type":"users","id":"jdoe"}],"links":{"next":"users?page%5Bnumber%5D=2"},"meta":{"totalCount":120}}
                """));

        Page<Resource> page = client.users().query(QueryOptions.of("disabled:false"));

        assertThat(sent().uri().getQuery()).contains("page[size]=50").doesNotContain("fields[");
        assertThat(page.hasNext()).isTrue();
        assertThat(page.totalCount()).isEqualTo(120);
        assertThat(page.items()).extracting(Resource::getId).containsExactly("jdoe");
    }

    @Test
    void getProjectDecodesDates() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":{"type":"projects","id":"DEMO",
                  "attributes":{"name":"Demo","active":true,"startDate":"2024-01-15","lead":"jdoe"}}}
                """));

        Resource project = client.projects().get("DEMO");

        assertThat(sent().uri().getPath()).isEqualTo("/rest/v1/projects/DEMO");
        assertThat(project.get(ProjectFields.START_DATE)).contains(LocalDate.of(2024, 1, 15));
        assertThat(project.get(ProjectFields.ACTIVE)).contains(true);
    }

    @Test
    void projectClientsAreCached() {
        assertThat(client.project("DEMO")).isSameAs(client.project("DEMO"));
        assertThat(client.project("DEMO").workItems().projectId()).isEqualTo("DEMO");
    }
}

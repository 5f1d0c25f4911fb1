package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.protocol.api.Enumeration;
import io.github.drompincen.polarionclient.protocol.api.EnumerationId;
import io.github.drompincen.polarionclient.protocol.api.EnumerationOption;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.TransportRequest;
import io.github.drompincen.polarionclient.runtime.http.TransportResponse;
import io.github.drompincen.polarionclient.runtime.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnumerationServiceTest {

    @Mock
    private HttpTransport transport;

    private EnumerationService enumerations;

    @BeforeEach
    void setUp() {
        ClientConfig config = ClientConfig.builder("https://alm.example.com/rest/v1", "secret")
                .retryPolicy(RetryPolicy.none()).build();
        enumerations = PolarionClient.create(config, transport).project("DEMO").enumerations();
    }

    @Test
    void readsOptionsOfEnumeration() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":{"type":"enumerations","id":"DEMO/workitem/status/~",
                  "attributes":{"options":[
                    {"id":"open","name":"Open","color":"#00ff00","default":true},
                    {"id":"done","name":"Done","sequence":2},
                    {"id":"obsolete","name":"Obsolete","hidden":true}]}}}
                """));

        Enumeration status = enumerations.get(EnumerationId.workItem("status", "~"));

        ArgumentCaptor<TransportRequest> request = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(request.capture(), any());
        assertThat(request.getValue().uri().getPath())
                .isEqualTo("/rest/v1/projects/DEMO/enumerations/workitem/status/~");
        assertThat(status.options()).extracting(EnumerationOption::id).containsExactly("open", "done", "obsolete");
        assertThat(status.defaultOption()).map(EnumerationOption::name).contains("Open");
        assertThat(status.option("done")).map(EnumerationOption::sequence).contains(2);
        assertThat(status.visibleOptions()).hasSize(2);
    }

    @Test
    void missingOptionsGiveEmptyEnumeration() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200,
                "{\"data\":{\"type\":\"enumerations\",\"id\":\"DEMO/workitem/severity/task\",\"attributes\":{}}}"));

        Enumeration severity = enumerations.get(EnumerationId.workItem("severity", "task"));

        assertThat(severity.options()).isEmpty();
        assertThat(severity.option("critical")).isEmpty();
    }
}

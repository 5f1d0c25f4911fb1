package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.polarionclient.client.model.CommentFields;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.protocol.json.JsonSupport;
import io.github.drompincen.polarionclient.runtime.error.ValidationException;
import io.github.drompincen.polarionclient.runtime.http.HttpTransport;
import io.github.drompincen.polarionclient.runtime.http.TransportRequest;
import io.github.drompincen.polarionclient.runtime.http.TransportResponse;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;
import io.github.drompincen.polarionclient.runtime.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkItemCommentServiceTest {

    @Mock
    private HttpTransport transport;

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();
    private WorkItemCommentService comments;

    @BeforeEach
    void setUp() {
        ClientConfig config = ClientConfig.builder("https://alm.example.com/rest/v1", "secret")
                .retryPolicy(RetryPolicy.none()).build();
        comments = PolarionClient.create(config, transport).project("DEMO").comments();
    }

    private TransportRequest sent() {
        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void getDecodesCommentAtRevision() {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(200, """
                {"data":{"type":"workitem_comments","id":"DEMO/WI-1/3",
                  "attributes":{"text":{"type":"text/html","value":"<p>done?</p>"},"resolved":false,
                    "created":"2024-05-02T08:30:00Z","childCommentIds":["DEMO/WI-1/4"]},
                  "relationships":{"author":{"data":{"type":"users","id":"jdoe"}}}}}
                """));

        Resource comment = comments.get("DEMO/WI-1", "DEMO/WI-1/3", "42", CancellationToken.create());

        TransportRequest request = sent();
        assertThat(request.uri().getPath()).isEqualTo("/rest/v1/projects/DEMO/workitems/WI-1/comments/3");
        assertThat(request.uri().getQuery()).isEqualTo("revision=42");
        assertThat(comment.get(CommentFields.TEXT)).contains(TextContent.html("<p>done?</p>"));
        assertThat(comment.get(CommentFields.CHILD_COMMENT_IDS)).contains(List.of("DEMO/WI-1/4"));
        assertThat(comment.relationships().refs(CommentFields.AUTHOR)).containsExactly(ResourceRef.user("jdoe"));
    }

    @Test
    void createPostsTextAndParentAndReturnsCreated() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(201, """
                {"data":[{"type":"workitem_comments","id":"DEMO/WI-1/5"},
                         {"type":"workitem_comments","id":"DEMO/WI-1/6"}]}
                """));

        List<Resource> created = comments.create("WI-1", List.of(
                comments.newComment(TextContent.plain("first")),
                comments.newReply("DEMO/WI-1/5", TextContent.html("<p>reply</p>"))));

        TransportRequest request = sent();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.uri().getPath()).endsWith("/projects/DEMO/workitems/WI-1/comments");
        JsonNode data = mapper.readTree(request.body()).path("data");
        assertThat(data.size()).isEqualTo(2);
        assertThat(data.get(0).at("/attributes/text/value").asText()).isEqualTo("first");
        assertThat(data.get(1).at("/relationships/parentComment/data/id").asText()).isEqualTo("DEMO/WI-1/5");
        assertThat(created).extracting(Resource::getId).containsExactly("DEMO/WI-1/5", "DEMO/WI-1/6");
    }

    @Test
    void createRejectsEmptyInputAndMissingText() {
        assertThatThrownBy(() -> comments.create("WI-1", List.of()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> comments.create("WI-1", List.of(new Resource(CommentFields.RESOURCE_TYPE))))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("comments[0].text"));
        verifyNoInteractions(transport);
    }

    @Test
    void updatePatchesWritableAttributesOnly() throws Exception {
        when(transport.send(any(), any())).thenReturn(TransportResponse.of(204, ""));
        Resource comment = comments.newComment(TextContent.plain("edited")).set(CommentFields.RESOLVED, true);
        comment.setId("DEMO/WI-1/3");
        comment.relationships().setSingle(CommentFields.AUTHOR, ResourceRef.user("jdoe"));

        comments.update("DEMO/WI-1", comment);

        TransportRequest request = sent();
        assertThat(request.method()).isEqualTo("PATCH");
        assertThat(request.uri().getPath()).endsWith("/workitems/WI-1/comments/3");
        JsonNode data = mapper.readTree(request.body()).path("data");
        assertThat(data.path("id").asText()).isEqualTo("DEMO/WI-1/3");
        assertThat(data.at("/attributes/resolved").asBoolean()).isTrue();
        assertThat(data.has("relationships")).isFalse();
    }

    @Test
    void updateRequiresId() {
        Resource comment = comments.newComment(TextContent.plain("x"));

        assertThatThrownBy(() -> comments.update("WI-1", comment))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(transport);
    }
}

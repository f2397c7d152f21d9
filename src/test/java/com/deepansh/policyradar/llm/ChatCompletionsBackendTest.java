package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.exception.ApiException;
import com.deepansh.policyradar.exception.BackendUnavailableException;
import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.model.ToolCall;
import com.deepansh.policyradar.tool.ToolImage;
import com.deepansh.policyradar.tool.ToolOutput;
import com.deepansh.policyradar.tool.ToolSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatCompletionsBackendTest {

    private static final String URL = "http://llm.test/v1/chat/completions";

    private static final String TOOL_CALLS_RESPONSE = """
            {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
              {"id":"call_1","type":"function","function":{"name":"regs_search_documents","arguments":"{\\"search_term\\":\\"PFAS\\"}"}},
              {"id":"call_2","type":"function","function":{"name":"fetch_url_content","arguments":"not json"}}
            ]},"finish_reason":"tool_calls"}],
             "usage":{"prompt_tokens":120,"completion_tokens":30}}""";

    private static final String TEXT_RESPONSE = """
            {"choices":[{"message":{"role":"assistant","content":"Final answer"},"finish_reason":"stop"}]}""";

    private MockRestServiceServer server;
    private ChatCompletionsBackend backend;
    private final List<ToolSpec> tools = List.of(new ToolSpec("regs_search_documents", "search",
            object(properties("search_term", string("term")), "search_term"), null));

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://llm.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        LlmProviderProperties settings = new LlmProviderProperties();
        settings.setModel("gpt-test");
        backend = new ChatCompletionsBackend("openai", settings, builder.build(), new ObjectMapper());
    }

    @Test
    void start_parsesEveryToolCallAndToleratesBadArguments() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("gpt-test"))
                .andExpect(jsonPath("$.messages", hasSize(2)))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.tools[0].function.name").value("regs_search_documents"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andRespond(withSuccess(TOOL_CALLS_RESPONSE, MediaType.APPLICATION_JSON));

        LlmResponse response = backend.start("instructions", "prompt", tools);

        assertThat(response.getToolCalls()).extracting(ToolCall::getId).containsExactly("call_1", "call_2");
        assertThat(response.getToolCalls().get(0).getArguments()).containsEntry("search_term", "PFAS");
        assertThat(response.getToolCalls().get(1).getArguments()).isEmpty();
        assertThat(response.getPromptTokens()).isEqualTo(120);
        assertThat(response.getHandle()).isEqualTo("openai-gpt-test-1");
        server.verify();
    }

    @Test
    void respond_echoesAssistantCallsThenToolMessagesThenImages() {
        server.expect(requestTo(URL)).andRespond(withSuccess(TOOL_CALLS_RESPONSE, MediaType.APPLICATION_JSON));
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages", hasSize(6)))
                .andExpect(jsonPath("$.messages[2].role").value("assistant"))
                .andExpect(jsonPath("$.messages[2].tool_calls[1].id").value("call_2"))
                .andExpect(jsonPath("$.messages[3].role").value("tool"))
                .andExpect(jsonPath("$.messages[3].tool_call_id").value("call_1"))
                .andExpect(jsonPath("$.messages[4].tool_call_id").value("call_2"))
                .andExpect(jsonPath("$.messages[5].role").value("user"))
                .andExpect(jsonPath("$.messages[5].content[1].type").value("image_url"))
                .andRespond(withSuccess(TEXT_RESPONSE, MediaType.APPLICATION_JSON));

        backend.start("instructions", "prompt", tools);
        ToolImage page = new ToolImage("page-1", 1, "https://example.gov/a.pdf", "image/png", 10, 10, new byte[]{1, 2});
        LlmResponse response = backend.respond(List.of(
                new ToolOutput("call_1", "regs_search_documents", "{\"count\":0}", List.of()),
                new ToolOutput("call_2", "fetch_url_content", "{\"full_text\":\"\"}", List.of(page))));

        assertThat(response.hasToolCalls()).isFalse();
        assertThat(response.getContent()).isEqualTo("Final answer");
        assertThat(backend.handle()).isEqualTo("openai-gpt-test-2");
        server.verify();
    }

    @Test
    void start_serverError_leavesConversationUntouched() {
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages", hasSize(2)))
                .andRespond(withSuccess(TEXT_RESPONSE, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> backend.start("instructions", "prompt", tools))
                .isInstanceOf(BackendUnavailableException.class);
        assertThat(backend.handle()).isNull();

        assertThat(backend.start("instructions", "prompt", tools).getContent()).isEqualTo("Final answer");
        assertThat(backend.handle()).isEqualTo("openai-gpt-test-1");
        server.verify();
    }

    @Test
    void parse_noChoices_isBadGateway() throws Exception {
        assertThatThrownBy(() -> backend.parse(new ObjectMapper().readTree("{\"choices\":[]}")))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getStatusCode()).isEqualTo(502));
    }

    @Test
    void imageNote_listsPageAndSource() {
        ToolImage image = new ToolImage("page-2", 2, "https://example.gov/b.pdf", "image/png", 1, 1, new byte[0]);

        assertThat(HttpConversationBackend.imageNote("fetch_url_content", List.of(image)))
                .isEqualTo("Images extracted from fetch_url_content:\n- page-2 (page 2, https://example.gov/b.pdf)");
    }

    @Test
    void complete_sendsNoToolsAndKeepsNoState() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.tools").doesNotExist())
                .andRespond(withSuccess(TEXT_RESPONSE, MediaType.APPLICATION_JSON));

        assertThat(backend.complete("route", "query")).isEqualTo("Final answer");
        assertThat(backend.handle()).isNull();
        server.verify();
    }
}

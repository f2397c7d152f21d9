package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.exception.ApiException;
import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.tool.ToolImage;
import com.deepansh.policyradar.tool.ToolOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AnthropicMessagesBackendTest {

    private static final String URL = "http://anthropic.test/v1/messages";

    private MockRestServiceServer server;
    private AnthropicMessagesBackend backend;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://anthropic.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        LlmProviderProperties settings = new LlmProviderProperties();
        settings.setModel("claude-test");
        backend = new AnthropicMessagesBackend(settings, builder.build(), new ObjectMapper());
    }

    @Test
    void respond_sendsToolResultsWithImagesAfterEchoedAssistantContent() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.system").value("instructions"))
                .andExpect(jsonPath("$.messages", hasSize(1)))
                .andRespond(withSuccess("""
                        {"content":[{"type":"text","text":"Let me look."},
                          {"type":"tool_use","id":"toolu_1","name":"fetch_url_content","input":{"url":"https://a.gov"}}],
                         "usage":{"input_tokens":90,"output_tokens":15}}""", MediaType.APPLICATION_JSON));
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages", hasSize(3)))
                .andExpect(jsonPath("$.messages[1].role").value("assistant"))
                .andExpect(jsonPath("$.messages[1].content[1].id").value("toolu_1"))
                .andExpect(jsonPath("$.messages[2].content[0].type").value("tool_result"))
                .andExpect(jsonPath("$.messages[2].content[0].tool_use_id").value("toolu_1"))
                .andExpect(jsonPath("$.messages[2].content[0].content[1].type").value("image"))
                .andRespond(withSuccess("""
                        {"content":[{"type":"text","text":"Answer."}]}""", MediaType.APPLICATION_JSON));

        LlmResponse first = backend.start("instructions", "prompt", List.of());

        assertThat(first.getContent()).isEqualTo("Let me look.");
        assertThat(first.getToolCalls()).singleElement()
                .satisfies(call -> assertThat(call.getArguments()).containsEntry("url", "https://a.gov"));

        ToolImage page = new ToolImage("page-1", 1, "https://a.gov", "image/png", 4, 4, new byte[]{9});
        LlmResponse second = backend.respond(List.of(
                new ToolOutput("toolu_1", "fetch_url_content", "{\"full_text\":\"\"}", List.of(page))));

        assertThat(second.getContent()).isEqualTo("Answer.");
        assertThat(backend.handle()).isEqualTo("anthropic-claude-test-2");
        server.verify();
    }

    @Test
    void parse_missingContent_isBadGateway() throws Exception {
        assertThatThrownBy(() -> backend.parse(new ObjectMapper().readTree("{\"type\":\"error\"}")))
                .isInstanceOf(ApiException.class);
    }
}

package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.model.ToolCall;
import com.deepansh.policyradar.tool.ToolOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiBackendTest {

    private MockRestServiceServer server;
    private GeminiBackend backend;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://gemini.test/v1beta");
        server = MockRestServiceServer.bindTo(builder).build();
        LlmProviderProperties settings = new LlmProviderProperties();
        settings.setModel("gemini-test");
        backend = new GeminiBackend(settings, builder.build(), new ObjectMapper());
    }

    @Test
    void respond_mapsGeneratedIdsBackToFunctionNames() {
        server.expect(requestTo(endsWith("/models/gemini-test:generateContent")))
                .andExpect(jsonPath("$.systemInstruction.parts[0].text").value("instructions"))
                .andExpect(jsonPath("$.contents", hasSize(1)))
                .andRespond(withSuccess("""
                        {"candidates":[{"content":{"role":"model","parts":[
                          {"functionCall":{"name":"congress_search_bills","args":{"query":"farm bill"}}},
                          {"functionCall":{"name":"doj_search","args":{"query":"fraud"}}}]}}],
                         "usageMetadata":{"promptTokenCount":80,"candidatesTokenCount":12}}""",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(endsWith(":generateContent")))
                .andExpect(jsonPath("$.contents", hasSize(3)))
                .andExpect(jsonPath("$.contents[1].role").value("model"))
                .andExpect(jsonPath("$.contents[2].parts[0].functionResponse.name").value("congress_search_bills"))
                .andExpect(jsonPath("$.contents[2].parts[1].functionResponse.name").value("doj_search"))
                .andRespond(withSuccess("""
                        {"candidates":[{"content":{"role":"model","parts":[{"text":"Summary "},{"text":"here."}]}}]}""",
                        MediaType.APPLICATION_JSON));

        LlmResponse first = backend.start("instructions", "prompt", List.of());

        assertThat(first.getToolCalls()).extracting(ToolCall::getId).containsExactly("gemini-call-1", "gemini-call-2");
        assertThat(first.getToolCalls().get(0).getArguments()).containsEntry("query", "farm bill");
        assertThat(first.getCompletionTokens()).isEqualTo(12);
        assertThat(backend.handle()).isEqualTo("gemini-gemini-test-1");

        LlmResponse second = backend.respond(List.of(
                new ToolOutput("gemini-call-1", "ignored_name", "{\"count\":1}", List.of()),
                new ToolOutput("gemini-call-2", "ignored_name", "{\"count\":2}", List.of())));

        assertThat(second.getContent()).isEqualTo("Summary here.");
        assertThat(backend.handle()).isEqualTo("gemini-gemini-test-2");
        server.verify();
    }

    @Test
    void parse_blockedPromptWithoutCandidates_returnsEmptyAnswer() throws Exception {
        LlmResponse response = backend.parse(
                new ObjectMapper().readTree("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"), false);

        assertThat(response.hasToolCalls()).isFalse();
        assertThat(response.textOrEmpty()).isEmpty();
    }
}

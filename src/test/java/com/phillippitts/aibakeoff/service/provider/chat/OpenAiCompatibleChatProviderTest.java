package com.phillippitts.aibakeoff.service.provider.chat;

import com.phillippitts.aibakeoff.config.properties.ProviderProperties.ChatProperties;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.domain.TranslationPair;
import com.phillippitts.aibakeoff.exception.ProviderException;
import com.phillippitts.aibakeoff.service.provider.TranslationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiCompatibleChatProviderTest {

    private static final String URL = "https://api.groq.test/openai/v1/chat/completions";
    private static final TranslationPair PAIR = new TranslationPair("es", "en", "Hola, necesito ayuda.");

    private MockRestServiceServer server;
    private RestClient restClient;
    private ChatProperties properties;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
        properties = new ChatProperties(URL, "llama-3.3-70b-versatile");
        properties.setApiKey("gsk-test");
    }

    @Test
    void sendsChatRequestAndParsesTranslation() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer gsk-test"))
                .andExpect(jsonPath("$.model").value("llama-3.3-70b-versatile"))
                .andExpect(jsonPath("$.temperature").value(0.1))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[0].content").value(ChatCompletionJsonParser.SYSTEM_PROMPT))
                .andExpect(jsonPath("$.messages[1].content").value("Translate from es to en: Hola, necesito ayuda."))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"  Hello, I need help. \\n"}}],
                         "usage":{"total_tokens":57}}
                        """, MediaType.APPLICATION_JSON));

        TranslationResult result = provider().translate(PAIR);

        assertThat(result.text()).isEqualTo("Hello, I need help.");
        assertThat(result.totalTokens()).isEqualTo(57);
        server.verify();
    }

    @Test
    void missingUsageAndContentAreTolerated() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        TranslationResult result = provider().translate(PAIR);

        assertThat(result.text()).isEmpty();
        assertThat(result.totalTokens()).isNull();
    }

    @Test
    void non2xxFailsWithStatusAndBody() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("rate limit exceeded"));

        Throwable thrown = catchThrowable(() -> provider().translate(PAIR));

        assertThat(thrown).isInstanceOf(ProviderException.class)
                .hasMessage("Groq chat failed: 429 rate limit exceeded");
        assertThat(((ProviderException) thrown).getHttpStatus()).isEqualTo(429);
    }

    @Test
    void malformedBodyFails() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("<html>gateway</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> provider().translate(PAIR))
                .isInstanceOf(ProviderException.class)
                .hasMessageStartingWith("Groq chat returned malformed JSON");
    }

    @Test
    void missingKeyFailsWithoutRequest() {
        properties.setApiKey("");
        OpenAiCompatibleChatProvider provider =
                new OpenAiCompatibleChatProvider(Provider.OPENAI, "OPENAI_API_KEY", properties, restClient);

        assertThat(provider.isConfigured()).isFalse();
        assertThatThrownBy(() -> provider.translate(PAIR))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Missing OPENAI_API_KEY");
        server.verify();
    }

    @Test
    void rejectsSpeechProviderIdentity() {
        assertThatThrownBy(() -> new OpenAiCompatibleChatProvider(Provider.GROK, "X", properties, restClient))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private OpenAiCompatibleChatProvider provider() {
        return new OpenAiCompatibleChatProvider(Provider.GROQ, "GROQ_API_KEY", properties, restClient);
    }
}

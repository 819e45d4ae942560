package com.phillippitts.aibakeoff.service.provider.chat;

import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.service.provider.TranslationResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChatCompletionJsonParserTest {

    @Test
    void readsNumericTokenCount() {
        TranslationResult result = ChatCompletionJsonParser.parse(
                "{\"choices\":[{\"message\":{\"content\":\" Hello \"}}],\"usage\":{\"total_tokens\":31}}",
                Provider.GROQ);

        assertThat(result.text()).isEqualTo("Hello");
        assertThat(result.totalTokens()).isEqualTo(31);
    }

    @Test
    void nonNumericTokenCountIsAbsent() {
        TranslationResult result = ChatCompletionJsonParser.parse(
                "{\"choices\":[],\"usage\":{\"total_tokens\":\"many\"}}", Provider.OPENAI);

        assertThat(result.totalTokens()).isNull();
    }

    @Test
    void nullTokenCountIsAbsent() {
        TranslationResult result = ChatCompletionJsonParser.parse(
                "{\"usage\":{\"total_tokens\":null}}", Provider.OPENAI);

        assertThat(result.text()).isEmpty();
        assertThat(result.totalTokens()).isNull();
    }
}

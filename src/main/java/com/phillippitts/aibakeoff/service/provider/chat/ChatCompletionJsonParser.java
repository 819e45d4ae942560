package com.phillippitts.aibakeoff.service.provider.chat;

import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.exception.ProviderExceptionBuilder;
import com.phillippitts.aibakeoff.service.provider.TranslationResult;
import com.phillippitts.aibakeoff.util.LogSanitizer;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Utility to build and parse OpenAI-compatible chat-completion payloads.
 *
 * <p>Response format:
 * <pre>{@code
 * {"choices": [{"message": {"content": "..."}}], "usage": {"total_tokens": 42}}
 * }</pre>
 *
 * <p>Missing {@code choices} or {@code content} yields empty text; missing {@code usage}
 * yields no token count. Only a body that is not a JSON object is an error.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
final class ChatCompletionJsonParser {

    static final String SYSTEM_PROMPT = "Translate the user message. Return only the translation text.";

    private ChatCompletionJsonParser() {
        // Utility class - prevent instantiation
    }

    static JSONObject requestBody(String model, double temperature, String source, String target, String text) {
        JSONArray messages = new JSONArray()
                .put(new JSONObject().put("role", "system").put("content", SYSTEM_PROMPT))
                .put(new JSONObject().put("role", "user")
                        .put("content", "Translate from " + source + " to " + target + ": " + text));
        return new JSONObject()
                .put("model", model)
                .put("messages", messages)
                .put("temperature", temperature);
    }

    static TranslationResult parse(String json, Provider provider) {
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw ProviderExceptionBuilder.create(provider.displayName() + " chat returned malformed JSON")
                    .provider(provider.tag())
                    .cause(e)
                    .metadata("bodyPreview", LogSanitizer.preview(json))
                    .build();
        }

        String text = "";
        JSONArray choices = obj.optJSONArray("choices");
        if (choices != null && !choices.isEmpty()) {
            JSONObject first = choices.optJSONObject(0);
            JSONObject message = first == null ? null : first.optJSONObject("message");
            if (message != null) {
                text = message.optString("content", "").trim();
            }
        }

        Integer totalTokens = null;
        JSONObject usage = obj.optJSONObject("usage");
        if (usage != null) {
            // Absent unless the field holds a number
            Number tokens = usage.optNumber("total_tokens");
            if (tokens != null) {
                totalTokens = tokens.intValue();
            }
        }
        return new TranslationResult(text, totalTokens);
    }
}

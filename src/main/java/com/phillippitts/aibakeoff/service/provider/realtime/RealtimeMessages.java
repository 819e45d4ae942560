package com.phillippitts.aibakeoff.service.provider.realtime;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Set;

/**
 * Message vocabulary of the realtime voice protocol.
 *
 * <p>Several inbound type names are accepted for the same event because the provider has
 * renamed them across protocol revisions.
 */
final class RealtimeMessages {

    static final Set<String> AUDIO_DELTA_TYPES = Set.of(
            "response.output_audio.delta",
            "response.audio.delta");

    static final Set<String> COMPLETION_TYPES = Set.of(
            "response.output_audio.done",
            "response.audio.done",
            "response.audio.delta.playback_completed");

    static final String ERROR_TYPE = "error";

    static final String PCM_FORMAT = "audio/pcm";

    private RealtimeMessages() {
    }

    /**
     * Session configuration: text and audio modalities, voice, PCM output at {@code sampleRate}.
     */
    static String sessionUpdate(String voice, int sampleRate) {
        JSONObject format = new JSONObject().put("type", PCM_FORMAT).put("rate", sampleRate);
        JSONObject session = new JSONObject()
                .put("modalities", new JSONArray().put("text").put("audio"))
                .put("voice", voice)
                .put("audio", new JSONObject().put("output", new JSONObject().put("format", format)));
        return new JSONObject().put("type", "session.update").put("session", session).toString();
    }

    /**
     * User message carrying the text to speak.
     */
    static String conversationItem(String text) {
        JSONObject item = new JSONObject()
                .put("type", "message")
                .put("role", "user")
                .put("content", new JSONArray().put(new JSONObject().put("type", "input_text").put("text", text)));
        return new JSONObject().put("type", "conversation.item.create").put("item", item).toString();
    }

    /**
     * Response request restricted to audio output.
     */
    static String responseCreate(String voice) {
        JSONObject response = new JSONObject()
                .put("modalities", new JSONArray().put("audio"))
                .put("voice", voice);
        return new JSONObject().put("type", "response.create").put("response", response).toString();
    }
}

/**
 * Chat-completion translation adapters (Groq, OpenAI) over the OpenAI-compatible REST protocol.
 */
package com.phillippitts.aibakeoff.service.provider.chat;

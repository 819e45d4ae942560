/**
 * ElevenLabs REST text-to-speech adapter.
 */
package com.phillippitts.aibakeoff.service.provider.elevenlabs;

package com.phillippitts.aibakeoff.domain;

import java.util.Objects;

/**
 * Identity of whatever produced a {@link MeasurementRecord}: a single provider, or a
 * translation provider chained with a speech provider in a pipeline run.
 *
 * <p>Used as part of the aggregation key, so implementations rely on record equality.
 */
public sealed interface ProviderTag permits ProviderTag.Single, ProviderTag.Paired {

    /**
     * Returns the report label, e.g. {@code groq} or {@code groq+grok}.
     */
    String label();

    static ProviderTag of(Provider provider) {
        return new Single(provider);
    }

    static ProviderTag paired(Provider translation, Provider speech) {
        return new Paired(translation, speech);
    }

    record Single(Provider provider) implements ProviderTag {
        public Single {
            Objects.requireNonNull(provider, "provider");
        }

        @Override
        public String label() {
            return provider.tag();
        }
    }

    record Paired(Provider translation, Provider speech) implements ProviderTag {
        public Paired {
            Objects.requireNonNull(translation, "translation");
            Objects.requireNonNull(speech, "speech");
            if (translation.capability() != Provider.Capability.TRANSLATION) {
                throw new IllegalArgumentException(translation + " is not a translation provider");
            }
            if (speech.capability() != Provider.Capability.SPEECH) {
                throw new IllegalArgumentException(speech + " is not a speech provider");
            }
        }

        @Override
        public String label() {
            return translation.tag() + "+" + speech.tag();
        }
    }
}

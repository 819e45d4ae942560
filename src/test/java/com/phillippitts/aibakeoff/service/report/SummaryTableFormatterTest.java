package com.phillippitts.aibakeoff.service.report;

import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.domain.ProviderTag;
import com.phillippitts.aibakeoff.domain.Scenario;
import com.phillippitts.aibakeoff.domain.SummaryRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryTableFormatterTest {

    private final SummaryTableFormatter formatter = new SummaryTableFormatter();

    @Test
    void formatsRowWithPaddedColumns() {
        SummaryRow row = new SummaryRow(ProviderTag.of(Provider.GROQ), Scenario.TRANSLATION,
                212.4, 390.6, 1.0, null);

        assertThat(formatter.formatRow(row))
                .isEqualTo("  translation        groq               p50=  212 p95=  391 ok=100.0% avgBytes=-");
    }

    @Test
    void formatsAverageBytesRounded() {
        SummaryRow row = new SummaryRow(ProviderTag.paired(Provider.GROQ, Provider.GROK), Scenario.PIPELINE,
                900, 1400, 0.5, 48123.6);

        assertThat(formatter.formatRow(row))
                .endsWith("ok= 50.0% avgBytes=48124 bytes")
                .contains("translation+tts    groq+grok");
    }

    @Test
    void listsErrorsAfterSummary() {
        ProviderTag grok = ProviderTag.of(Provider.GROK);
        BakeoffReport report = new BakeoffReport(
                List.of(new SummaryRow(grok, Scenario.TTS, 0, 0, 0.0, null)),
                List.of(MeasurementRecord.failure(grok, Scenario.TTS, "en",
                        "Missing GROK_VOICE_API_KEY or GROK_VOICE_URL")));

        String table = formatter.format(report);

        assertThat(table).startsWith(SummaryTableFormatter.HEADER);
        assertThat(table).contains(SummaryTableFormatter.ERRORS_HEADER);
        assertThat(table).contains("  [grok][tts][en] Missing GROK_VOICE_API_KEY or GROK_VOICE_URL");
    }

    @Test
    void omitsErrorSectionWhenAllSucceeded() {
        ProviderTag groq = ProviderTag.of(Provider.GROQ);
        BakeoffReport report = new BakeoffReport(
                List.of(new SummaryRow(groq, Scenario.TRANSLATION, 10, 10, 1.0, null)),
                List.of(MeasurementRecord.success(groq, Scenario.TRANSLATION, "es->en", 10, null, null)));

        assertThat(formatter.format(report)).doesNotContain(SummaryTableFormatter.ERRORS_HEADER);
    }
}

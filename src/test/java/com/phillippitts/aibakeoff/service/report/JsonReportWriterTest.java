package com.phillippitts.aibakeoff.service.report;

import com.phillippitts.aibakeoff.config.properties.ReportProperties;
import com.phillippitts.aibakeoff.domain.MeasurementRecord;
import com.phillippitts.aibakeoff.domain.Provider;
import com.phillippitts.aibakeoff.domain.ProviderTag;
import com.phillippitts.aibakeoff.domain.Scenario;
import com.phillippitts.aibakeoff.domain.SummaryRow;
import com.phillippitts.aibakeoff.exception.BakeoffException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    private static final ProviderTag GROK = ProviderTag.of(Provider.GROK);

    @Test
    void writesSummaryAndSamplesIntoNewDirectory() throws IOException {
        Path outputDir = tempDir.resolve("nested/artifacts");
        JsonReportWriter writer = new JsonReportWriter(new ReportProperties(outputDir));
        BakeoffReport report = new BakeoffReport(
                List.of(new SummaryRow(GROK, Scenario.TTS, 410.0, 800.0, 0.5, 48000.0)),
                List.of(MeasurementRecord.success(GROK, Scenario.TTS, "en", 410.0, null, 48000),
                        MeasurementRecord.failure(GROK, Scenario.TTS, "ar", "Grok WS error event: busy")));

        Path written = writer.write(report);

        assertThat(written).isEqualTo(outputDir.resolve("ai-bakeoff-report.json"));
        String content = Files.readString(written, StandardCharsets.UTF_8);
        assertThat(content).contains("\n  \"");

        JSONObject json = new JSONObject(content);
        JSONObject row = json.getJSONArray("summary").getJSONObject(0);
        assertThat(row.getString("provider")).isEqualTo("grok");
        assertThat(row.getString("scenario")).isEqualTo("tts");
        assertThat(row.getDouble("okRate")).isEqualTo(0.5);
        assertThat(row.getDouble("avgAudioBytes")).isEqualTo(48000.0);

        JSONArray samples = json.getJSONArray("samples");
        assertThat(samples.length()).isEqualTo(2);
        JSONObject ok = samples.getJSONObject(0);
        assertThat(ok.getInt("audioBytes")).isEqualTo(48000);
        assertThat(ok.has("costTokens")).isFalse();
        assertThat(ok.has("error")).isFalse();
        JSONObject failed = samples.getJSONObject(1);
        assertThat(failed.getBoolean("ok")).isFalse();
        assertThat(failed.getDouble("elapsedMs")).isZero();
        assertThat(failed.getString("error")).isEqualTo("Grok WS error event: busy");
    }

    @Test
    void omitsNullAverageAudio() {
        JSONObject json = JsonReportWriter.toJson(new BakeoffReport(
                List.of(new SummaryRow(ProviderTag.of(Provider.GROQ), Scenario.TRANSLATION, 1, 2, 1.0, null)),
                List.of()));

        assertThat(json.getJSONArray("summary").getJSONObject(0).has("avgAudioBytes")).isFalse();
        assertThat(json.getJSONArray("samples").isEmpty()).isTrue();
    }

    @Test
    void preservesNonAsciiText() throws IOException {
        JsonReportWriter writer = new JsonReportWriter(new ReportProperties(tempDir));
        Path written = writer.write(new BakeoffReport(List.of(), List.of(
                MeasurementRecord.failure(GROK, Scenario.TTS, "zh", "错误: 连接关闭"))));

        assertThat(Files.readString(written, StandardCharsets.UTF_8)).contains("错误: 连接关闭");
    }

    @Test
    void unwritableTargetFailsWithBakeoffException() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        JsonReportWriter writer = new JsonReportWriter(new ReportProperties(blocker.resolve("sub")));

        assertThatThrownBy(() -> writer.write(new BakeoffReport(List.of(), List.of())))
                .isInstanceOf(BakeoffException.class)
                .hasMessageContaining("Failed to write report");
    }
}

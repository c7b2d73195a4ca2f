package com.phillippitts.hsie.service.store;

import com.phillippitts.hsie.domain.AnalysisFailure;
import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.HsiContribution;
import com.phillippitts.hsie.domain.HsiScore;
import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.ScoredPayload;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.domain.WeightingConfig;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.phillippitts.hsie.testutil.EvidenceFixtures.analysis;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.failure;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.fixedClock;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.preprocessed;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.raw;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.result;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.segment;
import static com.phillippitts.hsie.testutil.EvidenceFixtures.word;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvidenceJsonCodecTest {

    private final EvidenceFactory factory = new EvidenceFactory(fixedClock());

    @Test
    void documentCarriesSchemaFields() {
        Evidence e = factory.create(null, "entry-stage", raw(word(0, "hello", 0.0, 0.4)));

        JSONObject json = EvidenceJsonCodec.toJson(e);

        assertThat(json.getString("id")).isEqualTo(e.id());
        assertThat(json.getString("version_kind")).isEqualTo("Raw");
        assertThat(json.isNull("parent_id")).isTrue();
        assertThat(json.getString("created_at")).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(json.getString("producer")).isEqualTo("entry-stage");
        assertThat(json.getJSONObject("payload").getJSONArray("words")).hasSize(1);
        assertThat(json.getJSONObject("payload").getJSONObject("source").getString("sha256"))
                .hasSize(64);
    }

    @Test
    void rawDocumentParsesBackToEqualEvidence() {
        Evidence e = factory.create(null, "entry-stage",
                raw(word(0, "hello", 0.0, 0.4), word(1, "world", 0.5, 0.9)));

        Evidence parsed = EvidenceJsonCodec.parse(EvidenceJsonCodec.canonical(e));

        assertThat(parsed).isEqualTo(e);
        assertThat(EvidenceFactory.addressOf(parsed)).isEqualTo(e.id());
    }

    @Test
    void failureMarkerIsRenderedAsFailedStatusAndSurvivesParsing() {
        AnalyzedPayload payload = new AnalyzedPayload(
                Map.of(AnalyzerKind.ACOUSTIC, "v1", AnalyzerKind.SEMANTIC, "v1"),
                List.of(analysis(0, "S1", result(AnalyzerKind.ACOUSTIC, 0.4),
                        failure(AnalyzerKind.SEMANTIC, AnalysisFailure.TIMEOUT))));
        Evidence e = factory.create("ab".repeat(32), "analysis-stage", payload);

        JSONObject semantic = EvidenceJsonCodec.payloadToJson(payload)
                .getJSONArray("segments").getJSONObject(0)
                .getJSONObject("results").getJSONObject("SEMANTIC");
        Evidence parsed = EvidenceJsonCodec.parse(EvidenceJsonCodec.toJson(e).toString());

        assertThat(semantic.getString("status")).isEqualTo("failed");
        assertThat(semantic.getString("error")).isEqualTo("PartialAnalysisError");
        assertThat(semantic.getString("reason")).isEqualTo("timeout");
        assertThat(parsed.payloadAs(AnalyzedPayload.class)).isEqualTo(payload);
    }

    @Test
    void scoredDocumentKeepsScoreAndWeighting() {
        HsiScore score = new HsiScore(0.5, 0.625, Map.of(AnalyzerKind.ACOUSTIC, 1.0), 1,
                List.of(new HsiContribution(0, AnalyzerKind.ACOUSTIC, "S1", 0.5, 1.0, 0.5, 1.25)));
        ScoredPayload payload = new ScoredPayload(score, WeightingConfig.equalWeights());
        Evidence e = factory.create("cd".repeat(32), "aggregation-stage", payload);

        Evidence parsed = EvidenceJsonCodec.parse(EvidenceJsonCodec.canonical(e));

        assertThat(parsed.versionKind()).isEqualTo(VersionKind.SCORED);
        assertThat(parsed.payloadAs(ScoredPayload.class)).isEqualTo(payload);
    }

    @Test
    void idIgnoresCreationTimeAndProducer() {
        RawPayload payload = raw(word(0, "hello", 0.0, 0.4));
        EvidenceFactory later = new EvidenceFactory(
                Clock.fixed(Instant.parse("2030-06-01T12:00:00Z"), ZoneOffset.UTC));

        Evidence a = factory.create(null, "entry-stage", payload);
        Evidence b = later.create(null, "another-producer", payload);

        assertThat(a.id()).isEqualTo(b.id());
        assertThat(ContentAddress.isWellFormed(a.id())).isTrue();
    }

    @Test
    void idDependsOnParent() {
        var payload = preprocessed(segment(0, 0.0, 1.0, "S1", "hi"));

        String underA = EvidenceFactory.addressOf("aa".repeat(32), payload);
        String underB = EvidenceFactory.addressOf("bb".repeat(32), payload);

        assertThat(underA).isNotEqualTo(underB);
    }

    @Test
    void canonicalRenderingSortsKeysWithoutWhitespace() {
        JSONObject obj = new JSONObject();
        obj.put("b", 1);
        obj.put("a", new JSONObject().put("z", true).put("y", JSONObject.NULL));

        assertThat(CanonicalJson.write(obj)).isEqualTo("{\"a\":{\"y\":null,\"z\":true},\"b\":1}");
    }

    @Test
    void contentAddressIsLowercaseSha256() {
        assertThat(ContentAddress.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(ContentAddress.isWellFormed("ABC")).isFalse();
        assertThat(ContentAddress.isWellFormed("g".repeat(64))).isFalse();
    }

    @Test
    void malformedDocumentIsRejected() {
        assertThatThrownBy(() -> EvidenceJsonCodec.parse("{\"id\":\"x\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed Evidence document");
        assertThatThrownBy(() -> EvidenceJsonCodec.parse("not json"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.phillippitts.hsie.service.entry;

import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.exception.TranscriptionException;
import com.phillippitts.hsie.exception.TranscriptionFailureReason;
import com.phillippitts.hsie.service.store.EvidenceFactory;
import com.phillippitts.hsie.service.store.InMemoryEvidenceStore;
import com.phillippitts.hsie.testutil.FakeTranscriptionAdapter;
import com.phillippitts.hsie.testutil.TestAudio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.phillippitts.hsie.testutil.EvidenceFixtures.fixedClock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntryStageTest {

    @TempDir
    Path dir;

    private InMemoryEvidenceStore store;
    private FakeTranscriptionAdapter adapter;
    private EntryStage stage;
    private Path wav;

    @BeforeEach
    void setUp() throws IOException {
        store = new InMemoryEvidenceStore();
        adapter = FakeTranscriptionAdapter.conversation();
        stage = new EntryStage(adapter, new AudioMetadataCollector(), store, new EvidenceFactory(fixedClock()), "en");
        wav = TestAudio.writeSilentWav(dir.resolve("interview.wav"), 2.5, 2);
    }

    @Test
    void capturesTranscriptAndAudioFactsAsRawEvidence() {
        // Act
        Evidence raw = stage.capture(wav, "interview-7");

        // Assert
        assertThat(raw.versionKind()).isEqualTo(VersionKind.RAW);
        assertThat(raw.parentId()).isNull();
        assertThat(raw.producer()).isEqualTo(EntryStage.PRODUCER);
        RawPayload payload = raw.payloadAs(RawPayload.class);
        assertThat(payload.transcript()).isEqualTo("good morning hello again");
        assertThat(payload.words()).hasSize(4);
        assertThat(payload.chunks()).hasSize(2);
        assertThat(payload.source().channels()).isEqualTo("stereo");
        assertThat(payload.capture().sessionId()).isEqualTo("interview-7");
        assertThat(payload.capture().engine()).isEqualTo("fake");
        assertThat(payload.capture().model()).isEqualTo("fake-model");
        assertThat(payload.capture().capturedBy()).isEqualTo(EntryStage.PRODUCER);
        assertThat(store.get(raw.id())).isEqualTo(raw);
        assertThat(adapter.lastLanguage()).isEqualTo("en");
    }

    @Test
    void blankSessionIsDerivedFromAudioHash() {
        Evidence raw = stage.capture(wav, " ");

        RawPayload payload = raw.payloadAs(RawPayload.class);
        assertThat(payload.capture().sessionId())
                .isEqualTo("session-" + payload.source().sha256().substring(0, 12));
    }

    @Test
    void capturingSameAudioTwiceYieldsSameEvidence() {
        String first = stage.capture(wav, null).id();
        String second = stage.capture(wav, null).id();

        assertThat(first).isEqualTo(second);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void transcriptionFailureLeavesStoreUntouched() {
        adapter.failWith(new TranscriptionException("engine crashed", TranscriptionFailureReason.ENGINE_FAILURE, "fake"));

        assertThatThrownBy(() -> stage.capture(wav, "s"))
                .isInstanceOfSatisfying(TranscriptionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(TranscriptionFailureReason.ENGINE_FAILURE));
        assertThat(store.size()).isZero();
    }
}

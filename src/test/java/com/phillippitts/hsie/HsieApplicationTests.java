package com.phillippitts.hsie;

import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.service.analysis.Analyzer;
import com.phillippitts.hsie.service.pipeline.EvidencePipeline;
import com.phillippitts.hsie.service.pipeline.PipelineRun;
import com.phillippitts.hsie.service.transcription.TranscriptionAdapter;
import com.phillippitts.hsie.testutil.FakeTranscriptionAdapter;
import com.phillippitts.hsie.testutil.ScriptedAnalyzer;
import com.phillippitts.hsie.testutil.TestAudio;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "hsie.store.type=memory",
        "hsie.transcription.language=en",
        "hsie.analysis.call-timeout-ms=5000"
})
@AutoConfigureMockMvc
class HsieApplicationTests {

    @TestConfiguration
    static class FakeCollaborators {

        @Bean
        @Primary
        TranscriptionAdapter fakeTranscriptionAdapter() {
            return FakeTranscriptionAdapter.conversation();
        }

        @Bean
        Analyzer acousticAnalyzer() {
            return ScriptedAnalyzer.constant(AnalyzerKind.ACOUSTIC, 0.3);
        }

        @Bean
        Analyzer semanticAnalyzer() {
            return ScriptedAnalyzer.constant(AnalyzerKind.SEMANTIC, 0.6);
        }

        @Bean
        Analyzer linguisticAnalyzer() {
            return ScriptedAnalyzer.constant(AnalyzerKind.LINGUISTIC, 0.9);
        }
    }

    @TempDir
    Path dir;

    @Autowired
    private EvidencePipeline pipeline;

    @Autowired
    private MockMvc mvc;

    @Test
    void contextLoads() {
        assertThat(pipeline.getDefaultAnalyzerSet().versions())
                .containsOnlyKeys(AnalyzerKind.ACOUSTIC, AnalyzerKind.SEMANTIC, AnalyzerKind.LINGUISTIC);
    }

    @Test
    void wiredPipelineRunsEndToEnd() throws Exception {
        Path wav = TestAudio.writeSilentWav(dir.resolve("wired.wav"), 3.0, 1);

        PipelineRun run = pipeline.run(wav, "wired-1");

        assertThat(run.score().score().hsi()).isBetween(0.59, 0.61);
        assertThat(pipeline.lineage(run.scored().id())).hasSize(4);
    }

    @Test
    void captureAndFetchOverRest() throws Exception {
        Path wav = TestAudio.writeSilentWav(dir.resolve("rest.wav"), 2.0, 1);
        String body = new JSONObject().put("audioPath", wav.toString()).put("sessionId", "rest-1").toString();

        MvcResult created = mvc.perform(post("/evidence/capture").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version_kind").value("Raw"))
                .andReturn();
        String id = new JSONObject(created.getResponse().getContentAsString()).getString("id");

        mvc.perform(get("/evidence/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id));
        mvc.perform(post("/evidence/" + id + "/preprocess"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.parent_id").value(id));
    }

    @Test
    void unknownEvidenceIsNotFound() throws Exception {
        mvc.perform(get("/evidence/" + "ee".repeat(32)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NotFoundError"));
    }

    @Test
    void blankAudioPathIsBadRequest() throws Exception {
        mvc.perform(post("/evidence/capture").contentType(MediaType.APPLICATION_JSON).content("{\"audioPath\":\"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void onlyNonOptionArgumentsSelectCommandMode() {
        assertThat(HsieApplication.hasCommand(new String[]{"--server.port=0"})).isFalse();
        assertThat(HsieApplication.hasCommand(new String[]{"run", "call.wav"})).isTrue();
    }
}

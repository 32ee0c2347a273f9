package com.phillippitts.holderbot;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HolderBotApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Test
    void contextLoads() {
    }

    @Test
    void decisionWithoutOracleFallsBackToRules() throws Exception {
        mvc.perform(post("/api/subjects/4200/decision"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subjectId").value("4200"))
                .andExpect(jsonPath("$.material").value("kov"))
                .andExpect(jsonPath("$.confidence").value(0.65))
                .andExpect(jsonPath("$.path").value("ENSEMBLE"));

        mvc.perform(get("/api/subjects/4200"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verified").value(false));
    }

    @Test
    void correctionIsVerifiedAndLearned() throws Exception {
        mvc.perform(put("/api/subjects/7313/correction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"material\": \"betón\", \"type\": \"stĺp značky dvojitý\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated.verified").value(true));

        mvc.perform(post("/api/subjects/7313/decision"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.material").value("betón"))
                .andExpect(jsonPath("$.confidence").value(1.0));

        mvc.perform(get("/api/subjects/7313/learned"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sampleCount").value(1));
    }

    @Test
    void malformedRequestsAreRejected() throws Exception {
        mvc.perform(put("/api/subjects/9/correction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"material\": \"\", \"type\": \"A\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationFailed"));

        mvc.perform(get("/api/subjects/export").param("format", "xml"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

        mvc.perform(post("/api/subjects/import").contentType(MediaType.APPLICATION_JSON).content("{oops"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownSubjectIs404() throws Exception {
        mvc.perform(get("/api/subjects/no-such-subject")).andExpect(status().isNotFound());
    }

    @Test
    void csvExportHasHeader() throws Exception {
        mvc.perform(get("/api/subjects/export").param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("subject_id,material,type")));
    }

    @Test
    void calibrationEndpointsRespond() throws Exception {
        mvc.perform(post("/api/calibration/outcomes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"predictedConfidence\": 0.85, \"wasCorrect\": true}"))
                .andExpect(status().isCreated());

        mvc.perform(get("/api/calibration/bins")).andExpect(status().isOk());
        mvc.perform(get("/api/calibration/report")).andExpect(status().isOk());
    }
}

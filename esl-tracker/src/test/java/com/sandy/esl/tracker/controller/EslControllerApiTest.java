package com.sandy.esl.tracker.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EslControllerApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired ObjectMapper objectMapper;
    @Autowired JdbcTemplate jdbcTemplate;

    @BeforeEach
    void clean() {
        jdbcTemplate.update("DELETE FROM esl");
    }

    private String saveViaApi(String serial, String eslId) throws Exception {
        String json = "{\"type\":\"Hanshow\",\"serial\":\"" + serial + "\",\"eslId\":\"" + eslId + "\","
                + "\"nom\":\"Lieu jaune\",\"prix\":\"24.90\",\"origine\":\"France\"}";
        String resp = mockMvc.perform(post("/api/esl")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.objectId", notNullValue()))
                .andExpect(jsonPath("$.createdAt", notNullValue()))
                .andExpect(jsonPath("$.printed", is(false)))
                .andExpect(jsonPath("$.nom", is("Lieu jaune")))
                .andReturn().getResponse().getContentAsString();
        return resp;
    }

    @Test
    void saveListAndMarkPrintedViaApi() throws Exception {
        String saved = saveViaApi("DEV-42", "abc123");
        String objectId = objectMapper.readTree(saved).get("objectId").asText();

        mockMvc.perform(get("/api/esl/unprinted").param("serial", "DEV-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].objectId", is(objectId)))
                .andExpect(jsonPath("$[0].eslId", is("abc123")))
                .andExpect(jsonPath("$[0].origine", is("France")));

        mockMvc.perform(put("/api/esl/printed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saved))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.objectId", is(objectId)))
                .andExpect(jsonPath("$.printed", is(true)));

        mockMvc.perform(get("/api/esl/unprinted").param("serial", "DEV-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void printAllMarksEveryPendingRecordOfTheDevice() throws Exception {
        saveViaApi("DEV-7", "a");
        saveViaApi("DEV-7", "b");
        saveViaApi("DEV-8", "c");

        mockMvc.perform(post("/api/esl/DEV-7/print-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].printed", everyItem(is(true))));

        mockMvc.perform(get("/api/esl/unprinted").param("serial", "DEV-7"))
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(get("/api/esl/unprinted").param("serial", "DEV-8"))
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void findByDateRangeViaApi() throws Exception {
        saveViaApi("DEV-9", "a");

        mockMvc.perform(get("/api/esl")
                        .param("serial", "DEV-9")
                        .param("start", "2000-01-01 00:00:00:000")
                        .param("end", "2999-12-31 23:59:59:999"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].eslId", is("a")));

        mockMvc.perform(get("/api/esl")
                        .param("serial", "DEV-9")
                        .param("start", "2000-01-01 00:00:00:000")
                        .param("end", "2000-01-02 00:00:00:000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void malformedDateBoundIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/esl")
                        .param("serial", "DEV-9")
                        .param("start", "yesterday")
                        .param("end", "2999-12-31 23:59:59:999"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("ESL-400")))
                .andExpect(jsonPath("$.error", containsString("yesterday")));
    }

    @Test
    void markPrintedWithoutObjectIdIsABadRequest() throws Exception {
        mockMvc.perform(put("/api/esl/printed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"Pricer\",\"serial\":\"DEV-1\",\"eslId\":\"3700000000017\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("ESL-007")))
                .andExpect(jsonPath("$.error", containsString("objectId")));
    }

    @Test
    void saveWithoutEslIdIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/esl")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"Hanshow\",\"serial\":\"DEV-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("ESL-400")));
    }

    @Test
    void saveOfARecordFlaggedPrintedIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/esl")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"Hanshow\",\"serial\":\"DEV-P\",\"eslId\":\"x\",\"printed\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("ESL-400")));

        mockMvc.perform(get("/api/esl/unprinted").param("serial", "DEV-P"))
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void markPrintedOfUnknownObjectIdIsServiceUnavailable() throws Exception {
        mockMvc.perform(put("/api/esl/printed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"objectId\":\"missing\",\"serial\":\"DEV-1\",\"eslId\":\"x\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code", is("ESL-006")));
    }
}

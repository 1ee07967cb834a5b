package com.example.tablecompare.web;

import com.example.tablecompare.application.PatchApplier;
import com.example.tablecompare.application.ReconciliationSessionService;
import com.example.tablecompare.application.TableComparisonUseCase;
import com.example.tablecompare.application.TableDiffer;
import com.example.tablecompare.infrastructure.DelimitedTableReader;
import com.example.tablecompare.infrastructure.DelimitedTableWriter;
import com.example.tablecompare.infrastructure.TableCompareConfiguration;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TableCompareController.class)
@Import({
    TableCompareConfiguration.class,
    DelimitedTableReader.class,
    DelimitedTableWriter.class,
    TableDiffer.class,
    PatchApplier.class,
    TableComparisonUseCase.class,
    ReconciliationSessionService.class,
    MultipartTableInputAdapter.class
})
class TableCompareControllerTest {

    private static final String ORIGINAL = "Name,City\nAlice,NYC\nBob,LA\n";
    private static final String UPDATED = "Name,City\nAlice,NYC\nBob,SF\nCarol,Chicago\n";

    @Autowired private MockMvc mockMvc;

    @Test
    void compareOpensSessionWithSummariesAndStats() throws Exception {
        mockMvc.perform(
                        multipart("/api/comparisons")
                                .file(csv("original", "people.csv", ORIGINAL))
                                .file(csv("updated", "people-v2.csv", UPDATED)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("people.csv vs people-v2.csv"))
                .andExpect(jsonPath("$.original.rowCount").value(2))
                .andExpect(jsonPath("$.updated.rowCount").value(3))
                .andExpect(jsonPath("$.stats.total").value(2))
                .andExpect(jsonPath("$.stats.modified").value(1))
                .andExpect(jsonPath("$.stats.added").value(1))
                .andExpect(jsonPath("$.canApply").value(false))
                .andExpect(jsonPath("$.timing.steps.length()").value(4));
    }

    @Test
    void differencesCanBeFilteredAndDecidedByIdentity() throws Exception {
        long id = openSession();

        mockMvc.perform(
                        get("/api/comparisons/{id}/differences", id)
                                .param("kind", "MODIFIED")
                                .param("search", "la"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(1))
                .andExpect(jsonPath("$.stats.total").value(2))
                .andExpect(jsonPath("$.filter.kind").value("MODIFIED"))
                .andExpect(jsonPath("$.differences[0].rowPosition").value(2))
                .andExpect(jsonPath("$.differences[0].columnIndex").value(1))
                .andExpect(jsonPath("$.differences[0].columnKey").value("City"))
                .andExpect(jsonPath("$.differences[0].status").value("PENDING"));

        mockMvc.perform(
                        put("/api/comparisons/{id}/differences/{row}/{column}", id, 2, 1)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"status\":\"ACCEPTED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(true))
                .andExpect(jsonPath("$.stats.accepted").value(1))
                .andExpect(jsonPath("$.stats.pending").value(1));

        mockMvc.perform(
                        put("/api/comparisons/{id}/differences/{row}/{column}", id, 9, 0)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"status\":\"REJECTED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(false))
                .andExpect(jsonPath("$.stats.rejected").value(0));

        mockMvc.perform(
                        get("/api/comparisons/{id}/differences", id).param("status", "ACCEPTED"))
                .andExpect(jsonPath("$.matched").value(1))
                .andExpect(jsonPath("$.differences[0].newValue").value("SF"));
    }

    @Test
    void correctedDownloadAppliesAcceptedDifferences() throws Exception {
        long id = openSession();
        mockMvc.perform(
                put("/api/comparisons/{id}/differences/{row}/{column}", id, 3, -1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"ACCEPTED\"}"));

        mockMvc.perform(get("/api/comparisons/{id}", id))
                .andExpect(jsonPath("$.canApply").value(true));

        mockMvc.perform(get("/api/comparisons/{id}/corrected", id))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("attachment")))
                .andExpect(
                        header().string(
                                        "Content-Disposition",
                                        containsString("corrected_people.csv")))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string("Name,City\nAlice,NYC\nBob,LA\nCarol,Chicago"));
    }

    @Test
    void rerunReplacesDifferences() throws Exception {
        long id = openSession();

        mockMvc.perform(
                        multipart("/api/comparisons/{id}/rerun", id)
                                .file(csv("updated", "people-v3.csv", ORIGINAL)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.total").value(0))
                .andExpect(jsonPath("$.updated.name").value("people-v3.csv"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/comparisons/{id}", 987654L)).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/comparisons/{id}/corrected", 987654L))
                .andExpect(status().isNotFound());
    }

    @Test
    void binaryUploadIsBadRequest() throws Exception {
        mockMvc.perform(
                        multipart("/api/comparisons")
                                .file(
                                        new MockMultipartFile(
                                                "original",
                                                "book.xlsx",
                                                "application/octet-stream",
                                                new byte[] {0x50, 0x4B, 0x03, 0x04}))
                                .file(csv("updated", "b.csv", UPDATED)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("book.xlsx")));
    }

    @Test
    void discardedSessionIsGone() throws Exception {
        long id = openSession();

        mockMvc.perform(delete("/api/comparisons/{id}", id)).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/comparisons/{id}", id)).andExpect(status().isNotFound());
    }

    private long openSession() throws Exception {
        MvcResult result =
                mockMvc.perform(
                                multipart("/api/comparisons")
                                        .file(csv("original", "people.csv", ORIGINAL))
                                        .file(csv("updated", "people-v2.csv", UPDATED)))
                        .andExpect(status().isCreated())
                        .andReturn();
        Number id = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
        return id.longValue();
    }

    private static MockMultipartFile csv(String part, String filename, String text) {
        return new MockMultipartFile(
                part, filename, "text/csv", text.getBytes(StandardCharsets.UTF_8));
    }
}

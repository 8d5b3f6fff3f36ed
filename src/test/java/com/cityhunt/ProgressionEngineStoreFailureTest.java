package com.cityhunt;

import com.cityhunt.engine.ProgressionEngine;
import com.cityhunt.error.ErrorKind;
import com.cityhunt.error.HuntException;
import com.cityhunt.repository.StageJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;

import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ProgressionEngineStoreFailureTest {
    @Autowired
    private ProgressionEngine engine;
    @Autowired
    private MockMvc mvc;

    @MockBean
    private StageJdbcRepository stages;

    @Test
    void wrapsStoreFailuresAsInternal() {
        when(stages.findByNumber(anyInt())).thenThrow(new DataAccessResourceFailureException("content store offline"));

        HuntException ex = assertThrows(HuntException.class,
                () -> engine.validateAnswer("session-f", "fail-group", "1", "cityhunt"));
        assertEquals(ErrorKind.INTERNAL, ex.kind());
        assertEquals("content store offline", ex.detail());
        assertFalse(ex.getMessage().contains("offline"));
    }

    @Test
    void wrapsFailureWhileCountingStages() {
        when(stages.count()).thenThrow(new DataAccessResourceFailureException("count failed"));

        HuntException ex = assertThrows(HuntException.class, () -> engine.getGroupProgress("session-f", "fail-group"));
        assertEquals(ErrorKind.INTERNAL, ex.kind());
        assertInstanceOf(DataAccessResourceFailureException.class, ex.getCause());
    }

    @Test
    void wrapsDamagedRowsAsInternal() {
        when(stages.findByNumber(anyInt())).thenThrow(new DateTimeParseException("bad timestamp", "not-a-time", 0));

        HuntException ex = assertThrows(HuntException.class,
                () -> engine.validateAnswer("session-f", "fail-group", "1", "cityhunt"));
        assertEquals(ErrorKind.INTERNAL, ex.kind());
        assertInstanceOf(DateTimeParseException.class, ex.getCause());
    }

    @Test
    void answersInternalFailuresWithErrorBody() throws Exception {
        when(stages.count()).thenThrow(new DataAccessResourceFailureException("count failed"));

        mvc.perform(get("/api/hunt/progress").header("X-Session-Id", "session-f").param("groupId", "fail-group"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("internal"))
                .andExpect(jsonPath("$.message").value("An error occurred while fetching progress."));
    }
}

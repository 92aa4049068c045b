package com.compilebox.backend.api;

import com.compilebox.backend.model.CompileOutcome;
import com.compilebox.backend.service.CompileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for CompileController: web layer only, CompileService mocked.
 */
@WebMvcTest(CompileController.class)
class CompileControllerTest {

    @Autowired   MockMvc        mockMvc;
    @MockitoBean CompileService compileService;

    // ------------------------------------------------------------------
    // POST /api/compile
    // ------------------------------------------------------------------

    @Test
    void compile_success_returns200WithOutput() throws Exception {
        when(compileService.compileAndExecute("вход {}")).thenReturn(CompileOutcome.success("Привет", 42));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceCode":"  вход {}\\n"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.output").value("Привет"))
                .andExpect(jsonPath("$.executionTimeMs").value(42))
                .andExpect(jsonPath("$.resultType").value("success"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void compile_compilerError_returns200WithResultType() throws Exception {
        when(compileService.compileAndExecute(any())).thenReturn(CompileOutcome.compilationError("ошибка"));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceCode":"вход { икс }"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("ошибка"))
                .andExpect(jsonPath("$.resultType").value("compilation_error"))
                .andExpect(jsonPath("$.output").doesNotExist());
    }

    @Test
    void compile_blankSource_returns400() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceCode":"   "}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.resultType").value("compilation_error"))
                .andExpect(jsonPath("$.error").value(org.hamcrest.Matchers.containsString("sourceCode")));

        verifyNoInteractions(compileService);
    }

    @Test
    void compile_sourceOverLimit_returns400() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\":\"" + "x".repeat(10_001) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.resultType").value("compilation_error"));

        verifyNoInteractions(compileService);
    }

    @Test
    void compile_serviceThrows_returns500() throws Exception {
        when(compileService.compileAndExecute(any())).thenThrow(new IllegalStateException("disk full"));

        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceCode":"вход {}"}
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error: disk full"));
    }

    // ------------------------------------------------------------------
    // GET /api/health
    // ------------------------------------------------------------------

    @Test
    void health_returns200() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string(org.hamcrest.Matchers.containsString("healthy")));
    }
}

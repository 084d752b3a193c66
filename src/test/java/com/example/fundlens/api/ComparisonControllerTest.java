package com.example.fundlens.api;

import com.example.fundlens.api.dto.ComparisonDtos.ComparisonRequest;
import com.example.fundlens.api.dto.ComparisonDtos.ComparisonResponse;
import com.example.fundlens.api.dto.ComparisonDtos.InstrumentSummary;
import com.example.fundlens.domain.InstrumentMetrics;
import com.example.fundlens.service.ComparisonService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ComparisonController.class)
class ComparisonControllerTest {
    @Autowired
    private MockMvc mvc;

    @MockBean
    private ComparisonService comparisonService;

    @Test
    void returnsBaseHundredTable() throws Exception {
        LocalDate d1 = LocalDate.of(2021, 3, 15);
        LocalDate d2 = LocalDate.of(2021, 3, 16);
        Map<String, List<Double>> series = new LinkedHashMap<>();
        series.put("Alpha", List.of(100.0, 101.5));
        series.put("Late", Arrays.asList(null, 100.0));
        InstrumentMetrics metrics = new InstrumentMetrics(1.5, null, 12.3, null, 0.0, 0.87, "Euro Stoxx 50");
        when(comparisonService.compare(any(ComparisonRequest.class))).thenReturn(new ComparisonResponse(d1, 100.0,
                List.of(d1, d2), series,
                List.of(new InstrumentSummary("LU0097089360", "Alpha", "Yahoo Finance (LU0097089360.L)", false, metrics)),
                List.of("IE0003111113")));

        mvc.perform(post("/api/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruments\": [{\"identifier\": \"LU0097089360\"}, {\"identifier\": \"IE0003111113\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.commonStartDate").value("2021-03-15"))
                .andExpect(jsonPath("$.baseValue").value(100.0))
                .andExpect(jsonPath("$.dates[1]").value("2021-03-16"))
                .andExpect(jsonPath("$.series.Alpha[1]").value(101.5))
                .andExpect(jsonPath("$.series.Late[0]").value(nullValue()))
                .andExpect(jsonPath("$.instruments[0].metrics.beta").value(0.87))
                .andExpect(jsonPath("$.unavailable[0]").value("IE0003111113"));
    }

    @Test
    void emptyInstrumentListIsRejected() throws Exception {
        mvc.perform(post("/api/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruments\": []}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(comparisonService);
    }

    @Test
    void blankIdentifierIsRejected() throws Exception {
        mvc.perform(post("/api/comparisons")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruments\": [{\"identifier\": \" \"}]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(comparisonService);
    }
}

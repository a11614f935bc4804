package com.al.pricetransparency.controller;

import com.al.pricetransparency.dto.PriceStats;
import com.al.pricetransparency.exception.GlobalExceptionHandler;
import com.al.pricetransparency.model.HospitalDocument;
import com.al.pricetransparency.model.enums.CodeType;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.service.query.ChargeQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class ChargeControllerTest {

    @Mock
    private ChargeQueryService queryService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChargeController(queryService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void testByCode_ParsesFilters() throws Exception {
        when(queryService.searchByCode("70551", CodeType.CPT, "h1", Setting.OUTPATIENT, 25))
                .thenReturn(List.of());

        mockMvc.perform(get("/api/charges/by-code/70551")
                .param("codeType", "cpt")
                .param("hospitalId", "h1")
                .param("setting", "outpatient")
                .param("limit", "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(queryService).searchByCode("70551", CodeType.CPT, "h1", Setting.OUTPATIENT, 25);
    }

    @Test
    public void testByCode_DefaultsWithoutFilters() throws Exception {
        when(queryService.searchByCode("470", null, null, null, ChargeQueryService.DEFAULT_LIMIT))
                .thenReturn(List.of());

        mockMvc.perform(get("/api/charges/by-code/470"))
                .andExpect(status().isOk());
    }

    @Test
    public void testByCode_UnknownCodeType() throws Exception {
        mockMvc.perform(get("/api/charges/by-code/70551").param("codeType", "XYZ"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Unknown code type: XYZ"));

        verifyNoInteractions(queryService);
    }

    @Test
    public void testSearch_UnknownSetting() throws Exception {
        mockMvc.perform(get("/api/charges/search").param("q", "MRI").param("setting", "home"))
                .andExpect(status().isBadRequest());

        verify(queryService, never()).searchByDescription(anyString(), any(), any(), anyInt());
    }

    @Test
    public void testPriceStats() throws Exception {
        when(queryService.getPriceStatsByCode("70551", CodeType.CPT)).thenReturn(PriceStats.builder()
                .count(3)
                .avgGross(2000.0)
                .minGross(1500.0)
                .maxGross(2500.0)
                .build());

        mockMvc.perform(get("/api/charges/stats/70551").param("codeType", "CPT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.maxGross").value(2500.0));
    }

    @Test
    public void testHospital_Found() throws Exception {
        when(queryService.getHospitalById("h1")).thenReturn(Optional.of(HospitalDocument.builder()
                .hospitalId("h1")
                .hospitalName("General Hospital")
                .build()));

        mockMvc.perform(get("/api/hospitals/h1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hospitalName").value("General Hospital"));
    }

    @Test
    public void testHospital_NotFound() throws Exception {
        when(queryService.getHospitalById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/hospitals/missing"))
                .andExpect(status().isNotFound());
    }
}

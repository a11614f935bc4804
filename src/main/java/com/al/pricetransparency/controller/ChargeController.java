package com.al.pricetransparency.controller;

import com.al.pricetransparency.dto.PayerSummary;
import com.al.pricetransparency.dto.PriceStats;
import com.al.pricetransparency.model.HospitalDocument;
import com.al.pricetransparency.model.StandardChargeDocument;
import com.al.pricetransparency.model.enums.CodeType;
import com.al.pricetransparency.model.enums.Setting;
import com.al.pricetransparency.service.query.ChargeQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Charges", description = "Stored charge queries")
public class ChargeController {

    private final ChargeQueryService queryService;

    @Autowired
    public ChargeController(ChargeQueryService queryService) {
        this.queryService = queryService;
    }

    @Operation(summary = "Charges by billing code")
    @GetMapping("/charges/by-code/{code}")
    public ResponseEntity<List<StandardChargeDocument>> byCode(
            @PathVariable String code,
            @RequestParam(required = false) String codeType,
            @RequestParam(required = false) String hospitalId,
            @RequestParam(required = false) String setting,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queryService.searchByCode(code, codeType(codeType), hospitalId,
                setting(setting), limit));
    }

    @Operation(summary = "Charges by description text")
    @GetMapping("/charges/search")
    public ResponseEntity<List<StandardChargeDocument>> search(
            @RequestParam String q,
            @RequestParam(required = false) String hospitalId,
            @RequestParam(required = false) String setting,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(queryService.searchByDescription(q, hospitalId, setting(setting), limit));
    }

    @Operation(summary = "Gross and cash price statistics of a code across hospitals")
    @GetMapping("/charges/stats/{code}")
    public ResponseEntity<PriceStats> priceStats(@PathVariable String code,
            @RequestParam(required = false) String codeType) {
        return ResponseEntity.ok(queryService.getPriceStatsByCode(code, codeType(codeType)));
    }

    @GetMapping("/payers")
    public ResponseEntity<List<PayerSummary>> payers() {
        return ResponseEntity.ok(queryService.getUniquePayers());
    }

    @GetMapping("/hospitals")
    public ResponseEntity<List<HospitalDocument>> hospitals() {
        return ResponseEntity.ok(queryService.getAllHospitals());
    }

    @GetMapping("/hospitals/{hospitalId}")
    public ResponseEntity<HospitalDocument> hospital(@PathVariable String hospitalId) {
        return queryService.getHospitalById(hospitalId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private static CodeType codeType(String raw) {
        if (raw == null) {
            return null;
        }
        CodeType type = CodeType.fromValue(raw);
        if (type == null) {
            throw new IllegalArgumentException("Unknown code type: " + raw);
        }
        return type;
    }

    private static Setting setting(String raw) {
        if (raw == null) {
            return null;
        }
        Setting setting = Setting.fromValue(raw);
        if (setting == null) {
            throw new IllegalArgumentException("Unknown setting: " + raw);
        }
        return setting;
    }
}

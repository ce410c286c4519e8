package com.flagship.general_ledger.numbering;

import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.numbering.dto.CreateNumberingSchemeRequest;
import com.flagship.general_ledger.numbering.dto.DocumentNumberResponse;
import com.flagship.general_ledger.numbering.dto.NumberingSchemeResponse;
import com.flagship.general_ledger.numbering.dto.ResetCounterRequest;
import com.flagship.general_ledger.web.RequestOrigin;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Numbering scheme administration and number issuance for non-voucher documents.
 */
@RestController
@RequestMapping("/api/numbering-schemes")
@RequiredArgsConstructor
@Slf4j
public class NumberingController {

    private final NumberingSchemeService schemeService;
    private final NumberGenerator numberGenerator;

    @PostMapping
    public ResponseEntity<NumberingSchemeResponse> createScheme(
            @Valid @RequestBody CreateNumberingSchemeRequest request,
            @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        NumberingScheme scheme = schemeService.createScheme(request, user);
        return ResponseEntity.status(HttpStatus.CREATED).body(NumberingSchemeResponse.from(scheme));
    }

    @GetMapping
    public List<NumberingSchemeResponse> listSchemes(@RequestParam("document_type") String documentType) {
        return schemeService.listSchemes(documentType).stream()
            .map(NumberingSchemeResponse::from)
            .toList();
    }

    @PostMapping("/{id}/deactivate")
    public NumberingSchemeResponse deactivateScheme(@PathVariable("id") UUID schemeId,
                                                    @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        log.info("Deactivating numbering scheme {} on behalf of {}", schemeId, user);
        return NumberingSchemeResponse.from(schemeService.deactivateScheme(schemeId));
    }

    @GetMapping("/preview")
    public DocumentNumberResponse preview(@RequestParam("document_type") String documentType,
                                          @RequestParam(value = "scope", required = false) String scope) {
        String number = numberGenerator.previewNextNumber(documentType, scope)
            .orElseThrow(() -> new NotFoundException(
                "No active numbering scheme found for document type: " + documentType));
        return new DocumentNumberResponse(documentType, scope, number);
    }

    @GetMapping("/info")
    public NumberingSchemeInfo info(@RequestParam("document_type") String documentType,
                                    @RequestParam(value = "scope", required = false) String scope) {
        return numberGenerator.getSchemeInfo(documentType, scope)
            .orElseThrow(() -> new NotFoundException(
                "No active numbering scheme found for document type: " + documentType));
    }

    /**
     * Issues the next number for a document type that is not a voucher (invoices, orders).
     * Voucher numbers are issued by voucher creation.
     */
    @PostMapping("/generate")
    public ResponseEntity<DocumentNumberResponse> generate(
            @RequestParam("document_type") String documentType,
            @RequestParam(value = "scope", required = false) String scope) {
        String number = numberGenerator.generateNumber(documentType, scope);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new DocumentNumberResponse(documentType, scope, number));
    }

    @PostMapping("/reset")
    public NumberingSchemeResponse resetCounter(@Valid @RequestBody ResetCounterRequest request,
                                                @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        log.info("Counter reset requested by {}: documentType={}, scope={}, resetTo={}",
            user, request.getDocumentType(), request.getScope(), request.getResetTo());
        NumberingScheme scheme = numberGenerator.resetCounter(
            request.getDocumentType(), request.getScope(), request.getResetTo());
        return NumberingSchemeResponse.from(scheme);
    }
}

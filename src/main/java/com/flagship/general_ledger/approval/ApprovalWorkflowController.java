package com.flagship.general_ledger.approval;

import com.flagship.general_ledger.approval.dto.ApprovalLevelRequest;
import com.flagship.general_ledger.approval.dto.DefineWorkflowRequest;
import com.flagship.general_ledger.approval.dto.WorkflowResponse;
import com.flagship.general_ledger.exception.NotFoundException;
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

import java.util.UUID;

@RestController
@RequestMapping("/api/approval-workflows")
@RequiredArgsConstructor
@Slf4j
public class ApprovalWorkflowController {

    private final ApprovalWorkflowService workflowService;

    @PostMapping
    public ResponseEntity<WorkflowResponse> define(@Valid @RequestBody DefineWorkflowRequest request,
                                                   @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        ApprovalWorkflow workflow = workflowService.defineWorkflow(
            request.getWorkflowName(),
            request.getDocumentType(),
            request.getLevels().stream().map(ApprovalLevelRequest::toLevel).toList(),
            request.isActive(),
            user);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(workflow));
    }

    @PostMapping("/{id}/deactivate")
    public WorkflowResponse deactivate(@PathVariable("id") UUID workflowId,
                                       @RequestHeader(RequestOrigin.USER_HEADER) String user) {
        log.info("Deactivating approval workflow {} on behalf of {}", workflowId, user);
        return WorkflowResponse.from(workflowService.deactivateWorkflow(workflowId));
    }

    @GetMapping("/active")
    public WorkflowResponse active(@RequestParam("document_type") String documentType) {
        return workflowService.getActiveWorkflow(documentType)
            .map(WorkflowResponse::from)
            .orElseThrow(() -> new NotFoundException(
                "No active approval workflow found for document type: " + documentType));
    }
}

package com.example.workflow_schema.controller;

import com.example.workflow_schema.dto.BatchExtractionResult;
import com.example.workflow_schema.dto.FlowRecord;
import com.example.workflow_schema.dto.IdentifierMapping;
import com.example.workflow_schema.dto.ValidationReport;
import com.example.workflow_schema.dto.ValidationRequest;
import com.example.workflow_schema.dto.ValidationSummary;
import com.example.workflow_schema.dto.WorkflowDocument;
import com.example.workflow_schema.service.ExtractionValidationService;
import com.example.workflow_schema.service.RecordUploadService;
import com.example.workflow_schema.service.WorkflowExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@CrossOrigin(origins = "${app.cors.allowed-origin:http://localhost:5173}")
@RestController
@RequestMapping("/api/workflow")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    @Autowired
    private WorkflowExtractionService extractionService;

    @Autowired
    private ExtractionValidationService validationService;

    @Autowired
    private RecordUploadService uploadService;

    /* ================= Extraction ================= */
    @PostMapping("/extract")
    public ResponseEntity<WorkflowDocument> extract(@RequestBody FlowRecord record) {
        return ResponseEntity.ok(extractionService.extract(record));
    }

    @PostMapping("/extract/batch")
    public ResponseEntity<BatchExtractionResult> extractBatch(@RequestBody List<FlowRecord> records) {
        return ResponseEntity.ok(extractionService.extractAll(records));
    }

    /* ================= Upload (.json records or .bpmn) ================= */
    @PostMapping("/upload")
    public ResponseEntity<BatchExtractionResult> upload(@RequestParam("file") MultipartFile file) {
        List<FlowRecord> records = uploadService.readRecords(file);
        log.info("Upload {}: {} record(s)", file.getOriginalFilename(), records.size());
        return ResponseEntity.ok(extractionService.extractAll(records));
    }

    /* ================= Identifiers ================= */
    @PostMapping("/identifiers")
    public ResponseEntity<IdentifierMapping> identifiers(@RequestBody FlowRecord record) {
        return ResponseEntity.ok(extractionService.identifiers(record));
    }

    /* ================= Validation ================= */
    @PostMapping("/validate")
    public ResponseEntity<ValidationReport> validate(@RequestBody ValidationRequest request) {
        return ResponseEntity.ok(validationService.validate(request.getRecord(), request.getDocument()));
    }

    @PostMapping("/validate/batch")
    public ResponseEntity<ValidationSummary> validateBatch(@RequestBody List<ValidationRequest> requests) {
        return ResponseEntity.ok(validationService.summarize(requests));
    }
}

package com.example.workflow_schema.service;

import com.example.workflow_schema.dto.FlowRecord;
import com.example.workflow_schema.exception.RecordImportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads uploaded files into records: BPMN 2.0 XML ({@code .bpmn}, {@code .xml}) or JSON holding
 * one record or an array of them.
 */
@Service
public class RecordUploadService {

    private final BpmnImportService bpmnImportService;
    private final ObjectMapper objectMapper;

    @Value("${app.workflow.upload.max-records:10000}")
    private int maxRecords = 10000;

    public RecordUploadService(BpmnImportService bpmnImportService, ObjectMapper objectMapper) {
        this.bpmnImportService = bpmnImportService;
        this.objectMapper = objectMapper;
    }

    public List<FlowRecord> readRecords(MultipartFile file) {
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        try (InputStream in = file.getInputStream()) {
            if (isBpmn(name)) {
                List<FlowRecord> single = new ArrayList<>(1);
                single.add(bpmnImportService.read(in, name));
                return single;
            }
            return readJson(objectMapper.readTree(in), name);
        } catch (JsonProcessingException e) {
            throw new RecordImportException("File " + name + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RecordImportException("Cannot read uploaded file " + name, e);
        }
    }

    List<FlowRecord> readJson(JsonNode root, String name) throws JsonProcessingException {
        if (root == null || !(root.isArray() || root.isObject())) {
            throw new RecordImportException("File " + name + " must hold a record object or an array of records");
        }
        if (root.isObject()) {
            List<FlowRecord> single = new ArrayList<>(1);
            single.add(objectMapper.treeToValue(root, FlowRecord.class));
            return single;
        }
        if (root.size() > maxRecords) {
            throw new RecordImportException("File " + name + " holds " + root.size()
                    + " records, the limit is " + maxRecords);
        }
        List<FlowRecord> records = new ArrayList<>(root.size());
        for (JsonNode item : root) records.add(objectMapper.treeToValue(item, FlowRecord.class));
        return records;
    }

    private static boolean isBpmn(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".bpmn") || lower.endsWith(".xml");
    }
}

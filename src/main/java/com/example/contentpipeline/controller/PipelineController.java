package com.example.contentpipeline.controller;

import com.example.contentpipeline.client.PipelineSubmissionClient;
import com.example.contentpipeline.domain.model.BatchReport;
import com.example.contentpipeline.domain.model.ExecutionRecord;
import com.example.contentpipeline.domain.model.PipelineOutcome;
import com.example.contentpipeline.domain.model.PipelineStage;
import com.example.contentpipeline.domain.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineSubmissionClient submissionClient;

    @Autowired
    public PipelineController(PipelineSubmissionClient submissionClient) {
        this.submissionClient = submissionClient;
    }

    @PostMapping("/batch")
    public ResponseEntity<?> startBatch(@RequestBody List<WorkItem> workItems) {
        logger.info("Received request to start {} pipeline executions", workItems.size());
        List<String> workflowIds = new ArrayList<>();
        List<Map<String, Object>> errors = new ArrayList<>();
        boolean serverError = false;
        for (int index = 0; index < workItems.size(); index++) {
            WorkItem workItem = workItems.get(index);
            try {
                workflowIds.add(submissionClient.submit(workItem).getWorkflowId());
            } catch (IllegalArgumentException e) {
                logger.warn("Rejected item {} of batch: {}", index, e.getMessage());
                errors.add(itemError(index, workItem, e.getMessage()));
            } catch (Exception e) {
                logger.error("Error starting item {} of batch", index, e);
                errors.add(itemError(index, workItem, "Failed to start workflow: " + e.getMessage()));
                serverError = true;
            }
        }

        if (workflowIds.isEmpty() && !errors.isEmpty()) {
            if (serverError) {
                return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to start workflows: " + errors.get(0).get("error"));
            }
            return error(HttpStatus.BAD_REQUEST, String.valueOf(errors.get(0).get("error")));
        }
        Map<String, Object> response = new HashMap<>();
        response.put("workflowIds", workflowIds);
        if (!errors.isEmpty()) {
            response.put("errors", errors);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    private static Map<String, Object> itemError(int index, WorkItem workItem, String message) {
        Map<String, Object> itemError = new HashMap<>();
        itemError.put("index", index);
        itemError.put("itemId", workItem == null ? null : workItem.itemId());
        itemError.put("error", message);
        return itemError;
    }

    @PostMapping("/batch/run")
    public ResponseEntity<?> runBatch(@RequestBody List<WorkItem> workItems) {
        logger.info("Received request to run {} pipeline executions", workItems.size());
        try {
            BatchReport report = submissionClient.submitBatch(workItems);
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            logger.error("Error running pipeline batch", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to run batch: " + e.getMessage());
        }
    }

    @GetMapping("/{workflowId}/stage")
    public ResponseEntity<?> getStage(@PathVariable String workflowId) {
        try {
            PipelineStage stage = submissionClient.stage(workflowId);
            Map<String, String> response = new HashMap<>();
            response.put("workflowId", workflowId);
            response.put("stage", stage.name());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error querying stage of workflowId: {}", workflowId, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to query workflow: " + e.getMessage());
        }
    }

    @GetMapping("/{workflowId}/result")
    public ResponseEntity<?> getResult(@PathVariable String workflowId) {
        try {
            PipelineOutcome outcome = submissionClient.awaitOutcome(workflowId);
            return ResponseEntity.ok(outcome);
        } catch (Exception e) {
            logger.error("Error reading result of workflowId: {}", workflowId, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read result: " + e.getMessage());
        }
    }

    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String workflowId) {
        try {
            submissionClient.cancel(workflowId);
            Map<String, String> response = new HashMap<>();
            response.put("message", "Cancellation requested for workflowId_" + workflowId);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        } catch (Exception e) {
            logger.error("Error cancelling workflowId: {}", workflowId, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to cancel workflow: " + e.getMessage());
        }
    }

    @GetMapping("/executions")
    public List<ExecutionRecord> listExecutions() {
        return submissionClient.executions();
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> errorResponse = new HashMap<>();
        errorResponse.put("error", message);
        return ResponseEntity.status(status).body(errorResponse);
    }
}

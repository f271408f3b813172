package io.syncbridge.demo;

import io.syncbridge.workflow.WorkflowEngine;
import io.syncbridge.workflow.WorkflowExecution;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
public class ProposalController {

    private final WorkflowEngine workflowEngine;

    public ProposalController(WorkflowEngine workflowEngine) {
        this.workflowEngine = workflowEngine;
    }

    @PostMapping("/proposals/{listingId}/accept")
    public Map<String, Object> accept(@PathVariable String listingId) {
        String executionId = workflowEngine.enqueueWorkflow(DemoSetup.PROPOSAL_ACCEPTED,
                Map.of("listing_id", listingId, "guest", "demo-guest"), "proposal-" + listingId);
        return Map.of("status", "queued", "executionId", executionId);
    }

    @GetMapping("/workflows/{executionId}")
    public Optional<WorkflowExecution> execution(@PathVariable String executionId) {
        return workflowEngine.find(executionId);
    }
}

package io.syncbridge.demo;

import io.syncbridge.SyncBridge;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.workflow.FailurePolicy;
import io.syncbridge.workflow.StepHandlerRegistry;
import io.syncbridge.workflow.WorkflowDefinition;
import io.syncbridge.workflow.WorkflowDefinitionRegistry;
import io.syncbridge.workflow.WorkflowStep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Seeds the sync config for {@code listings}, registers the step handlers and stores the
 * {@code proposal_accepted} workflow definition.
 */
@Component
public class DemoSetup implements ApplicationRunner {

    static final String PROPOSAL_ACCEPTED = "proposal_accepted";

    private static final Logger log = LoggerFactory.getLogger(DemoSetup.class);

    private final SyncBridge syncBridge;
    private final WorkflowDefinitionRegistry definitions;
    private final StepHandlerRegistry stepHandlers;
    private final BookingStepHandler bookings;
    private final NotificationStepHandler notifications;

    public DemoSetup(SyncBridge syncBridge, WorkflowDefinitionRegistry definitions, StepHandlerRegistry stepHandlers,
                     BookingStepHandler bookings, NotificationStepHandler notifications) {
        this.syncBridge = syncBridge;
        this.definitions = definitions;
        this.stepHandlers = stepHandlers;
        this.bookings = bookings;
        this.notifications = notifications;
    }

    @Override
    public void run(ApplicationArguments args) {
        syncBridge.configs().save(SyncConfig.of("listings", "sync_listing")
                .withTargetObjectType("Listing")
                .withSyncOnDelete(true)
                .withExcludedFields(Set.of("owner_note"))
                .withFieldMapping(Map.of("price", "nightly_price")));

        stepHandlers.register("bookings", bookings).register("notifications", notifications);

        definitions.save(WorkflowDefinition.of(PROPOSAL_ACCEPTED, List.of(
                new WorkflowStep("create_booking", "bookings", "create",
                        Map.of("listingId", "{{listing_id}}", "guest", "{{guest}}"), FailurePolicy.RETRY),
                new WorkflowStep("notify_guest", "notifications", "email",
                        Map.of("to", "{{guest}}", "bookingId", "{{create_booking.id}}"), FailurePolicy.CONTINUE)),
                List.of("listing_id", "guest")));

        log.info("Demo ready: listings sync config and workflow '{}' registered", PROPOSAL_ACCEPTED);
    }
}

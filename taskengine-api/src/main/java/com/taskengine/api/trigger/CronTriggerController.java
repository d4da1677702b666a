package com.taskengine.api.trigger;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

/**
 * Trigger endpoints called by the external scheduler, one per cadence.
 * Accepts GET and POST since schedulers differ in what they send.
 */
@RestController
@RequestMapping("/api/cron")
public class CronTriggerController {

    private final InvocationHarness harness;

    public CronTriggerController(InvocationHarness harness) {
        this.harness = harness;
    }

    /**
     * Claim and run due tasks, optionally only those of the given types.
     */
    @RequestMapping(path = "/dispatch", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Map<String, Object>> dispatch(
            @RequestParam(name = "types", required = false) Set<String> types) {
        return ResponseEntity.ok(harness.dispatch(types));
    }

    @RequestMapping(path = "/dead-letters", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Map<String, Object>> deadLetters() {
        return ResponseEntity.ok(harness.reviewDeadLetters());
    }

    @RequestMapping(path = "/workflows", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Map<String, Object>> workflows() {
        return ResponseEntity.ok(harness.advanceWorkflows());
    }

    @RequestMapping(path = "/cleanup", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Map<String, Object>> cleanup() {
        return ResponseEntity.ok(harness.cleanup());
    }
}

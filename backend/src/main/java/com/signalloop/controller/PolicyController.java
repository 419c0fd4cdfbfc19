package com.signalloop.controller;

import com.signalloop.model.ControlPlaneSnapshot;
import com.signalloop.model.PolicyUpdateResult;
import com.signalloop.service.ControlPlaneService;
import com.signalloop.service.PolicyUpdaterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the versioned control-plane policy.
 */
@RestController
@RequestMapping("/api/policy")
public class PolicyController {

    private final ControlPlaneService controlPlaneService;
    private final PolicyUpdaterService policyUpdaterService;

    public PolicyController(ControlPlaneService controlPlaneService, PolicyUpdaterService policyUpdaterService) {
        this.controlPlaneService = controlPlaneService;
        this.policyUpdaterService = policyUpdaterService;
    }

    @GetMapping("/active")
    public ResponseEntity<ControlPlaneSnapshot> active() {
        return ResponseEntity.ok(controlPlaneService.getActiveState());
    }

    @GetMapping("/history")
    public ResponseEntity<List<ControlPlaneSnapshot>> history(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(controlPlaneService.history(limit));
    }

    /**
     * Runs a policy update now. With {@code dryRun=true} nothing is written.
     */
    @PostMapping("/update")
    public ResponseEntity<PolicyUpdateResult> update(@RequestParam(defaultValue = "false") boolean dryRun) {
        return ResponseEntity.ok(policyUpdaterService.runPolicyUpdate(dryRun));
    }
}

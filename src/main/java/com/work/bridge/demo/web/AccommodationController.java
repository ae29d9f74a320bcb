package com.work.bridge.demo.web;

import com.work.bridge.core.BridgeComponent;
import com.work.bridge.demo.web.dto.AccommodateRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

/**
 * 入站 accommodation 的 REST API，由 relayer（BRIDGER）调用。
 */
@RestController
@RequestMapping("/api/bridge/chains/{chainId}/accommodations")
public class AccommodationController {

    private final BridgeComponent bridge;

    public AccommodationController(BridgeComponent bridge) {
        this.bridge = bridge;
    }

    @PostMapping
    public ResponseEntity<Map<String, Long>> accommodate(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                                         @PathVariable long chainId,
                                                         @RequestBody AccommodateRequest request) {
        bridge.accommodate(caller, chainId, request.getFirstNonce(), request.toAccommodations());
        return ResponseEntity.ok(Collections.singletonMap("lastAccommodationNonce", bridge.getLastAccommodationNonce(chainId)));
    }
}

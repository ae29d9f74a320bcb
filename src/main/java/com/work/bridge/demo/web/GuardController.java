package com.work.bridge.demo.web;

import com.work.bridge.core.BridgeComponent;
import com.work.bridge.demo.web.dto.AddressRequest;
import com.work.bridge.demo.web.dto.GuardConfigRequest;
import com.work.bridge.demo.web.dto.GuardConfigView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

/**
 * accommodation guard 的 REST API。
 */
@RestController
@RequestMapping("/api/bridge/guard")
public class GuardController {

    private final BridgeComponent bridge;

    public GuardController(BridgeComponent bridge) {
        this.bridge = bridge;
    }

    @GetMapping("/chains/{chainId}/tokens/{token}")
    public ResponseEntity<GuardConfigView> get(@PathVariable long chainId, @PathVariable String token) {
        return ResponseEntity.ok(new GuardConfigView(bridge.getGuardConfig(chainId, token)));
    }

    @PutMapping("/chains/{chainId}/tokens/{token}")
    public ResponseEntity<Void> configure(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                          @PathVariable long chainId,
                                          @PathVariable String token,
                                          @RequestBody GuardConfigRequest request) {
        bridge.configureGuard(caller, chainId, token, request.getTimeFrame(), request.getVolumeLimit());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/chains/{chainId}/tokens/{token}")
    public ResponseEntity<Void> reset(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                      @PathVariable long chainId,
                                      @PathVariable String token) {
        bridge.resetGuard(caller, chainId, token);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/bridge")
    public ResponseEntity<Map<String, String>> getBridge() {
        return ResponseEntity.ok(Collections.singletonMap("bridge", bridge.getGuardBridge()));
    }

    @PutMapping("/bridge")
    public ResponseEntity<Void> setBridge(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                          @RequestBody AddressRequest request) {
        bridge.setGuardBridge(caller, request.getAddress());
        return ResponseEntity.noContent().build();
    }
}

package com.work.bridge.demo.web;

import com.work.bridge.core.BridgeComponent;
import com.work.bridge.core.access.BridgeRole;
import com.work.bridge.demo.web.dto.AddressRequest;
import com.work.bridge.demo.web.dto.ModeRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 配置类 REST API：token 模式、fee、角色、暂停。
 */
@RestController
@RequestMapping("/api/bridge")
public class BridgeConfigController {

    private final BridgeComponent bridge;

    public BridgeConfigController(BridgeComponent bridge) {
        this.bridge = bridge;
    }

    @GetMapping("/chains/{chainId}/tokens/{token}/modes")
    public ResponseEntity<Map<String, Object>> modes(@PathVariable long chainId, @PathVariable String token) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("relocationMode", bridge.getRelocationMode(chainId, token));
        body.put("accommodationMode", bridge.getAccommodationMode(chainId, token));
        return ResponseEntity.ok(body);
    }

    @PutMapping("/chains/{chainId}/tokens/{token}/relocation-mode")
    public ResponseEntity<Void> setRelocationMode(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                                  @PathVariable long chainId,
                                                  @PathVariable String token,
                                                  @Validated @RequestBody ModeRequest request) {
        bridge.setRelocationMode(caller, chainId, token, request.getMode());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/chains/{chainId}/tokens/{token}/accommodation-mode")
    public ResponseEntity<Void> setAccommodationMode(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                                     @PathVariable long chainId,
                                                     @PathVariable String token,
                                                     @Validated @RequestBody ModeRequest request) {
        bridge.setAccommodationMode(caller, chainId, token, request.getMode());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/fee")
    public ResponseEntity<Map<String, Object>> fee() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("feeOracle", bridge.getFeeOracle());
        body.put("feeCollector", bridge.getFeeCollector());
        body.put("feeTaken", bridge.isFeeTaken());
        return ResponseEntity.ok(body);
    }

    @PutMapping("/fee/oracle")
    public ResponseEntity<Void> setFeeOracle(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                             @RequestBody AddressRequest request) {
        bridge.setFeeOracle(caller, request.getAddress());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/fee/collector")
    public ResponseEntity<Void> setFeeCollector(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                                @RequestBody AddressRequest request) {
        bridge.setFeeCollector(caller, request.getAddress());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/roles/{role}")
    public ResponseEntity<Set<String>> roleMembers(@PathVariable BridgeRole role) {
        return ResponseEntity.ok(bridge.roleMembers(role));
    }

    @PostMapping("/roles/{role}/grant")
    public ResponseEntity<Void> grantRole(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                          @PathVariable BridgeRole role,
                                          @RequestBody AddressRequest request) {
        bridge.grantRole(caller, role, request.getAddress());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/roles/{role}/revoke")
    public ResponseEntity<Void> revokeRole(@RequestHeader(RelocationController.CALLER_HEADER) String caller,
                                           @PathVariable BridgeRole role,
                                           @RequestBody AddressRequest request) {
        bridge.revokeRole(caller, role, request.getAddress());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/paused")
    public ResponseEntity<Map<String, Boolean>> paused() {
        return ResponseEntity.ok(Collections.singletonMap("paused", bridge.paused()));
    }

    @PostMapping("/pause")
    public ResponseEntity<Void> pause(@RequestHeader(RelocationController.CALLER_HEADER) String caller) {
        bridge.pause(caller);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/unpause")
    public ResponseEntity<Void> unpause(@RequestHeader(RelocationController.CALLER_HEADER) String caller) {
        bridge.unpause(caller);
        return ResponseEntity.noContent().build();
    }
}

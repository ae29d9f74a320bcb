package com.work.bridge.demo.web;

import com.work.bridge.core.BridgeComponent;
import com.work.bridge.demo.web.dto.ChainStateView;
import com.work.bridge.demo.web.dto.RefusalRequest;
import com.work.bridge.demo.web.dto.RelocateRequest;
import com.work.bridge.demo.web.dto.RelocationRequest;
import com.work.bridge.demo.web.dto.RelocationView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 出站 relocation 的 REST API。调用方身份取自请求头 X-Bridge-Caller。
 */
@RestController
@RequestMapping("/api/bridge/chains/{chainId}")
public class RelocationController {

    static final String CALLER_HEADER = "X-Bridge-Caller";

    private final BridgeComponent bridge;

    public RelocationController(BridgeComponent bridge) {
        this.bridge = bridge;
    }

    @PostMapping("/relocations")
    public ResponseEntity<Map<String, Long>> request(@RequestHeader(CALLER_HEADER) String caller,
                                                     @PathVariable long chainId,
                                                     @Validated @RequestBody RelocationRequest request) {
        long nonce = bridge.requestRelocation(caller, chainId, request.getToken(), request.getAmount());
        return ResponseEntity.ok(Collections.singletonMap("nonce", nonce));
    }

    @GetMapping("/relocations/{nonce}")
    public ResponseEntity<RelocationView> get(@PathVariable long chainId, @PathVariable long nonce) {
        return bridge.getRelocation(chainId, nonce)
                .map(RelocationView::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/relocations")
    public ResponseEntity<List<RelocationView>> list(@PathVariable long chainId,
                                                     @RequestParam(value = "fromNonce", defaultValue = "1") long fromNonce,
                                                     @RequestParam(value = "count", defaultValue = "20") int count) {
        List<RelocationView> views = bridge.getRelocations(chainId, fromNonce, count).stream()
                .map(RelocationView::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(views);
    }

    @PostMapping("/relocations/{nonce}/cancel")
    public ResponseEntity<Void> cancel(@RequestHeader(CALLER_HEADER) String caller,
                                       @PathVariable long chainId,
                                       @PathVariable long nonce,
                                       @RequestBody(required = false) RefusalRequest request) {
        bridge.cancelRelocation(caller, chainId, nonce, refusal(request).getFeeRefundMode());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/relocations/{nonce}/reject")
    public ResponseEntity<Void> reject(@RequestHeader(CALLER_HEADER) String caller,
                                       @PathVariable long chainId,
                                       @PathVariable long nonce,
                                       @RequestBody(required = false) RefusalRequest request) {
        bridge.rejectRelocation(caller, chainId, nonce, refusal(request).getFeeRefundMode());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/relocations/cancel")
    public ResponseEntity<Void> cancelBatch(@RequestHeader(CALLER_HEADER) String caller,
                                            @PathVariable long chainId,
                                            @RequestBody RefusalRequest request) {
        bridge.cancelRelocations(caller, chainId, request.getNonces(), refusal(request).getFeeRefundMode());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/relocations/reject")
    public ResponseEntity<Void> rejectBatch(@RequestHeader(CALLER_HEADER) String caller,
                                            @PathVariable long chainId,
                                            @RequestBody RefusalRequest request) {
        bridge.rejectRelocations(caller, chainId, request.getNonces(), refusal(request).getFeeRefundMode());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/relocations/{nonce}/abort")
    public ResponseEntity<Void> abort(@RequestHeader(CALLER_HEADER) String caller,
                                      @PathVariable long chainId,
                                      @PathVariable long nonce) {
        bridge.abortRelocation(caller, chainId, nonce);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/relocations/{nonce}/postpone")
    public ResponseEntity<Void> postpone(@RequestHeader(CALLER_HEADER) String caller,
                                         @PathVariable long chainId,
                                         @PathVariable long nonce) {
        bridge.postponeRelocation(caller, chainId, nonce);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/relocations/{nonce}/continue")
    public ResponseEntity<Map<String, Long>> continueRelocation(@RequestHeader(CALLER_HEADER) String caller,
                                                                @PathVariable long chainId,
                                                                @PathVariable long nonce) {
        long newNonce = bridge.continueRelocation(caller, chainId, nonce);
        return ResponseEntity.ok(Collections.singletonMap("nonce", newNonce));
    }

    @PostMapping("/relocate")
    public ResponseEntity<Map<String, Integer>> relocate(@RequestHeader(CALLER_HEADER) String caller,
                                                         @PathVariable long chainId,
                                                         @RequestBody RelocateRequest request) {
        int processed = bridge.relocate(caller, chainId, request.getCount());
        return ResponseEntity.ok(Collections.singletonMap("processed", processed));
    }

    @GetMapping("/state")
    public ResponseEntity<ChainStateView> state(@PathVariable long chainId) {
        return ResponseEntity.ok(new ChainStateView(bridge.getChainState(chainId)));
    }

    private static RefusalRequest refusal(RefusalRequest request) {
        return request == null ? new RefusalRequest() : request;
    }
}

package com.nei10u.cosmic.controller;

import com.nei10u.cosmic.model.BirthData;
import com.nei10u.cosmic.model.CosmicFingerprint;
import com.nei10u.cosmic.model.CosmicResponse;
import com.nei10u.cosmic.model.FingerprintRequest;
import com.nei10u.cosmic.model.LifePurposeProfile;
import com.nei10u.cosmic.service.BirthDataMapper;
import com.nei10u.cosmic.service.CosmicFingerprintBuilder;
import com.nei10u.cosmic.service.FingerprintContextFormatter;
import com.nei10u.cosmic.service.NarrativeService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/cosmic")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CosmicController {

    private static final Logger log = LoggerFactory.getLogger(CosmicController.class);
    private final BirthDataMapper birthDataMapper;
    private final CosmicFingerprintBuilder fingerprintBuilder;
    private final FingerprintContextFormatter contextFormatter;
    private final NarrativeService narrativeService;

    @PostMapping("/fingerprint")
    public ResponseEntity<CosmicResponse> fingerprint(@RequestBody FingerprintRequest request) {
        String rid = ensureRequestId(request);
        log.info("[{}] fingerprint start", rid);
        CosmicFingerprint fp = build(request, rid);
        CosmicResponse resp = new CosmicResponse();
        resp.setRequestId(rid);
        resp.setFingerprint(fp);
        resp.setContext(contextFormatter.contextBlock(fp));
        log.info("[{}] fingerprint done", rid);
        return ResponseEntity.ok(resp);
    }

    /**
     * 只返回给 LLM 用的上下文文本。
     */
    @PostMapping(value = "/context", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> context(@RequestBody FingerprintRequest request) {
        String rid = ensureRequestId(request);
        log.info("[{}] context start", rid);
        CosmicFingerprint fp = build(request, rid);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(contextFormatter.contextBlock(fp));
    }

    @PostMapping("/reading")
    public ResponseEntity<CosmicResponse> reading(@RequestBody FingerprintRequest request) {
        String rid = ensureRequestId(request);
        log.info("[{}] step-reading start", rid);
        CosmicFingerprint fp = build(request, rid);
        NarrativeService.Reading reading = narrativeService.firstReading(fp, rid);
        CosmicResponse resp = new CosmicResponse();
        resp.setRequestId(rid);
        resp.setReading(reading.text());
        resp.setReadingFallback(reading.fallback());
        log.info("[{}] step-reading done fallback={}", rid, reading.fallback());
        return ResponseEntity.ok(resp);
    }

    @PostMapping("/life-purpose")
    public ResponseEntity<CosmicResponse> lifePurpose(@RequestBody FingerprintRequest request) {
        String rid = ensureRequestId(request);
        log.info("[{}] step-life-purpose start", rid);
        CosmicFingerprint fp = build(request, rid);
        LifePurposeProfile profile = narrativeService.lifePurpose(fp, rid);
        CosmicResponse resp = new CosmicResponse();
        resp.setRequestId(rid);
        resp.setLifePurpose(profile);
        log.info("[{}] step-life-purpose done fallback={}", rid, profile.isFallback());
        return ResponseEntity.ok(resp);
    }

    private CosmicFingerprint build(FingerprintRequest request, String rid) {
        BirthData birth = birthDataMapper.toBirthData(request);
        return fingerprintBuilder.build(birth, request.getName(), rid);
    }

    private String ensureRequestId(FingerprintRequest request) {
        if (request.getRequestId() == null || request.getRequestId().isBlank()) {
            request.setRequestId(UUID.randomUUID().toString());
        }
        return request.getRequestId();
    }
}

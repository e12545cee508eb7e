package com.redactai.interfaces.api.pii;

import com.redactai.application.redaction.RedactionAppService;
import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionResult;
import com.redactai.domain.redaction.model.RedactionPreset;
import com.redactai.domain.redaction.model.Span;
import com.redactai.infrastructure.ai.pipeline.RedactionService.RedactionResult;
import com.redactai.interfaces.api.dto.DetectRequest;
import com.redactai.interfaces.api.dto.DetectResponse;
import com.redactai.interfaces.api.dto.MaskRequest;
import com.redactai.interfaces.api.dto.MaskResponse;
import com.redactai.interfaces.api.dto.PresetResponse;
import com.redactai.interfaces.api.dto.RedactRequest;
import com.redactai.interfaces.api.dto.RedactResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/v1/pii")
@RequiredArgsConstructor
public class PiiController {

    private final RedactionAppService redactionAppService;

    @PostMapping("/detect")
    public ResponseEntity<DetectResponse> detect(@Valid @RequestBody DetectRequest request) {
        DetectionResult result = redactionAppService.detect(
                request.text(),
                request.types(),
                request.preset(),
                request.documentContext());

        return ResponseEntity.ok(DetectResponse.from(result));
    }

    @PostMapping("/mask")
    public ResponseEntity<MaskResponse> mask(@Valid @RequestBody MaskRequest request) {
        String masked = redactionAppService.mask(request.type(), request.value(), request.maskOverride());
        return ResponseEntity.ok(new MaskResponse(masked));
    }

    @PostMapping("/redact")
    public ResponseEntity<RedactResponse> redact(@Valid @RequestBody RedactRequest request) {
        String text = request.text();
        List<DetectedEntity> plan = request.entities().stream()
                .map(entry -> toEntity(text, entry))
                .toList();

        RedactionResult result = redactionAppService.redact(text, plan);
        return ResponseEntity.ok(new RedactResponse(
                result.redactedText(), result.redactedCount(), result.skippedCount(), result.byType()));
    }

    @GetMapping("/presets")
    public ResponseEntity<List<PresetResponse>> presets() {
        return ResponseEntity.ok(Arrays.stream(RedactionPreset.values())
                .map(PresetResponse::from)
                .toList());
    }

    private DetectedEntity toEntity(String text, RedactRequest.PlanEntry entry) {
        Span span = new Span(entry.startIndex(), entry.endIndex());
        // Out-of-range spans are kept so the redaction step can count them as skipped
        String value = span.fitsWithin(text.length()) ? text.substring(span.start(), span.end()) : "";
        return DetectedEntity.builder()
                .type(entry.type())
                .value(value)
                .maskedValue(entry.maskedValue())
                .span(span)
                .shouldRedact(entry.shouldRedact() == null || entry.shouldRedact())
                .build();
    }
}

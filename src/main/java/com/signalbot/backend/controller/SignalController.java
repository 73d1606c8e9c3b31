package com.signalbot.backend.controller;

import com.signalbot.backend.dto.MessageRequest;
import com.signalbot.backend.dto.SignalRequest;
import com.signalbot.backend.service.signal.IncomingMessage;
import com.signalbot.backend.service.signal.PipelineResult;
import com.signalbot.backend.service.signal.SignalIntakeService;
import com.signalbot.backend.service.signal.SignalPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
public class SignalController {

    private final SignalIntakeService signalIntakeService;
    private final SignalPipelineService signalPipelineService;
    private final Clock clock;

    /**
     * Raw alert from the chat side; runs the full intake including extraction.
     */
    @PostMapping("/messages")
    public ResponseEntity<SignalIntakeService.IntakeResult> onMessage(@Valid @RequestBody MessageRequest request) {
        SignalIntakeService.IntakeResult result = signalIntakeService.onMessage(new IncomingMessage(
                request.getMessageId(), request.getChannel(), request.getContent(), request.getImageUrl(),
                Instant.now(clock)));
        HttpStatus status = result.status() == SignalIntakeService.IntakeResult.Status.SUBMITTED
                ? HttpStatus.ACCEPTED
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping
    public ResponseEntity<PipelineResult> submit(@Valid @RequestBody SignalRequest request) {
        PipelineResult result = signalPipelineService.submit(request.toCandidate(Instant.now(clock)));
        return ResponseEntity.status(result.isAccepted() ? HttpStatus.ACCEPTED : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }
}

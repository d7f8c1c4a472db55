package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.domain.service.AgentCatalog;
import me.golemcore.scheduler.domain.service.AgentCommandService;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Agent catalogue and command validation.
 */
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentsController {

    private final AgentCommandService agentCommands;
    private final SchedulerProperties properties;

    @GetMapping
    public Mono<ResponseEntity<AgentsResponse>> getAgents() {
        String defaultCommand = properties.getAgent().getCommand();
        AgentsResponse response = new AgentsResponse(defaultCommand, AgentCatalog.agentName(defaultCommand),
                AgentCatalog.PREDEFINED);
        return Mono.just(ResponseEntity.ok(response));
    }

    /**
     * Run the command once with a short prompt and report whether it looks
     * usable. Blocks for up to the validation timeout.
     */
    @PostMapping("/validate")
    public Mono<ResponseEntity<AgentCommandService.ValidationResult>> validate(
            @RequestBody ValidateRequest request) {
        if (request == null || request.command() == null || request.command().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "command is required");
        }
        return Mono.fromCallable(() -> agentCommands.validate(request.command().trim(),
                properties.getAgent().getValidationTimeout()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    public record AgentsResponse(String defaultCommand, String defaultAgentName, List<AgentCatalog.Agent> agents) {
    }

    public record ValidateRequest(String command) {
    }
}

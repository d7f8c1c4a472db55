package me.golemcore.scheduler.adapter.inbound.web.controller;

import me.golemcore.scheduler.domain.service.AgentCatalog;
import me.golemcore.scheduler.domain.service.AgentCommandService;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentsControllerTest {

    private AgentCommandService agentCommands;
    private SchedulerProperties properties;
    private AgentsController controller;

    @BeforeEach
    void setUp() {
        agentCommands = mock(AgentCommandService.class);
        properties = new SchedulerProperties();
        controller = new AgentsController(agentCommands, properties);
    }

    @Test
    void getAgentsShouldDescribeDefaultCommand() {
        properties.getAgent().setCommand("gemini -p \"{prompt}\"");

        StepVerifier.create(controller.getAgents())
                .assertNext(response -> {
                    assertEquals("gemini -p \"{prompt}\"", response.getBody().defaultCommand());
                    assertEquals("Gemini CLI", response.getBody().defaultAgentName());
                    assertEquals(AgentCatalog.PREDEFINED, response.getBody().agents());
                })
                .verifyComplete();
    }

    @Test
    void validateShouldRunCommandWithValidationTimeout() {
        AgentCommandService.ValidationResult result = new AgentCommandService.ValidationResult(true, "Hello!", "");
        when(agentCommands.validate("claude -p \"{prompt}\"", Duration.ofSeconds(30))).thenReturn(result);

        StepVerifier.create(controller.validate(new AgentsController.ValidateRequest(" claude -p \"{prompt}\" ")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().success());
                })
                .verifyComplete();
    }

    @Test
    void validateShouldRequireCommand() {
        assertThrows(ResponseStatusException.class,
                () -> controller.validate(new AgentsController.ValidateRequest("  ")));
    }
}

package me.golemcore.scheduler.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgentCatalogTest {

    @Test
    void shouldNameKnownAgents() {
        assertEquals("Claude", AgentCatalog.agentName("claude -p \"hi\""));
        assertEquals("Codex", AgentCatalog.agentName("CODEX exec \"hi\" --yolo"));
        assertEquals("Gemini CLI", AgentCatalog.agentName("gemini -p x"));
        assertEquals("Qwen Code", AgentCatalog.agentName("qwen -p x"));
    }

    @Test
    void shouldCapitalizeCustomExecutable() {
        assertEquals("Aider", AgentCatalog.agentName("/usr/local/bin/aider --message \"{prompt}\""));
        assertEquals("Mytool", AgentCatalog.agentName("mytool.exe run"));
    }

    @Test
    void shouldReturnUnknownForBlankCommand() {
        assertEquals("Unknown", AgentCatalog.agentName(null));
        assertEquals("Unknown", AgentCatalog.agentName("   "));
    }
}

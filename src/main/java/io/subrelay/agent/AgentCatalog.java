package io.subrelay.agent;

import java.nio.file.Path;

/**
 * Source of agent definitions. Discovery and parsing of definitions lives behind this seam.
 */
@FunctionalInterface
public interface AgentCatalog {
    AgentRegistry discover(Path cwd, AgentScope scope);
}

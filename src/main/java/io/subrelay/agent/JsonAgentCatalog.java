package io.subrelay.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.subrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads {@code agents.json} from the user's {@code ~/.subrelay} directory and from the
 * {@code .subrelay} directory of the working directory.
 */
public final class JsonAgentCatalog implements AgentCatalog {
    private static final Logger log = LoggerFactory.getLogger(JsonAgentCatalog.class);

    public static final String CONFIG_DIR = ".subrelay";
    public static final String AGENTS_FILE = "agents.json";

    private final Path userConfigDir;

    public JsonAgentCatalog() {
        this(Paths.get(System.getProperty("user.home"), CONFIG_DIR));
    }

    public JsonAgentCatalog(Path userConfigDir) {
        this.userConfigDir = userConfigDir;
    }

    @Override
    public AgentRegistry discover(Path cwd, AgentScope scope) {
        AgentScope effective = scope == null ? AgentScope.USER : scope;
        AgentRegistry registry = new AgentRegistry();
        if (effective.includesUser()) {
            load(userConfigDir.resolve(AGENTS_FILE), AgentScope.USER, registry);
        }
        if (effective.includesProject() && cwd != null) {
            load(cwd.resolve(CONFIG_DIR).resolve(AGENTS_FILE), AgentScope.PROJECT, registry);
        }
        return registry;
    }

    private void load(Path file, AgentScope source, AgentRegistry registry) {
        if (!Files.exists(file)) {
            return;
        }
        AgentFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), AgentFile.class);
        } catch (IOException e) {
            log.warn("Skipping unreadable agent file {}: {}", file, e.getMessage());
            return;
        }
        if (parsed == null || parsed.agents() == null || parsed.agents().isEmpty()) {
            return;
        }
        int loaded = 0;
        int skipped = 0;
        for (AgentSpec spec : parsed.agents()) {
            if (spec == null || spec.name() == null || spec.name().isBlank()) {
                skipped++;
                continue;
            }
            registry.register(new AgentDefinition(
                    spec.name().trim(),
                    spec.description(),
                    blankToNull(spec.model()),
                    spec.tools(),
                    spec.systemPrompt(),
                    source
            ));
            loaded++;
        }
        if (skipped > 0) {
            log.warn("Agent file {} loaded={} skipped={}", file, loaded, skipped);
        } else {
            log.debug("Agent file {} loaded={}", file, loaded);
        }
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record AgentFile(List<AgentSpec> agents) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record AgentSpec(
            String name,
            String description,
            String model,
            List<String> tools,
            String systemPrompt
    ) {
    }
}

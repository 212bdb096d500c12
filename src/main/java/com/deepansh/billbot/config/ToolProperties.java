package com.deepansh.billbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the tool worker and its catalog.
 * Bound from application.yml under the "tools" prefix.
 */
@Component
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private Worker worker = new Worker();
    private Context context = new Context();

    @Data
    public static class Worker {
        /** Full command line, whitespace separated; double quotes group an argument */
        private String command = "node ../mcp-server/dist/index.js";
        private String workingDirectory = "";
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration startupTimeout = Duration.ofSeconds(10);
        private Duration restartBackoff = Duration.ofSeconds(1);
        /** A worker that stays up this long counts as a healthy start for the restart breaker */
        private Duration stableUptime = Duration.ofSeconds(10);
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private int desyncThreshold = 5;
        private String protocolVersion = "2024-11-05";
        private String clientName = "bill-bot-backend";
        private String clientVersion = "1.0.0";
        private String healthCheckTool = "health_check";

        public List<String> getCommandTokens() {
            return splitCommand(command);
        }
    }

    @Data
    public static class Context {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(5);
        private int sponsorLimit = 20;
        private int topicLimit = 15;
        private String sponsorsTool = "get_available_sponsors";
        private String statusesTool = "get_available_statuses";
        private String topicsTool = "get_topic_categories";
        private String administrationsTool = "get_administrations";
    }

    static List<String> splitCommand(String cmd) {
        if (cmd == null || cmd.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        boolean inQuote = false;
        StringBuilder cur = new StringBuilder();
        for (char c : cmd.toCharArray()) {
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (cur.length() > 0) { out.add(cur.toString()); cur.setLength(0); }
            } else {
                cur.append(c);
            }
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }
}

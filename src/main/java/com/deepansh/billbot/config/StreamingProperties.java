package com.deepansh.billbot.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Per-connection event stream settings.
 * Bound from application.yml under the "streaming" prefix.
 */
@Component
@ConfigurationProperties(prefix = "streaming")
@Validated
@Data
public class StreamingProperties {

    /** Idle time after which a keepalive comment is written */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration heartbeatInterval = Duration.ofSeconds(30);

    /** Events buffered for a client before the connection is torn down */
    @Min(1)
    private int bufferSize = 256;

    /** Connections without an application event for this long are closed */
    @NotNull
    private Duration staleAfter = Duration.ofMinutes(10);
}

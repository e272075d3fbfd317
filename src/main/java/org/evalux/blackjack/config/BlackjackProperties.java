package org.evalux.blackjack.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "blackjack")
public class BlackjackProperties {
    @Min(1) @Max(8)
    private int defaultDeckCount = 6;

    @Min(0)
    private long startingBankroll = 10_000L;

    /** Pause "cosmétique" quand le croupier change de sabot. */
    @NotNull
    private Duration shoeChangePause = Duration.ofSeconds(2);

    @Min(1)
    private int maxSessions = 1000;
}

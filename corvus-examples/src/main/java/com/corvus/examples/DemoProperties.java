package com.corvus.examples;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "corvus.demo")
public class DemoProperties {

    /** Delay between UI ticks; each tick dispatches whatever is pending. */
    private Duration tickInterval = Duration.ofMillis(50);

    /** Upper bound for one phase of the demo to settle. */
    private Duration phaseTimeout = Duration.ofSeconds(30);

    /** Leave the scratch directory behind for inspection. */
    private boolean keepScratch = false;

    public Duration getTickInterval() { return tickInterval; }
    public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
    public Duration getPhaseTimeout() { return phaseTimeout; }
    public void setPhaseTimeout(Duration phaseTimeout) { this.phaseTimeout = phaseTimeout; }
    public boolean isKeepScratch() { return keepScratch; }
    public void setKeepScratch(boolean keepScratch) { this.keepScratch = keepScratch; }
}

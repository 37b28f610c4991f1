package net.myaioutfit.config;

import java.time.Clock;
import net.myaioutfit.support.retry.BackoffSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time sources for the pipeline. Tests construct services with a fixed clock and a recording sleeper instead.
 */
@Configuration
public class PipelineRuntimeConfig {

    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.THREAD_SLEEP;
    }
}

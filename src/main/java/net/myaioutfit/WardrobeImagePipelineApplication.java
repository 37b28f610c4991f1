/**
 * Main application class for the wardrobe image pipeline
 *
 * Features:
 * - Loads a local .env file before the context starts
 * - Enables scheduling for the stale-processing sweeper
 * - Registers typed configuration for the pipeline, Replicate and auth collaborators
 * - Entry point for Spring Boot application
 */

package net.myaioutfit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import net.myaioutfit.config.AuthProperties;
import net.myaioutfit.config.ImagePipelineProperties;
import net.myaioutfit.config.ReplicateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@SpringBootApplication(exclude = {
    // Schema is owned by the item store; never run schema.sql from here
    org.springframework.boot.jdbc.autoconfigure.DataSourceInitializationAutoConfiguration.class
})
@EnableScheduling
@EnableConfigurationProperties({
    ImagePipelineProperties.class,
    ReplicateProperties.class,
    AuthProperties.class
})
public class WardrobeImagePipelineApplication {

    private static final Logger log = LoggerFactory.getLogger(WardrobeImagePipelineApplication.class);
    private static final int APPLICATION_SCHEDULER_POOL_SIZE = 2;
    private static final int APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String APPLICATION_SCHEDULER_THREAD_PREFIX = "PipelineScheduler-";

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        disableNettyUnsafeAccess();
        SpringApplication.run(WardrobeImagePipelineApplication.class, args);
    }

    /**
     * Provides a dedicated scheduler for {@code @Scheduled} maintenance jobs so they never
     * share threads with request handling.
     *
     * @return application task scheduler used by Spring scheduling infrastructure
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(APPLICATION_SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(APPLICATION_SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }

    private static void disableNettyUnsafeAccess() {
        if (System.getProperty("io.netty.noUnsafe") == null) {
            System.setProperty("io.netty.noUnsafe", "true");
        }
    }

    private static void loadDotEnvFile() {
        try {
            Path envFile = Paths.get(".env");
            if (Files.exists(envFile)) {
                Properties props = new Properties();
                try (InputStream is = Files.newInputStream(envFile)) {
                    props.load(is);
                }
                // Real environment variables win over .env entries
                for (String key : props.stringPropertyNames()) {
                    if (System.getenv(key) == null) {
                        System.setProperty(key, props.getProperty(key));
                    }
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}

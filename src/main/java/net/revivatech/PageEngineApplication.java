package net.revivatech;

import java.time.Duration;
import net.revivatech.application.route.RouteResolver;
import net.revivatech.application.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Entry point for the RevivaTech page engine.
 */
@SpringBootApplication
@EnableScheduling
public class PageEngineApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PageEngineApplication.class);
    private static final int APPLICATION_SCHEDULER_POOL_SIZE = 2;
    private static final int APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String APPLICATION_SCHEDULER_THREAD_PREFIX = "PageScheduler-";
    private static final Duration ROUTE_WARMUP_TIMEOUT = Duration.ofSeconds(30);

    private final RouteResolver routeResolver;

    public PageEngineApplication(RouteResolver routeResolver) {
        this.routeResolver = routeResolver;
    }

    public static void main(String[] args) {
        SpringApplication.run(PageEngineApplication.class, args);
    }

    /**
     * Dedicated scheduler for the preview sweep.
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

    /**
     * Builds the route table before the first request so a broken catalog fails startup.
     */
    @Override
    public void run(ApplicationArguments args) {
        RouteTable routes = routeResolver.refresh().block(ROUTE_WARMUP_TIMEOUT);
        if (routes == null) {
            throw new IllegalStateException("Route table could not be built from the page catalog");
        }
        log.info("Serving {} static pages", routes.staticPaths().size());
    }
}

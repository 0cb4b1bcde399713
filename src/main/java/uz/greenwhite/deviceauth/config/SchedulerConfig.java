package uz.greenwhite.deviceauth.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Timer for poll ticks. Delays are scheduled, no thread waits for the interval.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler pollScheduler() {
        Scheduler scheduler = Schedulers.newSingle("device-auth-poll", true);
        log.info("Device auth poll scheduler created");
        return scheduler;
    }
}

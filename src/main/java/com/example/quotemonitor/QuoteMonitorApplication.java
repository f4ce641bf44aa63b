package com.example.quotemonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Quote Monitor Application
 * <p>
 * Periodically fetches a market quote on a cron schedule and announces
 * every change to the configured notification channels.
 * <p>
 * Features:
 * - Cron-driven trigger stream with overload shedding
 * - Unbounded fetch retries with capped exponential backoff
 * - At most one quote check in flight at a time
 * - Best-effort delivery to Twitter and Slack
 */
@SpringBootApplication
public class QuoteMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuoteMonitorApplication.class, args);
    }
}

package com.z254.sentinel.guardian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * GUARDIAN - workspace health monitor.
 *
 * <p>GUARDIAN provides:
 * <ul>
 *   <li>Ground-truth verification of detected issues per layer</li>
 *   <li>Deduplicated ticket files routed to agents</li>
 *   <li>Auto-remediation of known failure scenarios</li>
 *   <li>Predictive alerts from metric correlation and trends</li>
 *   <li>Root-cause learning and enhancement suggestions</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class GuardianApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardianApplication.class, args);
    }
}

package com.gpupool.rotator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GpuPoolRotatorApplication {

    private static final Logger log = LoggerFactory.getLogger(GpuPoolRotatorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GpuPoolRotatorApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           GPU Pool Rotator v1.0.0                 ║");
        log.info("║     Compute Account Rotation Scheduler            ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("API 端点:");
        log.info("  GET  /api/pool/status");
        log.info("  GET  /api/pool/session");
        log.info("  GET  /api/pool/events/stream  (SSE)");
        log.info("  GET  /health");
        log.info("  GET  /metrics");
    }
}

package com.polygonmev.arb.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the context and exits the JVM with a given code. Runs on its own
 * thread because closing the context joins the worker that asked for it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationTerminator {

    private final ConfigurableApplicationContext context;

    public void terminate(int exitCode) {
        Thread terminator = new Thread(() -> {
            log.warn("Terminating with exit code {}", exitCode);
            int code = SpringApplication.exit(context, () -> exitCode);
            System.exit(code);
        }, "engine-terminator");
        terminator.start();
    }
}

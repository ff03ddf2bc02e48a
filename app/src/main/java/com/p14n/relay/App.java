package com.p14n.relay;

import java.util.concurrent.TimeUnit;

import com.p14n.relay.data.ConfigData;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        var config = ConfigData.fromEnvironment(System.getenv());
        var ot = Opentelemetry.create("relay", config.otlpEndpoint());
        var relay = RelayProcess.start(config, ot);

        logger.atInfo()
                .addArgument(relay.port())
                .log("Relay started on port {}");

        Runtime.getRuntime().addShutdownHook(new Thread(
                () -> shutdown(relay, config.shutdownTimeoutSeconds()), "relay-shutdown"));
    }

    private static void shutdown(RelayProcess relay, int timeoutSeconds) {
        var closer = new Thread(() -> {
            try {
                relay.close();
            } catch (Exception e) {
                logger.atError()
                        .setCause(e)
                        .log("Error during shutdown");
            }
        }, "relay-close");
        closer.start();
        try {
            closer.join(TimeUnit.SECONDS.toMillis(timeoutSeconds));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (closer.isAlive()) {
            logger.atError()
                    .addArgument(timeoutSeconds)
                    .log("Shutdown did not complete within {}s, halting");
            Runtime.getRuntime().halt(1);
        }
    }
}

package dev.schemaeval;

import dev.schemaeval.config.SchemaEvalConfig;
import lombok.extern.slf4j.Slf4j;

/** Runs the engine's HTTP server, configured from the environment, until the JVM exits. */
@Slf4j
public class EngineMain {
    public static void main(String... args) throws Exception {
        var engine = SchemaEval.of(SchemaEvalConfig.fromEnvironment());
        var server = engine.serverBuilder().build();
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    server.stop();
                                    engine.close();
                                },
                                "schemaeval-shutdown"));
        server.start();
        log.info("press ctrl-c to stop");
        Thread.currentThread().join();
    }
}

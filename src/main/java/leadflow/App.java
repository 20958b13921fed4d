package leadflow;

import leadflow.workflow.config.WorkflowConfig;
import leadflow.workflow.server.WorkflowNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Starts the workflow server and blocks until the JVM is asked to shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        WorkflowConfig config = WorkflowConfig.fromEnv();
        int port = config.serverPort();

        log.info("Starting workflow server on port {}...", port);
        if (!WorkflowNettyServer.start(port, config)) {
            log.error("Workflow server did not start");
            System.exit(1);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            WorkflowNettyServer.stop();
            stopped.countDown();
        }, "leadflow-shutdown"));

        stopped.await();
    }
}

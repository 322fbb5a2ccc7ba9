package io.requestgate.standalone;

import io.requestgate.standalone.server.GateApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the standalone gate server. Delegates to {@link GateApp#start(String[])}; on
 * failure logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /** @param args command-line arguments, e.g. {@code --config request-gate.yaml} */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            GateApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}

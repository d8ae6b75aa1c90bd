package io.hapconf.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code hapconf} command. Delegates to {@link TranslateCommand} and exits with
 * its status code.
 */
public final class HapconfMain {

    private static final Logger LOG = LoggerFactory.getLogger(HapconfMain.class);

    private HapconfMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new TranslateCommand(System.out, System.err, System::getenv, LogbackConfigurator::configure)
                    .run(args);
        } catch (Exception e) {
            LOG.error("Translation aborted: {}", e.getMessage(), e);
            status = TranslateCommand.EXIT_FAILURE;
        }
        System.exit(status);
    }
}

package kds;

import com.google.inject.Guice;
import com.google.inject.Injector;
import kds.dal.ConfigurationService;
import kds.domain.IntegratedController;
import kds.domain.StartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point of the kitchen dispatch service
 * @since 11/10/2026
 */
public class KitchenDispatch {
    private static final Logger logger = LoggerFactory.getLogger(KitchenDispatch.class);

    public static void main(String[] args) {
        logger.info("Starting Kitchen Dispatch...");

        try {
            ConfigurationService configService = new ConfigurationService();

            logger.info("Configuration loaded successfully");
            logger.debug("Server: {}", configService.getServerConfiguration());
            logger.debug("Dispatch: {}", configService.getDispatchConfiguration());
            logger.debug("Retry: {}", configService.getRetryConfiguration());
            logger.debug("Relay: {}", configService.getRelayConfiguration());

            Injector injector = Guice.createInjector(new GuiceModule(configService));

            IntegratedController app = injector.getInstance(IntegratedController.class);
            app.start();

        } catch (StartupException e) {
            logger.error("Application startup failed:");
            logger.error("  Mode: {}", e.getMode());
            logger.error("  Failed services: {}", e.getFailedServices().size());
            for (var result : e.getFailedServices()) {
                logger.error("    - {}", result);
            }
            System.exit(1);

        } catch (Exception e) {
            logger.error("Failed to start application", e);
            System.exit(1);
        }
    }
}

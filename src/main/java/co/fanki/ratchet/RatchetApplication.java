package co.fanki.ratchet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Ratchet Application.
 *
 * <p>Indexes the autoload paths of a Ruby project at startup and serves
 * constant reference extraction over HTTP.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class RatchetApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(RatchetApplication.class, args);
    }

}

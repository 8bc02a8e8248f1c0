/**
 * Main application class for the Amphora front door
 *
 * Features:
 * - Routes each (host, path) to one of the configured sites
 * - Serves components, instances, pages, URIs and schemas
 * - Creates pages from component defaults in a single atomic batch
 */

package net.amphora;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AmphoraApplication {

    public static void main(String[] args) {
        SpringApplication.run(AmphoraApplication.class, args);
    }
}

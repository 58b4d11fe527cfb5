package hydromet.gwlevel.consolidate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Groundwater level consolidation service
 */
@SpringBootApplication
public class GroundwaterConsolidatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroundwaterConsolidatorApplication.class, args);
    }
}

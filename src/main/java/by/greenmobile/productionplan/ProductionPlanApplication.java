package by.greenmobile.productionplan;

import by.greenmobile.productionplan.config.DispatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {DispatchProperties.class})
@SpringBootApplication
public class ProductionPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProductionPlanApplication.class, args);
    }

}

package com.tripplanner.server;

import com.tripplanner.common.properties.AiProperties;
import com.tripplanner.common.properties.PlannerProperties;
import com.tripplanner.common.properties.ProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({PlannerProperties.class, ProviderProperties.class, AiProperties.class})
public class TripPlannerServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripPlannerServerApplication.class, args);
    }
}

package com.phillippitts.freefleet;

import com.phillippitts.freefleet.config.properties.CircuitBreakerProperties;
import com.phillippitts.freefleet.config.properties.DelegationProperties;
import com.phillippitts.freefleet.config.properties.OracleProperties;
import com.phillippitts.freefleet.config.properties.PersistenceProperties;
import com.phillippitts.freefleet.config.properties.RacerProperties;
import com.phillippitts.freefleet.config.properties.ScoutProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DelegationProperties.class,
        RacerProperties.class,
        CircuitBreakerProperties.class,
        ScoutProperties.class,
        OracleProperties.class,
        PersistenceProperties.class
})
public class FreeFleetApplication {

    public static void main(String[] args) {
        SpringApplication.run(FreeFleetApplication.class, args);
    }

}

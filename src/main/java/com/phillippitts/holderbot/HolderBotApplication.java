package com.phillippitts.holderbot;

import com.phillippitts.holderbot.config.properties.AggregationProperties;
import com.phillippitts.holderbot.config.properties.CalibrationProperties;
import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.config.properties.FallbackProperties;
import com.phillippitts.holderbot.config.properties.OracleProperties;
import com.phillippitts.holderbot.config.properties.PhotoProperties;
import com.phillippitts.holderbot.config.properties.RuleProperties;
import com.phillippitts.holderbot.config.properties.StoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        EnsembleProperties.class,
        FallbackProperties.class,
        RuleProperties.class,
        AggregationProperties.class,
        CalibrationProperties.class,
        OracleProperties.class,
        PhotoProperties.class,
        StoreProperties.class
})
@EnableScheduling
public class HolderBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(HolderBotApplication.class, args);
    }

}

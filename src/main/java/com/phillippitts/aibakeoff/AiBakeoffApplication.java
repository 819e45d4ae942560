package com.phillippitts.aibakeoff;

import com.phillippitts.aibakeoff.config.properties.ConcurrencyProperties;
import com.phillippitts.aibakeoff.config.properties.HttpClientProperties;
import com.phillippitts.aibakeoff.config.properties.ProviderProperties;
import com.phillippitts.aibakeoff.config.properties.ReportProperties;
import com.phillippitts.aibakeoff.config.properties.RunProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ProviderProperties.class,
        ConcurrencyProperties.class,
        HttpClientProperties.class,
        ReportProperties.class,
        RunProperties.class
})
public class AiBakeoffApplication {

    public static void main(String[] args) {
        // Pool threads are non-daemon; exit explicitly once the run is done
        System.exit(SpringApplication.exit(SpringApplication.run(AiBakeoffApplication.class, args)));
    }

}
